/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "BatchStatusResponse")
public record BatchStatusResponseDto(
        BatchSessionInfoDto sessionInfo,
        @Schema(description = "One entry per scan, newest first")
        List<BatchResultEntryDto> results) {
}
