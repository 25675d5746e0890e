/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "IssuanceStatusResponse")
public record IssuanceStatusResponseDto(
        IssuanceStatusTypeDto status,
        String message) {
}
