/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.Instant;

@Builder
@Schema(name = "BatchSessionInfo")
public record BatchSessionInfoDto(
        String verifierInfo,
        String verifierBranch,
        String verificationReason,
        String notes,
        BatchSessionStatusTypeDto status,
        Instant expiresAt) {
}
