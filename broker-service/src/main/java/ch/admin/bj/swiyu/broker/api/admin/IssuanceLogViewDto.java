/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.Instant;

@Builder
@Schema(name = "IssuanceLogView", description = "Issuance transaction as shown in the audit view")
public record IssuanceLogViewDto(
        Long id,
        String transactionId,
        @Schema(description = """
                Status of the transaction derived at read time: user_claimed once claimed,
                expired once the claim window lapsed, initiated otherwise.
                """, allowableValues = {"initiated", "user_claimed", "expired"})
        String status,
        @Schema(allowableValues = {"issuing", "issued", "expired", "revoked"})
        String credentialStatus,
        Instant createdAt,
        Instant expiresAt,
        Instant issuedAt,
        String benefitLevel,
        String personName,
        String county,
        String district,
        String templateName,
        String cardImageUrl) {
}
