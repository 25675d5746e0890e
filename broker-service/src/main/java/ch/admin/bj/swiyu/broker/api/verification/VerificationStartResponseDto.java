/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "VerificationStartResponse")
public record VerificationStartResponseDto(
        @Schema(allowableValues = {"single", "batch"})
        String type,
        @Schema(description = "Set for single verifications")
        String transactionId,
        @Schema(description = "Set for batch verifications")
        UUID batchSessionUuid,
        @Schema(description = "QR code as image data url")
        String qrCode,
        @Schema(description = "Wallet deeplink, set for single verifications")
        String deepLink,
        Instant expiresAt) {
}
