/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@Schema(name = "VerificationRequest")
public record VerificationRequestDto(
        @NotNull
        @Pattern(regexp = "^(single|batch)$", message = "verificationMode must be single or batch")
        @Schema(description = "single: one QR code for one holder. batch: a long-lived QR code, every scan starts a new verification.",
                allowableValues = {"single", "batch"})
        String verificationMode,

        @NotBlank
        @Schema(description = "Type of the verifying agency", example = "Social services")
        String role,

        @NotBlank
        @Schema(description = "Branch of the verifying agency", example = "Taipei branch")
        String verifier,

        @NotBlank
        @Schema(description = "Purpose of the verification", example = "Eligibility check")
        String reason,

        String notes
) {
    public boolean isBatch() {
        return "batch".equals(verificationMode);
    }
}
