/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.Map;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "VerificationStatusResponse")
public record VerificationStatusResponseDto(
        VerificationStatusTypeDto status,
        String message,
        @Schema(description = "Verified person and credentials, only set on success")
        VerificationPayloadDto verificationData,
        @Schema(description = "Verifier response as received, set for finished verifications other than success")
        Map<String, Object> data) {
}
