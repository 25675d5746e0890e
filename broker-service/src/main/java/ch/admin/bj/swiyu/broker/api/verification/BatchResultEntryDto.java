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

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "BatchResultEntry", description = "Outcome of one scan of a batch verification QR code")
public record BatchResultEntryDto(
        VerificationStatusTypeDto status,
        String message,
        VerificationPayloadDto verificationData,
        @Schema(description = "Time of the scan")
        Instant timestamp,
        @Schema(description = "Id of the verification log, as string", example = "17")
        String logId) {
}
