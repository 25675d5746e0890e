/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
@Schema(name = "VerificationLogView", description = "Verification as shown in the audit view")
public record VerificationLogViewDto(
        Long id,
        Instant verifiedAt,
        @Schema(description = "Branch of the verifying agency")
        String agencyName,
        @Schema(description = "Type of the verifying agency")
        String agencyType,
        String purpose,
        String notes,
        String status,
        Boolean result,
        String personName,
        @Schema(description = "County and district of the verified person")
        String personArea,
        @Schema(description = "Template names of the credentials currently issued to the verified person")
        List<String> verifiedIdentities) {
}
