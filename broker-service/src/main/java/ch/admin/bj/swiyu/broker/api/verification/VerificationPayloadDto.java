/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Everything a verifier gets to see about a successfully verified person.
 */
@Builder
@Schema(name = "VerificationPayload")
public record VerificationPayloadDto(
        PersonInfoDto person,
        EmergencyContactDto contact,
        ReviewerDto reviewer,
        @Schema(description = "Credentials currently issued to the person")
        List<VerifiedCredentialDto> verifiedCredentials,
        @Schema(description = "Verifier response as received, for traceability")
        Map<String, Object> rawSandboxData) {

    @Schema(name = "VerifiedPerson")
    public record PersonInfoDto(String name, String nationalId) {
    }

    @Schema(name = "EmergencyContact")
    public record EmergencyContactDto(
            String emergencyContactName,
            String emergencyContactRelationship,
            String emergencyContactPhone) {
    }

    @Schema(name = "Reviewer")
    public record ReviewerDto(
            String reviewingAuthority,
            String reviewerName,
            String reviewerPhone) {
    }

    @Schema(name = "VerifiedCredential")
    public record VerifiedCredentialDto(
            String templateName,
            String benefitLevel,
            String cardImageUrl) {
    }
}
