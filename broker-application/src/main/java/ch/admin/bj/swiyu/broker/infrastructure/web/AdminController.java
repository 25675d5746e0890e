/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.infrastructure.web;

import ch.admin.bj.swiyu.broker.api.admin.IssuanceLogViewDto;
import ch.admin.bj.swiyu.broker.api.admin.RevokeEligibilityRequestDto;
import ch.admin.bj.swiyu.broker.api.admin.RevokeEligibilityResponseDto;
import ch.admin.bj.swiyu.broker.api.admin.VerificationLogViewDto;
import ch.admin.bj.swiyu.broker.service.admin.AuditLogService;
import ch.admin.bj.swiyu.broker.service.admin.EligibilityRevocationService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = {"/api/v1/admin"})
@AllArgsConstructor
@Tag(name = "Admin API", description = "Revokes eligibilities and shows the issuance and verification audit trail.")
public class AdminController {

    private final EligibilityRevocationService revocationService;
    private final AuditLogService auditLogService;

    @Timed
    @PostMapping("/eligibility/revoke")
    @Operation(
            summary = "Revoke the eligibility of a person for a template",
            description = """
                    Revokes every claimed credential of the person for the template on the wallet sandbox, marks all
                    credentials of the pair as revoked and removes the eligibility. If the sandbox fails nothing is
                    changed locally, credentials revoked on the sandbox before the failure stay revoked there and
                    the call can be repeated.
                    """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Eligibility revoked"),
                    @ApiResponse(responseCode = "500", description = "Revoked on the sandbox but local state could not be updated",
                            content = @Content(schema = @Schema(implementation = Object.class))),
                    @ApiResponse(responseCode = "502", description = "Wallet sandbox failed, local state unchanged",
                            content = @Content(schema = @Schema(implementation = Object.class)))
            }
    )
    public RevokeEligibilityResponseDto revokeEligibility(@Valid @RequestBody RevokeEligibilityRequestDto request) {
        return revocationService.revoke(request);
    }

    @Timed
    @GetMapping("/logs/issuance/{logId}")
    @Operation(summary = "Get an issuance transaction with its derived status")
    public IssuanceLogViewDto getIssuanceLog(@PathVariable Long logId) {
        return auditLogService.getIssuanceLog(logId);
    }

    @Timed
    @GetMapping("/logs/verification/{logId}")
    @Operation(summary = "Get a verification with the verified person")
    public VerificationLogViewDto getVerificationLog(@PathVariable Long logId) {
        return auditLogService.getVerificationLog(logId);
    }
}
