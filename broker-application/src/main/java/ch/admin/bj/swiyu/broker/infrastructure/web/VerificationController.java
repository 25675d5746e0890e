/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.infrastructure.web;

import ch.admin.bj.swiyu.broker.api.verification.*;
import ch.admin.bj.swiyu.broker.service.verification.BatchVerificationService;
import ch.admin.bj.swiyu.broker.service.verification.VerificationService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping(value = {"/api/verification"})
@AllArgsConstructor
@Tag(name = "Verification API", description = "Verifies benefit credentials through the verifier sandbox, either one " +
        "holder at a time or with a batch session QR code that can be scanned by any number of holders.")
public class VerificationController {

    private final VerificationService verificationService;
    private final BatchVerificationService batchVerificationService;

    @Timed
    @PostMapping("/request-verification")
    @Operation(
            summary = "Start a single verification or a batch verification session",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Verification started"),
                    @ApiResponse(responseCode = "400", description = "Missing fields or invalid verification mode",
                            content = @Content(schema = @Schema(implementation = Object.class))),
                    @ApiResponse(responseCode = "502", description = "Verifier sandbox failed",
                            content = @Content(schema = @Schema(implementation = Object.class)))
            }
    )
    public VerificationStartResponseDto requestVerification(@Valid @RequestBody VerificationRequestDto request) {
        return verificationService.requestVerification(request);
    }

    @Timed
    @GetMapping("/batch/{sessionUuid}")
    @Operation(
            summary = "Target of the batch session QR code",
            description = "Starts a new verification for the scanning holder and redirects to the wallet deeplink.",
            responses = {
                    @ApiResponse(responseCode = "302", description = "Redirect to the wallet"),
                    @ApiResponse(responseCode = "404", description = "Unknown session",
                            content = @Content(schema = @Schema(implementation = Object.class))),
                    @ApiResponse(responseCode = "410", description = "Session closed or expired",
                            content = @Content(schema = @Schema(implementation = Object.class)))
            }
    )
    public ResponseEntity<Void> redirectBatchScan(@PathVariable UUID sessionUuid) {
        return ResponseEntity.status(HttpStatus.FOUND).location(verificationService.redirectBatchScan(sessionUuid)).build();
    }

    @Timed
    @PostMapping("/batch/{sessionUuid}/close")
    @Operation(summary = "Close a batch session, further scans are rejected")
    public BatchSessionInfoDto closeBatchSession(@PathVariable UUID sessionUuid) {
        return verificationService.closeBatchSession(sessionUuid);
    }

    @Timed
    @GetMapping("/check-status/{transactionId}")
    @Operation(summary = "Get the status of a single verification, checking the verifier sandbox while it is open")
    public VerificationStatusResponseDto checkStatus(@PathVariable String transactionId) {
        return verificationService.checkStatus(transactionId);
    }

    @Timed
    @GetMapping("/check-batch-status/{sessionUuid}")
    @Operation(summary = "Get the results of all scans of a batch session, checking the open ones against the verifier sandbox")
    public BatchStatusResponseDto checkBatchStatus(@PathVariable UUID sessionUuid) {
        return batchVerificationService.checkBatchStatus(sessionUuid);
    }
}
