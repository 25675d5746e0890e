/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.infrastructure.web;

import ch.admin.bj.swiyu.broker.api.issuance.CredentialOfferResponseDto;
import ch.admin.bj.swiyu.broker.api.issuance.CredentialRequestDto;
import ch.admin.bj.swiyu.broker.api.issuance.IssuanceStatusResponseDto;
import ch.admin.bj.swiyu.broker.api.issuance.StartSimulationResponseDto;
import ch.admin.bj.swiyu.broker.service.issuance.IssuanceService;
import ch.admin.bj.swiyu.broker.service.issuance.SimulationTokenService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = {"/api/issuance"})
@AllArgsConstructor
@Tag(name = "Issuance API", description = "Simulates a person claiming benefit credentials from the wallet sandbox. " +
        "A simulation is started first, the returned token identifies the simulated person in all further calls.")
public class IssuanceController {

    public static final String SIMULATION_TOKEN_HEADER = "X-Simulation-Token";

    private final IssuanceService issuanceService;
    private final SimulationTokenService simulationTokenService;

    @Timed
    @PostMapping("/start-simulation")
    @Operation(
            summary = "Start a simulation with a random person",
            description = """
                    Picks a random person who does not hold any issued credential yet and returns the templates
                    this person is eligible for, together with the simulation token.
                    """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Simulation started"),
                    @ApiResponse(responseCode = "404", description = "Every person already holds an issued credential",
                            content = @Content(schema = @Schema(implementation = Object.class)))
            }
    )
    public StartSimulationResponseDto startSimulation() {
        return issuanceService.startSimulation();
    }

    @Timed
    @PostMapping("/request-credential")
    @SecurityRequirement(name = "simulation-token")
    @Operation(
            summary = "Offer a credential of the given template to the simulated person",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Credential offer created"),
                    @ApiResponse(responseCode = "400", description = "Invalid template or person not eligible",
                            content = @Content(schema = @Schema(implementation = Object.class))),
                    @ApiResponse(responseCode = "401", description = "No simulation started",
                            content = @Content(schema = @Schema(implementation = Object.class))),
                    @ApiResponse(responseCode = "502", description = "Wallet sandbox failed",
                            content = @Content(schema = @Schema(implementation = Object.class)))
            }
    )
    public CredentialOfferResponseDto requestCredential(@RequestHeader(name = SIMULATION_TOKEN_HEADER, required = false) String simulationToken,
                                                        @Valid @RequestBody CredentialRequestDto request) {
        var personId = simulationTokenService.resolvePersonId(simulationToken);
        return issuanceService.requestCredential(personId, request.templateId());
    }

    @Timed
    @GetMapping("/status/{transactionId}")
    @SecurityRequirement(name = "simulation-token")
    @Operation(summary = "Get the status of a credential offer of the simulated person, checking the wallet sandbox while it is open")
    public IssuanceStatusResponseDto getIssuanceStatus(@RequestHeader(name = SIMULATION_TOKEN_HEADER, required = false) String simulationToken,
                                                       @PathVariable String transactionId) {
        var personId = simulationTokenService.resolvePersonId(simulationToken);
        return issuanceService.pollStatus(personId, transactionId);
    }
}
