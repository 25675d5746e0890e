/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "StartSimulationResponse")
public record StartSimulationResponseDto(
        SimulationPersonDto person,
        List<AvailableTemplateDto> availableTemplates,
        @Schema(description = "Token identifying the simulated person, to be sent as X-Simulation-Token header")
        String simulationToken) {
}
