/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SimulationPerson")
public record SimulationPersonDto(
        @Schema(description = "Person id, as string to survive JavaScript clients", example = "42")
        String id,
        String name) {
}
