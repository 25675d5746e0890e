/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@Schema(name = "RevokeEligibilityRequest")
public record RevokeEligibilityRequestDto(
        @NotBlank
        @Pattern(regexp = "^\\d+$", message = "personId must be numeric")
        @Schema(description = "Id of the person, as string", example = "42")
        String personId,

        @NotNull
        @Schema(example = "1")
        Integer templateId) {
}
