/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(name = "CredentialRequest")
public record CredentialRequestDto(
        @NotNull
        @Schema(description = "Id of the template to issue", example = "1")
        Integer templateId) {
}
