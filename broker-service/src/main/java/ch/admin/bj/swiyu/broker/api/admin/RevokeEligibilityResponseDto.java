/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.admin;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "RevokeEligibilityResponse")
public record RevokeEligibilityResponseDto(String message) {
}
