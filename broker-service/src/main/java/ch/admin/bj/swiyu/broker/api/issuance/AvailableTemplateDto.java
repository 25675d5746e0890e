/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.Instant;

@Builder
@Schema(name = "AvailableTemplate", description = "Template the person is eligible for and has not been issued yet")
public record AvailableTemplateDto(
        Integer id,
        String templateName,
        String vcUid,
        String description,
        String cardImageUrl,
        Instant createdAt) {
}
