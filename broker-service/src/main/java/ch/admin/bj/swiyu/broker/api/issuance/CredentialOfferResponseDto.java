/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@Schema(name = "CredentialOfferResponse")
public record CredentialOfferResponseDto(
        String transactionId,
        String qrCode,
        String deepLink) {
}
