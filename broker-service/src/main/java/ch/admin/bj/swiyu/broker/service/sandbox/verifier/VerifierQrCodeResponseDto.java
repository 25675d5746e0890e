/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.verifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param qrcodeImage QR code as image data url
 * @param authUri     deeplink opening the holder wallet
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerifierQrCodeResponseDto(
        String transactionId,
        String qrcodeImage,
        String authUri) {
}
