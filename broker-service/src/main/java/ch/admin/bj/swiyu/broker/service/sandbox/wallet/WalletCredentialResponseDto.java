/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.wallet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param credential compact JWT of the claimed credential
 * @param code       sandbox status code, set when the credential is not available
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletCredentialResponseDto(
        String credential,
        String code,
        String message) {
}
