/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.wallet;

import lombok.Builder;

import java.util.List;

/**
 * @param issuanceDate yyyyMMdd
 * @param expiredDate  yyyyMMdd
 */
@Builder
public record WalletIssueRequestDto(
        String vcUid,
        String issuanceDate,
        String expiredDate,
        List<WalletFieldDto> fields) {
}
