/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.verification;

public enum BatchVerificationStatus {
    ACTIVE,
    CLOSED,
    EXPIRED
}
