/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.issuance;

import lombok.Getter;

@Getter
public enum IssuanceLogStatus {
    INITIATED("Initiated"),
    USER_CLAIMED("Claimed by user"),
    EXPIRED("Expired");

    private final String displayName;

    IssuanceLogStatus(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return this.getDisplayName();
    }

    public boolean isTerminalState() {
        return this == USER_CLAIMED || this == EXPIRED;
    }
}
