/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.verification;

import lombok.Getter;

@Getter
public enum VerificationStatus {
    INITIATED("Initiated"),
    SUCCESS("Success"),
    FAILED("Failed"),
    EXPIRED("Expired"),
    // verifier accepted the presentation but it could not be linked to a local person
    ERROR_MISSING_UUID("Unlinked success");

    private final String displayName;

    VerificationStatus(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return this.getDisplayName();
    }

    public boolean isTerminalState() {
        return this != INITIATED;
    }
}
