/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.issuance;

import lombok.Getter;

@Getter
public enum IssuedCredentialStatus {
    ISSUING("Issuing"),
    ISSUED("Issued"),
    EXPIRED("Expired"),
    REVOKED("Revoked");

    private final String displayName;

    IssuedCredentialStatus(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return this.getDisplayName();
    }
}
