/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Credentials were revoked on the wallet sandbox but the local transaction could not be committed.
 * Local and remote state diverge and need manual reconciliation.
 */
@Getter
public class RevocationInconsistencyException extends RuntimeException {

    private final List<String> revokedCredentialIds;

    public RevocationInconsistencyException(String message, List<String> revokedCredentialIds, Throwable cause) {
        super(message, cause);
        this.revokedCredentialIds = List.copyOf(revokedCredentialIds);
    }
}
