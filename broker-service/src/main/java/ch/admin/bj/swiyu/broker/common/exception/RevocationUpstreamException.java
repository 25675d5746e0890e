/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

/**
 * The wallet sandbox refused or failed a revocation. No local state has been changed.
 */
public class RevocationUpstreamException extends RuntimeException {
    public RevocationUpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
