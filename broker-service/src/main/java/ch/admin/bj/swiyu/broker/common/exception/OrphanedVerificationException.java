/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

/**
 * A verification succeeded but the person it resolved to no longer exists.
 */
public class OrphanedVerificationException extends RuntimeException {
    public OrphanedVerificationException(String message) {
        super(message);
    }

    public OrphanedVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
