/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

/**
 * The addressed resource existed but is no longer usable, e.g. a closed or expired batch verification session.
 */
public class ResourceGoneException extends RuntimeException {
    public ResourceGoneException(String message) {
        super(message);
    }

    public ResourceGoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
