/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

/**
 * No valid simulation token accompanied an issuance request.
 */
public class MissingSimulationContextException extends RuntimeException {
    public MissingSimulationContextException(String message) {
        super(message);
    }

    public MissingSimulationContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
