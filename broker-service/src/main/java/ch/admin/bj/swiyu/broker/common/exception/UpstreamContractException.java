/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

/**
 * The sandbox answered successfully but with a payload that does not honour the agreed contract
 * (missing fields, undecodable credential token).
 */
public class UpstreamContractException extends RuntimeException {
    public UpstreamContractException(String message) {
        super(message);
    }

    public UpstreamContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
