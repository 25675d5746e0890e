/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.exception;

import lombok.Getter;

/**
 * A call to the wallet or verifier sandbox failed: either the sandbox answered with an error status
 * or it could not be reached at all (status code 0 in that case).
 */
@Getter
public class SandboxApiException extends RuntimeException {

    private final int statusCode;

    /**
     * Raw response body as returned by the sandbox, may be null.
     */
    private final String responseBody;

    public SandboxApiException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public SandboxApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }
}
