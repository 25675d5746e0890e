/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "VerificationStatusType", enumAsRef = true, description = """
            Progress of a verification.
            initiated - no presentation has been received yet.
            success - the presentation was verified and linked to a person.
            failed - the verifier rejected the presentation or polling failed.
            expired - the verification window lapsed.
            error_missing_uuid - the presentation was verified but cannot be linked to a person.
        """)
public enum VerificationStatusTypeDto {
    INITIATED("initiated"),
    SUCCESS("success"),
    FAILED("failed"),
    EXPIRED("expired"),
    ERROR_MISSING_UUID("error_missing_uuid");

    private final String value;

    VerificationStatusTypeDto(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
