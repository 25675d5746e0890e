/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.issuance;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "IssuanceStatusType", enumAsRef = true, description = """
            Progress of an issuance transaction as seen by the holder.
            initiated - the offer is waiting to be claimed.
            issued - the holder claimed the credential.
            expired - the claim window lapsed.
        """)
public enum IssuanceStatusTypeDto {
    INITIATED("initiated"),
    ISSUED("issued"),
    EXPIRED("expired");

    private final String value;

    IssuanceStatusTypeDto(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
