/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.verification;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "BatchSessionStatusType", enumAsRef = true)
public enum BatchSessionStatusTypeDto {
    ACTIVE("active"),
    CLOSED("closed"),
    EXPIRED("expired");

    private final String value;

    BatchSessionStatusTypeDto(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
