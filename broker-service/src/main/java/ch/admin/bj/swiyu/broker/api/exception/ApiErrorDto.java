/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.api.exception;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Builder
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ApiError", description = "Error response object")
public class ApiErrorDto {
    @JsonProperty("error")
    String errorCode;
    @JsonProperty("error_description")
    String errorDescription;
    @JsonProperty("detail")
    String errorDetails;
    @Schema(description = "Error body of the sandbox, if the error originates there")
    @JsonProperty("upstream_error")
    String upstreamError;
    @JsonIgnore
    HttpStatus status;
}
