/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.config;

import jakarta.validation.constraints.NotNull;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings of the two external sandbox services.
 */
@Validated
@ConfigurationProperties(prefix = "sandbox")
public record SandboxProperties(
        @NotNull ClientProperties wallet,
        @NotNull ClientProperties verifier) {

    /**
     * @param baseUrl    base url of the sandbox, without trailing slash
     * @param apiKey     access token sent with every call
     * @param authHeader header carrying the access token
     * @param authScheme optional prefix of the header value, e.g. "Bearer"
     * @param timeout    connect and read timeout
     */
    public record ClientProperties(
            String baseUrl,
            String apiKey,
            @DefaultValue("Access-Token") String authHeader,
            String authScheme,
            @DefaultValue("20s") Duration timeout) {

        public String authHeaderValue() {
            var key = StringUtils.defaultString(apiKey);
            return StringUtils.isBlank(authScheme) ? key : authScheme.trim() + " " + key;
        }

        public String normalizedBaseUrl() {
            return StringUtils.removeEnd(StringUtils.defaultString(baseUrl), "/");
        }
    }
}
