/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox;

import ch.admin.bj.swiyu.broker.common.config.SandboxProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * One {@link RestClient} per sandbox, each carrying its base url, timeouts and access token header.
 */
@Slf4j
@Configuration
public class SandboxClientConfig {

    @Bean
    public RestClient walletRestClient(RestClient.Builder builder, SandboxProperties sandboxProperties) {
        return createRestClient(builder, sandboxProperties.wallet(), "Wallet");
    }

    @Bean
    public RestClient verifierRestClient(RestClient.Builder builder, SandboxProperties sandboxProperties) {
        return createRestClient(builder, sandboxProperties.verifier(), "Verifier");
    }

    public static RestClient createRestClient(RestClient.Builder builder, SandboxProperties.ClientProperties properties, String name) {
        if (StringUtils.isBlank(properties.baseUrl())) {
            log.warn("{} sandbox base url is empty", name);
        }
        if (StringUtils.isBlank(properties.apiKey())) {
            log.warn("{} sandbox api key is empty, calls will be rejected with 401", name);
        }
        log.info("{} sandbox client configured for {} using header {} (scheme '{}')",
                name, properties.normalizedBaseUrl(), properties.authHeader(), StringUtils.defaultString(properties.authScheme()));

        // error bodies of 401 responses must stay readable
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.timeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.timeout());

        return builder
                .baseUrl(properties.normalizedBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(properties.authHeader(), properties.authHeaderValue())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
