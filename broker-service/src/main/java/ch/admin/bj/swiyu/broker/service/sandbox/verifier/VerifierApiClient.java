/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.verifier;

import ch.admin.bj.swiyu.broker.common.exception.SandboxApiException;
import ch.admin.bj.swiyu.broker.common.exception.UpstreamContractException;
import ch.admin.bj.swiyu.broker.service.sandbox.SandboxErrorBodies;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;
import java.util.Optional;

/**
 * Client of the verifier sandbox, creating presentation requests and collecting their results.
 */
@Slf4j
@Service
public class VerifierApiClient {

    /**
     * Code the verifier embeds into a 400 response while the holder has not presented anything yet.
     */
    public static final String RESULT_PENDING_CODE = "4002";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public VerifierApiClient(@Qualifier("verifierRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a presentation request for the given template reference.
     *
     * @throws SandboxApiException       if the sandbox call failed
     * @throws UpstreamContractException if the sandbox answered without body
     */
    public VerifierQrCodeResponseDto createQrCode(String ref, String transactionId) {
        VerifierQrCodeResponseDto response;
        try {
            log.debug("Requesting presentation QR code for transaction {}", transactionId);
            response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/api/oidvp/qrcode")
                            .queryParam("ref", ref)
                            .queryParam("transactionId", transactionId)
                            .build())
                    .retrieve()
                    .body(VerifierQrCodeResponseDto.class);
        } catch (RestClientResponseException e) {
            throw toSandboxApiException("Creating presentation request failed", e);
        } catch (RestClientException e) {
            throw new SandboxApiException("Verifier sandbox not reachable", e);
        }
        if (response == null) {
            throw new UpstreamContractException("Verifier sandbox answered without presentation request");
        }
        return response;
    }

    /**
     * Fetches the result of a presentation request.
     *
     * @return the result, or empty while the holder has not presented yet
     * @throws SandboxApiException       if the sandbox call failed for another reason
     * @throws UpstreamContractException if the result cannot be read
     */
    public Optional<VerifierResult> fetchResult(String transactionId) {
        Map<String, Object> rawData;
        try {
            rawData = restClient.post()
                    .uri("/api/oidvp/result")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("transactionId", transactionId))
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (RestClientResponseException e) {
            if (isResultPending(e)) {
                log.debug("Presentation of transaction {} still pending", transactionId);
                return Optional.empty();
            }
            throw toSandboxApiException("Fetching verification result failed", e);
        } catch (RestClientException e) {
            throw new SandboxApiException("Verifier sandbox not reachable", e);
        }

        if (rawData == null) {
            throw new UpstreamContractException("Verifier sandbox answered without result for transaction " + transactionId);
        }
        try {
            var result = objectMapper.convertValue(rawData, VerifierResultDto.class);
            return Optional.of(new VerifierResult(result, rawData));
        } catch (IllegalArgumentException e) {
            throw new UpstreamContractException("Verifier sandbox result of transaction " + transactionId + " cannot be read", e);
        }
    }

    private boolean isResultPending(RestClientResponseException e) {
        return e.getStatusCode().value() == HttpStatus.BAD_REQUEST.value()
                && SandboxErrorBodies.readParamsCode(objectMapper, e.getResponseBodyAsString())
                .filter(RESULT_PENDING_CODE::equals)
                .isPresent();
    }

    private static SandboxApiException toSandboxApiException(String message, RestClientResponseException e) {
        log.error("{}. Verifier sandbox responded with {}: {}", message, e.getStatusCode(), e.getResponseBodyAsString());
        return new SandboxApiException(
                String.format("%s. Verifier sandbox responded with %s", message, e.getStatusCode()),
                e.getStatusCode().value(),
                e.getResponseBodyAsString());
    }
}
