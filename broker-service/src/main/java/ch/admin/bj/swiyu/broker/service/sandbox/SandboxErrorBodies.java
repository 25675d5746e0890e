/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Reads the error codes the sandboxes embed in their error bodies.
 */
@Slf4j
@UtilityClass
public class SandboxErrorBodies {

    /**
     * @return the {@code code} field of a JSON error body as text
     */
    public static Optional<String> readCode(ObjectMapper objectMapper, String body) {
        return readJson(objectMapper, body)
                .map(node -> node.get("code"))
                .filter(code -> !code.isNull())
                .map(JsonNode::asText);
    }

    /**
     * The verifier wraps its error code into a {@code params} field which is either a nested object
     * or a JSON document serialized into a string.
     *
     * @return the {@code params.code} field as text
     */
    public static Optional<String> readParamsCode(ObjectMapper objectMapper, String body) {
        return readJson(objectMapper, body)
                .map(node -> node.get("params"))
                .filter(params -> !params.isNull())
                .flatMap(params -> params.isTextual() ? readJson(objectMapper, params.asText()) : Optional.of(params))
                .map(params -> params.get("code"))
                .filter(code -> code != null && !code.isNull())
                .map(JsonNode::asText);
    }

    private static Optional<JsonNode> readJson(ObjectMapper objectMapper, String body) {
        if (StringUtils.isBlank(body)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            log.debug("Sandbox error body is not JSON: {}", body);
            return Optional.empty();
        }
    }
}
