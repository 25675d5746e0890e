/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

import com.nimbusds.jwt.JWTParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.text.ParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts the external credential id (cid) from a claimed credential.
 * <p>
 * The wallet sandbox sets the {@code jti} claim to a url ending in {@code /credential/<cid>}.
 * The token is only decoded, its signature is not checked: it comes straight from the sandbox
 * over an authenticated channel and is never trusted for anything but the id.
 */
@Slf4j
@Component
public class CredentialTokenParser {

    private static final Pattern CID_PATTERN = Pattern.compile("/credential/([A-Za-z0-9\\-]+)$");

    /**
     * @param token compact JWT, optionally followed by SD-JWT disclosures separated by '~'
     * @return the credential id, or empty if the token is malformed or carries no matching jti
     */
    public Optional<String> extractCredentialId(String token) {
        if (StringUtils.isBlank(token)) {
            return Optional.empty();
        }
        try {
            var jwt = JWTParser.parse(StringUtils.substringBefore(token, "~"));
            return extractFromJti(jwt.getJWTClaimsSet().getJWTID());
        } catch (ParseException e) {
            log.warn("Credential token cannot be parsed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> extractFromJti(String jti) {
        if (jti == null) {
            return Optional.empty();
        }
        var matcher = CID_PATTERN.matcher(jti);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
