/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

import ch.admin.bj.swiyu.broker.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.broker.common.exception.MissingSimulationContextException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;

/**
 * Issues and checks the token remembering which simulated person drives an issuance flow.
 * The token is an HS256 JWT with the person id as subject.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationTokenService {

    private static final String ISSUER = "swiyu-vc-broker";

    private final ApplicationProperties applicationProperties;
    private final Clock clock;

    public String createToken(Long personId) {
        var now = clock.instant();
        var claims = new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject(String.valueOf(personId))
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(applicationProperties.getSimulationTokenValidity())))
                .build();
        var jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(new MACSigner(secret()));
        } catch (JOSEException e) {
            throw new IllegalStateException("Simulation token cannot be signed", e);
        }
        return jwt.serialize();
    }

    /**
     * @return the id of the simulated person
     * @throws MissingSimulationContextException if the token is missing, forged or expired
     */
    public Long resolvePersonId(String token) {
        if (StringUtils.isBlank(token)) {
            throw new MissingSimulationContextException("No simulation started, please start a simulation first");
        }
        try {
            var jwt = SignedJWT.parse(token);
            if (!jwt.verify(new MACVerifier(secret()))) {
                throw new MissingSimulationContextException("Simulation token signature is invalid");
            }
            var claims = jwt.getJWTClaimsSet();
            if (claims.getExpirationTime() == null || !claims.getExpirationTime().toInstant().isAfter(clock.instant())) {
                throw new MissingSimulationContextException("Simulation token expired, please start a new simulation");
            }
            return Long.valueOf(claims.getSubject());
        } catch (ParseException | JOSEException | NumberFormatException e) {
            log.debug("Rejected simulation token: {}", e.getMessage());
            throw new MissingSimulationContextException("Simulation token is invalid", e);
        }
    }

    private byte[] secret() {
        return applicationProperties.getSimulationTokenSecret().getBytes(StandardCharsets.UTF_8);
    }
}
