/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@Validated
@Data
@ConfigurationProperties(prefix = "application")
public class ApplicationProperties {

    /**
     * Public base url of this service. Batch verification QR codes point to
     * {@code <externalUrl>/api/verification/batch/<uuid>}.
     */
    @NotEmpty
    private String externalUrl;

    /**
     * How long a holder has to claim an offered credential.
     */
    @NotNull
    private Duration issuanceClaimWindow = Duration.ofMinutes(10);

    /**
     * How long a single verification (or one scan of a batch session) stays open.
     */
    @NotNull
    private Duration verificationWindow = Duration.ofMinutes(5);

    @NotNull
    private Duration batchSessionWindow = Duration.ofHours(3);

    /**
     * Expiry date (yyyyMMdd) written into every credential offered to the wallet sandbox.
     */
    @NotEmpty
    private String credentialExpiredDate = "20251231";

    /**
     * Presentation template reference used when asking the verifier sandbox for a QR code.
     */
    @NotEmpty
    private String verifierRequestRef = "00000000_template001";

    /**
     * HMAC secret of the simulation token. HS256 needs at least 256 bit.
     */
    @NotNull
    @Size(min = 32, message = "Simulation token secret must be at least 32 characters long")
    private String simulationTokenSecret;

    @NotNull
    private Duration simulationTokenValidity = Duration.ofHours(1);

    /**
     * Candidate benefit levels per template id. Templates without entry get "NA".
     */
    @NotNull
    private Map<Integer, List<String>> benefitLevels = new HashMap<>();

    @Min(1)
    private int batchPollPoolSize = 8;

    @NotNull
    private ExpirationSweep expirationSweep = new ExpirationSweep();

    @Data
    public static class ExpirationSweep {
        private boolean enabled;

        @NotNull
        private Duration interval = Duration.ofMinutes(1);
    }
}
