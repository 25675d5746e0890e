package ch.admin.bj.swiyu.broker.service.issuance;

import ch.admin.bj.swiyu.broker.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.broker.common.exception.MissingSimulationContextException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static ch.admin.bj.swiyu.broker.test.BrokerTestData.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationTokenServiceTest {

    private ApplicationProperties applicationProperties;
    private SimulationTokenService tokenService;

    @BeforeEach
    void setUp() {
        applicationProperties = new ApplicationProperties();
        applicationProperties.setSimulationTokenSecret("test-secret-with-at-least-thirty-two-characters");
        applicationProperties.setSimulationTokenValidity(Duration.ofHours(1));
        tokenService = new SimulationTokenService(applicationProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * Happy path: a freshly created token resolves to its person.
     */
    @Test
    void createdToken_resolvesToPerson() {
        var token = tokenService.createToken(42L);

        assertThat(tokenService.resolvePersonId(token)).isEqualTo(42L);
    }

    @Test
    void missingToken_thenRejected() {
        assertThatThrownBy(() -> tokenService.resolvePersonId(null))
                .isInstanceOf(MissingSimulationContextException.class);
        assertThatThrownBy(() -> tokenService.resolvePersonId(""))
                .isInstanceOf(MissingSimulationContextException.class);
    }

    @Test
    void expiredToken_thenRejected() {
        var token = tokenService.createToken(42L);
        var later = new SimulationTokenService(applicationProperties, Clock.fixed(NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.resolvePersonId(token))
                .isInstanceOf(MissingSimulationContextException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void tokenSignedWithOtherSecret_thenRejected() {
        var otherProperties = new ApplicationProperties();
        otherProperties.setSimulationTokenSecret("another-secret-with-at-least-thirty-two-chars");
        var otherToken = new SimulationTokenService(otherProperties, Clock.fixed(NOW, ZoneOffset.UTC)).createToken(42L);

        assertThatThrownBy(() -> tokenService.resolvePersonId(otherToken))
                .isInstanceOf(MissingSimulationContextException.class);
    }

    @Test
    void garbageToken_thenRejected() {
        assertThatThrownBy(() -> tokenService.resolvePersonId("definitely.not.ajwt"))
                .isInstanceOf(MissingSimulationContextException.class);
    }
}
