/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.statemachine;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogStatus;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationStatus;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationStatus;
import lombok.Getter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;

import java.util.EnumSet;

@Configuration
public class BrokerStateMachineConfig {

    @Getter
    public enum IssuedCredentialEvent {
        CLAIM("Claimed by holder"),
        EXPIRE("Claim window lapsed"),
        REVOKE("Revoked by admin");

        private final String displayName;

        IssuedCredentialEvent(String displayName) {
            this.displayName = displayName;
        }
    }

    public enum IssuanceLogEvent {
        CLAIM,
        EXPIRE
    }

    @Getter
    public enum VerificationEvent {
        SUCCEED("Presentation verified and linked to a person"),
        FAIL("Presentation rejected or polling failed"),
        EXPIRE("Verification window lapsed"),
        UNLINKED("Presentation verified but not linkable");

        private final String displayName;

        VerificationEvent(String displayName) {
            this.displayName = displayName;
        }
    }

    public enum BatchSessionEvent {
        CLOSE,
        EXPIRE
    }

    @Bean
    public StateMachine<IssuedCredentialStatus, IssuedCredentialEvent> issuedCredentialStateMachine() throws Exception {
        StateMachineBuilder.Builder<IssuedCredentialStatus, IssuedCredentialEvent> builder = StateMachineBuilder.builder();

        builder.configureStates()
                .withStates()
                .initial(IssuedCredentialStatus.ISSUING)
                .states(EnumSet.allOf(IssuedCredentialStatus.class));

        builder.configureTransitions()
                .withExternal()
                .source(IssuedCredentialStatus.ISSUING).target(IssuedCredentialStatus.ISSUED)
                .event(IssuedCredentialEvent.CLAIM)
                .and()
                .withExternal()
                .source(IssuedCredentialStatus.ISSUING).target(IssuedCredentialStatus.EXPIRED)
                .event(IssuedCredentialEvent.EXPIRE)
                .and()

                // Revocation applies to every attempt of a person/template pair, whatever its state
                .withExternal()
                .source(IssuedCredentialStatus.ISSUING).target(IssuedCredentialStatus.REVOKED)
                .event(IssuedCredentialEvent.REVOKE)
                .and()
                .withExternal()
                .source(IssuedCredentialStatus.ISSUED).target(IssuedCredentialStatus.REVOKED)
                .event(IssuedCredentialEvent.REVOKE)
                .and()
                .withExternal()
                .source(IssuedCredentialStatus.EXPIRED).target(IssuedCredentialStatus.REVOKED)
                .event(IssuedCredentialEvent.REVOKE)
                .and()
                .withExternal()
                .source(IssuedCredentialStatus.REVOKED).target(IssuedCredentialStatus.REVOKED)
                .event(IssuedCredentialEvent.REVOKE);

        builder.configureConfiguration()
                .withConfiguration()
                .autoStartup(true);

        return builder.build();
    }

    @Bean
    public StateMachine<IssuanceLogStatus, IssuanceLogEvent> issuanceLogStateMachine() throws Exception {
        StateMachineBuilder.Builder<IssuanceLogStatus, IssuanceLogEvent> builder = StateMachineBuilder.builder();

        builder.configureStates()
                .withStates()
                .initial(IssuanceLogStatus.INITIATED)
                .states(EnumSet.allOf(IssuanceLogStatus.class));

        builder.configureTransitions()
                .withExternal()
                .source(IssuanceLogStatus.INITIATED).target(IssuanceLogStatus.USER_CLAIMED)
                .event(IssuanceLogEvent.CLAIM)
                .and()
                .withExternal()
                .source(IssuanceLogStatus.INITIATED).target(IssuanceLogStatus.EXPIRED)
                .event(IssuanceLogEvent.EXPIRE);

        builder.configureConfiguration()
                .withConfiguration()
                .autoStartup(true);

        return builder.build();
    }

    @Bean
    public StateMachine<VerificationStatus, VerificationEvent> verificationStateMachine() throws Exception {
        StateMachineBuilder.Builder<VerificationStatus, VerificationEvent> builder = StateMachineBuilder.builder();

        builder.configureStates()
                .withStates()
                .initial(VerificationStatus.INITIATED)
                .states(EnumSet.allOf(VerificationStatus.class));

        builder.configureTransitions()
                .withExternal()
                .source(VerificationStatus.INITIATED).target(VerificationStatus.SUCCESS)
                .event(VerificationEvent.SUCCEED)
                .and()
                .withExternal()
                .source(VerificationStatus.INITIATED).target(VerificationStatus.FAILED)
                .event(VerificationEvent.FAIL)
                .and()
                .withExternal()
                .source(VerificationStatus.INITIATED).target(VerificationStatus.EXPIRED)
                .event(VerificationEvent.EXPIRE)
                .and()
                .withExternal()
                .source(VerificationStatus.INITIATED).target(VerificationStatus.ERROR_MISSING_UUID)
                .event(VerificationEvent.UNLINKED);

        builder.configureConfiguration()
                .withConfiguration()
                .autoStartup(true);

        return builder.build();
    }

    @Bean
    public StateMachine<BatchVerificationStatus, BatchSessionEvent> batchSessionStateMachine() throws Exception {
        StateMachineBuilder.Builder<BatchVerificationStatus, BatchSessionEvent> builder = StateMachineBuilder.builder();

        builder.configureStates()
                .withStates()
                .initial(BatchVerificationStatus.ACTIVE)
                .states(EnumSet.allOf(BatchVerificationStatus.class));

        builder.configureTransitions()
                .withExternal()
                .source(BatchVerificationStatus.ACTIVE).target(BatchVerificationStatus.CLOSED)
                .event(BatchSessionEvent.CLOSE)
                .and()
                .withExternal()
                .source(BatchVerificationStatus.ACTIVE).target(BatchVerificationStatus.EXPIRED)
                .event(BatchSessionEvent.EXPIRE);

        builder.configureConfiguration()
                .withConfiguration()
                .autoStartup(true);

        return builder.build();
    }
}
