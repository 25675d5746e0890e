/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.statemachine;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLog;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogStatus;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredential;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationSession;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationStatus;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationLog;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.support.DefaultStateMachineContext;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import static ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachineConfig.*;

/**
 * Validates every status change of the broker entities against the configured state machines.
 * <p>
 * The machines are singletons without per-entity state: each call rewinds the machine to the current
 * status of the entity and fires the event. Access is serialized per machine since batch polling
 * transitions logs from several threads at once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BrokerStateMachine {

    private final StateMachine<IssuedCredentialStatus, IssuedCredentialEvent> issuedCredentialStateMachine;
    private final StateMachine<IssuanceLogStatus, IssuanceLogEvent> issuanceLogStateMachine;
    private final StateMachine<VerificationStatus, VerificationEvent> verificationStateMachine;
    private final StateMachine<BatchVerificationStatus, BatchSessionEvent> batchSessionStateMachine;

    public void sendEventAndUpdateStatus(IssuedCredential entity, IssuedCredentialEvent event) {
        entity.changeStatus(sendEvent(issuedCredentialStateMachine, entity.getStatus(), event, "issuedCredentialId", entity.getId()));
    }

    public void sendEventAndUpdateStatus(IssuanceLog entity, IssuanceLogEvent event) {
        entity.changeStatus(sendEvent(issuanceLogStateMachine, entity.getStatus(), event, "issuanceLogId", entity.getId()));
    }

    public void sendEventAndUpdateStatus(VerificationLog entity, VerificationEvent event) {
        entity.changeStatus(sendEvent(verificationStateMachine, entity.getStatus(), event, "verificationLogId", entity.getId()));
    }

    public void sendEventAndUpdateStatus(BatchVerificationSession entity, BatchSessionEvent event) {
        entity.changeStatus(sendEvent(batchSessionStateMachine, entity.getStatus(), event, "batchSessionId", entity.getId()));
    }

    private <S, E> S sendEvent(StateMachine<S, E> machine, S currentStatus, E event, String idHeader, Object entityId) {
        synchronized (machine) {
            machine.getStateMachineAccessor()
                    .doWithAllRegions(access ->
                            access.resetStateMachineReactively(
                                    new DefaultStateMachineContext<>(
                                            currentStatus,
                                            null,
                                            null,
                                            null
                                    )
                            ).block()
                    );

            StateMachineEventResult<S, E> result = machine
                    .sendEvent(
                            Mono.just(
                                    MessageBuilder
                                            .withPayload(event)
                                            .setHeader(idHeader, entityId)
                                            .setHeader("oldStatus", currentStatus)
                                            .build()
                            )
                    )
                    .blockLast();

            if (result != null && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED) {
                S newStatus = machine.getState().getId();
                log.info("Transaction accepted for: {}. New state = {}", result.getMessage(), newStatus);
                return newStatus;
            }
            log.error("Transaction failed for {} {} with event {} from state {}", idHeader, entityId, event, currentStatus);
            throw new IllegalStateException("Transition failed for " + event + " from " + currentStatus);
        }
    }
}
