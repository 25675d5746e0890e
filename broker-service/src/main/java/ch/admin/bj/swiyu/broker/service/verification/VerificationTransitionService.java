/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.domain.person.PersonRepository;
import ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachine;
import ch.admin.bj.swiyu.broker.domain.verification.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

import static ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachineConfig.BatchSessionEvent;
import static ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachineConfig.VerificationEvent;

/**
 * Terminal transitions of verification logs and batch sessions, each in its own transaction.
 * <p>
 * Rows are locked and re-checked first: a log which is no longer initiated (or a session which is no
 * longer active) is returned unchanged, so a terminal state is written exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationTransitionService {

    public static final String EXPIRED_DESCRIPTION = "verification expired";
    public static final String MISSING_PERSONAL_ID_DESCRIPTION = "missing personalId";
    public static final String UNKNOWN_PERSON_DESCRIPTION = "cannot link user";

    private final VerificationLogRepository verificationLogRepository;
    private final BatchVerificationSessionRepository batchSessionRepository;
    private final PersonRepository personRepository;
    private final BrokerStateMachine stateMachine;

    @Transactional
    public VerificationLog expire(Long verificationLogId) {
        var verificationLog = lockLog(verificationLogId);
        if (verificationLog.getStatus() == VerificationStatus.INITIATED) {
            verificationLog.recordResult(null, EXPIRED_DESCRIPTION, null);
            stateMachine.sendEventAndUpdateStatus(verificationLog, VerificationEvent.EXPIRE);
        }
        return verificationLog;
    }

    @Transactional
    public VerificationLog fail(Long verificationLogId, String description, Map<String, Object> returnedData) {
        var verificationLog = lockLog(verificationLogId);
        if (verificationLog.getStatus() == VerificationStatus.INITIATED) {
            verificationLog.recordResult(false, description, returnedData);
            stateMachine.sendEventAndUpdateStatus(verificationLog, VerificationEvent.FAIL);
        }
        return verificationLog;
    }

    /**
     * Verified presentation without the personal id claim.
     */
    @Transactional
    public VerificationLog unlinked(Long verificationLogId, Map<String, Object> returnedData) {
        var verificationLog = lockLog(verificationLogId);
        if (verificationLog.getStatus() == VerificationStatus.INITIATED) {
            verificationLog.recordResult(true, MISSING_PERSONAL_ID_DESCRIPTION, returnedData);
            stateMachine.sendEventAndUpdateStatus(verificationLog, VerificationEvent.UNLINKED);
        }
        return verificationLog;
    }

    /**
     * Links a verified presentation to the local person holding the personal id. Lookup and update share
     * one transaction, so the log never points to a person that was not there when it was linked.
     */
    @Transactional
    public VerificationLog resolveSuccess(Long verificationLogId, String personalId, String description, Map<String, Object> returnedData) {
        var verificationLog = lockLog(verificationLogId);
        if (verificationLog.getStatus() != VerificationStatus.INITIATED) {
            return verificationLog;
        }
        var person = personRepository.findByPersonalId(personalId);
        if (person.isEmpty()) {
            log.warn("Verification {} succeeded for personal id {} which is unknown locally", verificationLog.getTransactionId(), personalId);
            verificationLog.recordResult(true, UNKNOWN_PERSON_DESCRIPTION, returnedData);
            stateMachine.sendEventAndUpdateStatus(verificationLog, VerificationEvent.UNLINKED);
            return verificationLog;
        }
        verificationLog.recordResult(true, description, returnedData);
        verificationLog.linkPerson(person.get().getId());
        stateMachine.sendEventAndUpdateStatus(verificationLog, VerificationEvent.SUCCEED);
        return verificationLog;
    }

    @Transactional
    public BatchVerificationSession expireSession(Long sessionId) {
        var session = lockSession(sessionId);
        if (session.getStatus() == BatchVerificationStatus.ACTIVE) {
            stateMachine.sendEventAndUpdateStatus(session, BatchSessionEvent.EXPIRE);
        }
        return session;
    }

    @Transactional
    public BatchVerificationSession closeSession(Long sessionId) {
        var session = lockSession(sessionId);
        if (session.getStatus() == BatchVerificationStatus.ACTIVE) {
            stateMachine.sendEventAndUpdateStatus(session, BatchSessionEvent.CLOSE);
        }
        return session;
    }

    private VerificationLog lockLog(Long verificationLogId) {
        return verificationLogRepository.findByIdForUpdate(verificationLogId)
                .orElseThrow(() -> new ResourceNotFoundException("Verification log " + verificationLogId + " not found"));
    }

    private BatchVerificationSession lockSession(Long sessionId) {
        return batchSessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch verification session " + sessionId + " not found"));
    }
}
