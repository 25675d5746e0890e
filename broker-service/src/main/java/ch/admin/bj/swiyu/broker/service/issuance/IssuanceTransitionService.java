/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.domain.issuance.*;
import ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

import static ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachineConfig.IssuanceLogEvent;
import static ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachineConfig.IssuedCredentialEvent;

/**
 * Applies the terminal transitions of an issuance transaction to the log and its credential in one
 * database transaction.
 * <p>
 * Both rows are locked and the log status is re-checked before anything is changed, so of two
 * concurrent polls only the first one transitions, the second one reports the stored outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssuanceTransitionService {

    private final IssuanceLogRepository issuanceLogRepository;
    private final IssuedCredentialRepository issuedCredentialRepository;
    private final BrokerStateMachine stateMachine;
    private final Clock clock;

    /**
     * Expires an unclaimed issuance transaction together with its credential.
     *
     * @return the status of the log after the call
     */
    @Transactional
    public IssuanceLogStatus expire(Long issuanceLogId) {
        var issuanceLog = lockLog(issuanceLogId);
        if (issuanceLog.getStatus() != IssuanceLogStatus.INITIATED) {
            return issuanceLog.getStatus();
        }
        stateMachine.sendEventAndUpdateStatus(issuanceLog, IssuanceLogEvent.EXPIRE);

        var credential = lockCredential(issuanceLog);
        if (credential.getStatus() == IssuedCredentialStatus.ISSUING) {
            stateMachine.sendEventAndUpdateStatus(credential, IssuedCredentialEvent.EXPIRE);
            credential.markExpired(clock.instant());
        } else {
            log.warn("Issuance log {} expired while its credential {} is already {}", issuanceLogId, credential.getId(), credential.getStatus());
        }
        return issuanceLog.getStatus();
    }

    /**
     * Records the claim of a credential by its holder.
     *
     * @param cid external credential id extracted from the claimed credential
     * @return the status of the log after the call
     */
    @Transactional
    public IssuanceLogStatus claim(Long issuanceLogId, String cid) {
        var issuanceLog = lockLog(issuanceLogId);
        if (issuanceLog.getStatus() != IssuanceLogStatus.INITIATED) {
            return issuanceLog.getStatus();
        }
        stateMachine.sendEventAndUpdateStatus(issuanceLog, IssuanceLogEvent.CLAIM);

        var credential = lockCredential(issuanceLog);
        if (credential.getStatus() == IssuedCredentialStatus.ISSUING) {
            stateMachine.sendEventAndUpdateStatus(credential, IssuedCredentialEvent.CLAIM);
        } else {
            // revoked while the offer was pending: the wallet now holds a live credential
            log.warn("Credential {} claimed with cid {} but is {} locally, revoke it on the wallet sandbox manually",
                    credential.getId(), cid, credential.getStatus());
        }
        credential.markClaimed(cid, clock.instant());
        return issuanceLog.getStatus();
    }

    private IssuanceLog lockLog(Long issuanceLogId) {
        return issuanceLogRepository.findByIdForUpdate(issuanceLogId)
                .orElseThrow(() -> new ResourceNotFoundException("Issuance log " + issuanceLogId + " not found"));
    }

    private IssuedCredential lockCredential(IssuanceLog issuanceLog) {
        var credentialId = issuanceLog.getIssuedCredential().getId();
        return issuedCredentialRepository.findByIdForUpdate(credentialId)
                .orElseThrow(() -> new ResourceNotFoundException("Issued credential " + credentialId + " not found"));
    }
}
