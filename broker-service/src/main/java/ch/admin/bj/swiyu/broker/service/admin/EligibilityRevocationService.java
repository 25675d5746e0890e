/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.admin;

import ch.admin.bj.swiyu.broker.api.admin.RevokeEligibilityRequestDto;
import ch.admin.bj.swiyu.broker.api.admin.RevokeEligibilityResponseDto;
import ch.admin.bj.swiyu.broker.common.exception.*;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredential;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialRepository;
import ch.admin.bj.swiyu.broker.domain.person.PersonEligibilityRepository;
import ch.admin.bj.swiyu.broker.domain.person.PersonRepository;
import ch.admin.bj.swiyu.broker.domain.person.VcTemplateRepository;
import ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachine;
import ch.admin.bj.swiyu.broker.service.sandbox.wallet.WalletApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

import static ch.admin.bj.swiyu.broker.domain.statemachine.BrokerStateMachineConfig.IssuedCredentialEvent;

/**
 * Withdraws the eligibility of a person for a template and revokes every credential issued for it.
 * <p>
 * The wallet sandbox calls run inside the local transaction: any failed call rolls back all local changes.
 * Revocations already performed on the sandbox are not compensated, running the revocation again is safe
 * since revoking a revoked credential is accepted by the sandbox and the local state machine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EligibilityRevocationService {

    private final PersonRepository personRepository;
    private final VcTemplateRepository templateRepository;
    private final PersonEligibilityRepository eligibilityRepository;
    private final IssuedCredentialRepository issuedCredentialRepository;
    private final WalletApiClient walletApiClient;
    private final BrokerStateMachine stateMachine;
    private final TransactionTemplate transaction;

    /**
     * @throws ResourceNotFoundException         if the person or template does not exist
     * @throws RevocationUpstreamException       if the wallet sandbox failed, nothing was changed locally
     * @throws RevocationInconsistencyException  if the sandbox revoked credentials but the local changes could not be committed
     */
    public RevokeEligibilityResponseDto revoke(RevokeEligibilityRequestDto request) {
        var personId = Long.valueOf(request.personId());
        var templateId = request.templateId();
        List<String> revokedCids = new ArrayList<>();

        Integer revokedRows;
        try {
            revokedRows = transaction.execute(status -> {
                if (!personRepository.existsById(personId)) {
                    throw new ResourceNotFoundException("Person " + personId + " not found");
                }
                if (!templateRepository.existsById(templateId)) {
                    throw new ResourceNotFoundException("Template " + templateId + " not found");
                }

                var credentials = issuedCredentialRepository.findAllByPersonAndTemplateForUpdate(personId, templateId);
                for (var credential : credentials) {
                    if (credential.isRevocableUpstream()) {
                        walletApiClient.revoke(credential.getCid());
                        revokedCids.add(credential.getCid());
                    }
                }
                credentials.forEach(this::revokeLocally);
                var deleted = eligibilityRepository.deleteByPersonIdAndTemplateId(personId, templateId);
                log.info("Revoked {} credential(s) of person {} for template {}, {} eligibility row(s) removed",
                        credentials.size(), personId, templateId, deleted);
                return credentials.size();
            });
        } catch (SandboxApiException | UpstreamContractException e) {
            var message = "Upstream revocation failed, local state untouched";
            if (!revokedCids.isEmpty()) {
                message += ". Already revoked on the wallet sandbox: " + revokedCids;
            }
            throw new RevocationUpstreamException(message, e);
        } catch (DataAccessException | TransactionException e) {
            if (revokedCids.isEmpty()) {
                throw e;
            }
            log.error("Credentials {} of person {} were revoked on the wallet sandbox but the local revocation failed, manual reconciliation required",
                    revokedCids, personId, e);
            throw new RevocationInconsistencyException(
                    "Partial failure, local state may be inconsistent with remote", revokedCids, e);
        }

        return new RevokeEligibilityResponseDto(String.format(
                "Eligibility of person %s for template %s revoked, %s credential(s) marked revoked, %s revoked on the wallet sandbox",
                personId, templateId, revokedRows, revokedCids.size()));
    }

    private void revokeLocally(IssuedCredential credential) {
        stateMachine.sendEventAndUpdateStatus(credential, IssuedCredentialEvent.REVOKE);
    }
}
