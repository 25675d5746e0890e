/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.VerificationStatusResponseDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationStatusTypeDto;
import ch.admin.bj.swiyu.broker.common.exception.OrphanedVerificationException;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationLog;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationStatus;
import ch.admin.bj.swiyu.broker.service.sandbox.verifier.VerifierApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;

import static ch.admin.bj.swiyu.broker.service.verification.VerificationMapper.toVerificationStatusTypeDto;

/**
 * Reconciles a single verification log with the verifier sandbox. Used for standalone verifications
 * as well as for every scan of a batch session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationPollService {

    static final String PENDING_MESSAGE = "credential not yet presented";
    static final String FINISHED_MESSAGE = "verification finished";
    static final String FAILED_DESCRIPTION = "verification failed";
    static final String SUCCEEDED_DESCRIPTION = "verification succeeded";

    private final VerifierApiClient verifierApiClient;
    private final VerificationTransitionService transitionService;
    private final VerificationPayloadAssembler payloadAssembler;
    private final Clock clock;

    /**
     * Advances the log if the sandbox has an outcome. Terminal logs are returned as they are, without
     * contacting the sandbox.
     *
     * @return the log after polling, unchanged while the presentation is pending
     */
    public VerificationLog poll(VerificationLog verificationLog) {
        if (verificationLog.getStatus().isTerminalState()) {
            return verificationLog;
        }
        if (verificationLog.hasExpirationTimeStampPassed(clock.instant())) {
            return transitionService.expire(verificationLog.getId());
        }

        var verifierResult = verifierApiClient.fetchResult(verificationLog.getTransactionId());
        if (verifierResult.isEmpty()) {
            return verificationLog;
        }

        var result = verifierResult.get().result();
        var rawData = verifierResult.get().rawData();
        if (Boolean.FALSE.equals(result.verifyResult())) {
            log.info("Verification {} rejected by verifier: {}", verificationLog.getTransactionId(), result.resultDescription());
            return transitionService.fail(verificationLog.getId(),
                    StringUtils.defaultIfBlank(result.resultDescription(), FAILED_DESCRIPTION), rawData);
        }

        var personalId = result.findPersonalId();
        if (personalId.isEmpty()) {
            log.warn("Verification {} succeeded without personal id claim", verificationLog.getTransactionId());
            return transitionService.unlinked(verificationLog.getId(), rawData);
        }
        return transitionService.resolveSuccess(verificationLog.getId(), personalId.get(),
                StringUtils.defaultIfBlank(result.resultDescription(), SUCCEEDED_DESCRIPTION), rawData);
    }

    /**
     * @throws OrphanedVerificationException if the log succeeded but its person no longer exists
     */
    public VerificationStatusResponseDto toStatusResponse(VerificationLog verificationLog) {
        var status = verificationLog.getStatus();
        if (status == VerificationStatus.INITIATED) {
            return VerificationStatusResponseDto.builder()
                    .status(VerificationStatusTypeDto.INITIATED)
                    .message(PENDING_MESSAGE)
                    .build();
        }
        if (status == VerificationStatus.SUCCESS) {
            var payload = payloadAssembler.assemble(verificationLog.getVerifiedPersonId(), verificationLog.getReturnedData())
                    .orElseThrow(() -> new OrphanedVerificationException(
                            "Verification " + verificationLog.getTransactionId() + " succeeded but the verified person no longer exists"));
            return VerificationStatusResponseDto.builder()
                    .status(VerificationStatusTypeDto.SUCCESS)
                    .message(StringUtils.defaultIfBlank(verificationLog.getResultDescription(), SUCCEEDED_DESCRIPTION))
                    .verificationData(payload)
                    .build();
        }
        return VerificationStatusResponseDto.builder()
                .status(toVerificationStatusTypeDto(status))
                .message(StringUtils.defaultIfBlank(verificationLog.getResultDescription(), FINISHED_MESSAGE))
                .data(verificationLog.getReturnedData())
                .build();
    }
}
