/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.BatchResultEntryDto;
import ch.admin.bj.swiyu.broker.api.verification.BatchStatusResponseDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationStatusTypeDto;
import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.common.exception.SandboxApiException;
import ch.admin.bj.swiyu.broker.common.exception.UpstreamContractException;
import ch.admin.bj.swiyu.broker.domain.verification.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static ch.admin.bj.swiyu.broker.service.verification.VerificationMapper.toBatchSessionInfoDto;
import static ch.admin.bj.swiyu.broker.service.verification.VerificationMapper.toVerificationStatusTypeDto;

/**
 * Polls every pending scan of a batch session concurrently and summarizes the session.
 * <p>
 * The polls are settled independently: a scan whose poll fails is marked as failed, its siblings are
 * polled regardless.
 */
@Slf4j
@Service
public class BatchVerificationService {

    static final String SCANNED_MESSAGE = "scanned, not yet complete";
    static final String SANDBOX_POLLING_ERROR = "Sandbox polling error";
    static final String INTERNAL_POLLING_ERROR = "internal polling error";
    static final String ORPHANED_MESSAGE = "verified person no longer exists";

    private final BatchVerificationSessionRepository batchSessionRepository;
    private final VerificationLogRepository verificationLogRepository;
    private final VerificationPollService pollService;
    private final VerificationTransitionService transitionService;
    private final VerificationPayloadAssembler payloadAssembler;
    private final Executor batchPollExecutor;
    private final Clock clock;

    public BatchVerificationService(BatchVerificationSessionRepository batchSessionRepository,
                                    VerificationLogRepository verificationLogRepository,
                                    VerificationPollService pollService,
                                    VerificationTransitionService transitionService,
                                    VerificationPayloadAssembler payloadAssembler,
                                    @Qualifier("batchPollExecutor") Executor batchPollExecutor,
                                    Clock clock) {
        this.batchSessionRepository = batchSessionRepository;
        this.verificationLogRepository = verificationLogRepository;
        this.pollService = pollService;
        this.transitionService = transitionService;
        this.payloadAssembler = payloadAssembler;
        this.batchPollExecutor = batchPollExecutor;
        this.clock = clock;
    }

    /**
     * @throws ResourceNotFoundException if the session does not exist
     */
    public BatchStatusResponseDto checkBatchStatus(UUID sessionUuid) {
        var session = batchSessionRepository.findByUuid(sessionUuid)
                .orElseThrow(() -> new ResourceNotFoundException("Batch verification session " + sessionUuid + " not found"));
        if (session.getStatus() == BatchVerificationStatus.ACTIVE && session.hasExpirationTimeStampPassed(clock.instant())) {
            session = transitionService.expireSession(session.getId());
        }

        var pending = verificationLogRepository.findAllByBatchSessionIdAndStatus(session.getId(), VerificationStatus.INITIATED);
        log.debug("Polling {} pending verification(s) of batch session {}", pending.size(), sessionUuid);
        var polls = pending.stream()
                .map(verificationLog -> CompletableFuture
                        .runAsync(() -> pollIsolated(verificationLog), batchPollExecutor)
                        .exceptionally(e -> {
                            log.error("Poll of verification log {} could not be settled", verificationLog.getId(), e);
                            return null;
                        }))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(polls).join();

        var results = verificationLogRepository.findAllByBatchSessionIdNewestFirst(session.getId()).stream()
                .map(this::toResultEntry)
                .toList();
        return new BatchStatusResponseDto(toBatchSessionInfoDto(session), results);
    }

    private void pollIsolated(VerificationLog verificationLog) {
        try {
            pollService.poll(verificationLog);
        } catch (SandboxApiException | UpstreamContractException e) {
            log.warn("Polling verification {} failed: {}", verificationLog.getTransactionId(), e.getMessage());
            transitionService.fail(verificationLog.getId(), SANDBOX_POLLING_ERROR, errorData(e));
        } catch (RuntimeException e) {
            log.error("Polling verification {} failed unexpectedly", verificationLog.getTransactionId(), e);
            transitionService.fail(verificationLog.getId(), INTERNAL_POLLING_ERROR, errorData(e));
        }
    }

    private BatchResultEntryDto toResultEntry(VerificationLog verificationLog) {
        var entry = BatchResultEntryDto.builder()
                .timestamp(verificationLog.getAuditMetadata().getCreatedAt())
                .logId(String.valueOf(verificationLog.getId()));

        return switch (verificationLog.getStatus()) {
            case INITIATED -> entry
                    .status(VerificationStatusTypeDto.INITIATED)
                    .message(SCANNED_MESSAGE)
                    .build();
            case SUCCESS -> payloadAssembler.assemble(verificationLog.getVerifiedPersonId(), verificationLog.getReturnedData())
                    .map(payload -> entry
                            .status(VerificationStatusTypeDto.SUCCESS)
                            .message(StringUtils.defaultIfBlank(verificationLog.getResultDescription(), VerificationPollService.SUCCEEDED_DESCRIPTION))
                            .verificationData(payload)
                            .build())
                    .orElseGet(() -> entry
                            .status(VerificationStatusTypeDto.ERROR_MISSING_UUID)
                            .message(ORPHANED_MESSAGE)
                            .build());
            default -> entry
                    .status(toVerificationStatusTypeDto(verificationLog.getStatus()))
                    .message(StringUtils.defaultIfBlank(verificationLog.getResultDescription(), VerificationPollService.FINISHED_MESSAGE))
                    .build();
        };
    }

    private static Map<String, Object> errorData(RuntimeException e) {
        return Map.of("error", StringUtils.defaultString(e.getMessage(), e.getClass().getSimpleName()));
    }
}
