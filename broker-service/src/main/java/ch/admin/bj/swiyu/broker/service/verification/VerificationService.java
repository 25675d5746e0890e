/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.BatchSessionInfoDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationRequestDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationStartResponseDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationStatusResponseDto;
import ch.admin.bj.swiyu.broker.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.broker.common.exception.ResourceGoneException;
import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.common.exception.UpstreamContractException;
import ch.admin.bj.swiyu.broker.domain.verification.*;
import ch.admin.bj.swiyu.broker.service.sandbox.verifier.VerifierApiClient;
import ch.admin.bj.swiyu.broker.service.sandbox.verifier.VerifierQrCodeResponseDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.UUID;

import static ch.admin.bj.swiyu.broker.service.verification.VerificationMapper.toBatchSessionInfoDto;

/**
 * Starts single verifications and batch sessions, turns batch session scans into one-shot verifications
 * and answers the status of single verifications.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    public static final String BATCH_REDIRECT_PATH = "/api/verification/batch/";

    private final VerificationLogRepository verificationLogRepository;
    private final BatchVerificationSessionRepository batchSessionRepository;
    private final VerificationTransitionService transitionService;
    private final VerificationPollService pollService;
    private final VerifierApiClient verifierApiClient;
    private final BatchQrCodeGenerator qrCodeGenerator;
    private final ApplicationProperties applicationProperties;
    private final Clock clock;

    public VerificationStartResponseDto requestVerification(VerificationRequestDto request) {
        return request.isBatch() ? startBatchSession(request) : startSingleVerification(request);
    }

    private VerificationStartResponseDto startSingleVerification(VerificationRequestDto request) {
        var transactionId = UUID.randomUUID().toString();
        var qrCode = requestPresentation(transactionId);
        if (StringUtils.isBlank(qrCode.qrcodeImage())) {
            throw new UpstreamContractException("Verifier sandbox answered without QR code image for " + transactionId);
        }

        var verificationLog = verificationLogRepository.save(VerificationLog.builder()
                .transactionId(transactionId)
                .status(VerificationStatus.INITIATED)
                .expiresAt(clock.instant().plus(applicationProperties.getVerificationWindow()))
                .verifierInfo(request.role())
                .verifierBranch(request.verifier())
                .verificationReason(request.reason())
                .notes(request.notes())
                .build());

        log.info("Single verification {} started by {} ({})", transactionId, request.verifier(), request.role());
        return VerificationStartResponseDto.builder()
                .type("single")
                .transactionId(transactionId)
                .qrCode(qrCode.qrcodeImage())
                .deepLink(qrCode.authUri())
                .expiresAt(verificationLog.getExpiresAt())
                .build();
    }

    private VerificationStartResponseDto startBatchSession(VerificationRequestDto request) {
        var session = batchSessionRepository.save(BatchVerificationSession.builder()
                .uuid(UUID.randomUUID())
                .status(BatchVerificationStatus.ACTIVE)
                .expiresAt(clock.instant().plus(applicationProperties.getBatchSessionWindow()))
                .verifierInfo(request.role())
                .verifierBranch(request.verifier())
                .verificationReason(request.reason())
                .notes(request.notes())
                .build());

        log.info("Batch verification session {} started by {} ({})", session.getUuid(), request.verifier(), request.role());
        return VerificationStartResponseDto.builder()
                .type("batch")
                .batchSessionUuid(session.getUuid())
                .qrCode(qrCodeGenerator.toDataUrl(batchRedirectUrl(session.getUuid())))
                .expiresAt(session.getExpiresAt())
                .build();
    }

    /**
     * Handles one scan of a batch session QR code by opening a new verification on the verifier sandbox.
     *
     * @return the wallet deeplink the scanning device is to be redirected to, validated before the log is stored
     * @throws ResourceNotFoundException if the session does not exist
     * @throws ResourceGoneException     if the session is closed or expired
     */
    public URI redirectBatchScan(UUID sessionUuid) {
        var session = findActiveSession(sessionUuid);

        var transactionId = UUID.randomUUID().toString();
        var qrCode = requestPresentation(transactionId);
        var deeplink = toDeeplinkUri(qrCode.authUri(), transactionId);
        verificationLogRepository.save(VerificationLog.builder()
                .transactionId(transactionId)
                .status(VerificationStatus.INITIATED)
                .expiresAt(clock.instant().plus(applicationProperties.getVerificationWindow()))
                .verifierInfo(session.getVerifierInfo())
                .verifierBranch(session.getVerifierBranch())
                .verificationReason(session.getVerificationReason())
                .notes(session.getNotes())
                .batchSession(session)
                .build());

        log.info("Batch verification session {} scanned, verification {} started", sessionUuid, transactionId);
        return deeplink;
    }

    /**
     * Ends a batch session before its expiry. Closing a closed session again is a no-op.
     */
    public BatchSessionInfoDto closeBatchSession(UUID sessionUuid) {
        var session = batchSessionRepository.findByUuid(sessionUuid)
                .orElseThrow(() -> new ResourceNotFoundException("Batch verification session " + sessionUuid + " not found"));
        if (session.getStatus() == BatchVerificationStatus.CLOSED) {
            return toBatchSessionInfoDto(session);
        }
        var active = findActiveSession(sessionUuid);
        log.info("Closing batch verification session {}", sessionUuid);
        return toBatchSessionInfoDto(transitionService.closeSession(active.getId()));
    }

    public VerificationStatusResponseDto checkStatus(String transactionId) {
        var verificationLog = verificationLogRepository.findByTransactionId(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Verification " + transactionId + " not found"));
        return pollService.toStatusResponse(pollService.poll(verificationLog));
    }

    private BatchVerificationSession findActiveSession(UUID sessionUuid) {
        var session = batchSessionRepository.findByUuid(sessionUuid)
                .orElseThrow(() -> new ResourceNotFoundException("Batch verification session " + sessionUuid + " not found"));
        if (session.getStatus() != BatchVerificationStatus.ACTIVE) {
            throw new ResourceGoneException("Batch verification session " + sessionUuid + " is " + session.getStatus().name().toLowerCase());
        }
        if (session.hasExpirationTimeStampPassed(clock.instant())) {
            transitionService.expireSession(session.getId());
            throw new ResourceGoneException("Batch verification session " + sessionUuid + " has expired");
        }
        return session;
    }

    private VerifierQrCodeResponseDto requestPresentation(String transactionId) {
        var qrCode = verifierApiClient.createQrCode(applicationProperties.getVerifierRequestRef(), transactionId);
        if (StringUtils.isBlank(qrCode.authUri())) {
            throw new UpstreamContractException("Verifier sandbox answered without authUri for " + transactionId);
        }
        return qrCode;
    }

    private static URI toDeeplinkUri(String authUri, String transactionId) {
        try {
            return URI.create(authUri);
        } catch (IllegalArgumentException e) {
            throw new UpstreamContractException("Verifier sandbox answered with an invalid authUri for " + transactionId);
        }
    }

    private String batchRedirectUrl(UUID sessionUuid) {
        return StringUtils.removeEnd(applicationProperties.getExternalUrl(), "/") + BATCH_REDIRECT_PATH + sessionUuid;
    }
}
