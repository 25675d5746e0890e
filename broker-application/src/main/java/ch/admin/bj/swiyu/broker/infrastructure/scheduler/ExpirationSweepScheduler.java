/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.infrastructure.scheduler;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogStatus;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationSessionRepository;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationStatus;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationLogRepository;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationStatus;
import ch.admin.bj.swiyu.broker.service.issuance.IssuanceTransitionService;
import ch.admin.bj.swiyu.broker.service.verification.VerificationTransitionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Materializes the expiry of transactions nobody polls anymore.
 *
 * <p>Expiry is still decided on every access, this job only keeps the stored status close to the
 * displayed one. Every row is expired in its own transaction through the same transition services
 * the polls use, so a poll racing the sweep cannot expire a row twice. Runs every
 * {@code application.expiration-sweep.interval} under the distributed lock "expireTransactions".</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableScheduling
@EnableSchedulerLock(defaultLockAtMostFor = "5m")
@ConditionalOnProperty(name = "application.expiration-sweep.enabled", havingValue = "true")
public class ExpirationSweepScheduler {

    private final IssuanceLogRepository issuanceLogRepository;
    private final VerificationLogRepository verificationLogRepository;
    private final BatchVerificationSessionRepository batchSessionRepository;
    private final IssuanceTransitionService issuanceTransitionService;
    private final VerificationTransitionService verificationTransitionService;
    private final Clock clock;

    @Scheduled(initialDelay = 0, fixedDelayString = "${application.expiration-sweep.interval}")
    @SchedulerLock(name = "expireTransactions")
    public void expireTransactions() {
        var now = clock.instant();

        var issuanceLogIds = issuanceLogRepository.findIdsByStatusAndExpiresAtBefore(IssuanceLogStatus.INITIATED, now);
        var verificationLogIds = verificationLogRepository.findIdsByStatusAndExpiresAtBefore(VerificationStatus.INITIATED, now);
        var sessionIds = batchSessionRepository.findIdsByStatusAndExpiresAtBefore(BatchVerificationStatus.ACTIVE, now);
        log.info("Expiring {} issuance(s), {} verification(s) and {} batch session(s)",
                issuanceLogIds.size(), verificationLogIds.size(), sessionIds.size());

        issuanceLogIds.forEach(issuanceTransitionService::expire);
        verificationLogIds.forEach(verificationTransitionService::expire);
        sessionIds.forEach(verificationTransitionService::expireSession);
    }
}
