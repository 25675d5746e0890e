package ch.admin.bj.swiyu.broker.infrastructure.scheduler;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogStatus;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationSessionRepository;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationStatus;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationLogRepository;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationStatus;
import ch.admin.bj.swiyu.broker.service.issuance.IssuanceTransitionService;
import ch.admin.bj.swiyu.broker.service.verification.VerificationTransitionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.*;

class ExpirationSweepSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    @Mock
    private IssuanceLogRepository issuanceLogRepository;
    @Mock
    private VerificationLogRepository verificationLogRepository;
    @Mock
    private BatchVerificationSessionRepository batchSessionRepository;
    @Mock
    private IssuanceTransitionService issuanceTransitionService;
    @Mock
    private VerificationTransitionService verificationTransitionService;

    private ExpirationSweepScheduler scheduler;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        scheduler = new ExpirationSweepScheduler(issuanceLogRepository, verificationLogRepository, batchSessionRepository,
                issuanceTransitionService, verificationTransitionService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void expireTransactions_expiresEveryOverdueRowIndividually() {
        when(issuanceLogRepository.findIdsByStatusAndExpiresAtBefore(IssuanceLogStatus.INITIATED, NOW)).thenReturn(List.of(1L, 2L));
        when(verificationLogRepository.findIdsByStatusAndExpiresAtBefore(VerificationStatus.INITIATED, NOW)).thenReturn(List.of(7L));
        when(batchSessionRepository.findIdsByStatusAndExpiresAtBefore(BatchVerificationStatus.ACTIVE, NOW)).thenReturn(List.of(9L));

        scheduler.expireTransactions();

        verify(issuanceTransitionService).expire(1L);
        verify(issuanceTransitionService).expire(2L);
        verify(verificationTransitionService).expire(7L);
        verify(verificationTransitionService).expireSession(9L);
    }

    @Test
    void expireTransactions_nothingOverdue_touchesNothing() {
        when(issuanceLogRepository.findIdsByStatusAndExpiresAtBefore(any(), any())).thenReturn(List.of());
        when(verificationLogRepository.findIdsByStatusAndExpiresAtBefore(any(), any())).thenReturn(List.of());
        when(batchSessionRepository.findIdsByStatusAndExpiresAtBefore(any(), any())).thenReturn(List.of());

        scheduler.expireTransactions();

        verifyNoInteractions(issuanceTransitionService, verificationTransitionService);
    }
}
