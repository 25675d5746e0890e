package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.BatchResultEntryDto;
import ch.admin.bj.swiyu.broker.api.verification.BatchSessionStatusTypeDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationStatusTypeDto;
import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.common.exception.SandboxApiException;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.person.PersonRepository;
import ch.admin.bj.swiyu.broker.domain.verification.*;
import ch.admin.bj.swiyu.broker.service.sandbox.verifier.VerifierApiClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static ch.admin.bj.swiyu.broker.test.BrokerTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchVerificationServiceTest {

    private static final UUID SESSION_UUID = UUID.fromString("7d9f1f3e-0c57-4a4b-9a53-1c1f5d6c9e11");

    @Mock
    private BatchVerificationSessionRepository batchSessionRepository;
    @Mock
    private VerificationLogRepository verificationLogRepository;
    @Mock
    private VerifierApiClient verifierApiClient;
    @Mock
    private PersonRepository personRepository;
    @Mock
    private IssuedCredentialRepository issuedCredentialRepository;

    private BatchVerificationService batchVerificationService;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        var transitionService = new VerificationTransitionService(verificationLogRepository, batchSessionRepository,
                personRepository, createStateMachine());
        var payloadAssembler = new VerificationPayloadAssembler(personRepository, issuedCredentialRepository);
        var pollService = new VerificationPollService(verifierApiClient, transitionService, payloadAssembler, clock);
        // polls run on the calling thread
        batchVerificationService = new BatchVerificationService(batchSessionRepository, verificationLogRepository,
                pollService, transitionService, payloadAssembler, Runnable::run, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    /**
     * One failing sandbox call must not hide the results of the other scans.
     */
    @Test
    void checkBatchStatus_oneSandboxError_thenAllScansReported() {
        var session = activeSession(NOW.plusSeconds(3600));
        var first = scan(1L, "tx-1", session);
        var second = scan(2L, "tx-2", session);
        var broken = scan(3L, "tx-3", session);
        var person = person(5L, "P1");
        when(batchSessionRepository.findByUuid(SESSION_UUID)).thenReturn(Optional.of(session));
        when(verificationLogRepository.findAllByBatchSessionIdAndStatus(100L, VerificationStatus.INITIATED))
                .thenReturn(List.of(first, second, broken));
        when(verificationLogRepository.findAllByBatchSessionIdNewestFirst(100L)).thenReturn(List.of(broken, second, first));
        when(verifierApiClient.fetchResult("tx-1")).thenReturn(Optional.of(verifierResult(true, "P1")));
        when(verifierApiClient.fetchResult("tx-2")).thenReturn(Optional.of(verifierResult(true, "P1")));
        when(verifierApiClient.fetchResult("tx-3")).thenThrow(new SandboxApiException("Verifier sandbox not reachable", new RuntimeException("timeout")));
        when(personRepository.findByPersonalId("P1")).thenReturn(Optional.of(person));
        when(personRepository.findById(5L)).thenReturn(Optional.of(person));
        when(issuedCredentialRepository.findAllWithTemplateByPersonIdAndStatus(5L, IssuedCredentialStatus.ISSUED))
                .thenReturn(List.of(credential(20L, person, template(1, "Low income"), IssuedCredentialStatus.ISSUED, "abc")));

        var response = batchVerificationService.checkBatchStatus(SESSION_UUID);

        assertThat(response.sessionInfo().status()).isEqualTo(BatchSessionStatusTypeDto.ACTIVE);
        assertThat(response.results()).hasSize(3);
        assertThat(response.results()).extracting(BatchResultEntryDto::logId).containsExactly("3", "2", "1");
        assertThat(response.results()).extracting(BatchResultEntryDto::status).containsExactly(
                VerificationStatusTypeDto.FAILED, VerificationStatusTypeDto.SUCCESS, VerificationStatusTypeDto.SUCCESS);
        assertThat(response.results().get(0).message()).isEqualTo(BatchVerificationService.SANDBOX_POLLING_ERROR);
        assertThat(response.results().get(1).verificationData().person().name()).isEqualTo("Chen Mei-Ling");
        assertThat(broken.getReturnedData()).containsEntry("error", "Verifier sandbox not reachable");
    }

    @Test
    void checkBatchStatus_unexpectedError_thenInternalPollingError() {
        var session = activeSession(NOW.plusSeconds(3600));
        var scan = scan(1L, "tx-1", session);
        when(batchSessionRepository.findByUuid(SESSION_UUID)).thenReturn(Optional.of(session));
        when(verificationLogRepository.findAllByBatchSessionIdAndStatus(100L, VerificationStatus.INITIATED)).thenReturn(List.of(scan));
        when(verificationLogRepository.findAllByBatchSessionIdNewestFirst(100L)).thenReturn(List.of(scan));
        when(verifierApiClient.fetchResult("tx-1")).thenThrow(new IllegalArgumentException("bad"));

        var response = batchVerificationService.checkBatchStatus(SESSION_UUID);

        assertThat(response.results().get(0).status()).isEqualTo(VerificationStatusTypeDto.FAILED);
        assertThat(response.results().get(0).message()).isEqualTo(BatchVerificationService.INTERNAL_POLLING_ERROR);
    }

    @Test
    void checkBatchStatus_pendingScan_thenScannedMessage() {
        var session = activeSession(NOW.plusSeconds(3600));
        var scan = scan(1L, "tx-1", session);
        when(batchSessionRepository.findByUuid(SESSION_UUID)).thenReturn(Optional.of(session));
        when(verificationLogRepository.findAllByBatchSessionIdAndStatus(100L, VerificationStatus.INITIATED)).thenReturn(List.of(scan));
        when(verificationLogRepository.findAllByBatchSessionIdNewestFirst(100L)).thenReturn(List.of(scan));
        when(verifierApiClient.fetchResult("tx-1")).thenReturn(Optional.empty());

        var response = batchVerificationService.checkBatchStatus(SESSION_UUID);

        assertThat(response.results().get(0).status()).isEqualTo(VerificationStatusTypeDto.INITIATED);
        assertThat(response.results().get(0).message()).isEqualTo(BatchVerificationService.SCANNED_MESSAGE);
    }

    /**
     * A success whose person was deleted afterwards is reported per entry instead of failing the whole batch.
     */
    @Test
    void checkBatchStatus_orphanedSuccess_thenReportedAsMissingPerson() {
        var session = activeSession(NOW.plusSeconds(3600));
        var scan = scan(1L, "tx-1", session);
        scan.recordResult(true, "success", Map.of());
        scan.linkPerson(5L);
        scan.changeStatus(VerificationStatus.SUCCESS);
        when(batchSessionRepository.findByUuid(SESSION_UUID)).thenReturn(Optional.of(session));
        when(verificationLogRepository.findAllByBatchSessionIdAndStatus(100L, VerificationStatus.INITIATED)).thenReturn(List.of());
        when(verificationLogRepository.findAllByBatchSessionIdNewestFirst(100L)).thenReturn(List.of(scan));
        when(personRepository.findById(5L)).thenReturn(Optional.empty());

        var response = batchVerificationService.checkBatchStatus(SESSION_UUID);

        assertThat(response.results().get(0).status()).isEqualTo(VerificationStatusTypeDto.ERROR_MISSING_UUID);
        assertThat(response.results().get(0).message()).isEqualTo(BatchVerificationService.ORPHANED_MESSAGE);
        verifyNoInteractions(verifierApiClient);
    }

    @Test
    void checkBatchStatus_sessionPastExpiry_thenExpiredLazily() {
        var session = activeSession(NOW.minusSeconds(1));
        when(batchSessionRepository.findByUuid(SESSION_UUID)).thenReturn(Optional.of(session));
        when(batchSessionRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(session));
        when(verificationLogRepository.findAllByBatchSessionIdAndStatus(100L, VerificationStatus.INITIATED)).thenReturn(List.of());
        when(verificationLogRepository.findAllByBatchSessionIdNewestFirst(100L)).thenReturn(List.of());

        var response = batchVerificationService.checkBatchStatus(SESSION_UUID);

        assertThat(response.sessionInfo().status()).isEqualTo(BatchSessionStatusTypeDto.EXPIRED);
        assertThat(response.results()).isEmpty();
    }

    @Test
    void checkBatchStatus_unknownSession_thenNotFound() {
        when(batchSessionRepository.findByUuid(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> batchVerificationService.checkBatchStatus(SESSION_UUID))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private static BatchVerificationSession activeSession(Instant expiresAt) {
        return BatchVerificationSession.builder()
                .id(100L)
                .uuid(SESSION_UUID)
                .status(BatchVerificationStatus.ACTIVE)
                .expiresAt(expiresAt)
                .verifierInfo("Social services")
                .verifierBranch("Taipei branch")
                .verificationReason("Event entry")
                .build();
    }

    private VerificationLog scan(Long id, String transactionId, BatchVerificationSession session) {
        var scan = VerificationLog.builder()
                .id(id)
                .transactionId(transactionId)
                .status(VerificationStatus.INITIATED)
                .expiresAt(NOW.plusSeconds(300))
                .batchSession(session)
                .build();
        when(verificationLogRepository.findByIdForUpdate(id)).thenReturn(Optional.of(scan));
        return scan;
    }
}
