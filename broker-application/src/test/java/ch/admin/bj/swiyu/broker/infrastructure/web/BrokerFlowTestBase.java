package ch.admin.bj.swiyu.broker.infrastructure.web;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredential;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.person.*;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationSessionRepository;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationLogRepository;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.QueueDispatcher;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the application against an in-memory database, with both sandboxes served by one mock server.
 * Subclasses share the application context and the mock server.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
abstract class BrokerFlowTestBase {

    static final String WALLET_ACCESS_TOKEN = "wallet-token";
    static final String VERIFIER_ACCESS_TOKEN = "verifier-token";

    // https://square.github.io/okhttp/#mockwebserver
    protected static MockWebServer sandbox;

    @Autowired
    protected MockMvc mvc;
    @Autowired
    protected PersonRepository personRepository;
    @Autowired
    protected VcTemplateRepository templateRepository;
    @Autowired
    protected PersonEligibilityRepository eligibilityRepository;
    @Autowired
    protected IssuedCredentialRepository issuedCredentialRepository;
    @Autowired
    protected IssuanceLogRepository issuanceLogRepository;
    @Autowired
    protected VerificationLogRepository verificationLogRepository;
    @Autowired
    protected BatchVerificationSessionRepository batchSessionRepository;

    @DynamicPropertySource
    static void sandboxProperties(DynamicPropertyRegistry registry) {
        if (sandbox == null) {
            sandbox = new MockWebServer();
            try {
                sandbox.start();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        registry.add("sandbox.wallet.base-url", () -> sandbox.url("/").toString());
        registry.add("sandbox.wallet.api-key", () -> WALLET_ACCESS_TOKEN);
        registry.add("sandbox.verifier.base-url", () -> sandbox.url("/").toString());
        registry.add("sandbox.verifier.api-key", () -> VERIFIER_ACCESS_TOKEN);
    }

    @BeforeEach
    void resetState() throws InterruptedException {
        sandbox.setDispatcher(new QueueDispatcher());
        RecordedRequest leftover;
        do {
            leftover = sandbox.takeRequest(10, TimeUnit.MILLISECONDS);
        } while (leftover != null);

        verificationLogRepository.deleteAllInBatch();
        batchSessionRepository.deleteAllInBatch();
        issuanceLogRepository.deleteAllInBatch();
        issuedCredentialRepository.deleteAllInBatch();
        eligibilityRepository.deleteAllInBatch();
        personRepository.deleteAllInBatch();
        templateRepository.deleteAllInBatch();
    }

    protected void enqueueJson(int status, String body) {
        sandbox.enqueue(new MockResponse()
                .setResponseCode(status)
                .setHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .setBody(body));
    }

    protected RecordedRequest takeSandboxRequest() throws InterruptedException {
        return sandbox.takeRequest(1, TimeUnit.SECONDS);
    }

    protected void assertNoSandboxRequest() throws InterruptedException {
        assertThat(sandbox.takeRequest(100, TimeUnit.MILLISECONDS)).isNull();
    }

    protected VcTemplate seedTemplate(Integer id, String name) {
        return templateRepository.save(VcTemplate.builder()
                .id(id)
                .templateName(name)
                .vcUid("00000000_vc_" + id)
                .description(name)
                .cardImageUrl("https://cards.example/" + id + ".png")
                .build());
    }

    protected Person seedPerson(String personalId, String name) {
        return personRepository.save(Person.builder()
                .personalId(personalId)
                .nationalId("A" + personalId)
                .name(name)
                .county("Taipei City")
                .district("Xinyi District")
                .emergencyContactName("Wang Da-Ming")
                .emergencyContactRelationship("Spouse")
                .emergencyContactPhone("0922333444")
                .reviewingAuthority("Social Affairs Bureau")
                .reviewerName("Lin Hsiao-Wen")
                .reviewerPhone("02-2720-8889")
                .build());
    }

    protected void grantEligibility(Person person, VcTemplate template) {
        eligibilityRepository.save(PersonEligibility.builder().person(person).template(template).build());
    }

    protected IssuedCredential seedIssuedCredential(Person person, VcTemplate template, String cid) {
        return issuedCredentialRepository.save(IssuedCredential.builder()
                .systemUuid(UUID.randomUUID().toString().replace('-', '_'))
                .person(person)
                .template(template)
                .status(IssuedCredentialStatus.ISSUED)
                .cid(cid)
                .issuedData(Map.of("personalId", person.getPersonalId()))
                .benefitLevel("NA")
                .issuedAt(Instant.now())
                .build());
    }
}
