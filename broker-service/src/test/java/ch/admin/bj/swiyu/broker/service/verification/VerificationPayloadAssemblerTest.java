package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.VerificationPayloadDto.VerifiedCredentialDto;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.person.PersonRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static ch.admin.bj.swiyu.broker.test.BrokerTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class VerificationPayloadAssemblerTest {

    @Mock
    private PersonRepository personRepository;
    @Mock
    private IssuedCredentialRepository issuedCredentialRepository;

    private VerificationPayloadAssembler assembler;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        assembler = new VerificationPayloadAssembler(personRepository, issuedCredentialRepository);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    /**
     * Happy path: person, contacts and every issued credential end up in the payload.
     */
    @Test
    void assemble_personWithTwoCredentials_thenFullPayload() {
        var person = person(5L, "P1");
        var lowIncome = credential(20L, person, template(1, "Low income"), IssuedCredentialStatus.ISSUED, "abc");
        var disability = credential(21L, person, template(2, "Disability"), IssuedCredentialStatus.ISSUED, "def");
        when(personRepository.findById(5L)).thenReturn(Optional.of(person));
        when(issuedCredentialRepository.findAllWithTemplateByPersonIdAndStatus(5L, IssuedCredentialStatus.ISSUED))
                .thenReturn(List.of(lowIncome, disability));

        var payload = assembler.assemble(5L, Map.of("verifyResult", true)).orElseThrow();

        assertThat(payload.person().name()).isEqualTo("Chen Mei-Ling");
        assertThat(payload.person().nationalId()).isEqualTo("A123456789");
        assertThat(payload.contact().emergencyContactRelationship()).isEqualTo("Son");
        assertThat(payload.reviewer().reviewerPhone()).isEqualTo("02-2720-8889");
        assertThat(payload.verifiedCredentials())
                .extracting(VerifiedCredentialDto::templateName)
                .containsExactly("Low income", "Disability");
        assertThat(payload.verifiedCredentials().get(1).cardImageUrl()).isEqualTo("https://cards.example/2.png");
        assertThat(payload.rawSandboxData()).containsEntry("verifyResult", true);
    }

    @Test
    void assemble_personWithoutCredentials_thenEmptyList() {
        when(personRepository.findById(5L)).thenReturn(Optional.of(person(5L, "P1")));
        when(issuedCredentialRepository.findAllWithTemplateByPersonIdAndStatus(5L, IssuedCredentialStatus.ISSUED)).thenReturn(List.of());

        assertThat(assembler.assemble(5L, Map.of()).orElseThrow().verifiedCredentials()).isEmpty();
    }

    @Test
    void assemble_deletedPerson_thenEmpty() {
        when(personRepository.findById(5L)).thenReturn(Optional.empty());

        assertThat(assembler.assemble(5L, Map.of())).isEmpty();
    }

    @Test
    void assemble_noLinkedPerson_thenEmpty() {
        assertThat(assembler.assemble(null, Map.of())).isEmpty();
        verifyNoInteractions(personRepository);
    }
}
