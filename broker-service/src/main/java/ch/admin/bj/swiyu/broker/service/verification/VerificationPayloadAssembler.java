/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.VerificationPayloadDto;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredential;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.person.Person;
import ch.admin.bj.swiyu.broker.domain.person.PersonRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

import static ch.admin.bj.swiyu.broker.api.verification.VerificationPayloadDto.*;

/**
 * Builds the answer of a successful verification from the current state of the verified person.
 */
@Component
@RequiredArgsConstructor
public class VerificationPayloadAssembler {

    private final PersonRepository personRepository;
    private final IssuedCredentialRepository issuedCredentialRepository;

    /**
     * @param personId      id of the verified person
     * @param rawSandboxData verifier response as received
     * @return the payload, or empty if the person no longer exists
     */
    @Transactional(readOnly = true)
    public Optional<VerificationPayloadDto> assemble(Long personId, Map<String, Object> rawSandboxData) {
        if (personId == null) {
            return Optional.empty();
        }
        return personRepository.findById(personId)
                .map(person -> toPayload(person, rawSandboxData));
    }

    private VerificationPayloadDto toPayload(Person person, Map<String, Object> rawSandboxData) {
        var credentials = issuedCredentialRepository
                .findAllWithTemplateByPersonIdAndStatus(person.getId(), IssuedCredentialStatus.ISSUED)
                .stream()
                .map(VerificationPayloadAssembler::toVerifiedCredential)
                .toList();

        return VerificationPayloadDto.builder()
                .person(new PersonInfoDto(person.getName(), person.getNationalId()))
                .contact(new EmergencyContactDto(
                        person.getEmergencyContactName(),
                        person.getEmergencyContactRelationship(),
                        person.getEmergencyContactPhone()))
                .reviewer(new ReviewerDto(
                        person.getReviewingAuthority(),
                        person.getReviewerName(),
                        person.getReviewerPhone()))
                .verifiedCredentials(credentials)
                .rawSandboxData(rawSandboxData)
                .build();
    }

    private static VerifiedCredentialDto toVerifiedCredential(IssuedCredential credential) {
        return new VerifiedCredentialDto(
                credential.getTemplate().getTemplateName(),
                credential.getBenefitLevel(),
                credential.getTemplate().getCardImageUrl());
    }
}
