/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

import ch.admin.bj.swiyu.broker.api.issuance.*;
import ch.admin.bj.swiyu.broker.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.broker.common.exception.BadRequestException;
import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.common.exception.UpstreamContractException;
import ch.admin.bj.swiyu.broker.domain.issuance.*;
import ch.admin.bj.swiyu.broker.domain.person.*;
import ch.admin.bj.swiyu.broker.service.sandbox.wallet.WalletApiClient;
import ch.admin.bj.swiyu.broker.service.sandbox.wallet.WalletIssueRequestDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static ch.admin.bj.swiyu.broker.service.issuance.IssuanceMapper.*;

/**
 * Drives a simulated person from eligibility to a claimed (or expired) credential on the wallet sandbox.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssuanceService {

    private final PersonRepository personRepository;
    private final VcTemplateRepository templateRepository;
    private final PersonEligibilityRepository eligibilityRepository;
    private final IssuedCredentialRepository issuedCredentialRepository;
    private final IssuanceLogRepository issuanceLogRepository;
    private final IssuanceTransitionService transitionService;
    private final WalletApiClient walletApiClient;
    private final CredentialTokenParser credentialTokenParser;
    private final BenefitLevelAssigner benefitLevelAssigner;
    private final SimulationTokenService simulationTokenService;
    private final ApplicationProperties applicationProperties;
    private final Clock clock;

    /**
     * Picks a random person not holding any issued credential yet and lists the templates they may claim.
     *
     * @throws ResourceNotFoundException if every person already holds an issued credential
     */
    @Transactional(readOnly = true)
    public StartSimulationResponseDto startSimulation() {
        var candidates = personRepository.findAllWithoutCredentialInStatus(IssuedCredentialStatus.ISSUED);
        if (candidates.isEmpty()) {
            throw new ResourceNotFoundException("No simulated person without issued credential left");
        }
        var person = candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));

        var availableTemplateIds = new HashSet<>(eligibilityRepository.findTemplateIdsByPersonId(person.getId()));
        issuedCredentialRepository.findTemplateIdsByPersonIdAndStatus(person.getId(), IssuedCredentialStatus.ISSUED)
                .forEach(availableTemplateIds::remove);

        var availableTemplates = availableTemplateIds.isEmpty()
                ? List.<AvailableTemplateDto>of()
                : templateRepository.findAllById(availableTemplateIds).stream()
                .sorted(Comparator.comparing(VcTemplate::getId))
                .map(IssuanceMapper::toAvailableTemplateDto)
                .toList();

        log.info("Simulation started for person {} with {} available template(s)", person.getId(), availableTemplates.size());
        return new StartSimulationResponseDto(
                new SimulationPersonDto(String.valueOf(person.getId()), person.getName()),
                availableTemplates,
                simulationTokenService.createToken(person.getId()));
    }

    /**
     * Offers a credential of the template to the person on the wallet sandbox.
     * <p>
     * The credential row, the sandbox call and the log row form one unit: if the sandbox fails or answers
     * incompletely the transaction is rolled back and no {@code ISSUING} credential is left behind.
     */
    @Transactional
    public CredentialOfferResponseDto requestCredential(Long personId, Integer templateId) {
        var person = personRepository.findById(personId)
                .orElseThrow(() -> new ResourceNotFoundException("Person " + personId + " not found"));
        var template = templateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("Template " + templateId + " not found"));
        if (StringUtils.isBlank(template.getVcUid())) {
            throw new BadRequestException("Template " + templateId + " is incomplete, vcUid is missing");
        }
        if (!eligibilityRepository.existsByPersonIdAndTemplateId(personId, templateId)) {
            throw new BadRequestException("Person " + personId + " is not eligible for template " + templateId);
        }

        var systemUuid = UUID.randomUUID().toString().replace('-', '_');
        var benefitLevel = benefitLevelAssigner.assign(templateId);
        var issuedData = toIssuedData(person, systemUuid, benefitLevel);

        var credential = issuedCredentialRepository.save(IssuedCredential.builder()
                .systemUuid(systemUuid)
                .person(person)
                .template(template)
                .status(IssuedCredentialStatus.ISSUING)
                .issuedData(issuedData)
                .benefitLevel(benefitLevel)
                .build());

        var offer = walletApiClient.issue(WalletIssueRequestDto.builder()
                .vcUid(template.getVcUid())
                .issuanceDate(LocalDate.now(clock).format(DateTimeFormatter.BASIC_ISO_DATE))
                .expiredDate(applicationProperties.getCredentialExpiredDate())
                .fields(toWalletFields(issuedData))
                .build());

        issuanceLogRepository.save(IssuanceLog.builder()
                .transactionId(offer.transactionId())
                .status(IssuanceLogStatus.INITIATED)
                .expiresAt(clock.instant().plus(applicationProperties.getIssuanceClaimWindow()))
                .issuedCredential(credential)
                .build());

        log.info("Credential offer {} created for person {} and template {}", offer.transactionId(), personId, templateId);
        return CredentialOfferResponseDto.builder()
                .transactionId(offer.transactionId())
                .qrCode(offer.qrCode())
                .deepLink(offer.deepLink())
                .build();
    }

    /**
     * Reconciles an issuance transaction with the wallet sandbox.
     * Terminal transactions are answered from the database without contacting the sandbox.
     *
     * @throws ResourceNotFoundException if the transaction does not exist or belongs to another person
     */
    public IssuanceStatusResponseDto pollStatus(Long personId, String transactionId) {
        var issuanceLog = issuanceLogRepository.findByTransactionIdAndPersonId(transactionId, personId)
                .orElseThrow(() -> new ResourceNotFoundException("Issuance " + transactionId + " not found"));

        if (issuanceLog.getStatus().isTerminalState()) {
            return toStatusResponse(issuanceLog.getStatus());
        }
        if (issuanceLog.hasExpirationTimeStampPassed(clock.instant())) {
            return toStatusResponse(transitionService.expire(issuanceLog.getId()));
        }

        var credential = walletApiClient.fetchCredential(transactionId);
        if (credential.isEmpty()) {
            return toStatusResponse(IssuanceLogStatus.INITIATED);
        }
        var cid = credentialTokenParser.extractCredentialId(credential.get())
                .orElseThrow(() -> new UpstreamContractException("Claimed credential of " + transactionId + " carries no credential id"));
        return toStatusResponse(transitionService.claim(issuanceLog.getId(), cid));
    }
}
