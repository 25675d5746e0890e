/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.admin;

import ch.admin.bj.swiyu.broker.api.admin.IssuanceLogViewDto;
import ch.admin.bj.swiyu.broker.api.admin.VerificationLogViewDto;
import ch.admin.bj.swiyu.broker.common.exception.ResourceNotFoundException;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLog;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialRepository;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import ch.admin.bj.swiyu.broker.domain.person.Person;
import ch.admin.bj.swiyu.broker.domain.person.PersonRepository;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationLogRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Read side of the issuance and verification audit trail.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    private final IssuanceLogRepository issuanceLogRepository;
    private final VerificationLogRepository verificationLogRepository;
    private final IssuedCredentialRepository issuedCredentialRepository;
    private final PersonRepository personRepository;
    private final Clock clock;

    /**
     * Shows an issuance transaction with its status derived at read time. A transaction whose claim
     * window lapsed is shown as expired even if no poll materialized the expiry yet.
     */
    @Transactional(readOnly = true)
    public IssuanceLogViewDto getIssuanceLog(Long issuanceLogId) {
        var issuanceLog = issuanceLogRepository.findWithCredentialById(issuanceLogId)
                .orElseThrow(() -> new ResourceNotFoundException("Issuance log " + issuanceLogId + " not found"));
        var credential = issuanceLog.getIssuedCredential();
        var person = credential.getPerson();
        var derived = deriveStatus(issuanceLog);

        return IssuanceLogViewDto.builder()
                .id(issuanceLog.getId())
                .transactionId(issuanceLog.getTransactionId())
                .status(derived.logStatus())
                .credentialStatus(derived.credentialStatus())
                .createdAt(issuanceLog.getAuditMetadata().getCreatedAt())
                .expiresAt(issuanceLog.getExpiresAt())
                .issuedAt(credential.getIssuedAt())
                .benefitLevel(credential.getBenefitLevel())
                .personName(person.getName())
                .county(person.getCounty())
                .district(person.getDistrict())
                .templateName(credential.getTemplate().getTemplateName())
                .cardImageUrl(credential.getTemplate().getCardImageUrl())
                .build();
    }

    @Transactional(readOnly = true)
    public VerificationLogViewDto getVerificationLog(Long verificationLogId) {
        var verificationLog = verificationLogRepository.findById(verificationLogId)
                .orElseThrow(() -> new ResourceNotFoundException("Verification log " + verificationLogId + " not found"));
        var person = verificationLog.getVerifiedPersonId() == null
                ? null
                : personRepository.findById(verificationLog.getVerifiedPersonId()).orElse(null);

        return VerificationLogViewDto.builder()
                .id(verificationLog.getId())
                .verifiedAt(verificationLog.getAuditMetadata().getCreatedAt())
                .agencyName(verificationLog.getVerifierBranch())
                .agencyType(verificationLog.getVerifierInfo())
                .purpose(verificationLog.getVerificationReason())
                .notes(verificationLog.getNotes())
                .status(verificationLog.getStatus().name().toLowerCase())
                .result(verificationLog.getVerifyResult())
                .personName(person == null ? null : person.getName())
                .personArea(person == null ? null : area(person))
                .verifiedIdentities(person == null ? List.of() : issuedTemplateNames(person))
                .build();
    }

    DerivedIssuanceStatus deriveStatus(IssuanceLog issuanceLog) {
        var credential = issuanceLog.getIssuedCredential();
        if (credential.getIssuedAt() != null) {
            return new DerivedIssuanceStatus("user_claimed", credential.getStatus().name().toLowerCase());
        }
        if (issuanceLog.hasExpirationTimeStampPassed(clock.instant())) {
            return new DerivedIssuanceStatus("expired", "expired");
        }
        return new DerivedIssuanceStatus("initiated", "issuing");
    }

    private List<String> issuedTemplateNames(Person person) {
        return issuedCredentialRepository.findAllWithTemplateByPersonIdAndStatus(person.getId(), IssuedCredentialStatus.ISSUED)
                .stream()
                .map(credential -> credential.getTemplate().getTemplateName())
                .toList();
    }

    private static String area(Person person) {
        var area = StringUtils.defaultString(person.getCounty()) + StringUtils.defaultString(person.getDistrict());
        return StringUtils.trimToNull(area);
    }

    record DerivedIssuanceStatus(String logStatus, String credentialStatus) {
    }
}
