/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

import ch.admin.bj.swiyu.broker.api.issuance.AvailableTemplateDto;
import ch.admin.bj.swiyu.broker.api.issuance.IssuanceStatusResponseDto;
import ch.admin.bj.swiyu.broker.api.issuance.IssuanceStatusTypeDto;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogStatus;
import ch.admin.bj.swiyu.broker.domain.person.Person;
import ch.admin.bj.swiyu.broker.domain.person.VcTemplate;
import ch.admin.bj.swiyu.broker.service.sandbox.wallet.WalletFieldDto;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@UtilityClass
public class IssuanceMapper {

    public static AvailableTemplateDto toAvailableTemplateDto(VcTemplate template) {
        return AvailableTemplateDto.builder()
                .id(template.getId())
                .templateName(template.getTemplateName())
                .vcUid(template.getVcUid())
                .description(template.getDescription())
                .cardImageUrl(template.getCardImageUrl())
                .createdAt(template.getAuditMetadata().getCreatedAt())
                .build();
    }

    /**
     * Field values of a credential, in the order the wallet sandbox expects them.
     */
    public static Map<String, String> toIssuedData(Person person, String systemUuid, String benefitLevel) {
        var data = new LinkedHashMap<String, String>();
        data.put("name", StringUtils.defaultString(person.getName()));
        data.put("personalId", person.getPersonalId());
        data.put("system_uuid", systemUuid);
        data.put("benefitLevel", benefitLevel);
        data.put("emergencyContactName", StringUtils.defaultString(person.getEmergencyContactName()));
        data.put("emergencyContactRelationship", StringUtils.defaultString(person.getEmergencyContactRelationship()));
        data.put("emergencyContactPhone", StringUtils.defaultString(person.getEmergencyContactPhone()));
        data.put("reviewingAuthority", StringUtils.defaultString(person.getReviewingAuthority()));
        data.put("reviewerName", StringUtils.defaultString(person.getReviewerName()));
        // the sandbox rejects dashes in phone number fields
        data.put("reviewerPhone", StringUtils.remove(StringUtils.defaultString(person.getReviewerPhone()), '-'));
        return data;
    }

    public static List<WalletFieldDto> toWalletFields(Map<String, String> issuedData) {
        return issuedData.entrySet().stream()
                .map(entry -> new WalletFieldDto(entry.getKey(), StringUtils.defaultString(entry.getValue())))
                .toList();
    }

    public static IssuanceStatusResponseDto toStatusResponse(IssuanceLogStatus status) {
        return switch (status) {
            case USER_CLAIMED -> new IssuanceStatusResponseDto(IssuanceStatusTypeDto.ISSUED, "Credential claimed");
            case EXPIRED -> new IssuanceStatusResponseDto(IssuanceStatusTypeDto.EXPIRED, "Issuance expired");
            case INITIATED -> new IssuanceStatusResponseDto(IssuanceStatusTypeDto.INITIATED, "Credential not claimed yet");
        };
    }
}
