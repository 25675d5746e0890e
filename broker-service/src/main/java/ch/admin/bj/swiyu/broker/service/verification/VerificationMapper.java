/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.verification;

import ch.admin.bj.swiyu.broker.api.verification.BatchSessionInfoDto;
import ch.admin.bj.swiyu.broker.api.verification.BatchSessionStatusTypeDto;
import ch.admin.bj.swiyu.broker.api.verification.VerificationStatusTypeDto;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationSession;
import ch.admin.bj.swiyu.broker.domain.verification.BatchVerificationStatus;
import ch.admin.bj.swiyu.broker.domain.verification.VerificationStatus;
import lombok.experimental.UtilityClass;

@UtilityClass
public class VerificationMapper {

    public static VerificationStatusTypeDto toVerificationStatusTypeDto(VerificationStatus status) {
        return switch (status) {
            case INITIATED -> VerificationStatusTypeDto.INITIATED;
            case SUCCESS -> VerificationStatusTypeDto.SUCCESS;
            case FAILED -> VerificationStatusTypeDto.FAILED;
            case EXPIRED -> VerificationStatusTypeDto.EXPIRED;
            case ERROR_MISSING_UUID -> VerificationStatusTypeDto.ERROR_MISSING_UUID;
        };
    }

    public static BatchSessionStatusTypeDto toBatchSessionStatusTypeDto(BatchVerificationStatus status) {
        return switch (status) {
            case ACTIVE -> BatchSessionStatusTypeDto.ACTIVE;
            case CLOSED -> BatchSessionStatusTypeDto.CLOSED;
            case EXPIRED -> BatchSessionStatusTypeDto.EXPIRED;
        };
    }

    public static BatchSessionInfoDto toBatchSessionInfoDto(BatchVerificationSession session) {
        return BatchSessionInfoDto.builder()
                .verifierInfo(session.getVerifierInfo())
                .verifierBranch(session.getVerifierBranch())
                .verificationReason(session.getVerificationReason())
                .notes(session.getNotes())
                .status(toBatchSessionStatusTypeDto(session.getStatus()))
                .expiresAt(session.getExpiresAt())
                .build();
    }
}
