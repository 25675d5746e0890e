/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.verifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VerifierResultDto(
        Boolean verifyResult,
        String resultDescription,
        String transactionId,
        List<VerifierCredentialDataDto> data) {

    /**
     * Claim name under which issued credentials carry the personal id of the holder.
     */
    public static final String PERSONAL_ID_CLAIM = "personalId";

    /**
     * Looks for the personal id among the claims of the first presented credential.
     */
    public Optional<String> findPersonalId() {
        if (data == null || data.isEmpty() || data.get(0) == null || data.get(0).claims() == null) {
            return Optional.empty();
        }
        return data.get(0).claims().stream()
                .filter(Objects::nonNull)
                .filter(claim -> PERSONAL_ID_CLAIM.equals(claim.ename()))
                .map(VerifierClaimDto::value)
                .filter(value -> value != null && !value.isEmpty())
                .findFirst();
    }
}
