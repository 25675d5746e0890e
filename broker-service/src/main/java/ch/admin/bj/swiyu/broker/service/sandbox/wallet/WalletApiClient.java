/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.wallet;

import ch.admin.bj.swiyu.broker.common.exception.SandboxApiException;
import ch.admin.bj.swiyu.broker.common.exception.UpstreamContractException;
import ch.admin.bj.swiyu.broker.service.sandbox.SandboxErrorBodies;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Optional;

/**
 * Client of the wallet sandbox, responsible for offering, fetching and revoking credentials.
 */
@Slf4j
@Service
public class WalletApiClient {

    /**
     * Code the wallet sandbox answers with while the holder has not claimed the credential yet.
     */
    public static final String CREDENTIAL_NOT_CLAIMED_CODE = "61010";

    private static final String REVOKED = "REVOKED";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public WalletApiClient(@Qualifier("walletRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a credential offer with the given field values.
     *
     * @return transaction id, QR code and deeplink of the offer, all guaranteed to be present
     * @throws SandboxApiException       if the sandbox call failed
     * @throws UpstreamContractException if the sandbox answered with an incomplete offer
     */
    public WalletIssueResponseDto issue(WalletIssueRequestDto request) {
        WalletIssueResponseDto response;
        try {
            log.debug("Requesting credential offer for vcUid {}", request.vcUid());
            response = restClient.post()
                    .uri("/api/qrcode/data")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(WalletIssueResponseDto.class);
        } catch (RestClientResponseException e) {
            throw toSandboxApiException("Issuing credential offer failed", e);
        } catch (RestClientException e) {
            throw new SandboxApiException("Wallet sandbox not reachable", e);
        }

        if (response == null
                || StringUtils.isAnyBlank(response.transactionId(), response.qrCode(), response.deepLink())) {
            throw new UpstreamContractException("Wallet sandbox returned an incomplete credential offer");
        }
        return response;
    }

    /**
     * Fetches the credential of an offer.
     *
     * @return the credential JWT, or empty while the holder has not claimed the credential
     * @throws SandboxApiException       if the sandbox call failed for another reason
     * @throws UpstreamContractException if the sandbox answered without credential
     */
    public Optional<String> fetchCredential(String transactionId) {
        WalletCredentialResponseDto response;
        try {
            response = restClient.get()
                    .uri("/api/credential/nonce/{transactionId}", transactionId)
                    .retrieve()
                    .body(WalletCredentialResponseDto.class);
        } catch (RestClientResponseException e) {
            if (isNotClaimedYet(e.getResponseBodyAsString())) {
                log.debug("Credential of transaction {} not claimed yet", transactionId);
                return Optional.empty();
            }
            throw toSandboxApiException("Fetching credential failed", e);
        } catch (RestClientException e) {
            throw new SandboxApiException("Wallet sandbox not reachable", e);
        }

        if (response != null && CREDENTIAL_NOT_CLAIMED_CODE.equals(response.code())) {
            return Optional.empty();
        }
        if (response == null || StringUtils.isBlank(response.credential())) {
            throw new UpstreamContractException("Wallet sandbox answered without credential for transaction " + transactionId);
        }
        return Optional.of(response.credential());
    }

    /**
     * Revokes a claimed credential.
     *
     * @throws SandboxApiException       if the sandbox call failed
     * @throws UpstreamContractException if the sandbox did not confirm the revocation
     */
    public void revoke(String cid) {
        WalletRevocationResponseDto response;
        try {
            response = restClient.put()
                    .uri("/api/credential/{cid}/revocation", cid)
                    .retrieve()
                    .body(WalletRevocationResponseDto.class);
        } catch (RestClientResponseException e) {
            throw toSandboxApiException("Revoking credential " + cid + " failed", e);
        } catch (RestClientException e) {
            throw new SandboxApiException("Wallet sandbox not reachable", e);
        }

        if (response == null || !REVOKED.equalsIgnoreCase(response.credentialStatus())) {
            throw new UpstreamContractException("Wallet sandbox did not confirm revocation of credential " + cid);
        }
        log.info("Credential {} revoked on wallet sandbox", cid);
    }

    private boolean isNotClaimedYet(String body) {
        return SandboxErrorBodies.readCode(objectMapper, body)
                .filter(CREDENTIAL_NOT_CLAIMED_CODE::equals)
                .isPresent();
    }

    private static SandboxApiException toSandboxApiException(String message, RestClientResponseException e) {
        log.error("{}. Wallet sandbox responded with {}: {}", message, e.getStatusCode(), e.getResponseBodyAsString());
        return new SandboxApiException(
                String.format("%s. Wallet sandbox responded with %s", message, e.getStatusCode()),
                e.getStatusCode().value(),
                e.getResponseBodyAsString());
    }
}
