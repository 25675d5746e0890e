package ch.admin.bj.swiyu.broker.service.sandbox.verifier;

import ch.admin.bj.swiyu.broker.common.config.SandboxProperties;
import ch.admin.bj.swiyu.broker.common.exception.SandboxApiException;
import ch.admin.bj.swiyu.broker.service.sandbox.SandboxClientConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerifierApiClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockWebServer;
    private VerifierApiClient verifierApiClient;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        var properties = new SandboxProperties.ClientProperties(
                mockWebServer.url("/").toString(), "verifier-key", "Authorization", "Bearer", Duration.ofSeconds(5));
        verifierApiClient = new VerifierApiClient(
                SandboxClientConfig.createRestClient(RestClient.builder(), properties, "Verifier"), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void createQrCode_thenQueryParametersAndSchemeSent() throws Exception {
        enqueueJson(200, """
                {"transactionId":"tx-1","qrcodeImage":"data:image/png;base64,AAA","authUri":"modadigitalwallet://authorize?x=1"}
                """);

        var response = verifierApiClient.createQrCode("00000000_template001", "tx-1");

        assertThat(response.authUri()).isEqualTo("modadigitalwallet://authorize?x=1");
        var request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/oidvp/qrcode?ref=00000000_template001&transactionId=tx-1");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer verifier-key");
    }

    /**
     * Happy path: the typed result exposes the personal id and the raw document is kept for the audit trail.
     */
    @Test
    void fetchResult_finished_thenTypedAndRawResult() throws Exception {
        enqueueJson(200, """
                {
                  "verifyResult": true,
                  "resultDescription": "success",
                  "transactionId": "tx-1",
                  "data": [{
                    "credentialType": "LowIncomeCard",
                    "claims": [
                      {"ename": "name", "cname": "Name", "value": "Chen Mei-Ling"},
                      {"ename": "personalId", "cname": "Personal id", "value": "P1"}
                    ]
                  }]
                }
                """);

        var result = verifierApiClient.fetchResult("tx-1").orElseThrow();

        assertThat(result.result().verifyResult()).isTrue();
        assertThat(result.result().findPersonalId()).contains("P1");
        assertThat(result.rawData()).containsEntry("resultDescription", "success");
        var request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/oidvp/result");
        assertThat(objectMapper.readTree(request.getBody().readUtf8()).get("transactionId").asText()).isEqualTo("tx-1");
    }

    @Test
    void fetchResult_pendingWithNestedParams_thenEmpty() {
        enqueueJson(400, """
                {"code":"400","params":{"code":4002,"message":"not presented"}}
                """);

        assertThat(verifierApiClient.fetchResult("tx-1")).isEmpty();
    }

    @Test
    void fetchResult_pendingWithSerializedParams_thenEmpty() {
        enqueueJson(400, """
                {"code":"400","params":"{\\"code\\":\\"4002\\"}"}
                """);

        assertThat(verifierApiClient.fetchResult("tx-1")).isEmpty();
    }

    @Test
    void fetchResult_otherBadRequest_thenSandboxApiException() {
        enqueueJson(400, """
                {"code":"400","params":{"code":4001}}
                """);

        assertThatThrownBy(() -> verifierApiClient.fetchResult("tx-1"))
                .isInstanceOfSatisfying(SandboxApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(400));
    }

    @Test
    void fetchResult_withoutPersonalId_thenEmptyPersonalId() {
        enqueueJson(200, """
                {"verifyResult": true, "data": [{"claims": [{"ename": "name", "value": "x"}]}]}
                """);

        var result = verifierApiClient.fetchResult("tx-1").orElseThrow();

        assertThat(result.result().findPersonalId()).isEmpty();
    }

    private void enqueueJson(int status, String body) {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(status)
                .setHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .setBody(body));
    }
}
