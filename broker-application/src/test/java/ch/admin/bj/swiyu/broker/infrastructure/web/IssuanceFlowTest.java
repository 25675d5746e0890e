package ch.admin.bj.swiyu.broker.infrastructure.web;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuanceLogStatus;
import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import static ch.admin.bj.swiyu.broker.infrastructure.web.IssuanceController.SIMULATION_TOKEN_HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IssuanceFlowTest extends BrokerFlowTestBase {

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * Happy path: simulation start, credential offer, pending poll, claim and a poll answered from the database.
     */
    @Test
    void simulateIssuance_thenCredentialClaimedWithCid() throws Exception {
        var template = seedTemplate(1, "Low income household");
        seedTemplate(2, "Disability");
        var person = seedPerson("F100000001", "Chen Mei-Ling");
        grantEligibility(person, template);

        var start = mvc.perform(post("/api/issuance/start-simulation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.person.id").value(String.valueOf(person.getId())))
                .andExpect(jsonPath("$.person.name").value("Chen Mei-Ling"))
                .andExpect(jsonPath("$.availableTemplates.length()").value(1))
                .andExpect(jsonPath("$.availableTemplates[0].templateName").value("Low income household"))
                .andReturn();
        String token = JsonPath.read(start.getResponse().getContentAsString(), "$.simulationToken");

        enqueueJson(200, """
                {"transactionId":"tx-flow-1","qrCode":"data:image/png;base64,AAA","deepLink":"modadigitalwallet://offer?tx=1"}
                """);
        mvc.perform(post("/api/issuance/request-credential")
                        .header(SIMULATION_TOKEN_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionId").value("tx-flow-1"))
                .andExpect(jsonPath("$.deepLink").value("modadigitalwallet://offer?tx=1"));

        var offerRequest = takeSandboxRequest();
        assertThat(offerRequest.getPath()).isEqualTo("/api/qrcode/data");
        assertThat(offerRequest.getHeader("Access-Token")).isEqualTo(WALLET_ACCESS_TOKEN);
        var offerBody = objectMapper.readTree(offerRequest.getBody().readUtf8());
        assertThat(offerBody.get("vcUid").asText()).isEqualTo("00000000_vc_1");
        assertThat(offerBody.get("expiredDate").asText()).isEqualTo("20301231");

        enqueueJson(400, """
                {"code":"61010","message":"credential not claimed"}
                """);
        mvc.perform(get("/api/issuance/status/tx-flow-1").header(SIMULATION_TOKEN_HEADER, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("initiated"));

        var jwt = new PlainJWT(new JWTClaimsSet.Builder().jwtID("https://wallet.example/api/credential/abc123").build());
        enqueueJson(200, "{\"credential\":\"" + jwt.serialize() + "\"}");
        mvc.perform(get("/api/issuance/status/tx-flow-1").header(SIMULATION_TOKEN_HEADER, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("issued"));

        var requestCount = sandbox.getRequestCount();
        mvc.perform(get("/api/issuance/status/tx-flow-1").header(SIMULATION_TOKEN_HEADER, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("issued"));
        assertThat(sandbox.getRequestCount()).isEqualTo(requestCount);

        var credentials = issuedCredentialRepository.findAllWithTemplateByPersonIdAndStatus(person.getId(), IssuedCredentialStatus.ISSUED);
        assertThat(credentials).hasSize(1);
        assertThat(credentials.get(0).getCid()).isEqualTo("abc123");
        assertThat(credentials.get(0).getIssuedData()).containsEntry("reviewerPhone", "0227208889");
        assertThat(issuanceLogRepository.findAll()).singleElement()
                .satisfies(issuanceLog -> assertThat(issuanceLog.getStatus()).isEqualTo(IssuanceLogStatus.USER_CLAIMED));
    }

    /**
     * A failing wallet sandbox leaves no credential attempt behind.
     */
    @Test
    void requestCredential_sandboxError_thenBadGatewayAndNothingStored() throws Exception {
        var template = seedTemplate(1, "Low income household");
        var person = seedPerson("F100000002", "Lin Chih-Hao");
        grantEligibility(person, template);
        String token = JsonPath.read(mvc.perform(post("/api/issuance/start-simulation"))
                .andReturn().getResponse().getContentAsString(), "$.simulationToken");

        enqueueJson(500, """
                {"code":"500","message":"internal error"}
                """);
        mvc.perform(post("/api/issuance/request-credential")
                        .header(SIMULATION_TOKEN_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": 1}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.upstream_error").value(containsString("internal error")));

        assertThat(issuedCredentialRepository.count()).isZero();
        assertThat(issuanceLogRepository.count()).isZero();
    }

    @Test
    void requestCredential_walletRejectsApiKey_thenBadGatewayCarriesSandboxBody() throws Exception {
        var template = seedTemplate(1, "Low income household");
        var person = seedPerson("F100000003", "Huang Yu-Ting");
        grantEligibility(person, template);
        String token = JsonPath.read(mvc.perform(post("/api/issuance/start-simulation"))
                .andReturn().getResponse().getContentAsString(), "$.simulationToken");

        enqueueJson(401, """
                {"code":"401","message":"invalid token"}
                """);
        mvc.perform(post("/api/issuance/request-credential")
                        .header(SIMULATION_TOKEN_HEADER, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": 1}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.upstream_error").value(containsString("invalid token")));

        assertThat(issuanceLogRepository.count()).isZero();
    }

    @Test
    void requestCredential_withoutSimulationToken_thenUnauthorized() throws Exception {
        mvc.perform(post("/api/issuance/request-credential")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": 1}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void requestCredential_withoutTemplateId_thenBadRequest() throws Exception {
        mvc.perform(post("/api/issuance/request-credential")
                        .header(SIMULATION_TOKEN_HEADER, "irrelevant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(startsWith("templateId:")));
    }

    @Test
    void startSimulation_noPersonLeft_thenNotFound() throws Exception {
        mvc.perform(post("/api/issuance/start-simulation"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("No simulated person without issued credential left"));
    }

    @Test
    void pollStatus_unknownTransaction_thenNotFound() throws Exception {
        seedPerson("F100000003", "Huang Ya-Ting");
        String token = JsonPath.read(mvc.perform(post("/api/issuance/start-simulation"))
                .andReturn().getResponse().getContentAsString(), "$.simulationToken");

        mvc.perform(get("/api/issuance/status/unknown").header(SIMULATION_TOKEN_HEADER, token))
                .andExpect(status().isNotFound());
    }
}
