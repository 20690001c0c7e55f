package com.adaptiv.healthservice.controllers;

import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.support.IntegrationTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiFlowTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void loginReturnsSnakeCaseTokens() throws Exception {
        patient("pat@example.com");

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials("pat@example.com", PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").isNotEmpty())
                .andExpect(jsonPath("$.refresh_token").isNotEmpty())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.expires_in").value(1800));
    }

    @Test
    void repeatedBadPasswordsEndInLockedResponse() throws Exception {
        patient("pat@example.com");

        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/api/v1/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(credentials("pat@example.com", "wrong-password")))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
        }

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials("pat@example.com", PASSWORD)))
                .andExpect(status().isLocked())
                .andExpect(header().string("Retry-After", "900"))
                .andExpect(jsonPath("$.code").value("ACCOUNT_LOCKED"))
                .andExpect(jsonPath("$.retry_after_seconds").value(900));
    }

    @Test
    void resetRequestAnswersTheSameForUnknownEmail() throws Exception {
        mockMvc.perform(post("/api/v1/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"nobody@example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void resetConfirmIsPublicAndRejectsBadTokenWith400() throws Exception {
        mockMvc.perform(post("/api/v1/auth/reset-password/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"not-a-token\",\"new_password\":\"a-brand-new-password\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TOKEN_INVALID"));
    }

    @Test
    void healthCheckIsPublic() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database").value("UP"));
    }

    @Test
    void protectedEndpointWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/vitals/latest"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_INVALID"));
    }

    @Test
    void refreshTokenIsNotAcceptedAsBearer() throws Exception {
        patient("pat@example.com");
        String refreshToken = JsonPath.read(login("pat@example.com").getResponse().getContentAsString(),
                "$.refresh_token");

        mockMvc.perform(get("/api/v1/auth/me").header("Authorization", "Bearer " + refreshToken))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void vitalsFlowRespectsConsentAndAdminExclusion() throws Exception {
        Account patient = patient("pat@example.com");
        clinician("doc@example.com");
        admin("root@example.com");

        String patientToken = accessToken("pat@example.com");
        String clinicianToken = accessToken("doc@example.com");
        String adminToken = accessToken("root@example.com");

        mockMvc.perform(post("/api/v1/vitals")
                        .header("Authorization", "Bearer " + patientToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"heart_rate\":190,\"spo2\":99,\"systolic_bp\":120}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.reading_id").isNumber())
                .andExpect(jsonPath("$.alerts_created").value(1));

        String latestPath = "/api/v1/vitals/user/" + patient.getAccountId() + "/latest";

        mockMvc.perform(get(latestPath).header("Authorization", "Bearer " + clinicianToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.heart_rate").value(190));

        mockMvc.perform(get(latestPath).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN_ADMIN_EXCLUDED"));

        mockMvc.perform(post("/api/v1/consent/disable")
                        .header("Authorization", "Bearer " + patientToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Switching providers\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.share_state").value("DISABLE_REQUESTED"));

        mockMvc.perform(get("/api/v1/consent/pending").header("Authorization", "Bearer " + clinicianToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(get(latestPath).header("Authorization", "Bearer " + clinicianToken))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/consent/" + patient.getAccountId() + "/review")
                        .header("Authorization", "Bearer " + clinicianToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"APPROVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.share_state").value("OFF"));

        mockMvc.perform(get(latestPath).header("Authorization", "Bearer " + clinicianToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN_CONSENT"));

        mockMvc.perform(get("/api/v1/vitals/latest").header("Authorization", "Bearer " + patientToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.heart_rate").value(190));
    }

    @Test
    void patientCannotAcknowledgeAnotherPatientsAlert() throws Exception {
        patient("one@example.com");
        patient("two@example.com");
        String firstToken = accessToken("one@example.com");
        String secondToken = accessToken("two@example.com");

        mockMvc.perform(post("/api/v1/vitals")
                        .header("Authorization", "Bearer " + firstToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"heart_rate\":72,\"spo2\":85}"))
                .andExpect(status().isCreated());

        MvcResult alerts = mockMvc.perform(get("/api/v1/alerts").header("Authorization", "Bearer " + firstToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andReturn();
        Number alertId = JsonPath.read(alerts.getResponse().getContentAsString(), "$.items[0].alert_id");

        mockMvc.perform(patch("/api/v1/alerts/" + alertId + "/acknowledge")
                        .header("Authorization", "Bearer " + secondToken))
                .andExpect(status().isForbidden());

        mockMvc.perform(patch("/api/v1/alerts/" + alertId + "/acknowledge")
                        .header("Authorization", "Bearer " + firstToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledged").value(true));
    }

    @Test
    void outOfRangeReadingIsValidationError() throws Exception {
        patient("pat@example.com");

        mockMvc.perform(post("/api/v1/vitals")
                        .header("Authorization", "Bearer " + accessToken("pat@example.com"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"heart_rate\":400}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field_errors.heartRate").exists());
    }

    private String accessToken(String email) throws Exception {
        return JsonPath.read(login(email).getResponse().getContentAsString(), "$.access_token");
    }

    private MvcResult login(String email) throws Exception {
        return mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(email, PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
    }

    private static String credentials(String email, String password) {
        return "{\"email\":\"" + email + "\",\"password\":\"" + password + "\"}";
    }
}
