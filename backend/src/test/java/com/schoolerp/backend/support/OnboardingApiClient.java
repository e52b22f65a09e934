package com.schoolerp.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schoolerp.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

/**
 * HTTP helpers shared by the onboarding integration tests.
 */
public class OnboardingApiClient {

    private final MockMvc mockMvc;
    private final ObjectMapper objectMapper;
    private final JwtTokenProvider tokenProvider;
    private final MutableClock clock;

    public OnboardingApiClient(MockMvc mockMvc, ObjectMapper objectMapper, JwtTokenProvider tokenProvider, MutableClock clock) {
        this.mockMvc = mockMvc;
        this.objectMapper = objectMapper;
        this.tokenProvider = tokenProvider;
        this.clock = clock;
    }

    public RegisteredSchool registerSchool(String schoolName, String adminEmail) throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/schools")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "schoolName": "%s",
                                          "admin": {
                                            "name": "Admin of %s",
                                            "email": "%s",
                                            "password": "admin-pass-1"
                                          }
                                        }
                                        """.formatted(schoolName, schoolName, adminEmail))
                )
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return new RegisteredSchool(
                UUID.fromString(body.path("id").asText()),
                UUID.fromString(body.path("adminUserId").asText()),
                body.path("joinCode").asText(),
                body.path("codeExpiresAt").asText()
        );
    }

    public ResultActions join(String joinCode, String name, String email) throws Exception {
        return mockMvc.perform(
                post("/onboarding/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "joinCode": "%s",
                                  "name": "%s",
                                  "email": "%s",
                                  "password": "staff-pass-1"
                                }
                                """.formatted(joinCode, name, email))
        );
    }

    public UUID joinAndReturnUserId(String joinCode, String name, String email) throws Exception {
        MvcResult result = join(joinCode, name, email)
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).path("userId").asText());
    }

    public String adminAuthorization(RegisteredSchool school) {
        return authorization(school.adminUserId(), school.schoolId(), List.of("ADMIN"));
    }

    public String authorization(UUID userId, UUID schoolId, List<String> roles) {
        return TestTokens.bearer(TestTokens.accessToken(tokenProvider.getSecretKey(), clock.instant(), userId, schoolId, roles));
    }

    public static String decisionBody(String action) {
        return """
                {
                  "action": "%s"
                }
                """.formatted(action);
    }

    public record RegisteredSchool(UUID schoolId, UUID adminUserId, String joinCode, String codeExpiresAt) {
    }
}
