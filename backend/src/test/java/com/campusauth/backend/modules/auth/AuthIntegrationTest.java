package com.campusauth.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.domain.Role;
import com.campusauth.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void seededAdminCanLogInAndVerify() throws Exception {
        JsonNode tokens = login("admin", "admin");

        assertThat(tokens.path("token_type").asText()).isEqualTo("bearer");
        assertThat(tokens.path("expires_in").asLong()).isEqualTo(1800L);
        assertThat(tokens.path("refresh_token").asText()).hasSizeGreaterThan(80);

        mockMvc.perform(post("/auth/verify").header("Authorization", bearer(tokens)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("admin"))
                .andExpect(jsonPath("$.user_id").isNotEmpty())
                .andExpect(jsonPath("$.permissions.length()").value(10));
    }

    @Test
    void loginThenVerifyReturnsTheSameUser() throws Exception {
        CampusUser student = testUserFactory.createUser(Role.STUDENT, "student-pass");
        JsonNode tokens = login(student.getLogin(), "student-pass");

        mockMvc.perform(post("/auth/verify").header("Authorization", bearer(tokens)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(student.getId().toString()))
                .andExpect(jsonPath("$.role").value("student"))
                .andExpect(jsonPath("$.permissions[?(@ == 'users:read')]").isEmpty());
    }

    @Test
    void wrongPasswordAndUnknownLoginLookTheSame() throws Exception {
        String wrong = mockMvc.perform(loginRequest("admin", "not-admin"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_credentials"))
                .andReturn().getResponse().getContentAsString();
        String unknown = mockMvc.perform(loginRequest("nobody-here", "not-admin"))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();

        assertThat(objectMapper.readTree(wrong).path("detail"))
                .isEqualTo(objectMapper.readTree(unknown).path("detail"));
    }

    @Test
    void loginIsCaseSensitive() throws Exception {
        mockMvc.perform(loginRequest("ADMIN", "admin"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void missingFieldsAreUnprocessable() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"login\": \"admin\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void refreshTokenIsSingleUse() throws Exception {
        JsonNode tokens = login("admin", "admin");
        String original = tokens.path("refresh_token").asText();

        JsonNode rotated = readJson(refresh(original).andExpect(status().isOk()).andReturn());

        assertThat(rotated.path("refresh_token").asText()).isNotEqualTo(original);
        refresh(original)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_refresh_token"));
        refresh(rotated.path("refresh_token").asText()).andExpect(status().isOk());
    }

    @Test
    void unknownRefreshTokenIsUnauthorized() throws Exception {
        refresh("definitely-not-issued")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_refresh_token"));
    }

    @Test
    void logoutIsIdempotentAndEndsTheLineage() throws Exception {
        JsonNode tokens = login("admin", "admin");
        String refreshToken = tokens.path("refresh_token").asText();

        logout(bearer(tokens), refreshToken).andExpect(status().isOk()).andExpect(jsonPath("$.ok").value(true));
        logout(bearer(tokens), refreshToken).andExpect(status().isOk()).andExpect(jsonPath("$.ok").value(true));
        logout(bearer(tokens), "never-issued").andExpect(status().isOk());

        refresh(refreshToken).andExpect(status().isUnauthorized());
    }

    @Test
    void logoutCannotRevokeAnotherUsersToken() throws Exception {
        CampusUser teacher = testUserFactory.createUser(Role.TEACHER, "teacher-pass");
        JsonNode teacherTokens = login(teacher.getLogin(), "teacher-pass");
        JsonNode adminTokens = login("admin", "admin");

        logout(bearer(adminTokens), teacherTokens.path("refresh_token").asText())
                .andExpect(status().isOk());

        refresh(teacherTokens.path("refresh_token").asText()).andExpect(status().isOk());
    }

    @Test
    void logoutRequiresAnAccessToken() throws Exception {
        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refresh_token\": \"whatever\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void verifyRejectsMissingAndInvalidTokens() throws Exception {
        mockMvc.perform(post("/auth/verify"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON));

        mockMvc.perform(post("/auth/verify").header("Authorization", "Bearer a.b.c"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401))
                .andExpect(jsonPath("$.type").isNotEmpty())
                .andExpect(jsonPath("$.instance").value("/auth/verify"));
    }

    @Test
    void meReturnsTheCurrentUserRecord() throws Exception {
        CampusUser student = testUserFactory.createUser(Role.STUDENT, "student-pass");
        JsonNode tokens = login(student.getLogin(), "student-pass");

        mockMvc.perform(get("/auth/me").header("Authorization", bearer(tokens)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.login").value(student.getLogin()))
                .andExpect(jsonPath("$.role").value("student"))
                .andExpect(jsonPath("$.gender").value("female"))
                .andExpect(jsonPath("$.class_name").value("10A"))
                .andExpect(jsonPath("$.password_hash").doesNotExist());
    }

    @Test
    void healthProbesArePublic() throws Exception {
        mockMvc.perform(get("/healthz")).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("UP"));
        mockMvc.perform(get("/health")).andExpect(status().isOk());
        mockMvc.perform(get("/readyz")).andExpect(status().isOk());
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/healthz").header("X-Request-Id", "trace-42"))
                .andExpect(header().string("X-Request-Id", "trace-42"));
    }

    private JsonNode login(String login, String password) throws Exception {
        return readJson(mockMvc.perform(loginRequest(login, password)).andExpect(status().isOk()).andReturn());
    }

    private RequestBuilder loginRequest(String login, String password) {
        return post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"login": "%s", "password": "%s"}
                        """.formatted(login, password));
    }

    private ResultActions refresh(String refreshToken) throws Exception {
        return mockMvc.perform(post("/auth/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"refresh_token": "%s"}
                        """.formatted(refreshToken)));
    }

    private ResultActions logout(String authorization, String refreshToken) throws Exception {
        return mockMvc.perform(post("/auth/logout")
                .header("Authorization", authorization)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"refresh_token": "%s"}
                        """.formatted(refreshToken)));
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String bearer(JsonNode tokens) {
        return "Bearer " + tokens.path("access_token").asText();
    }
}
