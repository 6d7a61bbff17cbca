package com.campusauth.backend.modules.auth;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.UUID;

import com.campusauth.backend.modules.auth.application.CredentialVerifier;
import com.campusauth.backend.modules.auth.application.RefreshTokenStore;
import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.domain.Gender;
import com.campusauth.backend.modules.auth.domain.Role;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

/**
 * A user removed between credential check and refresh record insert must not surface as a
 * data conflict.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DeletedUserTokenIssueIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RefreshTokenStore refreshTokenStore;

    @MockBean
    private CredentialVerifier credentialVerifier;

    @Test
    void loginForVanishedUserIsUnauthorized() throws Exception {
        when(credentialVerifier.verify(anyString(), anyString())).thenReturn(vanishedUser());

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"login\":\"ghost\",\"password\":\"whatever\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_credentials"))
                .andExpect(jsonPath("$.instance").value("/auth/login"));
    }

    @Test
    void refreshRecordForVanishedUserIsAnIntegrityViolation() {
        assertThrows(DataIntegrityViolationException.class,
                () -> refreshTokenStore.create(UUID.randomUUID(), Duration.ofDays(7)));
    }

    private static CampusUser vanishedUser() {
        CampusUser user = new CampusUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setLogin("ghost");
        user.setFirstName("Ghost");
        user.setLastName("User");
        user.setRole(Role.STUDENT);
        user.setGender(Gender.MALE);
        return user;
    }
}
