package com.campusauth.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.campusauth.backend.global.error.ProblemException;
import com.campusauth.backend.modules.auth.application.AuthService;
import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.domain.Role;
import com.campusauth.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.campusauth.backend.modules.auth.presentation.dto.LoginRequest;
import com.campusauth.backend.modules.auth.presentation.dto.RefreshRequest;
import com.campusauth.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.campusauth.backend.support.AbstractPostgresIntegrationTest;
import com.campusauth.backend.support.TestUserFactory;

import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class RefreshRotationRaceIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private AuthService authService;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @RepeatedTest(5)
    void concurrentRefreshOfOneTokenHasExactlyOneWinner() throws Exception {
        CampusUser user = testUserFactory.createUser(Role.TEACHER, "race-pass");
        TokenPairResponse pair = authService.login(new LoginRequest(user.getLogin(), "race-pass"));
        String token = pair.refreshToken();

        int contenders = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        try {
            List<Future<Boolean>> outcomes = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        authService.refresh(new RefreshRequest(token));
                        return true;
                    } catch (ProblemException ex) {
                        return false;
                    }
                };
                outcomes.add(pool.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(refreshTokenRepository.countByUserIdAndRevokedFalse(user.getId())).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
