package com.campusauth.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.campusauth.backend.global.error.RetryableProblemException;
import com.campusauth.backend.modules.auth.application.PasswordHasher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

class PasswordHasherTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void producesSelfDescribingArgon2idHashes() {
        PasswordHasher hasher = new PasswordHasher(
                new Argon2PasswordEncoder(16, 32, 1, 1024, 1), executor(2, 4), Duration.ofSeconds(10));

        String hash = hasher.hash("correct horse");

        assertThat(hash).startsWith("$argon2id$v=19$m=1024,t=1,p=1$");
        assertThat(hasher.matches("correct horse", hash)).isTrue();
        assertThat(hasher.matches("wrong horse", hash)).isFalse();
        assertThat(hasher.hash("correct horse")).isNotEqualTo(hash);
    }

    @Test
    void saturatedPoolAnswersRetryableServiceUnavailable() {
        PasswordHasher hasher = new PasswordHasher(new BlockingEncoder(release), executor(1, 0), Duration.ofSeconds(5));
        CompletableFuture.runAsync(() -> hasher.hash("first"));
        waitUntilBusy();

        RetryableProblemException ex = assertThrows(RetryableProblemException.class, () -> hasher.hash("second"));

        assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(ex.getRetryAfterSeconds()).isPositive();
    }

    @Test
    void slowHashingTimesOutAsRetryable() {
        PasswordHasher hasher = new PasswordHasher(new BlockingEncoder(release), executor(1, 1), Duration.ofMillis(50));

        RetryableProblemException ex = assertThrows(RetryableProblemException.class, () -> hasher.matches("pw", "hash"));

        assertThat(ex.getCode()).isEqualTo("auth.hashing_unavailable");
    }

    private ThreadPoolTaskExecutor executor(int poolSize, int queueCapacity) {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("test-hash-");
        executor.initialize();
        return executor;
    }

    private void waitUntilBusy() {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (executor.getActiveCount() == 0 && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertThat(executor.getActiveCount()).isEqualTo(1);
    }

    private static final class BlockingEncoder implements PasswordEncoder {

        private final CountDownLatch release;

        private BlockingEncoder(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public String encode(CharSequence rawPassword) {
            await();
            return "blocked";
        }

        @Override
        public boolean matches(CharSequence rawPassword, String encodedPassword) {
            await();
            return false;
        }

        private void await() {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
