package com.campusauth.backend.modules.auth.application;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.campusauth.backend.global.error.RetryableProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Runs Argon2 hashing and verification on the bounded hashing pool so request threads
 * never queue unboundedly behind memory-hard work.
 */
@Component
public class PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);
    private static final int RETRY_AFTER_SECONDS = 1;

    private final PasswordEncoder passwordEncoder;
    private final ThreadPoolTaskExecutor executor;
    private final Duration timeout;

    public PasswordHasher(
            PasswordEncoder passwordEncoder,
            @Qualifier("passwordHashingExecutor") ThreadPoolTaskExecutor executor,
            @Value("${app.security.password-hashing.timeout:PT5S}") Duration timeout
    ) {
        this.passwordEncoder = passwordEncoder;
        this.executor = executor;
        this.timeout = timeout;
    }

    public String hash(String rawPassword) {
        return runBounded(() -> passwordEncoder.encode(rawPassword));
    }

    public boolean matches(String rawPassword, String encodedPassword) {
        return runBounded(() -> passwordEncoder.matches(rawPassword, encodedPassword));
    }

    private <T> T runBounded(Supplier<T> work) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(work, executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Password hashing pool saturated (active={}, queued={})",
                    executor.getActiveCount(), executor.getThreadPoolExecutor().getQueue().size());
            throw busy();
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Password hashing exceeded {}", timeout);
            throw busy();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw busy();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Password hashing failed", cause);
        }
    }

    private static RetryableProblemException busy() {
        return new RetryableProblemException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "auth.hashing_unavailable",
                "Authentication is temporarily unavailable",
                RETRY_AFTER_SECONDS
        );
    }
}
