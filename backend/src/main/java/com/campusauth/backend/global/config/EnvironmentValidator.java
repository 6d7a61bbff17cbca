package com.campusauth.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when required settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-to-a-long-random-secret-value";
    static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;
    static final long MAX_REFRESH_TTL_MILLIS = 90L * 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated (algorithm={})", environment.getProperty("jwt.algorithm", "HS256"));
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        if (isBlank(environment.getProperty("spring.datasource.url"))) {
            problems.add("spring.datasource.url is required");
        }

        String algorithm = environment.getProperty("jwt.algorithm", "HS256").trim();
        if ("HS256".equalsIgnoreCase(algorithm)) {
            String secret = environment.getProperty("jwt.secret");
            if (isBlank(secret)) {
                problems.add("jwt.secret is required for HS256");
            } else if (PLACEHOLDER_SECRET.equals(secret.trim())) {
                problems.add("jwt.secret still holds the placeholder value");
            }
        } else if ("RS256".equalsIgnoreCase(algorithm)) {
            if (isBlank(environment.getProperty("jwt.private-key"))) {
                problems.add("jwt.private-key is required for RS256");
            }
            if (isBlank(environment.getProperty("jwt.public-key"))) {
                problems.add("jwt.public-key is required for RS256");
            }
        } else {
            problems.add("jwt.algorithm must be HS256 or RS256");
        }

        Optional<Long> accessTtl = readMillis("jwt.expiration", problems);
        Optional<Long> refreshTtl = readMillis("jwt.refresh-expiration", problems);
        accessTtl.filter(ttl -> ttl < MIN_ACCESS_TTL_MILLIS || ttl > MAX_ACCESS_TTL_MILLIS)
                .ifPresent(ttl -> problems.add("jwt.expiration must be within "
                        + MIN_ACCESS_TTL_MILLIS + "-" + MAX_ACCESS_TTL_MILLIS + " ms"));
        refreshTtl.filter(ttl -> ttl > MAX_REFRESH_TTL_MILLIS)
                .ifPresent(ttl -> problems.add("jwt.refresh-expiration must not exceed " + MAX_REFRESH_TTL_MILLIS + " ms"));
        if (accessTtl.isPresent() && refreshTtl.isPresent() && refreshTtl.get() <= accessTtl.get()) {
            problems.add("jwt.refresh-expiration must be longer than jwt.expiration");
        }
        return problems;
    }

    private Optional<Long> readMillis(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (isBlank(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number of milliseconds");
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
