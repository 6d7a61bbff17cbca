package com.campusauth.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RefreshTokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenCleanupScheduler.class);

    private final RefreshTokenStore refreshTokenStore;
    private final Clock clock;
    private final Duration retention;

    public RefreshTokenCleanupScheduler(
            RefreshTokenStore refreshTokenStore,
            Clock clock,
            @Value("${app.auth.refresh-token-retention:P7D}") Duration retention
    ) {
        this.refreshTokenStore = refreshTokenStore;
        this.clock = clock;
        this.retention = retention;
    }

    @Scheduled(
            initialDelayString = "${app.auth.refresh-token-cleanup-interval:PT1H}",
            fixedDelayString = "${app.auth.refresh-token-cleanup-interval:PT1H}"
    )
    public void purgeStaleTokens() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(retention);
        int purged = refreshTokenStore.purgeStale(cutoff);
        if (purged > 0) {
            log.info("Purged {} refresh tokens expired or revoked before {}", purged, cutoff);
        }
    }
}
