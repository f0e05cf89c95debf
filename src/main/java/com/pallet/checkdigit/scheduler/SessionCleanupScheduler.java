package com.pallet.checkdigit.scheduler;

import com.pallet.checkdigit.session.LookupSessionRegistry;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Periodic cleanup of lookup sessions whose input field was abandoned (screen closed,
 * device slept) without an explicit close.
 *
 * <p>Closing a session cancels any lookup it still has in flight. Runs every five minutes
 * after an initial one-minute delay.
 */
@Singleton
public class SessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupScheduler.class);

    @Value("${stations.lookup.session-idle-minutes:60}")
    int sessionIdleMinutes = 60;

    @Inject
    private LookupSessionRegistry sessionRegistry;

    @Scheduled(fixedDelay = "5m", initialDelay = "1m")
    public void closeIdleSessions() {
        Instant cutoff = Instant.now().minus(sessionIdleMinutes, ChronoUnit.MINUTES);
        try {
            int closed = sessionRegistry.closeIdleSince(cutoff);
            if (closed > 0) {
                log.info("SessionCleanupScheduler closed {} idle sessions, {} still open",
                        closed, sessionRegistry.size());
            }
        } catch (Exception e) {
            log.error("SessionCleanupScheduler failed: {}", e.getMessage(), e);
        }
    }
}
