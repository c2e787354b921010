package com.tony.transferMarket.job;

import com.tony.transferMarket.service.negotiation.NegotiationSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NegotiationSweepJob {

    private final NegotiationSessionStore sessionStore;

    /**
     * Purge des sessions de négociation expirées, en plus de la purge faite à la lecture.
     */
    @Scheduled(fixedDelayString = "${transfer.negotiation.sweep-interval:PT5M}")
    public void sweepExpiredSessions() {
        int removed = sessionStore.sweepExpired();
        if (removed > 0) {
            log.info("🧹 [CRON] {} session(s) de négociation expirée(s) purgée(s), {} active(s)", removed, sessionStore.size());
        }
    }
}
