package com.tony.transferMarket.service.negotiation;

import com.tony.transferMarket.config.TransferMarketProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sessions en mémoire locale. Les sessions expirées sont ignorées à la lecture et purgées
 * au plus une fois par intervalle de nettoyage (purge opportuniste, sans garantie de délai).
 */
@Component
@Slf4j
public class InMemoryNegotiationSessionStore implements NegotiationSessionStore {

    private final Map<String, NegotiationSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Instant> lastSweep;
    private final Clock clock;
    private final Duration ttl;
    private final Duration sweepInterval;

    public InMemoryNegotiationSessionStore(Clock clock, TransferMarketProperties properties) {
        this.clock = clock;
        this.ttl = properties.getNegotiation().getSessionTtl();
        this.sweepInterval = properties.getNegotiation().getSweepInterval();
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    @Override
    public Optional<NegotiationSession> find(String negotiationId) {
        maybeSweep();
        if (negotiationId == null) {
            return Optional.empty();
        }
        NegotiationSession session = sessions.get(negotiationId);
        if (session == null) {
            return Optional.empty();
        }
        if (isExpired(session, clock.instant())) {
            sessions.remove(negotiationId, session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    public void save(NegotiationSession session) {
        sessions.put(session.getId(), session);
    }

    @Override
    public void remove(String negotiationId) {
        if (negotiationId != null) {
            sessions.remove(negotiationId);
        }
    }

    @Override
    public boolean tryBegin(String negotiationId) {
        return inFlight.add(negotiationId);
    }

    @Override
    public void end(String negotiationId) {
        inFlight.remove(negotiationId);
    }

    @Override
    public int sweepExpired() {
        Instant now = clock.instant();
        lastSweep.set(now);
        int before = sessions.size();
        sessions.values().removeIf(session -> isExpired(session, now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.debug("🧹 {} session(s) de négociation expirée(s) supprimée(s)", removed);
        }
        return Math.max(0, removed);
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private void maybeSweep() {
        Instant now = clock.instant();
        Instant previous = lastSweep.get();
        if (!now.isBefore(previous.plus(sweepInterval)) && lastSweep.compareAndSet(previous, now)) {
            sweepExpired();
        }
    }

    private boolean isExpired(NegotiationSession session, Instant now) {
        return !now.isBefore(session.getCreatedAt().plus(ttl));
    }
}
