package com.tony.transferMarket.service.negotiation;

import com.tony.transferMarket.config.TransferMarketProperties;
import com.tony.transferMarket.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryNegotiationSessionStoreTest {

    private MutableClock clock;
    private InMemoryNegotiationSessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = new InMemoryNegotiationSessionStore(clock, new TransferMarketProperties());
    }

    private NegotiationSession session(String id) {
        return new NegotiationSession(id, NegotiationDirection.OUTGOING, 1L, 10L, 2L, 3L, null, clock.instant());
    }

    @Test
    @DisplayName("Une session est retrouvée avant son expiration")
    void findsLiveSession() {
        store.save(session("neg-1"));
        clock.advance(Duration.ofMinutes(29));

        assertThat(store.find("neg-1")).isPresent();
    }

    @Test
    @DisplayName("Après 30 minutes la session est considérée comme absente")
    void expiredSessionIsAbsent() {
        store.save(session("neg-1"));
        clock.advance(Duration.ofMinutes(30));

        assertThat(store.find("neg-1")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("La purge opportuniste retire les sessions expirées au plus toutes les 5 minutes")
    void opportunisticSweep() {
        store.save(session("old"));
        clock.advance(Duration.ofMinutes(31));
        store.save(session("fresh"));

        // Purge déclenchée par une lecture quelconque
        store.find("unknown");

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.find("fresh")).isPresent();
    }

    @Test
    @DisplayName("Un seul appel en cours par négociation")
    void singleFlight() {
        assertThat(store.tryBegin("neg-1")).isTrue();
        assertThat(store.tryBegin("neg-1")).isFalse();
        assertThat(store.tryBegin("neg-2")).isTrue();

        store.end("neg-1");
        assertThat(store.tryBegin("neg-1")).isTrue();
    }

    @Test
    @DisplayName("Identifiant absent : aucune session")
    void nullIdFindsNothing() {
        assertThat(store.find(null)).isEmpty();
    }
}
