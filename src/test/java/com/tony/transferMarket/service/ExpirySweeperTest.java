package com.tony.transferMarket.service;

import com.tony.transferMarket.model.*;
import com.tony.transferMarket.support.MarketJpaTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class ExpirySweeperTest extends MarketJpaTest {

    @Autowired
    private ExpirySweeper sweeper;

    @Test
    @DisplayName("Une offre reste valable pendant sa journée d'expiration puis expire")
    void expiresAfterLastRound() {
        GameSave save = fixture.save(2026, 5);
        Team human = fixture.humanTeam(save, "FC Lumière", 62, 30_000_000L, 1_500_000L);
        Team seller = fixture.team(save, "AS Montagne", 55, 18_000_000L, 1_400_000L);
        Player player = fixture.player(save, seller, "Sacha Morel", Position.ATT, 26, 66);
        TransferOffer offer = fixture.offer(save, player, human, 5_000_000L, 25_000L, OfferStatus.PENDING, 2, 5);

        assertThat(sweeper.sweep(save.getId(), 5)).isZero();
        assertThat(fixture.reload(TransferOffer.class, offer.getId()).getStatus()).isEqualTo(OfferStatus.PENDING);

        assertThat(sweeper.sweep(save.getId(), 6)).isEqualTo(1);
        assertThat(fixture.reload(TransferOffer.class, offer.getId()).getStatus()).isEqualTo(OfferStatus.EXPIRED);
    }

    @Test
    @DisplayName("Seules les offres en cours de la partie concernée expirent")
    void onlyOutstandingOffersOfTheSave() {
        GameSave save = fixture.save(2026, 8);
        Team human = fixture.humanTeam(save, "FC Lumière", 62, 30_000_000L, 1_500_000L);
        Team seller = fixture.team(save, "AS Montagne", 55, 18_000_000L, 1_400_000L);
        Player first = fixture.player(save, seller, "Sacha Morel", Position.ATT, 26, 66);
        Player second = fixture.player(save, seller, "Enzo Caron", Position.DEF, 27, 70);
        Player third = fixture.player(save, seller, "Jules Roy", Position.MID, 29, 63);
        TransferOffer counter = fixture.offer(save, first, human, 5_000_000L, 25_000L, OfferStatus.COUNTER, 2, 4);
        TransferOffer accepted = fixture.offer(save, second, human, 5_000_000L, 25_000L, OfferStatus.ACCEPTED, 2, 4);
        TransferOffer rejected = fixture.offer(save, third, human, 5_000_000L, 25_000L, OfferStatus.REJECTED, 2, 4);

        GameSave other = fixture.save(2026, 8);
        Team otherHuman = fixture.humanTeam(other, "FC Ailleurs", 50, 1_000_000L, 100_000L);
        Team otherSeller = fixture.team(other, "AS Ailleurs", 50, 1_000_000L, 100_000L);
        Player elsewhere = fixture.player(other, otherSeller, "Tom Blanc", Position.GK, 25, 60);
        TransferOffer untouched = fixture.offer(other, elsewhere, otherHuman, 1_000_000L, 10_000L, OfferStatus.PENDING, 2, 4);

        int expired = sweeper.sweep(save.getId(), 8);

        assertThat(expired).isEqualTo(1);
        assertThat(fixture.reload(TransferOffer.class, counter.getId()).getStatus()).isEqualTo(OfferStatus.EXPIRED);
        assertThat(em.find(TransferOffer.class, accepted.getId()).getStatus()).isEqualTo(OfferStatus.ACCEPTED);
        assertThat(em.find(TransferOffer.class, rejected.getId()).getStatus()).isEqualTo(OfferStatus.REJECTED);
        assertThat(em.find(TransferOffer.class, untouched.getId()).getStatus()).isEqualTo(OfferStatus.PENDING);
    }
}
