package com.tony.transferMarket.service.mutation;

import com.tony.transferMarket.model.OfferStatus;

/** Nouvelle offre ; {@code sellerTeamId} null pour un joueur libre. */
public record InsertOffer(Long saveId, Long playerId, Long sellerTeamId, Long buyerTeamId,
                          long fee, long wage, int contractYears, OfferStatus status,
                          int createdRound, int expiresRound) implements MarketMutation {

    @Override
    public int boundValues() {
        return 11;
    }
}
