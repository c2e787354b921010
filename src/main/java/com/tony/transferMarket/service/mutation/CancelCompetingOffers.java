package com.tony.transferMarket.service.mutation;

/**
 * Annule les offres encore ouvertes sur un joueur (acceptées comprises), sauf celle qui vient d'aboutir.
 * Sans {@code keepOfferId}, toutes sont annulées.
 */
public record CancelCompetingOffers(Long playerId, Long keepOfferId) implements MarketMutation {

    public static CancelCompetingOffers all(Long playerId) {
        return new CancelCompetingOffers(playerId, null);
    }

    @Override
    public int boundValues() {
        return 6;
    }
}
