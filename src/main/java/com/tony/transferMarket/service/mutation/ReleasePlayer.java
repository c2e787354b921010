package com.tony.transferMarket.service.mutation;

/** Le joueur quitte {@code fromTeamId} pour les joueurs libres. */
public record ReleasePlayer(Long playerId, Long fromTeamId) implements MarketMutation {

    @Override
    public int boundValues() {
        return 2;
    }
}
