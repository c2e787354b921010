package com.tony.transferMarket.service.mutation;

/**
 * Déplace un joueur vers {@code teamId}. {@code fromTeamId} est le club qui doit encore le posséder
 * ({@code null} pour un joueur libre) : sinon l'écriture échoue.
 */
public record ReassignPlayer(Long playerId, Long fromTeamId, Long teamId, long wage, int contractEndSeason, int morale)
        implements MarketMutation {

    @Override
    public int boundValues() {
        return 6;
    }
}
