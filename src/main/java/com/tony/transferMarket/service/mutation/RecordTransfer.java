package com.tony.transferMarket.service.mutation;

public record RecordTransfer(String transferId, Long saveId, Long playerId, Long fromTeamId, Long toTeamId,
                             long fee, long wage, int season) implements MarketMutation {

    @Override
    public int boundValues() {
        return 9;
    }
}
