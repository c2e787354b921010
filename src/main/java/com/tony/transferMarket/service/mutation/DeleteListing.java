package com.tony.transferMarket.service.mutation;

public record DeleteListing(Long saveId, Long playerId) implements MarketMutation {

    @Override
    public int boundValues() {
        return 2;
    }
}
