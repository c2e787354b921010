package com.tony.transferMarket.service.mutation;

import com.tony.transferMarket.model.ListingStatus;

public record InsertListing(Long saveId, Long playerId, Long teamId, long askingPrice,
                            ListingStatus status, int listedRound) implements MarketMutation {

    @Override
    public int boundValues() {
        return 7;
    }
}
