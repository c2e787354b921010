package com.tony.transferMarket.service.mutation;

import com.tony.transferMarket.model.TransactionType;

public record RecordTransaction(Long saveId, Long teamId, TransactionType type, String category,
                                long amount, String description, int round) implements MarketMutation {

    @Override
    public int boundValues() {
        return 9;
    }
}
