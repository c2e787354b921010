package com.tony.transferMarket.service.mutation;

/** Crédit (delta positif) ou débit du budget et de la trésorerie d'un club. */
public record AdjustBalance(Long teamId, long delta) implements MarketMutation {

    @Override
    public int boundValues() {
        return 3;
    }
}
