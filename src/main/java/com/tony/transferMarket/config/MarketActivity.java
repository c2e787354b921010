package com.tony.transferMarket.config;

/**
 * Niveau d'activité du marché : détermine le preset de {@link TransferConfig} utilisé par défaut.
 */
public enum MarketActivity {
    LOW(TransferConfig.LOW),
    NORMAL(TransferConfig.NORMAL),
    HIGH(TransferConfig.HIGH);

    private final TransferConfig preset;

    MarketActivity(TransferConfig preset) {
        this.preset = preset;
    }

    public TransferConfig preset() {
        return preset;
    }
}
