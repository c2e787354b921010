package com.tony.transferMarket.model;

/**
 * Postes simplifiés (4 lignes) et effectif idéal par poste.
 */
public enum Position {
    GK(3),
    DEF(9),
    MID(9),
    ATT(7);

    private final int idealCount;

    Position(int idealCount) {
        this.idealCount = idealCount;
    }

    public int getIdealCount() {
        return idealCount;
    }
}
