package com.tony.transferMarket.service.mutation;

/**
 * Intention d'écriture sur le marché. Une liste d'intentions est interprétée par
 * {@link MutationApplier}, en une seule transaction ou en morceaux successifs.
 */
public interface MarketMutation {

    /** Nombre de valeurs liées que l'instruction SQL correspondante consomme. */
    int boundValues();
}
