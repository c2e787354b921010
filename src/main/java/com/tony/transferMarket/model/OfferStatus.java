package com.tony.transferMarket.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Cycle de vie d'une offre de transfert.
 * La table de transitions est fermée : toute transition absente est refusée.
 */
public enum OfferStatus {
    PENDING,
    COUNTER,
    ACCEPTED,
    REJECTED,
    EXPIRED,
    COMPLETED,
    CANCELLED;

    private static final Map<OfferStatus, Set<OfferStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(COUNTER, ACCEPTED, REJECTED, EXPIRED, CANCELLED),
            COUNTER, EnumSet.of(PENDING, COUNTER, ACCEPTED, REJECTED, EXPIRED, CANCELLED),
            ACCEPTED, EnumSet.of(COMPLETED, CANCELLED),
            REJECTED, EnumSet.noneOf(OfferStatus.class),
            EXPIRED, EnumSet.noneOf(OfferStatus.class),
            COMPLETED, EnumSet.noneOf(OfferStatus.class),
            CANCELLED, EnumSet.noneOf(OfferStatus.class)
    );

    /** Statuts "en cours" : une seule offre de ce type par couple (joueur, acheteur). */
    public static final Set<OfferStatus> OUTSTANDING = Collections.unmodifiableSet(EnumSet.of(PENDING, COUNTER));

    /** Statuts encore ouverts : une offre acceptée mais non finalisée doit être annulée quand le joueur part. */
    public static final Set<OfferStatus> UNSETTLED = Collections.unmodifiableSet(EnumSet.of(PENDING, COUNTER, ACCEPTED));

    public boolean canTransitionTo(OfferStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean isOutstanding() {
        return OUTSTANDING.contains(this);
    }
}
