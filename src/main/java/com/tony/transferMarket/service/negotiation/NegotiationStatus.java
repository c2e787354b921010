package com.tony.transferMarket.service.negotiation;

/**
 * Issue d'un appel de négociation.
 */
public enum NegotiationStatus {
    /** L'IA a contre-proposé, la session attend la décision de l'humain. */
    COUNTERED,
    ACCEPTED,
    REJECTED,
    ABANDONED,
    /** La relance n'améliore pas assez la précédente : rien n'a changé, le tour n'avance pas. */
    INSUFFICIENT_IMPROVEMENT;

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED || this == ABANDONED;
    }
}
