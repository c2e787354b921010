package com.tony.transferMarket.service.negotiation;

import java.util.Optional;

/**
 * Stockage des sessions de négociation, indexé par identifiant de négociation.
 * Une implémentation en mémoire convient à une instance unique ; un déploiement multi-instances
 * doit fournir un stockage partagé.
 */
public interface NegotiationSessionStore {

    /** Session active, ou vide si elle n'existe pas ou a dépassé sa durée de vie. */
    Optional<NegotiationSession> find(String negotiationId);

    void save(NegotiationSession session);

    void remove(String negotiationId);

    /**
     * Réserve l'identifiant pour un appel. Renvoie {@code false} si un autre appel est déjà en cours
     * sur la même négociation.
     */
    boolean tryBegin(String negotiationId);

    void end(String negotiationId);

    /** Supprime les sessions expirées. @return le nombre de sessions supprimées */
    int sweepExpired();

    int size();
}
