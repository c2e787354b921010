package com.tony.transferMarket.service.negotiation;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * État éphémère d'une négociation en direct. Jamais persisté : sa perte fait simplement
 * repartir la négociation du premier tour.
 */
@Getter
@Setter
public class NegotiationSession {

    private final String id;
    private final NegotiationDirection direction;
    private final Long saveId;
    private final Long playerId;
    private final Long buyerTeamId;
    private final Long sellerTeamId;
    // Offre concernée (négociation entrante uniquement)
    private final Long offerId;
    private final Instant createdAt;

    private int round;
    private double hardeningFactor = 1.0;
    private int contractYears;

    private Long lastHumanFee;
    private Long lastHumanWage;
    private Long lastAiFee;
    private Long lastAiWage;

    public NegotiationSession(String id, NegotiationDirection direction, Long saveId, Long playerId,
                              Long buyerTeamId, Long sellerTeamId, Long offerId, Instant createdAt) {
        this.id = id;
        this.direction = direction;
        this.saveId = saveId;
        this.playerId = playerId;
        this.buyerTeamId = buyerTeamId;
        this.sellerTeamId = sellerTeamId;
        this.offerId = offerId;
        this.createdAt = createdAt;
    }

    public boolean hasAiCounter() {
        return lastAiFee != null && lastAiWage != null;
    }

    /** Vrai si la session porte bien sur la même transaction que l'appel. */
    public boolean matches(NegotiationDirection direction, Long saveId, Long playerId, Long buyerTeamId, Long offerId) {
        return this.direction == direction
                && this.saveId.equals(saveId)
                && this.playerId.equals(playerId)
                && this.buyerTeamId.equals(buyerTeamId)
                && (offerId == null || offerId.equals(this.offerId));
    }
}
