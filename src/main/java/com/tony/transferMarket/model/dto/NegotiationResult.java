package com.tony.transferMarket.model.dto;

import com.tony.transferMarket.service.negotiation.NegotiationStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class NegotiationResult {
    private String negotiationId;
    private NegotiationStatus status;
    private int round;
    private int maxRounds;
    private double hardeningFactor;

    // Dernière proposition de l'IA (contre-offre du vendeur, ou nouvelle offre de l'acheteur)
    private Long counterFee;
    private Long counterWage;

    // Renseignés quand l'accord est conclu
    private Long offerId;
    private String transferId;

    private String message;
}
