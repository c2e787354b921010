package com.tony.transferMarket.model.dto;

import lombok.Builder;
import lombok.Data;

/** Bilan d'une journée de marché IA. */
@Data
@Builder
public class AiTransferSummary {
    private int expiredOffers;
    private int aiOfferResponses;
    private int aiAutoCompletedTransfers;
    private int aiRejectedOffers;
    private int aiCounterOffers;
    private int newListings;
    private int newOffers;
    private int freeAgentSignings;
    private int releasedPlayers;
}
