package com.tony.transferMarket.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Résultat d'une offre : son identifiant et, si le vendeur est une IA ou un joueur libre,
 * la réponse immédiate.
 */
@Data
@AllArgsConstructor
public class OfferOutcome {
    private Long offerId;
    private AiResponse aiResponse;

    @Data
    @AllArgsConstructor
    public static class AiResponse {
        private String action; // accept / reject / counter
        private Long counterFee;
        private Long counterWage;
    }
}
