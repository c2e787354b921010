package com.tony.transferMarket.model.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class MarketDiagnostics {
    private Long saveId;
    private int currentRound;
    private int totalListings;
    // Tranches d'âge : "u24", "24-29", "30+"
    private Map<String, Integer> listingsByAge;
    // Ancienneté des annonces en journées : "<3", "3-6", ">6"
    private Map<String, Integer> listingsByDuration;
    private Map<String, Long> offersByStatus;
    // Réponses IA données pendant la journée courante
    private long aiResponsesThisRound;
}
