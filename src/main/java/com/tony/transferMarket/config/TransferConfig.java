package com.tony.transferMarket.config;

import lombok.Builder;
import lombok.Value;

/**
 * Réglages du comportement de l'IA sur le marché.
 * Les ratios sont exprimés entre 0 et 1, les seuils de qualité en points de note globale.
 */
@Value
@Builder(toBuilder = true)
public class TransferConfig {

    // --- Calendrier ---
    @Builder.Default int offerExpiryRounds = 3;

    // --- Achats IA ---
    @Builder.Default int maxOffersPerTeamPerRound = 3;
    @Builder.Default int maxListingsPerTeamPerRound = 3;
    @Builder.Default double offerPriceRatio = 0.9;
    @Builder.Default double maxBudgetSpendRatio = 0.85;
    @Builder.Default double maxWageAllocationRatio = 0.2;
    @Builder.Default double buyQualityThreshold = -15;
    @Builder.Default double baseOfferProbability = 0.7;
    @Builder.Default boolean allowPositionUpgrades = true;
    @Builder.Default double upgradeQualityThreshold = 6;

    // --- Ventes IA ---
    // 0.995 : tolérance pour les arrondis d'affichage (322K peut valoir 322 500)
    @Builder.Default double acceptThreshold = 0.995;
    @Builder.Default double overstaffedAcceptThreshold = 0.8;
    @Builder.Default double counterThreshold = 0.55;

    // --- Effectif ---
    @Builder.Default int idealSquadSize = 28;
    @Builder.Default double potentialWeightForYouth = 0.5;

    // --- Joueurs libres ---
    @Builder.Default double freeAgentUnemploymentFactor = 0.7;
    @Builder.Default double freeAgentAcceptRatio = 0.85;
    @Builder.Default double freeAgentRejectRatio = 0.5;

    public static final TransferConfig NORMAL = TransferConfig.builder().build();

    // IA prudente, peu de transactions
    public static final TransferConfig LOW = NORMAL.toBuilder()
            .maxOffersPerTeamPerRound(1)
            .offerPriceRatio(0.85)
            .maxBudgetSpendRatio(0.5)
            .maxWageAllocationRatio(0.1)
            .buyQualityThreshold(-5)
            .baseOfferProbability(0.4)
            .allowPositionUpgrades(false)
            .counterThreshold(0.65)
            .potentialWeightForYouth(0.3)
            .build();

    // IA agressive
    public static final TransferConfig HIGH = NORMAL.toBuilder()
            .offerPriceRatio(0.95)
            .maxBudgetSpendRatio(0.8)
            .baseOfferProbability(0.75)
            .upgradeQualityThreshold(5)
            .overstaffedAcceptThreshold(0.7)
            .counterThreshold(0.5)
            .potentialWeightForYouth(0.7)
            .build();
}
