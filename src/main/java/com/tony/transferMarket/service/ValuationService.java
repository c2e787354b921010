package com.tony.transferMarket.service;

import com.tony.transferMarket.model.Player;
import com.tony.transferMarket.model.PlayerAttributes;
import com.tony.transferMarket.model.Position;
import com.tony.transferMarket.model.dto.ReleaseFeeQuote;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Valorisation d'un joueur : note globale, prix demandé, salaire exigé.
 * Fonctions pures : mêmes entrées, mêmes sorties (la négociation en dépend).
 */
@Service
public class ValuationService {

    public static final int NEUTRAL_RATING = 50;
    public static final long BASE_WAGE_MULTIPLIER = 10_000L;
    public static final int YOUTH_AGE_THRESHOLD = 24;
    public static final int VETERAN_AGE_THRESHOLD = 29;
    // Saisons restantes en dessous desquelles le contrat est considéré comme expirant
    public static final int CONTRACT_EXPIRY_THRESHOLD = 1;

    private static final int PEAK_AGE = 27;

    public static final int ROUNDS_PER_SEASON = 38;
    // Minutes d'un titulaire sur une saison complète
    private static final double STARTER_MINUTES_PER_SEASON = 2700;
    private static final double MUTUAL_TERMINATION_UTILIZATION = 0.25;

    // Index = années de contrat - 1
    private static final double[] CONTRACT_LENGTH_MULTIPLIERS = {1.10, 1.05, 1.00, 0.95, 0.90};

    private record Weight(Function<PlayerAttributes, Integer> attribute, int weight) {}

    private static final Map<Position, List<Weight>> POSITION_WEIGHTS = new EnumMap<>(Position.class);

    static {
        POSITION_WEIGHTS.put(Position.GK, List.of(
                new Weight(PlayerAttributes::getReflexes, 3),
                new Weight(PlayerAttributes::getHandling, 3),
                new Weight(PlayerAttributes::getDiving, 3),
                new Weight(PlayerAttributes::getPositioning, 2),
                new Weight(PlayerAttributes::getComposure, 1)));
        POSITION_WEIGHTS.put(Position.DEF, List.of(
                new Weight(PlayerAttributes::getTackling, 3),
                new Weight(PlayerAttributes::getHeading, 2),
                new Weight(PlayerAttributes::getStrength, 2),
                new Weight(PlayerAttributes::getPositioning, 2),
                new Weight(PlayerAttributes::getSpeed, 1)));
        POSITION_WEIGHTS.put(Position.MID, List.of(
                new Weight(PlayerAttributes::getPassing, 3),
                new Weight(PlayerAttributes::getVision, 2),
                new Weight(PlayerAttributes::getStamina, 2),
                new Weight(PlayerAttributes::getDribbling, 1),
                new Weight(PlayerAttributes::getPositioning, 1),
                new Weight(PlayerAttributes::getTackling, 1)));
        POSITION_WEIGHTS.put(Position.ATT, List.of(
                new Weight(PlayerAttributes::getShooting, 3),
                new Weight(PlayerAttributes::getPositioning, 2),
                new Weight(PlayerAttributes::getDribbling, 2),
                new Weight(PlayerAttributes::getSpeed, 2),
                new Weight(PlayerAttributes::getComposure, 1)));
    }

    /**
     * Note globale pondérée par poste. Un poste ou des attributs absents donnent une note neutre (50),
     * un attribut manquant compte pour 50.
     */
    public int overall(Player player) {
        if (player == null || player.getPosition() == null || player.getAttributes() == null) {
            return NEUTRAL_RATING;
        }
        PlayerAttributes attributes = player.getAttributes();
        double total = 0;
        int weights = 0;
        for (Weight w : POSITION_WEIGHTS.get(player.getPosition())) {
            Integer value = w.attribute().apply(attributes);
            total += (value != null ? value : NEUTRAL_RATING) * w.weight();
            weights += w.weight();
        }
        return (int) Math.round(total / weights);
    }

    /**
     * Prix demandé = valeur marchande × modificateur d'âge × modificateur de contrat.
     * <ul>
     *     <li>moins de 24 ans : +25% plus un bonus de potentiel (1% par point de marge)</li>
     *     <li>plus de 29 ans : -10% par année, plancher à 50%</li>
     *     <li>dernière saison de contrat : -40%</li>
     * </ul>
     */
    public long askingPrice(Player player, int currentSeason) {
        double price = nonNegative(player.getMarketValue());
        int age = ageOf(player);

        if (age < YOUTH_AGE_THRESHOLD) {
            int potential = player.getPotential() != null ? player.getPotential() : overall(player);
            double potentialBonus = Math.max(0, potential - overall(player)) * 0.01;
            price *= 1.25 + potentialBonus;
        } else if (age > VETERAN_AGE_THRESHOLD) {
            price *= Math.max(0.5, 1 - (age - VETERAN_AGE_THRESHOLD) * 0.1);
        }

        if (isContractExpiring(player, currentSeason)) {
            price *= 0.6;
        }
        return Math.max(0L, Math.round(price));
    }

    /**
     * Salaire exigé = (note/50)³ × 10 000, ajusté par l'âge puis par la réputation de l'acheteur :
     * un grand club paie une prime (+0.5% par point de réputation au-dessus de 50).
     */
    public long wageDemand(Player player, int buyerReputation) {
        double wage = Math.pow(overall(player) / 50.0, 3) * BASE_WAGE_MULTIPLIER;
        int age = ageOf(player);

        if (age < YOUTH_AGE_THRESHOLD) {
            wage *= 0.85;
        } else if (age > VETERAN_AGE_THRESHOLD) {
            wage *= 1.10;
        }

        wage *= 1 + Math.max(0, buyerReputation - 50) / 200.0;
        return Math.max(0L, Math.round(wage));
    }

    /**
     * Salaire attendu par un joueur libre : son dernier salaire, décoté par le chômage
     * et ajusté par la durée proposée (contrat court = prime, contrat long = décote).
     */
    public long freeAgentExpectedWage(Player player, int contractYears, double unemploymentFactor) {
        double expected = nonNegative(player.getWage()) * unemploymentFactor * contractLengthMultiplier(contractYears);
        return Math.max(0L, Math.round(expected));
    }

    public double contractLengthMultiplier(int contractYears) {
        int years = Math.max(1, Math.min(5, contractYears));
        return CONTRACT_LENGTH_MULTIPLIERS[years - 1];
    }

    public boolean isContractExpiring(Player player, int currentSeason) {
        Integer contractEnd = player.getContractEndSeason();
        return contractEnd != null && contractEnd - currentSeason <= CONTRACT_EXPIRY_THRESHOLD;
    }

    /** Renouvellement automatique des bons joueurs (note >= 65, moins de 33 ans). */
    public boolean shouldAutoRenew(Player player) {
        return overall(player) >= 65 && ageOf(player) < 33;
    }

    /**
     * Indemnité de rupture : une part des salaires restant dus jusqu'à la fin du contrat.
     * La part monte avec le temps de jeu (le joueur perd sa place) et baisse avec les perspectives
     * du joueur sur le marché (jeune, bien noté). Sans année restante, rien n'est dû ;
     * un joueur de moins de 30 ans peu utilisé en dernière année accepte une rupture à l'amiable.
     */
    public ReleaseFeeQuote releaseCompensation(Player player, int currentSeason, int currentRound) {
        Integer contractEnd = player.getContractEndSeason();
        int yearsRemaining = contractEnd != null ? Math.max(0, contractEnd - currentSeason) : 0;
        double expectedMinutes = Math.max(1, Math.max(1, currentRound) / (double) ROUNDS_PER_SEASON * STARTER_MINUTES_PER_SEASON);
        int minutes = player.getSeasonMinutes() != null ? Math.max(0, player.getSeasonMinutes()) : 0;
        double utilization = Math.min(1.0, minutes / expectedMinutes);
        int age = ageOf(player);

        long fee = 0L;
        boolean mutualTermination = yearsRemaining <= 1 && utilization < MUTUAL_TERMINATION_UTILIZATION && age < 30;
        if (yearsRemaining > 0 && !mutualTermination) {
            double outlook = 0.5 * clamp01((30 - age) / 10.0) + 0.5 * clamp01((overall(player) - 60) / 20.0);
            double share = 0.35 + 0.25 * (1 - outlook) + 0.40 * utilization;
            double remainingWages = nonNegative(player.getWage()) * (double) ROUNDS_PER_SEASON * yearsRemaining;
            fee = Math.max(0L, Math.round(remainingWages * share));
        }

        return ReleaseFeeQuote.builder()
                .playerId(player.getId())
                .fee(fee)
                .hasFee(fee > 0)
                .yearsRemaining(yearsRemaining)
                .utilizationRatio(utilization)
                .build();
    }

    private static double clamp01(double value) {
        return Math.max(0, Math.min(1, value));
    }

    private static int ageOf(Player player) {
        return player.getAge() != null ? player.getAge() : PEAK_AGE;
    }

    private static long nonNegative(Long value) {
        return value != null ? Math.max(0L, value) : 0L;
    }
}
