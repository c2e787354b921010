package com.tony.transferMarket.service;

import com.tony.transferMarket.config.TransferConfig;
import com.tony.transferMarket.config.TransferMarketProperties;
import com.tony.transferMarket.model.Player;
import com.tony.transferMarket.model.PlayerStatus;
import com.tony.transferMarket.model.Position;
import com.tony.transferMarket.model.dto.ReleaseFeeQuote;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Politiques de décision des clubs IA : vendre, acheter, signer un joueur libre, mettre en vente.
 * Toutes les politiques sont totales : une entrée incomplète donne une décision, jamais une exception.
 */
@Service
@RequiredArgsConstructor
public class AiDecisionService {

    public static final String REASON_POSITION_NOT_NEEDED = "Position not needed";
    public static final String REASON_QUALITY_TOO_LOW = "Player quality too low";
    public static final String REASON_FEE_UNAFFORDABLE = "Cannot afford transfer fee";
    public static final String REASON_WAGE_UNAFFORDABLE = "Cannot afford wages";

    // Un joueur libre peut être un peu en dessous du niveau de l'équipe
    private static final double FREE_AGENT_QUALITY_MARGIN = -8;
    private static final int VETERAN_LISTING_AGE = 33;
    // Les grands clubs sont tolérés un peu plus bas avant un refus sec
    private static final int PRESTIGE_REPUTATION = 70;
    private static final double PRESTIGE_REJECT_DISCOUNT = 0.05;

    // Libérations : seuils des clubs IA
    private static final int RELEASE_MIN_SQUAD_SIZE = 20;
    private static final int RELEASE_MIN_AT_POSITION = 2;
    private static final double RELEASE_LOW_USE_RATIO = 0.22;
    private static final int RELEASE_DECLINING_AGE = 34;
    private static final int RELEASE_DECLINING_MAX_OVERALL = 69;
    private static final double RELEASE_FRINGE_MARGIN = 8;

    private final ValuationService valuation;
    private final TransferMarketProperties properties;

    public enum Action { ACCEPT, REJECT, COUNTER }

    public record SellDecision(Action action, Long amount, Long wage) {
        public static SellDecision accept() { return new SellDecision(Action.ACCEPT, null, null); }
        public static SellDecision reject() { return new SellDecision(Action.REJECT, null, null); }
        public static SellDecision counter(long amount, long wage) { return new SellDecision(Action.COUNTER, amount, wage); }
    }

    public record BuyDecision(boolean willBuy, Long offerAmount, Long offeredWage, Integer contractYears, String reason) {
        static BuyDecision no(String reason) { return new BuyDecision(false, null, null, null, reason); }
        static BuyDecision yes(long amount, long wage, int years) { return new BuyDecision(true, amount, wage, years, null); }
    }

    public record FreeAgentDecision(Action action, Long wage) {}

    /** Réponse d'un acheteur IA au prix réclamé par le vendeur humain. */
    public record BidResponse(Action action, Long fee) {}

    public record PositionNeed(int current, int ideal, double averageOverall) {
        public boolean isNeeded() {
            return current < ideal;
        }

        public double needScore() {
            return ideal <= 0 ? 0 : Math.max(0, ideal - current) / (double) ideal;
        }
    }

    public record ReleaseCandidate(Player player, ReleaseFeeQuote quote) {}

    public record SquadProfile(int size, double averageOverall, Map<Position, PositionNeed> needs) {
        public PositionNeed need(Position position) {
            PositionNeed need = position != null ? needs.get(position) : null;
            if (need == null) {
                int ideal = position != null ? position.getIdealCount() : 0;
                return new PositionNeed(0, ideal, ValuationService.NEUTRAL_RATING);
            }
            return need;
        }
    }

    // ============================== PROFIL D'EFFECTIF ==============================

    public SquadProfile assessSquad(List<Player> squad) {
        Map<Position, List<Double>> ratingsByPosition = new EnumMap<>(Position.class);
        for (Position position : Position.values()) {
            ratingsByPosition.put(position, new ArrayList<>());
        }
        double[] all = new double[squad.size()];
        for (int i = 0; i < squad.size(); i++) {
            Player player = squad.get(i);
            all[i] = valuation.overall(player);
            if (player.getPosition() != null) {
                ratingsByPosition.get(player.getPosition()).add(all[i]);
            }
        }

        Map<Position, PositionNeed> needs = new EnumMap<>(Position.class);
        ratingsByPosition.forEach((position, ratings) -> needs.put(position, new PositionNeed(
                ratings.size(),
                position.getIdealCount(),
                meanOrNeutral(ratings.stream().mapToDouble(Double::doubleValue).toArray()))));

        return new SquadProfile(squad.size(), meanOrNeutral(all), needs);
    }

    // ============================== VENTE ==============================

    /**
     * Réponse d'un club vendeur à une offre.
     * Accepte au prix demandé (ou un peu moins si le joueur est en surplus ou en fin de contrat),
     * contre-propose au point milieu si l'offre est proche, refuse sinon.
     */
    public SellDecision sellDecision(long askingPrice, long offerFee, long offerWage, Integer squadSize,
                                     Player player, int currentSeason, TransferConfig config) {
        if (askingPrice <= 0) {
            return SellDecision.accept();
        }
        double priceRatio = (double) offerFee / askingPrice;
        int size = squadSize != null ? squadSize : 0;

        if (priceRatio >= config.getAcceptThreshold()) {
            return SellDecision.accept();
        }

        boolean easierToRelease = size > config.getIdealSquadSize()
                || valuation.isContractExpiring(player, currentSeason);
        if (easierToRelease && priceRatio >= config.getOverstaffedAcceptThreshold()) {
            return SellDecision.accept();
        }

        if (priceRatio >= config.getCounterThreshold()) {
            long counterAmount = Math.round((offerFee + askingPrice) / 2.0);
            long currentWage = player.getWage() != null ? player.getWage() : 0L;
            long counterWage = Math.max(offerWage, Math.round(currentWage * 1.1));
            return SellDecision.counter(counterAmount, counterWage);
        }
        return SellDecision.reject();
    }

    // ============================== ACHAT ==============================

    /**
     * Décision d'achat d'un joueur listé. Ne propose jamais plus que le budget ni un salaire
     * au-delà de la part allouable de la masse salariale restante.
     *
     * @param wageBudget masse salariale encore disponible pour le club acheteur
     */
    public BuyDecision buyDecision(Player player, long askingPrice, long budget, long wageBudget,
                                   double squadAvgOverall, SquadProfile positionNeeds, int reputation,
                                   TransferConfig config) {
        int overall = valuation.overall(player);
        double effectiveRating = effectiveRating(player, overall, config);

        PositionNeed need = positionNeeds.need(player.getPosition());
        boolean upgrade = config.isAllowPositionUpgrades()
                && effectiveRating >= need.averageOverall() + config.getUpgradeQualityThreshold();
        if (player.getPosition() == null || (!need.isNeeded() && !upgrade)) {
            return BuyDecision.no(REASON_POSITION_NOT_NEEDED);
        }

        if (effectiveRating < squadAvgOverall + config.getBuyQualityThreshold()) {
            return BuyDecision.no(REASON_QUALITY_TOO_LOW);
        }

        if (askingPrice > budget * config.getMaxBudgetSpendRatio()) {
            return BuyDecision.no(REASON_FEE_UNAFFORDABLE);
        }

        long wage = valuation.wageDemand(player, reputation);
        if (wage > wageBudget * config.getMaxWageAllocationRatio()) {
            return BuyDecision.no(REASON_WAGE_UNAFFORDABLE);
        }

        long offerAmount = Math.min(budget, Math.round(askingPrice * config.getOfferPriceRatio()));
        return BuyDecision.yes(offerAmount, wage, transferContractYears(player));
    }

    /**
     * Intérêt d'un club IA pour un joueur libre (pas d'indemnité, uniquement le salaire).
     */
    public BuyDecision freeAgentTargetDecision(Player player, long wageBudget, double squadAvgOverall,
                                               SquadProfile positionNeeds, int reputation, TransferConfig config) {
        if (player.getPosition() == null || !positionNeeds.need(player.getPosition()).isNeeded()) {
            return BuyDecision.no(REASON_POSITION_NOT_NEEDED);
        }
        if (valuation.overall(player) < squadAvgOverall + FREE_AGENT_QUALITY_MARGIN) {
            return BuyDecision.no(REASON_QUALITY_TOO_LOW);
        }
        long wage = valuation.wageDemand(player, reputation);
        // Moitié de l'allocation habituelle : un joueur libre reste un pari
        if (wage > wageBudget * config.getMaxWageAllocationRatio() / 2) {
            return BuyDecision.no(REASON_WAGE_UNAFFORDABLE);
        }
        return BuyDecision.yes(0L, wage, freeAgentContractYears(player));
    }

    // ============================== JOUEUR LIBRE ==============================

    /**
     * Réponse d'un joueur libre à une proposition de salaire.
     * Au dernier tour de négociation la réponse est forcément une acceptation ou un refus.
     */
    public FreeAgentDecision freeAgentDecision(long expectedWage, long offeredWage, int reputation, int round,
                                               TransferConfig config) {
        if (expectedWage <= 0) {
            return new FreeAgentDecision(Action.ACCEPT, offeredWage);
        }
        double ratio = (double) offeredWage / expectedWage;

        if (ratio >= config.getFreeAgentAcceptRatio()) {
            return new FreeAgentDecision(Action.ACCEPT, offeredWage);
        }

        TransferMarketProperties.Negotiation negotiation = properties.getNegotiation();
        if (round >= negotiation.getMaxRounds()) {
            return ratio >= negotiation.getFreeAgentFinalTolerance()
                    ? new FreeAgentDecision(Action.ACCEPT, offeredWage)
                    : new FreeAgentDecision(Action.REJECT, null);
        }

        double rejectRatio = config.getFreeAgentRejectRatio();
        if (reputation >= PRESTIGE_REPUTATION) {
            rejectRatio -= PRESTIGE_REJECT_DISCOUNT;
        }
        if (ratio < rejectRatio) {
            return new FreeAgentDecision(Action.REJECT, null);
        }
        return new FreeAgentDecision(Action.COUNTER, Math.round((offeredWage + expectedWage) / 2.0));
    }

    // ============================== CONTRE-PROPOSITION ACHETEUR ==============================

    /**
     * Un acheteur IA face au prix réclamé par un vendeur humain.
     * Ne dépasse jamais son prix de réserve ; au dernier tour, accepte si la réserve couvre 90% de la demande.
     */
    public BidResponse counterBidDecision(long reservationPrice, long demandedFee, long currentBid, int round,
                                          TransferConfig config) {
        if (demandedFee <= reservationPrice) {
            return new BidResponse(Action.ACCEPT, demandedFee);
        }
        double ratio = demandedFee > 0 ? (double) reservationPrice / demandedFee : 1.0;

        TransferMarketProperties.Negotiation negotiation = properties.getNegotiation();
        if (round >= negotiation.getMaxRounds()) {
            return ratio >= negotiation.getListedFinalTolerance()
                    ? new BidResponse(Action.ACCEPT, demandedFee)
                    : new BidResponse(Action.REJECT, null);
        }

        if (ratio >= config.getAcceptThreshold()) {
            return new BidResponse(Action.ACCEPT, demandedFee);
        }
        if (ratio >= config.getCounterThreshold() && reservationPrice > currentBid) {
            long counter = Math.min(reservationPrice, Math.round((currentBid + demandedFee) / 2.0));
            return new BidResponse(Action.COUNTER, counter);
        }
        return new BidResponse(Action.REJECT, null);
    }

    // ============================== MISE EN VENTE ==============================

    /**
     * Joueurs qu'un club IA met en vente ce tour-ci : les plus faibles des postes en surplus
     * (si l'effectif déborde), les fins de contrat non renouvelées, puis les vétérans.
     * Limité à {@code maxListingsPerTeamPerRound}.
     */
    public List<Player> selectPlayersToList(List<Player> squad, int currentSeason, TransferConfig config) {
        Set<Player> toList = new LinkedHashSet<>();

        if (squad.size() > config.getIdealSquadSize() + 2) {
            for (Position position : Position.values()) {
                List<Player> atPosition = squad.stream()
                        .filter(p -> p.getPosition() == position)
                        .sorted(Comparator.comparingInt(valuation::overall))
                        .toList();
                int excess = atPosition.size() - position.getIdealCount();
                for (int i = 0; i < excess; i++) {
                    toList.add(atPosition.get(i));
                }
            }
        }

        for (Player player : squad) {
            if (valuation.isContractExpiring(player, currentSeason) && !valuation.shouldAutoRenew(player)) {
                toList.add(player);
            }
        }

        for (Player player : squad) {
            if (player.getAge() != null && player.getAge() >= VETERAN_LISTING_AGE && !valuation.shouldAutoRenew(player)) {
                toList.add(player);
            }
        }

        return toList.stream()
                .limit(Math.max(0, config.getMaxListingsPerTeamPerRound()))
                .toList();
    }

    /**
     * Choisit au plus un joueur à libérer dans un effectif de plus de 20 joueurs actifs :
     * un vétéran en déclin (34 ans et plus, note 69 au plus) ou un remplaçant peu utilisé
     * nettement sous la moyenne de l'équipe. On garde au moins trois joueurs par poste et
     * l'indemnité doit rester raisonnable face au salaire annuel et au budget du club.
     */
    public Optional<ReleaseCandidate> selectPlayerToRelease(List<Player> squad, Set<Long> listedPlayerIds, long budget,
                                                            int currentSeason, int currentRound) {
        List<Player> active = squad.stream()
                .filter(p -> p.getStatus() == null || p.getStatus() == PlayerStatus.ACTIVE)
                .toList();
        if (active.size() <= RELEASE_MIN_SQUAD_SIZE) {
            return Optional.empty();
        }

        Map<Position, Integer> positionCounts = new EnumMap<>(Position.class);
        for (Player player : active) {
            if (player.getPosition() != null) {
                positionCounts.merge(player.getPosition(), 1, Integer::sum);
            }
        }
        double teamAverage = meanOrNeutral(active.stream().mapToDouble(valuation::overall).toArray());

        List<ReleaseCandidate> candidates = new ArrayList<>();
        for (Player player : active) {
            if (listedPlayerIds.contains(player.getId()) || player.getContractEndSeason() == null
                    || player.getContractEndSeason() <= currentSeason) {
                continue;
            }
            int overall = valuation.overall(player);
            ReleaseFeeQuote quote = valuation.releaseCompensation(player, currentSeason, currentRound);
            boolean lowUse = quote.getUtilizationRatio() < RELEASE_LOW_USE_RATIO;
            boolean declining = player.getAge() != null && player.getAge() >= RELEASE_DECLINING_AGE
                    && overall <= RELEASE_DECLINING_MAX_OVERALL;
            boolean fringe = overall <= teamAverage - RELEASE_FRINGE_MARGIN;
            if (declining || (lowUse && fringe)) {
                candidates.add(new ReleaseCandidate(player, quote));
            }
        }
        // Les plus coûteux et les moins utiles d'abord
        candidates.sort(Comparator.comparingDouble(this::releaseScore).reversed());

        for (ReleaseCandidate candidate : candidates) {
            Player player = candidate.player();
            if (positionCounts.getOrDefault(player.getPosition(), 0) <= RELEASE_MIN_AT_POSITION) {
                continue;
            }
            double seasonWage = nonNegative(player.getWage()) * (double) ValuationService.ROUNDS_PER_SEASON;
            double maxFee = Math.max(seasonWage * 0.9, budget * 0.08);
            long fee = candidate.quote().getFee();
            if (fee > maxFee || fee > seasonWage * 1.2) {
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    // ============================== OUTILS ==============================

    private double releaseScore(ReleaseCandidate candidate) {
        Player player = candidate.player();
        boolean lowUse = candidate.quote().getUtilizationRatio() < RELEASE_LOW_USE_RATIO;
        return nonNegative(player.getWage()) + (lowUse ? 20_000 : 0) - valuation.overall(player) * 200.0;
    }

    private double effectiveRating(Player player, int overall, TransferConfig config) {
        if (player.getAge() != null && player.getAge() < 25 && player.getPotential() != null) {
            return overall + Math.max(0, (player.getPotential() - overall) * config.getPotentialWeightForYouth());
        }
        return overall;
    }

    private static int transferContractYears(Player player) {
        int age = player.getAge() != null ? player.getAge() : 27;
        if (age < 25) return 4;
        if (age < 30) return 3;
        return 2;
    }

    private static int freeAgentContractYears(Player player) {
        int age = player.getAge() != null ? player.getAge() : 27;
        if (age < 28) return 3;
        if (age < 32) return 2;
        return 1;
    }

    private static double meanOrNeutral(double[] values) {
        return values.length == 0 ? ValuationService.NEUTRAL_RATING : StatUtils.mean(values);
    }

    private static long nonNegative(Long value) {
        return value != null ? Math.max(0L, value) : 0L;
    }
}
