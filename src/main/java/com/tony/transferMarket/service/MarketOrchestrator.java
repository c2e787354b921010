package com.tony.transferMarket.service;

import com.tony.transferMarket.config.TransferConfig;
import com.tony.transferMarket.config.TransferMarketProperties;
import com.tony.transferMarket.exception.ConflictException;
import com.tony.transferMarket.model.*;
import com.tony.transferMarket.model.dto.AiTransferSummary;
import com.tony.transferMarket.repository.*;
import com.tony.transferMarket.service.AiDecisionService.Action;
import com.tony.transferMarket.service.AiDecisionService.BidResponse;
import com.tony.transferMarket.service.AiDecisionService.BuyDecision;
import com.tony.transferMarket.service.AiDecisionService.FreeAgentDecision;
import com.tony.transferMarket.service.AiDecisionService.ReleaseCandidate;
import com.tony.transferMarket.service.AiDecisionService.SellDecision;
import com.tony.transferMarket.service.AiDecisionService.SquadProfile;
import com.tony.transferMarket.service.mutation.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Journée de marché des clubs IA, dans un ordre fixe :
 * expiration, réponses aux offres, annonces, offres d'achat, joueurs libres, libérations.
 * <p>
 * Chaque étape relit l'état en base avant d'écrire. Les écritures en masse passent par
 * {@link MutationApplier#applyChunked(List)} : un échec en cours de séquence est fatal et
 * toute la journée IA doit être relancée.
 */
@Service
@Slf4j
public class MarketOrchestrator {

    static final int LISTING_CHURN_ROUNDS = 6;
    static final double LISTING_MARKDOWN_STEP = 0.04;
    static final int LISTING_MARKDOWN_INTERVAL = 4;
    static final double LISTING_PRICE_FLOOR_RATIO = 0.75;

    private final GameSaveRepository saveRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final TransferListingRepository listingRepository;
    private final TransferOfferRepository offerRepository;
    private final ValuationService valuation;
    private final AiDecisionService aiDecisions;
    private final ExpirySweeper expirySweeper;
    private final TransferLedger ledger;
    private final MutationApplier mutationApplier;
    private final TransferMarketProperties properties;
    private final RandomGenerator random;
    private final TransactionTemplate transactionTemplate;

    public MarketOrchestrator(GameSaveRepository saveRepository,
                              TeamRepository teamRepository,
                              PlayerRepository playerRepository,
                              TransferListingRepository listingRepository,
                              TransferOfferRepository offerRepository,
                              ValuationService valuation,
                              AiDecisionService aiDecisions,
                              ExpirySweeper expirySweeper,
                              TransferLedger ledger,
                              MutationApplier mutationApplier,
                              TransferMarketProperties properties,
                              RandomGenerator marketRandom,
                              PlatformTransactionManager transactionManager) {
        this.saveRepository = saveRepository;
        this.teamRepository = teamRepository;
        this.playerRepository = playerRepository;
        this.listingRepository = listingRepository;
        this.offerRepository = offerRepository;
        this.valuation = valuation;
        this.aiDecisions = aiDecisions;
        this.expirySweeper = expirySweeper;
        this.ledger = ledger;
        this.mutationApplier = mutationApplier;
        this.properties = properties;
        this.random = marketRandom;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    private static final class ResponseCounts {
        int responses;
        int completed;
        int rejected;
        int countered;
    }

    /**
     * Fait jouer le marché aux clubs IA pour la journée {@code round}.
     *
     * @param config réglages de l'IA ; {@code null} pour le préréglage configuré
     */
    public AiTransferSummary processAITransfers(Long saveId, Long humanTeamId, int season, int round,
                                                TransferConfig config) {
        TransferConfig cfg = config != null ? config : properties.defaultTransferConfig();
        List<Team> aiTeams = teamRepository.findAiTeams(saveId, humanTeamId);

        int expired = expirySweeper.sweep(saveId, round);
        ResponseCounts responses = respondToOffers(saveId, aiTeams, season, round, cfg);
        int newListings = processListings(saveId, aiTeams, season, round, cfg);
        int newOffers = processOffers(saveId, aiTeams, season, round, cfg);
        int signings = processFreeAgents(saveId, aiTeams, season, round, cfg);
        int released = processReleases(saveId, aiTeams, season, round);

        AiTransferSummary summary = AiTransferSummary.builder()
                .expiredOffers(expired)
                .aiOfferResponses(responses.responses)
                .aiAutoCompletedTransfers(responses.completed)
                .aiRejectedOffers(responses.rejected)
                .aiCounterOffers(responses.countered)
                .newListings(newListings)
                .newOffers(newOffers)
                .freeAgentSignings(signings)
                .releasedPlayers(released)
                .build();

        log.info("📊 Marché IA partie {} journée {} : {} expirée(s), {} réponse(s) ({} transfert(s), {} refus, {} contre), "
                        + "{} annonce(s), {} offre(s), {} signature(s) libre(s), {} libération(s)",
                saveId, round, expired, responses.responses, responses.completed, responses.rejected,
                responses.countered, newListings, newOffers, signings, released);
        return summary;
    }

    // ============================== 1. RÉPONSES AUX OFFRES ==============================

    /**
     * Les vendeurs IA répondent aux offres en attente sur leurs joueurs ; les acheteurs IA
     * tranchent les contre-propositions qu'ils ont reçues.
     */
    ResponseCounts respondToOffers(Long saveId, List<Team> aiTeams, int season, int round, TransferConfig config) {
        ResponseCounts counts = new ResponseCounts();
        if (aiTeams.isEmpty()) {
            return counts;
        }
        Set<Long> aiTeamIds = aiTeams.stream().map(Team::getId).collect(Collectors.toSet());
        Map<Long, Long> squadSizes = new HashMap<>();

        List<TransferOffer> candidates = offerRepository.findBySaveIdAndStatusIn(saveId, OfferStatus.OUTSTANDING);
        for (TransferOffer candidate : candidates) {
            // Relecture : l'offre a pu changer depuis la requête groupée (humain, transfert déjà conclu)
            TransferOffer offer = offerRepository.findById(candidate.getId()).orElse(null);
            if (offer == null || !offer.getStatus().isOutstanding()) {
                continue;
            }
            Long sellerId = offer.getSellerTeamId();
            Long buyerId = offer.getBuyerTeam().getId();
            try {
                if (offer.getStatus() == OfferStatus.PENDING && sellerId != null && aiTeamIds.contains(sellerId)) {
                    long squadSize = squadSizes.computeIfAbsent(sellerId, playerRepository::countByTeam_Id);
                    answerAsSeller(saveId, offer, (int) squadSize, season, round, config, counts);
                } else if (offer.getStatus() == OfferStatus.COUNTER && aiTeamIds.contains(buyerId)) {
                    answerAsBuyer(saveId, offer, season, round, config, counts);
                }
            } catch (ConflictException e) {
                log.warn("⚠️ Offre {} modifiée pendant la réponse IA, ignorée : {}", offer.getId(), e.getMessage());
            }
        }
        return counts;
    }

    private void answerAsSeller(Long saveId, TransferOffer offer, int squadSize, int season, int round,
                                TransferConfig config, ResponseCounts counts) {
        Long offerId = offer.getId();
        long fee = offer.getFee();
        long wage = offer.getWage();
        long asking = askingPriceFor(saveId, offer.getPlayer(), season);
        SellDecision decision = aiDecisions.sellDecision(asking, fee, wage, squadSize, offer.getPlayer(), season, config);

        List<MarketMutation> batch = new ArrayList<>();
        TransferService.applySellResponse(batch, offerId, OfferStatus.PENDING, decision, fee, wage, round);
        if (decision.action() == Action.ACCEPT) {
            acceptAndComplete(saveId, batch, offerId);
            counts.completed++;
        } else {
            mutationApplier.apply(batch);
            if (decision.action() == Action.COUNTER) {
                counts.countered++;
            } else {
                counts.rejected++;
            }
        }
        counts.responses++;
    }

    /**
     * Un acheteur IA ne relance pas : face à une contre-proposition il accepte si elle tient
     * dans son prix de réserve (tolérance du dernier tour), sinon il se retire.
     */
    private void answerAsBuyer(Long saveId, TransferOffer offer, int season, int round, TransferConfig config,
                               ResponseCounts counts) {
        Long offerId = offer.getId();
        Team buyer = offer.getBuyerTeam();
        long counterFee = offer.getCounterFee() != null ? offer.getCounterFee() : offer.getFee();
        long counterWage = offer.getCounterWage() != null ? offer.getCounterWage() : offer.getWage();

        boolean accepted;
        if (offer.isFreeAgentSigning()) {
            long wageRoom = buyer.getWageBudget() - playerRepository.sumWagesByTeamId(buyer.getId());
            accepted = counterWage <= wageRoom * config.getMaxWageAllocationRatio();
        } else {
            TransferMarketProperties.Negotiation negotiation = properties.getNegotiation();
            double finalHardening = 1 + negotiation.getHardeningStep() * negotiation.getMaxRounds();
            long reservation = Math.min(Math.round(buyer.getBudget() * config.getMaxBudgetSpendRatio()),
                    Math.round(askingPriceFor(saveId, offer.getPlayer(), season) * finalHardening));
            BidResponse response = aiDecisions.counterBidDecision(reservation, counterFee, offer.getFee(),
                    negotiation.getMaxRounds(), config);
            accepted = response.action() == Action.ACCEPT && counterFee <= buyer.getBudget();
        }

        if (accepted) {
            List<MarketMutation> batch = new ArrayList<>();
            batch.add(SetOfferStatus.accept(offerId, OfferStatus.COUNTER, counterFee, counterWage, round));
            acceptAndComplete(saveId, batch, offerId);
            counts.completed++;
        } else {
            mutationApplier.apply(List.of(SetOfferStatus.respond(offerId, OfferStatus.COUNTER, OfferStatus.REJECTED, round)));
            counts.rejected++;
        }
        counts.responses++;
    }

    private void acceptAndComplete(Long saveId, List<MarketMutation> acceptBatch, Long offerId) {
        transactionTemplate.executeWithoutResult(status -> {
            mutationApplier.apply(acceptBatch);
            ledger.completeTransfer(saveId, offerId);
        });
    }

    // ============================== 2. ANNONCES ==============================

    int processListings(Long saveId, List<Team> aiTeams, int season, int round, TransferConfig config) {
        if (aiTeams.isEmpty()) {
            return 0;
        }
        List<Long> aiTeamIds = aiTeams.stream().map(Team::getId).toList();
        Map<Long, List<Player>> squads = playerRepository.findBySaveIdAndTeam_IdIn(saveId, aiTeamIds).stream()
                .filter(p -> p.getStatus() == PlayerStatus.ACTIVE)
                .collect(Collectors.groupingBy(Player::getTeamId, LinkedHashMap::new, Collectors.toList()));

        Map<Long, Set<Long>> selectedByTeam = new HashMap<>();
        Map<Long, Player> playersById = new HashMap<>();
        squads.forEach((teamId, squad) -> {
            squad.forEach(p -> playersById.put(p.getId(), p));
            selectedByTeam.put(teamId, aiDecisions.selectPlayersToList(squad, season, config).stream()
                    .map(Player::getId)
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        });

        List<MarketMutation> batch = new ArrayList<>();
        Set<Long> listed = listingRepository.findBySaveId(saveId).stream()
                .map(l -> l.getPlayer().getId())
                .collect(Collectors.toCollection(HashSet::new));

        // Annonces sans offre depuis trop longtemps : retirées, puis remises en vente moins cher si le club le souhaite
        int delisted = 0;
        int relisted = 0;
        Map<Long, List<Integer>> offerRoundsByPlayer = offerRepository.findBySaveId(saveId).stream()
                .collect(Collectors.groupingBy(o -> o.getPlayer().getId(),
                        Collectors.mapping(TransferOffer::getCreatedRound, Collectors.toList())));
        for (TransferListing listing : listingRepository.findBySaveIdAndTeamIdIn(saveId, aiTeamIds)) {
            int listingAge = round - listing.getListedRound();
            Long playerId = listing.getPlayer().getId();
            if (listingAge < LISTING_CHURN_ROUNDS) {
                continue;
            }
            boolean hasOffers = offerRoundsByPlayer.getOrDefault(playerId, List.of()).stream()
                    .anyMatch(r -> r >= listing.getListedRound());
            if (hasOffers) {
                continue;
            }
            batch.add(new DeleteListing(saveId, playerId));
            listed.remove(playerId);
            delisted++;

            Long teamId = listing.getTeam().getId();
            Player player = playersById.get(playerId);
            if (player == null || !selectedByTeam.getOrDefault(teamId, Set.of()).contains(playerId)) {
                continue;
            }
            batch.add(new InsertListing(saveId, playerId, teamId, markedDownPrice(player, season, listingAge),
                    listingStatus(player, season), round));
            listed.add(playerId);
            relisted++;
        }

        int fresh = 0;
        for (Map.Entry<Long, Set<Long>> entry : selectedByTeam.entrySet()) {
            for (Long playerId : entry.getValue()) {
                if (listed.contains(playerId)) {
                    continue;
                }
                Player player = playersById.get(playerId);
                batch.add(new InsertListing(saveId, playerId, entry.getKey(),
                        valuation.askingPrice(player, season), listingStatus(player, season), round));
                listed.add(playerId);
                fresh++;
            }
        }

        if (!batch.isEmpty()) {
            mutationApplier.applyChunked(batch);
        }
        if (delisted > 0 || relisted > 0) {
            log.info("🔁 Annonces IA : {} retirée(s), {} remise(s) en vente, {} nouvelle(s)", delisted, relisted, fresh);
        }
        return fresh + relisted;
    }

    long markedDownPrice(Player player, int season, int listingAge) {
        long base = valuation.askingPrice(player, season);
        int steps = Math.max(0, listingAge) / LISTING_MARKDOWN_INTERVAL;
        double factor = Math.max(LISTING_PRICE_FLOOR_RATIO, 1 - steps * LISTING_MARKDOWN_STEP);
        return Math.round(base * factor);
    }

    private ListingStatus listingStatus(Player player, int season) {
        return valuation.isContractExpiring(player, season) ? ListingStatus.CONTRACT_EXPIRING : ListingStatus.AVAILABLE;
    }

    // ============================== 3. OFFRES D'ACHAT ==============================

    int processOffers(Long saveId, List<Team> aiTeams, int season, int round, TransferConfig config) {
        List<TransferListing> listings = listingRepository.findBySaveId(saveId);
        if (aiTeams.isEmpty() || listings.isEmpty()) {
            return 0;
        }
        Map<Long, List<Player>> squads = squadsOf(saveId, aiTeams);
        Set<String> outstanding = offerRepository.findBySaveIdAndStatusIn(saveId, OfferStatus.OUTSTANDING).stream()
                .map(o -> offerKey(o.getPlayer().getId(), o.getBuyerTeam().getId()))
                .collect(Collectors.toCollection(HashSet::new));

        List<MarketMutation> batch = new ArrayList<>();
        Map<String, Integer> rejectionReasons = new TreeMap<>();
        int maxOffers = config.getMaxOffersPerTeamPerRound();

        for (Team team : aiTeams) {
            List<Player> squad = squads.getOrDefault(team.getId(), List.of());
            SquadProfile profile = aiDecisions.assessSquad(squad);
            long budget = team.getBudget();
            long wageRoom = Math.max(0, team.getWageBudget() - playerRepository.sumWagesByTeamId(team.getId()));
            int made = 0;

            for (int index : shuffledIndexes(listings.size())) {
                if (made >= maxOffers) {
                    break;
                }
                TransferListing listing = listings.get(index);
                Player player = listing.getPlayer();
                if (team.getId().equals(listing.getTeam().getId())
                        || outstanding.contains(offerKey(player.getId(), team.getId()))) {
                    continue;
                }
                BuyDecision decision = aiDecisions.buyDecision(player, listing.getAskingPrice(), budget, wageRoom,
                        profile.averageOverall(), profile, team.getReputation(), config);
                if (!decision.willBuy()) {
                    rejectionReasons.merge(decision.reason(), 1, Integer::sum);
                    continue;
                }
                if (random.nextDouble() >= config.getBaseOfferProbability()) {
                    continue;
                }
                batch.add(new InsertOffer(saveId, player.getId(), listing.getTeam().getId(), team.getId(),
                        decision.offerAmount(), decision.offeredWage(), decision.contractYears(),
                        OfferStatus.PENDING, round, round + config.getOfferExpiryRounds()));
                outstanding.add(offerKey(player.getId(), team.getId()));
                // Le budget engagé ce tour n'est plus disponible pour les offres suivantes
                budget -= decision.offerAmount();
                wageRoom -= decision.offeredWage();
                made++;
            }
        }

        if (!batch.isEmpty()) {
            mutationApplier.applyChunked(batch);
        }
        if (!rejectionReasons.isEmpty()) {
            log.info("🔎 Évaluation des offres IA : {} annonce(s) x {} club(s), {} offre(s), motifs de refus {}",
                    listings.size(), aiTeams.size(), batch.size(), rejectionReasons);
        }
        return batch.size();
    }

    // ============================== 4. JOUEURS LIBRES ==============================

    /**
     * Au plus une signature par club et par journée. L'ordre des clubs est tiré au sort
     * pour qu'aucun ne se serve toujours en premier.
     */
    int processFreeAgents(Long saveId, List<Team> aiTeams, int season, int round, TransferConfig config) {
        List<Player> freeAgents = playerRepository.findBySaveIdAndTeamIsNull(saveId).stream()
                .filter(p -> p.getStatus() == PlayerStatus.ACTIVE)
                .sorted(Comparator.comparingInt(valuation::overall).reversed())
                .toList();
        if (aiTeams.isEmpty() || freeAgents.isEmpty()) {
            return 0;
        }
        Map<Long, List<Player>> squads = squadsOf(saveId, aiTeams);
        Set<Long> signed = new HashSet<>();
        int signings = 0;

        for (int index : shuffledIndexes(aiTeams.size())) {
            Team team = aiTeams.get(index);
            SquadProfile profile = aiDecisions.assessSquad(squads.getOrDefault(team.getId(), List.of()));
            long wageRoom = Math.max(0, team.getWageBudget() - playerRepository.sumWagesByTeamId(team.getId()));

            for (Player freeAgent : freeAgents) {
                if (signed.contains(freeAgent.getId())) {
                    continue;
                }
                BuyDecision target = aiDecisions.freeAgentTargetDecision(freeAgent, wageRoom,
                        profile.averageOverall(), profile, team.getReputation(), config);
                if (!target.willBuy()) {
                    continue;
                }
                long expected = valuation.freeAgentExpectedWage(freeAgent, target.contractYears(),
                        config.getFreeAgentUnemploymentFactor());
                FreeAgentDecision answer = aiDecisions.freeAgentDecision(expected, target.offeredWage(),
                        team.getReputation(), 0, config);
                Long agreedWage = agreedFreeAgentWage(answer, target, wageRoom, config);
                if (agreedWage == null) {
                    continue;
                }
                try {
                    signFreeAgent(saveId, freeAgent.getId(), team.getId(), agreedWage, target.contractYears(), round, config);
                } catch (ConflictException e) {
                    log.warn("⚠️ Signature de {} par le club {} abandonnée : {}", freeAgent.getName(), team.getId(), e.getMessage());
                    continue;
                }
                signed.add(freeAgent.getId());
                signings++;
                log.info("🆓 {} signe libre au club {} ({} par journée, {} an(s))",
                        freeAgent.getName(), team.getName(), agreedWage, target.contractYears());
                break;
            }
        }
        return signings;
    }

    // Le club suit la contre-proposition du joueur tant qu'elle reste dans sa masse salariale
    private static Long agreedFreeAgentWage(FreeAgentDecision answer, BuyDecision target, long wageRoom,
                                            TransferConfig config) {
        if (answer.action() == Action.ACCEPT) {
            return target.offeredWage();
        }
        if (answer.action() == Action.COUNTER && answer.wage() <= wageRoom * config.getMaxWageAllocationRatio()) {
            return answer.wage();
        }
        return null;
    }

    private void signFreeAgent(Long saveId, Long playerId, Long teamId, long wage, int contractYears, int round,
                               TransferConfig config) {
        transactionTemplate.executeWithoutResult(status -> {
            TransferOffer offer = new TransferOffer();
            offer.setSave(saveRepository.getReferenceById(saveId));
            offer.setPlayer(playerRepository.getReferenceById(playerId));
            offer.setBuyerTeam(teamRepository.getReferenceById(teamId));
            offer.setFee(0L);
            offer.setWage(wage);
            offer.setContractYears(contractYears);
            offer.setStatus(OfferStatus.ACCEPTED);
            offer.setCreatedRound(round);
            offer.setExpiresRound(round + config.getOfferExpiryRounds());
            offer.setRespondedRound(round);
            Long offerId = offerRepository.saveAndFlush(offer).getId();
            ledger.completeTransfer(saveId, offerId);
        });
    }

    // ============================== 5. LIBÉRATIONS ==============================

    /** Au plus une libération par club IA, toutes écrites en un seul lot. */
    int processReleases(Long saveId, List<Team> aiTeams, int season, int round) {
        if (aiTeams.isEmpty()) {
            return 0;
        }
        Map<Long, List<Player>> squads = squadsOf(saveId, aiTeams);
        Set<Long> listed = listingRepository.findBySaveId(saveId).stream()
                .map(l -> l.getPlayer().getId())
                .collect(Collectors.toSet());

        List<MarketMutation> batch = new ArrayList<>();
        int released = 0;
        for (Team team : aiTeams) {
            Optional<ReleaseCandidate> candidate = aiDecisions.selectPlayerToRelease(
                    squads.getOrDefault(team.getId(), List.of()), listed,
                    team.getBudget() != null ? team.getBudget() : 0L, season, round);
            if (candidate.isEmpty()) {
                continue;
            }
            Player player = candidate.get().player();
            long fee = candidate.get().quote().getFee();
            batch.addAll(ledger.releaseMutations(saveId, player.getId(), player.getName(), team.getId(), fee, round));
            released++;
            log.info("👋 {} libéré par {} (indemnité {})", player.getName(), team.getName(), fee);
        }
        if (!batch.isEmpty()) {
            mutationApplier.applyChunked(batch);
        }
        return released;
    }

    // ============================== OUTILS ==============================

    private Map<Long, List<Player>> squadsOf(Long saveId, List<Team> teams) {
        List<Long> teamIds = teams.stream().map(Team::getId).toList();
        return playerRepository.findBySaveIdAndTeam_IdIn(saveId, teamIds).stream()
                .collect(Collectors.groupingBy(Player::getTeamId));
    }

    private long askingPriceFor(Long saveId, Player player, int season) {
        return listingRepository.findBySaveIdAndPlayerId(saveId, player.getId())
                .map(TransferListing::getAskingPrice)
                .orElseGet(() -> valuation.askingPrice(player, season));
    }

    // Mélange de Fisher-Yates sur les indices
    private int[] shuffledIndexes(int size) {
        int[] indexes = MathArrays.natural(size);
        MathArrays.shuffle(indexes, random);
        return indexes;
    }

    private static String offerKey(Long playerId, Long buyerTeamId) {
        return playerId + "-" + buyerTeamId;
    }
}
