package com.tony.transferMarket.service;

import com.tony.transferMarket.config.TransferConfig;
import com.tony.transferMarket.config.TransferMarketProperties;
import com.tony.transferMarket.exception.AuthorizationException;
import com.tony.transferMarket.exception.ConflictException;
import com.tony.transferMarket.exception.NotFoundException;
import com.tony.transferMarket.exception.ValidationException;
import com.tony.transferMarket.model.*;
import com.tony.transferMarket.model.dto.*;
import com.tony.transferMarket.repository.*;
import com.tony.transferMarket.service.AiDecisionService.FreeAgentDecision;
import com.tony.transferMarket.service.AiDecisionService.SellDecision;
import com.tony.transferMarket.service.mutation.MarketMutation;
import com.tony.transferMarket.service.mutation.MutationApplier;
import com.tony.transferMarket.service.mutation.SetOfferStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Opérations du marché exposées au club humain : consultation, mise en vente, offres, réponses.
 * Toutes les erreurs remontent de façon synchrone à l'appelant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    public static final long MAX_FEE = 1_000_000_000L;
    public static final long MAX_WAGE = 10_000_000L;
    public static final int MIN_CONTRACT_YEARS = 1;
    public static final int MAX_CONTRACT_YEARS = 5;

    private final GameSaveRepository saveRepository;
    private final PlayerRepository playerRepository;
    private final TransferListingRepository listingRepository;
    private final TransferOfferRepository offerRepository;
    private final ValuationService valuation;
    private final AiDecisionService aiDecisions;
    private final TransferLedger ledger;
    private final MutationApplier mutationApplier;
    private final TransferMarketProperties properties;

    // ============================== CONSULTATION ==============================

    @Transactional(readOnly = true)
    public MarketView getMarket(Long saveId, Long excludeTeamId) {
        loadSave(saveId);
        List<ListingView> listed = listingRepository.findBySaveId(saveId).stream()
                .filter(l -> excludeTeamId == null || !excludeTeamId.equals(l.getTeam().getId()))
                .map(l -> ListingView.of(l, valuation.overall(l.getPlayer())))
                .sorted(Comparator.comparingInt(ListingView::getOverall).reversed())
                .toList();
        List<PlayerView> freeAgents = playerRepository.findBySaveIdAndTeamIsNull(saveId).stream()
                .filter(p -> p.getStatus() == PlayerStatus.ACTIVE)
                .map(p -> PlayerView.of(p, valuation.overall(p)))
                .sorted(Comparator.comparingInt(PlayerView::getOverall).reversed())
                .toList();
        return new MarketView(listed, freeAgents);
    }

    @Transactional(readOnly = true)
    public List<ListingView> getTeamListings(Long saveId, Long teamId) {
        return listingRepository.findBySaveIdAndTeamId(saveId, teamId).stream()
                .map(l -> ListingView.of(l, valuation.overall(l.getPlayer())))
                .toList();
    }

    @Transactional(readOnly = true)
    public TeamOffersView getTeamOffers(Long saveId, Long teamId) {
        List<TransferOffer> offers = offerRepository.findInvolvingTeam(saveId, teamId);
        List<OfferView> incoming = offers.stream()
                .filter(o -> teamId.equals(o.getSellerTeamId()))
                .map(OfferView::of)
                .toList();
        List<OfferView> outgoing = offers.stream()
                .filter(o -> teamId.equals(o.getBuyerTeam().getId()))
                .map(OfferView::of)
                .toList();
        return new TeamOffersView(incoming, outgoing);
    }

    // ============================== ANNONCES ==============================

    /**
     * Met un joueur du club en vente. Sans prix fourni, le prix demandé est celui de la valorisation.
     *
     * @return l'identifiant de l'annonce
     */
    @Transactional
    public Long listPlayerForSale(Long saveId, Long playerId, Long teamId, Long askingPrice) {
        GameSave save = loadSave(saveId);
        requireHumanTeam(save, teamId);
        if (askingPrice != null && (askingPrice < 0 || askingPrice > MAX_FEE)) {
            throw new ValidationException("asking price must be between 0 and " + MAX_FEE);
        }
        Player player = loadPlayer(saveId, playerId);
        if (!teamId.equals(player.getTeamId())) {
            throw new AuthorizationException("player does not belong to this team");
        }
        if (listingRepository.existsBySaveIdAndPlayerId(saveId, playerId)) {
            throw new ConflictException("already listed");
        }

        long price = askingPrice != null ? askingPrice : valuation.askingPrice(player, save.getCurrentSeason());
        ListingStatus status = valuation.isContractExpiring(player, save.getCurrentSeason())
                ? ListingStatus.CONTRACT_EXPIRING : ListingStatus.AVAILABLE;
        try {
            TransferListing listing = listingRepository.saveAndFlush(
                    new TransferListing(save, player, player.getTeam(), price, status, save.getCurrentRound()));
            log.info("🏷️ {} mis en vente à {}", player.getName(), price);
            return listing.getId();
        } catch (DataIntegrityViolationException e) {
            // Course avec une autre mise en vente : la contrainte unique a tranché
            throw new ConflictException("already listed", e);
        }
    }

    @Transactional
    public void removeListing(Long saveId, Long playerId, Long teamId) {
        GameSave save = loadSave(saveId);
        requireHumanTeam(save, teamId);
        TransferListing listing = listingRepository.findBySaveIdAndPlayerId(saveId, playerId)
                .orElseThrow(() -> NotFoundException.of("listing for player", playerId));
        if (!teamId.equals(listing.getTeam().getId())) {
            throw new AuthorizationException("listing does not belong to this team");
        }
        listingRepository.deleteOwned(saveId, playerId, teamId);
    }

    // ============================== LIBÉRATIONS ==============================

    @Transactional(readOnly = true)
    public ReleaseFeeQuote getReleaseFeeQuote(Long saveId, Long playerId, Long teamId) {
        GameSave save = loadSave(saveId);
        requireHumanTeam(save, teamId);
        Player player = loadOwnedPlayer(saveId, playerId, teamId);
        return valuation.releaseCompensation(player, save.getCurrentSeason(), save.getCurrentRound());
    }

    /**
     * Rompt le contrat d'un joueur du club humain. L'indemnité est recalculée ici, jamais fournie
     * par l'appelant ; le club doit avoir la trésorerie pour la payer.
     */
    @Transactional
    public ReleaseFeeQuote releasePlayerToFreeAgency(Long saveId, Long playerId, Long teamId) {
        GameSave save = loadSave(saveId);
        requireHumanTeam(save, teamId);
        Player player = loadOwnedPlayer(saveId, playerId, teamId);
        ReleaseFeeQuote quote = valuation.releaseCompensation(player, save.getCurrentSeason(), save.getCurrentRound());
        long balance = player.getTeam().getBalance() != null ? player.getTeam().getBalance() : 0L;
        if (quote.getFee() > balance) {
            throw new ValidationException("not enough cash to release " + player.getName()
                    + ": need " + quote.getFee() + ", have " + balance);
        }
        ledger.releasePlayer(saveId, playerId, player.getName(), teamId, quote.getFee(), save.getCurrentRound());
        return quote;
    }

    // ============================== OFFRES ==============================

    /**
     * Offre du club humain. Si le vendeur est une IA ou si le joueur est libre, la réponse est immédiate.
     */
    @Transactional
    public OfferOutcome makeOffer(Long saveId, Long playerId, Long sellerTeamId, Long buyerTeamId,
                                  long fee, long wage, int contractYears) {
        validateTerms(fee, wage, contractYears);
        GameSave save = loadSave(saveId);
        requireHumanTeam(save, buyerTeamId);
        Player player = loadPlayer(saveId, playerId);
        if (!Objects.equals(player.getTeamId(), sellerTeamId)) {
            throw new ConflictException("player is not at the expected club anymore");
        }
        if (buyerTeamId.equals(sellerTeamId)) {
            throw new ValidationException("cannot bid for your own player");
        }
        if (offerRepository.existsByPlayerIdAndBuyerTeamIdAndStatusIn(playerId, buyerTeamId, OfferStatus.OUTSTANDING)) {
            throw new ConflictException("you already have a pending offer for this player");
        }

        TransferConfig config = properties.defaultTransferConfig();
        int round = save.getCurrentRound();
        TransferOffer offer = new TransferOffer();
        offer.setSave(save);
        offer.setPlayer(player);
        offer.setSellerTeam(player.getTeam());
        offer.setBuyerTeam(save.getHumanTeam());
        offer.setFee(sellerTeamId == null ? 0L : fee);
        offer.setWage(wage);
        offer.setContractYears(contractYears);
        offer.setStatus(OfferStatus.PENDING);
        offer.setCreatedRound(round);
        offer.setExpiresRound(round + config.getOfferExpiryRounds());
        Long offerId = offerRepository.saveAndFlush(offer).getId();

        OfferOutcome.AiResponse response = null;
        List<MarketMutation> batch = new ArrayList<>();
        if (sellerTeamId == null) {
            long expected = valuation.freeAgentExpectedWage(player, contractYears, config.getFreeAgentUnemploymentFactor());
            FreeAgentDecision decision = aiDecisions.freeAgentDecision(expected, wage,
                    save.getHumanTeam().getReputation(), 0, config);
            response = applyFreeAgentResponse(batch, offerId, decision, wage, round);
        } else if (!save.isHumanTeam(sellerTeamId)) {
            long asking = listingRepository.findBySaveIdAndPlayerId(saveId, playerId)
                    .map(TransferListing::getAskingPrice)
                    .orElseGet(() -> valuation.askingPrice(player, save.getCurrentSeason()));
            int squadSize = (int) playerRepository.countByTeam_Id(sellerTeamId);
            SellDecision decision = aiDecisions.sellDecision(asking, fee, wage, squadSize, player,
                    save.getCurrentSeason(), config);
            response = applySellResponse(batch, offerId, OfferStatus.PENDING, decision, fee, wage, round);
        }
        mutationApplier.apply(batch);

        log.info("💸 Offre {} pour {} : {} / {} par journée ({})", offerId, player.getName(), fee, wage,
                response != null ? response.getAction() : "en attente");
        return new OfferOutcome(offerId, response);
    }

    /**
     * Réponse du club humain (vendeur) à une offre reçue.
     */
    @Transactional
    public OfferView respondToOffer(Long saveId, Long offerId, String action, Long counterFee, Long counterWage) {
        GameSave save = loadSave(saveId);
        TransferOffer offer = loadOffer(saveId, offerId);
        if (!save.isHumanTeam(offer.getSellerTeamId())) {
            throw new AuthorizationException("offer was not made to your team");
        }
        int round = save.getCurrentRound();

        SetOfferStatus mutation;
        switch (normalize(action)) {
            case "accept":
                mutation = SetOfferStatus.accept(offerId, OfferStatus.PENDING, offer.getFee(), offer.getWage(), round);
                break;
            case "reject":
                mutation = SetOfferStatus.respond(offerId, offer.getStatus(), OfferStatus.REJECTED, round);
                break;
            case "counter":
                if (counterFee == null || counterWage == null) {
                    throw new ValidationException("counter offer requires fee and wage");
                }
                validateTerms(counterFee, counterWage, offer.getContractYears());
                mutation = SetOfferStatus.counter(offerId, OfferStatus.PENDING, counterFee, counterWage, round);
                break;
            default:
                throw new ValidationException("unknown action: " + action);
        }
        mutationApplier.apply(List.of(mutation));
        return OfferView.of(loadOffer(saveId, offerId));
    }

    /**
     * Le club humain (acheteur) accepte la contre-proposition du vendeur : ses termes deviennent ceux de l'offre.
     */
    @Transactional
    public OfferView acceptCounterOffer(Long saveId, Long offerId) {
        GameSave save = loadSave(saveId);
        TransferOffer offer = loadOffer(saveId, offerId);
        if (!save.isHumanTeam(offer.getBuyerTeam().getId())) {
            throw new AuthorizationException("offer was not made by your team");
        }
        if (offer.getStatus() != OfferStatus.COUNTER || offer.getCounterFee() == null || offer.getCounterWage() == null) {
            throw new ConflictException("no counter offer values to accept");
        }
        mutationApplier.apply(List.of(SetOfferStatus.accept(offerId, OfferStatus.COUNTER,
                offer.getCounterFee(), offer.getCounterWage(), save.getCurrentRound())));
        return OfferView.of(loadOffer(saveId, offerId));
    }

    /**
     * Finalise une offre acceptée impliquant le club humain.
     *
     * @return l'identifiant de l'historique de transfert
     */
    @Transactional
    public String completeTransfer(Long saveId, Long offerId) {
        GameSave save = loadSave(saveId);
        TransferOffer offer = loadOffer(saveId, offerId);
        if (!save.isHumanTeam(offer.getBuyerTeam().getId()) && !save.isHumanTeam(offer.getSellerTeamId())) {
            throw new AuthorizationException("offer does not involve your team");
        }
        return ledger.completeTransfer(saveId, offerId);
    }

    // ============================== DIAGNOSTIC ==============================

    @Transactional(readOnly = true)
    public MarketDiagnostics getDiagnostics(Long saveId) {
        GameSave save = loadSave(saveId);
        int currentRound = save.getCurrentRound();
        List<TransferListing> listings = listingRepository.findBySaveId(saveId);

        Map<String, Integer> byAge = new LinkedHashMap<>();
        byAge.put("u24", 0);
        byAge.put("24-29", 0);
        byAge.put("30+", 0);
        byAge.put("unknown", 0);
        Map<String, Integer> byDuration = new LinkedHashMap<>();
        byDuration.put("<3", 0);
        byDuration.put("3-6", 0);
        byDuration.put(">6", 0);

        for (TransferListing listing : listings) {
            Integer age = listing.getPlayer().getAge();
            String ageBucket = age == null ? "unknown" : age < 24 ? "u24" : age < 30 ? "24-29" : "30+";
            byAge.merge(ageBucket, 1, Integer::sum);

            int listedFor = Math.max(0, currentRound - listing.getListedRound());
            String durationBucket = listedFor < 3 ? "<3" : listedFor <= 6 ? "3-6" : ">6";
            byDuration.merge(durationBucket, 1, Integer::sum);
        }

        List<TransferOffer> offers = offerRepository.findBySaveId(saveId);
        Map<String, Long> byStatus = offers.stream()
                .collect(Collectors.groupingBy(o -> o.getStatus().name().toLowerCase(), TreeMap::new, Collectors.counting()));
        long aiResponses = offers.stream()
                .filter(o -> Objects.equals(o.getRespondedRound(), currentRound))
                .filter(o -> o.getSellerTeamId() != null && !save.isHumanTeam(o.getSellerTeamId()))
                .count();

        return MarketDiagnostics.builder()
                .saveId(saveId)
                .currentRound(currentRound)
                .totalListings(listings.size())
                .listingsByAge(byAge)
                .listingsByDuration(byDuration)
                .offersByStatus(byStatus)
                .aiResponsesThisRound(aiResponses)
                .build();
    }

    // ============================== OUTILS ==============================

    /**
     * Traduit la décision du vendeur IA en changement de statut.
     */
    static OfferOutcome.AiResponse applySellResponse(List<MarketMutation> batch, Long offerId, OfferStatus expected,
                                                     SellDecision decision, long fee, long wage, int round) {
        switch (decision.action()) {
            case ACCEPT:
                batch.add(SetOfferStatus.accept(offerId, expected, fee, wage, round));
                return new OfferOutcome.AiResponse("accept", null, null);
            case COUNTER:
                batch.add(SetOfferStatus.counter(offerId, expected, decision.amount(), decision.wage(), round));
                return new OfferOutcome.AiResponse("counter", decision.amount(), decision.wage());
            default:
                batch.add(SetOfferStatus.respond(offerId, expected, OfferStatus.REJECTED, round));
                return new OfferOutcome.AiResponse("reject", null, null);
        }
    }

    private static OfferOutcome.AiResponse applyFreeAgentResponse(List<MarketMutation> batch, Long offerId,
                                                                  FreeAgentDecision decision, long wage, int round) {
        switch (decision.action()) {
            case ACCEPT:
                batch.add(SetOfferStatus.accept(offerId, OfferStatus.PENDING, 0L, wage, round));
                return new OfferOutcome.AiResponse("accept", null, null);
            case COUNTER:
                batch.add(SetOfferStatus.counter(offerId, OfferStatus.PENDING, 0L, decision.wage(), round));
                return new OfferOutcome.AiResponse("counter", 0L, decision.wage());
            default:
                batch.add(SetOfferStatus.respond(offerId, OfferStatus.PENDING, OfferStatus.REJECTED, round));
                return new OfferOutcome.AiResponse("reject", null, null);
        }
    }

    public static void validateTerms(long fee, long wage, int contractYears) {
        if (fee < 0 || fee > MAX_FEE) {
            throw new ValidationException("fee must be between 0 and " + MAX_FEE);
        }
        if (wage < 0 || wage > MAX_WAGE) {
            throw new ValidationException("wage must be between 0 and " + MAX_WAGE);
        }
        if (contractYears < MIN_CONTRACT_YEARS || contractYears > MAX_CONTRACT_YEARS) {
            throw new ValidationException("contract years must be between " + MIN_CONTRACT_YEARS + " and " + MAX_CONTRACT_YEARS);
        }
    }

    GameSave loadSave(Long saveId) {
        return saveRepository.findById(saveId).orElseThrow(() -> NotFoundException.of("save", saveId));
    }

    private Player loadPlayer(Long saveId, Long playerId) {
        return playerRepository.findById(playerId)
                .filter(p -> p.getSave().getId().equals(saveId))
                .orElseThrow(() -> NotFoundException.of("player", playerId));
    }

    private Player loadOwnedPlayer(Long saveId, Long playerId, Long teamId) {
        Player player = loadPlayer(saveId, playerId);
        if (!teamId.equals(player.getTeamId())) {
            throw new AuthorizationException("player does not belong to this team");
        }
        return player;
    }

    private TransferOffer loadOffer(Long saveId, Long offerId) {
        return offerRepository.findById(offerId)
                .filter(o -> o.getSave().getId().equals(saveId))
                .orElseThrow(() -> NotFoundException.of("offer", offerId));
    }

    private static void requireHumanTeam(GameSave save, Long teamId) {
        if (!save.isHumanTeam(teamId)) {
            throw new AuthorizationException("team " + teamId + " is not controlled by the caller");
        }
    }

    private static String normalize(String action) {
        return action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
    }
}
