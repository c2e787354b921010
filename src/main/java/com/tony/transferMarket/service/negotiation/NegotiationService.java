package com.tony.transferMarket.service.negotiation;

import com.tony.transferMarket.config.TransferConfig;
import com.tony.transferMarket.config.TransferMarketProperties;
import com.tony.transferMarket.exception.AuthorizationException;
import com.tony.transferMarket.exception.ConflictException;
import com.tony.transferMarket.exception.NotFoundException;
import com.tony.transferMarket.exception.ValidationException;
import com.tony.transferMarket.model.*;
import com.tony.transferMarket.model.dto.NegotiationResult;
import com.tony.transferMarket.repository.*;
import com.tony.transferMarket.service.AiDecisionService;
import com.tony.transferMarket.service.AiDecisionService.Action;
import com.tony.transferMarket.service.AiDecisionService.BidResponse;
import com.tony.transferMarket.service.AiDecisionService.FreeAgentDecision;
import com.tony.transferMarket.service.AiDecisionService.SellDecision;
import com.tony.transferMarket.service.TransferLedger;
import com.tony.transferMarket.service.TransferService;
import com.tony.transferMarket.service.ValuationService;
import com.tony.transferMarket.service.mutation.MarketMutation;
import com.tony.transferMarket.service.mutation.MutationApplier;
import com.tony.transferMarket.service.mutation.SetOfferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Négociations en direct entre le club humain et les clubs IA.
 * <p>
 * Protocole borné : une offre d'ouverture (tour 0) puis au plus {@code maxRounds} relances.
 * Chaque tour durcit le prix de référence du vendeur de {@code hardeningStep}. Au dernier tour,
 * l'issue est forcément une acceptation ou un refus. Une relance qui n'améliore pas la précédente
 * d'au moins {@code minImprovement} est refusée sans faire avancer le tour.
 * <p>
 * Un seul appel à la fois par identifiant de négociation : un appel concurrent échoue immédiatement.
 */
@Service
@Slf4j
public class NegotiationService {

    public static final String ACTION_COUNTER = "counter";
    public static final String ACTION_ACCEPT = "accept";
    public static final String ACTION_REJECT = "reject";
    public static final String ACTION_WALKAWAY = "walkaway";

    private final GameSaveRepository saveRepository;
    private final PlayerRepository playerRepository;
    private final TransferListingRepository listingRepository;
    private final TransferOfferRepository offerRepository;
    private final ValuationService valuation;
    private final AiDecisionService aiDecisions;
    private final TransferLedger ledger;
    private final MutationApplier mutationApplier;
    private final NegotiationSessionStore sessionStore;
    private final TransferMarketProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public NegotiationService(GameSaveRepository saveRepository,
                              PlayerRepository playerRepository,
                              TransferListingRepository listingRepository,
                              TransferOfferRepository offerRepository,
                              ValuationService valuation,
                              AiDecisionService aiDecisions,
                              TransferLedger ledger,
                              MutationApplier mutationApplier,
                              NegotiationSessionStore sessionStore,
                              TransferMarketProperties properties,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.saveRepository = saveRepository;
        this.playerRepository = playerRepository;
        this.listingRepository = listingRepository;
        this.offerRepository = offerRepository;
        this.valuation = valuation;
        this.aiDecisions = aiDecisions;
        this.ledger = ledger;
        this.mutationApplier = mutationApplier;
        this.sessionStore = sessionStore;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public record Terms(long fee, long wage, int contractYears) {}

    private record Deal(Long offerId, String transferId) {}

    // ============================== ACHAT (SORTANT) ==============================

    /**
     * Le club humain négocie l'achat d'un joueur listé (ou la signature d'un joueur libre si
     * {@code sellerTeamId} est null).
     *
     * @param action {@code counter} (par défaut : soumettre une offre), {@code accept} (prendre la
     *               dernière contre-proposition de l'IA) ou {@code walkaway}
     */
    public NegotiationResult negotiateTransfer(Long saveId, Long playerId, Long sellerTeamId, Long buyerTeamId,
                                               Terms terms, String negotiationId, String action) {
        String id = negotiationId != null ? negotiationId : newNegotiationId();
        if (!sessionStore.tryBegin(id)) {
            throw new ConflictException("negotiation already in progress");
        }
        try {
            return doNegotiateTransfer(saveId, playerId, sellerTeamId, buyerTeamId, terms, id, normalize(action));
        } finally {
            sessionStore.end(id);
        }
    }

    private NegotiationResult doNegotiateTransfer(Long saveId, Long playerId, Long sellerTeamId, Long buyerTeamId,
                                                  Terms terms, String id, String action) {
        GameSave save = loadSave(saveId);
        if (!save.isHumanTeam(buyerTeamId)) {
            throw new AuthorizationException("team " + buyerTeamId + " is not controlled by the caller");
        }
        if (sellerTeamId != null && save.isHumanTeam(sellerTeamId)) {
            throw new ValidationException("cannot negotiate with your own club");
        }
        Player player = loadPlayer(saveId, playerId);
        if (!Objects.equals(player.getTeamId(), sellerTeamId)) {
            throw new ConflictException("player is not at the expected club anymore");
        }

        NegotiationSession session = sessionStore.find(id)
                .filter(s -> s.matches(NegotiationDirection.OUTGOING, saveId, playerId, buyerTeamId, null))
                .orElse(null);

        if (ACTION_WALKAWAY.equals(action)) {
            sessionStore.remove(id);
            return result(id, NegotiationStatus.ABANDONED, session).message("negotiation abandoned").build();
        }

        if (ACTION_ACCEPT.equals(action)) {
            if (session == null || !session.hasAiCounter()) {
                throw new ConflictException("no counter offer to accept");
            }
            Deal deal = closeOutgoingDeal(save, player, sellerTeamId, buyerTeamId,
                    session.getLastAiFee(), session.getLastAiWage(), session.getContractYears());
            sessionStore.remove(id);
            return result(id, NegotiationStatus.ACCEPTED, session)
                    .offerId(deal.offerId()).transferId(deal.transferId()).build();
        }

        if (!ACTION_COUNTER.equals(action)) {
            throw new ValidationException("unknown action: " + action);
        }
        validateTerms(terms);
        long fee = sellerTeamId == null ? 0L : terms.fee();

        int round = 0;
        if (session != null) {
            if (!improves(fee, terms.wage(), session.getLastHumanFee(), session.getLastHumanWage())) {
                return result(id, NegotiationStatus.INSUFFICIENT_IMPROVEMENT, session)
                        .message("offer must improve fee or wage by at least "
                                + Math.round(properties.getNegotiation().getMinImprovement() * 100) + "%")
                        .build();
            }
            round = session.getRound() + 1;
        } else {
            session = new NegotiationSession(id, NegotiationDirection.OUTGOING, saveId, playerId,
                    buyerTeamId, sellerTeamId, null, clock.instant());
        }
        double hardening = hardeningFactor(round);
        TransferConfig config = properties.defaultTransferConfig();

        Action outcome;
        Long counterFee = null;
        Long counterWage = null;
        if (sellerTeamId == null) {
            long expected = Math.round(valuation.freeAgentExpectedWage(player, terms.contractYears(),
                    config.getFreeAgentUnemploymentFactor()) * hardening);
            FreeAgentDecision decision = aiDecisions.freeAgentDecision(expected, terms.wage(),
                    save.getHumanTeam().getReputation(), round, config);
            outcome = decision.action();
            if (outcome == Action.COUNTER) {
                counterFee = 0L;
                counterWage = decision.wage();
            }
        } else {
            long effectiveAsking = Math.round(askingPriceFor(save, player) * hardening);
            int squadSize = (int) playerRepository.countByTeam_Id(sellerTeamId);
            SellDecision decision = aiDecisions.sellDecision(effectiveAsking, fee, terms.wage(), squadSize,
                    player, save.getCurrentSeason(), config);
            outcome = decision.action();
            if (outcome == Action.COUNTER && isFinalRound(round)) {
                double tolerance = properties.getNegotiation().getListedFinalTolerance();
                outcome = fee >= effectiveAsking * tolerance ? Action.ACCEPT : Action.REJECT;
            }
            if (outcome == Action.COUNTER) {
                counterFee = decision.amount();
                counterWage = decision.wage();
            }
        }

        log.info("🤝 Négociation {} (tour {}/{}, durcissement {}) : {} / {} -> {}",
                id, round, maxRounds(), hardening, fee, terms.wage(), outcome);

        switch (outcome) {
            case ACCEPT: {
                Deal deal = closeOutgoingDeal(save, player, sellerTeamId, buyerTeamId, fee, terms.wage(), terms.contractYears());
                sessionStore.remove(id);
                session.setRound(round);
                session.setHardeningFactor(hardening);
                return result(id, NegotiationStatus.ACCEPTED, session)
                        .offerId(deal.offerId()).transferId(deal.transferId()).build();
            }
            case COUNTER: {
                session.setRound(round);
                session.setHardeningFactor(hardening);
                session.setContractYears(terms.contractYears());
                session.setLastHumanFee(fee);
                session.setLastHumanWage(terms.wage());
                session.setLastAiFee(counterFee);
                session.setLastAiWage(counterWage);
                sessionStore.save(session);
                return result(id, NegotiationStatus.COUNTERED, session).build();
            }
            default: {
                sessionStore.remove(id);
                session.setRound(round);
                session.setHardeningFactor(hardening);
                session.setLastAiFee(null);
                session.setLastAiWage(null);
                return result(id, NegotiationStatus.REJECTED, session).message("offer rejected").build();
            }
        }
    }

    // ============================== VENTE (ENTRANT) ==============================

    /**
     * Le club humain négocie une offre reçue d'un club IA.
     *
     * @param action    {@code accept} (l'offre actuelle de l'IA), {@code reject} ou {@code counter}
     * @param demandFee indemnité réclamée, obligatoire pour {@code counter}
     */
    public NegotiationResult negotiateIncomingOffer(Long saveId, Long offerId, String action, Long demandFee,
                                                    String negotiationId) {
        String id = negotiationId != null ? negotiationId : newNegotiationId();
        if (!sessionStore.tryBegin(id)) {
            throw new ConflictException("negotiation already in progress");
        }
        try {
            return doNegotiateIncoming(saveId, offerId, normalize(action), demandFee, id);
        } finally {
            sessionStore.end(id);
        }
    }

    private NegotiationResult doNegotiateIncoming(Long saveId, Long offerId, String action, Long demandFee, String id) {
        GameSave save = loadSave(saveId);
        TransferOffer offer = offerRepository.findById(offerId)
                .filter(o -> o.getSave().getId().equals(saveId))
                .orElseThrow(() -> NotFoundException.of("offer", offerId));
        if (!save.isHumanTeam(offer.getSellerTeamId())) {
            throw new AuthorizationException("offer was not made to your team");
        }
        if (!offer.getStatus().isOutstanding()) {
            throw new ConflictException("offer is " + offer.getStatus().name().toLowerCase() + ", nothing to negotiate");
        }

        Long playerId = offer.getPlayer().getId();
        Long buyerId = offer.getBuyerTeam().getId();
        OfferStatus status = offer.getStatus();
        int currentRound = save.getCurrentRound();

        NegotiationSession session = sessionStore.find(id)
                .filter(s -> s.matches(NegotiationDirection.INCOMING, saveId, playerId, buyerId, offerId))
                .orElse(null);

        if (ACTION_REJECT.equals(action)) {
            mutationApplier.apply(List.of(SetOfferStatus.respond(offerId, status, OfferStatus.REJECTED, currentRound)));
            sessionStore.remove(id);
            return result(id, NegotiationStatus.REJECTED, session).message("offer rejected").build();
        }

        if (ACTION_ACCEPT.equals(action)) {
            Deal deal = closeIncomingDeal(saveId, offerId, status, offer.getFee(), offer.getWage(), currentRound);
            sessionStore.remove(id);
            return result(id, NegotiationStatus.ACCEPTED, session)
                    .offerId(deal.offerId()).transferId(deal.transferId()).build();
        }

        if (!ACTION_COUNTER.equals(action)) {
            throw new ValidationException("unknown action: " + action);
        }
        if (demandFee == null || demandFee < 0 || demandFee > TransferService.MAX_FEE) {
            throw new ValidationException("counter requires a fee between 0 and "
                    + TransferService.MAX_FEE);
        }

        int round = 0;
        if (session != null) {
            // Côté vendeur, "améliorer" veut dire baisser sa demande
            if (!concedes(demandFee, session.getLastHumanFee())) {
                return result(id, NegotiationStatus.INSUFFICIENT_IMPROVEMENT, session)
                        .message("demand must drop by at least "
                                + Math.round(properties.getNegotiation().getMinImprovement() * 100) + "%")
                        .build();
            }
            round = session.getRound() + 1;
        } else {
            session = new NegotiationSession(id, NegotiationDirection.INCOMING, saveId, playerId,
                    buyerId, offer.getSellerTeamId(), offerId, clock.instant());
            session.setContractYears(offer.getContractYears());
        }

        double hardening = hardeningFactor(round);
        TransferConfig config = properties.defaultTransferConfig();
        Team buyer = offer.getBuyerTeam();
        long asking = askingPriceFor(save, offer.getPlayer());
        long reservation = Math.min(Math.round(buyer.getBudget() * config.getMaxBudgetSpendRatio()),
                Math.round(asking * hardening));
        long currentBid = offer.getFee();

        BidResponse response = aiDecisions.counterBidDecision(reservation, demandFee, currentBid, round, config);
        Action outcome = response.action();
        if (outcome == Action.ACCEPT && demandFee > buyer.getBudget()) {
            outcome = Action.REJECT;
        }

        log.info("🤝 Négociation entrante {} (tour {}/{}) : demande {} / réserve IA {} -> {}",
                id, round, maxRounds(), demandFee, reservation, outcome);

        session.setRound(round);
        session.setHardeningFactor(hardening);
        switch (outcome) {
            case ACCEPT: {
                Deal deal = closeIncomingDeal(saveId, offerId, status, demandFee, offer.getWage(), currentRound);
                sessionStore.remove(id);
                return result(id, NegotiationStatus.ACCEPTED, session)
                        .offerId(deal.offerId()).transferId(deal.transferId()).build();
            }
            case COUNTER: {
                long newBid = response.fee();
                // La demande humaine est enregistrée, puis l'IA relance avec une nouvelle offre
                mutationApplier.apply(List.of(
                        SetOfferStatus.counter(offerId, status, demandFee, offer.getWage(), currentRound),
                        SetOfferStatus.rebid(offerId, newBid, offer.getWage(), currentRound)));
                session.setLastHumanFee(demandFee);
                session.setLastHumanWage(offer.getWage());
                session.setLastAiFee(newBid);
                session.setLastAiWage(offer.getWage());
                sessionStore.save(session);
                return result(id, NegotiationStatus.COUNTERED, session).build();
            }
            default: {
                mutationApplier.apply(List.of(SetOfferStatus.respond(offerId, status, OfferStatus.REJECTED, currentRound)));
                sessionStore.remove(id);
                return result(id, NegotiationStatus.REJECTED, session).message("buyer walked away").build();
            }
        }
    }

    // ============================== CONCLUSION ==============================

    /**
     * Écrit l'offre acceptée et finalise le transfert dans la même transaction.
     */
    private Deal closeOutgoingDeal(GameSave save, Player player, Long sellerTeamId, Long buyerTeamId,
                                   long fee, long wage, int contractYears) {
        return transactionTemplate.execute(status -> {
            int round = save.getCurrentRound();
            TransferOffer offer = new TransferOffer();
            offer.setSave(saveRepository.getReferenceById(save.getId()));
            offer.setPlayer(playerRepository.getReferenceById(player.getId()));
            offer.setSellerTeam(player.getTeam());
            offer.setBuyerTeam(save.getHumanTeam());
            offer.setFee(fee);
            offer.setWage(wage);
            offer.setContractYears(contractYears);
            offer.setStatus(OfferStatus.ACCEPTED);
            offer.setCreatedRound(round);
            offer.setExpiresRound(round + properties.defaultTransferConfig().getOfferExpiryRounds());
            offer.setRespondedRound(round);
            Long offerId = offerRepository.saveAndFlush(offer).getId();
            String transferId = ledger.completeTransfer(save.getId(), offerId);
            return new Deal(offerId, transferId);
        });
    }

    private Deal closeIncomingDeal(Long saveId, Long offerId, OfferStatus expected, long fee, long wage, int round) {
        return transactionTemplate.execute(status -> {
            List<MarketMutation> accept = List.of(SetOfferStatus.accept(offerId, expected, fee, wage, round));
            mutationApplier.apply(accept);
            return new Deal(offerId, ledger.completeTransfer(saveId, offerId));
        });
    }

    // ============================== OUTILS ==============================

    boolean improves(long fee, long wage, Long previousFee, Long previousWage) {
        double step = properties.getNegotiation().getMinImprovement();
        long prevFee = previousFee != null ? previousFee : 0L;
        long prevWage = previousWage != null ? previousWage : 0L;
        boolean feeImproved = fee > prevFee && fee >= prevFee * (1 + step);
        boolean wageImproved = wage > prevWage && wage >= prevWage * (1 + step);
        return feeImproved || wageImproved;
    }

    boolean concedes(long demand, Long previousDemand) {
        if (previousDemand == null) {
            return true;
        }
        double step = properties.getNegotiation().getMinImprovement();
        return demand < previousDemand && demand <= previousDemand * (1 - step);
    }

    double hardeningFactor(int round) {
        return 1 + properties.getNegotiation().getHardeningStep() * round;
    }

    private boolean isFinalRound(int round) {
        return round >= maxRounds();
    }

    private int maxRounds() {
        return properties.getNegotiation().getMaxRounds();
    }

    private long askingPriceFor(GameSave save, Player player) {
        return listingRepository.findBySaveIdAndPlayerId(save.getId(), player.getId())
                .map(TransferListing::getAskingPrice)
                .orElseGet(() -> valuation.askingPrice(player, save.getCurrentSeason()));
    }

    private NegotiationResult.NegotiationResultBuilder result(String id, NegotiationStatus status, NegotiationSession session) {
        NegotiationResult.NegotiationResultBuilder builder = NegotiationResult.builder()
                .negotiationId(id)
                .status(status)
                .maxRounds(maxRounds())
                .hardeningFactor(1.0);
        if (session != null) {
            builder.round(session.getRound())
                    .hardeningFactor(session.getHardeningFactor())
                    .counterFee(session.getLastAiFee())
                    .counterWage(session.getLastAiWage());
        }
        return builder;
    }

    private static void validateTerms(Terms terms) {
        if (terms == null) {
            throw new ValidationException("offer terms are required");
        }
        TransferService.validateTerms(terms.fee(), terms.wage(), terms.contractYears());
    }

    private GameSave loadSave(Long saveId) {
        return saveRepository.findById(saveId).orElseThrow(() -> NotFoundException.of("save", saveId));
    }

    private Player loadPlayer(Long saveId, Long playerId) {
        return playerRepository.findById(playerId)
                .filter(p -> p.getSave().getId().equals(saveId))
                .orElseThrow(() -> NotFoundException.of("player", playerId));
    }

    private static String newNegotiationId() {
        return "neg-" + UUID.randomUUID();
    }

    private static String normalize(String action) {
        return action == null || action.isBlank() ? ACTION_COUNTER : action.trim().toLowerCase(Locale.ROOT);
    }
}
