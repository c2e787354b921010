package com.tony.transferMarket.service.mutation;

import com.tony.transferMarket.config.TransferMarketProperties;
import com.tony.transferMarket.exception.BatchApplyException;
import com.tony.transferMarket.exception.ConflictException;
import com.tony.transferMarket.model.*;
import com.tony.transferMarket.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Interprète les intentions d'écriture du marché.
 * <ul>
 *     <li>{@link #apply(List)} : tout ou rien, une seule transaction.</li>
 *     <li>{@link #applyChunked(List)} : découpage selon la limite de valeurs liées ; chaque morceau est
 *     atomique, la séquence ne l'est pas.</li>
 * </ul>
 */
@Service
@Slf4j
public class MutationApplier {

    private final GameSaveRepository saveRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final TransferListingRepository listingRepository;
    private final TransferOfferRepository offerRepository;
    private final TransactionRepository transactionRepository;
    private final TransferRecordRepository transferRecordRepository;
    private final TransferMarketProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public MutationApplier(GameSaveRepository saveRepository,
                           TeamRepository teamRepository,
                           PlayerRepository playerRepository,
                           TransferListingRepository listingRepository,
                           TransferOfferRepository offerRepository,
                           TransactionRepository transactionRepository,
                           TransferRecordRepository transferRecordRepository,
                           TransferMarketProperties properties,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.saveRepository = saveRepository;
        this.teamRepository = teamRepository;
        this.playerRepository = playerRepository;
        this.listingRepository = listingRepository;
        this.offerRepository = offerRepository;
        this.transactionRepository = transactionRepository;
        this.transferRecordRepository = transferRecordRepository;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /** Applique toutes les intentions dans une seule transaction : un échec annule l'ensemble. */
    @Transactional
    public void apply(List<MarketMutation> mutations) {
        mutations.forEach(this::applyOne);
    }

    /**
     * Applique les intentions morceau par morceau. Un échec en cours de séquence est fatal :
     * les morceaux précédents restent appliqués et l'appelant doit relancer tout le traitement.
     *
     * @return le nombre de morceaux appliqués
     */
    public int applyChunked(List<MarketMutation> mutations) {
        List<List<MarketMutation>> chunks = chunk(mutations, properties.getStorage().getMaxBoundValues());
        int applied = 0;
        for (int i = 0; i < chunks.size(); i++) {
            List<MarketMutation> chunk = chunks.get(i);
            try {
                transactionTemplate.executeWithoutResult(status -> chunk.forEach(this::applyOne));
            } catch (RuntimeException e) {
                log.error("💥 Lot interrompu au morceau {}/{} ({} intentions déjà appliquées), relance complète requise",
                        i + 1, chunks.size(), applied, e);
                throw new BatchApplyException(i, chunks.size(), e);
            }
            applied += chunk.size();
        }
        return chunks.size();
    }

    /**
     * Découpe en morceaux dont le total de valeurs liées reste sous la limite.
     * Une intention plus grosse que la limite forme un morceau à elle seule.
     */
    static List<List<MarketMutation>> chunk(List<MarketMutation> mutations, int maxBoundValues) {
        List<List<MarketMutation>> chunks = new ArrayList<>();
        List<MarketMutation> current = new ArrayList<>();
        int bound = 0;
        for (MarketMutation mutation : mutations) {
            int size = mutation.boundValues();
            if (!current.isEmpty() && bound + size > maxBoundValues) {
                chunks.add(current);
                current = new ArrayList<>();
                bound = 0;
            }
            current.add(mutation);
            bound += size;
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    private void applyOne(MarketMutation mutation) {
        if (mutation instanceof ReassignPlayer m) {
            reassignPlayer(m);
        } else if (mutation instanceof ReleasePlayer m) {
            requireOne(playerRepository.release(m.playerId(), m.fromTeamId()),
                    "player " + m.playerId() + " no longer belongs to team " + m.fromTeamId());
        } else if (mutation instanceof AdjustBalance m) {
            requireOne(teamRepository.adjustFinances(m.teamId(), m.delta()), "team " + m.teamId() + " not found");
        } else if (mutation instanceof RecordTransaction m) {
            recordTransaction(m);
        } else if (mutation instanceof SetOfferStatus m) {
            setOfferStatus(m);
        } else if (mutation instanceof DeleteListing m) {
            listingRepository.deleteBySaveAndPlayer(m.saveId(), m.playerId());
        } else if (mutation instanceof InsertListing m) {
            listingRepository.save(new TransferListing(
                    saveRepository.getReferenceById(m.saveId()),
                    playerRepository.getReferenceById(m.playerId()),
                    teamRepository.getReferenceById(m.teamId()),
                    m.askingPrice(), m.status(), m.listedRound()));
        } else if (mutation instanceof InsertOffer m) {
            insertOffer(m);
        } else if (mutation instanceof RecordTransfer m) {
            recordTransfer(m);
        } else if (mutation instanceof CancelCompetingOffers m) {
            cancelCompeting(m);
        } else {
            throw new IllegalArgumentException("Unsupported mutation: " + mutation.getClass().getSimpleName());
        }
    }

    private void reassignPlayer(ReassignPlayer m) {
        Team team = teamRepository.getReferenceById(m.teamId());
        int updated = m.fromTeamId() == null
                ? playerRepository.signFreeAgent(m.playerId(), team, m.wage(), m.contractEndSeason(), m.morale())
                : playerRepository.reassign(m.playerId(), m.fromTeamId(), team, m.wage(), m.contractEndSeason(), m.morale());
        requireOne(updated, m.fromTeamId() == null
                ? "player " + m.playerId() + " is no longer a free agent"
                : "player " + m.playerId() + " no longer belongs to team " + m.fromTeamId());
    }

    private void cancelCompeting(CancelCompetingOffers m) {
        if (m.keepOfferId() == null) {
            offerRepository.cancelAllForPlayer(m.playerId(), OfferStatus.UNSETTLED, OfferStatus.CANCELLED);
        } else {
            offerRepository.cancelCompeting(m.playerId(), m.keepOfferId(), OfferStatus.UNSETTLED, OfferStatus.CANCELLED);
        }
    }

    private void setOfferStatus(SetOfferStatus m) {
        if (!m.expected().canTransitionTo(m.target())) {
            throw new ConflictException("offer transition " + m.expected() + " -> " + m.target() + " is not allowed");
        }
        int updated;
        if (m.hasCounterTerms()) {
            updated = offerRepository.respondWithCounter(m.offerId(), m.expected(), m.target(),
                    m.counterFee(), m.counterWage(), m.round());
        } else if (m.hasTerms()) {
            updated = offerRepository.respondWithTerms(m.offerId(), m.expected(), m.target(),
                    m.fee(), m.wage(), m.round());
        } else if (m.round() == null) {
            updated = offerRepository.transitionStatus(m.offerId(), m.expected(), m.target());
        } else {
            updated = offerRepository.respond(m.offerId(), m.expected(), m.target(), m.round());
        }
        requireOne(updated, "offer " + m.offerId() + " is no longer " + m.expected().name().toLowerCase());
    }

    private void recordTransaction(RecordTransaction m) {
        Transaction transaction = new Transaction();
        transaction.setSave(saveRepository.getReferenceById(m.saveId()));
        transaction.setTeam(teamRepository.getReferenceById(m.teamId()));
        transaction.setType(m.type());
        transaction.setCategory(m.category());
        transaction.setAmount(m.amount());
        transaction.setDescription(m.description());
        transaction.setRound(m.round());
        transaction.setCreatedAt(LocalDateTime.now(clock));
        transactionRepository.save(transaction);
    }

    private void insertOffer(InsertOffer m) {
        TransferOffer offer = new TransferOffer();
        offer.setSave(saveRepository.getReferenceById(m.saveId()));
        offer.setPlayer(playerRepository.getReferenceById(m.playerId()));
        offer.setSellerTeam(m.sellerTeamId() != null ? teamRepository.getReferenceById(m.sellerTeamId()) : null);
        offer.setBuyerTeam(teamRepository.getReferenceById(m.buyerTeamId()));
        offer.setFee(m.fee());
        offer.setWage(m.wage());
        offer.setContractYears(m.contractYears());
        offer.setStatus(m.status());
        offer.setCreatedRound(m.createdRound());
        offer.setExpiresRound(m.expiresRound());
        offerRepository.save(offer);
    }

    private void recordTransfer(RecordTransfer m) {
        TransferRecord record = new TransferRecord();
        record.setId(m.transferId());
        record.setSave(saveRepository.getReferenceById(m.saveId()));
        record.setPlayer(playerRepository.getReferenceById(m.playerId()));
        record.setFromTeam(m.fromTeamId() != null ? teamRepository.getReferenceById(m.fromTeamId()) : null);
        record.setToTeam(teamRepository.getReferenceById(m.toTeamId()));
        record.setFee(m.fee());
        record.setWage(m.wage());
        record.setSeason(m.season());
        record.setDate(LocalDateTime.now(clock));
        transferRecordRepository.save(record);
    }

    private static void requireOne(int updated, String message) {
        if (updated == 0) {
            throw new ConflictException(message);
        }
    }
}
