package com.tony.transferMarket.service;

import com.tony.transferMarket.exception.NotFoundException;
import com.tony.transferMarket.model.GameSave;
import com.tony.transferMarket.model.Transaction;
import com.tony.transferMarket.model.TransactionType;
import com.tony.transferMarket.model.TransferOffer;
import com.tony.transferMarket.repository.TransferOfferRepository;
import com.tony.transferMarket.service.mutation.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Finalisation d'un transfert accepté, en une seule écriture atomique.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferLedger {

    // Moral fixé après un transfert
    public static final int POST_TRANSFER_MORALE = 80;

    private final TransferOfferRepository offerRepository;
    private final MutationApplier mutationApplier;

    /**
     * Finalise l'offre {@code offerId}, qui doit être exactement au statut {@code ACCEPTED}.
     * Le contrôle est fait par la mise à jour gardée elle-même (pas de lecture puis écriture) :
     * un second appel sur la même offre échoue avec une {@code ConflictException}.
     *
     * @return l'identifiant de l'historique de transfert
     */
    @Transactional
    public String completeTransfer(Long saveId, Long offerId) {
        TransferOffer offer = offerRepository.findById(offerId)
                .filter(o -> o.getSave().getId().equals(saveId))
                .orElseThrow(() -> NotFoundException.of("offer", offerId));

        GameSave save = offer.getSave();
        int season = save.getCurrentSeason();
        int round = save.getCurrentRound();
        Long playerId = offer.getPlayer().getId();
        String playerName = offer.getPlayer().getName();
        Long sellerId = offer.getSellerTeamId();
        Long buyerId = offer.getBuyerTeam().getId();
        long fee = offer.getFee();
        long wage = offer.getWage();
        String transferId = "txf-" + UUID.randomUUID();

        List<MarketMutation> batch = new ArrayList<>();
        // En premier : si l'offre n'est plus ACCEPTED, rien d'autre ne s'applique
        batch.add(SetOfferStatus.complete(offerId));
        batch.add(new ReassignPlayer(playerId, sellerId, buyerId, wage, season + offer.getContractYears(), POST_TRANSFER_MORALE));

        if (fee > 0 && sellerId != null) {
            batch.add(new AdjustBalance(sellerId, fee));
            batch.add(new RecordTransaction(saveId, sellerId, TransactionType.INCOME,
                    Transaction.CATEGORY_PLAYER_SALE, fee, "Player sale: " + playerName, round));
            batch.add(new AdjustBalance(buyerId, -fee));
            batch.add(new RecordTransaction(saveId, buyerId, TransactionType.EXPENSE,
                    Transaction.CATEGORY_PLAYER_BUY, fee, "Player purchase: " + playerName, round));
        }

        batch.add(new RecordTransfer(transferId, saveId, playerId, sellerId, buyerId, fee, wage, season));
        batch.add(new CancelCompetingOffers(playerId, offerId));
        batch.add(new DeleteListing(saveId, playerId));

        mutationApplier.apply(batch);

        log.info("✅ Transfert {} : {} rejoint le club {} (indemnité {}, salaire {})",
                transferId, playerName, buyerId, fee, wage);
        return transferId;
    }

    /**
     * Libère un joueur de {@code teamId} : il rejoint les joueurs libres, le club paie l'indemnité,
     * son annonce et toutes les offres encore ouvertes sur lui disparaissent.
     */
    @Transactional
    public void releasePlayer(Long saveId, Long playerId, String playerName, Long teamId, long fee, int round) {
        mutationApplier.apply(releaseMutations(saveId, playerId, playerName, teamId, fee, round));
        log.info("👋 {} libéré par le club {} (indemnité {})", playerName, teamId, fee);
    }

    public List<MarketMutation> releaseMutations(Long saveId, Long playerId, String playerName, Long teamId,
                                                 long fee, int round) {
        List<MarketMutation> batch = new ArrayList<>();
        batch.add(new ReleasePlayer(playerId, teamId));
        if (fee > 0) {
            batch.add(new AdjustBalance(teamId, -fee));
            batch.add(new RecordTransaction(saveId, teamId, TransactionType.EXPENSE,
                    Transaction.CATEGORY_PLAYER_RELEASE, fee, "Player release: " + playerName, round));
        }
        batch.add(new DeleteListing(saveId, playerId));
        batch.add(CancelCompetingOffers.all(playerId));
        return batch;
    }
}
