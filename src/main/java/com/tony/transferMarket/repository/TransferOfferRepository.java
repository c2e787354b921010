package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.OfferStatus;
import com.tony.transferMarket.model.TransferOffer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * Toutes les écritures de statut sont gardées : la mise à jour ne s'applique que si
 * l'offre est encore dans le statut attendu. Le nombre de lignes modifiées (0 ou 1)
 * permet à l'appelant de détecter une course.
 */
public interface TransferOfferRepository extends JpaRepository<TransferOffer, Long> {

    List<TransferOffer> findBySaveId(Long saveId);

    List<TransferOffer> findBySaveIdAndStatusIn(Long saveId, Collection<OfferStatus> statuses);

    boolean existsByPlayerIdAndBuyerTeamIdAndStatusIn(Long playerId, Long buyerTeamId, Collection<OfferStatus> statuses);

    @Query("SELECT o FROM TransferOffer o WHERE o.save.id = :saveId " +
            "AND (o.sellerTeam.id = :teamId OR o.buyerTeam.id = :teamId) ORDER BY o.id DESC")
    List<TransferOffer> findInvolvingTeam(@Param("saveId") Long saveId, @Param("teamId") Long teamId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :target WHERE o.id = :id AND o.status = :expected")
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") OfferStatus expected,
                         @Param("target") OfferStatus target);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :target, o.respondedRound = :round " +
            "WHERE o.id = :id AND o.status = :expected")
    int respond(@Param("id") Long id,
                @Param("expected") OfferStatus expected,
                @Param("target") OfferStatus target,
                @Param("round") int round);

    // Accord : les termes convenus remplacent ceux de l'offre initiale
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :target, o.fee = :fee, o.wage = :wage, o.respondedRound = :round " +
            "WHERE o.id = :id AND o.status = :expected")
    int respondWithTerms(@Param("id") Long id,
                         @Param("expected") OfferStatus expected,
                         @Param("target") OfferStatus target,
                         @Param("fee") long fee,
                         @Param("wage") long wage,
                         @Param("round") int round);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :target, o.counterFee = :counterFee, o.counterWage = :counterWage, " +
            "o.respondedRound = :round WHERE o.id = :id AND o.status = :expected")
    int respondWithCounter(@Param("id") Long id,
                           @Param("expected") OfferStatus expected,
                           @Param("target") OfferStatus target,
                           @Param("counterFee") long counterFee,
                           @Param("counterWage") long counterWage,
                           @Param("round") int round);

    // Une offre reste valable jusqu'à sa journée d'expiration incluse
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :expired WHERE o.save.id = :saveId " +
            "AND o.status IN :statuses AND o.expiresRound < :currentRound")
    int expireStale(@Param("saveId") Long saveId,
                    @Param("statuses") Collection<OfferStatus> statuses,
                    @Param("expired") OfferStatus expired,
                    @Param("currentRound") int currentRound);

    // Le joueur n'est plus disponible : on annule toutes les autres offres encore ouvertes
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :cancelled WHERE o.player.id = :playerId " +
            "AND o.id <> :keepOfferId AND o.status IN :statuses")
    int cancelCompeting(@Param("playerId") Long playerId,
                        @Param("keepOfferId") Long keepOfferId,
                        @Param("statuses") Collection<OfferStatus> statuses,
                        @Param("cancelled") OfferStatus cancelled);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TransferOffer o SET o.status = :cancelled WHERE o.player.id = :playerId AND o.status IN :statuses")
    int cancelAllForPlayer(@Param("playerId") Long playerId,
                           @Param("statuses") Collection<OfferStatus> statuses,
                           @Param("cancelled") OfferStatus cancelled);
}
