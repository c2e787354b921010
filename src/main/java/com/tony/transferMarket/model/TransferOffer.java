package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Offre d'un club acheteur pour un joueur (listé ou libre).
 * Les changements de statut passent par les requêtes gardées du repository,
 * jamais par un simple setter suivi d'un save.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "transfer_offers")
public class TransferOffer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "save_id")
    private GameSave save;

    @ManyToOne(optional = false)
    @JoinColumn(name = "player_id")
    private Player player;

    // Club vendeur (null = joueur libre)
    @ManyToOne
    @JoinColumn(name = "seller_team_id")
    private Team sellerTeam;

    @ManyToOne(optional = false)
    @JoinColumn(name = "buyer_team_id")
    private Team buyerTeam;

    @Column(nullable = false)
    private Long fee;

    @Column(nullable = false)
    private Long wage;

    @Column(nullable = false)
    private Integer contractYears;

    @Enumerated(EnumType.STRING)
    @Column(name = "offer_status", nullable = false)
    private OfferStatus status = OfferStatus.PENDING;

    // Contre-proposition en cours
    private Long counterFee;
    private Long counterWage;

    @Column(nullable = false)
    private Integer createdRound;

    @Column(nullable = false)
    private Integer expiresRound;

    private Integer respondedRound;

    public Long getSellerTeamId() {
        return sellerTeam != null ? sellerTeam.getId() : null;
    }

    public boolean isFreeAgentSigning() {
        return sellerTeam == null;
    }
}
