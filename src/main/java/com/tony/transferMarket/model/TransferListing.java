package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Joueur mis en vente par son club.
 * Contrainte : une seule annonce active par (partie, joueur).
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "transfer_listings", uniqueConstraints = {
        @UniqueConstraint(name = "transfer_listings_save_player_unique", columnNames = {"save_id", "player_id"})
})
public class TransferListing {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "save_id")
    private GameSave save;

    @ManyToOne(optional = false)
    @JoinColumn(name = "player_id")
    private Player player;

    @ManyToOne(optional = false)
    @JoinColumn(name = "team_id")
    private Team team;

    @Column(nullable = false)
    private Long askingPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "listing_status", nullable = false)
    private ListingStatus status = ListingStatus.AVAILABLE;

    @Column(nullable = false)
    private Integer listedRound;

    public TransferListing(GameSave save, Player player, Team team, long askingPrice, ListingStatus status, int listedRound) {
        this.save = save;
        this.player = player;
        this.team = team;
        this.askingPrice = askingPrice;
        this.status = status;
        this.listedRound = listedRound;
    }
}
