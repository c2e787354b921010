package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Historique permanent des transferts. L'identifiant est généré avant l'écriture
 * pour pouvoir être renvoyé à l'appelant dans le même lot.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "transfers")
public class TransferRecord {
    @Id
    @Column(length = 40)
    private String id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "save_id")
    private GameSave save;

    @ManyToOne(optional = false)
    @JoinColumn(name = "player_id")
    private Player player;

    @ManyToOne
    @JoinColumn(name = "from_team_id")
    private Team fromTeam;

    @ManyToOne(optional = false)
    @JoinColumn(name = "to_team_id")
    private Team toTeam;

    @Column(nullable = false)
    private Long fee;

    @Column(nullable = false)
    private Long wage;

    @Column(nullable = false)
    private Integer season;

    @Column(name = "transfer_date", nullable = false)
    private LocalDateTime date;
}
