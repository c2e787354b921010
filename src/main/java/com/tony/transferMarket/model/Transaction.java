package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Ligne du grand livre financier d'un club.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "finance_transactions")
public class Transaction {

    public static final String CATEGORY_PLAYER_SALE = "player_sale";
    public static final String CATEGORY_PLAYER_BUY = "player_buy";
    public static final String CATEGORY_PLAYER_RELEASE = "player_release";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "save_id")
    private GameSave save;

    @ManyToOne(optional = false)
    @JoinColumn(name = "team_id")
    private Team team;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false)
    private TransactionType type;

    @Column(nullable = false)
    private String category;

    @Column(nullable = false)
    private Long amount;

    private String description;

    @Column(name = "round_number", nullable = false)
    private Integer round;

    private LocalDateTime createdAt;
}
