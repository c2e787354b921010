package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "players")
@Getter @Setter @NoArgsConstructor
public class Player {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "save_id")
    private GameSave save;

    // null = joueur libre
    @ManyToOne
    @JoinColumn(name = "team_id")
    private Team team;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "player_position", nullable = false)
    private Position position;

    private Integer age;
    private Integer potential;

    @Embedded
    private PlayerAttributes attributes;

    private Integer contractEndSeason;

    // Salaire par journée
    private Long wage = 0L;
    private Long marketValue = 0L;
    private Integer morale = 70;
    // Temps de jeu de la saison en cours
    private Integer seasonMinutes = 0;

    @Enumerated(EnumType.STRING)
    private PlayerStatus status = PlayerStatus.ACTIVE;

    public boolean isFreeAgent() {
        return team == null;
    }

    public Long getTeamId() {
        return team != null ? team.getId() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        return id != null && id.equals(((Player) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
