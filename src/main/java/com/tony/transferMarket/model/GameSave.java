package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Une partie sauvegardée. La saison et la journée courantes sont avancées
 * par le collaborateur de progression de saison.
 */
@Entity
@Table(name = "game_saves")
@Getter @Setter @NoArgsConstructor
public class GameSave {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Club contrôlé par l'humain (null tant que la partie n'est pas initialisée)
    @OneToOne
    @JoinColumn(name = "human_team_id")
    private Team humanTeam;

    @Column(nullable = false)
    private Integer currentSeason = 2026;

    @Column(nullable = false)
    private Integer currentRound = 1;

    public GameSave(String name, int currentSeason, int currentRound) {
        this.name = name;
        this.currentSeason = currentSeason;
        this.currentRound = currentRound;
    }

    public boolean isHumanTeam(Long teamId) {
        return humanTeam != null && teamId != null && teamId.equals(humanTeam.getId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameSave)) return false;
        return id != null && id.equals(((GameSave) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
