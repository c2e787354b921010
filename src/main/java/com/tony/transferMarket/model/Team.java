package com.tony.transferMarket.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "teams", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name", "save_id"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "save_id")
    private GameSave save;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Integer reputation = 50;

    // Budget transferts
    @Column(nullable = false)
    private Long budget = 0L;

    // Masse salariale maximale (par journée)
    @Column(nullable = false)
    private Long wageBudget = 0L;

    // Trésorerie courante
    @Column(nullable = false)
    private Long balance = 0L;

    public Team(GameSave save, String name, int reputation, long budget, long wageBudget) {
        this.save = save;
        this.name = name;
        this.reputation = reputation;
        this.budget = budget;
        this.wageBudget = wageBudget;
        this.balance = budget;
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
