package com.tony.transferMarket.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attributs techniques d'un joueur (échelle 1-99).
 * Une valeur nulle compte pour une note neutre dans le calcul de la note globale.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerAttributes {

    // Physique
    private Integer speed;
    private Integer strength;
    private Integer stamina;

    // Technique
    private Integer shooting;
    private Integer passing;
    private Integer dribbling;
    private Integer heading;
    private Integer tackling;

    // Mental
    private Integer positioning;
    private Integer vision;
    private Integer composure;
    private Integer aggression;

    // Gardien
    private Integer reflexes;
    private Integer handling;
    private Integer diving;
}
