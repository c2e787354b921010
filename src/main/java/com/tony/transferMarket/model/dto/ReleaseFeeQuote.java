package com.tony.transferMarket.model.dto;

import lombok.Builder;
import lombok.Data;

/** Indemnité due par le club pour rompre le contrat d'un joueur. */
@Data
@Builder
public class ReleaseFeeQuote {
    private Long playerId;
    private long fee;
    // false = rupture à l'amiable
    private boolean hasFee;
    private int yearsRemaining;
    private double utilizationRatio;
}
