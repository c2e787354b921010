package com.tony.transferMarket.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Termes d'une offre du club humain. {@code sellerTeamId} est absent pour un joueur libre.
 */
@Data
public class OfferRequest {
    @NotNull
    private Long playerId;
    private Long sellerTeamId;
    @NotNull
    private Long buyerTeamId;

    @NotNull
    @Min(0)
    @Max(1_000_000_000L)
    private Long fee;

    @NotNull
    @Min(0)
    @Max(10_000_000L)
    private Long wage;

    @NotNull
    @Min(1)
    @Max(5)
    private Integer contractYears;
}
