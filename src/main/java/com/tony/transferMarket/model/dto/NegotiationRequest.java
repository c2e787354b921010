package com.tony.transferMarket.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Un tour de négociation sortante. Sans {@code negotiationId}, une nouvelle négociation démarre.
 */
@Data
public class NegotiationRequest {
    @NotNull
    private Long playerId;
    private Long sellerTeamId;
    @NotNull
    private Long buyerTeamId;

    @Min(0)
    @Max(1_000_000_000L)
    private long fee;
    @Min(0)
    @Max(10_000_000L)
    private long wage;
    @Min(1)
    @Max(5)
    private int contractYears = 3;

    private String negotiationId;

    @Pattern(regexp = "(?i)counter|accept|walkaway")
    private String action;
}
