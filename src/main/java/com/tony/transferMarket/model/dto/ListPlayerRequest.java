package com.tony.transferMarket.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ListPlayerRequest {
    @NotNull
    private Long playerId;
    @NotNull
    private Long teamId;

    // Optionnel : valorisation automatique si absent
    @Min(0)
    @Max(1_000_000_000L)
    private Long askingPrice;
}
