package com.tony.transferMarket.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ReleasePlayerRequest {
    @NotNull
    private Long playerId;
    @NotNull
    private Long teamId;
}
