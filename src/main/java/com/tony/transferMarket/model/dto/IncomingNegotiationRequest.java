package com.tony.transferMarket.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class IncomingNegotiationRequest {
    @NotBlank
    @Pattern(regexp = "(?i)accept|reject|counter")
    private String action;

    // Indemnité réclamée au club acheteur (action "counter")
    @Min(0)
    @Max(1_000_000_000L)
    private Long counterFee;

    private String negotiationId;
}
