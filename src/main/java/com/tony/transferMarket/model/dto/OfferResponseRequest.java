package com.tony.transferMarket.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class OfferResponseRequest {
    @NotBlank
    @Pattern(regexp = "(?i)accept|reject|counter")
    private String action;

    // Obligatoires pour "counter"
    @Min(0)
    @Max(1_000_000_000L)
    private Long counterFee;
    @Min(0)
    @Max(10_000_000L)
    private Long counterWage;
}
