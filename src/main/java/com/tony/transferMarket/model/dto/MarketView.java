package com.tony.transferMarket.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MarketView {
    private List<ListingView> listed;
    private List<PlayerView> freeAgents;
}
