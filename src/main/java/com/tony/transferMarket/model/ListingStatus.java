package com.tony.transferMarket.model;

public enum ListingStatus {
    AVAILABLE,
    CONTRACT_EXPIRING
}
