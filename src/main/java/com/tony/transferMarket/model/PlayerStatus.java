package com.tony.transferMarket.model;

public enum PlayerStatus {
    ACTIVE,
    RETIRING,
    RETIRED,
    SUSPENDED
}
