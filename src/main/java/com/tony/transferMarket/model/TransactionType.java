package com.tony.transferMarket.model;

public enum TransactionType {
    INCOME,
    EXPENSE
}
