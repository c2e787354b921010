package com.tony.transferMarket.exception;

public class ValidationException extends TransferMarketException {
    public ValidationException(String message) {
        super(message);
    }
}
