package com.tony.transferMarket.exception;

public class AuthorizationException extends TransferMarketException {
    public AuthorizationException(String message) {
        super(message);
    }
}
