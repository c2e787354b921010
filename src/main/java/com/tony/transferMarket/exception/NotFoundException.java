package com.tony.transferMarket.exception;

public class NotFoundException extends TransferMarketException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
