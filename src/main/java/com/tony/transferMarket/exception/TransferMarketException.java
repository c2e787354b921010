package com.tony.transferMarket.exception;

/**
 * Racine des erreurs métier du marché des transferts.
 */
public abstract class TransferMarketException extends RuntimeException {

    protected TransferMarketException(String message) {
        super(message);
    }

    protected TransferMarketException(String message, Throwable cause) {
        super(message, cause);
    }
}
