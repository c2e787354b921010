package com.tony.transferMarket.exception;

/**
 * État incompatible avec l'opération demandée (doublon, statut inattendu...).
 */
public class ConflictException extends TransferMarketException {
    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
