package com.tony.transferMarket.exception;

import lombok.Getter;

/**
 * Échec d'un lot découpé en plusieurs morceaux. Les morceaux précédents sont déjà
 * appliqués : l'appelant doit relancer l'opération complète, jamais la reprendre.
 */
@Getter
public class BatchApplyException extends TransferMarketException {

    private final int failedChunk;
    private final int totalChunks;

    public BatchApplyException(int failedChunk, int totalChunks, Throwable cause) {
        super("batch chunk " + (failedChunk + 1) + "/" + totalChunks + " failed: " + cause.getMessage(), cause);
        this.failedChunk = failedChunk;
        this.totalChunks = totalChunks;
    }
}
