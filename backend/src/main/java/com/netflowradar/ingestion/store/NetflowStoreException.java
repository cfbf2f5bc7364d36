package com.netflowradar.ingestion.store;

/**
 * Thrown when the ledger + snapshot write could not be committed. Nothing from the failed write is visible.
 */
public class NetflowStoreException extends RuntimeException {

    public NetflowStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
