package io.walletledger.core.storage;

/**
 * Underlying key-value I/O failure. Always fatal to the batch in flight.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
