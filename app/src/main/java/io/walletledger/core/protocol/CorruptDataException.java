package io.walletledger.core.protocol;

/**
 * Raised when a persisted record or wire blob cannot be decoded.
 */
public class CorruptDataException extends RuntimeException {
    public CorruptDataException(String message) {
        super(message);
    }

    public CorruptDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
