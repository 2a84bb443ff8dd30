package io.walletledger.core.storage;

/**
 * Atomic group of writes. Nothing is visible in the store until {@link #write()}
 * succeeds; a failed write applies nothing.
 */
public interface KeyValueBatch {
    void put(byte[] key, byte[] value);

    void del(byte[] key);

    /** Apply every staged operation atomically. */
    void write();

    /** Discard staged operations; the batch stays usable. */
    void clear();

    int size();
}
