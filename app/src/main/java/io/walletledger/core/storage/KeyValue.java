package io.walletledger.core.storage;

/** One entry returned by a range scan. */
public record KeyValue(byte[] key, byte[] value) {
}
