package io.walletledger.core.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered byte-key store. Keys compare as unsigned bytes, so big-endian
 * integer components scan in numeric order.
 *
 * Notes:
 * - A missing key is {@link Optional#empty()}, never an exception.
 * - I/O failures surface as {@link StorageException}.
 */
public interface KeyValueStore extends Lifecycle {

    Optional<byte[]> get(byte[] key);

    default boolean has(byte[] key) {
        return get(key).isPresent();
    }

    void put(byte[] key, byte[] value);

    void del(byte[] key);

    KeyValueBatch batch();

    /** Entries within the range, honouring reverse and limit. */
    List<KeyValue> range(RangeOptions options);

    default List<byte[]> keys(RangeOptions options) {
        List<KeyValue> entries = range(options);
        List<byte[]> out = new ArrayList<>(entries.size());
        for (KeyValue kv : entries) out.add(kv.key());
        return out;
    }

    default List<byte[]> values(RangeOptions options) {
        List<KeyValue> entries = range(options);
        List<byte[]> out = new ArrayList<>(entries.size());
        for (KeyValue kv : entries) out.add(kv.value());
        return out;
    }
}
