package io.walletledger.core.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A batch that can be read back before it is written.
 *
 * Staged puts and deletes shadow the underlying store for {@link #get},
 * {@link #has} and {@link #range}; nothing reaches the store until
 * {@link #write()}.
 */
public final class StagedBatch implements KeyValueBatch {

    private final KeyValueStore store;
    // null value = staged delete
    private final NavigableMap<byte[], byte[]> staged = new TreeMap<>(Arrays::compareUnsigned);

    public StagedBatch(KeyValueStore store) {
        if (store == null) throw new IllegalArgumentException("store is required");
        this.store = store;
    }

    @Override
    public void put(byte[] key, byte[] value) {
        staged.put(key.clone(), value.clone());
    }

    @Override
    public void del(byte[] key) {
        staged.put(key.clone(), null);
    }

    /** True if the batch holds a put or delete for the key. */
    public boolean touches(byte[] key) {
        return staged.containsKey(key);
    }

    public Optional<byte[]> get(byte[] key) {
        if (staged.containsKey(key)) {
            byte[] v = staged.get(key);
            return v == null ? Optional.empty() : Optional.of(v.clone());
        }
        return store.get(key);
    }

    public boolean has(byte[] key) {
        if (staged.containsKey(key)) {
            return staged.get(key) != null;
        }
        return store.has(key);
    }

    /** Store range merged with staged writes, in range order. */
    public List<KeyValue> range(RangeOptions options) {
        byte[] gte = options.gte();
        byte[] lte = options.lte();
        if (Arrays.compareUnsigned(gte, lte) > 0) {
            return new ArrayList<>();
        }
        NavigableMap<byte[], byte[]> overlay = staged.subMap(gte, true, lte, true);
        if (overlay.isEmpty()) {
            return store.range(options);
        }

        NavigableMap<byte[], byte[]> merged = new TreeMap<>(Arrays::compareUnsigned);
        // the overlay may delete keys the limit would otherwise have reached
        for (KeyValue kv : store.range(RangeOptions.between(gte, lte))) {
            merged.put(kv.key(), kv.value());
        }
        for (Map.Entry<byte[], byte[]> e : overlay.entrySet()) {
            if (e.getValue() == null) {
                merged.remove(e.getKey());
            } else {
                merged.put(e.getKey(), e.getValue());
            }
        }

        NavigableMap<byte[], byte[]> view = options.reverse() ? merged.descendingMap() : merged;
        List<KeyValue> out = new ArrayList<>();
        Iterator<Map.Entry<byte[], byte[]>> it = view.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<byte[], byte[]> e = it.next();
            out.add(new KeyValue(e.getKey().clone(), e.getValue().clone()));
            if (options.limited() && out.size() >= options.limit()) break;
        }
        return out;
    }

    public List<byte[]> keys(RangeOptions options) {
        List<byte[]> out = new ArrayList<>();
        for (KeyValue kv : range(options)) out.add(kv.key());
        return out;
    }

    public List<byte[]> values(RangeOptions options) {
        List<byte[]> out = new ArrayList<>();
        for (KeyValue kv : range(options)) out.add(kv.value());
        return out;
    }

    /** Snapshot of the staged writes, for {@link #reset}. */
    public NavigableMap<byte[], byte[]> mark() {
        return new TreeMap<>(staged);
    }

    /** Restores the staged writes captured by {@link #mark}. */
    public void reset(NavigableMap<byte[], byte[]> mark) {
        staged.clear();
        staged.putAll(mark);
    }

    @Override
    public void write() {
        if (staged.isEmpty()) {
            return;
        }
        KeyValueBatch batch = store.batch();
        for (Map.Entry<byte[], byte[]> e : staged.entrySet()) {
            if (e.getValue() == null) {
                batch.del(e.getKey());
            } else {
                batch.put(e.getKey(), e.getValue());
            }
        }
        batch.write();
        staged.clear();
    }

    @Override
    public void clear() {
        staged.clear();
    }

    @Override
    public int size() {
        return staged.size();
    }
}
