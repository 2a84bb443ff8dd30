package io.walletledger.core.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Simple, fast in-memory key-value store.
 * Good for tests and throwaway wallets before wiring RocksDB.
 *
 * Keys are ordered with {@link Arrays#compareUnsigned(byte[], byte[])}, the same
 * order RocksDB's default comparator uses.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<byte[], byte[]> data = new TreeMap<>(Arrays::compareUnsigned);
    private LifecycleState state = LifecycleState.CLOSED;

    /** Convenience: create and open in one step. */
    public static InMemoryKeyValueStore opened() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.open();
        return store;
    }

    @Override
    public synchronized void open() {
        if (state != LifecycleState.CLOSED) {
            throw new IllegalStateException("Store already open (state=" + state + ")");
        }
        state = LifecycleState.OPENING;
        state = LifecycleState.OPEN;
    }

    @Override
    public synchronized void close() {
        if (state != LifecycleState.OPEN) {
            return;
        }
        state = LifecycleState.CLOSING;
        state = LifecycleState.CLOSED;
    }

    @Override
    public synchronized LifecycleState state() {
        return state;
    }

    @Override
    public synchronized Optional<byte[]> get(byte[] key) {
        ensureOpen();
        byte[] v = data.get(key);
        return v == null ? Optional.empty() : Optional.of(v.clone());
    }

    @Override
    public synchronized boolean has(byte[] key) {
        ensureOpen();
        return data.containsKey(key);
    }

    @Override
    public synchronized void put(byte[] key, byte[] value) {
        ensureOpen();
        data.put(key.clone(), value.clone());
    }

    @Override
    public synchronized void del(byte[] key) {
        ensureOpen();
        data.remove(key);
    }

    @Override
    public KeyValueBatch batch() {
        return new MemoryBatch();
    }

    @Override
    public synchronized List<KeyValue> range(RangeOptions options) {
        ensureOpen();
        byte[] gte = options.gte();
        byte[] lte = options.lte();
        List<KeyValue> out = new ArrayList<>();
        if (Arrays.compareUnsigned(gte, lte) > 0) {
            return out;
        }
        NavigableMap<byte[], byte[]> view = data.subMap(gte, true, lte, true);
        if (options.reverse()) {
            view = view.descendingMap();
        }
        for (Map.Entry<byte[], byte[]> e : view.entrySet()) {
            out.add(new KeyValue(e.getKey().clone(), e.getValue().clone()));
            if (options.limited() && out.size() >= options.limit()) {
                break;
            }
        }
        return out;
    }

    /** Number of stored keys (tests/debug). */
    public synchronized int size() {
        return data.size();
    }

    private synchronized void apply(List<Op> ops) {
        ensureOpen();
        for (Op op : ops) {
            if (op.value == null) {
                data.remove(op.key);
            } else {
                data.put(op.key, op.value);
            }
        }
    }

    /** Staged operation; a null value is a delete. */
    private static final class Op {
        final byte[] key;
        final byte[] value;

        Op(byte[] key, byte[] value) {
            this.key = key;
            this.value = value;
        }
    }

    private final class MemoryBatch implements KeyValueBatch {
        private final List<Op> ops = new ArrayList<>();

        @Override
        public void put(byte[] key, byte[] value) {
            ops.add(new Op(key.clone(), value.clone()));
        }

        @Override
        public void del(byte[] key) {
            ops.add(new Op(key.clone(), null));
        }

        @Override
        public void write() {
            apply(new ArrayList<>(ops));
            ops.clear();
        }

        @Override
        public void clear() {
            ops.clear();
        }

        @Override
        public int size() {
            return ops.size();
        }
    }
}
