package io.walletledger.core.txdb;

import io.walletledger.core.protocol.Outpoint;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded LRU of committed credits, keyed by outpoint.
 *
 * While a batch is open, writes are staged and only reach the cache on
 * {@link #commit()}; {@link #drop()} throws them away.
 */
public final class CoinCache {
    private final int capacity;
    private final LinkedHashMap<Outpoint, Credit> entries;
    // null value = staged removal
    private Map<Outpoint, Credit> staged;
    // bumped on every commit
    private long epoch;

    public CoinCache(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Outpoint, Credit> eldest) {
                return size() > CoinCache.this.capacity;
            }
        };
    }

    public synchronized Credit get(Outpoint key) {
        return entries.get(key);
    }

    public synchronized boolean has(Outpoint key) {
        return entries.containsKey(key);
    }

    /** Caches a committed value. Ignored while a batch is open. */
    public synchronized void set(Outpoint key, Credit credit) {
        if (capacity == 0 || staged != null) return;
        entries.put(key, credit);
    }

    /**
     * Caches a value read from the store at {@code readEpoch}. Ignored when a
     * commit happened since, as the read may predate it.
     */
    public synchronized void set(Outpoint key, Credit credit, long readEpoch) {
        if (readEpoch != epoch) return;
        set(key, credit);
    }

    public synchronized long epoch() {
        return epoch;
    }

    public synchronized void remove(Outpoint key) {
        entries.remove(key);
    }

    /** Opens a batch. */
    public synchronized void start() {
        if (staged != null) {
            throw new IllegalStateException("Coin cache batch already open");
        }
        staged = new HashMap<>();
    }

    public synchronized void push(Outpoint key, Credit credit) {
        requireBatch();
        staged.put(key, credit);
    }

    public synchronized void unpush(Outpoint key) {
        requireBatch();
        staged.put(key, null);
    }

    public synchronized void commit() {
        requireBatch();
        Map<Outpoint, Credit> ops = staged;
        staged = null;
        epoch++;
        for (Map.Entry<Outpoint, Credit> e : ops.entrySet()) {
            if (e.getValue() == null) {
                entries.remove(e.getKey());
            } else if (capacity > 0) {
                entries.put(e.getKey(), e.getValue());
            }
        }
    }

    /** Discards staged writes and closes the batch. */
    public synchronized void drop() {
        staged = null;
    }

    /** Discards staged writes; the batch stays open. */
    public synchronized void clear() {
        requireBatch();
        staged.clear();
    }

    /** Snapshot of the staged writes, for {@link #reset}. */
    public synchronized Map<Outpoint, Credit> mark() {
        requireBatch();
        return new HashMap<>(staged);
    }

    public synchronized void reset(Map<Outpoint, Credit> mark) {
        requireBatch();
        staged.clear();
        staged.putAll(mark);
    }

    public synchronized boolean inBatch() {
        return staged != null;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    private void requireBatch() {
        if (staged == null) {
            throw new IllegalStateException("No coin cache batch open");
        }
    }
}
