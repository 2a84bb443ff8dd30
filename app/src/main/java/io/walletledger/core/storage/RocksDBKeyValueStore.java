package io.walletledger.core.storage;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Persistent KeyValueStore using RocksDB.
 *
 * Everything lives in the default column family; callers namespace their keys
 * with a one-byte prefix (wallet namespaces use 't' + wid). RocksDB's default
 * bytewise comparator gives the unsigned lexicographic order range scans rely on.
 */
public final class RocksDBKeyValueStore implements KeyValueStore {

    static {
        RocksDB.loadLibrary();
    }

    private static final Logger LOG = Logger.getLogger(RocksDBKeyValueStore.class.getName());

    private final String dataDir;
    private final boolean sync;

    private RocksDB db;
    private Options options;
    private WriteOptions writeOptions;
    private LifecycleState state = LifecycleState.CLOSED;

    public RocksDBKeyValueStore(String dataDir, boolean sync) {
        if (dataDir == null || dataDir.isBlank()) {
            throw new IllegalArgumentException("dataDir is required");
        }
        this.dataDir = dataDir;
        this.sync = sync;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBKeyValueStore open(String dataDir) {
        RocksDBKeyValueStore store = new RocksDBKeyValueStore(dataDir, false);
        store.open();
        return store;
    }

    @Override
    public synchronized void open() {
        if (state != LifecycleState.CLOSED) {
            throw new IllegalStateException("RocksDB store already open (state=" + state + ")");
        }
        state = LifecycleState.OPENING;
        try {
            Files.createDirectories(Paths.get(dataDir));
        } catch (IOException e) {
            state = LifecycleState.CLOSED;
            throw new StorageException("Failed to create data directory " + dataDir, e);
        }
        Options opts = new Options().setCreateIfMissing(true);
        try {
            this.db = RocksDB.open(opts, dataDir);
            this.options = opts;
            this.writeOptions = new WriteOptions().setSync(sync);
            state = LifecycleState.OPEN;
            LOG.info(() -> "Opened RocksDB store at " + dataDir);
        } catch (RocksDBException e) {
            opts.close();
            state = LifecycleState.CLOSED;
            throw new StorageException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized void close() {
        if (state != LifecycleState.OPEN) {
            return;
        }
        state = LifecycleState.CLOSING;
        // write options and db before the options they were opened with
        writeOptions.close();
        db.close();
        options.close();
        writeOptions = null;
        db = null;
        options = null;
        state = LifecycleState.CLOSED;
        LOG.info(() -> "Closed RocksDB store at " + dataDir);
    }

    @Override
    public synchronized LifecycleState state() {
        return state;
    }

    @Override
    public synchronized Optional<byte[]> get(byte[] key) {
        ensureOpen();
        try {
            byte[] v = db.get(key);
            return Optional.ofNullable(v);
        } catch (RocksDBException e) {
            throw new StorageException("get failed", e);
        }
    }

    @Override
    public synchronized void put(byte[] key, byte[] value) {
        ensureOpen();
        try {
            db.put(writeOptions, key, value);
        } catch (RocksDBException e) {
            throw new StorageException("put failed", e);
        }
    }

    @Override
    public synchronized void del(byte[] key) {
        ensureOpen();
        try {
            db.delete(writeOptions, key);
        } catch (RocksDBException e) {
            throw new StorageException("del failed", e);
        }
    }

    @Override
    public KeyValueBatch batch() {
        return new RocksBatch();
    }

    @Override
    public synchronized List<KeyValue> range(RangeOptions range) {
        ensureOpen();
        byte[] gte = range.gte();
        byte[] lte = range.lte();
        List<KeyValue> out = new ArrayList<>();
        if (Arrays.compareUnsigned(gte, lte) > 0) {
            return out;
        }
        try (RocksIterator it = db.newIterator()) {
            if (range.reverse()) {
                for (it.seekForPrev(lte); it.isValid(); it.prev()) {
                    byte[] key = it.key();
                    if (Arrays.compareUnsigned(key, gte) < 0) break;
                    out.add(new KeyValue(key, it.value()));
                    if (range.limited() && out.size() >= range.limit()) break;
                }
            } else {
                for (it.seek(gte); it.isValid(); it.next()) {
                    byte[] key = it.key();
                    if (Arrays.compareUnsigned(key, lte) > 0) break;
                    out.add(new KeyValue(key, it.value()));
                    if (range.limited() && out.size() >= range.limit()) break;
                }
            }
            it.status();
        } catch (RocksDBException e) {
            throw new StorageException("range scan failed", e);
        }
        return out;
    }

    private synchronized void apply(List<byte[][]> ops) {
        ensureOpen();
        try (WriteBatch batch = new WriteBatch()) {
            for (byte[][] op : ops) {
                if (op[1] == null) {
                    batch.delete(op[0]);
                } else {
                    batch.put(op[0], op[1]);
                }
            }
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new StorageException("batch write failed (" + ops.size() + " ops)", e);
        }
    }

    /** Operations are buffered in Java and turned into one WriteBatch at write time. */
    private final class RocksBatch implements KeyValueBatch {
        private final List<byte[][]> ops = new ArrayList<>();

        @Override
        public void put(byte[] key, byte[] value) {
            ops.add(new byte[][]{key.clone(), value.clone()});
        }

        @Override
        public void del(byte[] key) {
            ops.add(new byte[][]{key.clone(), null});
        }

        @Override
        public void write() {
            apply(ops);
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
