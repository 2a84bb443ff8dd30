package io.walletledger.core.wallet;

import io.walletledger.core.metrics.LedgerMetrics;
import io.walletledger.core.protocol.BlockMeta;
import io.walletledger.core.protocol.Encoding;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.storage.KeyValue;
import io.walletledger.core.storage.KeyValueBatch;
import io.walletledger.core.storage.KeyValueStore;
import io.walletledger.core.storage.Lifecycle;
import io.walletledger.core.storage.LifecycleState;
import io.walletledger.core.storage.RangeOptions;
import io.walletledger.core.storage.RocksDBKeyValueStore;
import io.walletledger.core.txdb.BlockRecord;
import io.walletledger.core.txdb.Details;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Hosts every wallet over one key-value store, tracks the chain tip and
 * routes mempool transactions and connected/disconnected blocks to each wallet.
 *
 * Top-level layout:
 * <pre>
 *  O              -> chain tip (hash, height, time)
 *  h[height]      -> block connected at that height
 *  W[wid]         -> wallet id
 *  l[id]          -> wid
 *  V              -> last assigned wid
 *  A[wid][address]-> path (see AddressBook)
 *  t[wid]...      -> wallet ledger (see TXDB layout)
 * </pre>
 */
public final class WalletDB implements Lifecycle {
    private static final Logger LOG = Logger.getLogger(WalletDB.class.getName());

    private final KeyValueStore store;
    private final WalletConfig config;
    private final InputVerifier verifier;
    private final LedgerMetrics metrics;
    private final Map<String, Wallet> wallets = new ConcurrentHashMap<>();
    private final List<WalletListener> listeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    private volatile LifecycleState state = LifecycleState.CLOSED;
    private volatile BlockMeta tip;
    private int lastWid;

    public WalletDB(KeyValueStore store, WalletConfig config) {
        this(store, config, InputVerifier.ACCEPT_ALL, LedgerMetrics.shared());
    }

    public WalletDB(KeyValueStore store, WalletConfig config, InputVerifier verifier, LedgerMetrics metrics) {
        if (store == null) throw new IllegalArgumentException("store is required");
        this.store = store;
        this.config = config;
        this.verifier = verifier;
        this.metrics = metrics;
    }

    /** Convenience factory for a RocksDB-backed database under {@code config.dataDir}. Not opened yet. */
    public static WalletDB rocks(WalletConfig config) {
        return new WalletDB(new RocksDBKeyValueStore(config.dataDir, true), config);
    }

    // ------------------------------------------------------------ lifecycle

    @Override
    public void open() {
        synchronized (writeLock) {
            if (state != LifecycleState.CLOSED) {
                throw new IllegalStateException("WalletDB already open (state=" + state + ")");
            }
            state = LifecycleState.OPENING;
            try {
                if (!store.isOpen()) {
                    store.open();
                }
                tip = store.get(key('O')).map(WalletDB::decodeMeta).orElse(null);
                lastWid = store.get(key('V')).map(v -> Encoding.readInt(Encoding.reader(v))).orElse(0);
                for (KeyValue kv : store.range(RangeOptions.between(key('W'), widKey('W', -1)))) {
                    int wid = ByteBuffer.wrap(kv.key(), 1, 4).getInt();
                    String id = new String(kv.value(), StandardCharsets.UTF_8);
                    Wallet wallet = newWallet(wid, id);
                    wallet.open();
                    wallets.put(id, wallet);
                }
                state = LifecycleState.OPEN;
            } catch (RuntimeException e) {
                wallets.clear();
                state = LifecycleState.CLOSED;
                throw e;
            }
            LOG.info(() -> "WalletDB opened: " + wallets.size() + " wallets, tip="
                    + (tip == null ? "none" : tip.height() + "/" + tip.hash().hex()));
        }
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            if (state != LifecycleState.OPEN) {
                return;
            }
            state = LifecycleState.CLOSING;
            wallets.clear();
            store.close();
            state = LifecycleState.CLOSED;
            LOG.info("WalletDB closed");
        }
    }

    @Override
    public LifecycleState state() {
        return state;
    }

    public WalletConfig config() {
        return config;
    }

    // ------------------------------------------------------------ wallets

    /**
     * Creates a wallet with a fresh wid.
     *
     * @throws IllegalStateException if the id is taken
     */
    public Wallet create(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("wallet id is required");
        synchronized (writeLock) {
            ensureOpen();
            if (wallets.containsKey(id) || store.has(idKey(id))) {
                throw new IllegalStateException("Wallet already exists: " + id);
            }
            int wid = lastWid + 1;
            KeyValueBatch batch = store.batch();
            batch.put(widKey('W', wid), id.getBytes(StandardCharsets.UTF_8));
            batch.put(idKey(id), ByteBuffer.allocate(4).putInt(wid).array());
            batch.put(key('V'), intLE(wid));
            batch.write();
            lastWid = wid;

            Wallet wallet = newWallet(wid, id);
            wallet.open();
            wallets.put(id, wallet);
            LOG.info(() -> "Created wallet " + id + " (wid=" + wid + ")");
            return wallet;
        }
    }

    /** Opens the configured default wallet, creating it on first use. */
    public Wallet primary() {
        synchronized (writeLock) {
            Wallet existing = wallets.get(config.walletId);
            return existing != null ? existing : create(config.walletId);
        }
    }

    public Optional<Wallet> get(String id) {
        ensureOpen();
        return Optional.ofNullable(wallets.get(id));
    }

    public boolean has(String id) {
        ensureOpen();
        return wallets.containsKey(id);
    }

    /** Wallet ids, sorted. */
    public List<String> getWallets() {
        ensureOpen();
        List<String> ids = new ArrayList<>(wallets.keySet());
        Collections.sort(ids);
        return ids;
    }

    public void addListener(WalletListener l) { listeners.add(l); }
    public void removeListener(WalletListener l) { listeners.remove(l); }

    // ------------------------------------------------------------ chain sync

    public Optional<BlockMeta> getTip() {
        return Optional.ofNullable(tip);
    }

    /** Tip height, or -1 before the first block. */
    public int getHeight() {
        BlockMeta t = tip;
        return t == null ? -1 : t.height();
    }

    /**
     * Offers a mempool transaction to every wallet.
     *
     * @return details from each wallet that recorded it
     */
    public List<Details> addTX(Transaction tx) {
        synchronized (writeLock) {
            ensureOpen();
            List<Details> out = new ArrayList<>();
            for (Wallet wallet : ordered()) {
                Details d = wallet.add(tx);
                if (d != null) {
                    LOG.fine(() -> "Added " + tx.txid() + " to wallet " + wallet.id());
                    out.add(d);
                }
            }
            return out;
        }
    }

    /**
     * Connects a block: each transaction is inserted or confirmed in every
     * wallet, then the tip advances.
     *
     * @return number of wallet transactions recorded
     * @throws IllegalStateException if the block does not extend the tip
     */
    public int addBlock(BlockMeta block, List<Transaction> txs) {
        synchronized (writeLock) {
            ensureOpen();
            BlockMeta current = tip;
            if (current != null) {
                if (block.height() < current.height()) {
                    LOG.warning(() -> "WalletDB is connecting low block " + block.height()
                            + " below tip " + current.height() + "; ignoring");
                    return 0;
                }
                // same height passes through for rescans
                if (block.height() != current.height() && block.height() != current.height() + 1) {
                    throw new IllegalStateException("Bad connection: block " + block.height()
                            + " does not extend tip " + current.height());
                }
            }

            int total = 0;
            for (Transaction tx : txs) {
                for (Wallet wallet : ordered()) {
                    if (wallet.add(tx, block) != null) total++;
                }
            }
            setTip(block);
            if (total > 0) {
                int n = total;
                LOG.info(() -> "Connected block " + block.height() + " (" + block.hash().hex() + "): " + n + " wallet txs");
            }
            return total;
        }
    }

    /**
     * Disconnects the tip block: every wallet unconfirms, newest first, the
     * transactions it recorded at that height. The tip moves back one block.
     *
     * @return number of wallet transactions unconfirmed
     * @throws IllegalStateException if the block is not the tip
     */
    public int removeBlock(BlockMeta block) {
        synchronized (writeLock) {
            ensureOpen();
            BlockMeta current = tip;
            if (current == null || block.height() > current.height()) {
                LOG.warning(() -> "WalletDB is disconnecting high block " + block.height() + "; ignoring");
                return 0;
            }
            if (block.height() != current.height()) {
                throw new IllegalStateException("Bad disconnection: block " + block.height()
                        + " is not the tip " + current.height());
            }

            int total = 0;
            for (Wallet wallet : ordered()) {
                BlockRecord record = wallet.txdb().getBlock(block.height());
                if (record == null) continue;
                List<Hash> hashes = record.hashes();
                Collections.reverse(hashes);
                for (Hash hash : hashes) {
                    if (wallet.unconfirm(hash) != null) total++;
                }
            }
            rewindTip(block);
            int n = total;
            LOG.info(() -> "Disconnected block " + block.height() + " (" + block.hash().hex() + "): " + n + " wallet txs");
            return total;
        }
    }

    private void setTip(BlockMeta block) {
        KeyValueBatch batch = store.batch();
        byte[] raw = encodeMeta(block);
        batch.put(heightKey(block.height()), raw);
        batch.put(key('O'), raw);
        batch.write();
        tip = block;
    }

    private void rewindTip(BlockMeta block) {
        KeyValueBatch batch = store.batch();
        batch.del(heightKey(block.height()));
        BlockMeta previous = null;
        if (block.height() > 0) {
            previous = store.get(heightKey(block.height() - 1)).map(WalletDB::decodeMeta).orElse(null);
        }
        if (previous != null) {
            batch.put(key('O'), encodeMeta(previous));
        } else {
            batch.del(key('O'));
        }
        batch.write();
        tip = previous;
    }

    // ------------------------------------------------------------ helpers

    private Wallet newWallet(int wid, String id) {
        return new Wallet(store, wid, id, config, verifier, metrics, this::getHeight, listeners);
    }

    private List<Wallet> ordered() {
        List<Wallet> out = new ArrayList<>(wallets.values());
        out.sort((a, b) -> Integer.compare(a.wid(), b.wid()));
        return out;
    }

    private static byte[] key(char type) {
        return new byte[]{(byte) type};
    }

    private static byte[] widKey(char type, int wid) {
        return ByteBuffer.allocate(5).put((byte) type).putInt(wid).array();
    }

    private static byte[] heightKey(int height) {
        return widKey('h', height);
    }

    private static byte[] idKey(String id) {
        byte[] b = id.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + b.length).put((byte) 'l').put(b).array();
    }

    private static byte[] intLE(int v) {
        ByteBuffer buf = Encoding.writer(4);
        buf.putInt(v);
        return Encoding.render(buf);
    }

    private static byte[] encodeMeta(BlockMeta meta) {
        ByteBuffer buf = Encoding.writer(Hash.LENGTH + 8);
        Encoding.putHash(buf, meta.hash());
        buf.putInt(meta.height());
        buf.putInt((int) meta.time());
        return Encoding.render(buf);
    }

    private static BlockMeta decodeMeta(byte[] raw) {
        ByteBuffer buf = Encoding.reader(raw);
        Hash hash = Encoding.readHash(buf);
        int height = Encoding.readInt(buf);
        long time = Encoding.readU32(buf);
        Encoding.expectEnd(buf, "block meta");
        return new BlockMeta(hash, height, time);
    }
}
