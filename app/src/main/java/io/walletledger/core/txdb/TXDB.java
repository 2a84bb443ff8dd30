package io.walletledger.core.txdb;

import io.walletledger.core.metrics.LedgerMetrics;
import io.walletledger.core.protocol.BlockMeta;
import io.walletledger.core.protocol.CorruptDataException;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Input;
import io.walletledger.core.protocol.Outpoint;
import io.walletledger.core.protocol.Output;
import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.storage.KeyValue;
import io.walletledger.core.storage.KeyValueStore;
import io.walletledger.core.storage.RangeOptions;
import io.walletledger.core.storage.StagedBatch;
import io.walletledger.core.wallet.InputVerifier;
import io.walletledger.core.wallet.Path;
import io.walletledger.core.wallet.PathResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-wallet transaction database.
 *
 * Tracks credits (our unspent and mempool-spent outputs), undo coins, the
 * transaction history with its time/height/account indexes, block records
 * and the running balance. Every mutation runs in one {@link TxdbBatch}:
 * either all of its writes land and its events are delivered, or nothing
 * changes.
 *
 * Writers must be serialized by the caller (the owning wallet's lock).
 * Reads take no lock.
 */
public final class TXDB {
    private static final Logger LOG = Logger.getLogger(TXDB.class.getName());
    private static final byte[] DUMMY = new byte[0];

    private final KeyValueStore store;
    private final int wid;
    private final String id;
    private final Layout layout;
    private final PathResolver paths;
    private final CoinCache coinCache;
    private final boolean verify;
    private final InputVerifier verifier;
    private final LedgerMetrics metrics;
    private final IntSupplier chainHeight;
    private final LongSupplier clock;
    private final Consumer<WalletEvent> sink;
    private final Set<Outpoint> locked = ConcurrentHashMap.newKeySet();

    private volatile TXDBState state;
    private volatile TxdbBatch current;

    private TXDB(Builder b) {
        this.store = b.store;
        this.wid = b.wid;
        this.id = b.id;
        this.layout = new Layout(b.wid);
        this.paths = b.paths;
        this.coinCache = new CoinCache(b.cacheSize);
        this.verify = b.verify;
        this.verifier = b.verifier;
        this.metrics = b.metrics;
        this.chainHeight = b.chainHeight;
        this.clock = b.clock;
        this.sink = b.sink;
        this.state = new TXDBState(wid, id);
    }

    public static Builder builder(KeyValueStore store, int wid) {
        return new Builder(store, wid);
    }

    public static final class Builder {
        private final KeyValueStore store;
        private final int wid;
        private String id;
        private PathResolver paths = address -> Optional.empty();
        private int cacheSize = 10_000;
        private boolean verify;
        private InputVerifier verifier = InputVerifier.ACCEPT_ALL;
        private LedgerMetrics metrics = LedgerMetrics.shared();
        private IntSupplier chainHeight = () -> -1;
        private LongSupplier clock = () -> System.currentTimeMillis() / 1000;
        private Consumer<WalletEvent> sink = e -> { };

        private Builder(KeyValueStore store, int wid) {
            if (store == null) throw new IllegalArgumentException("store is required");
            this.store = store;
            this.wid = wid;
            this.id = Integer.toString(wid);
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder paths(PathResolver paths) { this.paths = paths; return this; }
        public Builder cacheSize(int size) { this.cacheSize = size; return this; }
        public Builder verify(boolean v) { this.verify = v; return this; }
        public Builder verifier(InputVerifier v) { this.verifier = v; return this; }
        public Builder metrics(LedgerMetrics m) { this.metrics = m; return this; }
        public Builder chainHeight(IntSupplier h) { this.chainHeight = h; return this; }
        public Builder clock(LongSupplier c) { this.clock = c; return this; }
        public Builder onEvent(Consumer<WalletEvent> s) { this.sink = s; return this; }

        public TXDB build() {
            return new TXDB(this);
        }
    }

    /** Loads the persisted state, or starts from zero for a new wallet. */
    public void open() {
        Optional<byte[]> raw = store.get(layout.R());
        state = raw.map(data -> TXDBState.fromRaw(wid, id, data)).orElseGet(() -> new TXDBState(wid, id));
        LOG.info(() -> "TXDB loaded for " + id + ": tx=" + state.tx() + " coin=" + state.coin()
                + " unconfirmed=" + state.unconfirmed() + " confirmed=" + state.confirmed());
    }

    public int wid() { return wid; }
    public String id() { return id; }
    public Layout layout() { return layout; }

    /** Committed state snapshot. */
    public TXDBState getState() {
        return state.copy();
    }

    // ================================================================ batch

    /** Opens the write batch. Only one batch may be open at a time. */
    public TxdbBatch start() {
        if (current != null) {
            throw new IllegalStateException("Batch already open for wallet " + id);
        }
        coinCache.start();
        current = new TxdbBatch(this, new StagedBatch(store), state.copy());
        return current;
    }

    /** Discards everything staged in the open batch; the batch stays open. */
    public void clear() {
        TxdbBatch b = batch();
        b.writes.clear();
        b.events.clear();
        b.pending = state.copy();
        coinCache.clear();
    }

    void commit(TxdbBatch b) {
        requireCurrent(b);
        int writes = b.writes.size();
        try {
            metrics.recordCommit(() -> {
                b.writes.write();
                return null;
            });
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Ledger commit failed for wallet " + id, e);
            drop(b);
            throw e;
        }
        state = b.pending;
        coinCache.commit();
        current = null;
        b.finish();
        metrics.incrementCommits(writes);

        List<WalletEvent> events = new ArrayList<>(b.events);
        b.events.clear();
        for (WalletEvent event : events) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Listener failed on " + event.type() + " for wallet " + id, e);
            }
        }
    }

    void drop(TxdbBatch b) {
        requireCurrent(b);
        b.writes.clear();
        b.events.clear();
        coinCache.drop();
        current = null;
        b.finish();
        metrics.incrementDrops();
    }

    private void requireCurrent(TxdbBatch b) {
        if (b == null || b != current) {
            throw new IllegalStateException("Batch is not the open batch of wallet " + id);
        }
    }

    private TxdbBatch batch() {
        if (current == null) {
            throw new IllegalStateException("No batch open for wallet " + id);
        }
        return current;
    }

    private TXDBState pending() {
        return batch().pending;
    }

    private void emit(WalletEvent.Type type, TXRecord wtx, Details details) {
        batch().events.add(WalletEvent.tx(type, wtx, details));
    }

    private void emitBalance() {
        batch().events.add(WalletEvent.balance(pending().toBalance()));
    }

    /** Staged state at a point inside the batch, to roll one operation back. */
    private final class Savepoint {
        final NavigableMap<byte[], byte[]> writes = batch().writes.mark();
        final Map<Outpoint, Credit> cache = coinCache.mark();
        final TXDBState pending = pending().copy();
        final int events = batch().events.size();

        void restore() {
            TxdbBatch b = batch();
            b.writes.reset(writes);
            coinCache.reset(cache);
            b.pending = pending;
            b.events.subList(events, b.events.size()).clear();
        }
    }

    // ================================================================ kv helpers

    private void put(byte[] key, byte[] value) {
        batch().writes.put(key, value);
    }

    private void del(byte[] key) {
        batch().writes.del(key);
    }

    /** The open batch if the calling thread owns it; other threads read committed data only. */
    private TxdbBatch staged() {
        TxdbBatch b = current;
        return b != null && b.isOwnedByCurrentThread() ? b : null;
    }

    private Optional<byte[]> get(byte[] key) {
        TxdbBatch b = staged();
        return b != null ? b.writes.get(key) : store.get(key);
    }

    private boolean has(byte[] key) {
        TxdbBatch b = staged();
        return b != null ? b.writes.has(key) : store.has(key);
    }

    private List<KeyValue> range(RangeOptions options) {
        TxdbBatch b = staged();
        return b != null ? b.writes.range(options) : store.range(options);
    }

    private List<Hash> hashes(RangeOptions options) {
        List<KeyValue> entries = range(options);
        List<Hash> out = new ArrayList<>(entries.size());
        for (KeyValue kv : entries) out.add(Layout.tailHash(kv.key()));
        return out;
    }

    private static RangeOptions scan(byte[] gte, byte[] lte) {
        return RangeOptions.between(gte, lte);
    }

    private static RangeOptions scan(byte[] gte, byte[] lte, RangeQuery q) {
        return RangeOptions.between(gte, lte).limit(q.limit()).reverse(q.reverse());
    }

    private Path getPath(String address) {
        return paths.getPath(address).orElse(null);
    }

    private Path requirePath(Coin coin) {
        Path path = getPath(coin.address());
        if (path == null) {
            throw new IllegalStateException("No path for owned coin " + coin.outpoint() + " (" + coin.address() + ")");
        }
        return path;
    }

    // ================================================================ credit writes

    private void saveCredit(Credit credit, Path path) {
        Coin coin = credit.coin();
        put(layout.c(coin.hash(), coin.index()), credit.toRaw());
        put(layout.C(path.account(), coin.hash(), coin.index()), DUMMY);
        coinCache.push(coin.outpoint(), credit);
    }

    private void removeCredit(Credit credit, Path path) {
        Coin coin = credit.coin();
        del(layout.c(coin.hash(), coin.index()));
        del(layout.C(path.account(), coin.hash(), coin.index()));
        coinCache.unpush(coin.outpoint());
    }

    /** Marks the credit spent by input {@code index} of {@code spender} and keeps an undo copy. */
    private void spendCredit(Credit credit, Transaction spender, int index) {
        Outpoint prevout = spender.input(index).prevout();
        Outpoint spent = new Outpoint(spender.hash(), index);
        put(layout.s(prevout), spent.toRaw());
        put(layout.d(spent.hash(), spent.index()), UndoCoin.of(credit).toRaw());
    }

    private void unspendCredit(Transaction tx, int index) {
        Outpoint prevout = tx.input(index).prevout();
        del(layout.s(prevout));
        del(layout.d(tx.hash(), index));
    }

    /** Spend marker for an input that does not spend one of our credits (yet). */
    private void writeInput(Transaction tx, int index) {
        Outpoint prevout = tx.input(index).prevout();
        put(layout.s(prevout), new Outpoint(tx.hash(), index).toRaw());
    }

    private void removeInput(Transaction tx, int index) {
        del(layout.s(tx.input(index).prevout()));
    }

    /** Rewrites the height of the undo coin kept for output {@code index} of {@code tx}, if it was spent. */
    private void updateSpentCoin(Transaction tx, int index, int height) {
        Outpoint prevout = Outpoint.fromTX(tx, index);
        Outpoint spent = getSpent(prevout.hash(), prevout.index());
        if (spent == null) return;
        UndoCoin undo = getSpentCoin(spent, prevout);
        if (undo == null) return;
        put(layout.d(spent.hash(), spent.index()), new UndoCoin(undo.coin().withHeight(height), undo.own()).toRaw());
    }

    private void addBlockRecord(Hash hash, BlockMeta block) {
        byte[] key = layout.b(block.height());
        BlockRecord record = get(key).map(BlockRecord::fromRaw).orElseGet(() -> BlockRecord.fromMeta(block));
        if (!record.add(hash)) return;
        put(key, record.toRaw());
    }

    private void removeBlockRecord(Hash hash, int height) {
        byte[] key = layout.b(height);
        Optional<byte[]> raw = get(key);
        if (raw.isEmpty()) return;
        BlockRecord record = BlockRecord.fromRaw(raw.get());
        if (!record.remove(hash)) return;
        if (record.isEmpty()) {
            del(key);
        } else {
            put(key, record.toRaw());
        }
    }

    // ================================================================ mutations

    /**
     * Adds a transaction seen in the mempool ({@code block == null}) or in a block.
     *
     * @return details of the inserted or confirmed transaction, or null when
     *         the transaction was ignored (irrelevant, already confirmed, RBF,
     *         or losing a double-spend)
     */
    public Details add(Transaction tx, BlockMeta block) {
        try (TxdbBatch b = start()) {
            Details details = addInternal(tx, block);
            b.commit();
            return details;
        }
    }

    private Details addInternal(Transaction tx, BlockMeta block) {
        Hash hash = tx.hash();
        TXRecord existing = getTX(hash);

        if (existing != null) {
            if (existing.confirmed()) return null;
            if (block == null) return null;
            return confirmInternal(existing, block);
        }

        if (block == null) {
            if (isRBF(tx)) {
                // passive replace-by-fee: index only
                put(layout.r(hash), DUMMY);
                return null;
            }
            if (!removeConflicts(tx, true)) {
                return null;
            }
        } else {
            removeConflicts(tx, false);
            del(layout.r(hash));
        }

        return insert(TXRecord.fromTX(tx, block, clock.getAsLong()), block);
    }

    private Details insert(TXRecord wtx, BlockMeta block) {
        Savepoint savepoint = new Savepoint();
        Transaction tx = wtx.tx();
        Hash hash = wtx.hash();
        int height = block != null ? block.height() : Coin.UNCONFIRMED;
        Details details = new Details(wid, id, wtx, chainHeight.getAsInt());
        TXDBState pending = pending();
        boolean own = false;
        boolean updated = false;

        if (!tx.isCoinbase()) {
            for (int i = 0; i < tx.inputs().size(); i++) {
                Outpoint prevout = tx.input(i).prevout();
                Credit credit = getCredit(prevout.hash(), prevout.index());

                if (credit == null) {
                    writeInput(tx, i);
                    continue;
                }

                Coin coin = credit.coin();
                if (block == null && verify && !verifier.verify(tx, i, coin)) {
                    LOG.warning(() -> "Input " + prevout + " of " + tx.txid() + " failed verification; ignoring tx");
                    savepoint.restore();
                    return null;
                }

                Path path = requirePath(coin);
                details.setInput(i, path, coin);

                spendCredit(credit, tx, i);
                pending.coin--;
                pending.unconfirmed -= coin.value();

                if (block == null) {
                    // stays stored as spent until the spender confirms
                    saveCredit(credit.withSpent(true), path);
                } else {
                    pending.confirmed -= coin.value();
                    removeCredit(credit, path);
                }

                updated = true;
                own = true;
            }
        }

        for (int i = 0; i < tx.outputs().size(); i++) {
            Output output = tx.output(i);
            Path path = getPath(output.address());
            if (path == null) continue;

            details.setOutput(i, path);

            if (resolveInput(tx, i, height, path, own)) {
                updated = true;
                continue;
            }

            Credit credit = Credit.fromTX(tx, i, height, own);
            pending.coin++;
            pending.unconfirmed += output.value();
            if (block != null) pending.confirmed += output.value();
            saveCredit(credit, path);
            updated = true;
        }

        if (!updated) {
            savepoint.restore();
            return null;
        }

        put(layout.t(hash), wtx.toRaw());
        put(layout.m(wtx.ps(), hash), DUMMY);
        if (block == null) {
            put(layout.p(hash), DUMMY);
        } else {
            put(layout.h(height, hash), DUMMY);
        }

        for (int account : details.accounts()) {
            put(layout.T(account, hash), DUMMY);
            put(layout.M(account, wtx.ps(), hash), DUMMY);
            if (block == null) {
                put(layout.P(account, hash), DUMMY);
            } else {
                put(layout.H(account, height, hash), DUMMY);
            }
        }

        if (block != null) {
            addBlockRecord(hash, block);
        }

        pending.tx++;
        put(layout.R(), pending.commit());
        unlockTX(tx);

        emit(WalletEvent.Type.TX, wtx, details);
        emitBalance();
        return details;
    }

    /**
     * An output of {@code tx} may already have been spent by a transaction we
     * saw first (orphan order). Attach the new credit to that spender.
     */
    private boolean resolveInput(Transaction tx, int index, int height, Path path, boolean own) {
        Hash hash = tx.hash();
        Outpoint spent = getSpent(hash, index);
        if (spent == null) return false;

        // an undo coin means we already knew this input was ours
        if (hasSpentCoin(spent)) return false;

        TXRecord stx = getTX(spent.hash());
        if (stx == null) {
            throw new CorruptDataException("Spend marker points at unknown tx " + spent.hash().hex());
        }

        Credit credit = Credit.fromTX(tx, index, height, own);
        spendCredit(credit, stx.tx(), spent.index());

        if (!stx.confirmed()) {
            saveCredit(credit.withSpent(true), path);
            if (height != Coin.UNCONFIRMED) {
                pending().confirmed += credit.value();
            }
        }
        return true;
    }

    /**
     * Confirms a pending transaction.
     *
     * @return details, or null if the transaction is unknown
     * @throws IllegalStateException if it is already confirmed
     */
    public Details confirm(Hash hash, BlockMeta block) {
        if (block == null) throw new IllegalArgumentException("block is required");
        try (TxdbBatch b = start()) {
            TXRecord wtx = getTX(hash);
            if (wtx == null) {
                b.commit();
                return null;
            }
            if (wtx.confirmed()) {
                throw new IllegalStateException("TX " + hash.hex() + " is already confirmed");
            }
            Details details = confirmInternal(wtx, block);
            b.commit();
            return details;
        }
    }

    private Details confirmInternal(TXRecord pendingRecord, BlockMeta block) {
        Transaction tx = pendingRecord.tx();
        Hash hash = pendingRecord.hash();
        int height = block.height();
        TXRecord wtx = pendingRecord.withBlock(block);
        Details details = new Details(wid, id, wtx, chainHeight.getAsInt());
        TXDBState pending = pending();

        if (!tx.isCoinbase()) {
            List<Credit> credits = getSpentCredits(tx);
            for (int i = 0; i < tx.inputs().size(); i++) {
                Credit credit = credits.get(i);

                if (credit == null) {
                    // a credit we learned about after the spend was recorded
                    Outpoint prevout = tx.input(i).prevout();
                    credit = getCredit(prevout.hash(), prevout.index());
                    if (credit == null) continue;
                    spendCredit(credit, tx, i);
                    pending.coin--;
                    pending.unconfirmed -= credit.value();
                }

                Coin coin = credit.coin();
                Path path = requirePath(coin);
                details.setInput(i, path, coin);

                pending.confirmed -= coin.value();
                removeCredit(credit, path);
            }
        }

        for (int i = 0; i < tx.outputs().size(); i++) {
            Output output = tx.output(i);
            Path path = getPath(output.address());
            if (path == null) continue;

            details.setOutput(i, path);

            Credit credit = getCredit(hash, i);
            if (credit == null) {
                // spent by a confirmed tx; only the undo coin is left
                updateSpentCoin(tx, i, height);
                continue;
            }

            if (credit.spent()) {
                updateSpentCoin(tx, i, height);
            }

            pending.confirmed += output.value();
            saveCredit(credit.withHeight(height), path);
        }

        del(layout.r(hash));
        put(layout.t(hash), wtx.toRaw());
        del(layout.p(hash));
        put(layout.h(height, hash), DUMMY);

        for (int account : details.accounts()) {
            del(layout.P(account, hash));
            put(layout.H(account, height, hash), DUMMY);
        }

        addBlockRecord(hash, block);

        put(layout.R(), pending.commit());
        unlockTX(tx);

        emit(WalletEvent.Type.CONFIRMED, wtx, details);
        emitBalance();
        return details;
    }

    /**
     * Moves a confirmed transaction back to the mempool (reorg).
     *
     * @return details, or null if the transaction is unknown or already pending
     */
    public Details unconfirm(Hash hash) {
        try (TxdbBatch b = start()) {
            TXRecord wtx = getTX(hash);
            Details details = null;
            if (wtx != null && wtx.confirmed()) {
                details = disconnect(wtx, wtx.blockMeta());
            }
            b.commit();
            return details;
        }
    }

    private Details disconnect(TXRecord confirmedRecord, BlockMeta block) {
        Transaction tx = confirmedRecord.tx();
        Hash hash = confirmedRecord.hash();
        int height = block.height();
        TXRecord wtx = confirmedRecord.withoutBlock();
        Details details = new Details(wid, id, wtx, chainHeight.getAsInt());
        TXDBState pending = pending();

        if (!tx.isCoinbase()) {
            List<Credit> credits = getSpentCredits(tx);
            for (int i = 0; i < tx.inputs().size(); i++) {
                Credit credit = credits.get(i);
                if (credit == null) continue;

                Coin coin = credit.coin();
                Path path = requirePath(coin);
                details.setInput(i, path, coin);

                // back to a mempool spend of a still-confirmed coin
                pending.confirmed += coin.value();
                saveCredit(credit.withSpent(true), path);
            }
        }

        for (int i = 0; i < tx.outputs().size(); i++) {
            Output output = tx.output(i);
            Path path = getPath(output.address());
            if (path == null) continue;

            Credit credit = getCredit(hash, i);
            if (credit == null) {
                updateSpentCoin(tx, i, Coin.UNCONFIRMED);
                continue;
            }

            if (credit.spent()) {
                updateSpentCoin(tx, i, Coin.UNCONFIRMED);
            }

            details.setOutput(i, path);
            pending.confirmed -= output.value();
            saveCredit(credit.withHeight(Coin.UNCONFIRMED), path);
        }

        removeBlockRecord(hash, height);

        put(layout.t(hash), wtx.toRaw());
        put(layout.p(hash), DUMMY);
        del(layout.h(height, hash));

        for (int account : details.accounts()) {
            put(layout.P(account, hash), DUMMY);
            del(layout.H(account, height, hash));
        }

        put(layout.R(), pending.commit());

        emit(WalletEvent.Type.UNCONFIRMED, wtx, details);
        emitBalance();
        return details;
    }

    /**
     * Removes a transaction and every transaction spending its outputs.
     *
     * @return details of the removed transaction, or null if unknown
     */
    public Details remove(Hash hash) {
        try (TxdbBatch b = start()) {
            TXRecord wtx = getTX(hash);
            Details details = wtx == null ? null : removeRecursive(wtx);
            b.commit();
            return details;
        }
    }

    private Details removeRecursive(TXRecord wtx) {
        Transaction tx = wtx.tx();
        Hash hash = wtx.hash();

        for (int i = 0; i < tx.outputs().size(); i++) {
            Outpoint spent = getSpent(hash, i);
            if (spent == null) continue;
            TXRecord stx = getTX(spent.hash());
            if (stx == null) {
                throw new CorruptDataException("Spend marker points at unknown tx " + spent.hash().hex());
            }
            removeRecursive(stx);
        }

        return erase(wtx, wtx.blockMeta());
    }

    private Details erase(TXRecord wtx, BlockMeta block) {
        Transaction tx = wtx.tx();
        Hash hash = wtx.hash();
        int height = block != null ? block.height() : Coin.UNCONFIRMED;
        Details details = new Details(wid, id, wtx, chainHeight.getAsInt());
        TXDBState pending = pending();

        if (!tx.isCoinbase()) {
            List<Credit> credits = getSpentCredits(tx);
            for (int i = 0; i < tx.inputs().size(); i++) {
                Credit credit = credits.get(i);
                if (credit == null) {
                    removeInput(tx, i);
                    continue;
                }

                Coin coin = credit.coin();
                Path path = requirePath(coin);
                details.setInput(i, path, coin);

                pending.coin++;
                pending.unconfirmed += coin.value();
                if (block != null) pending.confirmed += coin.value();

                unspendCredit(tx, i);
                saveCredit(credit, path);
            }
        }

        for (int i = 0; i < tx.outputs().size(); i++) {
            Output output = tx.output(i);
            Path path = getPath(output.address());
            if (path == null) continue;

            details.setOutput(i, path);

            Credit credit = Credit.fromTX(tx, i, height, false);
            pending.coin--;
            pending.unconfirmed -= output.value();
            if (block != null) pending.confirmed -= output.value();
            removeCredit(credit, path);
        }

        del(layout.r(hash));
        del(layout.t(hash));
        del(layout.m(wtx.ps(), hash));
        if (block == null) {
            del(layout.p(hash));
        } else {
            del(layout.h(height, hash));
        }

        for (int account : details.accounts()) {
            del(layout.T(account, hash));
            del(layout.M(account, wtx.ps(), hash));
            if (block == null) {
                del(layout.P(account, hash));
            } else {
                del(layout.H(account, height, hash));
            }
        }

        if (block != null) {
            removeBlockRecord(hash, height);
        }

        pending.tx--;
        put(layout.R(), pending.commit());
        metrics.incrementRemovals();

        emit(WalletEvent.Type.REMOVE_TX, wtx, details);
        emitBalance();
        return details;
    }

    /**
     * Evicts the transactions that already spend the inputs of {@code tx}.
     *
     * @param requireUnconfirmed when true, a confirmed spender wins and nothing is removed
     * @return false if {@code tx} lost the double-spend
     */
    private boolean removeConflicts(Transaction tx, boolean requireUnconfirmed) {
        if (tx.isCoinbase()) return true;

        Hash hash = tx.hash();
        Map<Hash, TXRecord> spenders = new LinkedHashMap<>();

        for (Input input : tx.inputs()) {
            Outpoint prevout = input.prevout();
            Outpoint spent = getSpent(prevout.hash(), prevout.index());
            if (spent == null) continue;
            if (spent.hash().equals(hash)) continue;

            TXRecord spender = getTX(spent.hash());
            if (spender == null) {
                throw new CorruptDataException("Spend marker points at unknown tx " + spent.hash().hex());
            }
            if (requireUnconfirmed && spender.confirmed()) {
                return false;
            }
            spenders.putIfAbsent(spender.hash(), spender);
        }

        for (TXRecord spender : spenders.values()) {
            // an earlier eviction may already have taken this one as a descendant
            if (!has(layout.t(spender.hash()))) continue;
            removeConflict(spender);
        }
        return true;
    }

    private Details removeConflict(TXRecord wtx) {
        LOG.warning(() -> "Handling conflicting tx " + wtx.tx().txid() + " in wallet " + id);
        Details details = removeRecursive(wtx);
        metrics.incrementConflicts();
        LOG.warning(() -> "Removed conflict " + wtx.tx().txid() + " from wallet " + id);
        emit(WalletEvent.Type.CONFLICT, wtx, details);
        return details;
    }

    /**
     * Removes pending transactions first seen more than {@code age} seconds ago.
     *
     * @param account account filter, or null for the whole wallet
     * @return hashes of the removed transactions
     */
    public List<Hash> zap(Integer account, long age) {
        if (age < 0 || age > RangeQuery.MAX) throw new IllegalArgumentException("age must be a u32");
        long now = clock.getAsLong();
        long end = Math.max(0, now - age);
        List<Hash> removed = new ArrayList<>();

        for (TXRecord wtx : getRange(account, RangeQuery.between(0, Math.min(end, RangeQuery.MAX)))) {
            if (wtx.confirmed()) continue;
            LOG.fine(() -> "Zapping TX " + wtx.tx().txid() + " (" + id + ")");
            if (remove(wtx.hash()) != null) {
                removed.add(wtx.hash());
            }
        }
        if (!removed.isEmpty()) {
            LOG.info(() -> "Zapped " + removed.size() + " pending txs from wallet " + id);
        }
        return removed;
    }

    /**
     * Removes a pending transaction and its descendants.
     *
     * @throws IllegalStateException if the transaction is not pending
     */
    public Details abandon(Hash hash) {
        if (!store.has(layout.p(hash))) {
            throw new IllegalStateException("TX " + hash.hex() + " not eligible for abandon");
        }
        return remove(hash);
    }

    // ================================================================ predicates

    /** True if any input spends an outpoint we have already seen spent. */
    public boolean isDoubleSpend(Transaction tx) {
        for (Input input : tx.inputs()) {
            Outpoint prevout = input.prevout();
            if (isSpent(prevout.hash(), prevout.index())) return true;
        }
        return false;
    }

    /** True if the transaction signals RBF or spends an output of one that did. */
    public boolean isRBF(Transaction tx) {
        if (tx.isRBF()) return true;
        for (Input input : tx.inputs()) {
            if (has(layout.r(input.prevout().hash()))) return true;
        }
        return false;
    }

    // ================================================================ locking

    public void lockCoin(Outpoint outpoint) {
        locked.add(outpoint);
    }

    public void unlockCoin(Outpoint outpoint) {
        locked.remove(outpoint);
    }

    public boolean isLocked(Outpoint outpoint) {
        return locked.contains(outpoint);
    }

    public void lockTX(Transaction tx) {
        if (tx.isCoinbase()) return;
        for (Input input : tx.inputs()) lockCoin(input.prevout());
    }

    public void unlockTX(Transaction tx) {
        if (tx.isCoinbase()) return;
        for (Input input : tx.inputs()) unlockCoin(input.prevout());
    }

    public List<Coin> filterLocked(List<Coin> coins) {
        List<Coin> out = new ArrayList<>(coins.size());
        for (Coin coin : coins) {
            if (!isLocked(coin.outpoint())) out.add(coin);
        }
        return out;
    }

    public List<Outpoint> getLocked() {
        List<Outpoint> out = new ArrayList<>(locked);
        Collections.sort(out);
        return out;
    }

    // ================================================================ queries

    public List<Hash> getHistoryHashes(Integer account) {
        if (account == null) {
            return hashes(scan(layout.min('t'), layout.max('t')));
        }
        return hashes(scan(layout.min('T', account), layout.max('T', account)));
    }

    public List<Hash> getPendingHashes(Integer account) {
        if (account == null) {
            return hashes(scan(layout.min('p'), layout.max('p')));
        }
        return hashes(scan(layout.min('P', account), layout.max('P', account)));
    }

    public List<Outpoint> getOutpoints(Integer account) {
        RangeOptions options = account == null
                ? scan(layout.min('c'), layout.max('c'))
                : scan(layout.min('C', account), layout.max('C', account));
        List<KeyValue> entries = range(options);
        List<Outpoint> out = new ArrayList<>(entries.size());
        for (KeyValue kv : entries) out.add(Layout.tailOutpoint(kv.key()));
        return out;
    }

    public List<Hash> getHeightRangeHashes(Integer account, RangeQuery q) {
        int start = (int) q.start();
        int end = (int) q.end();
        if (account == null) {
            return hashes(scan(layout.min('h', start), layout.max('h', end), q));
        }
        return hashes(scan(layout.min('H', account, start), layout.max('H', account, end), q));
    }

    public List<Hash> getHeightHashes(int height) {
        return getHeightRangeHashes(null, RangeQuery.between(height, height));
    }

    /** Hashes by first-seen time. */
    public List<Hash> getRangeHashes(Integer account, RangeQuery q) {
        int start = (int) q.start();
        int end = (int) q.end();
        if (account == null) {
            return hashes(scan(layout.min('m', start), layout.max('m', end), q));
        }
        return hashes(scan(layout.min('M', account, start), layout.max('M', account, end), q));
    }

    public List<TXRecord> getRange(Integer account, RangeQuery q) {
        return records(getRangeHashes(account, q));
    }

    /** Most recently seen transactions, newest first. */
    public List<TXRecord> getLast(Integer account, int limit) {
        return getRange(account, RangeQuery.all().withLimit(limit).reversed());
    }

    public List<TXRecord> getHistory(Integer account) {
        if (account == null) {
            List<KeyValue> entries = range(scan(layout.min('t'), layout.max('t')));
            List<TXRecord> out = new ArrayList<>(entries.size());
            for (KeyValue kv : entries) out.add(TXRecord.fromRaw(kv.value()));
            return out;
        }
        return records(getHistoryHashes(account));
    }

    public List<TXRecord> getPending(Integer account) {
        return records(getPendingHashes(account));
    }

    private List<TXRecord> records(List<Hash> hashes) {
        List<TXRecord> out = new ArrayList<>(hashes.size());
        for (Hash h : hashes) {
            TXRecord wtx = getTX(h);
            if (wtx == null) {
                throw new CorruptDataException("Index entry for missing tx " + h.hex());
            }
            out.add(wtx);
        }
        return out;
    }

    public List<Credit> getCredits(Integer account) {
        if (account != null) {
            List<Credit> out = new ArrayList<>();
            for (Outpoint op : getOutpoints(account)) {
                Credit credit = getCredit(op.hash(), op.index());
                if (credit == null) {
                    throw new CorruptDataException("Account index entry for missing credit " + op);
                }
                out.add(credit);
            }
            return out;
        }
        List<KeyValue> entries = range(scan(layout.min('c'), layout.max('c')));
        List<Credit> out = new ArrayList<>(entries.size());
        for (KeyValue kv : entries) {
            Outpoint op = Layout.tailOutpoint(kv.key());
            out.add(Credit.fromRaw(kv.value(), op.hash(), op.index()));
        }
        return out;
    }

    /** Unspent coins (credits not spent in the mempool). */
    public List<Coin> getCoins(Integer account) {
        List<Coin> out = new ArrayList<>();
        for (Credit credit : getCredits(account)) {
            if (!credit.spent()) out.add(credit.coin());
        }
        return out;
    }

    /**
     * Undo credits for the inputs of {@code tx}, indexed by input; null where
     * the input did not spend one of our credits.
     */
    public List<Credit> getSpentCredits(Transaction tx) {
        List<Credit> out = new ArrayList<>(Collections.nCopies(tx.inputs().size(), (Credit) null));
        if (tx.isCoinbase()) return out;
        Hash hash = tx.hash();
        for (KeyValue kv : range(scan(layout.min('d', hash), layout.max('d', hash)))) {
            int index = Layout.tailOutpoint(kv.key()).index();
            if (index < 0 || index >= out.size()) {
                throw new CorruptDataException("Undo coin for missing input " + index + " of " + hash.hex());
            }
            Outpoint prevout = tx.input(index).prevout();
            out.set(index, UndoCoin.fromRaw(kv.value(), prevout.hash(), prevout.index()).toCredit());
        }
        return out;
    }

    public List<Coin> getSpentCoins(Transaction tx) {
        List<Coin> out = new ArrayList<>();
        for (Credit credit : getSpentCredits(tx)) {
            out.add(credit == null ? null : credit.coin());
        }
        return out;
    }

    /** @return the record, or null if unknown */
    public TXRecord getTX(Hash hash) {
        return get(layout.t(hash)).map(TXRecord::fromRaw).orElse(null);
    }

    public boolean hasTX(Hash hash) {
        return has(layout.t(hash));
    }

    /** @return details, or null if unknown */
    public Details getDetails(Hash hash) {
        TXRecord wtx = getTX(hash);
        return wtx == null ? null : toDetails(wtx);
    }

    public Details toDetails(TXRecord wtx) {
        Transaction tx = wtx.tx();
        Details details = new Details(wid, id, wtx, chainHeight.getAsInt());
        List<Coin> coins = getSpentCoins(tx);
        for (int i = 0; i < tx.inputs().size(); i++) {
            Coin coin = coins.get(i);
            if (coin == null) continue;
            details.setInput(i, getPath(coin.address()), coin);
        }
        for (int i = 0; i < tx.outputs().size(); i++) {
            Path path = getPath(tx.output(i).address());
            if (path == null) continue;
            details.setOutput(i, path);
        }
        return details;
    }

    /** @return the coin, or null if not an (unspent or mempool-spent) credit of ours */
    public Coin getCoin(Hash hash, int index) {
        Credit credit = getCredit(hash, index);
        return credit == null ? null : credit.coin();
    }

    /** @return the credit, or null if unknown */
    public Credit getCredit(Hash hash, int index) {
        Outpoint op = new Outpoint(hash, index);
        byte[] key = layout.c(hash, index);
        TxdbBatch b = staged();

        if (b != null && b.writes.touches(key)) {
            return b.writes.get(key).map(raw -> Credit.fromRaw(raw, hash, index)).orElse(null);
        }

        Credit cached = coinCache.get(op);
        if (cached != null) return cached;

        long epoch = coinCache.epoch();
        Optional<byte[]> raw = store.get(key);
        if (raw.isEmpty()) return null;
        Credit credit = Credit.fromRaw(raw.get(), hash, index);
        coinCache.set(op, credit, epoch);
        return credit;
    }

    public boolean hasCoin(Hash hash, int index) {
        TxdbBatch b = staged();
        if (b == null && coinCache.has(new Outpoint(hash, index))) return true;
        return has(layout.c(hash, index));
    }

    /**
     * @param spent   the spending input (spender hash and input index)
     * @param prevout the outpoint the undo coin restores
     */
    public UndoCoin getSpentCoin(Outpoint spent, Outpoint prevout) {
        return get(layout.d(spent.hash(), spent.index()))
                .map(raw -> UndoCoin.fromRaw(raw, prevout.hash(), prevout.index()))
                .orElse(null);
    }

    public boolean hasSpentCoin(Outpoint spent) {
        return has(layout.d(spent.hash(), spent.index()));
    }

    /** @return the spending input of the outpoint, or null if unspent */
    public Outpoint getSpent(Hash hash, int index) {
        return get(layout.s(hash, index)).map(Outpoint::fromRaw).orElse(null);
    }

    public boolean isSpent(Hash hash, int index) {
        return has(layout.s(hash, index));
    }

    /** Heights that hold at least one of our confirmed transactions, ascending. */
    public List<Integer> getBlocks() {
        List<KeyValue> entries = range(scan(layout.min('b'), layout.max('b')));
        List<Integer> out = new ArrayList<>(entries.size());
        for (KeyValue kv : entries) out.add(Layout.intAt(kv.key(), 0));
        return out;
    }

    /** @return the block record at that height, or null */
    public BlockRecord getBlock(int height) {
        return get(layout.b(height)).map(BlockRecord::fromRaw).orElse(null);
    }

    // ================================================================ balance

    /** @param account account, or null for the whole wallet (served from state) */
    public Balance getBalance(Integer account) {
        if (account != null) {
            return getAccountBalance(account);
        }
        return state.toBalance();
    }

    /** Wallet balance recomputed from every credit. */
    public Balance getWalletBalance() {
        return sum(-1, getCredits(null));
    }

    public Balance getAccountBalance(int account) {
        return sum(account, getCredits(account));
    }

    private Balance sum(int account, List<Credit> credits) {
        long confirmed = 0;
        long unconfirmed = 0;
        for (Credit credit : credits) {
            if (credit.coin().confirmed()) confirmed += credit.value();
            if (!credit.spent()) unconfirmed += credit.value();
        }
        return new Balance(wid, id, account, unconfirmed, confirmed);
    }
}
