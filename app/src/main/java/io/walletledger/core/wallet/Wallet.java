package io.walletledger.core.wallet;

import io.walletledger.core.metrics.LedgerMetrics;
import io.walletledger.core.protocol.BlockMeta;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.storage.KeyValueStore;
import io.walletledger.core.txdb.Balance;
import io.walletledger.core.txdb.Coin;
import io.walletledger.core.txdb.Details;
import io.walletledger.core.txdb.TXDB;
import io.walletledger.core.txdb.TXRecord;
import io.walletledger.core.txdb.WalletEvent;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One wallet: its address book, its transaction database and a write lock
 * serializing every mutation. Reads go straight to the ledger.
 */
public final class Wallet {
    private static final Logger LOG = Logger.getLogger(Wallet.class.getName());

    private final int wid;
    private final String id;
    private final AddressBook addresses;
    private final TXDB txdb;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<WalletListener> listeners = new CopyOnWriteArrayList<>();
    private final List<WalletListener> hostListeners;

    public Wallet(KeyValueStore store, int wid, String id, WalletConfig config) {
        this(store, wid, id, config, InputVerifier.ACCEPT_ALL, LedgerMetrics.shared(), () -> -1,
                Collections.emptyList());
    }

    /**
     * @param hostListeners listeners of the hosting database, notified after this wallet's own
     */
    public Wallet(KeyValueStore store,
                  int wid,
                  String id,
                  WalletConfig config,
                  InputVerifier verifier,
                  LedgerMetrics metrics,
                  IntSupplier chainHeight,
                  List<WalletListener> hostListeners) {
        this.wid = wid;
        this.id = id;
        this.addresses = new AddressBook(store, wid);
        this.hostListeners = hostListeners;
        this.txdb = TXDB.builder(store, wid)
                .id(id)
                .paths(addresses)
                .cacheSize(config.coinCacheSize)
                .verify(config.verify)
                .verifier(verifier)
                .metrics(metrics)
                .chainHeight(chainHeight)
                .onEvent(this::dispatch)
                .build();
    }

    /** Loads addresses and ledger state. */
    public void open() {
        try (Guard ignored = lock()) {
            addresses.load();
            txdb.open();
        }
    }

    public int wid() { return wid; }
    public String id() { return id; }
    public TXDB txdb() { return txdb; }
    public AddressBook addresses() { return addresses; }

    public void addListener(WalletListener l) { listeners.add(l); }
    public void removeListener(WalletListener l) { listeners.remove(l); }

    // ------------------------------------------------------------ writes

    /** Registers an address at the given path. */
    public Path importAddress(int account, int branch, int index, String address) {
        try (Guard ignored = lock()) {
            Path path = new Path(wid, account, branch, index, address);
            addresses.add(path);
            LOG.fine(() -> "Imported " + address + " into " + id + " at account " + account);
            return path;
        }
    }

    /** Mempool transaction. */
    public Details add(Transaction tx) {
        return add(tx, null);
    }

    public Details add(Transaction tx, BlockMeta block) {
        try (Guard ignored = lock()) {
            return txdb.add(tx, block);
        }
    }

    public Details confirm(Hash hash, BlockMeta block) {
        try (Guard ignored = lock()) {
            return txdb.confirm(hash, block);
        }
    }

    public Details unconfirm(Hash hash) {
        try (Guard ignored = lock()) {
            return txdb.unconfirm(hash);
        }
    }

    public Details remove(Hash hash) {
        try (Guard ignored = lock()) {
            return txdb.remove(hash);
        }
    }

    public List<Hash> zap(Integer account, long age) {
        try (Guard ignored = lock()) {
            return txdb.zap(account, age);
        }
    }

    public Details abandon(Hash hash) {
        try (Guard ignored = lock()) {
            return txdb.abandon(hash);
        }
    }

    // ------------------------------------------------------------ reads

    public Balance getBalance() { return txdb.getBalance(null); }
    public Balance getBalance(Integer account) { return txdb.getBalance(account); }
    public List<TXRecord> getHistory(Integer account) { return txdb.getHistory(account); }
    public List<TXRecord> getPending(Integer account) { return txdb.getPending(account); }
    public List<Coin> getCoins(Integer account) { return txdb.getCoins(account); }
    public TXRecord getTX(Hash hash) { return txdb.getTX(hash); }
    public Details getDetails(Hash hash) { return txdb.getDetails(hash); }

    // ------------------------------------------------------------ events

    private void dispatch(WalletEvent event) {
        deliver(listeners, event);
        deliver(hostListeners, event);
    }

    private void deliver(List<WalletListener> targets, WalletEvent event) {
        for (WalletListener l : targets) {
            try {
                switch (event.type()) {
                    case TX:
                        l.onTX(this, event.record(), event.details());
                        break;
                    case CONFIRMED:
                        l.onConfirmed(this, event.record(), event.details());
                        break;
                    case UNCONFIRMED:
                        l.onUnconfirmed(this, event.record(), event.details());
                        break;
                    case CONFLICT:
                        l.onConflict(this, event.record(), event.details());
                        break;
                    case REMOVE_TX:
                        l.onRemoveTX(this, event.record(), event.details());
                        break;
                    case BALANCE:
                        l.onBalance(this, event.balance());
                        break;
                    default:
                        throw new IllegalStateException("Unknown event " + event.type());
                }
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Wallet listener failed on " + event.type() + " for " + id, e);
            }
        }
    }

    private Guard lock() {
        writeLock.lock();
        return writeLock::unlock;
    }

    /** Scoped hold of the write lock. */
    @FunctionalInterface
    private interface Guard extends AutoCloseable {
        @Override
        void close();
    }

    @Override
    public String toString() {
        return "Wallet{" + id + " (wid=" + wid + ")}";
    }
}
