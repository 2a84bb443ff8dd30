package io.walletledger.core.txdb;

import io.walletledger.core.storage.StagedBatch;

import java.util.ArrayList;
import java.util.List;

/**
 * One ledger write batch: staged key-value writes, the pending state and the
 * events to deliver once the writes are durable.
 *
 * <pre>
 * try (TxdbBatch batch = txdb.start()) {
 *     ...
 *     batch.commit();
 * }
 * </pre>
 * Closing without a commit drops the batch.
 */
public final class TxdbBatch implements AutoCloseable {
    private final TXDB owner;
    final StagedBatch writes;
    final List<WalletEvent> events = new ArrayList<>();
    private final Thread thread = Thread.currentThread();
    TXDBState pending;
    private boolean done;

    TxdbBatch(TXDB owner, StagedBatch writes, TXDBState pending) {
        this.owner = owner;
        this.writes = writes;
        this.pending = pending;
    }

    public void commit() {
        if (done) throw new IllegalStateException("Batch already finished");
        owner.commit(this);
    }

    /** Staged writes are only visible to the thread that opened the batch. */
    boolean isOwnedByCurrentThread() {
        return thread == Thread.currentThread();
    }

    public boolean isDone() {
        return done;
    }

    void finish() {
        done = true;
    }

    @Override
    public void close() {
        if (!done) {
            owner.drop(this);
        }
    }
}
