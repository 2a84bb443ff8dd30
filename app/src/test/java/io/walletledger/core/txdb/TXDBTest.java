package io.walletledger.core.txdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.walletledger.core.metrics.LedgerMetrics;
import io.walletledger.core.protocol.BlockMeta;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Input;
import io.walletledger.core.protocol.Outpoint;
import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.storage.InMemoryKeyValueStore;
import io.walletledger.core.storage.KeyValue;
import io.walletledger.core.storage.KeyValueBatch;
import io.walletledger.core.storage.RangeOptions;
import io.walletledger.core.storage.StorageException;
import io.walletledger.core.wallet.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TXDBTest {
    private static final int WID = 1;

    private static final Map<String, Path> PATHS = Map.of(
            "addr-a", new Path(WID, 0, 0, 0, "addr-a"),
            "addr-b", new Path(WID, 1, 0, 0, "addr-b"),
            "change", new Path(WID, 0, 1, 0, "change"));

    private final List<WalletEvent> events = new ArrayList<>();
    private final long[] now = {1_000};
    private final int[] tip = {20};

    private FailingStore store;
    private LedgerMetrics metrics;
    private TXDB txdb;

    @BeforeEach
    void setUp() {
        store = new FailingStore();
        store.open();
        metrics = new LedgerMetrics(new SimpleMeterRegistry());
        txdb = newTXDB(TXDB.builder(store, WID));
    }

    private TXDB newTXDB(TXDB.Builder builder) {
        TXDB db = builder
                .id("primary")
                .paths(TXDBTest::path)
                .metrics(metrics)
                .chainHeight(() -> tip[0])
                .clock(() -> now[0])
                .onEvent(events::add)
                .build();
        db.open();
        return db;
    }

    // ------------------------------------------------------------ receive / spend

    @Test
    void receiveInMempoolCreditsUnconfirmedBalance() {
        Transaction tx = Transaction.builder()
                .input(h("ext-0"), 0)
                .output(5000, "addr-a")
                .output(300, "stranger")
                .build();

        Details details = txdb.add(tx, null);

        assertNotNull(details);
        assertEquals(List.of(0), details.accounts());
        assertTrue(details.outputs().get(0).isOwn());
        assertFalse(details.outputs().get(1).isOwn());
        assertEquals(0, details.fee());
        assertEquals(0, details.depth());
        assertState(1, 1, 5000, 0);
        assertEquals(List.of(WalletEvent.Type.TX, WalletEvent.Type.BALANCE), types());
        assertEquals(5000, events.get(1).balance().unconfirmed());

        assertEquals(List.of(tx.hash()), txdb.getPendingHashes(null));
        List<Coin> coins = txdb.getCoins(null);
        assertEquals(1, coins.size());
        assertEquals(5000, coins.get(0).value());
        assertFalse(coins.get(0).confirmed());
        assertTrue(txdb.isSpent(h("ext-0"), 0));

        // seen again in the mempool: nothing changes
        assertNull(txdb.add(tx, null));
        assertState(1, 1, 5000, 0);
        assertWalletBalanceMatchesState();
    }

    @Test
    void irrelevantTransactionLeavesNoTrace() {
        int before = store.size();
        Transaction tx = Transaction.builder().input(h("ext-0"), 0).output(10, "stranger").build();

        assertNull(txdb.add(tx, null));
        assertFalse(txdb.hasTX(tx.hash()));
        assertFalse(txdb.isSpent(h("ext-0"), 0));
        assertEquals(before, store.size());
        assertTrue(events.isEmpty());
    }

    @Test
    void mempoolSpendKeepsConfirmedBalanceUntilItConfirms() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, null);
        Details confirmed = txdb.confirm(funding.hash(), block(10));
        assertNotNull(confirmed);
        assertEquals(11, confirmed.depth());
        assertState(1, 1, 5000, 5000);

        Transaction spend = spend(funding, 0, 1000, 3900);
        Details details = txdb.add(spend, null);

        assertEquals(100, details.fee());
        assertEquals(100 * 1000 / spend.size(), details.rate());
        assertState(2, 1, 3900, 5000);
        assertTrue(txdb.getCredit(funding.hash(), 0).spent());
        assertWalletBalanceMatchesState();

        txdb.confirm(spend.hash(), block(11));

        assertState(2, 1, 3900, 3900);
        assertNull(txdb.getCredit(funding.hash(), 0));
        assertWalletBalanceMatchesState();

        assertThrows(IllegalStateException.class, () -> txdb.confirm(spend.hash(), block(11)));
        assertNull(txdb.confirm(h("unknown"), block(11)));
    }

    @Test
    void spendArrivingInBlockRemovesCreditAndKeepsUndoCoin() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(10));
        assertState(1, 1, 5000, 5000);

        Transaction spend = spend(funding, 0, 1000, 3900);
        txdb.add(spend, block(11));

        assertState(2, 1, 3900, 3900);
        assertNull(txdb.getCoin(funding.hash(), 0));
        Outpoint spender = txdb.getSpent(funding.hash(), 0);
        assertEquals(new Outpoint(spend.hash(), 0), spender);

        UndoCoin undo = txdb.getSpentCoin(spender, new Outpoint(funding.hash(), 0));
        assertEquals(5000, undo.coin().value());
        assertEquals(10, undo.coin().height());
        assertEquals(Arrays.asList(undo.coin()), txdb.getSpentCoins(spend));
        assertWalletBalanceMatchesState();
    }

    @Test
    void confirmingThroughAddPromotesPendingRecord() {
        Transaction tx = receive("ext-0", 700, "addr-b");
        txdb.add(tx, null);
        events.clear();

        Details details = txdb.add(tx, block(12));

        assertEquals(12, details.height());
        assertEquals(List.of(WalletEvent.Type.CONFIRMED, WalletEvent.Type.BALANCE), types());
        assertTrue(txdb.getPendingHashes(null).isEmpty());
        assertEquals(List.of(tx.hash()), txdb.getHeightHashes(12));
        assertEquals(12, txdb.getCoin(tx.hash(), 0).height());
        assertState(1, 1, 700, 700);

        // a confirmed record is never re-added
        assertNull(txdb.add(tx, block(13)));
    }

    // ------------------------------------------------------------ reorg

    @Test
    void confirmThenUnconfirmRestoresEveryKey() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(10));
        Transaction spend = spend(funding, 0, 1000, 3900);
        txdb.add(spend, null);

        Map<String, String> before = snapshot();
        TXDBState stateBefore = txdb.getState();

        txdb.confirm(spend.hash(), block(11));
        assertNotEquals(before, snapshot());

        events.clear();
        Details details = txdb.unconfirm(spend.hash());

        assertNotNull(details);
        assertEquals(-1, details.height());
        assertEquals(List.of(WalletEvent.Type.UNCONFIRMED, WalletEvent.Type.BALANCE), types());
        assertEquals(before, snapshot());
        assertEquals(stateBefore.toBalance(), txdb.getState().toBalance());
        assertNull(txdb.getBlock(11));

        // already pending
        assertNull(txdb.unconfirm(spend.hash()));
    }

    @Test
    void unconfirmingAReceiveMovesItBackToPending() {
        Transaction tx = receive("ext-0", 800, "addr-a");
        txdb.add(tx, block(5));

        txdb.unconfirm(tx.hash());

        assertState(1, 1, 800, 0);
        assertEquals(List.of(tx.hash()), txdb.getPendingHashes(0));
        assertTrue(txdb.getBlocks().isEmpty());
        assertFalse(txdb.getCoin(tx.hash(), 0).confirmed());
    }

    // ------------------------------------------------------------ conflicts

    @Test
    void newerMempoolDoubleSpendEvictsOlderOne() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(10));
        Transaction first = Transaction.builder()
                .input(funding.hash(), 0)
                .output(4900, "stranger")
                .build();
        Transaction second = Transaction.builder()
                .input(funding.hash(), 0)
                .output(4800, "change")
                .build();

        txdb.add(first, null);
        assertState(2, 0, 0, 5000);
        assertTrue(txdb.isDoubleSpend(second));

        events.clear();
        Details details = txdb.add(second, null);

        assertNotNull(details);
        assertEquals(List.of(
                WalletEvent.Type.REMOVE_TX,
                WalletEvent.Type.BALANCE,
                WalletEvent.Type.CONFLICT,
                WalletEvent.Type.TX,
                WalletEvent.Type.BALANCE), types());
        assertEquals(first.hash(), events.get(2).record().hash());
        assertFalse(txdb.hasTX(first.hash()));
        assertEquals(new Outpoint(second.hash(), 0), txdb.getSpent(funding.hash(), 0));
        assertState(2, 1, 4800, 5000);
        assertEquals(1.0, metrics.conflictCount());
        assertEquals(1.0, metrics.removalCount());
        assertWalletBalanceMatchesState();
    }

    @Test
    void confirmedSpenderWinsAgainstMempoolDoubleSpend() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(10));
        Transaction spend = spend(funding, 0, 1000, 3900);
        txdb.add(spend, block(11));
        TXDBState before = txdb.getState();

        Transaction late = Transaction.builder()
                .input(funding.hash(), 0)
                .output(4000, "addr-b")
                .build();

        assertNull(txdb.add(late, null));
        assertFalse(txdb.hasTX(late.hash()));
        assertEquals(before.toBalance(), txdb.getState().toBalance());
        assertEquals(0.0, metrics.conflictCount());
    }

    @Test
    void blockDoubleSpendEvictsPendingReceiveEvenWhenItselfIrrelevant() {
        Transaction ours = receive("ext-x", 2000, "addr-a");
        txdb.add(ours, null);
        assertState(1, 1, 2000, 0);

        Transaction theirs = Transaction.builder()
                .input(h("ext-x"), 0)
                .output(2000, "stranger")
                .build();
        events.clear();

        assertNull(txdb.add(theirs, block(12)));

        assertFalse(txdb.hasTX(ours.hash()));
        assertFalse(txdb.hasTX(theirs.hash()));
        assertFalse(txdb.isSpent(h("ext-x"), 0));
        assertState(0, 0, 0, 0);
        assertEquals(List.of(
                WalletEvent.Type.REMOVE_TX,
                WalletEvent.Type.BALANCE,
                WalletEvent.Type.CONFLICT), types());
    }

    @Test
    void removeTakesDescendantsDeepestFirst() {
        Transaction a = receive("ext-a", 5000, "addr-a");
        Transaction b = Transaction.builder().input(a.hash(), 0).output(4900, "addr-a").build();
        Transaction c = Transaction.builder().input(b.hash(), 0).output(4800, "addr-b").build();
        txdb.add(a, null);
        txdb.add(b, null);
        txdb.add(c, null);
        assertState(3, 1, 4800, 0);

        events.clear();
        Details removed = txdb.remove(b.hash());

        assertEquals(b.hash(), removed.hash());
        assertEquals(List.of(c.hash(), b.hash()), removedHashes());
        assertState(1, 1, 5000, 0);
        assertFalse(txdb.getCredit(a.hash(), 0).spent());
        assertNull(txdb.getSpent(a.hash(), 0));
        assertWalletBalanceMatchesState();

        txdb.remove(a.hash());
        assertState(0, 0, 0, 0);
        // only the wallet state record is left
        assertEquals(1, store.size());
        assertNull(txdb.remove(a.hash()));
    }

    @Test
    void removingRootEmitsChildrenBeforeParent() {
        Transaction a = receive("ext-a", 5000, "addr-a");
        Transaction b = Transaction.builder().input(a.hash(), 0).output(4900, "addr-a").build();
        Transaction c = Transaction.builder().input(b.hash(), 0).output(4800, "addr-b").build();
        txdb.add(a, null);
        txdb.add(b, null);
        txdb.add(c, null);
        events.clear();

        txdb.remove(a.hash());

        assertEquals(List.of(c.hash(), b.hash(), a.hash()), removedHashes());
        assertEquals(3.0, metrics.removalCount());
        assertState(0, 0, 0, 0);
    }

    // ------------------------------------------------------------ atomicity

    @Test
    void failedCommitLeavesStoreAndStateUntouched() {
        Transaction first = receive("ext-0", 5000, "addr-a");
        txdb.add(first, null);
        TXDBState before = txdb.getState();
        Map<String, String> keys = snapshot();
        int eventsBefore = events.size();

        store.failing = true;
        Transaction second = receive("ext-1", 700, "addr-b");
        StorageException e = assertThrows(StorageException.class, () -> txdb.add(second, null));

        assertEquals("persist-failure", e.getMessage());
        assertEquals(before.toBalance(), txdb.getState().toBalance());
        assertEquals(before.tx(), txdb.getState().tx());
        assertEquals(keys, snapshot());
        assertFalse(txdb.hasTX(second.hash()));
        assertNull(txdb.getCoin(second.hash(), 0));
        assertEquals(eventsBefore, events.size());
        assertEquals(1.0, metrics.dropCount());

        store.failing = false;
        assertNotNull(txdb.add(second, null));
        assertState(2, 2, 5700, 0);
    }

    @Test
    void readFailureInsideConfirmLeavesEverythingUntouched() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(10));
        Transaction spend = spend(funding, 0, 1000, 3900);
        txdb.add(spend, null);
        TXDBState before = txdb.getState();
        Map<String, String> keys = snapshot();
        int eventsBefore = events.size();

        // the block record is read after the credits are staged
        store.failOnGet = new Layout(WID).b(11);
        StorageException e = assertThrows(StorageException.class, () -> txdb.confirm(spend.hash(), block(11)));

        assertEquals("read-failure", e.getMessage());
        assertUnchanged(before, keys, eventsBefore);
        assertFalse(txdb.getTX(spend.hash()).confirmed());
        assertNull(txdb.getBlock(11));

        store.failOnGet = null;
        assertNotNull(txdb.confirm(spend.hash(), block(11)));
        assertState(2, 1, 3900, 3900);
    }

    @Test
    void failedCommitInsideConfirmAndUnconfirmLeavesEverythingUntouched() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(10));
        Transaction spend = spend(funding, 0, 1000, 3900);
        txdb.add(spend, null);

        TXDBState pending = txdb.getState();
        Map<String, String> pendingKeys = snapshot();
        store.failing = true;
        assertThrows(StorageException.class, () -> txdb.confirm(spend.hash(), block(11)));
        assertUnchanged(pending, pendingKeys, events.size());
        store.failing = false;

        txdb.confirm(spend.hash(), block(11));
        TXDBState confirmed = txdb.getState();
        Map<String, String> confirmedKeys = snapshot();
        int eventsBefore = events.size();

        store.failing = true;
        assertThrows(StorageException.class, () -> txdb.unconfirm(spend.hash()));
        assertUnchanged(confirmed, confirmedKeys, eventsBefore);
        store.failing = false;

        store.failOnGet = new Layout(WID).b(11);
        assertThrows(StorageException.class, () -> txdb.unconfirm(spend.hash()));
        assertUnchanged(confirmed, confirmedKeys, eventsBefore);
        assertTrue(txdb.getTX(spend.hash()).confirmed());
        store.failOnGet = null;

        assertNotNull(txdb.unconfirm(spend.hash()));
        assertEquals(pendingKeys, snapshot());
        assertEquals(3.0, metrics.dropCount());
    }

    @Test
    void readersOnOtherThreadsNeverSeeAnOpenBatch() throws Exception {
        Transaction tx = receive("ext-0", 5000, "addr-a");
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.beforeWrite = () -> {
            writing.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new StorageException("persist-failure");
        };

        ExecutorService writer = Executors.newSingleThreadExecutor();
        try {
            Future<Details> result = writer.submit(() -> txdb.add(tx, null));
            assertTrue(writing.await(5, TimeUnit.SECONDS));

            assertFalse(txdb.hasTX(tx.hash()));
            assertNull(txdb.getTX(tx.hash()));
            assertTrue(txdb.getCoins(null).isEmpty());
            assertNull(txdb.getCredit(tx.hash(), 0));
            assertFalse(txdb.isSpent(h("ext-0"), 0));
            assertEquals(0, txdb.getState().tx());

            release.countDown();
            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageException.class, e.getCause());
        } finally {
            writer.shutdownNow();
        }

        store.beforeWrite = null;
        assertFalse(txdb.hasTX(tx.hash()));
        assertTrue(events.isEmpty());
        assertNotNull(txdb.add(tx, null));
        assertEquals(1, txdb.getCoins(null).size());
    }

    @Test
    void onlyOneBatchAtATime() {
        try (TxdbBatch batch = txdb.start()) {
            assertThrows(IllegalStateException.class, txdb::start);
            assertFalse(batch.isDone());
        }
        assertEquals(1.0, metrics.dropCount());
        assertThrows(IllegalStateException.class, txdb::clear);
    }

    @Test
    void failingListenerDoesNotUndoCommit() {
        TXDB noisy = TXDB.builder(store, 2)
                .paths(TXDBTest::path)
                .metrics(metrics)
                .onEvent(e -> {
                    throw new IllegalStateException("listener boom");
                })
                .build();
        noisy.open();
        Transaction tx = receive("ext-0", 100, "addr-a");

        assertNotNull(noisy.add(tx, null));
        assertTrue(noisy.hasTX(tx.hash()));
    }

    // ------------------------------------------------------------ orphans, RBF, verification

    @Test
    void childSeenBeforeParentResolvesSpentCredit() {
        Transaction parent = receive("ext-p", 5000, "addr-a");
        Transaction child = spend(parent, 0, 4000, 900);

        Details orphan = txdb.add(child, null);
        assertEquals(0, orphan.fee());
        assertState(1, 1, 900, 0);

        txdb.add(parent, null);

        assertState(2, 1, 900, 0);
        Credit credit = txdb.getCredit(parent.hash(), 0);
        assertTrue(credit.spent());
        assertNotNull(txdb.getSpentCoin(new Outpoint(child.hash(), 0), new Outpoint(parent.hash(), 0)));
        assertEquals(100, txdb.getDetails(child.hash()).fee());
        assertWalletBalanceMatchesState();

        txdb.add(parent, block(10));

        assertState(2, 1, 900, 5000);
        UndoCoin undo = txdb.getSpentCoin(new Outpoint(child.hash(), 0), new Outpoint(parent.hash(), 0));
        assertEquals(10, undo.coin().height());
        assertWalletBalanceMatchesState();
    }

    @Test
    void replaceableTransactionsAreOnlyIndexedUntilConfirmed() {
        Transaction rbf = Transaction.builder()
                .input(new Input(new Outpoint(h("ext-r"), 0), 0, null))
                .output(1000, "addr-a")
                .build();
        Transaction child = Transaction.builder().input(rbf.hash(), 0).output(900, "addr-b").build();
        assertTrue(rbf.isRBF());
        assertFalse(child.isRBF());

        assertNull(txdb.add(rbf, null));
        assertFalse(txdb.hasTX(rbf.hash()));
        assertTrue(txdb.isRBF(child));
        assertNull(txdb.add(child, null));
        assertState(0, 0, 0, 0);

        assertNotNull(txdb.add(rbf, block(10)));
        assertFalse(txdb.isRBF(child));
        assertNotNull(txdb.add(child, null));
        assertState(2, 1, 900, 1000);
    }

    @Test
    void rejectedInputVerificationDropsMempoolSpend() {
        int[] calls = {0};
        TXDB verifying = newTXDB(TXDB.builder(store, 3).verify(true).verifier((tx, index, coin) -> {
            calls[0]++;
            return false;
        }));
        Transaction funding = receive("ext-0", 5000, "addr-a");
        verifying.add(funding, null);
        assertEquals(0, calls[0]);

        Transaction spend = spend(funding, 0, 1000, 3900);
        assertNull(verifying.add(spend, null));
        assertEquals(1, calls[0]);
        assertFalse(verifying.hasTX(spend.hash()));
        assertFalse(verifying.getCredit(funding.hash(), 0).spent());

        // blocks are not verified
        assertNotNull(verifying.add(spend, block(10)));
        assertEquals(1, calls[0]);
    }

    // ------------------------------------------------------------ zap / abandon

    @Test
    void zapRemovesOnlyStalePendingTransactions() {
        now[0] = 1_000;
        Transaction stale = receive("ext-0", 100, "addr-a");
        txdb.add(stale, null);
        Transaction mined = receive("ext-1", 200, "addr-a");
        txdb.add(mined, block(3));

        now[0] = 5_000;
        Transaction fresh = receive("ext-2", 300, "addr-b");
        txdb.add(fresh, null);

        List<Hash> zapped = txdb.zap(null, 3_600);

        assertEquals(List.of(stale.hash()), zapped);
        assertTrue(txdb.hasTX(mined.hash()));
        assertTrue(txdb.hasTX(fresh.hash()));
        assertState(2, 2, 500, 200);
        assertTrue(txdb.zap(1, 3_600).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> txdb.zap(null, -1));
    }

    @Test
    void abandonOnlyAppliesToPendingTransactions() {
        Transaction pending = receive("ext-0", 100, "addr-a");
        Transaction mined = receive("ext-1", 200, "addr-a");
        txdb.add(pending, null);
        txdb.add(mined, block(3));

        assertNotNull(txdb.abandon(pending.hash()));
        assertFalse(txdb.hasTX(pending.hash()));

        assertThrows(IllegalStateException.class, () -> txdb.abandon(mined.hash()));
        assertThrows(IllegalStateException.class, () -> txdb.abandon(h("unknown")));
        assertState(1, 1, 200, 200);
    }

    // ------------------------------------------------------------ queries

    @Test
    void queriesFilterByAccountTimeAndHeight() {
        now[0] = 100;
        Transaction tx1 = receive("ext-1", 1000, "addr-a");
        txdb.add(tx1, block(10));
        now[0] = 200;
        Transaction tx2 = receive("ext-2", 2000, "addr-b");
        txdb.add(tx2, null);
        now[0] = 300;
        Transaction tx3 = Transaction.builder()
                .input(h("ext-3"), 0)
                .output(3000, "addr-a")
                .output(4000, "addr-b")
                .build();
        Details d3 = txdb.add(tx3, block(12));

        assertEquals(List.of(0, 1), d3.accounts());
        assertEquals(List.of(tx3.hash(), tx2.hash()), hashesOf(txdb.getLast(null, 2)));
        assertEquals(List.of(tx2.hash(), tx3.hash()), hashesOf(txdb.getRange(null, RangeQuery.between(150, 300))));
        assertEquals(List.of(tx3.hash()), hashesOf(txdb.getLast(0, 1)));

        assertEquals(Set.of(tx2.hash(), tx3.hash()), new HashSet<>(txdb.getHistoryHashes(1)));
        assertEquals(3, txdb.getHistory(null).size());
        assertEquals(List.of(tx2.hash()), txdb.getPendingHashes(null));
        assertTrue(txdb.getPendingHashes(0).isEmpty());
        assertEquals(List.of(tx2.hash()), hashesOf(txdb.getPending(1)));

        assertEquals(List.of(tx1.hash()), txdb.getHeightHashes(10));
        assertEquals(List.of(tx1.hash(), tx3.hash()),
                txdb.getHeightRangeHashes(null, RangeQuery.between(10, 12)));
        assertEquals(List.of(tx3.hash()),
                txdb.getHeightRangeHashes(null, RangeQuery.between(10, 12).withLimit(1).reversed()));
        assertEquals(List.of(tx3.hash()), txdb.getHeightRangeHashes(1, RangeQuery.between(0, 20)));

        assertEquals(List.of(10, 12), txdb.getBlocks());
        assertEquals(List.of(tx3.hash()), txdb.getBlock(12).hashes());
        assertNull(txdb.getBlock(11));

        assertEquals(2, txdb.getOutpoints(1).size());
        assertEquals(new Balance(WID, "primary", 1, 6000, 4000), txdb.getAccountBalance(1));
        assertEquals(new Balance(WID, "primary", 0, 4000, 4000), txdb.getBalance(0));
        assertEquals(new Balance(WID, "primary", -1, 10000, 8000), txdb.getBalance(null));
        assertWalletBalanceMatchesState();

        assertEquals(tx2.hash(), txdb.getTX(tx2.hash()).hash());
        assertNull(txdb.getTX(h("unknown")));
        assertNull(txdb.getDetails(h("unknown")));
    }

    @Test
    void detailsAndBalanceProjectToJson() {
        ObjectMapper mapper = new ObjectMapper();
        Transaction funding = receive("ext-0", 5000, "addr-a");
        txdb.add(funding, block(18));
        Transaction spend = spend(funding, 0, 1000, 3900);
        txdb.add(spend, null);

        ObjectNode json = txdb.getDetails(spend.hash()).toJSON(mapper);

        assertEquals(spend.txid(), json.get("hash").asText());
        assertTrue(json.get("block").isNull());
        assertEquals(-1, json.get("height").asInt());
        assertEquals(100, json.get("fee").asLong());
        assertEquals(0, json.get("confirmations").asInt());
        assertEquals(1, json.get("accounts").size());
        assertEquals(5000, json.get("inputs").get(0).get("value").asLong());
        assertTrue(json.get("outputs").get(0).get("path").isNull());
        assertTrue(json.get("outputs").get(1).get("path").get("change").asBoolean());

        ObjectNode funded = txdb.getDetails(funding.hash()).toJSON(mapper);
        assertEquals(3, funded.get("confirmations").asInt());

        ObjectNode balance = txdb.getBalance(null).toJSON(mapper);
        assertTrue(balance.get("account").isNull());
        assertEquals(3900, balance.get("unconfirmed").asLong());
        assertEquals(5000, balance.get("confirmed").asLong());
        assertEquals(0, txdb.getAccountBalance(0).toJSON(mapper).get("account").asInt());
    }

    @Test
    void lockedCoinsAreFilteredUntilSpent() {
        Transaction funding = receive("ext-0", 5000, "addr-a");
        Transaction other = receive("ext-1", 100, "addr-a");
        txdb.add(funding, null);
        txdb.add(other, null);
        Transaction spend = spend(funding, 0, 1000, 3900);

        txdb.lockTX(spend);

        Outpoint op = new Outpoint(funding.hash(), 0);
        assertTrue(txdb.isLocked(op));
        assertEquals(List.of(op), txdb.getLocked());
        List<Coin> available = txdb.filterLocked(txdb.getCoins(null));
        assertEquals(1, available.size());
        assertEquals(other.hash(), available.get(0).hash());

        txdb.add(spend, null);
        assertFalse(txdb.isLocked(op));

        txdb.lockCoin(op);
        txdb.unlockCoin(op);
        assertTrue(txdb.getLocked().isEmpty());
    }

    @Test
    void stateSurvivesReopen() {
        txdb.add(receive("ext-0", 5000, "addr-a"), block(4));
        txdb.add(receive("ext-1", 250, "addr-b"), null);

        TXDB reopened = newTXDB(TXDB.builder(store, WID));

        assertEquals(txdb.getState().toBalance(), reopened.getState().toBalance());
        assertEquals(2, reopened.getState().tx());
        assertEquals(2, reopened.getState().coin());
        assertEquals(2, reopened.getHistory(null).size());
    }

    // ------------------------------------------------------------ helpers

    private static Hash h(String label) {
        return Hash.of(label.getBytes(StandardCharsets.UTF_8));
    }

    private static Optional<Path> path(String address) {
        return Optional.ofNullable(PATHS.get(address));
    }

    private static BlockMeta block(int height) {
        return new BlockMeta(h("block-" + height), height, 1_600_000_000L + height);
    }

    private static Transaction receive(String prev, long value, String address) {
        return Transaction.builder().input(h(prev), 0).output(value, address).build();
    }

    /** Spends {@code funding:index}: one payment out, change back to us. */
    private static Transaction spend(Transaction funding, int index, long payment, long change) {
        return Transaction.builder()
                .input(funding.hash(), index)
                .output(payment, "stranger")
                .output(change, "change")
                .build();
    }

    private void assertState(long tx, long coin, long unconfirmed, long confirmed) {
        TXDBState state = txdb.getState();
        assertEquals(tx, state.tx(), "tx count");
        assertEquals(coin, state.coin(), "coin count");
        assertEquals(unconfirmed, state.unconfirmed(), "unconfirmed");
        assertEquals(confirmed, state.confirmed(), "confirmed");
    }

    private void assertUnchanged(TXDBState state, Map<String, String> keys, int eventCount) {
        assertArrayEquals(state.toRaw(), txdb.getState().toRaw());
        assertEquals(keys, snapshot());
        assertEquals(eventCount, events.size());
    }

    private void assertWalletBalanceMatchesState() {
        assertEquals(txdb.getState().toBalance(), txdb.getWalletBalance());
    }

    private List<WalletEvent.Type> types() {
        List<WalletEvent.Type> out = new ArrayList<>();
        for (WalletEvent e : events) out.add(e.type());
        return out;
    }

    private List<Hash> removedHashes() {
        List<Hash> out = new ArrayList<>();
        for (WalletEvent e : events) {
            if (e.type() == WalletEvent.Type.REMOVE_TX) out.add(e.record().hash());
        }
        return out;
    }

    private static List<Hash> hashesOf(List<TXRecord> records) {
        List<Hash> out = new ArrayList<>();
        for (TXRecord r : records) out.add(r.hash());
        return out;
    }

    private Map<String, String> snapshot() {
        byte[] high = new byte[64];
        Arrays.fill(high, (byte) 0xff);
        Map<String, String> out = new LinkedHashMap<>();
        for (KeyValue kv : store.range(RangeOptions.between(new byte[0], high))) {
            out.put(Hash.toHex(kv.key()), Hash.toHex(kv.value()));
        }
        return out;
    }

    private static final class FailingStore extends InMemoryKeyValueStore {
        volatile boolean failing;
        volatile byte[] failOnGet;
        volatile Runnable beforeWrite;

        @Override
        public Optional<byte[]> get(byte[] key) {
            byte[] target = failOnGet;
            if (target != null && Arrays.equals(target, key)) {
                throw new StorageException("read-failure");
            }
            return super.get(key);
        }

        @Override
        public KeyValueBatch batch() {
            KeyValueBatch delegate = super.batch();
            return new KeyValueBatch() {
                @Override
                public void put(byte[] key, byte[] value) {
                    delegate.put(key, value);
                }

                @Override
                public void del(byte[] key) {
                    delegate.del(key);
                }

                @Override
                public void write() {
                    Runnable hook = beforeWrite;
                    if (hook != null) {
                        hook.run();
                    }
                    if (failing) {
                        throw new StorageException("persist-failure");
                    }
                    delegate.write();
                }

                @Override
                public void clear() {
                    delegate.clear();
                }

                @Override
                public int size() {
                    return delegate.size();
                }
            };
        }
    }
}
