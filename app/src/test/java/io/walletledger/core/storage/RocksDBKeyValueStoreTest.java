package io.walletledger.core.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static io.walletledger.core.storage.InMemoryKeyValueStoreTest.k;
import static org.junit.jupiter.api.Assertions.*;

class RocksDBKeyValueStoreTest {

    @TempDir
    Path dir;

    @Test
    void persistsAcrossReopen() {
        String path = dir.resolve("db").toString();
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(path)) {
            KeyValueBatch batch = store.batch();
            batch.put(k(1, 1), k(10));
            batch.put(k(1, 2), k(20));
            batch.write();
            store.put(k(2), k(30));
            store.del(k(1, 1));
        }

        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(path)) {
            assertTrue(store.get(k(1, 1)).isEmpty());
            assertArrayEquals(k(20), store.get(k(1, 2)).orElseThrow());
            assertArrayEquals(k(30), store.get(k(2)).orElseThrow());
        }
    }

    @Test
    void rangeScansForwardAndReverse() {
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(dir.resolve("range").toString())) {
            store.put(k(0x05), k(0));
            store.put(k(0x10, 0x01), k(1));
            store.put(k(0x10, 0x80), k(2));
            store.put(k(0x10, 0xff), k(3));
            store.put(k(0x20), k(4));

            RangeOptions inner = RangeOptions.between(k(0x10), k(0x10, 0xff));
            List<KeyValue> forward = store.range(inner);
            assertEquals(3, forward.size());
            assertArrayEquals(k(0x10, 0x01), forward.get(0).key());

            List<KeyValue> reverse = store.range(inner.reverse(true).limit(2));
            assertEquals(2, reverse.size());
            assertArrayEquals(k(3), reverse.get(0).value());
            assertArrayEquals(k(2), reverse.get(1).value());

            List<KeyValue> firstOnly = store.range(inner.limit(1));
            assertEquals(1, firstOnly.size());
            assertArrayEquals(k(1), firstOnly.get(0).value());
        }
    }

    @Test
    void closedStoreRejectsReads() {
        RocksDBKeyValueStore store = new RocksDBKeyValueStore(dir.resolve("closed").toString(), true);
        assertThrows(IllegalStateException.class, () -> store.get(k(1)));
        store.open();
        store.put(k(1), k(1));
        store.close();
        assertEquals(LifecycleState.CLOSED, store.state());
        assertThrows(IllegalStateException.class, () -> store.get(k(1)));
    }
}
