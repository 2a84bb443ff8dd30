package io.walletledger.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    void countsAndScrapes() {
        LedgerMetrics metrics = new LedgerMetrics(new SimpleMeterRegistry());

        String result = metrics.recordCommit(() -> "written");
        metrics.incrementCommits(12);
        metrics.incrementDrops();
        metrics.incrementConflicts();
        metrics.incrementRemovals();
        metrics.incrementRemovals();

        assertEquals("written", result);
        assertEquals(1.0, metrics.commitCount());
        assertEquals(1.0, metrics.dropCount());
        assertEquals(1.0, metrics.conflictCount());
        assertEquals(2.0, metrics.removalCount());
        assertEquals(1, metrics.registry().find("ledger.batch.commit.time").timer().count());
        assertEquals(12.0, metrics.registry().find("ledger.batch.writes").summary().totalAmount());

        String scrape = metrics.scrapeMetrics();
        assertTrue(scrape.contains("ledger.batch.commits{stat=COUNT} 1.0"));
        assertTrue(scrape.contains("ledger.tx.removed{stat=COUNT} 2.0"));
    }

    @Test
    void failedCommitIsStillTimed() {
        LedgerMetrics metrics = new LedgerMetrics(new SimpleMeterRegistry());

        assertThrows(IllegalStateException.class, () -> metrics.recordCommit(() -> {
            throw new IllegalStateException("disk full");
        }));
        assertEquals(1, metrics.registry().find("ledger.batch.commit.time").timer().count());
        assertEquals(0.0, metrics.commitCount());
    }
}
