package io.walletledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Ledger batch and removal counters.
 */
public final class LedgerMetrics {
    private static final LedgerMetrics SHARED = new LedgerMetrics(new SimpleMeterRegistry());

    private final MeterRegistry registry;
    private final Counter commits;
    private final Counter drops;
    private final Counter conflicts;
    private final Counter removals;
    private final Timer commitTime;
    private final DistributionSummary batchWrites;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.commits = Counter.builder("ledger.batch.commits")
                .description("Ledger batches written")
                .register(registry);
        this.drops = Counter.builder("ledger.batch.drops")
                .description("Ledger batches discarded")
                .register(registry);
        this.conflicts = Counter.builder("ledger.conflicts.removed")
                .description("Transactions evicted as double spends")
                .register(registry);
        this.removals = Counter.builder("ledger.tx.removed")
                .description("Transactions erased from the ledger")
                .register(registry);
        this.commitTime = registry.timer("ledger.batch.commit.time");
        this.batchWrites = DistributionSummary.builder("ledger.batch.writes")
                .baseUnit("operations")
                .description("Key-value operations per committed batch")
                .register(registry);
    }

    /** Process-wide instance used when no registry is injected. */
    public static LedgerMetrics shared() {
        return SHARED;
    }

    public <T> T recordCommit(Supplier<T> commitLogic) {
        return commitTime.record(commitLogic);
    }

    public void incrementCommits(int writes) {
        commits.increment();
        batchWrites.record(writes);
    }

    public void incrementDrops() {
        drops.increment();
    }

    public void incrementConflicts() {
        conflicts.increment();
    }

    public void incrementRemovals() {
        removals.increment();
    }

    public double commitCount() { return commits.count(); }
    public double dropCount() { return drops.count(); }
    public double conflictCount() { return conflicts.count(); }
    public double removalCount() { return removals.count(); }

    public String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
