package io.walletledger.core.txdb;

/**
 * Height or time range for index scans. Bounds are inclusive unsigned 32-bit
 * values; {@code limit <= 0} means no limit.
 */
public record RangeQuery(long start, long end, int limit, boolean reverse) {
    public static final long MAX = 0xffffffffL;

    public RangeQuery {
        if (start < 0 || start > MAX) throw new IllegalArgumentException("start out of range: " + start);
        if (end < 0 || end > MAX) throw new IllegalArgumentException("end out of range: " + end);
    }

    public static RangeQuery all() {
        return new RangeQuery(0, MAX, 0, false);
    }

    public static RangeQuery between(long start, long end) {
        return new RangeQuery(start, end, 0, false);
    }

    public RangeQuery withLimit(int l) { return new RangeQuery(start, end, l, reverse); }
    public RangeQuery reversed() { return new RangeQuery(start, end, limit, !reverse); }
}
