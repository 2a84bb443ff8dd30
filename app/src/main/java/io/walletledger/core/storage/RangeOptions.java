package io.walletledger.core.storage;

import java.util.Arrays;

/**
 * Inclusive key range for ordered scans. {@code limit <= 0} means unlimited.
 */
public final class RangeOptions {
    private final byte[] gte;
    private final byte[] lte;
    private final boolean reverse;
    private final int limit;

    private RangeOptions(byte[] gte, byte[] lte, boolean reverse, int limit) {
        if (gte == null || lte == null) {
            throw new IllegalArgumentException("Range bounds are required");
        }
        this.gte = gte.clone();
        this.lte = lte.clone();
        this.reverse = reverse;
        this.limit = limit;
    }

    public static RangeOptions between(byte[] gte, byte[] lte) {
        return new RangeOptions(gte, lte, false, 0);
    }

    public RangeOptions reverse(boolean r) { return new RangeOptions(gte, lte, r, limit); }
    public RangeOptions limit(int l) { return new RangeOptions(gte, lte, reverse, l); }

    public byte[] gte() { return gte.clone(); }
    public byte[] lte() { return lte.clone(); }
    public boolean reverse() { return reverse; }
    public int limit() { return limit; }
    public boolean limited() { return limit > 0; }

    public boolean contains(byte[] key) {
        return Arrays.compareUnsigned(key, gte) >= 0 && Arrays.compareUnsigned(key, lte) <= 0;
    }
}
