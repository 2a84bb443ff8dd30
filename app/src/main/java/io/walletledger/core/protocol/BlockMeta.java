package io.walletledger.core.protocol;

import java.util.Objects;

/**
 * Reference to a confirming block: hash, height and block time (unix seconds).
 */
public record BlockMeta(Hash hash, int height, long time) {
    public BlockMeta {
        Objects.requireNonNull(hash, "hash");
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
    }
}
