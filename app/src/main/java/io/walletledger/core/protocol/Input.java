package io.walletledger.core.protocol;

import java.util.Objects;

/** Transaction input: the outpoint it spends, its sequence and opaque witness data. */
public final class Input {
    public static final int MAX_SEQUENCE = 0xffffffff;
    /** Sequences strictly below this value signal replace-by-fee. */
    public static final int RBF_THRESHOLD = 0xfffffffe;

    private final Outpoint prevout;
    private final int sequence;
    private final byte[] witness;

    public Input(Outpoint prevout, int sequence, byte[] witness) {
        this.prevout = Objects.requireNonNull(prevout, "prevout");
        this.sequence = sequence;
        this.witness = witness != null ? witness.clone() : new byte[0];
    }

    public Input(Outpoint prevout) {
        this(prevout, MAX_SEQUENCE, null);
    }

    public Outpoint prevout() { return prevout; }
    public int sequence() { return sequence; }
    public byte[] witness() { return witness.clone(); }

    public boolean isRBF() {
        return Integer.compareUnsigned(sequence, RBF_THRESHOLD) < 0;
    }

    int size() {
        return Outpoint.SIZE + 4 + Encoding.sizeOf(witness);
    }

    byte[] rawWitness() { return witness; }
}
