package io.walletledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Identity of a spendable output: (transaction hash, output index).
 * The index is an unsigned 32-bit value stored in an int; {@link #NULL_INDEX}
 * marks the coinbase prevout.
 */
public record Outpoint(Hash hash, int index) implements Comparable<Outpoint> {
    public static final int SIZE = Hash.LENGTH + 4;
    public static final int NULL_INDEX = 0xffffffff;
    public static final Outpoint NULL = new Outpoint(Hash.ZERO, NULL_INDEX);

    public Outpoint {
        Objects.requireNonNull(hash, "hash");
    }

    public static Outpoint fromTX(Transaction tx, int index) {
        return new Outpoint(tx.hash(), index);
    }

    public boolean isNull() {
        return index == NULL_INDEX && hash.isZero();
    }

    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(SIZE);
        write(buf);
        return Encoding.render(buf);
    }

    public void write(ByteBuffer buf) {
        Encoding.putHash(buf, hash);
        buf.putInt(index);
    }

    public static Outpoint read(ByteBuffer buf) {
        Hash hash = Encoding.readHash(buf);
        int index = Encoding.readInt(buf);
        return new Outpoint(hash, index);
    }

    public static Outpoint fromRaw(byte[] data) {
        ByteBuffer buf = Encoding.reader(data);
        Outpoint out = read(buf);
        Encoding.expectEnd(buf, "outpoint");
        return out;
    }

    @Override
    public int compareTo(Outpoint o) {
        int cmp = hash.compareTo(o.hash);
        return cmp != 0 ? cmp : Integer.compareUnsigned(index, o.index);
    }

    @Override
    public String toString() {
        return hash.hex() + ":" + Integer.toUnsignedString(index);
    }
}
