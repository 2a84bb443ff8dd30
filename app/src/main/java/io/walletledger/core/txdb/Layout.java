package io.walletledger.core.txdb;

import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Outpoint;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Key layout for one wallet's ledger. Every key starts with {@code 't' + wid}
 * (u32 big-endian); integers inside keys are big-endian so byte order is
 * numeric order.
 *
 * <pre>
 *  t[hash]                 -> tx record
 *  c[hash][index]          -> credit
 *  d[hash][index]          -> undo coin (spender hash and input index)
 *  s[hash][index]          -> spender outpoint
 *  p[hash]                 -> pending marker
 *  m[time][hash]           -> first-seen index
 *  h[height][hash]         -> height index
 *  T[account][hash]        -> account tx
 *  P[account][hash]        -> account pending
 *  M[account][time][hash]  -> account first-seen
 *  H[account][height][hash]-> account height
 *  C[account][hash][index] -> account outpoint
 *  b[height]               -> block record
 *  r[hash]                 -> replace-by-fee marker
 *  R                       -> state
 * </pre>
 */
public final class Layout {
    public static final byte WALLET = 't';
    private static final int PREFIX = 5;

    private final int wid;
    private final byte[] prefix;

    public Layout(int wid) {
        this.wid = wid;
        this.prefix = ByteBuffer.allocate(PREFIX).put(WALLET).putInt(wid).array();
    }

    public int wid() { return wid; }

    public byte[] prefix() { return prefix.clone(); }

    // ---------------------------------------------------------------- keys

    public byte[] t(Hash hash) { return key('t', PREFIX_HASH).putHash(hash).done(); }
    public byte[] c(Hash hash, int index) { return key('c', OUTPOINT).putHash(hash).putInt(index).done(); }
    public byte[] c(Outpoint op) { return c(op.hash(), op.index()); }
    public byte[] d(Hash hash, int index) { return key('d', OUTPOINT).putHash(hash).putInt(index).done(); }
    public byte[] s(Hash hash, int index) { return key('s', OUTPOINT).putHash(hash).putInt(index).done(); }
    public byte[] s(Outpoint op) { return s(op.hash(), op.index()); }
    public byte[] p(Hash hash) { return key('p', PREFIX_HASH).putHash(hash).done(); }
    public byte[] r(Hash hash) { return key('r', PREFIX_HASH).putHash(hash).done(); }
    public byte[] m(long time, Hash hash) { return key('m', 4 + Hash.LENGTH).putInt((int) time).putHash(hash).done(); }
    public byte[] h(int height, Hash hash) { return key('h', 4 + Hash.LENGTH).putInt(height).putHash(hash).done(); }

    public byte[] T(int account, Hash hash) { return key('T', 4 + Hash.LENGTH).putInt(account).putHash(hash).done(); }
    public byte[] P(int account, Hash hash) { return key('P', 4 + Hash.LENGTH).putInt(account).putHash(hash).done(); }
    public byte[] M(int account, long time, Hash hash) {
        return key('M', 8 + Hash.LENGTH).putInt(account).putInt((int) time).putHash(hash).done();
    }
    public byte[] H(int account, int height, Hash hash) {
        return key('H', 8 + Hash.LENGTH).putInt(account).putInt(height).putHash(hash).done();
    }
    public byte[] C(int account, Hash hash, int index) {
        return key('C', 4 + OUTPOINT).putInt(account).putHash(hash).putInt(index).done();
    }

    public byte[] b(int height) { return key('b', 4).putInt(height).done(); }
    public byte[] R() { return key('R', 0).done(); }

    // ------------------------------------------------------------- bounds

    /** Lower scan bound for a type byte, optionally narrowed by leading u32 components. */
    public byte[] min(char type, int... ints) {
        Builder b = key(type, ints.length * 4);
        for (int v : ints) b.putInt(v);
        return b.done();
    }

    /** Upper scan bound: the components followed by enough 0xff to cover any key suffix. */
    public byte[] max(char type, int... ints) {
        Builder b = key(type, ints.length * 4 + OUTPOINT);
        for (int v : ints) b.putInt(v);
        while (b.buf.hasRemaining()) b.buf.put((byte) 0xff);
        return b.done();
    }

    /** Bounds for every {@code [hash][index]} key of one transaction. */
    public byte[] min(char type, Hash hash) {
        return key(type, Hash.LENGTH).putHash(hash).done();
    }

    public byte[] max(char type, Hash hash) {
        return key(type, OUTPOINT).putHash(hash).putInt(-1).done();
    }

    // ------------------------------------------------------------ parsers

    /** Trailing 32-byte hash of a key. */
    public static Hash tailHash(byte[] key) {
        return new Hash(Arrays.copyOfRange(key, key.length - Hash.LENGTH, key.length));
    }

    /** Trailing hash + u32 index of a key. */
    public static Outpoint tailOutpoint(byte[] key) {
        int start = key.length - Hash.LENGTH - 4;
        Hash hash = new Hash(Arrays.copyOfRange(key, start, start + Hash.LENGTH));
        int index = ByteBuffer.wrap(key, start + Hash.LENGTH, 4).order(ByteOrder.BIG_ENDIAN).getInt();
        return new Outpoint(hash, index);
    }

    /** u32 at the given offset after the wallet prefix and type byte. */
    public static int intAt(byte[] key, int offset) {
        return ByteBuffer.wrap(key, PREFIX + 1 + offset, 4).order(ByteOrder.BIG_ENDIAN).getInt();
    }

    // ------------------------------------------------------------ helpers

    private static final int PREFIX_HASH = Hash.LENGTH;
    private static final int OUTPOINT = Hash.LENGTH + 4;

    private Builder key(char type, int bodySize) {
        ByteBuffer buf = ByteBuffer.allocate(PREFIX + 1 + bodySize).order(ByteOrder.BIG_ENDIAN);
        buf.put(prefix);
        buf.put((byte) type);
        return new Builder(buf);
    }

    private static final class Builder {
        final ByteBuffer buf;

        Builder(ByteBuffer buf) { this.buf = buf; }

        Builder putInt(int v) { buf.putInt(v); return this; }

        Builder putHash(Hash h) {
            byte[] b = new byte[Hash.LENGTH];
            h.writeTo(b, 0);
            buf.put(b);
            return this;
        }

        byte[] done() {
            if (buf.hasRemaining()) {
                throw new IllegalStateException("key under-filled by " + buf.remaining() + " bytes");
            }
            return buf.array();
        }
    }
}
