package io.walletledger.core.txdb;

import io.walletledger.core.protocol.BlockMeta;
import io.walletledger.core.protocol.CorruptDataException;
import io.walletledger.core.protocol.Encoding;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.protocol.TransactionCodec;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A stored transaction with its first-seen time and, once confirmed, its block.
 *
 * Serialized form: tx (len-prefixed), hasBlock u8 [block hash, height i32, time u32],
 * index i32, ps u32.
 */
public final class TXRecord {
    private final Transaction tx;
    private final long ps;
    private final Hash block;
    private final int height;
    private final long time;
    private final int index;

    private TXRecord(Transaction tx, long ps, Hash block, int height, long time, int index) {
        this.tx = Objects.requireNonNull(tx, "tx");
        this.ps = ps;
        this.block = block;
        this.height = block == null ? Coin.UNCONFIRMED : height;
        this.time = block == null ? 0 : time;
        this.index = block == null ? -1 : index;
    }

    /**
     * @param tx    the transaction
     * @param block confirming block, or null for a mempool transaction
     * @param ps    first-seen time (unix seconds)
     */
    public static TXRecord fromTX(Transaction tx, BlockMeta block, long ps) {
        if (block == null) {
            return new TXRecord(tx, ps, null, Coin.UNCONFIRMED, 0, -1);
        }
        return new TXRecord(tx, ps, block.hash(), block.height(), block.time(), -1);
    }

    public Transaction tx() { return tx; }
    public Hash hash() { return tx.hash(); }
    public long ps() { return ps; }
    /** Block hash, or null while pending. */
    public Hash block() { return block; }
    public int height() { return height; }
    public long time() { return time; }
    public int index() { return index; }

    public boolean confirmed() { return block != null; }

    /** Block reference, or null while pending. */
    public BlockMeta blockMeta() {
        return block == null ? null : new BlockMeta(block, height, time);
    }

    public TXRecord withBlock(BlockMeta meta) {
        return new TXRecord(tx, ps, meta.hash(), meta.height(), meta.time(), index);
    }

    public TXRecord withoutBlock() {
        return new TXRecord(tx, ps, null, Coin.UNCONFIRMED, 0, -1);
    }

    /** Confirmations at the given chain height; 0 while pending. */
    public int depth(int chainHeight) {
        if (height == Coin.UNCONFIRMED || chainHeight < height) {
            return 0;
        }
        return chainHeight - height + 1;
    }

    public byte[] toRaw() {
        byte[] raw = tx.serialize();
        int size = Encoding.sizeOf(raw) + 1 + (block != null ? Hash.LENGTH + 8 : 0) + 4 + 4;
        ByteBuffer buf = Encoding.writer(size);
        Encoding.putBytes(buf, raw);
        if (block != null) {
            buf.put((byte) 1);
            Encoding.putHash(buf, block);
            buf.putInt(height);
            buf.putInt((int) time);
        } else {
            buf.put((byte) 0);
        }
        buf.putInt(index);
        buf.putInt((int) ps);
        return Encoding.render(buf);
    }

    public static TXRecord fromRaw(byte[] data) {
        ByteBuffer buf = Encoding.reader(data);
        Transaction tx = TransactionCodec.fromBytes(Encoding.readBytes(buf));
        Hash block = null;
        int height = Coin.UNCONFIRMED;
        long time = 0;
        if (Encoding.readFlag(buf)) {
            block = Encoding.readHash(buf);
            height = Encoding.readInt(buf);
            time = Encoding.readU32(buf);
            if (height < 0) {
                throw new CorruptDataException("Confirmed record with negative height " + height);
            }
        }
        int index = Encoding.readInt(buf);
        long ps = Encoding.readU32(buf);
        Encoding.expectEnd(buf, "tx record");
        return new TXRecord(tx, ps, block, height, time, index);
    }

    @Override
    public String toString() {
        return "TXRecord{" + tx.txid() + ", height=" + height + ", ps=" + ps + "}";
    }
}
