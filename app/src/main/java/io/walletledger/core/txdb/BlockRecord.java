package io.walletledger.core.txdb;

import io.walletledger.core.protocol.BlockMeta;
import io.walletledger.core.protocol.CorruptDataException;
import io.walletledger.core.protocol.Encoding;
import io.walletledger.core.protocol.Hash;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Wallet transactions confirmed in one block, keyed by height.
 * The hash list never holds duplicates.
 */
public final class BlockRecord {
    private final Hash hash;
    private final int height;
    private final long time;
    private final Set<Hash> hashes = new LinkedHashSet<>();

    public BlockRecord(Hash hash, int height, long time) {
        this.hash = Objects.requireNonNull(hash, "hash");
        this.height = height;
        this.time = time;
    }

    public static BlockRecord fromMeta(BlockMeta meta) {
        return new BlockRecord(meta.hash(), meta.height(), meta.time());
    }

    public Hash hash() { return hash; }
    public int height() { return height; }
    public long time() { return time; }

    public BlockMeta toMeta() {
        return new BlockMeta(hash, height, time);
    }

    /** @return false if the hash was already present */
    public boolean add(Hash txHash) {
        return hashes.add(txHash);
    }

    /** @return false if the hash was not present */
    public boolean remove(Hash txHash) {
        return hashes.remove(txHash);
    }

    public boolean contains(Hash txHash) {
        return hashes.contains(txHash);
    }

    public List<Hash> hashes() {
        return new ArrayList<>(hashes);
    }

    public int size() {
        return hashes.size();
    }

    public boolean isEmpty() {
        return hashes.isEmpty();
    }

    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(Hash.LENGTH + 12 + hashes.size() * Hash.LENGTH);
        Encoding.putHash(buf, hash);
        buf.putInt(height);
        buf.putInt((int) time);
        buf.putInt(hashes.size());
        for (Hash h : hashes) {
            Encoding.putHash(buf, h);
        }
        return Encoding.render(buf);
    }

    public static BlockRecord fromRaw(byte[] data) {
        ByteBuffer buf = Encoding.reader(data);
        Hash hash = Encoding.readHash(buf);
        int height = Encoding.readInt(buf);
        long time = Encoding.readU32(buf);
        long count = Encoding.readU32(buf);
        if (count * Hash.LENGTH != buf.remaining()) {
            throw new CorruptDataException("Block record count " + count + " does not match "
                    + buf.remaining() + " remaining bytes");
        }
        BlockRecord record = new BlockRecord(hash, height, time);
        for (long i = 0; i < count; i++) {
            if (!record.add(Encoding.readHash(buf))) {
                throw new CorruptDataException("Duplicate hash in block record at height " + height);
            }
        }
        return record;
    }
}
