package io.walletledger.core.txdb;

import io.walletledger.core.protocol.CorruptDataException;
import io.walletledger.core.protocol.Encoding;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Outpoint;
import io.walletledger.core.protocol.Output;
import io.walletledger.core.protocol.Transaction;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * An output as the ledger remembers it. Height -1 means unconfirmed.
 *
 * Serialized form: version i32, height i32, value i64, address (len-prefixed),
 * coinbase u8. The outpoint is not serialized; it comes back from the key.
 */
public final class Coin {
    public static final int UNCONFIRMED = -1;

    private final int version;
    private final int height;
    private final long value;
    private final String address;
    private final boolean coinbase;
    private final Hash hash;
    private final int index;

    public Coin(int version, int height, long value, String address, boolean coinbase, Hash hash, int index) {
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        if (height < UNCONFIRMED) throw new IllegalArgumentException("height must be >= -1");
        this.version = version;
        this.height = height;
        this.value = value;
        this.address = address == null ? "" : address;
        this.coinbase = coinbase;
        this.hash = Objects.requireNonNull(hash, "hash");
        this.index = index;
    }

    public static Coin fromTX(Transaction tx, int index, int height) {
        Output out = tx.output(index);
        return new Coin(tx.version(), height, out.value(), out.address(), tx.isCoinbase(), tx.hash(), index);
    }

    public int version() { return version; }
    public int height() { return height; }
    public long value() { return value; }
    public String address() { return address; }
    public boolean coinbase() { return coinbase; }
    public Hash hash() { return hash; }
    public int index() { return index; }

    public boolean confirmed() { return height != UNCONFIRMED; }

    public Outpoint outpoint() { return new Outpoint(hash, index); }

    public Coin withHeight(int newHeight) {
        return new Coin(version, newHeight, value, address, coinbase, hash, index);
    }

    /** Same coin re-keyed to another outpoint (undo records live at the spender's input). */
    public Coin at(Outpoint outpoint) {
        return new Coin(version, height, value, address, coinbase, outpoint.hash(), outpoint.index());
    }

    int size() {
        return 4 + 4 + 8 + Encoding.sizeOf(address) + 1;
    }

    void write(ByteBuffer buf) {
        buf.putInt(version);
        buf.putInt(height);
        buf.putLong(value);
        Encoding.putString(buf, address);
        buf.put((byte) (coinbase ? 1 : 0));
    }

    static Coin read(ByteBuffer buf, Hash hash, int index) {
        int version = Encoding.readInt(buf);
        int height = Encoding.readInt(buf);
        long value = Encoding.readLong(buf);
        String address = Encoding.readString(buf);
        boolean coinbase = Encoding.readFlag(buf);
        try {
            return new Coin(version, height, value, address, coinbase, hash, index);
        } catch (IllegalArgumentException e) {
            throw new CorruptDataException("Invalid coin record", e);
        }
    }

    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(size());
        write(buf);
        return Encoding.render(buf);
    }

    public static Coin fromRaw(byte[] data, Hash hash, int index) {
        ByteBuffer buf = Encoding.reader(data);
        Coin coin = read(buf, hash, index);
        Encoding.expectEnd(buf, "coin");
        return coin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coin)) return false;
        Coin c = (Coin) o;
        return version == c.version && height == c.height && value == c.value
                && coinbase == c.coinbase && index == c.index
                && address.equals(c.address) && hash.equals(c.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, height, value, address, coinbase, hash, index);
    }

    @Override
    public String toString() {
        return "Coin{" + outpoint() + ", value=" + value + ", height=" + height + ", address=" + address + "}";
    }
}
