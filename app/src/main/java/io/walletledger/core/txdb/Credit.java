package io.walletledger.core.txdb;

import io.walletledger.core.protocol.CorruptDataException;
import io.walletledger.core.protocol.Encoding;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Outpoint;
import io.walletledger.core.protocol.Transaction;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A wallet-owned coin plus its spend state.
 *
 * <ul>
 *   <li>{@code spent}: consumed by a transaction that is still unconfirmed.</li>
 *   <li>{@code own}: created by a transaction that spent our own coins.</li>
 * </ul>
 */
public final class Credit {

    /** On-disk shape of a credit record. */
    public enum Format {
        /** coin + spent byte; written before the own flag existed, own reads as true. */
        LEGACY,
        /** coin + spent byte + own byte. */
        CURRENT
    }

    private final Coin coin;
    private final boolean spent;
    private final boolean own;
    private final Format format;

    public Credit(Coin coin, boolean spent, boolean own) {
        this(coin, spent, own, Format.CURRENT);
    }

    private Credit(Coin coin, boolean spent, boolean own, Format format) {
        this.coin = Objects.requireNonNull(coin, "coin");
        this.spent = spent;
        this.own = own;
        this.format = format;
    }

    public static Credit fromTX(Transaction tx, int index, int height, boolean own) {
        return new Credit(Coin.fromTX(tx, index, height), false, own);
    }

    public Coin coin() { return coin; }
    public boolean spent() { return spent; }
    public boolean own() { return own; }
    /** Format the record was decoded from; new credits are {@link Format#CURRENT}. */
    public Format format() { return format; }

    public Outpoint outpoint() { return coin.outpoint(); }
    public long value() { return coin.value(); }
    public int height() { return coin.height(); }

    public Credit withSpent(boolean s) { return new Credit(coin, s, own); }
    public Credit withHeight(int height) { return new Credit(coin.withHeight(height), spent, own); }

    public int size() {
        return coin.size() + 2;
    }

    /** Always encodes the current format. */
    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(size());
        coin.write(buf);
        buf.put((byte) (spent ? 1 : 0));
        buf.put((byte) (own ? 1 : 0));
        return Encoding.render(buf);
    }

    public static Credit fromRaw(byte[] data, Hash hash, int index) {
        ByteBuffer buf = Encoding.reader(data);
        Coin coin = Coin.read(buf, hash, index);
        boolean spent = Encoding.readFlag(buf);
        if (!buf.hasRemaining()) {
            return new Credit(coin, spent, true, Format.LEGACY);
        }
        boolean own = Encoding.readFlag(buf);
        Encoding.expectEnd(buf, "credit");
        return new Credit(coin, spent, own, Format.CURRENT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Credit)) return false;
        Credit c = (Credit) o;
        return spent == c.spent && own == c.own && coin.equals(c.coin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coin, spent, own);
    }

    @Override
    public String toString() {
        return "Credit{" + coin + ", spent=" + spent + ", own=" + own + "}";
    }
}
