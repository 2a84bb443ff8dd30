package io.walletledger.core.txdb;

import io.walletledger.core.protocol.Encoding;
import io.walletledger.core.protocol.Hash;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Copy of a credit consumed by one of our transactions, stored under the
 * spender's input so the credit can be restored when the spender goes away.
 * Records written without the trailing own byte decode with {@code own = true}.
 */
public record UndoCoin(Coin coin, boolean own) {

    public UndoCoin {
        Objects.requireNonNull(coin, "coin");
    }

    static UndoCoin of(Credit credit) {
        return new UndoCoin(credit.coin(), credit.own());
    }

    /** Credit rebuilt from this record, unspent. */
    public Credit toCredit() {
        return new Credit(coin, false, own);
    }

    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(coin.size() + 1);
        coin.write(buf);
        buf.put((byte) (own ? 1 : 0));
        return Encoding.render(buf);
    }

    /**
     * @param hash  hash of the transaction that created the coin
     * @param index output index of the coin
     */
    public static UndoCoin fromRaw(byte[] data, Hash hash, int index) {
        ByteBuffer buf = Encoding.reader(data);
        Coin coin = Coin.read(buf, hash, index);
        boolean own = true;
        if (buf.hasRemaining()) {
            own = Encoding.readFlag(buf);
        }
        Encoding.expectEnd(buf, "undo coin");
        return new UndoCoin(coin, own);
    }
}
