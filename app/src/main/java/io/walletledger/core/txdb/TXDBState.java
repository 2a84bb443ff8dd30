package io.walletledger.core.txdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletledger.core.protocol.CorruptDataException;
import io.walletledger.core.protocol.Encoding;

import java.nio.ByteBuffer;

/**
 * Running per-wallet totals: transaction count, coin count and the two balances.
 * Serialized as four u64 LE counters.
 */
public final class TXDBState {
    public static final int SIZE = 32;

    private final int wid;
    private final String id;
    long tx;
    long coin;
    long unconfirmed;
    long confirmed;
    private boolean committed;

    public TXDBState(int wid, String id) {
        this.wid = wid;
        this.id = id;
    }

    public int wid() { return wid; }
    public String id() { return id; }
    public long tx() { return tx; }
    public long coin() { return coin; }
    public long unconfirmed() { return unconfirmed; }
    public long confirmed() { return confirmed; }

    /** True once this snapshot has been handed to a batch for writing. */
    public boolean committed() { return committed; }

    public TXDBState copy() {
        TXDBState s = new TXDBState(wid, id);
        s.tx = tx;
        s.coin = coin;
        s.unconfirmed = unconfirmed;
        s.confirmed = confirmed;
        return s;
    }

    /** Marks the snapshot committed and returns its encoding. */
    byte[] commit() {
        committed = true;
        return toRaw();
    }

    public Balance toBalance() {
        return new Balance(wid, id, -1, unconfirmed, confirmed);
    }

    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(SIZE);
        buf.putLong(tx);
        buf.putLong(coin);
        buf.putLong(unconfirmed);
        buf.putLong(confirmed);
        return Encoding.render(buf);
    }

    public static TXDBState fromRaw(int wid, String id, byte[] data) {
        ByteBuffer buf = Encoding.reader(data);
        TXDBState s = new TXDBState(wid, id);
        s.tx = Encoding.readLong(buf);
        s.coin = Encoding.readLong(buf);
        s.unconfirmed = Encoding.readLong(buf);
        s.confirmed = Encoding.readLong(buf);
        Encoding.expectEnd(buf, "txdb state");
        if (s.tx < 0 || s.coin < 0) {
            throw new CorruptDataException("Negative counters in txdb state");
        }
        return s;
    }

    public ObjectNode toJSON(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("wid", wid);
        node.put("id", id);
        node.put("tx", tx);
        node.put("coin", coin);
        node.put("unconfirmed", unconfirmed);
        node.put("confirmed", confirmed);
        return node;
    }

    @Override
    public String toString() {
        return "TXDBState{wid=" + wid + ", tx=" + tx + ", coin=" + coin
                + ", unconfirmed=" + unconfirmed + ", confirmed=" + confirmed + "}";
    }
}
