package io.walletledger.core.wallet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletledger.core.protocol.Encoding;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Where an address sits in a wallet: account, branch (0 receive, 1 change)
 * and derivation index.
 */
public record Path(int wid, int account, int branch, int index, String address) {

    public Path {
        if (account < 0) throw new IllegalArgumentException("account must be >= 0");
        if (branch < 0) throw new IllegalArgumentException("branch must be >= 0");
        Objects.requireNonNull(address, "address");
    }

    public byte[] toRaw() {
        ByteBuffer buf = Encoding.writer(16 + Encoding.sizeOf(address));
        buf.putInt(wid);
        buf.putInt(account);
        buf.putInt(branch);
        buf.putInt(index);
        Encoding.putString(buf, address);
        return Encoding.render(buf);
    }

    public static Path fromRaw(byte[] data) {
        ByteBuffer buf = Encoding.reader(data);
        int wid = Encoding.readInt(buf);
        int account = Encoding.readInt(buf);
        int branch = Encoding.readInt(buf);
        int index = Encoding.readInt(buf);
        String address = Encoding.readString(buf);
        Encoding.expectEnd(buf, "path");
        return new Path(wid, account, branch, index, address);
    }

    public ObjectNode toJSON(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("account", account);
        node.put("change", branch == 1);
        node.put("derivation", "m/" + account + "'/" + branch + "/" + index);
        return node;
    }
}
