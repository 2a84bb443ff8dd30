package io.walletledger.core.txdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletledger.core.wallet.Path;

/**
 * One input or output line of a {@link Details} view. The path is null when
 * the line does not belong to this wallet.
 */
public final class DetailsMember {
    private long value;
    private String address;
    private Path path;

    DetailsMember(long value, String address) {
        this.value = value;
        this.address = address;
    }

    public long value() { return value; }
    public String address() { return address; }
    public Path path() { return path; }

    public boolean isOwn() { return path != null; }

    void set(long value, String address, Path path) {
        this.value = value;
        this.address = address;
        this.path = path;
    }

    public ObjectNode toJSON(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("value", value);
        if (address == null) {
            node.putNull("address");
        } else {
            node.put("address", address);
        }
        if (path == null) {
            node.putNull("path");
        } else {
            node.set("path", path.toJSON(mapper));
        }
        return node;
    }
}
