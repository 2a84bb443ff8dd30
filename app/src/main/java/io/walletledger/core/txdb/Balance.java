package io.walletledger.core.txdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Balance snapshot for a wallet ({@code account == -1}) or a single account.
 */
public record Balance(int wid, String id, int account, long unconfirmed, long confirmed) {

    public ObjectNode toJSON(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("wid", wid);
        node.put("id", id);
        if (account == -1) {
            node.putNull("account");
        } else {
            node.put("account", account);
        }
        node.put("unconfirmed", unconfirmed);
        node.put("confirmed", confirmed);
        return node;
    }
}
