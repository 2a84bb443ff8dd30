package io.walletledger.core.txdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletledger.core.protocol.Hash;
import io.walletledger.core.protocol.Output;
import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.wallet.Path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Wallet-relative view of a transaction: which inputs and outputs are ours,
 * the accounts touched, and depth/fee figures for display.
 */
public final class Details {
    private final int wid;
    private final String id;
    private final TXRecord record;
    private final int chainHeight;
    private final List<DetailsMember> inputs;
    private final List<DetailsMember> outputs;
    private final SortedSet<Integer> accounts = new TreeSet<>();

    public Details(int wid, String id, TXRecord record, int chainHeight) {
        this.wid = wid;
        this.id = id;
        this.record = record;
        this.chainHeight = chainHeight;

        Transaction tx = record.tx();
        List<DetailsMember> in = new ArrayList<>(tx.inputs().size());
        for (int i = 0; i < tx.inputs().size(); i++) {
            in.add(new DetailsMember(0, null));
        }
        List<DetailsMember> out = new ArrayList<>(tx.outputs().size());
        for (Output o : tx.outputs()) {
            out.add(new DetailsMember(o.value(), o.address()));
        }
        this.inputs = Collections.unmodifiableList(in);
        this.outputs = Collections.unmodifiableList(out);
    }

    void setInput(int i, Path path, Coin coin) {
        inputs.get(i).set(coin.value(), coin.address(), path);
        if (path != null) accounts.add(path.account());
    }

    void setOutput(int i, Path path) {
        DetailsMember m = outputs.get(i);
        m.set(m.value(), m.address(), path);
        if (path != null) accounts.add(path.account());
    }

    public int wid() { return wid; }
    public String id() { return id; }
    public TXRecord record() { return record; }
    public Transaction tx() { return record.tx(); }
    public Hash hash() { return record.hash(); }
    public long ps() { return record.ps(); }
    public int size() { return record.tx().size(); }
    public Hash block() { return record.block(); }
    public int height() { return record.height(); }
    public long time() { return record.time(); }
    public List<DetailsMember> inputs() { return inputs; }
    public List<DetailsMember> outputs() { return outputs; }

    /** Sorted distinct accounts with at least one input or output in this transaction. */
    public List<Integer> accounts() { return new ArrayList<>(accounts); }

    public int depth() {
        return record.depth(chainHeight);
    }

    /** Fee paid; 0 unless every input is one of ours. */
    public long fee() {
        long inputValue = 0;
        for (DetailsMember in : inputs) {
            if (in.path() == null) {
                return 0;
            }
            inputValue += in.value();
        }
        long outputValue = 0;
        for (DetailsMember out : outputs) {
            outputValue += out.value();
        }
        return inputValue - outputValue;
    }

    /** Fee per 1000 bytes. */
    public long rate() {
        int size = size();
        if (size <= 0) return 0;
        return fee() * 1000 / size;
    }

    public ObjectNode toJSON(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("wid", wid);
        node.put("id", id);
        node.put("hash", record.hash().hex());
        node.put("height", record.height());
        if (record.block() == null) {
            node.putNull("block");
        } else {
            node.put("block", record.block().hex());
        }
        node.put("time", record.time());
        node.put("mtime", record.ps());
        node.put("size", size());
        node.put("fee", fee());
        node.put("rate", rate());
        node.put("confirmations", depth());
        ArrayNode acc = node.putArray("accounts");
        for (Integer a : accounts) acc.add(a);
        ArrayNode in = node.putArray("inputs");
        for (DetailsMember m : inputs) in.add(m.toJSON(mapper));
        ArrayNode out = node.putArray("outputs");
        for (DetailsMember m : outputs) out.add(m.toJSON(mapper));
        node.put("tx", Hash.toHex(record.tx().serialize()));
        return node;
    }
}
