package io.walletledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable UTXO transaction. The hash is the double SHA-256 of {@link #serialize()}.
 */
public final class Transaction {

    private final int version;
    private final List<Input> inputs;
    private final List<Output> outputs;
    private final int locktime;

    private final byte[] raw;
    private final Hash hash;

    private Transaction(int version, List<Input> inputs, List<Output> outputs, int locktime) {
        this.version = version;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.locktime = locktime;
        basicValidate();
        this.raw = encode();
        this.hash = Hash.of(raw);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = 1;
        private final List<Input> inputs = new ArrayList<>();
        private final List<Output> outputs = new ArrayList<>();
        private int locktime;

        public Builder version(int v) { this.version = v; return this; }
        public Builder input(Input in) { this.inputs.add(in); return this; }
        public Builder input(Outpoint prevout) { return input(new Input(prevout)); }
        public Builder input(Hash hash, int index) { return input(new Outpoint(hash, index)); }
        public Builder output(Output out) { this.outputs.add(out); return this; }
        public Builder output(long value, String address) { return output(new Output(value, address)); }
        public Builder locktime(int l) { this.locktime = l; return this; }

        /** Adds the single null-prevout input that marks a coinbase. */
        public Builder coinbase(byte[] extraNonce) {
            return input(new Input(Outpoint.NULL, Input.MAX_SEQUENCE, extraNonce));
        }

        public Transaction build() {
            return new Transaction(version, inputs, outputs, locktime);
        }
    }

    // -------------------- getters --------------------
    public int version() { return version; }
    public List<Input> inputs() { return inputs; }
    public List<Output> outputs() { return outputs; }
    public Input input(int i) { return inputs.get(i); }
    public Output output(int i) { return outputs.get(i); }
    public int locktime() { return locktime; }
    public Hash hash() { return hash; }
    public String txid() { return hash.hex(); }
    public int size() { return raw.length; }

    public boolean isCoinbase() {
        return inputs.size() == 1 && inputs.get(0).prevout().isNull();
    }

    /** True when any input opts in to replacement. */
    public boolean isRBF() {
        if (version == 0) {
            return false;
        }
        for (Input input : inputs) {
            if (input.isRBF()) {
                return true;
            }
        }
        return false;
    }

    public long outputValue() {
        long total = 0;
        for (Output out : outputs) {
            total += out.value();
        }
        return total;
    }

    public byte[] serialize() {
        return raw.clone();
    }

    public void basicValidate() {
        if (inputs.isEmpty()) throw new IllegalArgumentException("Transaction has no inputs");
        if (outputs.isEmpty()) throw new IllegalArgumentException("Transaction has no outputs");
        for (Input input : inputs) {
            if (input.prevout().isNull() && inputs.size() > 1) {
                throw new IllegalArgumentException("Null prevout in non-coinbase transaction");
            }
        }
    }

    // -------------------- helpers --------------------
    private byte[] encode() {
        ByteBuffer buf = Encoding.writer(estimateSize());
        buf.putInt(version);
        buf.putInt(inputs.size());
        for (Input input : inputs) {
            input.prevout().write(buf);
            buf.putInt(input.sequence());
            Encoding.putBytes(buf, input.rawWitness());
        }
        buf.putInt(outputs.size());
        for (Output output : outputs) {
            buf.putLong(output.value());
            Encoding.putString(buf, output.address());
        }
        buf.putInt(locktime);
        return Encoding.render(buf);
    }

    private int estimateSize() {
        int size = 4 + 4 + 4 + 4;
        for (Input input : inputs) size += input.size();
        for (Output output : outputs) size += output.size();
        return size;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transaction && hash.equals(((Transaction) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Transaction(" + txid() + ", in=" + inputs.size() + ", out=" + outputs.size() + ")";
    }
}
