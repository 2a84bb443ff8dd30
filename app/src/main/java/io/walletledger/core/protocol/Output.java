package io.walletledger.core.protocol;

/**
 * Transaction output. Scripts are treated as opaque; the output is identified
 * by the address it pays, which is what the wallet's path lookup keys on.
 */
public record Output(long value, String address) {
    public Output {
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        if (address == null) address = "";
    }

    int size() {
        return 8 + Encoding.sizeOf(address);
    }
}
