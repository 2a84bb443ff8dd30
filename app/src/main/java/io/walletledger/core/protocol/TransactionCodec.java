package io.walletledger.core.protocol;

import java.nio.ByteBuffer;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        ByteBuffer buf = Encoding.reader(bytes);
        Transaction tx = read(buf);
        Encoding.expectEnd(buf, "transaction");
        return tx;
    }

    /** Reads one transaction and leaves the buffer positioned after it. */
    public static Transaction read(ByteBuffer buf) {
        try {
            Transaction.Builder builder = Transaction.builder().version(Encoding.readInt(buf));

            int inCount = readCount(buf);
            for (int i = 0; i < inCount; i++) {
                Outpoint prevout = Outpoint.read(buf);
                int sequence = Encoding.readInt(buf);
                byte[] witness = Encoding.readBytes(buf);
                builder.input(new Input(prevout, sequence, witness));
            }

            int outCount = readCount(buf);
            for (int i = 0; i < outCount; i++) {
                long value = Encoding.readLong(buf);
                String address = Encoding.readString(buf);
                builder.output(new Output(value, address));
            }

            return builder.locktime(Encoding.readInt(buf)).build();
        } catch (IllegalArgumentException ex) {
            throw new CorruptDataException("Malformed Transaction bytes", ex);
        }
    }

    private static int readCount(ByteBuffer b) {
        int count = Encoding.readInt(b);
        if (count < 0 || count > b.remaining()) {
            throw new CorruptDataException("Bad item count: " + count);
        }
        return count;
    }
}
