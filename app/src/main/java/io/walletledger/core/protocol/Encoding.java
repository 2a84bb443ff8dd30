package io.walletledger.core.protocol;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian record helpers shared by every codec.
 * Variable-length fields are prefixed with a u32 length.
 */
public final class Encoding {
    private Encoding(){}

    public static ByteBuffer writer(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    public static ByteBuffer reader(byte[] data) {
        if (data == null) {
            throw new CorruptDataException("Missing record bytes");
        }
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    /** Returns the array backing a writer, checking that it was filled exactly. */
    public static byte[] render(ByteBuffer buf) {
        if (buf.hasRemaining()) {
            throw new IllegalStateException("Encoded size mismatch: " + buf.remaining() + " bytes unused");
        }
        return buf.array();
    }

    public static int sizeOf(byte[] b) { return 4 + (b == null ? 0 : b.length); }

    public static int sizeOf(String s) { return 4 + (s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length); }

    public static void putBytes(ByteBuffer buf, byte[] b){
        byte[] data = b == null ? new byte[0] : b;
        buf.putInt(data.length);
        buf.put(data);
    }

    public static void putString(ByteBuffer buf, String s){
        putBytes(buf, s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8));
    }

    public static void putHash(ByteBuffer buf, Hash hash) {
        buf.put(hash.bytes());
    }

    public static byte readU8(ByteBuffer b) {
        require(b, 1);
        return b.get();
    }

    public static int readInt(ByteBuffer b) {
        require(b, 4);
        return b.getInt();
    }

    public static long readU32(ByteBuffer b) {
        return Integer.toUnsignedLong(readInt(b));
    }

    public static long readLong(ByteBuffer b) {
        require(b, 8);
        return b.getLong();
    }

    public static Hash readHash(ByteBuffer b) {
        require(b, Hash.LENGTH);
        byte[] out = new byte[Hash.LENGTH];
        b.get(out);
        return new Hash(out);
    }

    public static byte[] readBytes(ByteBuffer b) {
        int len = readInt(b);
        if (len < 0 || len > b.remaining()) {
            throw new CorruptDataException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    public static String readString(ByteBuffer b) {
        byte[] raw = readBytes(b);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CorruptDataException("Invalid UTF-8 string", e);
        }
    }

    public static boolean readFlag(ByteBuffer b) {
        byte v = readU8(b);
        if (v != 0 && v != 1) {
            throw new CorruptDataException("Invalid flag byte: " + v);
        }
        return v == 1;
    }

    public static void expectEnd(ByteBuffer b, String what) {
        if (b.hasRemaining()) {
            throw new CorruptDataException("Trailing " + b.remaining() + " bytes after " + what);
        }
    }

    private static void require(ByteBuffer b, int n) {
        if (b.remaining() < n) {
            throw new CorruptDataException("Truncated record: need " + n + " bytes, have " + b.remaining(),
                    new BufferUnderflowException());
        }
    }
}
