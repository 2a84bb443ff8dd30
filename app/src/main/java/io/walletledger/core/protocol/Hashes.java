package io.walletledger.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    /** Double SHA-256, the transaction id digest. */
    public static byte[] hash256(byte[] in) {
        MessageDigest sha = sha256();
        byte[] first = sha.digest(in);
        return sha.digest(first);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
