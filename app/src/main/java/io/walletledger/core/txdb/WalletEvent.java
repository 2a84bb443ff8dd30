package io.walletledger.core.txdb;

import java.util.Objects;

/**
 * Notification queued by a ledger batch and delivered after the batch commits.
 * Transaction events carry the record and details; balance events carry the
 * balance at that point of the batch.
 */
public record WalletEvent(Type type, TXRecord record, Details details, Balance balance) {

    public enum Type {
        TX,
        CONFIRMED,
        UNCONFIRMED,
        CONFLICT,
        REMOVE_TX,
        BALANCE
    }

    public WalletEvent {
        Objects.requireNonNull(type, "type");
    }

    static WalletEvent tx(Type type, TXRecord record, Details details) {
        if (type == Type.BALANCE) throw new IllegalArgumentException("balance events carry a Balance");
        return new WalletEvent(type, record, details, null);
    }

    static WalletEvent balance(Balance balance) {
        return new WalletEvent(Type.BALANCE, null, null, balance);
    }
}
