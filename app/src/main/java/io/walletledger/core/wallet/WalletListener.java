package io.walletledger.core.wallet;

import io.walletledger.core.txdb.Balance;
import io.walletledger.core.txdb.Details;
import io.walletledger.core.txdb.TXRecord;

/**
 * Callbacks for committed ledger changes. Delivered synchronously, in commit
 * order, after the batch is durable. Override what you need.
 */
public interface WalletListener {

    default void onTX(Wallet wallet, TXRecord wtx, Details details) { }

    default void onConfirmed(Wallet wallet, TXRecord wtx, Details details) { }

    default void onUnconfirmed(Wallet wallet, TXRecord wtx, Details details) { }

    default void onConflict(Wallet wallet, TXRecord wtx, Details details) { }

    default void onRemoveTX(Wallet wallet, TXRecord wtx, Details details) { }

    default void onBalance(Wallet wallet, Balance balance) { }
}
