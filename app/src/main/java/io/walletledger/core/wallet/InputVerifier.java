package io.walletledger.core.wallet;

import io.walletledger.core.protocol.Transaction;
import io.walletledger.core.txdb.Coin;

/**
 * Checks that an unconfirmed transaction may spend one of our coins.
 * Only consulted when input verification is enabled.
 */
@FunctionalInterface
public interface InputVerifier {

    InputVerifier ACCEPT_ALL = (tx, index, coin) -> true;

    boolean verify(Transaction tx, int index, Coin coin);
}
