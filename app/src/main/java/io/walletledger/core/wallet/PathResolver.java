package io.walletledger.core.wallet;

import java.util.Optional;

/** Maps an output address to the wallet path that owns it. */
@FunctionalInterface
public interface PathResolver {
    Optional<Path> getPath(String address);
}
