package io.walletledger.core.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

/** Simple config holder for a wallet database. */
public final class WalletConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String ENV_DATA_DIR = "WALLET_LEDGER_DATA_DIR";
    public static final String ENV_COIN_CACHE_SIZE = "WALLET_LEDGER_COIN_CACHE_SIZE";
    public static final String ENV_VERIFY = "WALLET_LEDGER_VERIFY";
    public static final String ENV_WALLET_ID = "WALLET_LEDGER_WALLET_ID";

    public final String dataDir;
    public final int coinCacheSize;
    public final boolean verify;
    public final String walletId;

    public WalletConfig(String dataDir, int coinCacheSize, boolean verify, String walletId) {
        if (coinCacheSize < 0) {
            throw new IllegalArgumentException("coinCacheSize must be >= 0");
        }
        if (walletId == null || walletId.isBlank()) {
            throw new IllegalArgumentException("walletId is required");
        }
        this.dataDir = dataDir;
        this.coinCacheSize = coinCacheSize;
        this.verify = verify;
        this.walletId = walletId;
    }

    public static WalletConfig defaultLocal() {
        return new WalletConfig(
                "data/wallet",  // relative to the working directory
                10_000,         // coin cache entries
                false,          // input verification off
                "primary"
        );
    }

    public WalletConfig withDataDir(String dir) {
        return new WalletConfig(dir, coinCacheSize, verify, walletId);
    }

    public WalletConfig withCoinCacheSize(int size) {
        return new WalletConfig(dataDir, size, verify, walletId);
    }

    public WalletConfig withVerify(boolean v) {
        return new WalletConfig(dataDir, coinCacheSize, v, walletId);
    }

    public WalletConfig withWalletId(String id) {
        return new WalletConfig(dataDir, coinCacheSize, verify, id);
    }

    public static WalletConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /** Defaults overridden by any {@code WALLET_LEDGER_*} variables present. */
    public static WalletConfig fromEnv(Map<String, String> env) {
        WalletConfig config = defaultLocal();
        String dir = env.get(ENV_DATA_DIR);
        if (dir != null && !dir.isBlank()) {
            config = config.withDataDir(dir);
        }
        String cache = env.get(ENV_COIN_CACHE_SIZE);
        if (cache != null && !cache.isBlank()) {
            try {
                config = config.withCoinCacheSize(Integer.parseInt(cache.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + ENV_COIN_CACHE_SIZE + ": " + cache, e);
            }
        }
        String verify = env.get(ENV_VERIFY);
        if (verify != null && !verify.isBlank()) {
            config = config.withVerify("true".equalsIgnoreCase(verify.trim()));
        }
        String id = env.get(ENV_WALLET_ID);
        if (id != null && !id.isBlank()) {
            config = config.withWalletId(id.trim());
        }
        return config;
    }

    /**
     * Reads a JSON config file. Keys: {@code dataDir}, {@code coinCacheSize},
     * {@code verify}, {@code walletId}; missing keys keep their defaults.
     */
    public static WalletConfig load(java.nio.file.Path file) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Config file not found: " + file);
        }
        JsonNode root;
        try {
            root = JSON.readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read wallet config from " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Wallet config must be a JSON object: " + file);
        }
        WalletConfig config = defaultLocal();
        if (root.hasNonNull("dataDir")) {
            config = config.withDataDir(root.get("dataDir").asText());
        }
        if (root.hasNonNull("coinCacheSize")) {
            JsonNode n = root.get("coinCacheSize");
            if (!n.canConvertToInt()) {
                throw new IllegalArgumentException("coinCacheSize must be an integer");
            }
            config = config.withCoinCacheSize(n.asInt());
        }
        if (root.hasNonNull("verify")) {
            config = config.withVerify(root.get("verify").asBoolean());
        }
        if (root.hasNonNull("walletId")) {
            config = config.withWalletId(root.get("walletId").asText());
        }
        return config;
    }

    @Override
    public String toString() {
        return "WalletConfig{dataDir=" + dataDir + ", coinCacheSize=" + coinCacheSize
                + ", verify=" + verify + ", walletId=" + walletId + "}";
    }
}
