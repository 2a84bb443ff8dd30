package io.walletledger.core.wallet;

import io.walletledger.core.storage.KeyValue;
import io.walletledger.core.storage.KeyValueStore;
import io.walletledger.core.storage.RangeOptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent address to path map for one wallet ({@code 'A' + wid + address}).
 * Kept in memory after {@link #load()}.
 */
public final class AddressBook implements PathResolver {
    static final byte PREFIX = 'A';

    private final KeyValueStore store;
    private final int wid;
    private final Map<String, Path> paths = new ConcurrentHashMap<>();

    public AddressBook(KeyValueStore store, int wid) {
        this.store = store;
        this.wid = wid;
    }

    public void load() {
        paths.clear();
        byte[] gte = key("");
        byte[] lte = ByteBuffer.allocate(6).put(PREFIX).putInt(wid).put((byte) 0xff).array();
        for (KeyValue kv : store.range(RangeOptions.between(gte, lte))) {
            Path path = Path.fromRaw(kv.value());
            paths.put(path.address(), path);
        }
    }

    @Override
    public Optional<Path> getPath(String address) {
        if (address == null || address.isEmpty()) return Optional.empty();
        return Optional.ofNullable(paths.get(address));
    }

    public boolean has(String address) {
        return paths.containsKey(address);
    }

    /**
     * Stores a path. Re-adding the same path is a no-op.
     *
     * @throws IllegalStateException if the address already maps to another path
     */
    public void add(Path path) {
        if (path.wid() != wid) {
            throw new IllegalArgumentException("Path belongs to wallet " + path.wid() + ", not " + wid);
        }
        if (path.address().isEmpty()) {
            throw new IllegalArgumentException("address is required");
        }
        Path existing = paths.get(path.address());
        if (existing != null) {
            if (existing.equals(path)) return;
            throw new IllegalStateException("Address " + path.address() + " already mapped to " + existing);
        }
        store.put(key(path.address()), path.toRaw());
        paths.put(path.address(), path);
    }

    public List<Path> getPaths() {
        return new ArrayList<>(paths.values());
    }

    public List<Path> getPaths(int account) {
        List<Path> out = new ArrayList<>();
        for (Path p : paths.values()) {
            if (p.account() == account) out.add(p);
        }
        return out;
    }

    public int size() {
        return paths.size();
    }

    private byte[] key(String address) {
        byte[] addr = address.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(5 + addr.length).put(PREFIX).putInt(wid).put(addr).array();
    }
}
