package io.deedchain.core.state;

import java.util.Optional;

/**
 * Read-your-writes view over a store. Reads see the pending writes first;
 * nothing reaches the store until the owner commits {@link #writes()}.
 */
public final class StateDelta {
    private final RegistryStore store;
    private final WriteSet writes = new WriteSet();

    public StateDelta(RegistryStore store) {
        this.store = store;
    }

    public <K, V> Optional<V> get(Column<K, V> column, K key) {
        Optional<V> pending = writes.lookup(column, key);
        if (pending.isPresent()) {
            return pending;
        }
        return store.get(column, key);
    }

    public <K, V> void put(Column<K, V> column, K key, V value) {
        writes.put(column, key, value);
    }

    public WriteSet writes() {
        return writes;
    }
}
