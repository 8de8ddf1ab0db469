package io.deedchain.core.state;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of RegistryStore.
 * Not persistent: resets every process run. Good for tests and local nodes.
 */
public final class InMemoryRegistryStore implements RegistryStore {

    private final Map<Column<?, ?>, Map<Object, Object>> tables = new HashMap<>();

    @Override
    public synchronized <K, V> Optional<V> get(Column<K, V> column, K key) {
        if (key == null) return Optional.empty();
        Map<Object, Object> table = tables.get(column);
        if (table == null) return Optional.empty();
        return Optional.ofNullable(column.valueType().cast(table.get(key)));
    }

    @Override
    public synchronized void write(WriteSet writes) {
        // puts cannot fail once validated by WriteSet, so applying in order is all-or-nothing
        for (WriteSet.Put<?, ?> put : writes.puts()) {
            tables.computeIfAbsent(put.column(), c -> new HashMap<>()).put(put.key(), put.value());
        }
    }

    @Override
    public synchronized long size(Column<?, ?> column) {
        Map<Object, Object> table = tables.get(column);
        return table == null ? 0 : table.size();
    }
}
