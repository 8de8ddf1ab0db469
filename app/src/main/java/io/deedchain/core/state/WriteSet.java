package io.deedchain.core.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of puts belonging to one operation. Stores apply a write set all-or-nothing.
 * A later put to the same (column, key) replaces the earlier one.
 */
public final class WriteSet {

    public record Put<K, V>(Column<K, V> column, K key, V value) {}

    private final Map<Column<?, ?>, Map<Object, Put<?, ?>>> byColumn = new LinkedHashMap<>();

    public <K, V> void put(Column<K, V> column, K key, V value) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        byColumn.computeIfAbsent(column, c -> new LinkedHashMap<>())
                .put(key, new Put<>(column, key, value));
    }

    public <K, V> Optional<V> lookup(Column<K, V> column, K key) {
        Map<Object, Put<?, ?>> puts = byColumn.get(column);
        if (puts == null) {
            return Optional.empty();
        }
        Put<?, ?> put = puts.get(key);
        return put == null ? Optional.empty() : Optional.of(column.valueType().cast(put.value()));
    }

    public List<Put<?, ?>> puts() {
        List<Put<?, ?>> out = new ArrayList<>();
        for (Map<Object, Put<?, ?>> puts : byColumn.values()) {
            out.addAll(puts.values());
        }
        return out;
    }

    public boolean isEmpty() {
        return byColumn.isEmpty();
    }

    public int size() {
        int n = 0;
        for (Map<Object, Put<?, ?>> puts : byColumn.values()) {
            n += puts.size();
        }
        return n;
    }
}
