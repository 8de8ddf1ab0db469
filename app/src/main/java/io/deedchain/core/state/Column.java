package io.deedchain.core.state;

import java.util.Objects;

/**
 * A named, typed map inside the registry store.
 * The name doubles as the RocksDB column family name.
 */
public final class Column<K, V> {
    private final String name;
    private final KeyCodec<K> keyCodec;
    private final Class<V> valueType;

    public Column(String name, KeyCodec<K> keyCodec, Class<V> valueType) {
        this.name = Objects.requireNonNull(name, "name");
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public String name() { return name; }
    public KeyCodec<K> keyCodec() { return keyCodec; }
    public Class<V> valueType() { return valueType; }

    public byte[] encodeKey(K key) {
        return keyCodec.encode(key);
    }

    @Override
    public String toString() {
        return "Column(" + name + ")";
    }
}
