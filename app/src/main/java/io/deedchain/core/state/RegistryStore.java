package io.deedchain.core.state;

import java.util.Optional;

/**
 * Key-value storage behind the registry: typed point reads plus atomic batch writes.
 */
public interface RegistryStore {

    /** Point read; empty when the key was never written. */
    <K, V> Optional<V> get(Column<K, V> column, K key);

    /** Apply every put in the set, or none of them. */
    void write(WriteSet writes);

    /** Number of entries in a column (debug/metrics). */
    long size(Column<?, ?> column);
}
