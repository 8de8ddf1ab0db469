package io.deedchain.core.registry;

import io.deedchain.core.state.Columns;
import io.deedchain.core.state.CounterKey;
import io.deedchain.core.state.RegistryStore;
import io.deedchain.core.state.StateDelta;

/**
 * Monotonic counters kept in the "counters" column. A scope that was never used reads as 0,
 * so the first issued value is 1.
 */
final class SequenceGenerator {
    private SequenceGenerator() {}

    /** Issue the next value of a scope; the increment is part of the delta's write set. */
    static long next(StateDelta delta, CounterKey key) {
        long next = current(delta, key) + 1;
        delta.put(Columns.COUNTERS, key, next);
        return next;
    }

    static long current(StateDelta delta, CounterKey key) {
        return delta.get(Columns.COUNTERS, key).orElse(0L);
    }

    static long current(RegistryStore store, CounterKey key) {
        return store.get(Columns.COUNTERS, key).orElse(0L);
    }
}
