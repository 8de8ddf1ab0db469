package io.deedchain.core.state;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StateDeltaTest {

    @Test
    void readsSeePendingWritesBeforeTheStore() {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        WriteSet seed = new WriteSet();
        seed.put(Columns.OWNERS, 1L, "alice");
        store.write(seed);

        StateDelta delta = new StateDelta(store);
        assertEquals(Optional.of("alice"), delta.get(Columns.OWNERS, 1L));

        delta.put(Columns.OWNERS, 1L, "bob");
        assertEquals(Optional.of("bob"), delta.get(Columns.OWNERS, 1L));
        assertEquals(Optional.of("alice"), store.get(Columns.OWNERS, 1L));

        store.write(delta.writes());
        assertEquals(Optional.of("bob"), store.get(Columns.OWNERS, 1L));
    }

    @Test
    void laterPutReplacesEarlierOne() {
        StateDelta delta = new StateDelta(new InMemoryRegistryStore());
        delta.put(Columns.COUNTERS, CounterKey.PROPERTY_ID, 1L);
        delta.put(Columns.COUNTERS, CounterKey.PROPERTY_ID, 2L);
        delta.put(Columns.MEMBERSHIP, new MembershipKey("alice", 1L), Boolean.TRUE);

        assertEquals(2, delta.writes().size());
        assertEquals(Optional.of(2L), delta.get(Columns.COUNTERS, CounterKey.PROPERTY_ID));
    }

    @Test
    void compositeKeysUseStructuralEquality() {
        StateDelta delta = new StateDelta(new InMemoryRegistryStore());
        delta.put(Columns.MEMBERSHIP, new MembershipKey("alice", 7L), Boolean.TRUE);

        assertEquals(Optional.of(Boolean.TRUE), delta.get(Columns.MEMBERSHIP, new MembershipKey("alice", 7L)));
        assertTrue(delta.get(Columns.MEMBERSHIP, new MembershipKey("alice", 8L)).isEmpty());
        assertTrue(delta.get(Columns.GRANTS, new GrantKey(7L, "alice")).isEmpty());
    }
}
