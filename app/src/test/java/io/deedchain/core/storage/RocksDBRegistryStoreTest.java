package io.deedchain.core.storage;

import io.deedchain.core.model.AccessGrant;
import io.deedchain.core.model.DocumentRecord;
import io.deedchain.core.model.PropertyDetails;
import io.deedchain.core.model.PropertyInfo;
import io.deedchain.core.model.PropertyStatus;
import io.deedchain.core.model.StatusChange;
import io.deedchain.core.model.TransferRecord;
import io.deedchain.core.registry.CallContext;
import io.deedchain.core.registry.PropertyRegistry;
import io.deedchain.core.state.Columns;
import io.deedchain.core.state.WriteSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBRegistryStoreTest {

    @TempDir
    Path tempDir;

    private RocksDBRegistryStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void registryStateSurvivesReopen() {
        String dir = tempDir.resolve("registry").toString();
        store = RocksDBRegistryStore.open(dir);
        PropertyRegistry registry = new PropertyRegistry(store);

        long id = registry.register(CallContext.of("alice", 1),
                new PropertyDetails("Lot 7", "Lakeside parcel", "Springfield", "residential", 1000, "sqft"), "alice").value();
        registry.transfer(CallContext.of("alice", 2), id, "bob", "sale", OptionalLong.of(500));
        registry.verify(CallContext.of("inspector", 2), id, "ok");
        registry.addDocument(CallContext.of("bob", 3), id, "Deed", "deed", "abc123", "");
        registry.changeStatus(CallContext.of("bob", 3), id, PropertyStatus.PENDING, "escrow");
        registry.grant(CallContext.of("bob", 4), id, "bank", 2, OptionalLong.of(50));

        PropertyInfo before = registry.getPropertyInfo(id).value();
        TransferRecord transferBefore = registry.getTransfer(id, 1).value();
        DocumentRecord documentBefore = registry.getDocument(id, 1).value();
        List<StatusChange> historyBefore = registry.getStatusHistory(id).value();
        AccessGrant grantBefore = registry.getAccessGrant(id, "bank").value();

        store.close();
        store = RocksDBRegistryStore.open(dir);
        PropertyRegistry reopened = new PropertyRegistry(store);

        assertEquals(before, reopened.getPropertyInfo(id).value());
        assertEquals(transferBefore, reopened.getTransfer(id, 1).value());
        assertEquals(OptionalLong.of(500), reopened.getTransfer(id, 1).value().amount());
        assertEquals(documentBefore, reopened.getDocument(id, 1).value());
        assertEquals(historyBefore, reopened.getStatusHistory(id).value());
        assertEquals(grantBefore, reopened.getAccessGrant(id, "bank").value());
        assertTrue(reopened.getOwnerMembership("bob", id));
        assertFalse(reopened.getOwnerMembership("alice", id));
        assertEquals(4, reopened.currentHeight());
        assertEquals(1, reopened.getSystemStatistics().totalVerified());

        // counters continue where they stopped
        long next = reopened.register(CallContext.of("carol", 5),
                new PropertyDetails("Lot 8", "Next door", "Springfield", "residential", 900, "sqft"), "carol").value();
        assertEquals(2, next);
    }

    @Test
    void writeSetIsVisibleAndCounted() {
        store = RocksDBRegistryStore.open(tempDir.resolve("db").toString());
        WriteSet writes = new WriteSet();
        writes.put(Columns.OWNERS, 1L, "alice");
        writes.put(Columns.OWNERS, 2L, "bob");
        writes.put(Columns.META, Columns.HEIGHT, 9L);

        store.write(writes);

        assertEquals(Optional.of("alice"), store.get(Columns.OWNERS, 1L));
        assertEquals(Optional.of(9L), store.get(Columns.META, Columns.HEIGHT));
        assertTrue(store.get(Columns.OWNERS, 3L).isEmpty());
        assertEquals(2, store.size(Columns.OWNERS));
        assertEquals(0, store.size(Columns.TRANSFERS));
    }
}
