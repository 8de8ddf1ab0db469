package io.deedchain.core.registry;

import io.deedchain.core.model.PropertyDetails;
import io.deedchain.core.model.PropertyStatus;
import io.deedchain.core.model.SystemStatistics;
import io.deedchain.core.model.TransferRecord;
import io.deedchain.core.state.InMemoryRegistryStore;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class OwnershipTransferTest {

    private final PropertyRegistry registry = new PropertyRegistry(new InMemoryRegistryStore());

    @Test
    void transferMovesOwnershipAndRecordsHistory() {
        long id = register("alice");

        Result<Boolean> result = registry.transfer(CallContext.of("alice", 3), id, "bob", "sale", OptionalLong.empty());

        assertEquals(Result.ok(true), result);
        assertEquals(Result.ok("bob"), registry.getOwner(id));
        assertFalse(registry.ownsProperty(id, "alice"));
        assertTrue(registry.ownsProperty(id, "bob"));
        assertFalse(registry.getOwnerMembership("alice", id));
        assertTrue(registry.getOwnerMembership("bob", id));

        TransferRecord record = registry.getTransfer(id, 1).value();
        assertEquals("alice", record.fromOwner());
        assertEquals("bob", record.toOwner());
        assertEquals(3, record.transferredAt());
        assertEquals("sale", record.reason());
        assertTrue(record.amount().isEmpty());
        assertEquals(Result.ok(1L), registry.getTransferCount(id));
        assertEquals(3, registry.getPropertyInfo(id).value().metadata().lastModified());
    }

    @Test
    void nonOwnerCannotTransfer() {
        long id = register("alice");

        assertEquals(RegistryError.UNAUTHORIZED,
                registry.transfer(CallContext.of("mallory", 2), id, "mallory", "theft", OptionalLong.empty()).error());

        assertEquals(Result.ok("alice"), registry.getOwner(id));
        assertEquals(Result.ok(0L), registry.getTransferCount(id));
        assertEquals(0, registry.getSystemStatistics().totalTransfers());
    }

    @Test
    void transferToCurrentOwnerIsInvalidOwner() {
        long id = register("alice");

        assertEquals(RegistryError.INVALID_OWNER,
                registry.transfer(CallContext.of("alice", 2), id, "alice", "", OptionalLong.empty()).error());
        assertEquals(Result.ok(0L), registry.getTransferCount(id));
    }

    @Test
    void transferValidatesArguments() {
        long id = register("alice");
        CallContext alice = CallContext.of("alice", 2);

        assertEquals(RegistryError.INVALID_OWNER, registry.transfer(alice, id, "", "", OptionalLong.empty()).error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.transfer(alice, id, "bob", "r".repeat(201), OptionalLong.empty()).error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.transfer(alice, id, "bob", "sale", OptionalLong.of(-1)).error());
        assertEquals(RegistryError.PROPERTY_NOT_FOUND,
                registry.transfer(alice, 99, "bob", "sale", OptionalLong.empty()).error());
        assertEquals(Result.ok("alice"), registry.getOwner(id));
    }

    @Test
    void successiveTransfersGetIncreasingSequenceNumbers() {
        long id = register("alice");

        assertTrue(registry.transfer(CallContext.of("alice", 2), id, "bob", "sale", OptionalLong.of(100)).isOk());
        assertTrue(registry.transfer(CallContext.of("bob", 3), id, "carol", "gift", OptionalLong.empty()).isOk());

        assertEquals("alice", registry.getTransfer(id, 1).value().fromOwner());
        assertEquals("bob", registry.getTransfer(id, 2).value().fromOwner());
        assertEquals("carol", registry.getTransfer(id, 2).value().toOwner());
        assertEquals(RegistryError.TRANSFER_NOT_FOUND, registry.getTransfer(id, 3).error());
        assertEquals(RegistryError.PROPERTY_NOT_FOUND, registry.getTransfer(99, 1).error());

        // the previous owner cannot move it again
        assertEquals(RegistryError.UNAUTHORIZED,
                registry.transfer(CallContext.of("bob", 4), id, "dave", "", OptionalLong.empty()).error());
        assertEquals(2, registry.getSystemStatistics().totalTransfers());
    }

    @Test
    void transferSequencesArePerProperty() {
        long first = register("alice");
        long second = register("alice");

        registry.transfer(CallContext.of("alice", 2), first, "bob", "", OptionalLong.empty());
        registry.transfer(CallContext.of("alice", 2), second, "carol", "", OptionalLong.empty());

        assertEquals("bob", registry.getTransfer(first, 1).value().toOwner());
        assertEquals("carol", registry.getTransfer(second, 1).value().toOwner());
    }

    @Test
    void saleScenarioEndToEnd() {
        long id = registry.register(CallContext.of("alice", 1),
                new PropertyDetails("Lot 7", "Lakeside parcel", "Springfield", "residential", 1000, "sqft"),
                "alice").value();
        assertEquals(1, id);

        assertEquals(Result.ok(true),
                registry.transfer(CallContext.of("alice", 2), 1, "bob", "sale", OptionalLong.of(500)));
        assertEquals(Result.ok("bob"), registry.getOwner(1));

        TransferRecord record = registry.getTransfer(1, 1).value();
        assertEquals("alice", record.fromOwner());
        assertEquals("bob", record.toOwner());
        assertEquals(OptionalLong.of(500), record.amount());

        assertEquals(Result.ok(true),
                registry.changeStatus(CallContext.of("bob", 3), 1, PropertyStatus.SUSPENDED, "dispute"));
        assertEquals(PropertyStatus.SUSPENDED, registry.getPropertyInfo(1).value().metadata().status());

        SystemStatistics stats = registry.getSystemStatistics();
        assertEquals(1, stats.totalProperties());
        assertEquals(1, stats.totalTransfers());
        assertEquals(0, stats.totalVerified());
        assertEquals(3, stats.height());
    }

    private long register(String owner) {
        return registry.register(CallContext.of(owner, 1),
                new PropertyDetails("Lot", "Parcel", "Springfield", "residential", 500, "m2"), owner).value();
    }
}
