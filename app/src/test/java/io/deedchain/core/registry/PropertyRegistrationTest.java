package io.deedchain.core.registry;

import io.deedchain.core.model.PropertyDetails;
import io.deedchain.core.model.PropertyInfo;
import io.deedchain.core.model.PropertyMetadata;
import io.deedchain.core.model.PropertyStatus;
import io.deedchain.core.state.InMemoryRegistryStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PropertyRegistrationTest {

    private final PropertyRegistry registry = new PropertyRegistry(new InMemoryRegistryStore());

    @Test
    void registerIssuesSequentialIds() {
        assertEquals(Result.ok(1L), registry.register(CallContext.of("alice", 1), lot("Lot 1"), "alice"));
        assertEquals(Result.ok(2L), registry.register(CallContext.of("bob", 1), lot("Lot 2"), "bob"));
        assertEquals(Result.ok(3L), registry.register(CallContext.of("alice", 2), lot("Lot 3"), "carol"));
        assertEquals(3, registry.getPropertyCount());
    }

    @Test
    void registerRecordsOwnerMetadataAndUnverifiedState() {
        long id = registry.register(CallContext.of("registrar", 7), lot("Lot 7"), "alice").value();

        assertEquals(Result.ok("alice"), registry.getOwner(id));
        assertTrue(registry.ownsProperty(id, "alice"));
        assertFalse(registry.ownsProperty(id, "registrar"));
        assertTrue(registry.getOwnerMembership("alice", id));

        PropertyInfo info = registry.getPropertyInfo(id).value();
        PropertyMetadata metadata = info.metadata();
        assertEquals("Lot 7", metadata.title());
        assertEquals(1000, metadata.totalArea());
        assertEquals("sqft", metadata.areaUnit());
        assertEquals(7, metadata.registeredAt());
        assertEquals(7, metadata.lastModified());
        assertEquals(PropertyStatus.ACTIVE, metadata.status());
        assertFalse(info.verification().verified());
        assertNull(info.verification().verifier());
    }

    @Test
    void emptyRequiredFieldsAreRejectedWithoutIssuingAnId() {
        CallContext ctx = CallContext.of("alice", 1);
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.register(ctx, new PropertyDetails("", "d", "l", "c", 10, "m2"), "alice").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.register(ctx, new PropertyDetails("t", "", "l", "c", 10, "m2"), "alice").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.register(ctx, new PropertyDetails("t", "d", "", "c", 10, "m2"), "alice").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.register(ctx, new PropertyDetails("t", "d", "l", "", 10, "m2"), "alice").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.register(ctx, new PropertyDetails("t", "d", "l", "c", 0, "m2"), "alice").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.register(ctx, new PropertyDetails("t", "d", "l", "c", 10, ""), "alice").error());

        assertEquals(0, registry.getPropertyCount());
        assertEquals(Result.ok(1L), registry.register(ctx, lot("Lot 1"), "alice"));
    }

    @Test
    void titleLengthIsBoundedAtOneHundred() {
        CallContext ctx = CallContext.of("alice", 1);
        assertTrue(registry.register(ctx, lot("t".repeat(100)), "alice").isOk());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA, registry.register(ctx, lot("t".repeat(101)), "alice").error());
    }

    @Test
    void blankInitialOwnerIsInvalidOwner() {
        assertEquals(RegistryError.INVALID_OWNER,
                registry.register(CallContext.of("alice", 1), lot("Lot 1"), " ").error());
        assertEquals(RegistryError.INVALID_OWNER,
                registry.register(CallContext.of("alice", 1), lot("Lot 1"), null).error());
        assertEquals(0, registry.getPropertyCount());
    }

    @Test
    void unknownPropertyReadsReportNotFound() {
        assertEquals(RegistryError.PROPERTY_NOT_FOUND, registry.getPropertyInfo(42).error());
        assertEquals(RegistryError.PROPERTY_NOT_FOUND, registry.getOwner(42).error());
        assertEquals(RegistryError.PROPERTY_NOT_FOUND, registry.getVerification(42).error());
        assertFalse(registry.ownsProperty(42, "alice"));
        assertFalse(registry.getOwnerMembership("alice", 42));
    }

    @Test
    void ownerCanUpdateMetadata() {
        long id = registry.register(CallContext.of("alice", 1), lot("Lot 1"), "alice").value();
        PropertyDetails updated = new PropertyDetails("Lot 1A", "Subdivided", "Springfield", "commercial", 400, "m2");

        assertEquals(Result.ok(true), registry.updateMetadata(CallContext.of("alice", 5), id, updated));

        PropertyMetadata metadata = registry.getPropertyInfo(id).value().metadata();
        assertEquals(updated, metadata.details());
        assertEquals(1, metadata.registeredAt());
        assertEquals(5, metadata.lastModified());
        assertEquals(PropertyStatus.ACTIVE, metadata.status());
    }

    @Test
    void updateMetadataChecksExistenceThenOwnershipThenShape() {
        long id = registry.register(CallContext.of("alice", 1), lot("Lot 1"), "alice").value();
        PropertyDetails invalid = new PropertyDetails("", "d", "l", "c", 1, "m2");

        assertEquals(RegistryError.PROPERTY_NOT_FOUND,
                registry.updateMetadata(CallContext.of("mallory", 2), 99, invalid).error());
        assertEquals(RegistryError.UNAUTHORIZED,
                registry.updateMetadata(CallContext.of("mallory", 2), id, invalid).error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.updateMetadata(CallContext.of("alice", 2), id, invalid).error());

        assertEquals("Lot 1", registry.getPropertyInfo(id).value().metadata().title());
        assertEquals(1, registry.getPropertyInfo(id).value().metadata().lastModified());
    }

    private static PropertyDetails lot(String title) {
        return new PropertyDetails(title, "Corner lot", "Springfield", "residential", 1000, "sqft");
    }
}
