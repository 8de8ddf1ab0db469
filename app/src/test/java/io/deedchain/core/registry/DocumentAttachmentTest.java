package io.deedchain.core.registry;

import io.deedchain.core.model.DocumentRecord;
import io.deedchain.core.model.PropertyDetails;
import io.deedchain.core.state.InMemoryRegistryStore;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class DocumentAttachmentTest {

    private static final String HASH = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";

    private final PropertyRegistry registry = new PropertyRegistry(new InMemoryRegistryStore());

    @Test
    void ownerAttachesDocumentsWithPerPropertyIds() {
        long id = register();

        assertEquals(Result.ok(1L), registry.addDocument(CallContext.of("alice", 2), id, "Deed", "deed", HASH, "Original deed"));
        assertEquals(Result.ok(2L), registry.addDocument(CallContext.of("alice", 3), id, "Survey", "survey", HASH, ""));

        DocumentRecord deed = registry.getDocument(id, 1).value();
        assertEquals("Deed", deed.title());
        assertEquals("deed", deed.documentType());
        assertEquals(HASH, deed.hash());
        assertEquals(2, deed.uploadedAt());
        assertEquals("alice", deed.uploader());
        assertEquals("Original deed", deed.description());
        assertEquals(Result.ok(2L), registry.getDocumentCount(id));
        assertEquals(3, registry.getPropertyInfo(id).value().metadata().lastModified());

        long other = register();
        assertEquals(Result.ok(1L), registry.addDocument(CallContext.of("alice", 4), other, "Deed", "deed", HASH, ""));
    }

    @Test
    void onlyTheCurrentOwnerMayAttach() {
        long id = register();

        assertEquals(RegistryError.UNAUTHORIZED,
                registry.addDocument(CallContext.of("bob", 2), id, "Deed", "deed", HASH, "").error());

        registry.transfer(CallContext.of("alice", 3), id, "bob", "sale", OptionalLong.empty());
        assertEquals(RegistryError.UNAUTHORIZED,
                registry.addDocument(CallContext.of("alice", 4), id, "Deed", "deed", HASH, "").error());
        assertEquals(Result.ok(1L), registry.addDocument(CallContext.of("bob", 4), id, "Deed", "deed", HASH, ""));
    }

    @Test
    void validatesDocumentFields() {
        long id = register();
        CallContext alice = CallContext.of("alice", 2);

        assertEquals(RegistryError.INVALID_PROPERTY_DATA, registry.addDocument(alice, id, "Deed", "deed", "", "").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.addDocument(alice, id, "Deed", "deed", "a".repeat(65), "").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA, registry.addDocument(alice, id, "", "deed", HASH, "").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.addDocument(alice, id, "Deed", "t".repeat(51), HASH, "").error());
        assertEquals(RegistryError.INVALID_PROPERTY_DATA,
                registry.addDocument(alice, id, "Deed", "deed", HASH, "d".repeat(501)).error());
        assertEquals(Result.ok(0L), registry.getDocumentCount(id));
    }

    @Test
    void missingDocumentsAndPropertiesAreReported() {
        long id = register();

        assertEquals(RegistryError.DOCUMENT_NOT_FOUND, registry.getDocument(id, 1).error());
        assertEquals(RegistryError.PROPERTY_NOT_FOUND, registry.getDocument(404, 1).error());
        assertEquals(RegistryError.PROPERTY_NOT_FOUND,
                registry.addDocument(CallContext.of("alice", 2), 404, "Deed", "deed", HASH, "").error());
    }

    private long register() {
        return registry.register(CallContext.of("alice", 1),
                new PropertyDetails("House", "Two storeys", "Elm street 4", "residential", 180, "m2"), "alice").value();
    }
}
