package io.deedchain.core.mempool;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.deedchain.core.protocol.Operation;
import io.deedchain.core.protocol.RegistryCall;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CallPoolTest {

    @Test
    void addAcceptsValidCall() {
        CallPool pool = new CallPool(new CallValidator());

        assertTrue(pool.add(verifyCall("inspector", 1, 1_000L)));
        assertEquals(1, pool.size());
    }

    @Test
    void identicalCallIsQueuedOnce() {
        CallPool pool = new CallPool(new CallValidator());
        RegistryCall call = verifyCall("inspector", 1, 1_000L);

        assertTrue(pool.add(call));
        assertFalse(pool.add(verifyCall("inspector", 1, 1_000L)));
        assertTrue(pool.add(verifyCall("inspector", 1, 1_001L)));
        assertEquals(2, pool.size());
    }

    @Test
    void addRejectsMissingArgument() {
        CallPool pool = new CallPool(new CallValidator());
        RegistryCall call = RegistryCall.builder()
                .operation(Operation.TRANSFER)
                .caller("alice")
                .arg("propertyId", 1)
                .arg("newOwner", "bob")
                .build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> pool.add(call));
        assertTrue(ex.getMessage().contains("reason"));
        assertEquals(0, pool.size());
    }

    @Test
    void addRejectsWrongArgumentType() {
        CallPool pool = new CallPool(new CallValidator());
        RegistryCall call = RegistryCall.builder()
                .operation(Operation.VERIFY)
                .caller("inspector")
                .arg("propertyId", "one")
                .arg("notes", "")
                .build();

        assertThrows(IllegalArgumentException.class, () -> pool.add(call));
        assertEquals(0, pool.size());
    }

    @Test
    void addRejectsNumbersThatWouldBeTruncated() {
        CallPool pool = new CallPool(new CallValidator());
        ObjectNode fractionalLevel = JsonNodeFactory.instance.objectNode()
                .put("propertyId", 1)
                .put("accessor", "bank")
                .put("level", 4.5);
        ObjectNode hugeStatus = JsonNodeFactory.instance.objectNode()
                .put("propertyId", 1)
                .put("status", new BigInteger("18446744073709551620"))
                .put("reason", "");
        ObjectNode fractionalAmount = JsonNodeFactory.instance.objectNode()
                .put("propertyId", 1)
                .put("newOwner", "bob")
                .put("reason", "sale")
                .put("amount", 10.25);

        assertThrows(IllegalArgumentException.class, () -> pool.add(call(Operation.GRANT_ACCESS, fractionalLevel)));
        assertThrows(IllegalArgumentException.class, () -> pool.add(call(Operation.CHANGE_STATUS, hugeStatus)));
        assertThrows(IllegalArgumentException.class, () -> pool.add(call(Operation.TRANSFER, fractionalAmount)));
        assertEquals(0, pool.size());
    }

    @Test
    void addRefusesIdsAlreadyExecuted() {
        Set<String> executed = new HashSet<>();
        CallPool pool = new CallPool(new CallValidator(), executed::contains);
        RegistryCall call = verifyCall("inspector", 1, 1_000L);
        executed.add(call.idHex());

        assertFalse(pool.add(call));
        assertTrue(pool.add(verifyCall("inspector", 1, 1_001L)));
        assertEquals(1, pool.size());
    }

    @Test
    void addRejectsOverLengthFields() {
        CallPool pool = new CallPool(new CallValidator());
        RegistryCall longNotes = RegistryCall.builder()
                .operation(Operation.VERIFY)
                .caller("inspector")
                .arg("propertyId", 1)
                .arg("notes", "n".repeat(301))
                .build();
        RegistryCall longCaller = verifyCall("c".repeat(129), 1, 1_000L);

        assertThrows(IllegalArgumentException.class, () -> pool.add(longNotes));
        assertThrows(IllegalArgumentException.class, () -> pool.add(longCaller));
        assertEquals(0, pool.size());
    }

    @Test
    void batchesAreFifoAndRequeueRestoresOrder() {
        CallPool pool = new CallPool(new CallValidator());
        RegistryCall first = verifyCall("a", 1, 1L);
        RegistryCall second = verifyCall("b", 2, 2L);
        RegistryCall third = verifyCall("c", 3, 3L);
        pool.add(first);
        pool.add(second);
        pool.add(third);

        List<RegistryCall> batch = pool.getBatch(2);
        assertEquals(List.of(first, second), batch);
        assertEquals(1, pool.size());

        pool.requeue(batch);
        assertEquals(List.of(first, second, third), pool.getBatch(10));
        assertEquals(0, pool.size());
    }

    @Test
    void callEnvelopeIsValidatedOnBuild() {
        assertThrows(IllegalArgumentException.class, () -> RegistryCall.builder()
                .operation(Operation.VERIFY)
                .caller(" ")
                .build());
        assertThrows(IllegalArgumentException.class, () -> RegistryCall.builder()
                .caller("alice")
                .build());
    }

    private static RegistryCall call(Operation operation, ObjectNode args) {
        return RegistryCall.builder()
                .operation(operation)
                .caller("alice")
                .args(args)
                .timestamp(1_000L)
                .build();
    }

    private static RegistryCall verifyCall(String caller, long propertyId, long timestamp) {
        return RegistryCall.builder()
                .operation(Operation.VERIFY)
                .caller(caller)
                .arg("propertyId", propertyId)
                .arg("notes", "")
                .timestamp(timestamp)
                .build();
    }
}
