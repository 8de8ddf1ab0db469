package io.deedchain.core.protocol;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A submitted registry operation: what to run, with which arguments, on whose behalf.
 * The id is SHA-256 over the canonical encoding, so resubmitting the same call is detectable.
 */
public final class RegistryCall {

    private final int version;
    private final Operation operation;
    private final String caller;
    private final ObjectNode args;
    private final long timestamp;
    private final byte[] id;

    private RegistryCall(int version, Operation operation, String caller, ObjectNode args, long timestamp) {
        this.version = version;
        this.operation = operation;
        this.caller = caller;
        this.args = args != null ? args.deepCopy() : JsonNodeFactory.instance.objectNode();
        this.timestamp = timestamp;
        basicValidate();
        this.id = Hashes.sha256(toCanonicalBytes());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = 1;
        private Operation operation;
        private String caller;
        private ObjectNode args = JsonNodeFactory.instance.objectNode();
        private long timestamp = System.currentTimeMillis();

        public Builder version(int v) { this.version = v; return this; }
        public Builder operation(Operation op) { this.operation = op; return this; }
        public Builder caller(String c) { this.caller = c; return this; }
        public Builder args(ObjectNode a) { this.args = a != null ? a.deepCopy() : JsonNodeFactory.instance.objectNode(); return this; }
        public Builder arg(String name, String value) { this.args.put(name, value); return this; }
        public Builder arg(String name, long value) { this.args.put(name, value); return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }

        public RegistryCall build() {
            return new RegistryCall(version, operation, caller, args, timestamp);
        }
    }

    // -------------------- getters --------------------
    public int version() { return version; }
    public Operation operation() { return operation; }
    public String caller() { return caller; }
    public ObjectNode args() { return args.deepCopy(); }
    public long timestamp() { return timestamp; }
    public byte[] id() { return id.clone(); }
    public String idHex() { return Hashes.toHex(id); }

    public byte[] toCanonicalBytes() {
        byte[] op = operation.wireName().getBytes(StandardCharsets.UTF_8);
        byte[] who = caller.getBytes(StandardCharsets.UTF_8);
        byte[] body = args.toString().getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + (4 + op.length) + (4 + who.length) + (4 + body.length) + 8);
        buf.putInt(version);
        buf.putInt(op.length).put(op);
        buf.putInt(who.length).put(who);
        buf.putInt(body.length).put(body);
        buf.putLong(timestamp);
        return buf.array();
    }

    public void basicValidate() {
        if (version != 1) throw new IllegalArgumentException("Unsupported version: " + version);
        if (operation == null) throw new IllegalArgumentException("Missing operation");
        if (caller == null || caller.isBlank()) throw new IllegalArgumentException("Missing caller");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
    }

    @Override
    public String toString() {
        return "RegistryCall(" + operation.wireName() + " by " + caller + ", id=" + idHex().substring(0, 8) + ")";
    }
}
