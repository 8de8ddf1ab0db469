package io.deedchain.core.state;

/**
 * Counter scope. Global counters use property id 0, which is never issued.
 */
public record CounterKey(String scope, long propertyId) {

    public static final KeyCodec<CounterKey> CODEC =
            key -> KeyCodec.stringAndLong(key.scope, key.propertyId);

    public static final CounterKey PROPERTY_ID = global("property-id");
    public static final CounterKey TOTAL_PROPERTIES = global("total-properties");
    public static final CounterKey TOTAL_TRANSFERS = global("total-transfers");
    public static final CounterKey TOTAL_VERIFIED = global("total-verified");

    public static CounterKey global(String scope) {
        return new CounterKey(scope, 0L);
    }

    public static CounterKey transferSeq(long propertyId) {
        return new CounterKey("transfer-seq", propertyId);
    }

    public static CounterKey documentSeq(long propertyId) {
        return new CounterKey("document-seq", propertyId);
    }

    public static CounterKey statusSeq(long propertyId) {
        return new CounterKey("status-seq", propertyId);
    }
}
