package io.deedchain.core.state;

import java.nio.ByteBuffer;
import java.util.Comparator;

/** (property, per-property sequence number) key for transfers, documents and status changes. */
public record SequenceKey(long propertyId, long sequence) implements Comparable<SequenceKey> {

    public static final KeyCodec<SequenceKey> CODEC = key -> ByteBuffer.allocate(16)
            .putLong(key.propertyId)
            .putLong(key.sequence)
            .array();

    private static final Comparator<SequenceKey> ORDER = Comparator
            .comparingLong(SequenceKey::propertyId)
            .thenComparingLong(SequenceKey::sequence);

    @Override
    public int compareTo(SequenceKey other) {
        return ORDER.compare(this, other);
    }
}
