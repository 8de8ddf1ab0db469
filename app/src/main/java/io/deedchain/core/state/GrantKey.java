package io.deedchain.core.state;

import java.util.Comparator;

/** (property, accessor) key of the access grant table. */
public record GrantKey(long propertyId, String accessor) implements Comparable<GrantKey> {

    public static final KeyCodec<GrantKey> CODEC =
            key -> KeyCodec.longAndString(key.propertyId, key.accessor);

    private static final Comparator<GrantKey> ORDER = Comparator
            .comparingLong(GrantKey::propertyId)
            .thenComparing(GrantKey::accessor);

    @Override
    public int compareTo(GrantKey other) {
        return ORDER.compare(this, other);
    }
}
