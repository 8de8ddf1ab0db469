package io.deedchain.core.state;

import java.util.Comparator;

/** (owner, property) key of the membership table. */
public record MembershipKey(String owner, long propertyId) implements Comparable<MembershipKey> {

    public static final KeyCodec<MembershipKey> CODEC =
            key -> KeyCodec.stringAndLong(key.owner, key.propertyId);

    private static final Comparator<MembershipKey> ORDER = Comparator
            .comparing(MembershipKey::owner)
            .thenComparingLong(MembershipKey::propertyId);

    @Override
    public int compareTo(MembershipKey other) {
        return ORDER.compare(this, other);
    }
}
