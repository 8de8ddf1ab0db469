package io.deedchain.core.model;

import java.util.OptionalLong;

/**
 * Delegated permission on a property. Levels run from 1 (broadest) to 4.
 * Revocation clears {@code active}; the record itself is kept.
 */
public record AccessGrant(
        int level,
        String grantedBy,
        long grantedAt,
        OptionalLong expiresAt,
        boolean active
) {

    public AccessGrant revoked() {
        return new AccessGrant(level, grantedBy, grantedAt, expiresAt, false);
    }

    /** A grant stays usable through its expiry height and lapses after it. */
    public boolean expiredAt(long height) {
        return expiresAt.isPresent() && height > expiresAt.getAsLong();
    }
}
