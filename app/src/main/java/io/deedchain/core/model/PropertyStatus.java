package io.deedchain.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of a registered property.
 *
 * <pre>
 *   ACTIVE    -> PENDING, SUSPENDED, ARCHIVED, ACTIVE
 *   PENDING   -> ACTIVE, SUSPENDED
 *   SUSPENDED -> ACTIVE, ARCHIVED
 *   ARCHIVED  -> (terminal)
 * </pre>
 *
 * Codes are stable and used on the wire.
 */
public enum PropertyStatus {
    ACTIVE(1),
    PENDING(2),
    SUSPENDED(3),
    ARCHIVED(4);

    private static final Map<PropertyStatus, Set<PropertyStatus>> ALLOWED_TRANSITIONS = Map.of(
            ACTIVE, EnumSet.of(PENDING, SUSPENDED, ARCHIVED, ACTIVE),
            PENDING, EnumSet.of(ACTIVE, SUSPENDED),
            SUSPENDED, EnumSet.of(ACTIVE, ARCHIVED),
            ARCHIVED, EnumSet.noneOf(PropertyStatus.class)
    );

    private final int code;

    PropertyStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean canTransitionTo(PropertyStatus target) {
        return target != null && ALLOWED_TRANSITIONS.get(this).contains(target);
    }

    public Set<PropertyStatus> allowedTransitions() {
        return Collections.unmodifiableSet(ALLOWED_TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return ALLOWED_TRANSITIONS.get(this).isEmpty();
    }

    public static Optional<PropertyStatus> fromCode(long code) {
        for (PropertyStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
