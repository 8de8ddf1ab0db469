package io.deedchain.core.model;

public record StatusChange(
        PropertyStatus oldStatus,
        PropertyStatus newStatus,
        long changedAt,
        String changedBy,
        String reason
) {
}
