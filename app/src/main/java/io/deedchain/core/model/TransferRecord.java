package io.deedchain.core.model;

import java.util.OptionalLong;

/**
 * One entry of a property's transfer history. The amount is informational only.
 */
public record TransferRecord(
        String fromOwner,
        String toOwner,
        long transferredAt,
        String reason,
        OptionalLong amount
) {
}
