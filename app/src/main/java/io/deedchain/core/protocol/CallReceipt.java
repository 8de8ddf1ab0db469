package io.deedchain.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.deedchain.core.registry.RegistryError;

/**
 * Outcome of one executed call. Exactly one of {@code value} and {@code error} is non-null.
 */
public record CallReceipt(
        String callId,
        Operation operation,
        String caller,
        long height,
        JsonNode value,
        RegistryError error
) {

    public boolean ok() {
        return error == null;
    }
}
