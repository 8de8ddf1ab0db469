package io.deedchain.core.registry;

/**
 * What the execution environment supplies with every mutating call:
 * the authenticated caller and the current block height.
 */
public record CallContext(String caller, long height) {

    public CallContext {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("caller required");
        }
        if (height < 0) {
            throw new IllegalArgumentException("height must be >= 0");
        }
    }

    public static CallContext of(String caller, long height) {
        return new CallContext(caller, height);
    }
}
