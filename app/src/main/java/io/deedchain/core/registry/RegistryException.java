package io.deedchain.core.registry;

/**
 * Raised inside an operation to abort it; the registry turns it into an error result
 * at the operation boundary.
 */
public final class RegistryException extends RuntimeException {
    private final RegistryError error;

    public RegistryException(RegistryError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public RegistryError error() {
        return error;
    }
}
