package io.deedchain.core.registry;

/** Policy switches of the registry. */
public final class RegistryConfig {
    /** When set, only the current owner may change a property's status. */
    public final boolean statusChangeRequiresOwner;
    /** When set, grants past their expiry height no longer satisfy access checks. */
    public final boolean enforceGrantExpiry;

    public RegistryConfig(boolean statusChangeRequiresOwner, boolean enforceGrantExpiry) {
        this.statusChangeRequiresOwner = statusChangeRequiresOwner;
        this.enforceGrantExpiry = enforceGrantExpiry;
    }

    public static RegistryConfig defaults() {
        return new RegistryConfig(
                false,   // open status changes
                true     // expiry is enforced
        );
    }

    public RegistryConfig withStatusChangeRequiresOwner(boolean value) {
        return new RegistryConfig(value, this.enforceGrantExpiry);
    }

    public RegistryConfig withEnforceGrantExpiry(boolean value) {
        return new RegistryConfig(this.statusChangeRequiresOwner, value);
    }

    @Override
    public String toString() {
        return "RegistryConfig{statusChangeRequiresOwner=" + statusChangeRequiresOwner
                + ", enforceGrantExpiry=" + enforceGrantExpiry + "}";
    }
}
