package io.deedchain.core.registry;

import java.util.Optional;

/**
 * Error kinds returned by registry operations. Codes are stable.
 */
public enum RegistryError {
    UNAUTHORIZED(1001),
    PROPERTY_NOT_FOUND(1002),
    INVALID_OWNER(1003),
    INVALID_PROPERTY_DATA(1005),
    TRANSFER_NOT_FOUND(1006),
    ALREADY_VERIFIED(1007),
    INVALID_STATUS(1008),
    INVALID_ACCESS_LEVEL(1009),
    DOCUMENT_NOT_FOUND(1010),
    GRANT_NOT_FOUND(1011),
    STATUS_CHANGE_NOT_FOUND(1012);

    private final int code;

    RegistryError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isNotFound() {
        return this == PROPERTY_NOT_FOUND
                || this == TRANSFER_NOT_FOUND
                || this == DOCUMENT_NOT_FOUND
                || this == GRANT_NOT_FOUND
                || this == STATUS_CHANGE_NOT_FOUND;
    }

    public static Optional<RegistryError> fromCode(int code) {
        for (RegistryError error : values()) {
            if (error.code == code) {
                return Optional.of(error);
            }
        }
        return Optional.empty();
    }
}
