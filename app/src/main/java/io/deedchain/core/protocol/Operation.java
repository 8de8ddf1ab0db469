package io.deedchain.core.protocol;

import java.util.List;
import java.util.Optional;

/**
 * Mutating registry operations that can be submitted as calls.
 * Each lists the argument names a call must carry.
 */
public enum Operation {
    REGISTER("register",
            List.of("title", "description", "location", "category", "totalArea", "areaUnit", "initialOwner")),
    UPDATE_METADATA("update-metadata",
            List.of("propertyId", "title", "description", "location", "category", "totalArea", "areaUnit")),
    TRANSFER("transfer", List.of("propertyId", "newOwner", "reason")),
    VERIFY("verify", List.of("propertyId", "notes")),
    ADD_DOCUMENT("add-document", List.of("propertyId", "title", "documentType", "hash", "description")),
    CHANGE_STATUS("change-status", List.of("propertyId", "status", "reason")),
    GRANT_ACCESS("grant-access", List.of("propertyId", "accessor", "level")),
    REVOKE_ACCESS("revoke-access", List.of("propertyId", "accessor"));

    private final String wireName;
    private final List<String> requiredArgs;

    Operation(String wireName, List<String> requiredArgs) {
        this.wireName = wireName;
        this.requiredArgs = requiredArgs;
    }

    public String wireName() { return wireName; }
    public List<String> requiredArgs() { return requiredArgs; }

    public static Optional<Operation> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Operation op : values()) {
            if (op.wireName.equals(name)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
