package io.deedchain.core.mempool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.deedchain.core.protocol.FieldLimits;
import io.deedchain.core.protocol.Operation;
import io.deedchain.core.protocol.RegistryCall;

import java.util.Map;

/**
 * Admission checks for submitted calls. Only the envelope is checked here; business rules
 * are left to the registry, which reports them in the call's receipt.
 */
public class CallValidator {

    private static final Map<String, Integer> MAX_LENGTH = Map.ofEntries(
            Map.entry("title", FieldLimits.MAX_TITLE),
            Map.entry("description", FieldLimits.MAX_DESCRIPTION),
            Map.entry("location", FieldLimits.MAX_LOCATION),
            Map.entry("category", FieldLimits.MAX_CATEGORY),
            Map.entry("areaUnit", FieldLimits.MAX_AREA_UNIT),
            Map.entry("reason", FieldLimits.MAX_REASON),
            Map.entry("notes", FieldLimits.MAX_NOTES),
            Map.entry("hash", FieldLimits.MAX_DOCUMENT_HASH),
            Map.entry("documentType", FieldLimits.MAX_DOCUMENT_TYPE),
            Map.entry("initialOwner", FieldLimits.MAX_PRINCIPAL),
            Map.entry("newOwner", FieldLimits.MAX_PRINCIPAL),
            Map.entry("accessor", FieldLimits.MAX_PRINCIPAL)
    );

    public void validate(RegistryCall call) {
        if (call == null) {
            throw new IllegalArgumentException("Call required");
        }
        if (call.caller().length() > FieldLimits.MAX_PRINCIPAL) {
            throw new IllegalArgumentException("Caller longer than " + FieldLimits.MAX_PRINCIPAL + " characters");
        }
        Operation op = call.operation();
        ObjectNode args = call.args();
        for (String name : op.requiredArgs()) {
            JsonNode arg = args.get(name);
            if (arg == null || arg.isNull()) {
                throw new IllegalArgumentException(op.wireName() + " requires argument '" + name + "'");
            }
            if (isNumeric(name) && !isWholeNumber(arg)) {
                throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
            }
            if (!isNumeric(name) && !arg.isTextual()) {
                throw new IllegalArgumentException("Argument '" + name + "' must be a string");
            }
            Integer max = MAX_LENGTH.get(name);
            if (max != null && arg.asText().length() > max) {
                throw new IllegalArgumentException("Argument '" + name + "' longer than " + max + " characters");
            }
        }
        for (String optional : new String[]{"amount", "expiresAt"}) {
            JsonNode arg = args.get(optional);
            if (arg != null && !arg.isNull() && !isWholeNumber(arg)) {
                throw new IllegalArgumentException("Argument '" + optional + "' must be an integer");
            }
        }
    }

    /** JSON integers within long range; 4.5 or 2^64 would otherwise be truncated when read. */
    private static boolean isWholeNumber(JsonNode arg) {
        return arg.isIntegralNumber() && arg.canConvertToLong();
    }

    private static boolean isNumeric(String argName) {
        switch (argName) {
            case "propertyId":
            case "totalArea":
            case "status":
            case "level":
                return true;
            default:
                return false;
        }
    }
}
