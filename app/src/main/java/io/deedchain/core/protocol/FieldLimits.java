package io.deedchain.core.protocol;

/** Maximum lengths (in characters) of text fields, and the access level range. */
public final class FieldLimits {
    private FieldLimits(){}

    public static final int MAX_TITLE = 100;
    public static final int MAX_DESCRIPTION = 500;
    public static final int MAX_LOCATION = 200;
    public static final int MAX_CATEGORY = 50;
    public static final int MAX_AREA_UNIT = 20;
    public static final int MAX_REASON = 200;          // transfers and status changes
    public static final int MAX_NOTES = 300;
    public static final int MAX_DOCUMENT_HASH = 64;
    public static final int MAX_DOCUMENT_TITLE = 100;
    public static final int MAX_DOCUMENT_TYPE = 50;
    public static final int MAX_DOCUMENT_DESCRIPTION = 500;
    public static final int MAX_PRINCIPAL = 128;       // account identifiers

    public static final int MIN_ACCESS_LEVEL = 1;
    public static final int MAX_ACCESS_LEVEL = 4;

    public static boolean fits(String value, int max) {
        return value == null || value.length() <= max;
    }

    public static boolean present(String value, int max) {
        return value != null && !value.isEmpty() && value.length() <= max;
    }
}
