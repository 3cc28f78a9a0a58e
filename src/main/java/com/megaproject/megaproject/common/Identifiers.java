package com.megaproject.megaproject.common;

import java.util.regex.Pattern;

/**
 * Guards every identifier that ends up in dynamic SQL.
 */
public final class Identifiers {

    /**
     * Separator reserved for internal tables. Asset-class and table names never contain it.
     */
    public static final String RESERVED_SEPARATOR = "__";
    public static final String BUILD_SUFFIX = RESERVED_SEPARATOR + "build";

    private static final Pattern VALID_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final int MAX_LENGTH = 63;
    // a build table name must still fit the engine's identifier limit
    private static final int MAX_TABLE_NAME_LENGTH = MAX_LENGTH - BUILD_SUFFIX.length();

    private Identifiers() {
    }

    public static String requireValid(String value, String kind) {
        if (value == null || value.length() > MAX_LENGTH || !VALID_IDENTIFIER.matcher(value).matches()) {
            throw new SchemaValidationException(
                    "Invalid %s name: '%s'. Use lowercase letters, digits and underscores.".formatted(kind, value));
        }
        return value;
    }

    /**
     * Validates an asset-class or raw table name, which may later be materialized next to its build table.
     */
    public static String requireTableName(String value, String kind) {
        requireValid(value, kind);
        if (value.contains(RESERVED_SEPARATOR)) {
            throw new SchemaValidationException(
                    "Invalid %s name: '%s'. '%s' is reserved.".formatted(kind, value, RESERVED_SEPARATOR));
        }
        if (value.length() > MAX_TABLE_NAME_LENGTH) {
            throw new SchemaValidationException("Invalid %s name: '%s'. At most %d characters are allowed."
                    .formatted(kind, value, MAX_TABLE_NAME_LENGTH));
        }
        return value;
    }
}
