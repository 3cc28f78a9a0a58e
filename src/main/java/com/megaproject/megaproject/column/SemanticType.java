package com.megaproject.megaproject.column;

import com.megaproject.megaproject.common.SchemaValidationException;

import java.sql.Types;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Storage type a column carries in every raw, staged and production table.
 */
public enum SemanticType {

    INTEGER(Types.INTEGER),
    BOOLEAN(Types.BOOLEAN),
    DATE(Types.DATE),
    FLOAT(Types.DOUBLE),
    STRING(Types.VARCHAR);

    private static final Set<String> TRUE_VALUES = Set.of("y", "yes", "t", "true", "on", "1");

    private final int jdbcType;

    SemanticType(int jdbcType) {
        this.jdbcType = jdbcType;
    }

    public int jdbcType() {
        return jdbcType;
    }

    /**
     * Converts one source cell into the JDBC value bound for this type. Blank cells become {@code null}.
     */
    public Object parse(String column, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return switch (this) {
                case INTEGER -> Integer.valueOf(value);
                case BOOLEAN -> TRUE_VALUES.contains(value.toLowerCase(Locale.ROOT));
                case DATE -> java.sql.Date.valueOf(LocalDate.parse(value));
                case FLOAT -> Double.valueOf(value);
                case STRING -> value;
            };
        } catch (NumberFormatException | DateTimeParseException ex) {
            throw new SchemaValidationException(
                    "Invalid value '%s' for column %s, expected %s%s".formatted(
                            value, column, name(), this == DATE ? " (yyyy-MM-dd)" : ""),
                    ex);
        }
    }
}
