package com.megaproject.megaproject.column;

/**
 * Classified column metadata: name, storage type and pipeline role.
 */
public record ColumnSpec(String name, SemanticType type, ColumnRole role) {

    public boolean is(ColumnRole expected) {
        return role == expected;
    }
}
