package com.megaproject.megaproject.staging;

import java.util.List;

/**
 * Physical table feeding a union: where it lives and which columns it has, in table order.
 */
public record SourceTable(String schema, String name, List<String> columns) {

    public SourceTable {
        columns = List.copyOf(columns);
    }
}
