package com.megaproject.megaproject.raw;

import java.util.List;

/**
 * Outcome of loading one raw table.
 */
public record RawLoadResult(String assetClass, String schema, String table, List<String> columns, int loadedRows) {

    public RawLoadResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
