package com.megaproject.megaproject.staging;

import java.util.List;

/**
 * Outcome of a stage or promote run.
 */
public record StageResult(String schema, String table, List<String> sourceTables, List<String> columns, long rowCount) {

    public StageResult {
        sourceTables = sourceTables == null ? List.of() : List.copyOf(sourceTables);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
