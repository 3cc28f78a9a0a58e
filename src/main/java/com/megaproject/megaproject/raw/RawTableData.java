package com.megaproject.megaproject.raw;

import java.util.List;
import java.util.Map;

/**
 * Parsed source file: sanitized column names plus rows keyed by those names.
 */
public record RawTableData(List<String> columns, List<Map<String, String>> rows) {

    public RawTableData {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
