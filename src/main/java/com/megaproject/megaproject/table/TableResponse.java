package com.megaproject.megaproject.table;

import java.util.List;
import java.util.Map;

/**
 * Tabular payload for table reads.
 */
public record TableResponse(String schema, String table, List<String> columns, List<Map<String, String>> rows) {
}
