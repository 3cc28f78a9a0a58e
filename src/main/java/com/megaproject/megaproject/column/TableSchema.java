package com.megaproject.megaproject.column;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, classified column set of one table or intermediate query. Computed once and carried through the
 * pipeline instead of re-deriving types from names at every step.
 */
public final class TableSchema {

    private final Map<String, ColumnSpec> columns;

    private TableSchema(Map<String, ColumnSpec> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static TableSchema of(Collection<String> names) {
        Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        for (String name : names) {
            columns.putIfAbsent(name, ColumnClassifier.describe(name));
        }
        return new TableSchema(columns);
    }

    public static TableSchema fromSpecs(Collection<ColumnSpec> specs) {
        Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        for (ColumnSpec spec : specs) {
            columns.put(spec.name(), spec);
        }
        return new TableSchema(columns);
    }

    public boolean contains(String name) {
        return columns.containsKey(name);
    }

    public ColumnSpec column(String name) {
        return columns.get(name);
    }

    public List<String> names() {
        return List.copyOf(columns.keySet());
    }

    public List<ColumnSpec> columns() {
        return List.copyOf(columns.values());
    }

    public List<ColumnSpec> withRole(ColumnRole role) {
        List<ColumnSpec> matches = new ArrayList<>();
        for (ColumnSpec spec : columns.values()) {
            if (spec.is(role)) {
                matches.add(spec);
            }
        }
        return matches;
    }

    public int size() {
        return columns.size();
    }

    @Override
    public String toString() {
        return "TableSchema" + columns.keySet();
    }
}
