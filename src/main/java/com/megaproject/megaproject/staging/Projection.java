package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.query.Expressions;
import com.megaproject.megaproject.query.SelectItem;
import com.megaproject.megaproject.query.SqlExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered select list under construction. Replacing a column keeps its position; new columns append.
 */
final class Projection {

    private final Map<String, SqlExpression> expressions = new LinkedHashMap<>();
    private final Map<String, ColumnSpec> specs = new LinkedHashMap<>();

    static Projection passThrough(TableSchema schema, String alias) {
        Projection projection = new Projection();
        for (ColumnSpec spec : schema.columns()) {
            projection.expressions.put(spec.name(), Expressions.column(alias, spec.name()));
            projection.specs.put(spec.name(), spec);
        }
        return projection;
    }

    void put(String name, SqlExpression expression) {
        expressions.put(name, expression);
        specs.putIfAbsent(name, ColumnClassifier.describe(name));
    }

    boolean contains(String name) {
        return expressions.containsKey(name);
    }

    List<SelectItem> items() {
        List<SelectItem> items = new ArrayList<>(expressions.size());
        expressions.forEach((name, expression) -> items.add(new SelectItem(expression, name)));
        return items;
    }

    TableSchema schema() {
        return TableSchema.fromSpecs(specs.values());
    }
}
