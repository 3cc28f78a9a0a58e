package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.common.SchemaValidationException;
import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.Expressions;
import com.megaproject.megaproject.query.FromItem;
import com.megaproject.megaproject.query.SelectQuery;
import com.megaproject.megaproject.query.SqlQuery;
import com.megaproject.megaproject.query.UnionQuery;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Unions tables with divergent column sets into one column-complete relation.
 *
 * <p>The output carries every column seen in any input, in first-seen order. A table lacking a column
 * contributes a NULL cast to the column's classified type. Every present column is cast to its classified
 * type too, so all branches agree. When a {@code {stem}_date} column appears anywhere without its
 * {@code {stem}_year} partner, the partner is appended NULL-filled, so later steps can rely on the pair.
 */
@Component
public class UnionReconciler {

    public ReconciledQuery reconcile(List<SourceTable> tables, AliasGenerator aliases) {
        return reconcile(tables, null, aliases);
    }

    /**
     * Same as {@link #reconcile(List, AliasGenerator)}, but a table lacking {@code provenanceColumn} fills it
     * with its own table name instead of NULL.
     */
    public ReconciledQuery reconcile(List<SourceTable> tables, String provenanceColumn, AliasGenerator aliases) {
        for (SourceTable table : tables) {
            if (!table.columns().containsAll(ColumnClassifier.PRIMARY_KEYS)) {
                throw new SchemaValidationException(
                        StagingConstants.MSG_PRIMARY_KEY_MISSING.formatted(table.schema(), table.name()));
            }
        }
        if (tables.isEmpty()) {
            return emptyRelation(provenanceColumn);
        }

        TableSchema schema = TableSchema.of(unionColumns(tables, provenanceColumn));
        List<SelectQuery> branches = new ArrayList<>(tables.size());
        for (SourceTable table : tables) {
            branches.add(branch(table, schema, provenanceColumn, aliases.next("src")));
        }
        SqlQuery query = branches.size() == 1 ? branches.get(0) : new UnionQuery(branches);
        return new ReconciledQuery(query, schema);
    }

    private Set<String> unionColumns(List<SourceTable> tables, String provenanceColumn) {
        Set<String> columns = new LinkedHashSet<>();
        for (SourceTable table : tables) {
            columns.addAll(table.columns());
        }
        if (provenanceColumn != null) {
            columns.add(provenanceColumn);
        }
        for (String column : List.copyOf(columns)) {
            if (column.endsWith(ColumnClassifier.DATE_SUFFIX)) {
                String stem = column.substring(0, column.length() - ColumnClassifier.DATE_SUFFIX.length());
                columns.add(stem + ColumnClassifier.YEAR_SUFFIX);
            }
        }
        return columns;
    }

    private SelectQuery branch(SourceTable table, TableSchema schema, String provenanceColumn, String alias) {
        Set<String> present = new HashSet<>(table.columns());
        SelectQuery.Builder builder = SelectQuery.builder()
                .from(new FromItem.Table(table.schema(), table.name(), alias));
        for (ColumnSpec column : schema.columns()) {
            if (present.contains(column.name())) {
                builder.item(Expressions.cast(Expressions.column(alias, column.name()), column.type()), column.name());
            } else if (column.name().equals(provenanceColumn)) {
                builder.item(Expressions.cast(Expressions.literal(table.name()), SemanticType.STRING), column.name());
            } else {
                builder.item(Expressions.typedNull(column.type()), column.name());
            }
        }
        return builder.build();
    }

    /**
     * Typed, zero-row relation with only the key columns, for an asset class with no tables.
     */
    private ReconciledQuery emptyRelation(String provenanceColumn) {
        List<String> columns = new ArrayList<>(ColumnClassifier.PRIMARY_KEYS);
        if (provenanceColumn != null) {
            columns.add(provenanceColumn);
        }
        TableSchema schema = TableSchema.of(columns);
        SelectQuery.Builder builder = SelectQuery.builder()
                .where(Expressions.eq(Expressions.literal(1), Expressions.literal(0)));
        for (ColumnSpec column : schema.columns()) {
            builder.item(Expressions.typedNull(column.type()), column.name());
        }
        return new ReconciledQuery(builder.build(), schema);
    }
}
