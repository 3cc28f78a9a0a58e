package com.megaproject.megaproject.query;

import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the query IR and the DDL of the staging engine for one relational engine. Identifiers are always
 * quoted, so names that collide with keywords ({@code year}, {@code value}) need no special handling.
 */
public abstract class SqlDialect {

    public abstract String productName();

    /**
     * Renders a date built from an integer year plus a fixed month and day.
     */
    public abstract void unparseDateFromYear(SqlWriter writer, SqlExpression year, int month, int day);

    /**
     * Renders the whole number of days from {@code start} to {@code end}.
     */
    public abstract void unparseDaysBetween(SqlWriter writer, SqlExpression start, SqlExpression end);

    public void unparseYearOf(SqlWriter writer, SqlExpression date) {
        writer.append("CAST(EXTRACT(YEAR FROM ").expression(date).append(") AS ")
                .append(typeName(SemanticType.INTEGER)).append(")");
    }

    public String typeName(SemanticType type) {
        return switch (type) {
            case INTEGER -> "INTEGER";
            case BOOLEAN -> "BOOLEAN";
            case DATE -> "DATE";
            case FLOAT -> "DOUBLE PRECISION";
            case STRING -> "VARCHAR";
        };
    }

    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public String qualify(String schema, String table) {
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }

    public String render(SqlQuery query) {
        return new SqlWriter(this).query(query).toSql();
    }

    public String createSchemaIfNotExists(String schema) {
        return "CREATE SCHEMA IF NOT EXISTS " + quoteIdentifier(schema);
    }

    public String createTable(String schema, String table, TableSchema columns, List<String> primaryKey) {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(qualify(schema, table)).append(" (");
        for (ColumnSpec column : columns.columns()) {
            sql.append(quoteIdentifier(column.name())).append(' ').append(typeName(column.type()));
            if (primaryKey.contains(column.name())) {
                sql.append(" NOT NULL");
            }
            sql.append(", ");
        }
        return sql.append("PRIMARY KEY (").append(quoteAll(primaryKey)).append("))").toString();
    }

    public String createTableAs(String schema, String table, SqlQuery query) {
        return "CREATE TABLE " + qualify(schema, table) + " AS " + render(query);
    }

    public String dropTableIfExists(String schema, String table) {
        return "DROP TABLE IF EXISTS " + qualify(schema, table);
    }

    public String renameTable(String schema, String from, String to) {
        return "ALTER TABLE " + qualify(schema, from) + " RENAME TO " + quoteIdentifier(to);
    }

    public String setNotNull(String schema, String table, String column) {
        return "ALTER TABLE " + qualify(schema, table) + " ALTER COLUMN " + quoteIdentifier(column) + " SET NOT NULL";
    }

    public String addPrimaryKey(String schema, String table, List<String> columns) {
        return "ALTER TABLE " + qualify(schema, table) + " ADD PRIMARY KEY (" + quoteAll(columns) + ")";
    }

    public String insert(String schema, String table, List<String> columns) {
        return "INSERT INTO " + qualify(schema, table) + " (" + quoteAll(columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
    }

    public String deleteAll(String schema, String table) {
        return "DELETE FROM " + qualify(schema, table);
    }

    public String selectAll(String schema, String table, List<String> orderBy) {
        String sql = "SELECT * FROM " + qualify(schema, table);
        return orderBy.isEmpty() ? sql : sql + " ORDER BY " + quoteAll(orderBy);
    }

    public String selectByKey(String schema, String table, List<String> keyColumns) {
        return "SELECT * FROM " + qualify(schema, table) + " WHERE " + keyPredicate(keyColumns);
    }

    /**
     * {@code UPDATE} binding {@code columns} first and {@code keyColumns} after them.
     */
    public String updateByKey(String schema, String table, List<String> columns, List<String> keyColumns) {
        return "UPDATE " + qualify(schema, table) + " SET " + columns.stream()
                .map(column -> quoteIdentifier(column) + " = ?")
                .collect(Collectors.joining(", "))
                + " WHERE " + keyPredicate(keyColumns);
    }

    public String deleteByKey(String schema, String table, List<String> keyColumns) {
        return "DELETE FROM " + qualify(schema, table) + " WHERE " + keyPredicate(keyColumns);
    }

    public String selectFirstRow(String schema, String table) {
        return "SELECT * FROM " + qualify(schema, table) + " LIMIT 1";
    }

    public String countRows(String schema, String table) {
        return "SELECT COUNT(*) FROM " + qualify(schema, table);
    }

    private String keyPredicate(List<String> keyColumns) {
        return keyColumns.stream()
                .map(column -> quoteIdentifier(column) + " = ?")
                .collect(Collectors.joining(" AND "));
    }

    private String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
