package com.megaproject.megaproject.query;

/**
 * Relation referenced in a FROM or JOIN position.
 */
public interface FromItem {

    String alias();

    void unparse(SqlWriter writer);

    /**
     * Physical table, rendered as {@code "schema"."table" AS "alias"}.
     */
    record Table(String schema, String table, String alias) implements FromItem {

        @Override
        public void unparse(SqlWriter writer) {
            writer.qualified(schema, table).append(" AS ").identifier(alias);
        }
    }

    /**
     * Parenthesized subquery with an alias.
     */
    record Derived(SqlQuery query, String alias) implements FromItem {

        @Override
        public void unparse(SqlWriter writer) {
            writer.append("(").query(query).append(") AS ").identifier(alias);
        }
    }
}
