package com.megaproject.megaproject.query;

/**
 * Accumulates SQL text for one render pass, delegating dialect-specific fragments to {@link SqlDialect}.
 */
public final class SqlWriter {

    private final SqlDialect dialect;
    private final StringBuilder sql = new StringBuilder();

    public SqlWriter(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public SqlWriter append(String text) {
        sql.append(text);
        return this;
    }

    public SqlWriter identifier(String name) {
        sql.append(dialect.quoteIdentifier(name));
        return this;
    }

    public SqlWriter qualified(String qualifier, String name) {
        if (qualifier != null) {
            identifier(qualifier).append(".");
        }
        return identifier(name);
    }

    public SqlWriter expression(SqlExpression expression) {
        expression.unparse(this);
        return this;
    }

    public SqlWriter query(SqlQuery query) {
        query.unparse(this);
        return this;
    }

    public String toSql() {
        return sql.toString();
    }
}
