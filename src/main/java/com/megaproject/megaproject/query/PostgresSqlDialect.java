package com.megaproject.megaproject.query;

/**
 * PostgreSQL rendering. Date subtraction yields whole days natively.
 */
public class PostgresSqlDialect extends SqlDialect {

    @Override
    public String productName() {
        return "PostgreSQL";
    }

    @Override
    public void unparseDateFromYear(SqlWriter writer, SqlExpression year, int month, int day) {
        writer.append("MAKE_DATE(").expression(year).append(", " + month + ", " + day + ")");
    }

    @Override
    public void unparseDaysBetween(SqlWriter writer, SqlExpression start, SqlExpression end) {
        writer.append("(CAST(").expression(end).append(" AS DATE) - CAST(")
                .expression(start).append(" AS DATE))");
    }
}
