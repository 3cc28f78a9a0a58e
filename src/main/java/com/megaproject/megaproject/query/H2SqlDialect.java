package com.megaproject.megaproject.query;

/**
 * H2 rendering, used by the integration tests with H2 running in PostgreSQL compatibility mode.
 */
public class H2SqlDialect extends SqlDialect {

    @Override
    public String productName() {
        return "H2";
    }

    @Override
    public void unparseDateFromYear(SqlWriter writer, SqlExpression year, int month, int day) {
        writer.append("CAST(CAST(").expression(year).append(" AS VARCHAR) || '")
                .append("-%02d-%02d".formatted(month, day)).append("' AS DATE)");
    }

    @Override
    public void unparseDaysBetween(SqlWriter writer, SqlExpression start, SqlExpression end) {
        writer.append("DATEDIFF(DAY, ").expression(start).append(", ").expression(end).append(")");
    }
}
