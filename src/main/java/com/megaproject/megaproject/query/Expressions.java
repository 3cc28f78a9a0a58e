package com.megaproject.megaproject.query;

import com.megaproject.megaproject.column.SemanticType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scalar IR nodes and their factory methods. Binary operators always render parenthesized so composed
 * expressions never depend on operator precedence.
 */
public final class Expressions {

    public static final SqlExpression NULL = new Literal(null);

    private Expressions() {
    }

    public static SqlExpression column(String qualifier, String name) {
        return new ColumnRef(qualifier, name);
    }

    public static SqlExpression literal(Object value) {
        return new Literal(value);
    }

    public static SqlExpression cast(SqlExpression operand, SemanticType type) {
        return new Cast(operand, type);
    }

    public static SqlExpression typedNull(SemanticType type) {
        return new Cast(NULL, type);
    }

    public static SqlExpression isNull(SqlExpression operand) {
        return new NullTest(operand, false);
    }

    public static SqlExpression isNotNull(SqlExpression operand) {
        return new NullTest(operand, true);
    }

    public static SqlExpression and(SqlExpression left, SqlExpression right) {
        return new Binary("AND", left, right);
    }

    public static SqlExpression eq(SqlExpression left, SqlExpression right) {
        return new Binary("=", left, right);
    }

    public static SqlExpression multiply(SqlExpression left, SqlExpression right) {
        return new Binary("*", left, right);
    }

    public static SqlExpression divide(SqlExpression left, SqlExpression right) {
        return new Binary("/", left, right);
    }

    /**
     * Division that yields NULL instead of failing when the denominator is zero.
     */
    public static SqlExpression safeDivide(SqlExpression numerator, SqlExpression denominator) {
        return divide(numerator, call("NULLIF", denominator, literal(0)));
    }

    public static SqlExpression call(String function, SqlExpression... operands) {
        return new Call(function, Arrays.asList(operands));
    }

    public static SqlExpression call(String function, List<SqlExpression> operands) {
        return new Call(function, operands);
    }

    public static CaseBuilder when(SqlExpression condition, SqlExpression result) {
        return new CaseBuilder().when(condition, result);
    }

    public static SqlExpression yearOf(SqlExpression date) {
        return new YearOf(date);
    }

    public static SqlExpression dateFromYear(SqlExpression year, int month, int day) {
        return new DateFromYear(year, month, day);
    }

    public static SqlExpression daysBetween(SqlExpression start, SqlExpression end) {
        return new DaysBetween(start, end);
    }

    public static SqlExpression scalar(SqlQuery query) {
        return new ScalarQuery(query);
    }

    public record ColumnRef(String qualifier, String name) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.qualified(qualifier, name);
        }
    }

    public record Literal(Object value) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            if (value == null) {
                writer.append("NULL");
            } else if (value instanceof String text) {
                writer.append("'").append(text.replace("'", "''")).append("'");
            } else if (value instanceof Boolean flag) {
                writer.append(flag ? "TRUE" : "FALSE");
            } else if (value instanceof Double || value instanceof Float) {
                writer.append(BigDecimal.valueOf(((Number) value).doubleValue()).toPlainString());
            } else if (value instanceof Number) {
                writer.append(value.toString());
            } else {
                throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
            }
        }
    }

    public record Cast(SqlExpression operand, SemanticType type) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.append("CAST(").expression(operand).append(" AS ")
                    .append(writer.dialect().typeName(type)).append(")");
        }
    }

    public record NullTest(SqlExpression operand, boolean negated) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.expression(operand).append(negated ? " IS NOT NULL" : " IS NULL");
        }
    }

    public record Binary(String operator, SqlExpression left, SqlExpression right) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.append("(").expression(left).append(" ").append(operator).append(" ")
                    .expression(right).append(")");
        }
    }

    public record Call(String function, List<SqlExpression> operands) implements SqlExpression {

        public Call {
            operands = List.copyOf(operands);
        }

        @Override
        public void unparse(SqlWriter writer) {
            writer.append(function).append("(");
            for (int i = 0; i < operands.size(); i++) {
                if (i > 0) {
                    writer.append(", ");
                }
                writer.expression(operands.get(i));
            }
            writer.append(")");
        }
    }

    public record WhenClause(SqlExpression condition, SqlExpression result) {
    }

    public record Case(List<WhenClause> whens, SqlExpression otherwise) implements SqlExpression {

        public Case {
            whens = List.copyOf(whens);
        }

        @Override
        public void unparse(SqlWriter writer) {
            writer.append("CASE");
            for (WhenClause when : whens) {
                writer.append(" WHEN ").expression(when.condition())
                        .append(" THEN ").expression(when.result());
            }
            if (otherwise != null) {
                writer.append(" ELSE ").expression(otherwise);
            }
            writer.append(" END");
        }
    }

    public record YearOf(SqlExpression date) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.dialect().unparseYearOf(writer, date);
        }
    }

    public record DateFromYear(SqlExpression year, int month, int day) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.dialect().unparseDateFromYear(writer, year, month, day);
        }
    }

    public record DaysBetween(SqlExpression start, SqlExpression end) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.dialect().unparseDaysBetween(writer, start, end);
        }
    }

    public record ScalarQuery(SqlQuery query) implements SqlExpression {

        @Override
        public void unparse(SqlWriter writer) {
            writer.append("(").query(query).append(")");
        }
    }

    public static final class CaseBuilder {

        private final List<WhenClause> whens = new ArrayList<>();

        private CaseBuilder() {
        }

        public CaseBuilder when(SqlExpression condition, SqlExpression result) {
            whens.add(new WhenClause(condition, result));
            return this;
        }

        public SqlExpression otherwise(SqlExpression result) {
            return new Case(whens, result);
        }
    }
}
