package com.megaproject.megaproject.query;

/**
 * One projected expression and its output column name.
 */
public record SelectItem(SqlExpression expression, String alias) {
}
