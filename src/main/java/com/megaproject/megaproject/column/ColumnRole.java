package com.megaproject.megaproject.column;

/**
 * Semantic role a column plays in the staging pipeline, derived from the same naming convention as its type.
 */
public enum ColumnRole {
    PRIMARY_KEY,
    YEAR,
    DATE,
    DURATION,
    COST_LOCAL_AMOUNT,
    COST_LOCAL_CURRENCY,
    COST_LOCAL_YEAR,
    RATIO,
    SOURCE,
    ATTRIBUTE
}
