package com.megaproject.megaproject.query;

/**
 * Scalar node of the query IR.
 */
public interface SqlExpression {

    void unparse(SqlWriter writer);
}
