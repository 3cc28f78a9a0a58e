package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.query.FromItem;
import com.megaproject.megaproject.query.SqlQuery;

/**
 * Output of one pipeline step: the composed query and the classified schema of its result.
 */
public record ReconciledQuery(SqlQuery query, TableSchema schema) {

    public FromItem as(String alias) {
        return new FromItem.Derived(query, alias);
    }
}
