package com.megaproject.megaproject.query;

import java.util.List;

/**
 * Relational node of the query IR: a plain select or a union of selects.
 */
public interface SqlQuery {

    List<String> columnNames();

    void unparse(SqlWriter writer);
}
