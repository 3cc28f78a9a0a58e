package com.megaproject.megaproject.query;

import java.util.List;

/**
 * {@code UNION ALL} of column-aligned selects. Branches must project the same column names in the same order.
 */
public record UnionQuery(List<SelectQuery> branches) implements SqlQuery {

    public UnionQuery {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one branch");
        }
        branches = List.copyOf(branches);
        List<String> expected = branches.get(0).columnNames();
        for (SelectQuery branch : branches) {
            if (!branch.columnNames().equals(expected)) {
                throw new IllegalArgumentException("Union branches are not column-aligned: "
                        + expected + " vs " + branch.columnNames());
            }
        }
    }

    @Override
    public List<String> columnNames() {
        return branches.get(0).columnNames();
    }

    @Override
    public void unparse(SqlWriter writer) {
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) {
                writer.append(" UNION ALL ");
            }
            branches.get(i).unparse(writer);
        }
    }
}
