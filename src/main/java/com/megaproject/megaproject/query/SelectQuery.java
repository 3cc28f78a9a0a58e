package com.megaproject.megaproject.query;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code SELECT items [FROM from] [joins] [WHERE where]}. A select without FROM is allowed and is used for the
 * empty, typed relation an asset class without tables stages to.
 */
public record SelectQuery(List<SelectItem> items, FromItem from, List<JoinClause> joins, SqlExpression where)
        implements SqlQuery {

    public SelectQuery {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("A select needs at least one item");
        }
        items = List.copyOf(items);
        joins = joins == null ? List.of() : List.copyOf(joins);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> columnNames() {
        return items.stream().map(SelectItem::alias).toList();
    }

    @Override
    public void unparse(SqlWriter writer) {
        writer.append("SELECT ");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                writer.append(", ");
            }
            SelectItem item = items.get(i);
            writer.expression(item.expression()).append(" AS ").identifier(item.alias());
        }
        if (from != null) {
            writer.append(" FROM ");
            from.unparse(writer);
        }
        for (JoinClause join : joins) {
            join.unparse(writer);
        }
        if (where != null) {
            writer.append(" WHERE ").expression(where);
        }
    }

    public static final class Builder {

        private final List<SelectItem> items = new ArrayList<>();
        private final List<JoinClause> joins = new ArrayList<>();
        private FromItem from;
        private SqlExpression where;

        private Builder() {
        }

        public Builder item(SqlExpression expression, String alias) {
            items.add(new SelectItem(expression, alias));
            return this;
        }

        public Builder items(List<SelectItem> selectItems) {
            items.addAll(selectItems);
            return this;
        }

        public Builder from(FromItem fromItem) {
            this.from = fromItem;
            return this;
        }

        public Builder join(JoinClause join) {
            joins.add(join);
            return this;
        }

        public Builder where(SqlExpression condition) {
            this.where = condition;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(items, from, joins, where);
        }
    }
}
