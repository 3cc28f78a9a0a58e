package com.megaproject.megaproject.query;

/**
 * Join of one additional relation onto a select's FROM item.
 */
public record JoinClause(JoinType type, FromItem item, SqlExpression condition) {

    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public static JoinClause left(FromItem item, SqlExpression condition) {
        return new JoinClause(JoinType.LEFT, item, condition);
    }

    void unparse(SqlWriter writer) {
        writer.append(" ").append(type.keyword()).append(" ");
        item.unparse(writer);
        writer.append(" ON ").expression(condition);
    }
}
