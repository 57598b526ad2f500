package com.lineage.core.persistence;

/**
 * Filter, paging and ordering for conversation listings. Sort columns and
 * directions are closed enums so no caller text reaches the ORDER BY clause.
 */
public record ConversationQuery(
    String userId,
    String resourceId,
    int limit,
    int offset,
    SortColumn orderBy,
    SortDirection direction
) {
    public static final int DEFAULT_LIMIT = 50;

    public ConversationQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        offset = Math.max(0, offset);
        orderBy = orderBy == null ? SortColumn.UPDATED_AT : orderBy;
        direction = direction == null ? SortDirection.DESC : direction;
    }

    public static ConversationQuery all() {
        return new ConversationQuery(null, null, DEFAULT_LIMIT, 0, null, null);
    }

    public ConversationQuery forUser(String user) {
        return new ConversationQuery(user, resourceId, limit, offset, orderBy, direction);
    }

    public ConversationQuery forResource(String resource) {
        return new ConversationQuery(userId, resource, limit, offset, orderBy, direction);
    }

    public ConversationQuery page(int newLimit, int newOffset) {
        return new ConversationQuery(userId, resourceId, newLimit, newOffset, orderBy, direction);
    }

    public ConversationQuery sortedBy(SortColumn column, SortDirection newDirection) {
        return new ConversationQuery(userId, resourceId, limit, offset, column, newDirection);
    }

    public enum SortColumn {
        CREATED_AT("created_at"),
        UPDATED_AT("updated_at"),
        TITLE("title");

        private final String column;

        SortColumn(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }
    }

    public enum SortDirection { ASC, DESC }
}
