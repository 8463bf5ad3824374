package com.tagstore.query;

/**
 * Represents a sort field with order
 */
public class SortField {
    private final String field;
    private final String order;

    public SortField(String field, String order) {
        this.field = field;
        this.order = order;
    }

    public static SortField asc(String field) {
        return new SortField(field, "asc");
    }

    public static SortField desc(String field) {
        return new SortField(field, "desc");
    }

    public String getField() {
        return field;
    }

    public String getOrder() {
        return order;
    }

    public boolean isAscending() {
        return "asc".equalsIgnoreCase(order);
    }

    @Override
    public String toString() {
        return (isAscending() ? "" : "-") + field;
    }
}
