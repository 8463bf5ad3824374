package com.tagstore.query;

/**
 * Represents an aggregation function applied to a column.
 * A {@code null} field means the function takes no argument, e.g. {@code count()}.
 */
public class Aggregation {
    private final String function;
    private final String field;
    private final String alias;

    public Aggregation(String function, String field, String alias) {
        this.function = function;
        this.field = field;
        this.alias = alias;
    }

    public static Aggregation count(String alias) {
        return new Aggregation("count", null, alias);
    }

    public static Aggregation uniq(String field, String alias) {
        return new Aggregation("uniq", field, alias);
    }

    public static Aggregation min(String field, String alias) {
        return new Aggregation("min", field, alias);
    }

    public static Aggregation max(String field, String alias) {
        return new Aggregation("max", field, alias);
    }

    public String getFunction() {
        return function;
    }

    public String getField() {
        return field;
    }

    public String getAlias() {
        if (alias != null) {
            return alias;
        }
        return field != null ? function + "_" + field : function;
    }

    @Override
    public String toString() {
        return function + "(" + (field != null ? field : "") + ") AS " + getAlias();
    }
}
