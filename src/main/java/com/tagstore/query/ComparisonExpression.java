package com.tagstore.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Represents a comparison expression (field op value).
 *
 * Supported operators are {@code =}, {@code !=}, {@code IN}, {@code IS NULL} and
 * {@code IS NOT NULL}. The value is a list for {@code IN} and {@code null} for the
 * null checks.
 */
public class ComparisonExpression implements Expression {

    public static final String EQ = "=";
    public static final String NEQ = "!=";
    public static final String IN = "IN";
    public static final String IS_NULL = "IS NULL";
    public static final String IS_NOT_NULL = "IS NOT NULL";

    private final String field;
    private final String operator;
    private final Object value;

    public ComparisonExpression(String field, String operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public static ComparisonExpression eq(String field, Object value) {
        return new ComparisonExpression(field, EQ, value);
    }

    public static ComparisonExpression notEq(String field, Object value) {
        return new ComparisonExpression(field, NEQ, value);
    }

    public static ComparisonExpression in(String field, Collection<?> values) {
        return new ComparisonExpression(field, IN, new ArrayList<>(values));
    }

    public static ComparisonExpression isNotNull(String field) {
        return new ComparisonExpression(field, IS_NOT_NULL, null);
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Values of an {@code IN} comparison; empty for any other operator.
     */
    public List<?> getValues() {
        if (value instanceof List) {
            return (List<?>) value;
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonExpression)) return false;
        ComparisonExpression that = (ComparisonExpression) o;
        return field.equals(that.field)
            && operator.equals(that.operator)
            && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return value == null ? field + " " + operator : field + " " + operator + " " + value;
    }
}
