package com.tagstore.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine-agnostic description of one analytic query: time range, group-by
 * columns, filters, AND-ed conditions, aggregations, ordering and limit.
 *
 * Filters restrict a column to a set of allowed values. Conditions are free
 * boolean expressions; each top-level entry is AND-ed with the others.
 */
public class TagQuery {
    private final TimeRange timeRange;
    private final List<String> groupBy = new ArrayList<>();
    private final List<Expression> conditions = new ArrayList<>();
    private final Map<String, List<Object>> filters = new LinkedHashMap<>();
    private final List<Aggregation> aggregations = new ArrayList<>();
    private SortField orderBy;
    private int limit = -1;

    public TagQuery(TimeRange timeRange) {
        this.timeRange = timeRange;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public List<String> getGroupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public TagQuery groupBy(String column) {
        groupBy.add(column);
        return this;
    }

    public List<Expression> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public TagQuery where(Expression condition) {
        conditions.add(condition);
        return this;
    }

    public Map<String, List<Object>> getFilters() {
        return Collections.unmodifiableMap(filters);
    }

    public TagQuery filter(String column, Object value) {
        return filter(column, List.of(value));
    }

    public TagQuery filter(String column, Collection<?> values) {
        filters.put(column, new ArrayList<>(values));
        return this;
    }

    public List<Aggregation> getAggregations() {
        return Collections.unmodifiableList(aggregations);
    }

    public TagQuery aggregate(Aggregation aggregation) {
        aggregations.add(aggregation);
        return this;
    }

    public SortField getOrderBy() {
        return orderBy;
    }

    public TagQuery orderBy(SortField orderBy) {
        this.orderBy = orderBy;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    public boolean hasLimit() {
        return limit > 0;
    }

    public TagQuery limit(int limit) {
        this.limit = limit;
        return this;
    }

    @Override
    public String toString() {
        return "TagQuery{timeRange=" + timeRange
            + ", groupBy=" + groupBy
            + ", filters=" + filters
            + ", conditions=" + conditions
            + ", aggregations=" + aggregations
            + ", orderBy=" + orderBy
            + ", limit=" + limit + "}";
    }
}
