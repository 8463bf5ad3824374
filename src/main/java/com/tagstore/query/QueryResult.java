package com.tagstore.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tabular result of one analytic query.
 *
 * Each row maps column labels (group-by aliases and aggregation aliases) to
 * values. Two views match the shapes callers expect from the engine: a scalar
 * for queries without group-by, and rows keyed by the leading group-by column,
 * kept in engine order.
 */
public class QueryResult {

    private final List<String> groupBy;
    private final List<String> aggregationAliases;
    private final List<Map<String, Object>> rows;
    private long executionTimeMs;

    public QueryResult(TagQuery query, List<Map<String, Object>> rows) {
        this.groupBy = new ArrayList<>(query.getGroupBy());
        this.aggregationAliases = new ArrayList<>();
        for (Aggregation aggregation : query.getAggregations()) {
            aggregationAliases.add(aggregation.getAlias());
        }
        this.rows = rows != null ? rows : new ArrayList<>();
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    /**
     * First row, if the engine returned any.
     */
    public Optional<Map<String, Object>> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Value of the first aggregation in the first row. Empty when the engine
     * returned no rows at all, which is distinct from a row holding zero.
     */
    public Optional<Object> scalar() {
        if (aggregationAliases.isEmpty()) {
            throw new IllegalStateException("Query has no aggregations to read a scalar from");
        }
        return firstRow().map(row -> row.get(aggregationAliases.get(0)));
    }

    /**
     * Rows keyed by the value of the leading group-by column.
     */
    public Map<Object, Map<String, Object>> byGroup() {
        if (groupBy.isEmpty()) {
            throw new IllegalStateException("Query has no group-by column to key rows by");
        }
        String column = groupBy.get(0);
        Map<Object, Map<String, Object>> keyed = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            keyed.put(row.get(column), row);
        }
        return keyed;
    }
}
