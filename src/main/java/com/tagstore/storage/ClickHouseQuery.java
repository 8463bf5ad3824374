package com.tagstore.storage;

import java.util.Collections;
import java.util.List;

/**
 * ClickHouse SQL text with its positional parameters, in binding order.
 */
public class ClickHouseQuery {

    private final String sql;
    private final List<Object> parameters;

    public ClickHouseQuery(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(parameters);
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
