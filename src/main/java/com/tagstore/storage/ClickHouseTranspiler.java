package com.tagstore.storage;

import com.tagstore.query.Aggregation;
import com.tagstore.query.Columns;
import com.tagstore.query.ComparisonExpression;
import com.tagstore.query.Expression;
import com.tagstore.query.OrExpression;
import com.tagstore.query.QueryExecutionException;
import com.tagstore.query.SortField;
import com.tagstore.query.TagQuery;
import com.tagstore.query.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Transpiles tag store query descriptors to parameterised ClickHouse SQL.
 *
 * Tags are stored as the parallel arrays {@code tags.key} / {@code tags.value}.
 * A single tag column {@code tags[k]} reads the value at the index of {@code k};
 * the per-pair columns {@code tags_key} / {@code tags_value} come from an
 * {@code ARRAY JOIN} over both arrays. Every literal is bound as a parameter.
 */
@Component
public class ClickHouseTranspiler {

    private static final Logger logger = LoggerFactory.getLogger(ClickHouseTranspiler.class);

    private static final DateTimeFormatter DATETIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern FUNCTION = Pattern.compile("[A-Za-z]+(\\(\\d+\\))?");

    private static final String ISSUE_COLUMN = "group_id";
    private static final String ARRAY_JOIN = " ARRAY JOIN tags.key AS tags_key, tags.value AS tags_value";

    private final String table;

    public ClickHouseTranspiler(@Value("${tagstore.clickhouse.events-table:events}") String table) {
        if (!IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid events table name: " + table);
        }
        this.table = table;
    }

    /**
     * Transpile a descriptor to ClickHouse SQL
     *
     * @throws QueryExecutionException if the descriptor cannot be expressed as SQL
     */
    public ClickHouseQuery transpile(TagQuery query) {
        if (query.getGroupBy().isEmpty() && query.getAggregations().isEmpty()) {
            throw new QueryExecutionException("Query selects neither group-by columns nor aggregations",
                query.toString());
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();

        // SELECT clause
        sql.append("SELECT ");
        sql.append(buildSelect(query, params));

        // FROM clause
        sql.append(" FROM ").append(table);
        if (usesTagPairs(query)) {
            sql.append(ARRAY_JOIN);
        }

        // WHERE clause
        sql.append(" WHERE ");
        sql.append(buildWhereClause(query, params));

        // GROUP BY clause
        if (!query.getGroupBy().isEmpty()) {
            List<String> aliases = new ArrayList<>();
            for (String column : query.getGroupBy()) {
                aliases.add(quoteAlias(column));
            }
            sql.append(" GROUP BY ").append(String.join(", ", aliases));
        }

        // ORDER BY clause
        if (query.getOrderBy() != null) {
            sql.append(" ORDER BY ").append(buildOrderBy(query));
        }

        // LIMIT clause
        if (query.hasLimit()) {
            sql.append(" LIMIT ").append(query.getLimit());
        }

        ClickHouseQuery transpiled = new ClickHouseQuery(sql.toString(), params);
        logger.debug("Transpiled query: {}", transpiled);
        return transpiled;
    }

    private String buildSelect(TagQuery query, List<Object> params) {
        List<String> select = new ArrayList<>();

        // Group by columns first, labelled with their logical names
        for (String column : query.getGroupBy()) {
            select.add(resolveColumn(column, params) + " AS " + quoteAlias(column));
        }

        for (Aggregation aggregation : query.getAggregations()) {
            select.add(buildAggregationFunction(aggregation, params));
        }
        return String.join(", ", select);
    }

    private String buildAggregationFunction(Aggregation aggregation, List<Object> params) {
        String function = aggregation.getFunction();
        if (!FUNCTION.matcher(function).matches()) {
            throw new QueryExecutionException("Unsupported aggregation function: " + function);
        }
        String alias = aggregation.getAlias();
        requireIdentifier(alias);
        String argument = aggregation.getField() != null ? resolveColumn(aggregation.getField(), params) : "";
        return function + "(" + argument + ") AS " + alias;
    }

    private String buildWhereClause(TagQuery query, List<Object> params) {
        List<String> where = new ArrayList<>();

        TimeRange timeRange = query.getTimeRange();
        if (timeRange == null) {
            throw new QueryExecutionException("Query has no time range", query.toString());
        }
        // Microsecond bounds so the current second stays inside the window
        where.add(Columns.TIMESTAMP + " >= toDateTime64(?, 6, 'UTC')");
        params.add(DATETIME_FORMATTER.format(timeRange.getStart()));
        where.add(Columns.TIMESTAMP + " < toDateTime64(?, 6, 'UTC')");
        params.add(DATETIME_FORMATTER.format(timeRange.getEnd()));

        for (Map.Entry<String, List<Object>> filter : query.getFilters().entrySet()) {
            where.add(buildIn(filter.getKey(), filter.getValue(), params));
        }

        for (Expression condition : query.getConditions()) {
            where.add(buildExpressionSql(condition, params));
        }
        return String.join(" AND ", where);
    }

    private String buildExpressionSql(Expression expression, List<Object> params) {
        if (expression instanceof OrExpression) {
            List<String> clauses = new ArrayList<>();
            for (ComparisonExpression clause : ((OrExpression) expression).getClauses()) {
                clauses.add(buildComparisonSql(clause, params));
            }
            return "(" + String.join(" OR ", clauses) + ")";
        } else if (expression instanceof ComparisonExpression) {
            return buildComparisonSql((ComparisonExpression) expression, params);
        }
        throw new QueryExecutionException("Unsupported condition: " + expression);
    }

    private String buildComparisonSql(ComparisonExpression expr, List<Object> params) {
        String operator = expr.getOperator();
        switch (operator) {
            case ComparisonExpression.EQ:
            case ComparisonExpression.NEQ: {
                String column = resolveColumn(expr.getField(), params);
                params.add(expr.getValue());
                return column + " " + operator + " ?";
            }
            case ComparisonExpression.IN:
                return buildIn(expr.getField(), expr.getValues(), params);
            case ComparisonExpression.IS_NULL:
            case ComparisonExpression.IS_NOT_NULL:
                return resolveColumn(expr.getField(), params) + " " + operator;
            default:
                throw new QueryExecutionException("Unsupported operator: " + operator);
        }
    }

    private String buildIn(String field, List<?> values, List<Object> params) {
        if (values.isEmpty()) {
            throw new QueryExecutionException("Empty IN list for column " + field);
        }
        String column = resolveColumn(field, params);
        List<String> placeholders = new ArrayList<>();
        for (Object value : values) {
            placeholders.add("?");
            params.add(value);
        }
        return column + " IN (" + String.join(", ", placeholders) + ")";
    }

    private String buildOrderBy(TagQuery query) {
        SortField sortField = query.getOrderBy();
        String field = sortField.getField();
        String target;
        if (query.getGroupBy().contains(field)) {
            target = quoteAlias(field);
        } else if (query.getAggregations().stream().anyMatch(a -> a.getAlias().equals(field))) {
            target = field;
        } else {
            throw new QueryExecutionException("Cannot order by unselected column: " + field, query.toString());
        }
        return target + " " + (sortField.isAscending() ? "ASC" : "DESC");
    }

    /**
     * Physical expression for a logical column. Tag keys are bound as parameters.
     */
    private String resolveColumn(String column, List<Object> params) {
        if (Columns.isTag(column)) {
            params.add(Columns.tagKey(column));
            return "tags.value[indexOf(tags.key, ?)]";
        }
        requireIdentifier(column);
        if (Columns.ISSUE.equals(column)) {
            return ISSUE_COLUMN;
        }
        return column;
    }

    private boolean usesTagPairs(TagQuery query) {
        List<String> columns = new ArrayList<>(query.getGroupBy());
        columns.addAll(query.getFilters().keySet());
        for (Aggregation aggregation : query.getAggregations()) {
            if (aggregation.getField() != null) {
                columns.add(aggregation.getField());
            }
        }
        for (Expression condition : query.getConditions()) {
            if (condition instanceof ComparisonExpression) {
                columns.add(((ComparisonExpression) condition).getField());
            } else if (condition instanceof OrExpression) {
                for (ComparisonExpression clause : ((OrExpression) condition).getClauses()) {
                    columns.add(clause.getField());
                }
            }
        }
        return columns.contains(Columns.TAGS_KEY) || columns.contains(Columns.TAGS_VALUE);
    }

    private static String quoteAlias(String column) {
        return "`" + column.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new QueryExecutionException("Invalid column name: " + name);
        }
    }
}
