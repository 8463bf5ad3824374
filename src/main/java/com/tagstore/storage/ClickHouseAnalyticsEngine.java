package com.tagstore.storage;

import com.tagstore.query.QueryExecutionException;
import com.tagstore.query.QueryResult;
import com.tagstore.query.TagQuery;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs tag store queries against ClickHouse through {@link JdbcTemplate}.
 *
 * Translation and execution failures are logged and counted, then rethrown
 * unchanged: callers must be able to tell an engine error from an empty result.
 */
@Repository
public class ClickHouseAnalyticsEngine implements AnalyticsEngine {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseAnalyticsEngine.class);

    private final JdbcTemplate clickHouseTemplate;
    private final ClickHouseTranspiler transpiler;
    private final QueryMetrics metrics;

    public ClickHouseAnalyticsEngine(
            @Qualifier("clickHouseJdbcTemplate") JdbcTemplate clickHouseTemplate,
            ClickHouseTranspiler transpiler,
            QueryMetrics metrics) {
        this.clickHouseTemplate = clickHouseTemplate;
        this.transpiler = transpiler;
        this.metrics = metrics;
    }

    @Override
    public QueryResult query(TagQuery query) {
        long startTime = System.currentTimeMillis();
        Timer.Sample sample = metrics.startQueryTimer();
        ResultSetExtractor<List<Map<String, Object>>> extractor = this::extractRows;
        try {
            ClickHouseQuery sql = transpiler.transpile(query);
            log.debug("Executing ClickHouse query: {}", sql);

            List<Map<String, Object>> rows = clickHouseTemplate.query(
                sql.getSql(),
                new ArgumentPreparedStatementSetter(sql.getParameters().toArray()),
                extractor);

            QueryResult result = new QueryResult(query, rows);
            result.setExecutionTimeMs(System.currentTimeMillis() - startTime);
            metrics.recordQueryExecuted();
            metrics.recordResultSize(result.size());
            log.debug("ClickHouse query completed in {}ms, returned {} rows",
                result.getExecutionTimeMs(), result.size());
            return result;
        } catch (QueryExecutionException e) {
            metrics.recordQueryFailed();
            log.error("Query could not be translated to ClickHouse SQL: {}", e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            metrics.recordQueryFailed();
            log.error("ClickHouse query execution failed: {} [Query: {}]", e.getMessage(), query, e);
            throw e;
        } finally {
            metrics.recordQueryLatency(sample);
        }
    }

    /**
     * Reads every row into a map keyed by column label, normalising driver types.
     */
    List<Map<String, Object>> extractRows(ResultSet rs) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();

        // Get column metadata
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();

        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(metaData.getColumnLabel(i), normalize(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    static Object normalize(Object value) throws SQLException {
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toInstant();
        } else if (value instanceof LocalDateTime) {
            // DateTime columns are stored in UTC
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        } else if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        } else if (value instanceof BigInteger) {
            BigInteger number = (BigInteger) value;
            return number.bitLength() < Long.SIZE ? (Object) number.longValue() : number;
        } else if (value instanceof java.sql.Array) {
            return normalize(((java.sql.Array) value).getArray());
        } else if (value instanceof Object[]) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Object[]) value) {
                list.add(normalize(element));
            }
            return list;
        } else if (value instanceof long[]) {
            List<Object> list = new ArrayList<>();
            Arrays.stream((long[]) value).forEach(list::add);
            return list;
        }
        return value;
    }
}
