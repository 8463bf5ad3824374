package com.tagstore.storage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for analytics engine queries
 * Tracks executed and failed queries, latency and result sizes
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Timer queryLatency;
    private DistributionSummary resultSize;

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("tagstore.query.executed")
            .description("Total number of engine queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("tagstore.query.failed")
            .description("Total number of engine queries that failed")
            .register(meterRegistry);

        // Timer with histogram support for percentile calculation
        queryLatency = Timer.builder("tagstore.query.latency")
            .description("Latency of engine query execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("tagstore.query.result.size")
            .description("Distribution of engine result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Timer getQueryLatency() {
        return queryLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }
}
