package com.bbthechange.tvguide.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every DynamoDB call made by the repositories.
 * Slow calls are logged at WARN and all calls feed the {@code dynamodb.query.duration} timer.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a storage call and record how long it took.
     *
     * @param operation DynamoDB API name, used as a metric tag
     * @param table table being accessed
     * @param queryOperation the call itself; exceptions propagate unchanged
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;

        } catch (RuntimeException e) {
            outcome = "error";
            logger.debug("DynamoDB call failed: operation={}, table={}, duration={}ms, error={}",
                operation, table, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
