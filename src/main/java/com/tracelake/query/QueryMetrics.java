package com.tracelake.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collector for analytics queries
 * Tracks executions, failures, fallbacks, result sizes and cache hit rates
 */
@Component
public class QueryMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter queriesExecuted;
    private final Counter queriesFailed;
    private final Counter queriesInvalid;
    private final Counter queriesDegraded;
    private final Counter queriesNoData;
    private final Timer queryExecutionLatency;
    private final DistributionSummary resultSize;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter cacheInvalidations;
    private final Map<String, Counter> engineQueries = new ConcurrentHashMap<>();

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        queriesExecuted = Counter.builder("tracelake.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("tracelake.query.failed")
            .description("Total number of queries that failed on every engine")
            .register(meterRegistry);

        queriesInvalid = Counter.builder("tracelake.query.invalid")
            .description("Total number of queries rejected by validation")
            .register(meterRegistry);

        queriesDegraded = Counter.builder("tracelake.query.degraded")
            .description("Total number of queries answered by the fallback engine")
            .register(meterRegistry);

        queriesNoData = Counter.builder("tracelake.query.nodata")
            .description("Total number of queries with no partition to scan")
            .register(meterRegistry);

        queryExecutionLatency = Timer.builder("tracelake.query.execution.latency")
            .description("Latency of query execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("tracelake.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        cacheHits = Counter.builder("tracelake.query.cache.hits")
            .description("Total number of query cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("tracelake.query.cache.misses")
            .description("Total number of query cache misses")
            .register(meterRegistry);

        cacheInvalidations = Counter.builder("tracelake.query.cache.invalidations")
            .description("Total number of query cache invalidations")
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordQueryInvalid() {
        queriesInvalid.increment();
    }

    public void recordQueryDegraded() {
        queriesDegraded.increment();
    }

    public void recordNoData() {
        queriesNoData.increment();
    }

    public void recordEngineQuery(String engine) {
        engineQueries.computeIfAbsent(engine, name -> Counter.builder("tracelake.query.engine")
            .description("Queries executed per analytics engine")
            .tag("engine", name)
            .register(meterRegistry)).increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordCacheInvalidation() {
        cacheInvalidations.increment();
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesInvalid() {
        return queriesInvalid;
    }

    public Counter getQueriesDegraded() {
        return queriesDegraded;
    }

    public Counter getQueriesNoData() {
        return queriesNoData;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }

    public Counter getCacheInvalidations() {
        return cacheInvalidations;
    }

    public double getEngineQueryCount(String engine) {
        Counter counter = engineQueries.get(engine);
        return counter == null ? 0.0 : counter.count();
    }
}
