package com.tracelake.query;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tracelake.config.TraceLakeSettings;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.IngestHistoryEntry;
import com.tracelake.domain.Manifest;
import com.tracelake.domain.PartitionHandle;
import com.tracelake.domain.QueryResult;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.manifest.DatasetHandle;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * QueryService answers analytics queries against the active manifest.
 *
 * Each call reads the manifest once and works on that snapshot, so a
 * concurrent publish never mixes two dataset versions into one answer.
 * Results are cached per dataset version; when a new version is observed
 * the whole cache is dropped.
 *
 * Queries run on the primary engine through a circuit breaker. While the
 * engine is disabled, its circuit is open or a call fails, the fallback engine
 * answers and the result is flagged {@code degraded}. Requests the fallback
 * cannot serve fail with {@link DegradedModeException}.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final DatasetHandle dataset;
    private final AnalyticsEngine primaryEngine;
    private final AnalyticsEngine fallbackEngine;
    private final PartitionPruner pruner;
    private final QueryMetrics metrics;
    private final boolean advancedEngineEnabled;
    private final Cache<String, QueryResult> queryCache;
    private final CircuitBreaker engineCircuitBreaker;
    private final AtomicLong observedVersion = new AtomicLong(-1);

    public QueryService(
            DatasetHandle dataset,
            @Qualifier("duckDbAnalyticsEngine") AnalyticsEngine primaryEngine,
            @Qualifier("parquetScanEngine") AnalyticsEngine fallbackEngine,
            PartitionPruner pruner,
            QueryMetrics metrics,
            TraceLakeSettings settings) {
        this.dataset = dataset;
        this.primaryEngine = primaryEngine;
        this.fallbackEngine = fallbackEngine;
        this.pruner = pruner;
        this.metrics = metrics;
        this.advancedEngineEnabled = settings.isAdvancedEngineEnabled();

        this.queryCache = Caffeine.newBuilder()
            .maximumSize(settings.getCacheMaxSize())
            .expireAfterWrite(settings.getCacheTtlMinutes(), TimeUnit.MINUTES)
            .recordStats()
            .build();

        // Opens when half of the last 10 calls failed, retries after 30s
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .ignoreException(QueryService::isRequestFailure)
            .build();
        this.engineCircuitBreaker = CircuitBreaker.of(primaryEngine.getName(), cbConfig);
        this.engineCircuitBreaker.getEventPublisher().onStateTransition(event ->
            log.warn("Engine {} circuit: {}", primaryEngine.getName(), event.getStateTransition()));

        log.info("QueryService initialized (primary={}, enabled={}, fallback={}, cache maxSize={}, ttl={}min)",
            primaryEngine.getName(), advancedEngineEnabled, fallbackEngine.getName(),
            settings.getCacheMaxSize(), settings.getCacheTtlMinutes());
    }

    /**
     * Top groups of one event kind ranked by the kind's primary metric
     */
    public QueryResult aggregate(EventKind kind, Grouping grouping, QueryFilters filters, int limit) {
        return execute(QuerySpec.aggregate(kind, grouping, filters, limit, false));
    }

    /**
     * As {@link #aggregate(EventKind, Grouping, QueryFilters, int)}, optionally adding
     * the 95th percentile of slow query duration
     *
     * @throws DegradedModeException if percentiles are requested while only the fallback engine can run
     */
    public QueryResult aggregate(EventKind kind, Grouping grouping, QueryFilters filters, int limit,
                                 boolean withPercentiles) {
        return execute(QuerySpec.aggregate(kind, grouping, filters, limit, withPercentiles));
    }

    /**
     * Event counts per time bucket, optionally split by a grouping
     */
    public QueryResult trend(EventKind kind, Grouping grouping, QueryFilters filters, TrendBucketing bucketing) {
        return execute(QuerySpec.trend(kind, grouping, filters, bucketing));
    }

    /**
     * Matching rows, newest first
     */
    public QueryResult search(EventKind kind, QueryFilters filters, int limit) {
        return execute(QuerySpec.search(kind, filters, limit));
    }

    public QueryResult execute(QuerySpec spec) {
        try {
            spec.validate();
        } catch (InvalidFilterException e) {
            metrics.recordQueryInvalid();
            throw e;
        }

        Manifest manifest = dataset.currentManifest().orElse(null);
        long version = manifest == null ? 0L : manifest.getDatasetVersion();
        observeVersion(version);

        String cacheKey = spec.cacheKey(version);
        QueryResult cachedResult = queryCache.getIfPresent(cacheKey);
        if (cachedResult != null) {
            log.debug("Cache hit for {}", spec);
            metrics.recordCacheHit();
            QueryResult cloned = copyOf(cachedResult);
            cloned.setCached(true);
            return cloned;
        }
        metrics.recordCacheMiss();

        Timer.Sample sample = metrics.startQueryTimer();
        long startTime = System.currentTimeMillis();
        try {
            List<PartitionHandle> partitions = manifest == null ? List.of() : pruner.prune(manifest, spec);
            QueryResult result;
            boolean cacheable = true;
            if (partitions.isEmpty()) {
                log.debug("No partitions selected for {} at version {}", spec, version);
                metrics.recordNoData();
                result = new QueryResult(new ArrayList<>(), version);
            } else {
                result = run(spec, toFiles(partitions), version);
                result.setPartitionsScanned(partitions.size());
                // a fallback answer caused by an unhealthy primary is not kept
                cacheable = !result.isDegraded() || !advancedEngineEnabled;
            }

            result.setExecutionTimeMs(System.currentTimeMillis() - startTime);
            result.setCached(false);
            metrics.recordQueryExecuted();
            metrics.recordResultSize(result.getRows().size());
            if (cacheable) {
                queryCache.put(cacheKey, copyOf(result));
            }
            log.debug("Query {} completed in {}ms with {} rows on {}",
                spec, result.getExecutionTimeMs(), result.getTotalCount(), result.getEngine());
            return result;
        } catch (RuntimeException e) {
            metrics.recordQueryFailed();
            throw e;
        } finally {
            metrics.recordQueryLatency(sample);
        }
    }

    private QueryResult run(QuerySpec spec, List<Path> files, long version) {
        QueryExecutionException primaryFailure = null;
        if (advancedEngineEnabled) {
            try {
                List<Map<String, Object>> rows =
                    engineCircuitBreaker.executeSupplier(() -> primaryEngine.execute(spec, files));
                metrics.recordEngineQuery(primaryEngine.getName());
                QueryResult result = new QueryResult(rows, version);
                result.setEngine(primaryEngine.getName());
                return result;
            } catch (CallNotPermittedException e) {
                log.debug("Engine {} circuit is open, using {}", primaryEngine.getName(), fallbackEngine.getName());
                primaryFailure = new QueryExecutionException("Circuit of engine " + primaryEngine.getName() + " is open",
                    QueryExecutionException.FailureKind.ENGINE_UNAVAILABLE, primaryEngine.getName(), e);
            } catch (QueryExecutionException e) {
                if (e.getKind() == QueryExecutionException.FailureKind.NO_DATA) {
                    throw e;
                }
                log.warn("Engine {} failed, falling back to {}: {}",
                    primaryEngine.getName(), fallbackEngine.getName(), e.getMessage());
                primaryFailure = e;
            } catch (RuntimeException e) {
                log.warn("Engine {} failed, falling back to {}: {}",
                    primaryEngine.getName(), fallbackEngine.getName(), e.getMessage());
                primaryFailure = new QueryExecutionException(e.getMessage(),
                    QueryExecutionException.FailureKind.ENGINE_FAILURE, primaryEngine.getName(), e);
            }
        }

        if (spec.isWithPercentiles() && !fallbackEngine.supportsPercentiles()) {
            throw new DegradedModeException(
                "Percentiles need the " + primaryEngine.getName() + " engine, which is not available",
                "percentiles", primaryEngine.getName(), primaryFailure);
        }

        metrics.recordQueryDegraded();
        List<Map<String, Object>> rows = fallbackEngine.execute(spec, files);
        metrics.recordEngineQuery(fallbackEngine.getName());
        QueryResult result = new QueryResult(rows, version);
        result.setEngine(fallbackEngine.getName());
        result.setDegraded(true);
        return result;
    }

    /**
     * Failures caused by the request or the data rather than the engine
     */
    private static boolean isRequestFailure(Throwable e) {
        if (!(e instanceof QueryExecutionException)) {
            return false;
        }
        QueryExecutionException.FailureKind kind = ((QueryExecutionException) e).getKind();
        return kind == QueryExecutionException.FailureKind.NO_DATA
            || kind == QueryExecutionException.FailureKind.INVALID_FILTER;
    }

    private List<Path> toFiles(List<PartitionHandle> partitions) {
        DatasetLayout layout = dataset.getLayout();
        List<Path> files = new ArrayList<>(partitions.size());
        for (PartitionHandle partition : partitions) {
            files.add(layout.resolve(partition.getPath()));
        }
        return files;
    }

    /**
     * Drop the cache when a newer version than any seen before shows up.
     * Callers still working on an older snapshot leave it alone.
     */
    void observeVersion(long version) {
        while (true) {
            long previous = observedVersion.get();
            if (version <= previous) {
                return;
            }
            if (observedVersion.compareAndSet(previous, version)) {
                if (previous != -1) {
                    log.info("Dataset version changed from {} to {}", previous, version);
                    invalidateCache();
                }
                return;
            }
        }
    }

    /**
     * Earliest and latest event time across all published partitions
     */
    public Optional<TimeRange> availableDateRange() {
        Manifest manifest = dataset.currentManifest().orElse(null);
        if (manifest == null || manifest.getPartitions().isEmpty()) {
            return Optional.empty();
        }
        long earliest = Long.MAX_VALUE;
        long latest = Long.MIN_VALUE;
        for (PartitionHandle partition : manifest.getPartitions()) {
            earliest = Math.min(earliest, partition.getMinTsEpoch());
            latest = Math.max(latest, partition.getMaxTsEpoch());
        }
        return Optional.of(new TimeRange(earliest, latest));
    }

    /**
     * Ingest history of the active manifest, newest first
     */
    public List<IngestHistoryEntry> listIngests() {
        List<IngestHistoryEntry> ingests = dataset.currentManifest()
            .map(m -> new ArrayList<>(m.getIngests()))
            .orElseGet(ArrayList::new);
        Collections.reverse(ingests);
        return ingests;
    }

    /**
     * Get cache statistics for monitoring
     *
     * @return A map of cache statistics
     */
    public Map<String, Object> cacheStats() {
        CacheStats stats = queryCache.stats();

        Map<String, Object> statsMap = new ConcurrentHashMap<>();
        statsMap.put("hitCount", stats.hitCount());
        statsMap.put("missCount", stats.missCount());
        statsMap.put("hitRate", stats.hitRate());
        statsMap.put("evictionCount", stats.evictionCount());
        statsMap.put("estimatedSize", queryCache.estimatedSize());
        statsMap.put("datasetVersion", observedVersion.get());
        statsMap.put("engineCircuit", engineCircuitBreaker.getState().name());
        return statsMap;
    }

    /**
     * Circuit breaker guarding the primary engine
     */
    public CircuitBreaker getEngineCircuitBreaker() {
        return engineCircuitBreaker;
    }

    /**
     * Invalidate the entire query cache
     */
    public void invalidateCache() {
        long sizeBefore = queryCache.estimatedSize();
        queryCache.invalidateAll();
        log.info("Invalidated query cache, removed {} entries", sizeBefore);
        metrics.recordCacheInvalidation();
    }

    private static QueryResult copyOf(QueryResult source) {
        QueryResult cloned = new QueryResult();
        cloned.setRows(new ArrayList<>(source.getRows()));
        cloned.setTotalCount(source.getTotalCount());
        cloned.setDatasetVersion(source.getDatasetVersion());
        cloned.setEngine(source.getEngine());
        cloned.setPartitionsScanned(source.getPartitionsScanned());
        cloned.setExecutionTimeMs(source.getExecutionTimeMs());
        cloned.setDegraded(source.isDegraded());
        cloned.setNoData(source.isNoData());
        cloned.setCached(source.isCached());
        return cloned;
    }
}
