package com.tracelake.analysis;

import com.tracelake.domain.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs several queries until all of them answer from the same dataset version
 */
final class ConsistentQueries {

    private static final Logger log = LoggerFactory.getLogger(ConsistentQueries.class);

    static final int MAX_ATTEMPTS = 3;

    private ConsistentQueries() {
    }

    static List<QueryResult> run(List<Supplier<QueryResult>> queries) {
        List<QueryResult> results = new ArrayList<>();
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            results.clear();
            for (Supplier<QueryResult> query : queries) {
                results.add(query.get());
            }
            if (sameVersion(results)) {
                return results;
            }
            log.debug("Dataset changed between queries, attempt {} of {}", attempt, MAX_ATTEMPTS);
        }
        log.warn("Dataset kept changing across {} attempts, combining results of versions {}",
            MAX_ATTEMPTS, versions(results));
        return results;
    }

    static boolean anyDegraded(List<QueryResult> results) {
        for (QueryResult result : results) {
            if (result.isDegraded()) {
                return true;
            }
        }
        return false;
    }

    static long value(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static boolean sameVersion(List<QueryResult> results) {
        for (QueryResult result : results) {
            if (result.getDatasetVersion() != results.get(0).getDatasetVersion()) {
                return false;
            }
        }
        return true;
    }

    private static List<Long> versions(List<QueryResult> results) {
        List<Long> versions = new ArrayList<>();
        for (QueryResult result : results) {
            versions.add(result.getDatasetVersion());
        }
        return versions;
    }
}
