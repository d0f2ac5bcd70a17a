package com.tracelake.query;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Executes a validated query over an already pruned list of partition files.
 *
 * Implementations return rows with the column names of {@link ResultColumns}
 * and must rank and order them identically for the same input.
 */
public interface AnalyticsEngine {

    String getName();

    boolean supportsPercentiles();

    /**
     * @throws QueryExecutionException if the engine fails to run the query
     */
    List<Map<String, Object>> execute(QuerySpec spec, List<Path> partitionFiles);
}
