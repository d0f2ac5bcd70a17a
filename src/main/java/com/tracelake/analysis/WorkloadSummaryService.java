package com.tracelake.analysis;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.QueryResult;
import com.tracelake.query.Grouping;
import com.tracelake.query.QueryFilters;
import com.tracelake.query.QueryService;
import com.tracelake.query.QuerySpec;
import com.tracelake.query.ResultColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Summarizes the slow query workload through the query service, so answers
 * share its engine routing and result cache.
 */
@Service
public class WorkloadSummaryService {

    private static final Logger log = LoggerFactory.getLogger(WorkloadSummaryService.class);

    private final QueryService queryService;

    public WorkloadSummaryService(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * @param limit length of each ranked list
     * @throws com.tracelake.query.InvalidFilterException on a limit out of range or a filter slow queries lack
     */
    public WorkloadSummary summarize(QueryFilters filters, int limit) {
        QueryFilters slowFilters = filters == null ? QueryFilters.none() : filters;
        List<Supplier<QueryResult>> queries = List.of(
            () -> queryService.aggregate(EventKind.SLOW_QUERY, Grouping.NAMESPACE, slowFilters, QuerySpec.MAX_LIMIT),
            () -> queryService.aggregate(EventKind.SLOW_QUERY, Grouping.PLAN_SUMMARY, slowFilters, limit),
            () -> queryService.aggregate(EventKind.SLOW_QUERY, Grouping.OPERATION, slowFilters, limit));
        List<QueryResult> results = ConsistentQueries.run(queries);
        List<Map<String, Object>> namespaces = results.get(0).getRows();
        if (namespaces.size() >= QuerySpec.MAX_LIMIT) {
            log.warn("Workload totals cover only the {} most costly namespaces", QuerySpec.MAX_LIMIT);
        }

        WorkloadSummary summary = new WorkloadSummary();
        for (Map<String, Object> row : namespaces) {
            summary.setExecutions(summary.getExecutions() + ConsistentQueries.value(row, ResultColumns.COUNT));
            summary.setTotalDurationMs(summary.getTotalDurationMs()
                + ConsistentQueries.value(row, ResultColumns.TOTAL_DURATION_MS));
            summary.setTotalDocsExamined(summary.getTotalDocsExamined()
                + ConsistentQueries.value(row, ResultColumns.TOTAL_DOCS_EXAMINED));
            summary.setTotalDocsReturned(summary.getTotalDocsReturned()
                + ConsistentQueries.value(row, ResultColumns.TOTAL_DOCS_RETURNED));
            summary.setTotalKeysExamined(summary.getTotalKeysExamined()
                + ConsistentQueries.value(row, ResultColumns.TOTAL_KEYS_EXAMINED));
        }
        summary.setTopDuration(top(namespaces, ResultColumns.TOTAL_DURATION_MS, limit));
        summary.setTopDocsExamined(top(namespaces, ResultColumns.TOTAL_DOCS_EXAMINED, limit));
        summary.setTopDocsReturned(top(namespaces, ResultColumns.TOTAL_DOCS_RETURNED, limit));
        summary.setTopKeysExamined(top(namespaces, ResultColumns.TOTAL_KEYS_EXAMINED, limit));
        summary.setPlanMix(results.get(1).getRows());
        summary.setOperationMix(results.get(2).getRows());
        summary.setDatasetVersion(results.get(0).getDatasetVersion());
        summary.setDegraded(ConsistentQueries.anyDegraded(results));
        return summary;
    }

    /**
     * Rows with the highest values of a column, ties broken by group
     */
    static List<Map<String, Object>> top(List<Map<String, Object>> rows, String column, int limit) {
        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingLong((Map<String, Object> row) -> ConsistentQueries.value(row, column))
            .reversed()
            .thenComparing(row -> String.valueOf(row.get(ResultColumns.GROUP))));
        return new ArrayList<>(sorted.subList(0, Math.min(limit, sorted.size())));
    }
}
