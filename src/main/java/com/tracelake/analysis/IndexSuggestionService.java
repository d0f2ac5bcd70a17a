package com.tracelake.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.config.TraceLakeSettings;
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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Proposes indexes for namespaces whose slow queries scan whole collections.
 *
 * Costs come from the slow query aggregates per pattern key, so every
 * execution of a pattern counts. The query shape of a pattern is read from its
 * newest logged command. A candidate index is suggested when its patterns ran
 * often enough and were slow enough, ranked by total duration weighted by
 * docs examined per returned document. Patterns already using an index, or
 * whose shape cannot be read, are listed for review instead.
 */
@Service
public class IndexSuggestionService {

    private static final Logger log = LoggerFactory.getLogger(IndexSuggestionService.class);

    static final int MAX_TOP_SUGGESTIONS = 10;

    private static final Comparator<Accumulator> BY_IMPACT = Comparator
        .comparingLong((Accumulator a) -> a.impactScore).reversed()
        .thenComparing(Comparator.comparingInt((Accumulator a) -> a.spec.size()).reversed())
        .thenComparing(a -> a.spec.toString());

    private final QueryService queryService;
    private final ObjectMapper objectMapper;
    private final long minOccurrences;
    private final double minAvgDurationMs;
    private final int limitPerCollection;

    public IndexSuggestionService(QueryService queryService, ObjectMapper objectMapper, TraceLakeSettings settings) {
        this.queryService = queryService;
        this.objectMapper = objectMapper;
        this.minOccurrences = settings.getSuggestionMinOccurrences();
        this.minAvgDurationMs = settings.getSuggestionMinAvgDurationMs();
        this.limitPerCollection = settings.getSuggestionsPerCollection();
    }

    /**
     * @param filters slow query filters, e.g. a time range or excluding system databases
     * @throws com.tracelake.query.InvalidFilterException if a filter does not apply to slow queries
     */
    public IndexSuggestionReport suggest(QueryFilters filters) {
        QueryFilters slowFilters = filters == null ? QueryFilters.none() : filters;
        List<Supplier<QueryResult>> queries = List.of(
            () -> queryService.aggregate(EventKind.SLOW_QUERY, Grouping.PATTERN_KEY, slowFilters, QuerySpec.MAX_LIMIT),
            () -> queryService.search(EventKind.SLOW_QUERY, slowFilters, QuerySpec.MAX_LIMIT));
        List<QueryResult> results = ConsistentQueries.run(queries);
        QueryResult patterns = results.get(0);
        Map<String, Map<String, Object>> samples = newestSamples(results.get(1).getRows());

        Map<String, CollectionIndexReport> collections = new TreeMap<>();
        Map<String, Map<IndexSpec, Accumulator>> candidates = new HashMap<>();
        long collscanExecutions = 0;
        long collscanDocs = 0;

        for (Map<String, Object> row : patterns.getRows()) {
            Pattern pattern = new Pattern(row, samples.get((String) row.get(ResultColumns.GROUP)));
            if (!pattern.collscan && !pattern.ixscan) {
                continue;
            }
            CollectionIndexReport collection = collections.computeIfAbsent(pattern.namespace,
                CollectionIndexReport::new);
            collection.recordScan(pattern.collscan, pattern.executions, pattern.docsExamined,
                pattern.docsReturned, pattern.totalDurationMs);
            if (pattern.collscan) {
                collscanExecutions += pattern.executions;
                collscanDocs += pattern.docsExamined;
                collection.addSampleQuery(pattern.queryText);
            }

            List<QueryShapes.Candidate> shapeCandidates = QueryShapes.candidates(parse(pattern.queryText));
            if (shapeCandidates.isEmpty()) {
                collection.addReview(pattern.review(pattern.collscan
                    ? "Collection scan with no plain filter or sort; review manually"
                    : "Query already uses an index; consider tuning the existing index or the query"));
                continue;
            }
            if (!pattern.collscan) {
                collection.addReview(pattern.review("Index already present; review before adding additional indexes"));
                continue;
            }
            Map<IndexSpec, Accumulator> specs = candidates.computeIfAbsent(pattern.namespace, ns -> new LinkedHashMap<>());
            Set<IndexSpec> counted = new HashSet<>();
            for (QueryShapes.Candidate candidate : shapeCandidates) {
                // a filter and a sort on the same field yield one spec
                if (counted.add(candidate.getSpec())) {
                    specs.computeIfAbsent(candidate.getSpec(), Accumulator::new).add(candidate, pattern);
                }
            }
        }

        List<IndexSuggestion> all = new ArrayList<>();
        for (CollectionIndexReport collection : collections.values()) {
            Map<IndexSpec, Accumulator> specs = candidates.getOrDefault(collection.getNamespace(), Map.of());
            List<IndexSuggestion> suggestions = rank(collection.getNamespace(), specs.values());
            collection.setSuggestions(suggestions);
            all.addAll(suggestions);
        }
        all.sort(Comparator.comparingLong(IndexSuggestion::getImpactScore).reversed());
        List<IndexSuggestion> top = new ArrayList<>(all.subList(0, Math.min(MAX_TOP_SUGGESTIONS, all.size())));

        double avgDocs = collscanExecutions == 0 ? 0.0 : (double) collscanDocs / collscanExecutions;
        boolean truncated = patterns.getRows().size() >= QuerySpec.MAX_LIMIT;
        if (truncated) {
            log.warn("Index suggestions considered only the {} most costly slow query patterns", QuerySpec.MAX_LIMIT);
        }
        log.debug("Suggested {} indexes over {} namespaces from {} patterns at version {}",
            all.size(), collections.size(), patterns.getRows().size(), patterns.getDatasetVersion());
        return new IndexSuggestionReport(collections, top, collscanExecutions, avgDocs,
            patterns.getDatasetVersion(), ConsistentQueries.anyDegraded(results), truncated);
    }

    private List<IndexSuggestion> rank(String namespace, Iterable<Accumulator> specs) {
        List<Accumulator> eligible = new ArrayList<>();
        for (Accumulator candidate : specs) {
            candidate.score();
            if (candidate.occurrences < minOccurrences || !QueryShapes.PRIORITY_HIGH.equals(candidate.priority)) {
                continue;
            }
            if (candidate.avgDurationMs < minAvgDurationMs && candidate.impactScore < minAvgDurationMs * minOccurrences) {
                continue;
            }
            eligible.add(candidate);
        }
        eligible.sort(BY_IMPACT);

        List<Accumulator> kept = new ArrayList<>();
        for (Accumulator candidate : eligible) {
            boolean covered = kept.stream().anyMatch(existing -> candidate.spec.isPrefixOf(existing.spec));
            if (!covered && kept.size() < limitPerCollection) {
                kept.add(candidate);
            }
        }

        List<IndexSuggestion> suggestions = new ArrayList<>(kept.size());
        for (Accumulator candidate : kept) {
            suggestions.add(candidate.toSuggestion(namespace));
        }
        return suggestions;
    }

    private JsonNode parse(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return null;
        }
        String text = queryText.trim();
        if (!text.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable query shape: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Newest logged row per pattern key among rows that carry a command
     */
    private static Map<String, Map<String, Object>> newestSamples(List<Map<String, Object>> rows) {
        Map<String, Map<String, Object>> samples = new HashMap<>();
        for (Map<String, Object> row : rows) {
            if (row.get("query_text") == null) {
                continue;
            }
            String key = Grouping.patternKey((String) row.get("namespace"), (String) row.get("plan_summary"),
                (String) row.get("query_hash"));
            samples.putIfAbsent(key, row);
        }
        return samples;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class Pattern {
        private final String key;
        private final String namespace;
        private final String planSummary;
        private final String queryText;
        private final boolean collscan;
        private final boolean ixscan;
        private final long executions;
        private final long totalDurationMs;
        private final long docsExamined;
        private final long docsReturned;

        Pattern(Map<String, Object> aggregate, Map<String, Object> sample) {
            this.key = (String) aggregate.get(ResultColumns.GROUP);
            String[] parts = key.split(Grouping.PATTERN_SEPARATOR, 3);
            this.namespace = sample != null ? (String) sample.get("namespace") : parts[0];
            this.planSummary = sample != null ? (String) sample.get("plan_summary") : (parts.length > 1 ? parts[1] : "");
            this.queryText = sample == null ? null : (String) sample.get("query_text");
            String plan = planSummary == null ? "" : planSummary.toUpperCase();
            this.collscan = plan.startsWith("COLLSCAN");
            this.ixscan = !collscan && plan.contains("IXSCAN");
            this.executions = ConsistentQueries.value(aggregate, ResultColumns.COUNT);
            this.totalDurationMs = ConsistentQueries.value(aggregate, ResultColumns.TOTAL_DURATION_MS);
            this.docsExamined = ConsistentQueries.value(aggregate, ResultColumns.TOTAL_DOCS_EXAMINED);
            this.docsReturned = ConsistentQueries.value(aggregate, ResultColumns.TOTAL_DOCS_RETURNED);
        }

        IndexReview review(String reason) {
            return new IndexReview(key, planSummary, executions, totalDurationMs / Math.max(1, executions),
                docsExamined, docsReturned, reason, queryText);
        }
    }

    private static final class Accumulator {
        private final IndexSpec spec;
        private String type;
        private String reason;
        private String priority;
        private long occurrences;
        private long totalDurationMs;
        private long docsExamined;
        private long docsReturned;
        private Double inefficiencyRatio;
        private Double selectivityPct;
        private long impactScore;
        private long avgDurationMs;

        Accumulator(IndexSpec spec) {
            this.spec = spec;
        }

        void add(QueryShapes.Candidate candidate, Pattern pattern) {
            type = candidate.getType();
            reason = candidate.getReason();
            if (priority == null || QueryShapes.PRIORITY_HIGH.equals(candidate.getPriority())) {
                priority = candidate.getPriority();
            }
            occurrences += pattern.executions;
            totalDurationMs += pattern.totalDurationMs;
            docsExamined += pattern.docsExamined;
            docsReturned += pattern.docsReturned;
        }

        void score() {
            inefficiencyRatio = docsExamined > 0 ? round2((double) docsExamined / Math.max(1, docsReturned)) : null;
            selectivityPct = docsExamined > 0 ? round2(docsReturned * 100.0 / docsExamined) : null;
            impactScore = (long) (totalDurationMs * (inefficiencyRatio != null ? inefficiencyRatio : 1.0));
            avgDurationMs = totalDurationMs / Math.max(1, occurrences);
        }

        IndexSuggestion toSuggestion(String namespace) {
            String collection = namespace.contains(".") ? namespace.substring(namespace.indexOf('.') + 1) : namespace;
            IndexSuggestion suggestion = new IndexSuggestion();
            suggestion.setNamespace(namespace);
            suggestion.setSpec(spec);
            suggestion.setType(spec.size() > 1 ? "compound" : type);
            suggestion.setReason(reason);
            suggestion.setPriority(priority);
            suggestion.setOccurrences(occurrences);
            suggestion.setAvgDurationMs(avgDurationMs);
            suggestion.setImpactScore(impactScore);
            suggestion.setInefficiencyRatio(inefficiencyRatio);
            suggestion.setSelectivityPct(selectivityPct);
            suggestion.setCommand("db." + collection + ".createIndex(" + spec + ")");
            suggestion.setJustification(occurrences + " COLLSCAN executions scanned ~"
                + docsExamined / Math.max(1, occurrences) + " docs in " + avgDurationMs
                + " ms without an index covering " + spec + ".");
            return suggestion;
        }
    }
}
