package com.tracelake.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Scan statistics, suggestions and review items of one namespace
 */
public class CollectionIndexReport {

    static final int MAX_SAMPLE_QUERIES = 3;

    @JsonProperty("namespace")
    private final String namespace;

    @JsonProperty("collscan_executions")
    private long collscanExecutions;

    @JsonProperty("ixscan_executions")
    private long ixscanExecutions;

    @JsonProperty("total_docs_examined")
    private long totalDocsExamined;

    @JsonProperty("total_docs_returned")
    private long totalDocsReturned;

    @JsonProperty("total_duration_ms")
    private long totalDurationMs;

    @JsonProperty("sample_queries")
    private final List<String> sampleQueries = new ArrayList<>();

    @JsonProperty("suggestions")
    private List<IndexSuggestion> suggestions = new ArrayList<>();

    @JsonProperty("reviews")
    private final List<IndexReview> reviews = new ArrayList<>();

    public CollectionIndexReport(String namespace) {
        this.namespace = namespace;
    }

    void recordScan(boolean collscan, long executions, long docsExamined, long docsReturned, long durationMs) {
        if (collscan) {
            collscanExecutions += executions;
        } else {
            ixscanExecutions += executions;
        }
        totalDocsExamined += docsExamined;
        totalDocsReturned += docsReturned;
        totalDurationMs += durationMs;
    }

    void addSampleQuery(String queryText) {
        if (queryText != null && sampleQueries.size() < MAX_SAMPLE_QUERIES) {
            sampleQueries.add(queryText);
        }
    }

    void addReview(IndexReview review) {
        reviews.add(review);
    }

    void setSuggestions(List<IndexSuggestion> suggestions) {
        this.suggestions = suggestions;
    }

    public String getNamespace() {
        return namespace;
    }

    public long getCollscanExecutions() {
        return collscanExecutions;
    }

    public long getIxscanExecutions() {
        return ixscanExecutions;
    }

    public long getTotalDocsExamined() {
        return totalDocsExamined;
    }

    public long getTotalDocsReturned() {
        return totalDocsReturned;
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    @JsonProperty("avg_duration_ms")
    public double getAvgDurationMs() {
        long executions = collscanExecutions + ixscanExecutions;
        return executions == 0 ? 0.0 : (double) totalDurationMs / executions;
    }

    @JsonProperty("avg_docs_per_query")
    public double getAvgDocsPerQuery() {
        long executions = collscanExecutions + ixscanExecutions;
        return executions == 0 ? 0.0 : (double) totalDocsExamined / executions;
    }

    public List<String> getSampleQueries() {
        return sampleQueries;
    }

    public List<IndexSuggestion> getSuggestions() {
        return suggestions;
    }

    public List<IndexReview> getReviews() {
        return reviews;
    }
}
