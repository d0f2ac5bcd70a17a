package com.tracelake.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Index suggestions of all namespaces, computed from one dataset version.
 *
 * {@code truncated} is set when more slow query patterns matched than one
 * query may return, so the least costly patterns were not considered.
 */
public class IndexSuggestionReport {

    @JsonProperty("collections")
    private final Map<String, CollectionIndexReport> collections;

    @JsonProperty("top_suggestions")
    private final List<IndexSuggestion> topSuggestions;

    @JsonProperty("total_collscan_executions")
    private final long totalCollscanExecutions;

    @JsonProperty("avg_docs_examined")
    private final double avgDocsExamined;

    @JsonProperty("dataset_version")
    private final long datasetVersion;

    @JsonProperty("degraded")
    private final boolean degraded;

    @JsonProperty("truncated")
    private final boolean truncated;

    public IndexSuggestionReport(Map<String, CollectionIndexReport> collections, List<IndexSuggestion> topSuggestions,
                                 long totalCollscanExecutions, double avgDocsExamined, long datasetVersion,
                                 boolean degraded, boolean truncated) {
        this.collections = collections;
        this.topSuggestions = topSuggestions;
        this.totalCollscanExecutions = totalCollscanExecutions;
        this.avgDocsExamined = avgDocsExamined;
        this.datasetVersion = datasetVersion;
        this.degraded = degraded;
        this.truncated = truncated;
    }

    public Map<String, CollectionIndexReport> getCollections() {
        return collections;
    }

    public List<IndexSuggestion> getTopSuggestions() {
        return topSuggestions;
    }

    @JsonProperty("total_suggestions")
    public int getTotalSuggestions() {
        int total = 0;
        for (CollectionIndexReport collection : collections.values()) {
            total += collection.getSuggestions().size();
        }
        return total;
    }

    public long getTotalCollscanExecutions() {
        return totalCollscanExecutions;
    }

    public double getAvgDocsExamined() {
        return avgDocsExamined;
    }

    public long getDatasetVersion() {
        return datasetVersion;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isTruncated() {
        return truncated;
    }
}
