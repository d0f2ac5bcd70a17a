package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Represents the result of an analytics query against one manifest version.
 *
 * A result with {@code noData} set is a successful answer over an empty
 * selection. A result with {@code degraded} set was computed by the fallback
 * engine and only carries the metrics that engine supports.
 */
public class QueryResult {

    @JsonProperty("rows")
    private List<Map<String, Object>> rows;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("dataset_version")
    private long datasetVersion;

    @JsonProperty("engine")
    private String engine;

    @JsonProperty("partitions_scanned")
    private int partitionsScanned;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    @JsonProperty("degraded")
    private boolean degraded;

    @JsonProperty("no_data")
    private boolean noData;

    @JsonProperty("cached")
    private boolean cached;

    /**
     * Default constructor
     */
    public QueryResult() {
        this.rows = new ArrayList<>();
    }

    /**
     * Constructor with rows
     */
    public QueryResult(List<Map<String, Object>> rows) {
        this.rows = rows != null ? rows : new ArrayList<>();
        this.totalCount = this.rows.size();
        this.noData = this.rows.isEmpty();
    }

    /**
     * Constructor with rows and the manifest version they were computed from
     */
    public QueryResult(List<Map<String, Object>> rows, long datasetVersion) {
        this(rows);
        this.datasetVersion = datasetVersion;
    }

    // Getters and Setters

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(long totalCount) {
        this.totalCount = totalCount;
    }

    public long getDatasetVersion() {
        return datasetVersion;
    }

    public void setDatasetVersion(long datasetVersion) {
        this.datasetVersion = datasetVersion;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public int getPartitionsScanned() {
        return partitionsScanned;
    }

    public void setPartitionsScanned(int partitionsScanned) {
        this.partitionsScanned = partitionsScanned;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public boolean isNoData() {
        return noData;
    }

    public void setNoData(boolean noData) {
        this.noData = noData;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }
}
