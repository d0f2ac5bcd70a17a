package com.tracelake.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Slow query workload of one dataset version: totals plus the namespaces
 * ranked by each cost, and the plan and operation mix.
 *
 * Ranked lists hold aggregate rows of the namespace grouping.
 */
public class WorkloadSummary {

    @JsonProperty("executions")
    private long executions;

    @JsonProperty("total_duration_ms")
    private long totalDurationMs;

    @JsonProperty("total_docs_examined")
    private long totalDocsExamined;

    @JsonProperty("total_docs_returned")
    private long totalDocsReturned;

    @JsonProperty("total_keys_examined")
    private long totalKeysExamined;

    @JsonProperty("top_duration")
    private List<Map<String, Object>> topDuration;

    @JsonProperty("top_docs_examined")
    private List<Map<String, Object>> topDocsExamined;

    @JsonProperty("top_docs_returned")
    private List<Map<String, Object>> topDocsReturned;

    @JsonProperty("top_keys_examined")
    private List<Map<String, Object>> topKeysExamined;

    @JsonProperty("plan_mix")
    private List<Map<String, Object>> planMix;

    @JsonProperty("operation_mix")
    private List<Map<String, Object>> operationMix;

    @JsonProperty("dataset_version")
    private long datasetVersion;

    @JsonProperty("degraded")
    private boolean degraded;

    public WorkloadSummary() {
    }

    public long getExecutions() {
        return executions;
    }

    public void setExecutions(long executions) {
        this.executions = executions;
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    public void setTotalDurationMs(long totalDurationMs) {
        this.totalDurationMs = totalDurationMs;
    }

    public long getTotalDocsExamined() {
        return totalDocsExamined;
    }

    public void setTotalDocsExamined(long totalDocsExamined) {
        this.totalDocsExamined = totalDocsExamined;
    }

    public long getTotalDocsReturned() {
        return totalDocsReturned;
    }

    public void setTotalDocsReturned(long totalDocsReturned) {
        this.totalDocsReturned = totalDocsReturned;
    }

    public long getTotalKeysExamined() {
        return totalKeysExamined;
    }

    public void setTotalKeysExamined(long totalKeysExamined) {
        this.totalKeysExamined = totalKeysExamined;
    }

    public List<Map<String, Object>> getTopDuration() {
        return topDuration;
    }

    public void setTopDuration(List<Map<String, Object>> topDuration) {
        this.topDuration = topDuration;
    }

    public List<Map<String, Object>> getTopDocsExamined() {
        return topDocsExamined;
    }

    public void setTopDocsExamined(List<Map<String, Object>> topDocsExamined) {
        this.topDocsExamined = topDocsExamined;
    }

    public List<Map<String, Object>> getTopDocsReturned() {
        return topDocsReturned;
    }

    public void setTopDocsReturned(List<Map<String, Object>> topDocsReturned) {
        this.topDocsReturned = topDocsReturned;
    }

    public List<Map<String, Object>> getTopKeysExamined() {
        return topKeysExamined;
    }

    public void setTopKeysExamined(List<Map<String, Object>> topKeysExamined) {
        this.topKeysExamined = topKeysExamined;
    }

    public List<Map<String, Object>> getPlanMix() {
        return planMix;
    }

    public void setPlanMix(List<Map<String, Object>> planMix) {
        this.planMix = planMix;
    }

    public List<Map<String, Object>> getOperationMix() {
        return operationMix;
    }

    public void setOperationMix(List<Map<String, Object>> operationMix) {
        this.operationMix = operationMix;
    }

    public long getDatasetVersion() {
        return datasetVersion;
    }

    public void setDatasetVersion(long datasetVersion) {
        this.datasetVersion = datasetVersion;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }
}
