package com.tracelake.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A slow query pattern that needs a manual look instead of an automatic suggestion
 */
public class IndexReview {

    @JsonProperty("pattern_key")
    private final String patternKey;

    @JsonProperty("plan_summary")
    private final String planSummary;

    @JsonProperty("executions")
    private final long executions;

    @JsonProperty("avg_duration_ms")
    private final long avgDurationMs;

    @JsonProperty("docs_examined")
    private final long docsExamined;

    @JsonProperty("docs_returned")
    private final long docsReturned;

    @JsonProperty("reason")
    private final String reason;

    @JsonProperty("query_text")
    private final String queryText;

    public IndexReview(String patternKey, String planSummary, long executions, long avgDurationMs,
                       long docsExamined, long docsReturned, String reason, String queryText) {
        this.patternKey = patternKey;
        this.planSummary = planSummary;
        this.executions = executions;
        this.avgDurationMs = avgDurationMs;
        this.docsExamined = docsExamined;
        this.docsReturned = docsReturned;
        this.reason = reason;
        this.queryText = queryText;
    }

    public String getPatternKey() {
        return patternKey;
    }

    public String getPlanSummary() {
        return planSummary;
    }

    public long getExecutions() {
        return executions;
    }

    public long getAvgDurationMs() {
        return avgDurationMs;
    }

    public long getDocsExamined() {
        return docsExamined;
    }

    public long getDocsReturned() {
        return docsReturned;
    }

    public String getReason() {
        return reason;
    }

    public String getQueryText() {
        return queryText;
    }
}
