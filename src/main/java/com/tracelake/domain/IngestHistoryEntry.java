package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telemetry of one successful ingest, kept in the manifest's ingest history.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestHistoryEntry {

    @JsonProperty("ingest_id")
    private String ingestId;

    @JsonProperty("dataset_version")
    private long datasetVersion;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("source_path")
    private String sourcePath;

    @JsonProperty("file_id")
    private int fileId;

    @JsonProperty("row_counts")
    private Map<String, Long> rowCounts = new LinkedHashMap<>();

    @JsonProperty("counters")
    private Map<String, Map<String, Long>> counters = new LinkedHashMap<>();

    @JsonProperty("parse_errors")
    private long parseErrors;

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    @JsonProperty("duration_ms")
    private long durationMs;

    public IngestHistoryEntry() {
    }

    public String getIngestId() {
        return ingestId;
    }

    public void setIngestId(String ingestId) {
        this.ingestId = ingestId;
    }

    public long getDatasetVersion() {
        return datasetVersion;
    }

    public void setDatasetVersion(long datasetVersion) {
        this.datasetVersion = datasetVersion;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    public int getFileId() {
        return fileId;
    }

    public void setFileId(int fileId) {
        this.fileId = fileId;
    }

    public Map<String, Long> getRowCounts() {
        return rowCounts;
    }

    public void setRowCounts(Map<String, Long> rowCounts) {
        this.rowCounts = rowCounts;
    }

    public Map<String, Map<String, Long>> getCounters() {
        return counters;
    }

    public void setCounters(Map<String, Map<String, Long>> counters) {
        this.counters = counters;
    }

    public long getParseErrors() {
        return parseErrors;
    }

    public void setParseErrors(long parseErrors) {
        this.parseErrors = parseErrors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<String> warnings) {
        this.warnings = warnings;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }
}
