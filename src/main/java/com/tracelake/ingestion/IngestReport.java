package com.tracelake.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one ingest run, successful or not
 */
public class IngestReport {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    @JsonProperty("ingest_id")
    private String ingestId;

    @JsonProperty("status")
    private String status;

    @JsonProperty("source_path")
    private String sourcePath;

    @JsonProperty("file_id")
    private int fileId;

    @JsonProperty("dataset_version")
    private long datasetVersion;

    @JsonProperty("row_counts")
    private Map<String, Long> rowCounts = new LinkedHashMap<>();

    @JsonProperty("counters")
    private Map<String, Map<String, Long>> counters = new LinkedHashMap<>();

    @JsonProperty("parse_errors")
    private long parseErrors;

    @JsonProperty("partitions_written")
    private int partitionsWritten;

    @JsonProperty("partitions_superseded")
    private int partitionsSuperseded;

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    @JsonProperty("error")
    private String error;

    @JsonProperty("duration_ms")
    private long durationMs;

    public IngestReport() {
    }

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    public long rowCount(String kind) {
        return rowCounts.getOrDefault(kind, 0L);
    }

    public String getIngestId() {
        return ingestId;
    }

    public void setIngestId(String ingestId) {
        this.ingestId = ingestId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
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

    public long getDatasetVersion() {
        return datasetVersion;
    }

    public void setDatasetVersion(long datasetVersion) {
        this.datasetVersion = datasetVersion;
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

    public int getPartitionsWritten() {
        return partitionsWritten;
    }

    public void setPartitionsWritten(int partitionsWritten) {
        this.partitionsWritten = partitionsWritten;
    }

    public int getPartitionsSuperseded() {
        return partitionsSuperseded;
    }

    public void setPartitionsSuperseded(int partitionsSuperseded) {
        this.partitionsSuperseded = partitionsSuperseded;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<String> warnings) {
        this.warnings = warnings;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    @Override
    public String toString() {
        return "IngestReport{ingestId=" + ingestId + ", status=" + status + ", version=" + datasetVersion
            + ", rows=" + rowCounts + ", parseErrors=" + parseErrors + "}";
    }
}
