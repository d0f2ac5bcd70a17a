package com.tracelake.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracelake.domain.EventKind;

/**
 * A raw log record read back through the offset index, with its provenance.
 *
 * When {@code fallback} is set the source could not be read and {@code raw}
 * holds the truncated sample stored at ingest time.
 */
public class RetrievedRecord {

    @JsonProperty("record_key")
    private String recordKey;

    @JsonProperty("kind")
    private EventKind kind;

    @JsonProperty("ts_epoch")
    private long tsEpoch;

    @JsonProperty("file_id")
    private int fileId;

    @JsonProperty("path")
    private String path;

    @JsonProperty("byte_offset")
    private long byteOffset;

    @JsonProperty("byte_length")
    private int byteLength;

    @JsonProperty("line_number")
    private long lineNumber;

    @JsonProperty("raw")
    private String raw;

    @JsonProperty("fallback")
    private boolean fallback;

    @JsonProperty("unavailable_reason")
    private String unavailableReason;

    public RetrievedRecord() {
    }

    public String getRecordKey() {
        return recordKey;
    }

    public void setRecordKey(String recordKey) {
        this.recordKey = recordKey;
    }

    public EventKind getKind() {
        return kind;
    }

    public void setKind(EventKind kind) {
        this.kind = kind;
    }

    public long getTsEpoch() {
        return tsEpoch;
    }

    public void setTsEpoch(long tsEpoch) {
        this.tsEpoch = tsEpoch;
    }

    public int getFileId() {
        return fileId;
    }

    public void setFileId(int fileId) {
        this.fileId = fileId;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    public void setByteOffset(long byteOffset) {
        this.byteOffset = byteOffset;
    }

    public int getByteLength() {
        return byteLength;
    }

    public void setByteLength(int byteLength) {
        this.byteLength = byteLength;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(long lineNumber) {
        this.lineNumber = lineNumber;
    }

    public String getRaw() {
        return raw;
    }

    public void setRaw(String raw) {
        this.raw = raw;
    }

    public boolean isFallback() {
        return fallback;
    }

    public void setFallback(boolean fallback) {
        this.fallback = fallback;
    }

    public String getUnavailableReason() {
        return unavailableReason;
    }

    public void setUnavailableReason(String unavailableReason) {
        this.unavailableReason = unavailableReason;
    }

    @Override
    public String toString() {
        return "RetrievedRecord{key=" + recordKey + ", kind=" + kind + ", file=" + fileId
            + ", offset=" + byteOffset + ", length=" + byteLength + ", fallback=" + fallback + "}";
    }
}
