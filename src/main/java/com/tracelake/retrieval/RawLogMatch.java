package com.tracelake.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A source line matched by a raw text search, with the structured log fields
 * read from it. Fields are null when the line does not carry them.
 */
public class RawLogMatch {

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("ts_epoch")
    private Long tsEpoch;

    @JsonProperty("level")
    private String level;

    @JsonProperty("component")
    private String component;

    @JsonProperty("context")
    private String context;

    @JsonProperty("msg")
    private String message;

    @JsonProperty("file_id")
    private int fileId;

    @JsonProperty("path")
    private String path;

    @JsonProperty("line_number")
    private long lineNumber;

    @JsonProperty("byte_offset")
    private long byteOffset;

    @JsonProperty("byte_length")
    private long byteLength;

    @JsonProperty("raw")
    private String raw;

    public RawLogMatch() {
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public Long getTsEpoch() {
        return tsEpoch;
    }

    public void setTsEpoch(Long tsEpoch) {
        this.tsEpoch = tsEpoch;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public String getComponent() {
        return component;
    }

    public void setComponent(String component) {
        this.component = component;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
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

    public long getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(long lineNumber) {
        this.lineNumber = lineNumber;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    public void setByteOffset(long byteOffset) {
        this.byteOffset = byteOffset;
    }

    public long getByteLength() {
        return byteLength;
    }

    public void setByteLength(long byteLength) {
        this.byteLength = byteLength;
    }

    public String getRaw() {
        return raw;
    }

    public void setRaw(String raw) {
        this.raw = raw;
    }

    @Override
    public String toString() {
        return "RawLogMatch{file=" + fileId + ", line=" + lineNumber + ", msg=" + message + "}";
    }
}
