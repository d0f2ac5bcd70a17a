package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A closed, write-once partition file as listed in the manifest.
 *
 * The path is relative to the dataset root. Min/max statistics cover
 * {@code ts_epoch} and the kind's pruning column, and are used by the query
 * service to skip partitions before scanning.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartitionHandle {

    @JsonProperty("kind")
    private EventKind kind;

    @JsonProperty("path")
    private String path;

    @JsonProperty("date_key")
    private String dateKey;

    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("row_count")
    private long rowCount;

    @JsonProperty("byte_size")
    private long byteSize;

    @JsonProperty("checksum")
    private String checksum;

    @JsonProperty("min_ts_epoch")
    private long minTsEpoch;

    @JsonProperty("max_ts_epoch")
    private long maxTsEpoch;

    @JsonProperty("min_key")
    private String minKey;

    @JsonProperty("max_key")
    private String maxKey;

    @JsonProperty("file_id")
    private int fileId;

    @JsonProperty("ingest_id")
    private String ingestId;

    public PartitionHandle() {
    }

    public EventKind getKind() {
        return kind;
    }

    public void setKind(EventKind kind) {
        this.kind = kind;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getDateKey() {
        return dateKey;
    }

    public void setDateKey(String dateKey) {
        this.dateKey = dateKey;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public long getRowCount() {
        return rowCount;
    }

    public void setRowCount(long rowCount) {
        this.rowCount = rowCount;
    }

    public long getByteSize() {
        return byteSize;
    }

    public void setByteSize(long byteSize) {
        this.byteSize = byteSize;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public long getMinTsEpoch() {
        return minTsEpoch;
    }

    public void setMinTsEpoch(long minTsEpoch) {
        this.minTsEpoch = minTsEpoch;
    }

    public long getMaxTsEpoch() {
        return maxTsEpoch;
    }

    public void setMaxTsEpoch(long maxTsEpoch) {
        this.maxTsEpoch = maxTsEpoch;
    }

    public String getMinKey() {
        return minKey;
    }

    public void setMinKey(String minKey) {
        this.minKey = minKey;
    }

    public String getMaxKey() {
        return maxKey;
    }

    public void setMaxKey(String maxKey) {
        this.maxKey = maxKey;
    }

    public int getFileId() {
        return fileId;
    }

    public void setFileId(int fileId) {
        this.fileId = fileId;
    }

    public String getIngestId() {
        return ingestId;
    }

    public void setIngestId(String ingestId) {
        this.ingestId = ingestId;
    }

    @Override
    public String toString() {
        return "PartitionHandle{" + path + ", rows=" + rowCount + "}";
    }
}
