package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Published offset index file of one event kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OffsetIndexInfo {

    @JsonProperty("path")
    private String path;

    @JsonProperty("row_count")
    private long rowCount;

    @JsonProperty("checksum")
    private String checksum;

    public OffsetIndexInfo() {
    }

    public OffsetIndexInfo(String path, long rowCount, String checksum) {
        this.path = path;
        this.rowCount = rowCount;
        this.checksum = checksum;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public long getRowCount() {
        return rowCount;
    }

    public void setRowCount(long rowCount) {
        this.rowCount = rowCount;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }
}
