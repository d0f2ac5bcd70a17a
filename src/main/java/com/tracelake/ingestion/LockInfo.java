package com.tracelake.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of the {@code .ingest.lock} file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LockInfo {

    @JsonProperty("ingest_id")
    private String ingestId;

    @JsonProperty("pid")
    private long pid;

    @JsonProperty("host")
    private String host;

    @JsonProperty("acquired_at")
    private String acquiredAt;

    public LockInfo() {
    }

    public LockInfo(String ingestId, long pid, String host, String acquiredAt) {
        this.ingestId = ingestId;
        this.pid = pid;
        this.host = host;
        this.acquiredAt = acquiredAt;
    }

    public String getIngestId() {
        return ingestId;
    }

    public void setIngestId(String ingestId) {
        this.ingestId = ingestId;
    }

    public long getPid() {
        return pid;
    }

    public void setPid(long pid) {
        this.pid = pid;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getAcquiredAt() {
        return acquiredAt;
    }

    public void setAcquiredAt(String acquiredAt) {
        this.acquiredAt = acquiredAt;
    }
}
