package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A registered source file as stored in {@code index/file_map.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileRegistryEntry {

    @JsonProperty("file_id")
    private int fileId;

    @JsonProperty("path")
    private String path;

    @JsonProperty("checksum")
    private String checksum;

    @JsonProperty("size")
    private long size;

    @JsonProperty("content_length")
    private long contentLength;

    @JsonProperty("registered_at")
    private String registeredAt;

    @JsonProperty("original_path")
    private String originalPath;

    public FileRegistryEntry() {
    }

    public FileRegistryEntry(int fileId, String path, String checksum, long size,
                             String registeredAt, String originalPath) {
        this.fileId = fileId;
        this.path = path;
        this.checksum = checksum;
        this.size = size;
        this.registeredAt = registeredAt;
        this.originalPath = originalPath;
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

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    /**
     * Addressable bytes of the source; the decompressed length for gzip files
     */
    public long getContentLength() {
        return contentLength;
    }

    public void setContentLength(long contentLength) {
        this.contentLength = contentLength;
    }

    /**
     * Upper bound for span end offsets, or 0 when the entry predates content lengths
     */
    public long spanLimit() {
        return contentLength > 0 ? contentLength : size;
    }

    public String getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(String registeredAt) {
        this.registeredAt = registeredAt;
    }

    public String getOriginalPath() {
        return originalPath;
    }

    public void setOriginalPath(String originalPath) {
        this.originalPath = originalPath;
    }

    /**
     * Path the source was registered under, falling back to the stored path for legacy entries
     */
    public String logicalPath() {
        return originalPath != null ? originalPath : path;
    }

    @Override
    public String toString() {
        return "FileRegistryEntry{fileId=" + fileId + ", path=" + path + ", size=" + size + ", contentLength=" + contentLength + "}";
    }
}
