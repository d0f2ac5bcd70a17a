package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned snapshot of the whole dataset after a successful ingest.
 *
 * A manifest lists every partition readers may see, the offset index file of
 * each event kind, the file map and the row counts per kind. Readers fetch one manifest per
 * operation and never look at files it does not list, which gives them
 * snapshot isolation from a concurrent ingest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Manifest {

    public static final int SCHEMA_VERSION = 1;

    @JsonProperty("dataset_version")
    private long datasetVersion;

    @JsonProperty("ingest_id")
    private String ingestId;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("schema_version")
    private int schemaVersion = SCHEMA_VERSION;

    @JsonProperty("compression_codec")
    private String compressionCodec;

    @JsonProperty("row_counts")
    private Map<String, Long> rowCounts = new LinkedHashMap<>();

    @JsonProperty("partitions")
    private List<PartitionHandle> partitions = new ArrayList<>();

    @JsonProperty("offset_indexes")
    private Map<String, OffsetIndexInfo> offsetIndexes = new LinkedHashMap<>();

    @JsonProperty("ingests")
    private List<IngestHistoryEntry> ingests = new ArrayList<>();

    @JsonProperty("next_sequence")
    private long nextSequence;

    @JsonProperty("file_map_path")
    private String fileMapPath;

    @JsonProperty("file_map_checksum")
    private String fileMapChecksum;

    public Manifest() {
    }

    public long getDatasetVersion() {
        return datasetVersion;
    }

    public void setDatasetVersion(long datasetVersion) {
        this.datasetVersion = datasetVersion;
    }

    public String getIngestId() {
        return ingestId;
    }

    public void setIngestId(String ingestId) {
        this.ingestId = ingestId;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getCompressionCodec() {
        return compressionCodec;
    }

    public void setCompressionCodec(String compressionCodec) {
        this.compressionCodec = compressionCodec;
    }

    public Map<String, Long> getRowCounts() {
        return rowCounts;
    }

    public void setRowCounts(Map<String, Long> rowCounts) {
        this.rowCounts = rowCounts;
    }

    public List<PartitionHandle> getPartitions() {
        return partitions;
    }

    public void setPartitions(List<PartitionHandle> partitions) {
        this.partitions = partitions;
    }

    public Map<String, OffsetIndexInfo> getOffsetIndexes() {
        return offsetIndexes;
    }

    public void setOffsetIndexes(Map<String, OffsetIndexInfo> offsetIndexes) {
        this.offsetIndexes = offsetIndexes;
    }

    public List<IngestHistoryEntry> getIngests() {
        return ingests;
    }

    public void setIngests(List<IngestHistoryEntry> ingests) {
        this.ingests = ingests;
    }

    public long getNextSequence() {
        return nextSequence;
    }

    public void setNextSequence(long nextSequence) {
        this.nextSequence = nextSequence;
    }

    /**
     * File map of this version relative to the dataset root, null for
     * manifests written before file maps were versioned
     */
    public String getFileMapPath() {
        return fileMapPath;
    }

    public void setFileMapPath(String fileMapPath) {
        this.fileMapPath = fileMapPath;
    }

    public String getFileMapChecksum() {
        return fileMapChecksum;
    }

    public void setFileMapChecksum(String fileMapChecksum) {
        this.fileMapChecksum = fileMapChecksum;
    }

    /**
     * Partitions of one event kind, in manifest order
     */
    public List<PartitionHandle> partitionsOf(EventKind kind) {
        List<PartitionHandle> result = new ArrayList<>();
        for (PartitionHandle partition : partitions) {
            if (partition.getKind() == kind) {
                result.add(partition);
            }
        }
        return result;
    }

    public long rowCount(EventKind kind) {
        return rowCounts.getOrDefault(kind.getValue(), 0L);
    }

    /**
     * Offset index of a kind, or null when nothing of that kind was ever published
     */
    public OffsetIndexInfo offsetIndex(EventKind kind) {
        return offsetIndexes.get(kind.getValue());
    }

    /**
     * Entry of the ingest that produced this manifest, or null for an empty history
     */
    public IngestHistoryEntry latestIngest() {
        return ingests.isEmpty() ? null : ingests.get(ingests.size() - 1);
    }
}
