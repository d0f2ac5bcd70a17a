package com.tracelake.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Environment-level tunables read by the ingest coordinator, the query service
 * and the workload analysis.
 *
 * Field initializers hold the same defaults as the placeholders so instances
 * built outside the container (see {@link #forDataset(Path)}) behave the same.
 */
@Component
public class TraceLakeSettings {

    @Value("${tracelake.dataset.root:./dataset}")
    private String datasetRoot = "./dataset";

    @Value("${tracelake.ingest.compression:snappy}")
    private String compression = "snappy";

    @Value("${tracelake.ingest.chunk-rows:50000}")
    private int chunkRows = 50_000;

    @Value("${tracelake.ingest.chunk-bytes:0}")
    private long chunkBytes = 0;

    @Value("${tracelake.ingest.keep-source-copy:false}")
    private boolean keepSourceCopy = false;

    @Value("${tracelake.ingest.sample-chars:512}")
    private int sampleChars = 512;

    @Value("${tracelake.ingest.max-line-bytes:16777216}")
    private int maxLineBytes = 16 * 1024 * 1024;

    @Value("${tracelake.ingest.stale-lock-after-minutes:30}")
    private long staleLockAfterMinutes = 30;

    @Value("${tracelake.ingest.timeout-seconds:0}")
    private long timeoutSeconds = 0;

    @Value("${tracelake.ingest.max-inflight-chunks:2}")
    private int maxInflightChunks = 2;

    @Value("${tracelake.query.advanced-engine-enabled:true}")
    private boolean advancedEngineEnabled = true;

    @Value("${tracelake.query.cache-max-size:1000}")
    private long cacheMaxSize = 1000;

    @Value("${tracelake.query.cache-ttl-minutes:5}")
    private long cacheTtlMinutes = 5;

    @Value("${tracelake.analysis.suggestion-min-occurrences:3}")
    private long suggestionMinOccurrences = 3;

    @Value("${tracelake.analysis.suggestion-min-avg-duration-ms:250}")
    private double suggestionMinAvgDurationMs = 250.0;

    @Value("${tracelake.analysis.suggestions-per-collection:10}")
    private int suggestionsPerCollection = 10;

    /**
     * Settings with default values for the given dataset root
     */
    public static TraceLakeSettings forDataset(Path root) {
        TraceLakeSettings settings = new TraceLakeSettings();
        settings.setDatasetRoot(root.toString());
        return settings;
    }

    public Path getDatasetRoot() {
        return Paths.get(datasetRoot).toAbsolutePath().normalize();
    }

    public void setDatasetRoot(String datasetRoot) {
        this.datasetRoot = datasetRoot;
    }

    public String getCompression() {
        return compression;
    }

    public void setCompression(String compression) {
        this.compression = compression;
    }

    public int getChunkRows() {
        return chunkRows;
    }

    public void setChunkRows(int chunkRows) {
        this.chunkRows = chunkRows;
    }

    public long getChunkBytes() {
        return chunkBytes;
    }

    public void setChunkBytes(long chunkBytes) {
        this.chunkBytes = chunkBytes;
    }

    public boolean isKeepSourceCopy() {
        return keepSourceCopy;
    }

    public void setKeepSourceCopy(boolean keepSourceCopy) {
        this.keepSourceCopy = keepSourceCopy;
    }

    public int getSampleChars() {
        return sampleChars;
    }

    public void setSampleChars(int sampleChars) {
        this.sampleChars = sampleChars;
    }

    public int getMaxLineBytes() {
        return maxLineBytes;
    }

    public void setMaxLineBytes(int maxLineBytes) {
        this.maxLineBytes = maxLineBytes;
    }

    public Duration getStaleLockAfter() {
        return Duration.ofMinutes(staleLockAfterMinutes);
    }

    public void setStaleLockAfterMinutes(long staleLockAfterMinutes) {
        this.staleLockAfterMinutes = staleLockAfterMinutes;
    }

    /**
     * Ingest timeout, or {@link Duration#ZERO} for none
     */
    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxInflightChunks() {
        return maxInflightChunks;
    }

    public void setMaxInflightChunks(int maxInflightChunks) {
        this.maxInflightChunks = maxInflightChunks;
    }

    public boolean isAdvancedEngineEnabled() {
        return advancedEngineEnabled;
    }

    public void setAdvancedEngineEnabled(boolean advancedEngineEnabled) {
        this.advancedEngineEnabled = advancedEngineEnabled;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(long cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public long getCacheTtlMinutes() {
        return cacheTtlMinutes;
    }

    public void setCacheTtlMinutes(long cacheTtlMinutes) {
        this.cacheTtlMinutes = cacheTtlMinutes;
    }

    public long getSuggestionMinOccurrences() {
        return suggestionMinOccurrences;
    }

    public void setSuggestionMinOccurrences(long suggestionMinOccurrences) {
        this.suggestionMinOccurrences = suggestionMinOccurrences;
    }

    public double getSuggestionMinAvgDurationMs() {
        return suggestionMinAvgDurationMs;
    }

    public void setSuggestionMinAvgDurationMs(double suggestionMinAvgDurationMs) {
        this.suggestionMinAvgDurationMs = suggestionMinAvgDurationMs;
    }

    public int getSuggestionsPerCollection() {
        return suggestionsPerCollection;
    }

    public void setSuggestionsPerCollection(int suggestionsPerCollection) {
        this.suggestionsPerCollection = suggestionsPerCollection;
    }
}
