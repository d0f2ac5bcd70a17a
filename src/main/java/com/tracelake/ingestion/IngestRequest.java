package com.tracelake.ingestion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A request to ingest one source file
 */
public class IngestRequest {

    private final Path sourcePath;
    private final boolean overrideStaleLock;

    public IngestRequest(Path sourcePath) {
        this(sourcePath, false);
    }

    /**
     * @param overrideStaleLock take over an ingest lock left behind by a dead process
     */
    public IngestRequest(Path sourcePath, boolean overrideStaleLock) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.overrideStaleLock = overrideStaleLock;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public boolean isOverrideStaleLock() {
        return overrideStaleLock;
    }

    @Override
    public String toString() {
        return "IngestRequest{source=" + sourcePath + ", override=" + overrideStaleLock + "}";
    }
}
