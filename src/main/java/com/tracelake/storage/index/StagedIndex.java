package com.tracelake.storage.index;

import com.tracelake.domain.EventKind;

import java.nio.file.Path;

/**
 * Merged offset index of one kind, staged and waiting to be committed
 */
public class StagedIndex {

    private final EventKind kind;
    private final Path stagedFile;
    private final long rowCount;
    private final String checksum;

    public StagedIndex(EventKind kind, Path stagedFile, long rowCount, String checksum) {
        this.kind = kind;
        this.stagedFile = stagedFile;
        this.rowCount = rowCount;
        this.checksum = checksum;
    }

    public EventKind getKind() {
        return kind;
    }

    public Path getStagedFile() {
        return stagedFile;
    }

    public long getRowCount() {
        return rowCount;
    }

    public String getChecksum() {
        return checksum;
    }
}
