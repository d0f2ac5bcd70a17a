package com.tracelake.storage.registry;

import com.tracelake.domain.FileRegistryEntry;

import java.util.Optional;

/**
 * Outcome of registering a source file
 */
public class SourceRegistration {

    private final FileRegistryEntry entry;
    private final boolean existing;
    private final SourceChangedWarning warning;

    public SourceRegistration(FileRegistryEntry entry, boolean existing, SourceChangedWarning warning) {
        this.entry = entry;
        this.existing = existing;
        this.warning = warning;
    }

    public int getFileId() {
        return entry.getFileId();
    }

    public FileRegistryEntry getEntry() {
        return entry;
    }

    /**
     * True when the source matched an earlier registration and kept its file id
     */
    public boolean isExisting() {
        return existing;
    }

    public Optional<SourceChangedWarning> getWarning() {
        return Optional.ofNullable(warning);
    }
}
