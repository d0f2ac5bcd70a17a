package com.tracelake.storage.manifest;

import java.nio.file.Path;

/**
 * A dataset metadata file (manifest or file map) exists but cannot be read.
 * Reported instead of silently treating the dataset as empty.
 */
public class ManifestCorruptedException extends RuntimeException {

    private final Path file;

    public ManifestCorruptedException(String message, Path file, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (file != null) {
            sb.append(" [File: ").append(file).append("]");
        }
        return sb.toString();
    }
}
