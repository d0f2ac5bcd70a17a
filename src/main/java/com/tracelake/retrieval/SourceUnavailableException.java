package com.tracelake.retrieval;

import java.nio.file.Path;

/**
 * The original bytes of a record cannot be read back: the source file is
 * missing, shorter than the recorded span, or was replaced by different content.
 */
public class SourceUnavailableException extends RuntimeException {

    private final int fileId;
    private final Path path;

    public SourceUnavailableException(String message, int fileId, Path path) {
        this(message, fileId, path, null);
    }

    public SourceUnavailableException(String message, int fileId, Path path, Throwable cause) {
        super(message, cause);
        this.fileId = fileId;
        this.path = path;
    }

    public int getFileId() {
        return fileId;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" [File id: ").append(fileId);
        if (path != null) {
            sb.append(", path: ").append(path);
        }
        sb.append("]");
        return sb.toString();
    }
}
