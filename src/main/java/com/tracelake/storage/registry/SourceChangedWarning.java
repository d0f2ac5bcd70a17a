package com.tracelake.storage.registry;

/**
 * Raised (as a value, not thrown) when a source path is registered again with
 * different content. The new content gets a new file id; offset entries of the
 * previous id keep pointing at the previous content.
 */
public class SourceChangedWarning {

    private final String path;
    private final int previousFileId;
    private final int newFileId;
    private final String previousChecksum;
    private final String newChecksum;

    public SourceChangedWarning(String path, int previousFileId, int newFileId,
                                String previousChecksum, String newChecksum) {
        this.path = path;
        this.previousFileId = previousFileId;
        this.newFileId = newFileId;
        this.previousChecksum = previousChecksum;
        this.newChecksum = newChecksum;
    }

    public String getPath() {
        return path;
    }

    public int getPreviousFileId() {
        return previousFileId;
    }

    public int getNewFileId() {
        return newFileId;
    }

    public String getPreviousChecksum() {
        return previousChecksum;
    }

    public String getNewChecksum() {
        return newChecksum;
    }

    public String getMessage() {
        return String.format("Source %s changed since file id %d was registered; registered as file id %d",
            path, previousFileId, newFileId);
    }

    @Override
    public String toString() {
        return "SourceChangedWarning{" + getMessage() + "}";
    }
}
