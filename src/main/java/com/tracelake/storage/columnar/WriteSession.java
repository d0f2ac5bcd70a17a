package com.tracelake.storage.columnar;

import com.tracelake.domain.EventKind;
import com.tracelake.storage.DatasetLayout;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-ingest state shared by the writers of all kinds.
 *
 * Thread-safe: each kind's writer lane runs on its own thread.
 */
public class WriteSession {

    private final String ingestId;
    private final int fileId;
    private final DatasetLayout layout;
    private final Path stagingDir;
    private final CompressionCodec codec;
    private final AtomicLong sequence;
    private final Set<EventKind> validatedKinds = ConcurrentHashMap.newKeySet();
    private final List<Path> placedFiles = Collections.synchronizedList(new ArrayList<>());

    /**
     * @param firstSequence first sequence number to try for new partition files
     */
    public WriteSession(String ingestId, int fileId, DatasetLayout layout, CompressionCodec codec, long firstSequence) {
        this.ingestId = ingestId;
        this.fileId = fileId;
        this.layout = layout;
        this.stagingDir = layout.stagingDir(ingestId);
        this.codec = codec;
        this.sequence = new AtomicLong(firstSequence);
    }

    public String getIngestId() {
        return ingestId;
    }

    public int getFileId() {
        return fileId;
    }

    public DatasetLayout getLayout() {
        return layout;
    }

    public Path getStagingDir() {
        return stagingDir;
    }

    public CompressionCodec getCodec() {
        return codec;
    }

    public long nextSequence() {
        return sequence.getAndIncrement();
    }

    /**
     * Sequence the next ingest should start from
     */
    public long peekNextSequence() {
        return sequence.get();
    }

    /**
     * @return true only for the first caller per kind, who must validate the chunk
     */
    public boolean claimValidation(EventKind kind) {
        return validatedKinds.add(kind);
    }

    /**
     * Remember a file moved into the dataset tree so an abort can remove it
     */
    public void recordPlacedFile(Path file) {
        placedFiles.add(file);
    }

    public List<Path> getPlacedFiles() {
        synchronized (placedFiles) {
            return new ArrayList<>(placedFiles);
        }
    }
}
