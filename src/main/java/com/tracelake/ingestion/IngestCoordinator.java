package com.tracelake.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.config.TraceLakeSettings;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.IngestHistoryEntry;
import com.tracelake.domain.Manifest;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.OffsetIndexEntry;
import com.tracelake.domain.OffsetIndexInfo;
import com.tracelake.domain.PartitionHandle;
import com.tracelake.domain.RawSpan;
import com.tracelake.ingestion.buffer.Chunk;
import com.tracelake.ingestion.buffer.ChunkBuffer;
import com.tracelake.normalization.NormalizationCounters;
import com.tracelake.normalization.RecordNormalizer;
import com.tracelake.storage.Checksums;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.columnar.ColumnarWriter;
import com.tracelake.storage.columnar.CompressionCodec;
import com.tracelake.storage.columnar.PartitionSchemas;
import com.tracelake.storage.columnar.WriteSession;
import com.tracelake.storage.index.OffsetIndexBuffer;
import com.tracelake.storage.index.OffsetIndexWriter;
import com.tracelake.storage.index.StagedIndex;
import com.tracelake.storage.manifest.DatasetHandle;
import com.tracelake.storage.registry.FileRegistry;
import com.tracelake.storage.registry.SourceRegistration;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one ingest end to end: lock, parse, write, publish.
 *
 * The source is read on the calling thread. Each event kind has its own
 * single-threaded writer lane that turns chunks into partitions plus offset
 * segments, with a bounded number of chunks in flight per lane. Nothing a run
 * writes is visible to readers until the new manifest is renamed into place;
 * any structural failure before that point removes everything the run wrote
 * and leaves the previous manifest active.
 */
@Service
public class IngestCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(IngestCoordinator.class);

    private static final DateTimeFormatter INGEST_ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);
    private static final long POLL_MILLIS = 100;

    private final DatasetHandle dataset;
    private final TraceLakeSettings settings;
    private final RecordNormalizer normalizer;
    private final PartitionSchemas schemas;
    private final ColumnarWriter columnarWriter;
    private final OffsetIndexWriter indexWriter;
    private final IngestMetrics metrics;
    private final IngestStatusTracker tracker;
    private final IngestLock lock;
    private final AtomicReference<RunControl> activeRun = new AtomicReference<>();

    public IngestCoordinator(
            DatasetHandle dataset,
            TraceLakeSettings settings,
            RecordNormalizer normalizer,
            PartitionSchemas schemas,
            ColumnarWriter columnarWriter,
            OffsetIndexWriter indexWriter,
            ObjectMapper objectMapper,
            IngestMetrics metrics,
            IngestStatusTracker tracker) {
        this.dataset = dataset;
        this.settings = settings;
        this.normalizer = normalizer;
        this.schemas = schemas;
        this.columnarWriter = columnarWriter;
        this.indexWriter = indexWriter;
        this.metrics = metrics;
        this.tracker = tracker;
        this.lock = new IngestLock(dataset.getLayout(), objectMapper, settings.getStaleLockAfter());
    }

    /**
     * Ingest one source file and publish a new dataset version
     *
     * @throws IngestInProgressException if another ingest holds the dataset lock
     * @throws IngestFailedException if the run aborted; the dataset is unchanged
     */
    public IngestReport ingest(IngestRequest request) {
        Path source = request.getSourcePath().toAbsolutePath().normalize();
        String ingestId = newIngestId();
        long started = System.currentTimeMillis();

        IngestLock.Lease lease;
        try {
            lease = lock.acquire(ingestId, request.isOverrideStaleLock());
        } catch (IngestInProgressException e) {
            metrics.recordLockRejected();
            logger.warn("Ingest of {} rejected: {}", source, e.getMessage());
            throw e;
        }

        RunControl control = new RunControl(settings.getTimeout());
        activeRun.set(control);
        tracker.begin(ingestId, source.toString());
        tracker.transition(IngestState.LOCKED);
        IngestRun run = new IngestRun(ingestId, source);
        logger.info("Ingest {} started for {}", ingestId, source);

        try {
            IngestReport report = execute(run, control);
            report.setDurationMs(System.currentTimeMillis() - started);
            metrics.recordCompleted(report.getDurationMs());
            deleteRecursively(dataset.getLayout().stagingDir(ingestId));
            tracker.finish(report);
            logger.info("Ingest {} published dataset v{}: rows={}, parse_errors={}, {} ms",
                ingestId, report.getDatasetVersion(), report.getRowCounts(),
                report.getParseErrors(), report.getDurationMs());
            return report;

        } catch (Exception e) {
            tracker.transition(IngestState.ABORTING);
            logger.error("Ingest {} failed, rolling back: {}", ingestId, e.getMessage());
            abort(run);
            long duration = System.currentTimeMillis() - started;
            metrics.recordAborted(duration);
            tracker.finish(failedReport(run, e, duration));
            throw new IngestFailedException("Ingest of " + source + " aborted",
                ingestId, run.counters.snapshot(), e);

        } finally {
            run.shutdownLanes();
            activeRun.compareAndSet(control, null);
            lease.release();
        }
    }

    /**
     * Request cancellation of the running ingest. The run aborts at its next
     * check and leaves the dataset in its pre-ingest state, unless the new
     * manifest has already been committed.
     *
     * @return true if a cancellable run was signalled
     */
    public boolean cancel() {
        RunControl control = activeRun.get();
        if (control == null || !tracker.getState().isCancellable()) {
            return false;
        }
        control.cancelRequested.set(true);
        logger.info("Cancellation requested for ingest {}", tracker.getCurrentIngestId().orElse("?"));
        return true;
    }

    public IngestState getState() {
        return tracker.getState();
    }

    /**
     * Keep the latest manifest snapshots and delete unreferenced partitions,
     * under the ingest lock
     *
     * @return number of partition files deleted
     */
    public int prune(int keepLatest) {
        try (IngestLock.Lease lease = lock.acquire("prune-" + newIngestId(), false)) {
            return dataset.getManifestStore().prune(keepLatest);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (cancel()) {
            logger.info("Cancelled running ingest on shutdown");
        }
    }

    private IngestReport execute(IngestRun run, RunControl control) throws Exception {
        DatasetLayout layout = dataset.getLayout();
        removeAbandonedStaging(run.ingestId);

        Manifest previous = dataset.getManifestStore().load().orElse(null);
        if (previous != null) {
            refreshIndexCopies(previous, run);
        }
        FileRegistry registry = dataset.fileRegistry(previous);
        SourceRegistration registration = registry.registerSource(run.source, settings.isKeepSourceCopy());
        run.registration = registration;
        registration.getWarning().ifPresent(w -> run.warnings.add(w.getMessage()));

        CompressionCodec codec = CompressionCodec.fromValue(settings.getCompression());
        long firstSequence = previous == null ? 1 : Math.max(1, previous.getNextSequence());
        WriteSession session = new WriteSession(run.ingestId, registration.getFileId(), layout, codec, firstSequence);
        run.session = session;

        // Parse
        tracker.transition(IngestState.PARSING);
        Map<EventKind, KindLane> lanes = run.openLanes(session);
        OffsetIndexBuffer indexBuffer = new OffsetIndexBuffer();
        try (SourceLineReader reader = new SourceLineReader(run.source, settings.getMaxLineBytes())) {
            SourceLineReader.SourceLine line;
            while ((line = reader.next()) != null) {
                control.check();
                run.checkLanes();
                if (line.isOversized()) {
                    run.counters.recordMalformed(null);
                    metrics.recordOversizedLine();
                    logger.warn("Line {} of {} exceeds {} bytes, skipped",
                        line.getLineNumber(), run.source.getFileName(), settings.getMaxLineBytes());
                    continue;
                }
                RawSpan span = new RawSpan(registration.getFileId(), line.getOffset(), (int) line.getLength());
                Optional<NormalizedEvent> normalized =
                    normalizer.normalize(line.text(), span, line.getLineNumber(), run.counters);
                if (normalized.isEmpty()) {
                    continue;
                }
                NormalizedEvent event = normalized.get();
                KindLane lane = lanes.get(event.getKind());
                indexBuffer.record(event);
                if (lane.buffer.append(event).shouldFlush()) {
                    lane.submit(lane.buffer.takeChunk(), indexBuffer.drain(event.getKind()), control);
                }
            }
            metrics.recordLinesRead(reader.getLineNumber());
        }

        // Flush
        tracker.transition(IngestState.FLUSHING);
        for (KindLane lane : lanes.values()) {
            Optional<Chunk> partial = lane.buffer.flushPartial();
            if (partial.isPresent()) {
                lane.submit(partial.get(), indexBuffer.drain(lane.kind), control);
            }
        }
        for (KindLane lane : lanes.values()) {
            lane.await(control);
        }
        control.check();

        // Publish
        tracker.transition(IngestState.PUBLISHING);
        return publish(run, control, previous, registry, lanes);
    }

    private IngestReport publish(IngestRun run, RunControl control, Manifest previous,
                                 FileRegistry registry, Map<EventKind, KindLane> lanes) throws TimeoutException {
        DatasetLayout layout = dataset.getLayout();
        WriteSession session = run.session;
        int fileId = run.registration.getFileId();

        Set<Integer> superseded = new HashSet<>();
        if (run.registration.isExisting()) {
            superseded.add(fileId);
        }

        List<PartitionHandle> partitions = new ArrayList<>();
        int supersededCount = 0;
        if (previous != null) {
            for (PartitionHandle partition : previous.getPartitions()) {
                if (superseded.contains(partition.getFileId())) {
                    supersededCount++;
                } else {
                    partitions.add(partition);
                }
            }
        }
        if (supersededCount > 0) {
            logger.info("Re-ingest of file id {} supersedes {} partitions", fileId, supersededCount);
        }

        long version = (previous == null ? 0 : previous.getDatasetVersion()) + 1;
        Map<String, Long> runRows = new LinkedHashMap<>();
        Map<String, OffsetIndexInfo> offsetIndexes = new LinkedHashMap<>();
        int written = 0;
        for (KindLane lane : lanes.values()) {
            long rows = 0;
            for (PartitionHandle partition : lane.partitions) {
                rows += partition.getRowCount();
            }
            partitions.addAll(lane.partitions);
            written += lane.partitions.size();
            runRows.put(lane.kind.getValue(), rows);

            OffsetIndexInfo previousIndex = previous == null ? null : previous.offsetIndex(lane.kind);
            if (lane.segments.isEmpty() && (previousIndex == null || superseded.isEmpty())) {
                if (previousIndex != null) {
                    offsetIndexes.put(lane.kind.getValue(), previousIndex);
                }
                continue;
            }
            Path published = previousIndex == null ? null : layout.resolve(previousIndex.getPath());
            StagedIndex staged = indexWriter.mergeForPublish(
                session, lane.kind, published, superseded, new ArrayList<>(lane.segments));
            Path target = layout.offsetIndexFile(lane.kind, version);
            place(session, staged.getStagedFile(), target);
            offsetIndexes.put(lane.kind.getValue(),
                new OffsetIndexInfo(layout.relativize(target), staged.getRowCount(), staged.getChecksum()));
        }
        Path stagedFileMap = registry.stage(session.getStagingDir());
        String fileMapChecksum = Checksums.sha256(stagedFileMap);
        Path fileMap = layout.fileMapFile(version);
        place(session, stagedFileMap, fileMap);

        Manifest next = new Manifest();
        String createdAt = Instant.now().toString();
        next.setDatasetVersion(version);
        next.setIngestId(run.ingestId);
        next.setCreatedAt(createdAt);
        next.setSchemaVersion(schemas.schemaVersion());
        next.setCompressionCodec(session.getCodec().getValue());
        next.setPartitions(partitions);
        Map<String, Long> rowCounts = new LinkedHashMap<>();
        for (EventKind kind : EventKind.values()) {
            rowCounts.put(kind.getValue(), partitions.stream()
                .filter(p -> p.getKind() == kind)
                .mapToLong(PartitionHandle::getRowCount)
                .sum());
        }
        next.setRowCounts(rowCounts);
        next.setOffsetIndexes(offsetIndexes);
        next.setNextSequence(session.peekNextSequence());
        next.setFileMapPath(layout.relativize(fileMap));
        next.setFileMapChecksum(fileMapChecksum);

        IngestHistoryEntry history = new IngestHistoryEntry();
        history.setIngestId(run.ingestId);
        history.setDatasetVersion(version);
        history.setCreatedAt(createdAt);
        history.setSourcePath(run.source.toString());
        history.setFileId(fileId);
        history.setRowCounts(runRows);
        history.setCounters(run.counters.snapshot());
        history.setParseErrors(run.counters.parseErrors());
        history.setWarnings(new ArrayList<>(run.warnings));
        history.setDurationMs(System.currentTimeMillis() - run.startedMillis);
        List<IngestHistoryEntry> ingests = new ArrayList<>();
        if (previous != null) {
            ingests.addAll(previous.getIngests());
        }
        ingests.add(history);
        next.setIngests(ingests);

        // the manifest rename is the commit point
        control.check();
        dataset.getManifestStore().publish(next, session.getStagingDir());
        run.published = true;
        dataset.onPublished(next);
        refreshIndexCopies(next, run);

        IngestReport report = new IngestReport();
        report.setIngestId(run.ingestId);
        report.setStatus(IngestReport.STATUS_COMPLETED);
        report.setSourcePath(run.source.toString());
        report.setFileId(fileId);
        report.setDatasetVersion(version);
        report.setRowCounts(runRows);
        report.setCounters(run.counters.snapshot());
        report.setParseErrors(run.counters.parseErrors());
        report.setPartitionsWritten(written);
        report.setPartitionsSuperseded(supersededCount);
        report.setWarnings(new ArrayList<>(run.warnings));
        return report;
    }

    /**
     * Move a staged index file to its versioned place in the dataset tree.
     * A file left at the same path by a run that crashed before its commit is
     * replaced.
     */
    private static void place(WriteSession session, Path staged, Path target) {
        try {
            Files.createDirectories(target.getParent());
            session.recordPlacedFile(target);
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to place " + target.getFileName(), e);
        }
    }

    private void refreshIndexCopies(Manifest manifest, IngestRun run) {
        try {
            dataset.getManifestStore().refreshIndexCopies(manifest);
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Could not refresh index copies of v{}: {}", manifest.getDatasetVersion(), e.getMessage());
            run.warnings.add("Index copies of v" + manifest.getDatasetVersion() + " not refreshed: " + e.getMessage());
        }
    }

    /**
     * Remove everything the run put into the dataset tree
     */
    private void abort(IngestRun run) {
        run.cancelLanes();
        if (run.session != null && !run.published) {
            for (Path placed : run.session.getPlacedFiles()) {
                deleteQuietly(placed);
            }
        }
        if (run.registration != null && !run.registration.isExisting() && !run.published) {
            Path stored = Path.of(run.registration.getEntry().getPath());
            if (!stored.isAbsolute()) {
                deleteQuietly(dataset.getLayout().resolve(run.registration.getEntry().getPath()));
            }
        }
        deleteRecursively(dataset.getLayout().stagingDir(run.ingestId));
    }

    private IngestReport failedReport(IngestRun run, Exception cause, long durationMs) {
        IngestReport report = new IngestReport();
        report.setIngestId(run.ingestId);
        report.setStatus(IngestReport.STATUS_FAILED);
        report.setSourcePath(run.source.toString());
        if (run.registration != null) {
            report.setFileId(run.registration.getFileId());
        }
        report.setCounters(run.counters.snapshot());
        report.setParseErrors(run.counters.parseErrors());
        report.setWarnings(new ArrayList<>(run.warnings));
        report.setError(cause.getMessage());
        report.setDurationMs(durationMs);
        return report;
    }

    private void removeAbandonedStaging(String currentIngestId) throws IOException {
        Path stagingRoot = dataset.getLayout().stagingRoot();
        if (!Files.isDirectory(stagingRoot)) {
            return;
        }
        List<Path> abandoned;
        try (Stream<Path> dirs = Files.list(stagingRoot)) {
            abandoned = dirs
                .filter(p -> !p.getFileName().toString().equals(currentIngestId))
                .collect(Collectors.toList());
        }
        for (Path dir : abandoned) {
            logger.warn("Removing abandoned staging directory {}", dir.getFileName());
            deleteRecursively(dir);
        }
    }

    private static String newIngestId() {
        return INGEST_ID_FORMAT.format(Instant.now()) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Could not list {} for removal: {}", dir, e.getMessage());
            return;
        }
        for (Path path : paths) {
            deleteQuietly(path);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Cancellation flag and deadline of the running ingest
     */
    private static final class RunControl {
        private final AtomicBoolean cancelRequested = new AtomicBoolean();
        private final Duration timeout;
        private final long deadlineNanos;

        RunControl(Duration timeout) {
            this.timeout = timeout;
            this.deadlineNanos = timeout.isZero() ? 0 : System.nanoTime() + timeout.toNanos();
        }

        void check() throws TimeoutException {
            if (cancelRequested.get()) {
                throw new CancellationException("Ingest cancelled");
            }
            if (deadlineNanos != 0 && System.nanoTime() - deadlineNanos > 0) {
                throw new TimeoutException("Ingest exceeded timeout of " + timeout.toSeconds() + "s");
            }
        }
    }

    /**
     * Mutable state of one run, kept for cleanup on abort
     */
    private final class IngestRun {
        private final String ingestId;
        private final Path source;
        private final long startedMillis = System.currentTimeMillis();
        private final NormalizationCounters counters = new NormalizationCounters();
        private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
        private final Map<EventKind, KindLane> lanes = new EnumMap<>(EventKind.class);
        private SourceRegistration registration;
        private WriteSession session;
        private boolean published;

        IngestRun(String ingestId, Path source) {
            this.ingestId = ingestId;
            this.source = source;
        }

        Map<EventKind, KindLane> openLanes(WriteSession session) {
            for (EventKind kind : EventKind.values()) {
                lanes.put(kind, new KindLane(kind, session));
            }
            return lanes;
        }

        void checkLanes() {
            for (KindLane lane : lanes.values()) {
                lane.checkFailure();
            }
        }

        void cancelLanes() {
            for (KindLane lane : lanes.values()) {
                lane.buffer.discard();
                lane.executor.shutdownNow();
            }
            for (KindLane lane : lanes.values()) {
                try {
                    if (!lane.executor.awaitTermination(30, TimeUnit.SECONDS)) {
                        logger.warn("Writer lane {} did not stop in time", lane.kind.getValue());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }

        void shutdownLanes() {
            for (KindLane lane : lanes.values()) {
                lane.executor.shutdownNow();
            }
        }
    }

    /**
     * Single-writer pipeline of one event kind
     */
    private final class KindLane {
        private final EventKind kind;
        private final WriteSession session;
        private final ChunkBuffer buffer;
        private final ExecutorService executor;
        private final Semaphore permits;
        private final List<Future<?>> futures = new ArrayList<>();
        private final List<PartitionHandle> partitions = Collections.synchronizedList(new ArrayList<>());
        private final List<Path> segments = Collections.synchronizedList(new ArrayList<>());
        private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

        KindLane(EventKind kind, WriteSession session) {
            this.kind = kind;
            this.session = session;
            this.buffer = new ChunkBuffer(kind, settings.getChunkRows(), settings.getChunkBytes());
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, "ingest-" + kind.getValue());
                thread.setDaemon(true);
                return thread;
            });
            this.permits = new Semaphore(Math.max(1, settings.getMaxInflightChunks()));
        }

        /**
         * Hand a chunk and its offset entries to the lane, blocking while the
         * lane has its maximum number of chunks in flight
         */
        void submit(Chunk chunk, List<OffsetIndexEntry> entries, RunControl control)
                throws InterruptedException, TimeoutException {
            while (!permits.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                control.check();
                checkFailure();
            }
            futures.add(executor.submit(() -> {
                try {
                    long start = System.currentTimeMillis();
                    List<PartitionHandle> handles = columnarWriter.write(session, chunk);
                    Path segment = indexWriter.writeSegment(session, kind, entries, handles.get(0).getSequence());
                    partitions.addAll(handles);
                    segments.add(segment);
                    long elapsed = System.currentTimeMillis() - start;
                    for (PartitionHandle handle : handles) {
                        metrics.recordPartitionWritten(kind, handle.getRowCount(), elapsed);
                    }
                } catch (RuntimeException e) {
                    failure.compareAndSet(null, e);
                    throw e;
                } finally {
                    permits.release();
                }
            }));
        }

        void checkFailure() {
            RuntimeException e = failure.get();
            if (e != null) {
                throw e;
            }
        }

        void await(RunControl control) throws InterruptedException, TimeoutException {
            for (Future<?> future : futures) {
                while (true) {
                    try {
                        future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                        break;
                    } catch (TimeoutException e) {
                        control.check();
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause();
                        if (cause instanceof RuntimeException) {
                            throw (RuntimeException) cause;
                        }
                        if (cause instanceof Error) {
                            throw (Error) cause;
                        }
                        throw new IllegalStateException("Writer lane " + kind.getValue() + " failed", cause);
                    }
                }
            }
        }
    }
}
