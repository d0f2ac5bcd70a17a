package com.tracelake.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.TestLogs;
import com.tracelake.TraceLakeFixture;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.Manifest;
import com.tracelake.domain.OffsetIndexInfo;
import com.tracelake.domain.PartitionHandle;
import com.tracelake.retrieval.RawRecordRetriever;
import com.tracelake.retrieval.RetrievedRecord;
import com.tracelake.storage.Checksums;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.columnar.PartitionSchemas;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IngestCoordinator Tests")
class IngestCoordinatorTest {

    private static final String DATE = "2024-03-01T10:15:30.123+00:00";

    @TempDir
    Path tempDir;

    private TraceLakeFixture fixture;
    private DatasetLayout layout;

    @BeforeEach
    void setUp() {
        fixture = new TraceLakeFixture(tempDir.resolve("dataset"));
        layout = fixture.dataset.getLayout();
    }

    private Path source(String name, List<String> lines) throws IOException {
        return TestLogs.write(tempDir.resolve(name), lines);
    }

    private static String slowQuery(int i) {
        return TestLogs.slowQuery("2024-03-01T10:" + String.format("%02d", i) + ":00.000+00:00",
            "shop.orders", "HASH" + i, "COLLSCAN", 100 + i);
    }

    private List<Path> partitionFiles() throws IOException {
        Path kindDir = layout.kindDir(EventKind.SLOW_QUERY);
        if (!Files.exists(kindDir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(kindDir)) {
            return walk.filter(Files::isRegularFile).toList();
        }
    }

    @Test
    @DisplayName("Should normalize, count parse errors and publish version 1")
    void shouldIngestMixedSource() throws IOException {
        // Given a slow query, a failed authentication and a truncated line
        String slow = TestLogs.slowQuery(DATE, "shop.orders", "8A5C4C1E", "COLLSCAN", 1200);
        String auth = TestLogs.auth(DATE, "alice", "admin", false, "10.0.0.5:51234");
        Path source = source("mongod.log", List.of(slow, auth, TestLogs.truncatedSlowQuery(DATE)));

        // When ingesting
        IngestReport report = fixture.coordinator().ingest(new IngestRequest(source));

        // Then each kind is counted and the dataset is published
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getDatasetVersion()).isEqualTo(1);
        assertThat(report.getFileId()).isEqualTo(1);
        assertThat(report.rowCount("slow_queries")).isEqualTo(1);
        assertThat(report.rowCount("authentications")).isEqualTo(1);
        assertThat(report.rowCount("connections")).isZero();
        assertThat(report.getParseErrors()).isEqualTo(1);
        assertThat(report.getCounters().get("slow_queries")).containsEntry("malformed", 1L);
        assertThat(report.getPartitionsWritten()).isEqualTo(2);

        Manifest manifest = fixture.dataset.currentManifest().orElseThrow();
        assertThat(manifest.getDatasetVersion()).isEqualTo(1);
        assertThat(manifest.rowCount(EventKind.SLOW_QUERY)).isEqualTo(1);
        assertThat(manifest.rowCount(EventKind.AUTH)).isEqualTo(1);
        assertThat(manifest.offsetIndex(EventKind.SLOW_QUERY)).isNotNull();
        assertThat(manifest.offsetIndex(EventKind.CONNECTION)).isNull();
        assertThat(manifest.getIngests()).hasSize(1);
        assertThat(manifest.latestIngest().getParseErrors()).isEqualTo(1);

        assertThat(fixture.retriever().fetch("8A5C4C1E", 10))
            .extracting(RetrievedRecord::getRaw).containsExactly(slow);
        assertThat(layout.lockFile()).doesNotExist();
        assertThat(layout.stagingDir(report.getIngestId())).doesNotExist();
        assertThat(fixture.tracker.getState()).isEqualTo(IngestState.IDLE);
    }

    @Test
    @DisplayName("Should cut partitions at the row threshold and flush the remainder")
    void shouldSplitIntoChunks() throws IOException {
        fixture.settings.setChunkRows(2);
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            lines.add(slowQuery(i));
        }

        IngestReport report = fixture.coordinator().ingest(new IngestRequest(source("mongod.log", lines)));

        List<PartitionHandle> partitions = fixture.dataset.currentManifest().orElseThrow()
            .partitionsOf(EventKind.SLOW_QUERY);
        assertThat(report.getPartitionsWritten()).isEqualTo(3);
        assertThat(partitions).extracting(PartitionHandle::getRowCount).containsExactlyInAnyOrder(2L, 2L, 1L);
        assertThat(partitions).extracting(PartitionHandle::getSequence).doesNotHaveDuplicates();
        assertThat(partitionFiles()).hasSize(3);
    }

    @Test
    @DisplayName("Should point every indexed span at exactly its original line")
    void shouldRecordExactSpans() throws IOException {
        fixture.settings.setChunkRows(2);
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            lines.add(i % 3 == 2 ? TestLogs.connection(DATE, true, "10.0.0." + i + ":5000") : slowQuery(i));
        }
        Path source = source("mongod.log", lines);
        fixture.coordinator().ingest(new IngestRequest(source));

        RawRecordRetriever retriever = fixture.retriever();
        byte[] bytes = Files.readAllBytes(source);
        for (int i = 0; i < 6; i++) {
            if (i % 3 == 2) {
                continue;
            }
            RetrievedRecord record = retriever.fetch("HASH" + i, 10).get(0);
            String fromSpan = new String(bytes, (int) record.getByteOffset(), record.getByteLength(),
                StandardCharsets.UTF_8);
            assertThat(fromSpan).isEqualTo(lines.get(i));
            assertThat(record.getLineNumber()).isEqualTo(i + 1);
        }
    }

    @Test
    @DisplayName("Should supersede earlier partitions when the same source is ingested again")
    void shouldReingestIdempotently() throws IOException {
        Path source = source("mongod.log", List.of(slowQuery(1), slowQuery(2)));
        IngestCoordinator coordinator = fixture.coordinator();

        coordinator.ingest(new IngestRequest(source));
        IngestReport second = coordinator.ingest(new IngestRequest(source));

        Manifest manifest = fixture.dataset.currentManifest().orElseThrow();
        assertThat(second.getDatasetVersion()).isEqualTo(2);
        assertThat(second.getFileId()).isEqualTo(1);
        assertThat(second.getPartitionsSuperseded()).isEqualTo(1);
        assertThat(manifest.rowCount(EventKind.SLOW_QUERY)).isEqualTo(2);
        assertThat(manifest.partitionsOf(EventKind.SLOW_QUERY)).hasSize(1);
        assertThat(manifest.offsetIndex(EventKind.SLOW_QUERY).getRowCount()).isEqualTo(2);
        assertThat(fixture.retriever().fetch("HASH1", 10)).hasSize(1);
        assertThat(fixture.dataset.getManifestStore().listVersions()).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Should keep partitions of other sources when a new source is ingested")
    void shouldAccumulateSources() throws IOException {
        IngestCoordinator coordinator = fixture.coordinator();

        coordinator.ingest(new IngestRequest(source("a.log", List.of(slowQuery(1)))));
        IngestReport report = coordinator.ingest(new IngestRequest(source("b.log", List.of(slowQuery(2)))));

        assertThat(report.getFileId()).isEqualTo(2);
        assertThat(report.getPartitionsSuperseded()).isZero();
        assertThat(fixture.dataset.currentManifest().orElseThrow().rowCount(EventKind.SLOW_QUERY)).isEqualTo(2);
        assertThat(fixture.retriever().fetch("HASH1", 10)).hasSize(1);
        assertThat(fixture.retriever().fetch("HASH2", 10)).hasSize(1);
    }

    @Test
    @DisplayName("Should leave the dataset unchanged when a chunk violates the declared schema")
    void shouldRollBackOnSchemaViolation() throws IOException {
        // Given a published version 1
        fixture.coordinator().ingest(new IngestRequest(source("a.log", List.of(slowQuery(1)))));
        List<Path> before = partitionFiles();
        byte[] fileMap = Files.readAllBytes(layout.fileMapFile());

        // When a second ingest writes against a schema with ts_epoch declared as a string
        Schema broken = SchemaBuilder.record("SlowQuery").namespace("com.tracelake.storage").fields()
            .requiredString("record_key")
            .requiredString("timestamp")
            .requiredString("ts_epoch")
            .endRecord();
        IngestCoordinator coordinator = fixture.coordinator(
            new PartitionSchemas().withSchema(EventKind.SLOW_QUERY, broken));

        assertThatThrownBy(() -> coordinator.ingest(new IngestRequest(source("b.log", List.of(slowQuery(2))))))
            .isInstanceOf(IngestFailedException.class);

        // Then version 1 stays active with the same files
        assertThat(fixture.dataset.currentVersion()).isEqualTo(1);
        assertThat(partitionFiles()).containsExactlyInAnyOrderElementsOf(before);
        assertThat(Files.readAllBytes(layout.fileMapFile())).isEqualTo(fileMap);
        assertThat(fixture.dataset.fileRegistry().lookup(2)).isEmpty();
        assertThat(layout.lockFile()).doesNotExist();
        assertThat(layout.stagingRoot()).isEmptyDirectory();
        assertThat(fixture.tracker.getState()).isEqualTo(IngestState.IDLE);
        assertThat(fixture.meterRegistry.get("tracelake.ingest.runs.aborted").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject an ingest while another holds the lock")
    void shouldRejectWhileLocked() throws IOException {
        Path source = source("mongod.log", List.of(slowQuery(1)));
        IngestLock other = new IngestLock(layout, new ObjectMapper(), Duration.ofMinutes(30));

        try (IngestLock.Lease lease = other.acquire("other-run", false)) {
            assertThatThrownBy(() -> fixture.coordinator().ingest(new IngestRequest(source)))
                .isInstanceOf(IngestInProgressException.class);
        }

        assertThat(fixture.dataset.currentManifest()).isEmpty();
        assertThat(fixture.coordinator().ingest(new IngestRequest(source)).getDatasetVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail cleanly for a missing source")
    void shouldFailForMissingSource() {
        assertThatThrownBy(() -> fixture.coordinator().ingest(new IngestRequest(tempDir.resolve("absent.log"))))
            .isInstanceOf(IngestFailedException.class);

        assertThat(fixture.dataset.currentManifest()).isEmpty();
        assertThat(layout.lockFile()).doesNotExist();
    }

    @Test
    @DisplayName("Should prune old versions under the lock")
    void shouldPrune() throws IOException {
        IngestCoordinator coordinator = fixture.coordinator();
        Path source = source("mongod.log", List.of(slowQuery(1)));
        coordinator.ingest(new IngestRequest(source));
        coordinator.ingest(new IngestRequest(source));

        int deleted = coordinator.prune(1);

        assertThat(deleted).isEqualTo(1);
        assertThat(partitionFiles()).hasSize(1);
        assertThat(layout.offsetIndexFile(EventKind.SLOW_QUERY, 1)).doesNotExist();
        assertThat(layout.fileMapFile(1)).doesNotExist();
        assertThat(layout.offsetIndexFile(EventKind.SLOW_QUERY, 2)).exists();
        assertThat(fixture.retriever().fetch("HASH1", 10)).hasSize(1);
    }

    @Test
    @DisplayName("Should leave the index files of an earlier version untouched by a later publish")
    void shouldIsolateIndexFilesPerVersion() throws IOException {
        // Given two published versions
        IngestCoordinator coordinator = fixture.coordinator();
        coordinator.ingest(new IngestRequest(source("a.log", List.of(slowQuery(1)))));
        coordinator.ingest(new IngestRequest(source("b.log", List.of(slowQuery(2)))));

        // When loading version 1 after version 2 is active
        Manifest v1 = fixture.dataset.getManifestStore().load(1).orElseThrow();
        Manifest v2 = fixture.dataset.currentManifest().orElseThrow();
        OffsetIndexInfo v1Index = v1.offsetIndex(EventKind.SLOW_QUERY);
        OffsetIndexInfo v2Index = v2.offsetIndex(EventKind.SLOW_QUERY);

        // Then the files v1 references still hold exactly what v1 recorded
        assertThat(v1Index.getPath()).isNotEqualTo(v2Index.getPath());
        assertThat(v1.getFileMapPath()).isNotEqualTo(v2.getFileMapPath());
        assertThat(Checksums.sha256(layout.resolve(v1Index.getPath()))).isEqualTo(v1Index.getChecksum());
        assertThat(Checksums.sha256(layout.resolve(v1.getFileMapPath()))).isEqualTo(v1.getFileMapChecksum());
        assertThat(fixture.indexWriter.readEntries(layout.resolve(v1Index.getPath()), "HASH2")).isEmpty();
        assertThat(fixture.dataset.fileRegistry(v1).lookup(2)).isEmpty();

        // And the unversioned copies follow the active version
        assertThat(layout.offsetIndexFile(EventKind.SLOW_QUERY)).hasSameBinaryContentAs(layout.resolve(v2Index.getPath()));
        assertThat(layout.fileMapFile()).hasSameBinaryContentAs(layout.resolve(v2.getFileMapPath()));
    }

    @Test
    @DisplayName("Should abort when cancelled while parsing")
    void shouldAbortOnCancelWhileParsing() throws IOException {
        assertCancelledIn(IngestState.PARSING);
    }

    @Test
    @DisplayName("Should abort when cancelled while flushing")
    void shouldAbortOnCancelWhileFlushing() throws IOException {
        assertCancelledIn(IngestState.FLUSHING);
    }

    @Test
    @DisplayName("Should abort when cancelled while publishing")
    void shouldAbortOnCancelWhilePublishing() throws IOException {
        assertCancelledIn(IngestState.PUBLISHING);
    }

    @Test
    @DisplayName("Should abort when the timeout passes while parsing")
    void shouldAbortOnTimeoutWhileParsing() throws IOException {
        assertTimedOutIn(IngestState.PARSING);
    }

    @Test
    @DisplayName("Should abort when the timeout passes while flushing")
    void shouldAbortOnTimeoutWhileFlushing() throws IOException {
        assertTimedOutIn(IngestState.FLUSHING);
    }

    @Test
    @DisplayName("Should abort when the timeout passes while publishing")
    void shouldAbortOnTimeoutWhilePublishing() throws IOException {
        assertTimedOutIn(IngestState.PUBLISHING);
    }

    @Test
    @DisplayName("Should not signal a cancel when no ingest is running")
    void shouldIgnoreCancelWhenIdle() {
        assertThat(fixture.coordinator().cancel()).isFalse();
    }

    private void assertCancelledIn(IngestState phase) throws IOException {
        // Given a published version 1 and a coordinator cancelled on entering the phase
        fixture.coordinator().ingest(new IngestRequest(source("a.log", List.of(slowQuery(1)))));
        PhaseHookTracker hooked = new PhaseHookTracker(phase);
        IngestCoordinator coordinator = fixture.coordinator(fixture.schemas, hooked);
        hooked.onEnter(() -> assertThat(coordinator.cancel()).isTrue());

        // When ingesting a second source
        assertAborted(coordinator, CancellationException.class);
        assertThat(hooked.entered).isTrue();
    }

    private void assertTimedOutIn(IngestState phase) throws IOException {
        // Given a published version 1 and a one second timeout that passes on entering the phase
        fixture.coordinator().ingest(new IngestRequest(source("a.log", List.of(slowQuery(1)))));
        fixture.settings.setTimeoutSeconds(1);
        PhaseHookTracker hooked = new PhaseHookTracker(phase);
        hooked.onEnter(() -> {
            try {
                Thread.sleep(1100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        IngestCoordinator coordinator = fixture.coordinator(fixture.schemas, hooked);

        // When ingesting a second source
        assertAborted(coordinator, TimeoutException.class);
    }

    private void assertAborted(IngestCoordinator coordinator, Class<? extends Exception> cause) throws IOException {
        List<Path> before = partitionFiles();
        Path source = source("b.log", List.of(slowQuery(2), slowQuery(3)));

        assertThatThrownBy(() -> coordinator.ingest(new IngestRequest(source)))
            .isInstanceOf(IngestFailedException.class)
            .hasCauseInstanceOf(cause);

        // Then version 1 stays active and nothing the run wrote is left behind
        assertThat(fixture.dataset.currentVersion()).isEqualTo(1);
        assertThat(fixture.dataset.getManifestStore().listVersions()).containsExactly(1L);
        assertThat(partitionFiles()).containsExactlyInAnyOrderElementsOf(before);
        assertThat(layout.offsetIndexFile(EventKind.SLOW_QUERY, 2)).doesNotExist();
        assertThat(layout.fileMapFile(2)).doesNotExist();
        assertThat(layout.stagingRoot()).isEmptyDirectory();
        assertThat(layout.lockFile()).doesNotExist();
        assertThat(coordinator.getState()).isEqualTo(IngestState.IDLE);
    }

    /**
     * Status tracker that runs an action on the ingest thread when a phase begins
     */
    private static final class PhaseHookTracker extends IngestStatusTracker {
        private final IngestState phase;
        private Runnable action = () -> { };
        private volatile boolean entered;

        PhaseHookTracker(IngestState phase) {
            this.phase = phase;
        }

        void onEnter(Runnable action) {
            this.action = action;
        }

        @Override
        public void transition(IngestState next) {
            super.transition(next);
            if (next == phase) {
                entered = true;
                action.run();
            }
        }
    }
}
