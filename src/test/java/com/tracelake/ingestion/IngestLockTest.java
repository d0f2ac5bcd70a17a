package com.tracelake.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.storage.DatasetLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IngestLock Tests")
class IngestLockTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DatasetLayout layout;

    @BeforeEach
    void setUp() {
        layout = new DatasetLayout(tempDir);
    }

    private IngestLock lockAt(Instant now) {
        return new IngestLock(layout, objectMapper, Duration.ofMinutes(30), Clock.fixed(now, ZoneOffset.UTC));
    }

    private void writeHolder(String ingestId, long pid, String host, Instant acquiredAt) throws IOException {
        objectMapper.writeValue(layout.lockFile().toFile(), new LockInfo(ingestId, pid, host, acquiredAt.toString()));
    }

    @Test
    @DisplayName("Should create the lock file and delete it on release")
    void shouldAcquireAndRelease() {
        IngestLock lock = lockAt(NOW);

        try (IngestLock.Lease lease = lock.acquire("run-1", false)) {
            assertThat(layout.lockFile()).exists();
            assertThat(lock.current()).isPresent();
            assertThat(lock.current().get().getIngestId()).isEqualTo("run-1");
            assertThat(lease.getInfo().getPid()).isEqualTo(ProcessHandle.current().pid());
        }

        assertThat(layout.lockFile()).doesNotExist();
        assertThat(lock.current()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a second ingest while the lock is held")
    void shouldRejectConcurrentAcquire() {
        IngestLock lock = lockAt(NOW);
        lock.acquire("run-1", false);

        assertThatThrownBy(() -> lock.acquire("run-2", false))
            .isInstanceOf(IngestInProgressException.class);
        assertThat(lock.current().get().getIngestId()).isEqualTo("run-1");
    }

    @Test
    @DisplayName("Should refuse to override a fresh lock")
    void shouldRefuseOverrideOfFreshLock() throws IOException {
        writeHolder("other", 999_999_999L, IngestLock.localHost(), NOW.minus(Duration.ofMinutes(5)));

        assertThatThrownBy(() -> lockAt(NOW).acquire("run-2", true))
            .isInstanceOf(IngestInProgressException.class)
            .hasMessageContaining("not stale");
    }

    @Test
    @DisplayName("Should take over an old lock whose process is gone")
    void shouldOverrideStaleLock() throws IOException {
        // Given a lock from this host, two hours old, held by a pid that does not exist
        writeHolder("crashed", 999_999_999L, IngestLock.localHost(), NOW.minus(Duration.ofHours(2)));
        IngestLock lock = lockAt(NOW);

        // When overriding
        IngestLock.Lease lease = lock.acquire("run-2", true);

        // Then the new run holds the lock
        assertThat(lease.getInfo().getIngestId()).isEqualTo("run-2");
        assertThat(lock.current().get().getIngestId()).isEqualTo("run-2");
    }

    @Test
    @DisplayName("Should not treat an old lock of a live process as stale")
    void shouldKeepLockOfLiveProcess() throws IOException {
        writeHolder("running", ProcessHandle.current().pid(), IngestLock.localHost(), NOW.minus(Duration.ofHours(2)));
        IngestLock lock = lockAt(NOW);

        assertThat(lock.isStale(lock.current().orElseThrow(), layout.lockFile())).isFalse();
    }

    @Test
    @DisplayName("Should not judge locks held from another host by pid")
    void shouldKeepLockOfOtherHost() throws IOException {
        writeHolder("remote", 999_999_999L, "some-other-host.invalid", NOW.minus(Duration.ofHours(2)));
        IngestLock lock = lockAt(NOW);

        assertThat(lock.isStale(lock.current().orElseThrow(), layout.lockFile())).isFalse();
    }

    @Test
    @DisplayName("Should leave a lock that was taken over in place on release")
    void shouldNotDeleteForeignLockOnRelease() throws IOException {
        IngestLock lock = lockAt(NOW);
        IngestLock.Lease lease = lock.acquire("run-1", false);
        writeHolder("run-2", 1L, IngestLock.localHost(), NOW);

        lease.release();

        assertThat(lock.current().get().getIngestId()).isEqualTo("run-2");
    }
}
