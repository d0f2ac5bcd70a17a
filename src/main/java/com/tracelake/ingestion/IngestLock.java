package com.tracelake.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.storage.DatasetLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Exclusive writer lock of a dataset, held as the {@code .ingest.lock} file.
 *
 * The file is created with CREATE_NEW so exactly one writer wins. A held lock
 * can only be taken over on explicit request, and only when it is stale: older
 * than the configured age and owned by a process on this host that is no
 * longer alive.
 */
public class IngestLock {

    private static final Logger logger = LoggerFactory.getLogger(IngestLock.class);

    private final DatasetLayout layout;
    private final ObjectMapper objectMapper;
    private final Duration staleAfter;
    private final Clock clock;

    public IngestLock(DatasetLayout layout, ObjectMapper objectMapper, Duration staleAfter) {
        this(layout, objectMapper, staleAfter, Clock.systemUTC());
    }

    IngestLock(DatasetLayout layout, ObjectMapper objectMapper, Duration staleAfter, Clock clock) {
        this.layout = layout;
        this.objectMapper = objectMapper;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    /**
     * Take the lock for an ingest run
     *
     * @param override take over a stale lock
     * @throws IngestInProgressException if the lock is held and cannot be taken over
     */
    public Lease acquire(String ingestId, boolean override) {
        LockInfo info = new LockInfo(ingestId, ProcessHandle.current().pid(), localHost(), clock.instant().toString());
        Path file = layout.lockFile();
        try {
            Files.createDirectories(file.getParent());
            byte[] content = objectMapper.writeValueAsBytes(info);
            try {
                Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return new Lease(info);
            } catch (FileAlreadyExistsException e) {
                LockInfo holder = current().orElse(null);
                if (!override) {
                    throw new IngestInProgressException("Dataset is locked by another ingest", holder);
                }
                if (!isStale(holder, file)) {
                    throw new IngestInProgressException("Lock override refused: holder is not stale", holder);
                }
                logger.warn("Overriding stale ingest lock held by {}",
                    holder == null ? "unknown owner" : holder.getIngestId());
                Files.deleteIfExists(file);
                try {
                    Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                } catch (FileAlreadyExistsException race) {
                    throw new IngestInProgressException("Dataset was locked during override", current().orElse(null));
                }
                return new Lease(info);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create ingest lock " + file, e);
        }
    }

    /**
     * The current holder, if the lock file exists and is readable
     */
    public Optional<LockInfo> current() {
        Path file = layout.lockFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), LockInfo.class));
        } catch (IOException e) {
            logger.warn("Unreadable ingest lock {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    boolean isStale(LockInfo holder, Path file) {
        Instant acquiredAt = acquiredAt(holder, file);
        if (Duration.between(acquiredAt, clock.instant()).compareTo(staleAfter) <= 0) {
            return false;
        }
        if (holder == null) {
            // unreadable lock file past the age limit
            return true;
        }
        if (!localHost().equals(holder.getHost())) {
            return false;
        }
        boolean alive = ProcessHandle.of(holder.getPid()).map(ProcessHandle::isAlive).orElse(false);
        return !alive;
    }

    private Instant acquiredAt(LockInfo holder, Path file) {
        if (holder != null && holder.getAcquiredAt() != null) {
            try {
                return Instant.parse(holder.getAcquiredAt());
            } catch (DateTimeParseException e) {
                logger.debug("Lock acquired_at '{}' unparsable, using file time", holder.getAcquiredAt());
            }
        }
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat ingest lock " + file, e);
        }
    }

    static String localHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    /**
     * A held lock; closing it releases the lock
     */
    public class Lease implements AutoCloseable {

        private final LockInfo info;
        private boolean released;

        Lease(LockInfo info) {
            this.info = info;
            logger.debug("Ingest lock acquired by {}", info.getIngestId());
        }

        public LockInfo getInfo() {
            return info;
        }

        /**
         * Delete the lock file if it still belongs to this lease
         */
        public synchronized void release() {
            if (released) {
                return;
            }
            released = true;
            Optional<LockInfo> holder = current();
            if (holder.isPresent() && !info.getIngestId().equals(holder.get().getIngestId())) {
                logger.warn("Ingest lock was taken over by {}, leaving it in place", holder.get().getIngestId());
                return;
            }
            try {
                Files.deleteIfExists(layout.lockFile());
                logger.debug("Ingest lock released by {}", info.getIngestId());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to release ingest lock", e);
            }
        }

        @Override
        public void close() {
            release();
        }
    }
}
