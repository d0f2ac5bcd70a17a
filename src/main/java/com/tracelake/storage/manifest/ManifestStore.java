package com.tracelake.storage.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.Manifest;
import com.tracelake.domain.OffsetIndexInfo;
import com.tracelake.storage.DatasetLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and publishes manifest snapshots.
 *
 * Every published version is kept as {@code manifests/manifest_v<n>.json};
 * {@code manifest.json} is the active one and is only ever replaced by an
 * atomic rename, so a crash mid-publish leaves the previous version active.
 */
public class ManifestStore {

    private static final Logger logger = LoggerFactory.getLogger(ManifestStore.class);

    private static final Pattern HISTORY_FILE = Pattern.compile("manifest_v(\\d+)\\.json");

    private final DatasetLayout layout;
    private final ObjectMapper objectMapper;

    public ManifestStore(DatasetLayout layout, ObjectMapper objectMapper) {
        this.layout = layout;
        this.objectMapper = objectMapper;
    }

    /**
     * The active manifest, or empty for a dataset that was never published
     *
     * @throws ManifestCorruptedException if {@code manifest.json} exists but is unreadable
     */
    public Optional<Manifest> load() {
        Path file = layout.manifestFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    public Optional<Manifest> load(long version) {
        Path file = layout.historyManifestFile(version);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    /**
     * Versions with a history snapshot, ascending
     */
    public List<Long> listVersions() {
        Path dir = layout.manifestsDir();
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .map(p -> HISTORY_FILE.matcher(p.getFileName().toString()))
                .filter(Matcher::matches)
                .map(m -> Long.parseLong(m.group(1)))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list manifest history", e);
        }
    }

    /**
     * Publish a new version: history snapshot first, then the atomic rename of
     * {@code manifest.json}. If the rename fails the snapshot is removed again.
     *
     * @param stagingDir directory for the temporary file, on the same file system as the dataset
     * @throws IllegalStateException if the version does not increase
     */
    public Manifest publish(Manifest manifest, Path stagingDir) {
        long current = load().map(Manifest::getDatasetVersion).orElse(0L);
        if (manifest.getDatasetVersion() <= current) {
            throw new IllegalStateException(
                "Dataset version must increase: active " + current + ", publishing " + manifest.getDatasetVersion());
        }
        Path history = layout.historyManifestFile(manifest.getDatasetVersion());
        Path staged = stagingDir.resolve("manifest.json");
        try {
            Files.createDirectories(stagingDir);
            Files.createDirectories(layout.manifestsDir());
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
            Files.write(staged, content);
            Files.write(history, content);
            try {
                Files.move(staged, layout.manifestFile(),
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                Files.deleteIfExists(history);
                throw e;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to publish manifest v" + manifest.getDatasetVersion(), e);
        }
        logger.info("Published manifest v{} ({} partitions)",
            manifest.getDatasetVersion(), manifest.getPartitions().size());
        return manifest;
    }

    /**
     * Copy the offset indexes and file map a manifest references to their
     * unversioned paths. Copies that already match are left alone.
     */
    public void refreshIndexCopies(Manifest manifest) throws IOException {
        for (EventKind kind : EventKind.values()) {
            OffsetIndexInfo info = manifest.offsetIndex(kind);
            if (info != null) {
                copyIfChanged(layout.resolve(info.getPath()), layout.offsetIndexFile(kind));
            }
        }
        if (manifest.getFileMapPath() != null) {
            copyIfChanged(layout.resolve(manifest.getFileMapPath()), layout.fileMapFile());
        }
    }

    /**
     * Delete all but the latest {@code keepLatest} history snapshots, and the
     * partition and versioned index files no retained snapshot references. The
     * caller must hold the ingest lock so no unpublished files are on disk.
     *
     * @return number of partition files deleted
     */
    public int prune(int keepLatest) {
        if (keepLatest < 1) {
            throw new IllegalArgumentException("keepLatest must be at least 1");
        }
        List<Long> versions = new ArrayList<>(listVersions());
        Optional<Manifest> active = load();
        List<Long> retained = versions.subList(Math.max(0, versions.size() - keepLatest), versions.size());

        Set<String> referenced = new HashSet<>();
        active.ifPresent(m -> collectReferences(m, referenced));
        for (Long version : retained) {
            load(version).ifPresent(m -> collectReferences(m, referenced));
        }

        int deletedSnapshots = 0;
        int deletedPartitions = 0;
        int deletedIndexFiles = 0;
        try {
            for (Long version : versions) {
                boolean isActive = active.isPresent() && active.get().getDatasetVersion() == version;
                if (!retained.contains(version) && !isActive) {
                    Files.deleteIfExists(layout.historyManifestFile(version));
                    deletedSnapshots++;
                }
            }
            for (EventKind kind : EventKind.values()) {
                Path kindDir = layout.kindDir(kind);
                if (!Files.isDirectory(kindDir)) {
                    continue;
                }
                List<Path> files;
                try (Stream<Path> walk = Files.walk(kindDir)) {
                    files = walk
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith("." + DatasetLayout.PARQUET_EXTENSION))
                        .collect(Collectors.toList());
                }
                for (Path file : files) {
                    if (!referenced.contains(layout.relativize(file))) {
                        Files.deleteIfExists(file);
                        deletedPartitions++;
                    }
                }
            }
            deletedIndexFiles = pruneIndexFiles(referenced);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prune dataset", e);
        }
        logger.info("Pruned {} manifest snapshots, {} partition files and {} index files",
            deletedSnapshots, deletedPartitions, deletedIndexFiles);
        return deletedPartitions;
    }

    private int pruneIndexFiles(Set<String> referenced) throws IOException {
        Path indexDir = layout.indexDir();
        if (!Files.isDirectory(indexDir)) {
            return 0;
        }
        List<Path> versioned;
        try (Stream<Path> files = Files.list(indexDir)) {
            versioned = files
                .filter(DatasetLayout::isVersionedIndexFile)
                .collect(Collectors.toList());
        }
        int deleted = 0;
        for (Path file : versioned) {
            if (!referenced.contains(layout.relativize(file))) {
                Files.deleteIfExists(file);
                deleted++;
            }
        }
        return deleted;
    }

    private static void collectReferences(Manifest manifest, Set<String> referenced) {
        manifest.getPartitions().forEach(p -> referenced.add(p.getPath()));
        manifest.getOffsetIndexes().values().forEach(i -> referenced.add(i.getPath()));
        if (manifest.getFileMapPath() != null) {
            referenced.add(manifest.getFileMapPath());
        }
    }

    private static void copyIfChanged(Path source, Path target) throws IOException {
        if (source.equals(target) || !Files.exists(source)) {
            return;
        }
        if (Files.exists(target) && Files.mismatch(source, target) == -1L) {
            return;
        }
        Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
        Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private Manifest read(Path file) {
        Manifest manifest;
        try {
            manifest = objectMapper.readValue(file.toFile(), Manifest.class);
        } catch (IOException e) {
            throw new ManifestCorruptedException("Unreadable manifest", file, e);
        }
        if (manifest == null) {
            throw new ManifestCorruptedException("Empty manifest", file, null);
        }
        if (manifest.getSchemaVersion() > Manifest.SCHEMA_VERSION) {
            throw new ManifestCorruptedException(
                "Unsupported manifest schema version " + manifest.getSchemaVersion(), file, null);
        }
        return manifest;
    }
}
