package com.tracelake.storage;

import com.tracelake.domain.EventKind;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * File layout of a dataset root.
 *
 * <pre>
 * manifest.json                                   active snapshot
 * manifests/manifest_v&lt;n&gt;.json                    history snapshots
 * &lt;kind&gt;/&lt;yyyy&gt;/&lt;MM&gt;/&lt;dd&gt;/chunk_&lt;seq&gt;.parquet       partitions
 * index/&lt;kind&gt;_offsets.v&lt;n&gt;.parquet              offset index per kind and version
 * index/file_map.v&lt;n&gt;.json                        file registry per version
 * index/&lt;kind&gt;_offsets.parquet                   copy of the active offset index
 * index/file_map.json                             copy of the active file registry
 * source/                                         managed source copies
 * .staging/&lt;ingest_id&gt;/                           in-flight run files
 * .ingest.lock                                    writer lock
 * </pre>
 *
 * Manifests reference the versioned index files, which are written once and
 * only removed by pruning. The unversioned copies are refreshed after each
 * publish for external tools and are never read through a manifest.
 */
public class DatasetLayout {

    public static final String PARQUET_EXTENSION = "parquet";

    private static final Pattern VERSIONED_INDEX_FILE =
        Pattern.compile("(\\w+_offsets\\.v\\d+\\.parquet|file_map\\.v\\d+\\.json)");

    private final Path root;

    public DatasetLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path manifestFile() {
        return root.resolve("manifest.json");
    }

    public Path manifestsDir() {
        return root.resolve("manifests");
    }

    public Path historyManifestFile(long version) {
        return manifestsDir().resolve("manifest_v" + version + ".json");
    }

    public Path indexDir() {
        return root.resolve("index");
    }

    public Path offsetIndexFile(EventKind kind) {
        return indexDir().resolve(kind.getValue() + "_offsets." + PARQUET_EXTENSION);
    }

    public Path offsetIndexFile(EventKind kind, long version) {
        return indexDir().resolve(kind.getValue() + "_offsets.v" + version + "." + PARQUET_EXTENSION);
    }

    public Path fileMapFile() {
        return indexDir().resolve("file_map.json");
    }

    public Path fileMapFile(long version) {
        return indexDir().resolve("file_map.v" + version + ".json");
    }

    /**
     * True for a per-version offset index or file map
     */
    public static boolean isVersionedIndexFile(Path file) {
        return VERSIONED_INDEX_FILE.matcher(file.getFileName().toString()).matches();
    }

    public Path sourceDir() {
        return root.resolve("source");
    }

    public Path stagingRoot() {
        return root.resolve(".staging");
    }

    public Path stagingDir(String ingestId) {
        return stagingRoot().resolve(ingestId);
    }

    public Path lockFile() {
        return root.resolve(".ingest.lock");
    }

    public Path kindDir(EventKind kind) {
        return root.resolve(kind.getValue());
    }

    public Path partitionFile(EventKind kind, LocalDate date, long sequence) {
        return kindDir(kind)
            .resolve(String.format("%04d", date.getYear()))
            .resolve(String.format("%02d", date.getMonthValue()))
            .resolve(String.format("%02d", date.getDayOfMonth()))
            .resolve(String.format("chunk_%06d.%s", sequence, PARQUET_EXTENSION));
    }

    /**
     * Path relative to the root with forward slashes, as stored in the manifest
     */
    public String relativize(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public Path resolve(String relativePath) {
        return root.resolve(relativePath).normalize();
    }
}
