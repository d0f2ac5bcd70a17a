package com.tracelake.storage.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.domain.FileRegistryEntry;
import com.tracelake.storage.Checksums;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.SourceFiles;
import com.tracelake.storage.manifest.ManifestCorruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Assigns stable file ids to ingest sources. Each dataset version has its
 * own file map, {@code index/file_map.v<n>.json}.
 *
 * A source is matched first by its logical path, then by checksum. A path
 * seen before with the same content keeps its id; the same path with new
 * content gets a new id and a {@link SourceChangedWarning}. Content already
 * registered under another path keeps its id.
 *
 * Instances are working copies: the ingest coordinator registers into its own
 * copy and stages it for publish, readers load a fresh copy. Not thread-safe.
 */
public class FileRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FileRegistry.class);

    private final DatasetLayout layout;
    private final ObjectMapper objectMapper;
    private final TreeMap<Integer, FileRegistryEntry> entries;

    FileRegistry(DatasetLayout layout, ObjectMapper objectMapper, TreeMap<Integer, FileRegistryEntry> entries) {
        this.layout = layout;
        this.objectMapper = objectMapper;
        this.entries = entries;
    }

    /**
     * Load {@code index/file_map.json}, the copy of the latest published file map
     */
    public static FileRegistry load(DatasetLayout layout, ObjectMapper objectMapper) {
        return load(layout, objectMapper, layout.fileMapFile());
    }

    /**
     * Load a file map; a missing file yields an empty registry. Both the
     * structured form ({@code {"1": {...entry...}}}) and the legacy form
     * ({@code {"1": "/path/to/source"}}) are accepted.
     *
     * @throws ManifestCorruptedException if the file cannot be parsed
     */
    public static FileRegistry load(DatasetLayout layout, ObjectMapper objectMapper, Path file) {
        TreeMap<Integer, FileRegistryEntry> entries = new TreeMap<>();
        if (!Files.exists(file)) {
            return new FileRegistry(layout, objectMapper, entries);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ManifestCorruptedException("Unreadable file map", file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestCorruptedException("File map is not a JSON object", file, null);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int fileId;
            try {
                fileId = Integer.parseInt(field.getKey());
            } catch (NumberFormatException e) {
                throw new ManifestCorruptedException("Invalid file id '" + field.getKey() + "'", file, e);
            }
            JsonNode value = field.getValue();
            FileRegistryEntry entry;
            if (value.isTextual()) {
                entry = new FileRegistryEntry(fileId, value.asText(), null, 0L, null, null);
            } else if (value.isObject()) {
                try {
                    entry = objectMapper.treeToValue(value, FileRegistryEntry.class);
                } catch (IOException e) {
                    throw new ManifestCorruptedException("Invalid entry for file id " + fileId, file, e);
                }
                entry.setFileId(fileId);
            } else {
                throw new ManifestCorruptedException("Invalid entry for file id " + fileId, file, null);
            }
            entries.put(fileId, entry);
        }
        logger.debug("Loaded {} file registry entries from {}", entries.size(), file);
        return new FileRegistry(layout, objectMapper, entries);
    }

    public SourceRegistration registerSource(Path source) {
        return registerSource(source, false);
    }

    /**
     * Register a source file and return its file id.
     *
     * @param keepCopy copy new content to {@code source/<id>_<name>} and register the managed copy
     */
    public SourceRegistration registerSource(Path source, boolean keepCopy) {
        Path absolute = source.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new UncheckedIOException(new IOException("Source file not found: " + absolute));
        }
        String logicalPath = absolute.toString();
        String checksum = Checksums.sha256(absolute);
        long size;
        try {
            size = Files.size(absolute);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + absolute, e);
        }

        FileRegistryEntry byPath = latestForPath(logicalPath);
        if (byPath != null && (byPath.getChecksum() == null || byPath.getChecksum().equals(checksum))) {
            if (byPath.getChecksum() == null) {
                // legacy entry without content info
                byPath.setChecksum(checksum);
                byPath.setSize(size);
            }
            if (byPath.getContentLength() <= 0) {
                byPath.setContentLength(SourceFiles.contentLength(absolute));
            }
            logger.debug("Source {} unchanged, reusing file id {}", logicalPath, byPath.getFileId());
            return new SourceRegistration(byPath, true, null);
        }

        if (byPath == null) {
            FileRegistryEntry byChecksum = findByChecksum(checksum);
            if (byChecksum != null) {
                if (!Files.exists(resolvePath(byChecksum))) {
                    byChecksum.setPath(logicalPath);
                    byChecksum.setOriginalPath(logicalPath);
                }
                logger.debug("Source {} matches content of file id {}", logicalPath, byChecksum.getFileId());
                return new SourceRegistration(byChecksum, true, null);
            }
        }

        int fileId = entries.isEmpty() ? 1 : entries.lastKey() + 1;
        String storedPath = logicalPath;
        if (keepCopy) {
            storedPath = copyToManagedStore(absolute, fileId);
        }
        FileRegistryEntry entry = new FileRegistryEntry(
            fileId, storedPath, checksum, size, Instant.now().toString(), logicalPath);
        entry.setContentLength(SourceFiles.contentLength(absolute));
        entries.put(fileId, entry);

        SourceChangedWarning warning = null;
        if (byPath != null) {
            warning = new SourceChangedWarning(
                logicalPath, byPath.getFileId(), fileId, byPath.getChecksum(), checksum);
            logger.warn(warning.getMessage());
        }
        logger.info("Registered source {} as file id {}", logicalPath, fileId);
        return new SourceRegistration(entry, false, warning);
    }

    public Optional<FileRegistryEntry> lookup(int fileId) {
        return Optional.ofNullable(entries.get(fileId));
    }

    public Collection<FileRegistryEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Absolute path of an entry; managed copies are stored relative to the dataset root
     */
    public Path resolvePath(FileRegistryEntry entry) {
        Path path = Path.of(entry.getPath());
        return path.isAbsolute() ? path : layout.resolve(entry.getPath());
    }

    /**
     * True when a later registration stored different content at the same path,
     * so the bytes this entry describes are no longer on disk
     */
    public boolean isOverwritten(int fileId) {
        FileRegistryEntry entry = entries.get(fileId);
        if (entry == null) {
            return false;
        }
        for (FileRegistryEntry later : entries.tailMap(fileId, false).values()) {
            if (later.getPath().equals(entry.getPath())
                    && later.getChecksum() != null
                    && !later.getChecksum().equals(entry.getChecksum())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Write the registry to {@code file_map.json} in the given staging directory
     *
     * @return the staged file
     */
    public Path stage(Path stagingDir) {
        Path staged = stagingDir.resolve("file_map.json");
        try {
            Files.createDirectories(stagingDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(staged.toFile(), entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage file map", e);
        }
        return staged;
    }

    private FileRegistryEntry latestForPath(String logicalPath) {
        List<FileRegistryEntry> matches = new ArrayList<>();
        for (FileRegistryEntry entry : entries.values()) {
            if (logicalPath.equals(entry.logicalPath())) {
                matches.add(entry);
            }
        }
        return matches.isEmpty() ? null : matches.get(matches.size() - 1);
    }

    private FileRegistryEntry findByChecksum(String checksum) {
        for (FileRegistryEntry entry : entries.values()) {
            if (checksum.equals(entry.getChecksum())) {
                return entry;
            }
        }
        return null;
    }

    private String copyToManagedStore(Path source, int fileId) {
        Path target = layout.sourceDir().resolve(fileId + "_" + source.getFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy source to " + target, e);
        }
        logger.info("Copied source {} to managed store {}", source, target);
        return layout.relativize(target);
    }
}
