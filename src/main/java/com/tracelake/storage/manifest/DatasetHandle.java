package com.tracelake.storage.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.domain.Manifest;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.registry.FileRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A dataset root plus its cached active manifest.
 *
 * Passed explicitly to the services that read a dataset. The cached manifest
 * is re-read whenever {@code manifest.json} is replaced (new file key, size or
 * modification time), and refreshed directly by an in-process publish.
 */
public class DatasetHandle {

    private final DatasetLayout layout;
    private final ObjectMapper objectMapper;
    private final ManifestStore manifestStore;
    private final AtomicReference<CachedManifest> cached = new AtomicReference<>();

    public DatasetHandle(Path root, ObjectMapper objectMapper) {
        this.layout = new DatasetLayout(root);
        this.objectMapper = objectMapper;
        this.manifestStore = new ManifestStore(layout, objectMapper);
    }

    public DatasetLayout getLayout() {
        return layout;
    }

    public ManifestStore getManifestStore() {
        return manifestStore;
    }

    /**
     * The active manifest; one call per read operation gives that operation a
     * consistent snapshot
     */
    public Optional<Manifest> currentManifest() {
        FileStamp stamp = stamp(layout.manifestFile());
        if (stamp == null) {
            cached.set(null);
            return Optional.empty();
        }
        CachedManifest current = cached.get();
        if (current != null && current.stamp.equals(stamp)) {
            return Optional.of(current.manifest);
        }
        Optional<Manifest> loaded = manifestStore.load();
        // keyed by the stamp taken before reading; a newer file is detected on the next call
        loaded.ifPresent(m -> cached.set(new CachedManifest(stamp, m)));
        return loaded;
    }

    /**
     * Current dataset version, 0 before the first publish
     */
    public long currentVersion() {
        return currentManifest().map(Manifest::getDatasetVersion).orElse(0L);
    }

    /**
     * Fresh copy of the file registry of the active manifest
     */
    public FileRegistry fileRegistry() {
        return fileRegistry(currentManifest().orElse(null));
    }

    /**
     * Fresh copy of the file registry a manifest references
     */
    public FileRegistry fileRegistry(Manifest manifest) {
        if (manifest == null || manifest.getFileMapPath() == null) {
            return FileRegistry.load(layout, objectMapper);
        }
        return FileRegistry.load(layout, objectMapper, layout.resolve(manifest.getFileMapPath()));
    }

    /**
     * Install a manifest this process has just published
     */
    public void onPublished(Manifest manifest) {
        FileStamp stamp = stamp(layout.manifestFile());
        if (stamp != null) {
            cached.set(new CachedManifest(stamp, manifest));
        }
    }

    private static FileStamp stamp(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileStamp(attrs.fileKey(), attrs.lastModifiedTime().toMillis(), attrs.size());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + file, e);
        }
    }

    private static final class FileStamp {
        private final Object fileKey;
        private final long modifiedMillis;
        private final long size;

        FileStamp(Object fileKey, long modifiedMillis, long size) {
            this.fileKey = fileKey;
            this.modifiedMillis = modifiedMillis;
            this.size = size;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FileStamp)) {
                return false;
            }
            FileStamp other = (FileStamp) o;
            return modifiedMillis == other.modifiedMillis
                && size == other.size
                && Objects.equals(fileKey, other.fileKey);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fileKey, modifiedMillis, size);
        }
    }

    private static final class CachedManifest {
        private final FileStamp stamp;
        private final Manifest manifest;

        CachedManifest(FileStamp stamp, Manifest manifest) {
            this.stamp = stamp;
            this.manifest = manifest;
        }
    }
}
