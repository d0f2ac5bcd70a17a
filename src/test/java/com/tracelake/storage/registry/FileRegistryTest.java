package com.tracelake.storage.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.domain.FileRegistryEntry;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.manifest.ManifestCorruptedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileRegistry Tests")
class FileRegistryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DatasetLayout layout;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        layout = new DatasetLayout(tempDir.resolve("dataset"));
        source = tempDir.resolve("mongod.log");
        Files.writeString(source, "line one\n", StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should assign ids from 1 and reuse them for unchanged sources")
    void shouldReuseIdForUnchangedSource() {
        FileRegistry registry = FileRegistry.load(layout, objectMapper);

        SourceRegistration first = registry.registerSource(source);
        SourceRegistration again = registry.registerSource(source);

        assertThat(first.getFileId()).isEqualTo(1);
        assertThat(first.isExisting()).isFalse();
        assertThat(again.getFileId()).isEqualTo(1);
        assertThat(again.isExisting()).isTrue();
        assertThat(again.getWarning()).isEmpty();
        assertThat(registry.entries()).hasSize(1);
        assertThat(first.getEntry().getContentLength()).isEqualTo(first.getEntry().getSize()).isEqualTo(9);
    }

    @Test
    @DisplayName("Should register changed content as a new id with a warning")
    void shouldWarnOnChangedSource() throws IOException {
        FileRegistry registry = FileRegistry.load(layout, objectMapper);
        registry.registerSource(source);

        Files.writeString(source, "line one\nline two\n", StandardCharsets.UTF_8);
        SourceRegistration changed = registry.registerSource(source);

        assertThat(changed.getFileId()).isEqualTo(2);
        assertThat(changed.isExisting()).isFalse();
        assertThat(changed.getWarning()).isPresent();
        assertThat(changed.getWarning().get().getPreviousFileId()).isEqualTo(1);
        assertThat(registry.isOverwritten(1)).isTrue();
        assertThat(registry.isOverwritten(2)).isFalse();
    }

    @Test
    @DisplayName("Should match a renamed source by its checksum")
    void shouldMatchByChecksum() throws IOException {
        FileRegistry registry = FileRegistry.load(layout, objectMapper);
        registry.registerSource(source);

        Path renamed = tempDir.resolve("mongod-copy.log");
        Files.copy(source, renamed);

        SourceRegistration registration = registry.registerSource(renamed);
        assertThat(registration.getFileId()).isEqualTo(1);
        assertThat(registration.isExisting()).isTrue();
    }

    @Test
    @DisplayName("Should keep a managed copy under the dataset root")
    void shouldKeepManagedCopy() {
        FileRegistry registry = FileRegistry.load(layout, objectMapper);

        SourceRegistration registration = registry.registerSource(source, true);

        FileRegistryEntry entry = registration.getEntry();
        assertThat(entry.getPath()).isEqualTo("source/1_mongod.log");
        assertThat(entry.getOriginalPath()).isEqualTo(source.toAbsolutePath().normalize().toString());
        assertThat(registry.resolvePath(entry)).exists();
        assertThat(registry.resolvePath(entry)).startsWith(layout.root());
    }

    @Test
    @DisplayName("Should reload a staged registry with the same entries")
    void shouldRoundTripStagedRegistry() throws IOException {
        FileRegistry registry = FileRegistry.load(layout, objectMapper);
        registry.registerSource(source);
        Path staged = registry.stage(tempDir.resolve("staging"));
        Files.createDirectories(layout.fileMapFile().getParent());
        Files.move(staged, layout.fileMapFile());

        FileRegistry reloaded = FileRegistry.load(layout, objectMapper);

        FileRegistryEntry entry = reloaded.lookup(1).orElseThrow();
        assertThat(entry.getPath()).isEqualTo(source.toAbsolutePath().normalize().toString());
        assertThat(entry.getChecksum()).isNotBlank();
        assertThat(reloaded.registerSource(source).getFileId()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept the legacy id-to-path form")
    void shouldLoadLegacyForm() throws IOException {
        Files.createDirectories(layout.fileMapFile().getParent());
        Files.writeString(layout.fileMapFile(),
            "{\"3\": " + objectMapper.writeValueAsString(source.toAbsolutePath().normalize().toString()) + "}");

        FileRegistry registry = FileRegistry.load(layout, objectMapper);

        assertThat(registry.lookup(3)).isPresent();
        assertThat(registry.lookup(3).get().getPath()).isEqualTo(source.toAbsolutePath().normalize().toString());
        SourceRegistration registration = registry.registerSource(source);
        assertThat(registration.getFileId()).isEqualTo(3);
        assertThat(registration.isExisting()).isTrue();
    }

    @Test
    @DisplayName("Should reject a file map that is not an object")
    void shouldRejectCorruptFileMap() throws IOException {
        Files.createDirectories(layout.fileMapFile().getParent());
        Files.writeString(layout.fileMapFile(), "[1, 2]");

        assertThatThrownBy(() -> FileRegistry.load(layout, objectMapper))
            .isInstanceOf(ManifestCorruptedException.class);
    }
}
