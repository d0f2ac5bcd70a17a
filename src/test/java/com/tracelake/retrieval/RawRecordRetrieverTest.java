package com.tracelake.retrieval;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracelake.TestLogs;
import com.tracelake.TraceLakeFixture;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.FileRegistryEntry;
import com.tracelake.domain.Manifest;
import com.tracelake.ingestion.IngestRequest;
import com.tracelake.query.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RawRecordRetriever Tests")
class RawRecordRetrieverTest {

    @TempDir
    Path tempDir;

    private TraceLakeFixture fixture;
    private RawRecordRetriever retriever;

    private final String first = TestLogs.slowQuery("2024-03-01T10:00:00.000+00:00", "shop.orders", "AAAA1111", "COLLSCAN", 120);
    private final String second = TestLogs.slowQuery("2024-03-01T10:05:00.000+00:00", "shop.users", "BBBB2222", "IXSCAN { _id: 1 }", 80);
    private final String third = TestLogs.slowQuery("2024-03-01T10:10:00.000+00:00", "shop.orders", "AAAA1111", "COLLSCAN", 300);

    @BeforeEach
    void setUp() {
        fixture = new TraceLakeFixture(tempDir.resolve("dataset"));
        retriever = fixture.retriever();
    }

    private void ingest(Path source) {
        fixture.coordinator().ingest(new IngestRequest(source));
    }

    @Test
    @DisplayName("Should return nothing before the first ingest")
    void shouldReturnNothingForEmptyDataset() {
        assertThat(retriever.fetch("AAAA1111", 10)).isEmpty();
    }

    @Test
    @DisplayName("Should return the exact original bytes, newest first")
    void shouldReturnExactBytes() throws IOException {
        // Given a source with CRLF endings, which must not leak into the records
        Path source = tempDir.resolve("mongod.log");
        Files.write(source, (first + "\r\n" + second + "\r\n" + third + "\r\n").getBytes(StandardCharsets.UTF_8));
        ingest(source);

        // When fetching a key that occurs twice
        List<RetrievedRecord> records = retriever.fetch("AAAA1111", 10);

        // Then both lines come back unchanged with their provenance
        assertThat(records).extracting(RetrievedRecord::getRaw).containsExactly(third, first);
        RetrievedRecord newest = records.get(0);
        assertThat(newest.getKind()).isEqualTo(EventKind.SLOW_QUERY);
        assertThat(newest.getFileId()).isEqualTo(1);
        assertThat(newest.getLineNumber()).isEqualTo(3);
        assertThat(newest.getByteOffset()).isEqualTo(first.length() + second.length() + 4);
        assertThat(newest.getByteLength()).isEqualTo(third.length());
        assertThat(newest.getPath()).isEqualTo(source.toAbsolutePath().normalize().toString());
        assertThat(newest.isFallback()).isFalse();

        assertThat(retriever.fetch("BBBB2222", 10)).extracting(RetrievedRecord::getRaw).containsExactly(second);
        assertThat(retriever.fetch("UNKNOWN", 10)).isEmpty();
    }

    @Test
    @DisplayName("Should honour the limit")
    void shouldApplyLimit() throws IOException {
        ingest(TestLogs.write(tempDir.resolve("mongod.log"), List.of(first, second, third)));

        assertThat(retriever.fetch("AAAA1111", 1)).extracting(RetrievedRecord::getRaw).containsExactly(third);
    }

    @Test
    @DisplayName("Should read spans from gzip sources")
    void shouldReadGzipSource() throws IOException {
        ingest(TestLogs.writeGzip(tempDir.resolve("mongod.log.gz"), List.of(first, second, third)));

        assertThat(retriever.fetch("BBBB2222", 10)).singleElement()
            .satisfies(record -> {
                assertThat(record.getRaw()).isEqualTo(second);
                assertThat(record.getByteOffset()).isEqualTo(first.length() + 1);
                assertThat(record.isFallback()).isFalse();
            });
    }

    @Test
    @DisplayName("Should register the decompressed length of gzip sources and keep spans within it")
    void shouldBoundGzipSpansByContentLength() throws IOException {
        // Given a gzip source
        Path source = TestLogs.writeGzip(tempDir.resolve("mongod.log.gz"), List.of(first, second, third));
        ingest(source);

        // When looking up its registry entry and the span of the last line
        FileRegistryEntry entry = fixture.dataset.fileRegistry().lookup(1).orElseThrow();
        RetrievedRecord last = retriever.fetch("AAAA1111", 1).get(0);

        // Then the registered length is the decompressed one and the span ends within it
        long decompressed = first.length() + second.length() + third.length() + 3;
        assertThat(entry.getSize()).isEqualTo(Files.size(source));
        assertThat(entry.getContentLength()).isEqualTo(decompressed);
        assertThat(last.getByteOffset() + last.getByteLength()).isLessThanOrEqualTo(entry.getContentLength());
        assertThat(last.getRaw()).isEqualTo(third);
    }

    @Test
    @DisplayName("Should refuse a gzip span that ends past the registered length")
    void shouldRejectGzipSpanPastContentLength() throws IOException {
        // Given a gzip source whose registered length is shorter than its second line's span
        ingest(TestLogs.writeGzip(tempDir.resolve("mongod.log.gz"), List.of(first, second)));
        Manifest manifest = fixture.dataset.currentManifest().orElseThrow();
        Path fileMap = fixture.dataset.getLayout().resolve(manifest.getFileMapPath());
        ObjectNode registry = (ObjectNode) fixture.objectMapper.readTree(fileMap.toFile());
        ((ObjectNode) registry.get("1")).put("content_length", first.length() + 1);
        fixture.objectMapper.writeValue(fileMap.toFile(), registry);

        // When fetching that line
        RetrievedRecord record = retriever.fetch("BBBB2222", 10).get(0);

        // Then the bytes are not read and the stored sample is returned
        assertThat(record.isFallback()).isTrue();
        assertThat(record.getRaw()).isEqualTo(second);
        assertThat(record.getUnavailableReason()).contains("registered length");
    }

    @Test
    @DisplayName("Should fall back to the stored sample when the source is gone")
    void shouldFallBackToSample() throws IOException {
        Path source = TestLogs.write(tempDir.resolve("mongod.log"), List.of(first, second));
        ingest(source);
        Files.delete(source);

        RetrievedRecord record = retriever.fetch("BBBB2222", 10).get(0);

        assertThat(record.isFallback()).isTrue();
        assertThat(record.getRaw()).isEqualTo(second);
        assertThat(record.getUnavailableReason()).contains("missing");
    }

    @Test
    @DisplayName("Should fail when the source is gone and no sample was stored")
    void shouldFailWithoutSample() throws IOException {
        fixture = new TraceLakeFixture(tempDir.resolve("no-samples"), settings -> settings.setSampleChars(0));
        retriever = fixture.retriever();
        Path source = TestLogs.write(tempDir.resolve("mongod.log"), List.of(first));
        ingest(source);
        Files.delete(source);

        assertThatThrownBy(() -> retriever.fetch("AAAA1111", 10))
            .isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    @DisplayName("Should not read a source whose content changed since ingest")
    void shouldDetectOverwrittenSource() throws IOException {
        // Given a source ingested, then rewritten with other content and ingested again
        Path source = TestLogs.write(tempDir.resolve("mongod.log"), List.of(first, second));
        ingest(source);
        TestLogs.write(source, List.of(third));
        ingest(source);

        // When fetching a record that only the old content had
        RetrievedRecord record = retriever.fetch("BBBB2222", 10).get(0);

        // Then the stored sample is returned instead of the bytes now at that offset
        assertThat(record.getFileId()).isEqualTo(1);
        assertThat(record.isFallback()).isTrue();
        assertThat(record.getRaw()).isEqualTo(second);
        assertThat(retriever.fetch("AAAA1111", 10)).extracting(RetrievedRecord::getFileId).contains(2);
    }

    @Test
    @DisplayName("Should reject a blank key or a non-positive limit")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> retriever.fetch(" ", 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retriever.fetch("AAAA1111", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should find raw lines by text, case-insensitively, with their fields and location")
    void shouldSearchRawText() throws IOException {
        ingest(TestLogs.write(tempDir.resolve("mongod.log"), List.of(first, second, third)));

        List<RawLogMatch> matches = retriever.searchText(TextSearchRequest.forText("SHOP.USERS"));

        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.getRaw()).isEqualTo(second);
            assertThat(match.getFileId()).isEqualTo(1);
            assertThat(match.getLineNumber()).isEqualTo(2);
            assertThat(match.getByteOffset()).isEqualTo(first.length() + 1);
            assertThat(match.getByteLength()).isEqualTo(second.length());
            assertThat(match.getTsEpoch()).isEqualTo(1709287500L);
            assertThat(match.getMessage()).isEqualTo("Slow query");
            assertThat(match.getLevel()).isEqualTo("I");
            assertThat(match.getComponent()).isEqualTo("COMMAND");
            assertThat(match.getContext()).isEqualTo("conn12");
        });
        assertThat(retriever.searchText(TextSearchRequest.builder().text("SHOP.USERS").caseSensitive(true).build()))
            .isEmpty();
    }

    @Test
    @DisplayName("Should search by pattern in line order up to the limit")
    void shouldSearchByPattern() throws IOException {
        ingest(TestLogs.write(tempDir.resolve("mongod.log"), List.of(first, second, third)));

        TextSearchRequest.Builder request = TextSearchRequest.builder().regex("durationMillis\":(120|300),");

        assertThat(retriever.searchText(request.build())).extracting(RawLogMatch::getRaw).containsExactly(first, third);
        assertThat(retriever.searchText(request.limit(1).build())).extracting(RawLogMatch::getRaw).containsExactly(first);
    }

    @Test
    @DisplayName("Should restrict text search to a time range")
    void shouldSearchWithinTimeRange() throws IOException {
        ingest(TestLogs.writeGzip(tempDir.resolve("mongod.log.gz"), List.of(first, second, third)));

        List<RawLogMatch> matches = retriever.searchText(TextSearchRequest.builder()
            .text("slow query")
            .timeRange(new TimeRange(1709287500L, 1709287800L))
            .build());

        assertThat(matches).extracting(RawLogMatch::getRaw).containsExactly(second, third);
        assertThat(matches.get(1).getByteOffset()).isEqualTo(first.length() + second.length() + 2);
    }

    @Test
    @DisplayName("Should skip sources that are no longer on disk")
    void shouldSkipMissingSourcesInTextSearch() throws IOException {
        // Given two sources, one of them deleted after ingest
        Path gone = TestLogs.write(tempDir.resolve("mongod.log"), List.of(first, second));
        ingest(gone);
        ingest(TestLogs.write(tempDir.resolve("mongod-2.log"), List.of(third)));
        Files.delete(gone);

        // Then only the remaining source is searched
        assertThat(retriever.searchText(TextSearchRequest.forText("AAAA1111"))).singleElement()
            .satisfies(match -> {
                assertThat(match.getRaw()).isEqualTo(third);
                assertThat(match.getFileId()).isEqualTo(2);
            });
    }

    @Test
    @DisplayName("Should reject empty text searches and invalid patterns")
    void shouldRejectInvalidTextSearch() {
        assertThatThrownBy(() -> retriever.searchText(TextSearchRequest.forText("")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retriever.searchText(TextSearchRequest.builder().regex("(unclosed").build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid search pattern");
        assertThatThrownBy(() -> retriever.searchText(TextSearchRequest.builder().text("x").limit(0).build()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
