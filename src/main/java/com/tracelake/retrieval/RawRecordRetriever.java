package com.tracelake.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.config.TraceLakeSettings;
import com.tracelake.domain.EventKind;
import com.tracelake.domain.FileRegistryEntry;
import com.tracelake.domain.Manifest;
import com.tracelake.domain.OffsetIndexEntry;
import com.tracelake.domain.OffsetIndexInfo;
import com.tracelake.ingestion.SourceLineReader;
import com.tracelake.normalization.parsers.StructuredLogParser;
import com.tracelake.normalization.parsers.TimestampException;
import com.tracelake.storage.DatasetLayout;
import com.tracelake.storage.SourceFiles;
import com.tracelake.storage.index.OffsetIndexWriter;
import com.tracelake.storage.manifest.DatasetHandle;
import com.tracelake.storage.registry.FileRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads original log records back from their source files through the
 * offset indexes of the active manifest.
 *
 * Plain sources are memory-mapped at the recorded span. Gzip sources are
 * streamed and decompressed up to the span, whose offsets address the
 * decompressed bytes. Spans are checked against the content length recorded
 * at registration before any read.
 *
 * Text search reads the registered sources line by line, without the indexes.
 */
@Service
public class RawRecordRetriever {

    private static final Logger logger = LoggerFactory.getLogger(RawRecordRetriever.class);

    private final DatasetHandle dataset;
    private final OffsetIndexWriter indexWriter;
    private final ObjectMapper objectMapper;
    private final int maxLineBytes;

    public RawRecordRetriever(DatasetHandle dataset, OffsetIndexWriter indexWriter, ObjectMapper objectMapper,
                              TraceLakeSettings settings) {
        this.dataset = dataset;
        this.indexWriter = indexWriter;
        this.objectMapper = objectMapper;
        this.maxLineBytes = settings.getMaxLineBytes();
    }

    /**
     * Records stored under a record key, newest first
     *
     * @param recordKey the record key assigned at ingest
     * @param limit maximum number of records returned
     * @throws SourceUnavailableException if a source cannot be read and no sample was stored
     */
    public List<RetrievedRecord> fetch(String recordKey, int limit) {
        if (recordKey == null || recordKey.isBlank()) {
            throw new IllegalArgumentException("Record key is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
        Manifest manifest = dataset.currentManifest().orElse(null);
        if (manifest == null) {
            return new ArrayList<>();
        }

        DatasetLayout layout = dataset.getLayout();
        List<Located> located = new ArrayList<>();
        for (EventKind kind : EventKind.values()) {
            OffsetIndexInfo info = manifest.offsetIndex(kind);
            if (info == null) {
                continue;
            }
            for (OffsetIndexEntry entry : indexWriter.readEntries(layout.resolve(info.getPath()), recordKey)) {
                located.add(new Located(kind, entry));
            }
        }
        located.sort(Comparator.comparingLong((Located l) -> l.entry.getTsEpoch()).reversed()
            .thenComparingInt(l -> l.entry.getSpan().getFileId())
            .thenComparingLong(l -> l.entry.getSpan().getByteOffset()));

        FileRegistry registry = dataset.fileRegistry(manifest);
        List<RetrievedRecord> records = new ArrayList<>();
        for (Located candidate : located.subList(0, Math.min(limit, located.size()))) {
            records.add(retrieve(candidate.kind, candidate.entry, registry));
        }
        logger.debug("Fetched {} of {} records for key {}", records.size(), located.size(), recordKey);
        return records;
    }

    /**
     * Structured log lines of the registered sources containing the text or
     * matching the pattern, in file id and line order.
     *
     * Sources that are missing or were re-registered with different content
     * are skipped. Lines that are not JSON objects are not returned.
     *
     * @throws IllegalArgumentException on an empty request, invalid pattern or non-positive limit
     * @throws SourceUnavailableException if a present source cannot be read
     */
    public List<RawLogMatch> searchText(TextSearchRequest request) {
        TextSearchRequest.LineMatcher matcher = request.matcher();
        Manifest manifest = dataset.currentManifest().orElse(null);
        if (manifest == null) {
            return new ArrayList<>();
        }

        FileRegistry registry = dataset.fileRegistry(manifest);
        List<FileRegistryEntry> sources = new ArrayList<>(registry.entries());
        sources.sort(Comparator.comparingInt(FileRegistryEntry::getFileId));

        List<RawLogMatch> matches = new ArrayList<>();
        int skipped = 0;
        for (FileRegistryEntry source : sources) {
            Path path = registry.resolvePath(source);
            if (registry.isOverwritten(source.getFileId()) || path == null || !Files.isRegularFile(path)) {
                skipped++;
                continue;
            }
            if (searchSource(source.getFileId(), path, request, matcher, matches)) {
                break;
            }
        }
        logger.debug("Text search {} returned {} matches, {} sources skipped", request, matches.size(), skipped);
        return matches;
    }

    /**
     * @return true once the limit is reached
     */
    private boolean searchSource(int fileId, Path path, TextSearchRequest request,
                                 TextSearchRequest.LineMatcher matcher, List<RawLogMatch> matches) {
        try (SourceLineReader reader = new SourceLineReader(path, maxLineBytes)) {
            SourceLineReader.SourceLine line;
            while ((line = reader.next()) != null) {
                String text = line.text();
                if (text == null) {
                    continue;
                }
                String trimmed = text.trim();
                if (!trimmed.startsWith("{") || !matcher.matches(trimmed)) {
                    continue;
                }
                RawLogMatch match = toMatch(trimmed);
                if (match == null || !inRange(match, request)) {
                    continue;
                }
                match.setFileId(fileId);
                match.setPath(path.toString());
                match.setLineNumber(line.getLineNumber());
                match.setByteOffset(line.getOffset());
                match.setByteLength(line.getLength());
                matches.add(match);
                if (matches.size() >= request.getLimit()) {
                    return true;
                }
            }
            return false;
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to search source: " + e.getMessage(), fileId, path, e);
        }
    }

    private RawLogMatch toMatch(String line) {
        JsonNode entry;
        try {
            entry = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (!entry.isObject()) {
            return null;
        }
        RawLogMatch match = new RawLogMatch();
        match.setRaw(line);
        match.setLevel(textOf(entry, "s"));
        match.setComponent(textOf(entry, "c"));
        match.setContext(textOf(entry, "ctx"));
        match.setMessage(textOf(entry, "msg"));
        try {
            StructuredLogParser.EventTime time = StructuredLogParser.parseTime(entry);
            match.setTimestamp(time.getIso());
            match.setTsEpoch(time.getEpochSeconds());
        } catch (TimestampException e) {
            // kept without a timestamp
        }
        return match;
    }

    private static boolean inRange(RawLogMatch match, TextSearchRequest request) {
        return request.getTimeRange() == null || match.getTsEpoch() == null
            || request.getTimeRange().contains(match.getTsEpoch());
    }

    private static String textOf(JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private RetrievedRecord retrieve(EventKind kind, OffsetIndexEntry entry, FileRegistry registry) {
        RetrievedRecord record = new RetrievedRecord();
        record.setRecordKey(entry.getRecordKey());
        record.setKind(kind);
        record.setTsEpoch(entry.getTsEpoch());
        record.setFileId(entry.getSpan().getFileId());
        record.setByteOffset(entry.getSpan().getByteOffset());
        record.setByteLength(entry.getSpan().getByteLength());
        record.setLineNumber(entry.getLineNumber());

        FileRegistryEntry source = registry.lookup(entry.getSpan().getFileId()).orElse(null);
        Path path = source == null ? null : registry.resolvePath(source);
        record.setPath(path == null ? null : path.toString());
        try {
            record.setRaw(new String(readSpan(entry, source, path, registry), StandardCharsets.UTF_8));
        } catch (SourceUnavailableException e) {
            if (entry.getSample() == null) {
                throw e;
            }
            logger.warn("Returning stored sample for {}: {}", entry.getRecordKey(), e.getMessage());
            record.setRaw(entry.getSample());
            record.setFallback(true);
            record.setUnavailableReason(e.getMessage());
        }
        return record;
    }

    private byte[] readSpan(OffsetIndexEntry entry, FileRegistryEntry source, Path path, FileRegistry registry) {
        int fileId = entry.getSpan().getFileId();
        if (source == null) {
            throw new SourceUnavailableException("File id is not registered", fileId, null);
        }
        if (registry.isOverwritten(fileId)) {
            throw new SourceUnavailableException("Source was re-registered with different content", fileId, path);
        }
        if (!Files.isRegularFile(path)) {
            throw new SourceUnavailableException("Source file is missing", fileId, path);
        }
        try {
            if (source.spanLimit() > 0 && entry.getSpan().getEndOffset() > source.spanLimit()) {
                throw new SourceUnavailableException(
                    "Span ends at " + entry.getSpan().getEndOffset()
                        + " past the registered length of " + source.spanLimit() + " bytes",
                    fileId, path);
            }
            return SourceFiles.isCompressed(path) ? readCompressed(entry, path) : readMapped(entry, path);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read source: " + e.getMessage(), fileId, path, e);
        }
    }

    private static byte[] readMapped(OffsetIndexEntry entry, Path path) throws IOException {
        long offset = entry.getSpan().getByteOffset();
        int length = entry.getSpan().getByteLength();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            if (entry.getSpan().getEndOffset() > channel.size()) {
                throw new SourceUnavailableException(
                    "Source is truncated: span ends at " + entry.getSpan().getEndOffset()
                        + " but file has " + channel.size() + " bytes",
                    entry.getSpan().getFileId(), path);
            }
            byte[] bytes = new byte[length];
            if (length > 0) {
                MappedByteBuffer buffer = channel.map(FileChannel.MapMode.READ_ONLY, offset, length);
                buffer.get(bytes);
            }
            return bytes;
        }
    }

    private static byte[] readCompressed(OffsetIndexEntry entry, Path path) throws IOException {
        int length = entry.getSpan().getByteLength();
        try (InputStream in = SourceFiles.open(path)) {
            in.skipNBytes(entry.getSpan().getByteOffset());
            byte[] bytes = in.readNBytes(length);
            if (bytes.length < length) {
                throw new EOFException("span ends past the decompressed data");
            }
            return bytes;
        } catch (EOFException e) {
            throw new SourceUnavailableException("Source is truncated: " + e.getMessage(),
                entry.getSpan().getFileId(), path, e);
        }
    }

    private static final class Located {
        private final EventKind kind;
        private final OffsetIndexEntry entry;

        Located(EventKind kind, OffsetIndexEntry entry) {
            this.kind = kind;
            this.entry = entry;
        }
    }
}
