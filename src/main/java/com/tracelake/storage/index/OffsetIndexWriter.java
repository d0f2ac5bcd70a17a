package com.tracelake.storage.index;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.OffsetIndexEntry;
import com.tracelake.domain.RawSpan;
import com.tracelake.storage.Checksums;
import com.tracelake.storage.columnar.ParquetFiles;
import com.tracelake.storage.columnar.PartitionSchemas;
import com.tracelake.storage.columnar.WriteSession;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.filter2.predicate.FilterApi;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.io.api.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Writes and reads the per-kind offset index ({@code index/<kind>_offsets.v<n>.parquet}).
 *
 * During a run each drained batch of entries becomes a segment file in the
 * run's staging directory, written on the same lane right after its data
 * partition. At publish the index of the previous version (minus entries of
 * superseded file ids) and the run's segments are merged into one staged
 * file, which the coordinator places as the new version's index file.
 */
@Component
public class OffsetIndexWriter {

    private static final Logger logger = LoggerFactory.getLogger(OffsetIndexWriter.class);

    private final PartitionSchemas schemas;

    public OffsetIndexWriter(PartitionSchemas schemas) {
        this.schemas = schemas;
    }

    /**
     * Write a staged segment for the entries paired with one data partition
     *
     * @param sequence sequence number of the paired data partition
     * @return path of the segment file
     */
    public Path writeSegment(WriteSession session, EventKind kind, List<OffsetIndexEntry> entries, long sequence) {
        Path segment = session.getStagingDir()
            .resolve("offsets_" + kind.getValue() + "_" + String.format("%06d", sequence) + ".parquet");
        Schema schema = schemas.offsetIndexSchema();
        try {
            Files.createDirectories(session.getStagingDir());
            try (ParquetWriter<GenericRecord> writer = ParquetFiles.openWriter(segment, schema, session.getCodec())) {
                for (OffsetIndexEntry entry : entries) {
                    writer.write(toRecord(schema, entry));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Offset segment write failed for " + kind.getValue(), e);
        }
        logger.debug("Staged {} offset entries for {} in {}", entries.size(), kind.getValue(), segment.getFileName());
        return segment;
    }

    /**
     * Merge the published index with this run's segments into a staged file
     *
     * @param published currently published index file, or null when none exists
     * @param supersededFileIds file ids whose existing entries are dropped
     * @param segments the run's segment files for this kind, in write order
     */
    public StagedIndex mergeForPublish(WriteSession session, EventKind kind, Path published,
                                       Set<Integer> supersededFileIds, List<Path> segments) {
        Path staged = session.getStagingDir().resolve("index_" + kind.getValue() + "_offsets.parquet");
        Schema schema = schemas.offsetIndexSchema();
        long rows = 0;
        long dropped = 0;
        try {
            Files.createDirectories(session.getStagingDir());
            try (ParquetWriter<GenericRecord> writer = ParquetFiles.openWriter(staged, schema, session.getCodec())) {
                if (published != null && Files.exists(published)) {
                    try (ParquetReader<GenericRecord> reader = ParquetFiles.openReader(published)) {
                        GenericRecord record;
                        while ((record = reader.read()) != null) {
                            if (supersededFileIds.contains(ParquetFiles.intValue(record, "file_id"))) {
                                dropped++;
                                continue;
                            }
                            writer.write(copy(schema, record));
                            rows++;
                        }
                    }
                }
                for (Path segment : segments) {
                    try (ParquetReader<GenericRecord> reader = ParquetFiles.openReader(segment)) {
                        GenericRecord record;
                        while ((record = reader.read()) != null) {
                            writer.write(copy(schema, record));
                            rows++;
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Offset index merge failed for " + kind.getValue(), e);
        }
        if (dropped > 0) {
            logger.info("Dropped {} offset entries of superseded sources from {} index", dropped, kind.getValue());
        }
        return new StagedIndex(kind, staged, rows, Checksums.sha256(staged));
    }

    /**
     * Entries of an index file whose record key matches, using record-key pushdown
     */
    public List<OffsetIndexEntry> readEntries(Path indexFile, String recordKey) {
        List<OffsetIndexEntry> entries = new ArrayList<>();
        if (indexFile == null || !Files.exists(indexFile)) {
            return entries;
        }
        FilterCompat.Filter filter = FilterCompat.get(
            FilterApi.eq(FilterApi.binaryColumn("record_key"), Binary.fromString(recordKey)));
        try (ParquetReader<GenericRecord> reader = ParquetFiles.openReader(indexFile, filter)) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                if (recordKey.equals(ParquetFiles.string(record, "record_key"))) {
                    entries.add(fromRecord(record));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read offset index " + indexFile, e);
        }
        return entries;
    }

    private static GenericRecord toRecord(Schema schema, OffsetIndexEntry entry) {
        GenericRecord record = new GenericData.Record(schema);
        record.put("record_key", entry.getRecordKey());
        record.put("ts_epoch", entry.getTsEpoch());
        record.put("file_id", entry.getSpan().getFileId());
        record.put("byte_offset", entry.getSpan().getByteOffset());
        record.put("byte_length", entry.getSpan().getByteLength());
        record.put("line_number", entry.getLineNumber());
        record.put("sample", entry.getSample());
        return record;
    }

    private static GenericRecord copy(Schema schema, GenericRecord source) {
        return toRecord(schema, fromRecord(source));
    }

    private static OffsetIndexEntry fromRecord(GenericRecord record) {
        RawSpan span = new RawSpan(
            ParquetFiles.intValue(record, "file_id"),
            ParquetFiles.longValue(record, "byte_offset"),
            ParquetFiles.intValue(record, "byte_length"));
        return new OffsetIndexEntry(
            ParquetFiles.string(record, "record_key"),
            ParquetFiles.longValue(record, "ts_epoch"),
            span,
            ParquetFiles.longValue(record, "line_number"),
            ParquetFiles.string(record, "sample"));
    }
}
