package com.tracelake.storage.columnar;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.PartitionHandle;
import com.tracelake.ingestion.buffer.Chunk;
import com.tracelake.storage.Checksums;
import com.tracelake.storage.DatasetLayout;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.hadoop.ParquetWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Writes chunks to Parquet partition files.
 *
 * A partition is written under the run's staging directory and renamed into
 * {@code <kind>/<yyyy>/<MM>/<dd>/chunk_<seq>.parquet} only after it is closed,
 * so no reader can see a half-written file. A chunk whose events fall on
 * several UTC days becomes one partition per day.
 */
@Component
public class ColumnarWriter {

    private static final Logger logger = LoggerFactory.getLogger(ColumnarWriter.class);

    private final PartitionSchemas schemas;

    public ColumnarWriter(PartitionSchemas schemas) {
        this.schemas = schemas;
    }

    /**
     * Write one chunk as partitions and move them to their final names, one
     * partition per UTC day the chunk's events fall on
     *
     * @return handles of the closed, visible partitions, in date order
     * @throws SchemaViolationException if the chunk does not match the declared schema
     * @throws UncheckedIOException on I/O failure
     */
    public List<PartitionHandle> write(WriteSession session, Chunk chunk) {
        if (chunk.isEmpty()) {
            throw new IllegalArgumentException("Cannot write an empty chunk");
        }
        EventKind kind = chunk.getKind();
        Schema schema = schemas.schemaFor(kind);

        Map<LocalDate, List<Map<String, Object>>> rowsByDay = new TreeMap<>();
        for (NormalizedEvent event : chunk.getEvents()) {
            LocalDate day = Instant.ofEpochSecond(event.getTsEpoch()).atZone(ZoneOffset.UTC).toLocalDate();
            rowsByDay.computeIfAbsent(day, d -> new ArrayList<>()).add(EventRows.toRow(event));
        }
        if (session.claimValidation(kind)) {
            for (List<Map<String, Object>> rows : rowsByDay.values()) {
                validate(kind, schema, rows);
            }
        }
        if (rowsByDay.size() > 1) {
            logger.debug("Chunk of {} {} rows spans {} days", chunk.size(), kind.getValue(), rowsByDay.size());
        }

        List<PartitionHandle> handles = new ArrayList<>(rowsByDay.size());
        for (Map.Entry<LocalDate, List<Map<String, Object>>> day : rowsByDay.entrySet()) {
            handles.add(writePartition(session, kind, schema, day.getKey(), day.getValue()));
        }
        return handles;
    }

    private PartitionHandle writePartition(WriteSession session, EventKind kind, Schema schema,
                                           LocalDate date, List<Map<String, Object>> rows) {
        DatasetLayout layout = session.getLayout();
        Path temp = session.getStagingDir().resolve(kind.getValue() + "_" + UUID.randomUUID() + ".parquet.tmp");
        try {
            Files.createDirectories(session.getStagingDir());
            PartitionStats stats = writeFile(kind, schema, rows, temp, session.getCodec());

            long sequence;
            Path target;
            do {
                sequence = session.nextSequence();
                target = layout.partitionFile(kind, date, sequence);
            } while (Files.exists(target));

            String checksum = Checksums.sha256(temp);
            long size = Files.size(temp);
            Files.createDirectories(target.getParent());
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            session.recordPlacedFile(target);

            PartitionHandle handle = new PartitionHandle();
            handle.setKind(kind);
            handle.setPath(layout.relativize(target));
            handle.setDateKey(date.toString());
            handle.setSequence(sequence);
            handle.setRowCount(rows.size());
            handle.setByteSize(size);
            handle.setChecksum(checksum);
            handle.setMinTsEpoch(stats.minTs);
            handle.setMaxTsEpoch(stats.maxTs);
            handle.setMinKey(stats.minKey);
            handle.setMaxKey(stats.maxKey);
            handle.setFileId(session.getFileId());
            handle.setIngestId(session.getIngestId());

            logger.debug("Wrote {} rows to partition {}", rows.size(), handle.getPath());
            return handle;

        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Partition write failed for " + kind.getValue(), e);
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    /**
     * Check produced rows against the declared schema: every declared column
     * present with the declared type, no nulls in required columns, no
     * undeclared columns.
     */
    void validate(EventKind kind, Schema schema, List<Map<String, Object>> rows) {
        for (Map<String, Object> row : rows) {
            for (Schema.Field field : schema.getFields()) {
                if (!row.containsKey(field.name())) {
                    throw new SchemaViolationException("Missing declared column", kind, field.name());
                }
                Object value = row.get(field.name());
                if (value == null) {
                    if (PartitionSchemas.isRequired(field.schema())) {
                        throw new SchemaViolationException("Null value in required column", kind, field.name());
                    }
                    continue;
                }
                Schema.Type type = PartitionSchemas.valueType(field.schema()).getType();
                if (!matches(type, value)) {
                    throw new SchemaViolationException(
                        "Type mismatch: declared " + type + ", produced " + value.getClass().getSimpleName(),
                        kind, field.name());
                }
            }
            for (String column : row.keySet()) {
                if (schema.getField(column) == null) {
                    throw new SchemaViolationException("Undeclared column", kind, column);
                }
            }
        }
    }

    private static boolean matches(Schema.Type type, Object value) {
        return switch (type) {
            case STRING -> value instanceof CharSequence;
            case LONG -> value instanceof Long;
            case INT -> value instanceof Integer;
            case DOUBLE -> value instanceof Double;
            case FLOAT -> value instanceof Float;
            case BOOLEAN -> value instanceof Boolean;
            default -> false;
        };
    }

    private PartitionStats writeFile(EventKind kind, Schema schema, List<Map<String, Object>> rows,
                                     Path file, CompressionCodec codec) throws IOException {
        PartitionStats stats = new PartitionStats();
        String keyColumn = kind.getPruningColumn();
        try (ParquetWriter<GenericRecord> writer = ParquetFiles.openWriter(file, schema, codec)) {
            for (Map<String, Object> row : rows) {
                GenericRecord record = new GenericData.Record(schema);
                for (Schema.Field field : schema.getFields()) {
                    record.put(field.pos(), row.get(field.name()));
                }
                try {
                    writer.write(record);
                } catch (RuntimeException e) {
                    throw new SchemaViolationException("Row rejected by writer: " + e.getMessage(), kind, null, e);
                }
                stats.observe(row, keyColumn);
            }
        }
        return stats;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete temporary partition {}: {}", file, e.getMessage());
        }
    }

    /**
     * Min/max statistics gathered while writing, used for partition pruning
     */
    private static class PartitionStats {
        long minTs = Long.MAX_VALUE;
        long maxTs = Long.MIN_VALUE;
        String minKey;
        String maxKey;

        void observe(Map<String, Object> row, String keyColumn) {
            Object ts = row.get("ts_epoch");
            if (ts instanceof Long) {
                long value = (Long) ts;
                minTs = Math.min(minTs, value);
                maxTs = Math.max(maxTs, value);
            }
            Object key = row.get(keyColumn);
            if (key != null) {
                String value = key.toString();
                if (minKey == null || value.compareTo(minKey) < 0) {
                    minKey = value;
                }
                if (maxKey == null || value.compareTo(maxKey) > 0) {
                    maxKey = value;
                }
            }
        }
    }
}
