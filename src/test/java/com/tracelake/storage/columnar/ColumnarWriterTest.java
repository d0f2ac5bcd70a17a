package com.tracelake.storage.columnar;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.PartitionHandle;
import com.tracelake.domain.RawSpan;
import com.tracelake.domain.SlowQueryEvent;
import com.tracelake.ingestion.buffer.Chunk;
import com.tracelake.ingestion.buffer.FlushSignal;
import com.tracelake.storage.DatasetLayout;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.hadoop.ParquetReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ColumnarWriter Tests")
class ColumnarWriterTest {

    // 2024-03-01T10:00:00Z
    private static final long BASE_TS = 1709287200L;

    @TempDir
    Path tempDir;

    private DatasetLayout layout;
    private WriteSession session;

    @BeforeEach
    void setUp() {
        layout = new DatasetLayout(tempDir);
        session = new WriteSession("ingest-1", 4, layout, CompressionCodec.UNCOMPRESSED, 1);
    }

    private static NormalizedEvent slowQuery(String namespace, long tsOffset, long durationMs) {
        return SlowQueryEvent.builder()
            .recordKey("HASH-" + namespace)
            .timestamp("2024-03-01T10:00:00Z", BASE_TS + tsOffset)
            .span(new RawSpan(4, tsOffset * 100, 99), tsOffset + 1)
            .queryHash("HASH-" + namespace)
            .namespace(namespace.split("\\.")[0], namespace.split("\\.")[1], namespace)
            .planSummary("IXSCAN { status: 1 }")
            .operation("find")
            .durationMs(durationMs)
            .docsExamined(5)
            .build();
    }

    private static Chunk chunk(NormalizedEvent... events) {
        return new Chunk(EventKind.SLOW_QUERY, new ArrayList<>(List.of(events)), 0, FlushSignal.NONE);
    }

    @Test
    @DisplayName("Should write a dated partition with pruning statistics")
    void shouldWritePartition() throws IOException {
        ColumnarWriter writer = new ColumnarWriter(new PartitionSchemas());

        List<PartitionHandle> handles = writer.write(session, chunk(
            slowQuery("shop.orders", 0, 120),
            slowQuery("analytics.events", 60, 300)));

        assertThat(handles).hasSize(1);
        PartitionHandle handle = handles.get(0);
        assertThat(handle.getPath()).isEqualTo("slow_queries/2024/03/01/chunk_000001.parquet");
        assertThat(handle.getKind()).isEqualTo(EventKind.SLOW_QUERY);
        assertThat(handle.getRowCount()).isEqualTo(2);
        assertThat(handle.getMinTsEpoch()).isEqualTo(BASE_TS);
        assertThat(handle.getMaxTsEpoch()).isEqualTo(BASE_TS + 60);
        assertThat(handle.getMinKey()).isEqualTo("analytics.events");
        assertThat(handle.getMaxKey()).isEqualTo("shop.orders");
        assertThat(handle.getFileId()).isEqualTo(4);
        assertThat(handle.getIngestId()).isEqualTo("ingest-1");
        assertThat(handle.getChecksum()).hasSize(64);
        assertThat(session.getPlacedFiles()).containsExactly(layout.resolve(handle.getPath()));

        List<GenericRecord> records = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = ParquetFiles.openReader(layout.resolve(handle.getPath()))) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                records.add(record);
            }
        }
        assertThat(records).hasSize(2);
        assertThat(ParquetFiles.string(records.get(0), "namespace")).isEqualTo("shop.orders");
        assertThat(ParquetFiles.longValue(records.get(1), "duration_ms")).isEqualTo(300);
        assertThat(ParquetFiles.intValue(records.get(1), "file_id")).isEqualTo(4);
        assertThat(ParquetFiles.longValue(records.get(1), "byte_offset")).isEqualTo(6000);
    }

    @Test
    @DisplayName("Should give each partition its own sequence number")
    void shouldAdvanceSequence() {
        ColumnarWriter writer = new ColumnarWriter(new PartitionSchemas());

        PartitionHandle first = writer.write(session, chunk(slowQuery("shop.orders", 0, 1))).get(0);
        PartitionHandle second = writer.write(session, chunk(slowQuery("shop.orders", 1, 1))).get(0);

        assertThat(first.getSequence()).isEqualTo(1);
        assertThat(second.getSequence()).isEqualTo(2);
        assertThat(session.peekNextSequence()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should split a chunk that crosses midnight into one partition per day")
    void shouldSplitChunkAtDayBoundary() {
        ColumnarWriter writer = new ColumnarWriter(new PartitionSchemas());
        // 2024-03-01T23:59:59Z and 2024-03-02T00:00:01Z
        long beforeMidnight = 14 * 3600 - 1;
        long afterMidnight = 14 * 3600 + 1;

        // Given a chunk whose first event is after midnight
        List<PartitionHandle> handles = writer.write(session, chunk(
            slowQuery("shop.orders", afterMidnight, 5),
            slowQuery("shop.orders", beforeMidnight, 7),
            slowQuery("analytics.events", afterMidnight + 30, 9)));

        // Then each day gets its own partition, oldest first
        assertThat(handles).hasSize(2);
        assertThat(handles.get(0).getDateKey()).isEqualTo("2024-03-01");
        assertThat(handles.get(0).getPath()).isEqualTo("slow_queries/2024/03/01/chunk_000001.parquet");
        assertThat(handles.get(0).getRowCount()).isEqualTo(1);
        assertThat(handles.get(0).getMaxTsEpoch()).isEqualTo(BASE_TS + beforeMidnight);
        assertThat(handles.get(1).getDateKey()).isEqualTo("2024-03-02");
        assertThat(handles.get(1).getPath()).isEqualTo("slow_queries/2024/03/02/chunk_000002.parquet");
        assertThat(handles.get(1).getRowCount()).isEqualTo(2);
        assertThat(handles.get(1).getMinTsEpoch()).isEqualTo(BASE_TS + afterMidnight);
        assertThat(session.getPlacedFiles()).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a chunk whose columns disagree with the declared schema")
    void shouldRejectSchemaMismatch() {
        // Given a declared schema where ts_epoch is a string
        Schema declared = SchemaBuilder.record("SlowQuery").namespace("com.tracelake.storage").fields()
            .requiredString("record_key")
            .requiredString("timestamp")
            .requiredString("ts_epoch")
            .endRecord();
        ColumnarWriter writer = new ColumnarWriter(new PartitionSchemas().withSchema(EventKind.SLOW_QUERY, declared));

        // When writing, then nothing is placed in the dataset
        assertThatThrownBy(() -> writer.write(session, chunk(slowQuery("shop.orders", 0, 1))))
            .isInstanceOf(SchemaViolationException.class)
            .satisfies(e -> assertThat(((SchemaViolationException) e).getColumn()).isEqualTo("ts_epoch"));
        assertThat(session.getPlacedFiles()).isEmpty();
        assertThat(layout.kindDir(EventKind.SLOW_QUERY)).doesNotExist();
    }

    @Test
    @DisplayName("Should reject undeclared columns")
    void shouldRejectUndeclaredColumns() {
        Schema schema = new PartitionSchemas().schemaFor(EventKind.SLOW_QUERY);
        List<Schema.Field> fields = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            if (!field.name().equals("username")) {
                fields.add(new Schema.Field(field.name(), field.schema(), field.doc(), field.defaultVal()));
            }
        }
        Schema narrowed = Schema.createRecord("SlowQuery", null, "com.tracelake.storage", false, fields);
        ColumnarWriter writer = new ColumnarWriter(new PartitionSchemas().withSchema(EventKind.SLOW_QUERY, narrowed));

        assertThatThrownBy(() -> writer.write(session, chunk(slowQuery("shop.orders", 0, 1))))
            .isInstanceOf(SchemaViolationException.class)
            .hasMessageContaining("username");
    }

    @Test
    @DisplayName("Should refuse to write an empty chunk")
    void shouldRejectEmptyChunk() {
        ColumnarWriter writer = new ColumnarWriter(new PartitionSchemas());

        assertThatThrownBy(() -> writer.write(session, chunk()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
