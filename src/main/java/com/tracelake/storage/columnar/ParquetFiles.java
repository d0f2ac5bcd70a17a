package com.tracelake.storage.columnar;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens Avro-model Parquet readers and writers on local files
 */
public final class ParquetFiles {

    private static final int PAGE_SIZE = 1024 * 1024;
    private static final int ROW_GROUP_SIZE = 128 * 1024 * 1024;

    private ParquetFiles() {
    }

    /**
     * New writer; fails if the file already exists
     */
    public static ParquetWriter<GenericRecord> openWriter(Path file, Schema schema, CompressionCodec codec)
            throws IOException {
        return AvroParquetWriter
            .<GenericRecord>builder(new NioOutputFile(file))
            .withSchema(schema)
            .withDataModel(GenericData.get())
            .withConf(newConf())
            .withCompressionCodec(codec.getParquetCodec())
            .withWriteMode(ParquetFileWriter.Mode.CREATE)
            .withPageSize(PAGE_SIZE)
            .withRowGroupSize(ROW_GROUP_SIZE)
            .build();
    }

    /**
     * Reader with row-group and record-level filtering for the given predicate
     */
    public static ParquetReader<GenericRecord> openReader(Path file, FilterCompat.Filter filter) throws IOException {
        return AvroParquetReader
            .<GenericRecord>builder(new NioInputFile(file))
            .withDataModel(GenericData.get())
            .withConf(newConf())
            .withFilter(filter)
            .build();
    }

    public static ParquetReader<GenericRecord> openReader(Path file) throws IOException {
        return openReader(file, FilterCompat.NOOP);
    }

    /**
     * String value of a record field; Avro hands strings back as {@code Utf8}
     */
    public static String string(GenericRecord record, String field) {
        Object value = record.get(field);
        return value == null ? null : value.toString();
    }

    public static long longValue(GenericRecord record, String field) {
        Object value = record.get(field);
        return value == null ? 0L : ((Number) value).longValue();
    }

    public static int intValue(GenericRecord record, String field) {
        Object value = record.get(field);
        return value == null ? 0 : ((Number) value).intValue();
    }

    private static Configuration newConf() {
        return new Configuration(false);
    }
}
