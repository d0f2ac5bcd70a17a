package com.tracelake.storage.columnar;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * Compression codecs accepted by {@code tracelake.ingest.compression}
 */
public enum CompressionCodec {

    SNAPPY("snappy", CompressionCodecName.SNAPPY),
    GZIP("gzip", CompressionCodecName.GZIP),
    ZSTD("zstd", CompressionCodecName.ZSTD),
    UNCOMPRESSED("uncompressed", CompressionCodecName.UNCOMPRESSED);

    private final String value;
    private final CompressionCodecName parquetCodec;

    CompressionCodec(String value, CompressionCodecName parquetCodec) {
        this.value = value;
        this.parquetCodec = parquetCodec;
    }

    public String getValue() {
        return value;
    }

    public CompressionCodecName getParquetCodec() {
        return parquetCodec;
    }

    /**
     * Parse a configured codec name; "none" is accepted for uncompressed
     */
    public static CompressionCodec fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SNAPPY;
        }
        if ("none".equalsIgnoreCase(value.trim())) {
            return UNCOMPRESSED;
        }
        for (CompressionCodec codec : values()) {
            if (codec.value.equalsIgnoreCase(value.trim())) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec: " + value);
    }
}
