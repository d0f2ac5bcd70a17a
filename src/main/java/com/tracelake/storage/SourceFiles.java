package com.tracelake.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Access to ingest sources, which are plain or gzip compressed log files.
 * Byte offsets into a {@code .gz} source address its decompressed content.
 */
public final class SourceFiles {

    public static final int BUFFER_SIZE = 64 * 1024;

    private SourceFiles() {
    }

    public static boolean isCompressed(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".gz");
    }

    /**
     * Stream of the source content, decompressed for {@code .gz} files
     */
    public static InputStream open(Path file) throws IOException {
        InputStream raw = Files.newInputStream(file);
        if (isCompressed(file)) {
            try {
                return new GZIPInputStream(raw, BUFFER_SIZE);
            } catch (IOException e) {
                raw.close();
                throw e;
            }
        }
        return raw;
    }

    /**
     * Number of addressable bytes: the file size for plain sources, the
     * decompressed length for gzip sources
     */
    public static long contentLength(Path file) {
        try {
            if (!isCompressed(file)) {
                return Files.size(file);
            }
            long total = 0;
            byte[] buffer = new byte[BUFFER_SIZE];
            try (InputStream in = open(file)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    total += read;
                }
            }
            return total;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to measure " + file, e);
        }
    }
}
