package com.tracelake.ingestion;

import com.tracelake.storage.SourceFiles;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads a source file line by line as bytes, tracking the exact byte offset
 * and length of every line.
 *
 * Offsets refer to the decompressed stream for {@code .gz} sources. The line
 * terminator ({@code \n} or {@code \r\n}) is excluded from the line and from
 * its length. Lines longer than the limit are reported as oversized without
 * their content.
 */
public class SourceLineReader implements Closeable {

    private static final int BUFFER_SIZE = SourceFiles.BUFFER_SIZE;

    private final InputStream in;
    private final int maxLineBytes;
    private final byte[] buffer = new byte[BUFFER_SIZE];
    private int bufferPos;
    private int bufferLimit;
    private long position;
    private long lineNumber;
    private byte[] line = new byte[1024];

    public SourceLineReader(Path file, int maxLineBytes) throws IOException {
        this.in = SourceFiles.open(file);
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * The next line, or null at end of input
     */
    public SourceLine next() throws IOException {
        if (!fill()) {
            return null;
        }
        long start = position;
        int length = 0;
        long total = 0;
        boolean terminated = false;
        while (fill()) {
            byte b = buffer[bufferPos++];
            position++;
            if (b == '\n') {
                terminated = true;
                break;
            }
            if (total < maxLineBytes) {
                if (length == line.length) {
                    line = Arrays.copyOf(line, Math.min(maxLineBytes, line.length * 2));
                }
                line[length++] = b;
            }
            total++;
        }
        lineNumber++;
        if (total > maxLineBytes) {
            return new SourceLine(null, start, total, lineNumber, true);
        }
        if (length > 0 && line[length - 1] == '\r' && terminated) {
            length--;
        }
        return new SourceLine(Arrays.copyOf(line, length), start, length, lineNumber, false);
    }

    public long getPosition() {
        return position;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    private boolean fill() throws IOException {
        if (bufferPos < bufferLimit) {
            return true;
        }
        int read = in.read(buffer);
        while (read == 0) {
            read = in.read(buffer);
        }
        if (read < 0) {
            return false;
        }
        bufferPos = 0;
        bufferLimit = read;
        return true;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    /**
     * One line of a source file with its location
     */
    public static class SourceLine {
        private final byte[] bytes;
        private final long offset;
        private final long length;
        private final long lineNumber;
        private final boolean oversized;

        SourceLine(byte[] bytes, long offset, long length, long lineNumber, boolean oversized) {
            this.bytes = bytes;
            this.offset = offset;
            this.length = length;
            this.lineNumber = lineNumber;
            this.oversized = oversized;
        }

        /**
         * Line bytes without the terminator; null for oversized lines
         */
        public byte[] getBytes() {
            return bytes;
        }

        public String text() {
            return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
        }

        public long getOffset() {
            return offset;
        }

        public long getLength() {
            return length;
        }

        public long getLineNumber() {
            return lineNumber;
        }

        public boolean isOversized() {
            return oversized;
        }
    }
}
