package com.tracelake.storage.columnar;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Adapts a local {@link Path} to Parquet's {@link OutputFile} interface.
 * Writes go straight through java.nio, without Hadoop's FileSystem and its checksum side files.
 */
public class NioOutputFile implements OutputFile {

    private static final int BUFFER_SIZE = 256 * 1024;

    private final Path path;

    public NioOutputFile(Path path) {
        this.path = path;
    }

    @Override
    public PositionOutputStream create(long blockSizeHint) throws IOException {
        return new NioPositionOutputStream(Files.newOutputStream(path,
            StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
        return new NioPositionOutputStream(Files.newOutputStream(path,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }

    @Override
    public String toString() {
        return path.toString();
    }

    /**
     * Tracks the write position over a buffered stream
     */
    private static class NioPositionOutputStream extends PositionOutputStream {

        private final OutputStream delegate;
        private long position;

        NioPositionOutputStream(OutputStream out) {
            this.delegate = new BufferedOutputStream(out, BUFFER_SIZE);
        }

        @Override
        public long getPos() {
            return position;
        }

        @Override
        public void write(int b) throws IOException {
            delegate.write(b);
            position++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            delegate.write(b, off, len);
            position += len;
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }
}
