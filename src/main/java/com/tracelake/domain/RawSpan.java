package com.tracelake.domain;

import java.util.Objects;

/**
 * Location of a record's original bytes inside a registered source file.
 * The span covers the line content only; the line terminator is excluded.
 */
public final class RawSpan {

    private final int fileId;
    private final long byteOffset;
    private final int byteLength;

    public RawSpan(int fileId, long byteOffset, int byteLength) {
        if (byteOffset < 0 || byteLength < 0) {
            throw new IllegalArgumentException(
                "Invalid span offset=" + byteOffset + " length=" + byteLength);
        }
        this.fileId = fileId;
        this.byteOffset = byteOffset;
        this.byteLength = byteLength;
    }

    public int getFileId() {
        return fileId;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    public int getByteLength() {
        return byteLength;
    }

    /**
     * First byte position after the span
     */
    public long getEndOffset() {
        return byteOffset + byteLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawSpan)) {
            return false;
        }
        RawSpan other = (RawSpan) o;
        return fileId == other.fileId
            && byteOffset == other.byteOffset
            && byteLength == other.byteLength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileId, byteOffset, byteLength);
    }

    @Override
    public String toString() {
        return "RawSpan{fileId=" + fileId + ", offset=" + byteOffset + ", length=" + byteLength + "}";
    }
}
