package io.lookuplite.core;

/**
 * Raised by the size guard when a lookup file exceeds the editable maximum.
 */
public class LookupFileTooBigException extends LookupException {
    private final long size;
    private final long maxSize;

    public LookupFileTooBigException(long size, long maxSize) {
        super("Lookup file is too large to be edited: size=%d bytes, max=%d bytes".formatted(size, maxSize));
        this.size = size;
        this.maxSize = maxSize;
    }

    /** Measured size of the file in bytes. */
    public long size() {
        return size;
    }

    public long maxSize() {
        return maxSize;
    }
}
