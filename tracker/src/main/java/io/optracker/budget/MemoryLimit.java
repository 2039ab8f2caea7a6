package io.optracker.budget;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Byte limit of a budget node, or no limit at all.
 */
public final class MemoryLimit {
    private static final long UNLIMITED_SENTINEL_MB = -1;
    private static final MemoryLimit UNLIMITED = new MemoryLimit(-1);

    private final long bytes;

    private MemoryLimit(long bytes) { this.bytes = bytes; }

    public static MemoryLimit unlimited() { return UNLIMITED; }

    public static MemoryLimit ofBytes(long bytes) {
        Preconditions.checkArgument(bytes >= 0, "memory limit must be non-negative: %s", bytes);
        return new MemoryLimit(bytes);
    }

    public static MemoryLimit ofMegabytes(long megabytes) {
        Preconditions.checkArgument(megabytes >= 0, "memory limit must be non-negative: %s MB", megabytes);
        return ofBytes(Math.multiplyExact(megabytes, 1024L * 1024L));
    }

    /**
     * Parses a megabyte count where {@code -1} means unlimited.
     */
    public static MemoryLimit parseMegabytes(String value) {
        long mb;
        try {
            mb = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a megabyte count: " + value, e);
        }
        if (mb == UNLIMITED_SENTINEL_MB) return UNLIMITED;
        return ofMegabytes(mb);
    }

    public boolean isUnlimited() { return bytes < 0; }

    public long bytes() {
        Preconditions.checkState(!isUnlimited(), "unlimited memory limit has no byte value");
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryLimit)) return false;
        return bytes == ((MemoryLimit) o).bytes;
    }

    @Override
    public int hashCode() { return Objects.hashCode(bytes); }

    @Override
    public String toString() { return isUnlimited() ? "unlimited" : bytes + " bytes"; }
}
