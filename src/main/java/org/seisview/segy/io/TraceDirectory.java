package org.seisview.segy.io;

import java.util.Arrays;

import org.seisview.segy.format.FileHeader;

/**
 * File offset and sample count of every trace in a volume.
 * <p>
 * A trace header that declares its own sample count overrides the binary header's, so traces
 * need not share one length and trace {@code i} starts where trace {@code i - 1} ends. The
 * directory is filled once while the trace headers are scanned at open time and is read-only
 * afterwards.
 */
public final class TraceDirectory {

    private final long[] offsets;
    private final int[] sampleCounts;
    private final int maxSampleCount;
    private final boolean uniform;

    private TraceDirectory(long[] offsets, int[] sampleCounts) {
        this.offsets = offsets;
        this.sampleCounts = sampleCounts;
        int max = 0;
        boolean same = true;
        for (int count : sampleCounts) {
            max = Math.max(max, count);
            same &= count == sampleCounts[0];
        }
        this.maxSampleCount = max;
        this.uniform = same;
    }

    /**
     * Directory of {@code traceCount} traces that all have the binary header's length.
     *
     * @param header     decoded file header
     * @param traceCount number of traces
     * @return the directory
     */
    public static TraceDirectory fixedLength(FileHeader header, int traceCount) {
        final long[] offsets = new long[traceCount];
        final int[] counts = new int[traceCount];
        for (int i = 0; i < traceCount; i++) {
            offsets[i] = header.headerRegionSize() + i * header.traceSize();
            counts[i] = header.samplesPerTrace();
        }
        return new TraceDirectory(offsets, counts);
    }

    public int getTraceCount() {
        return offsets.length;
    }

    /** Offset of the trace's 240-byte header. */
    public long offset(int traceIndex) {
        return offsets[traceIndex];
    }

    public int sampleCount(int traceIndex) {
        return sampleCounts[traceIndex];
    }

    /** Length of the longest trace, which is the row count of every slice. */
    public int getMaxSampleCount() {
        return maxSampleCount;
    }

    public boolean isUniform() {
        return uniform;
    }

    /**
     * Collects traces in file order.
     */
    public static final class Builder {

        private long[] offsets = new long[1024];
        private int[] sampleCounts = new int[1024];
        private int size;

        public Builder add(long offset, int sampleCount) {
            if (size == offsets.length) {
                final int grown = (int) Math.min(Integer.MAX_VALUE - 8L, size * 2L);
                if (grown <= size) {
                    throw new IllegalStateException("Too many traces: " + size);
                }
                offsets = Arrays.copyOf(offsets, grown);
                sampleCounts = Arrays.copyOf(sampleCounts, grown);
            }
            offsets[size] = offset;
            sampleCounts[size] = sampleCount;
            size++;
            return this;
        }

        public int size() {
            return size;
        }

        public TraceDirectory build() {
            return new TraceDirectory(Arrays.copyOf(offsets, size), Arrays.copyOf(sampleCounts, size));
        }
    }
}
