package org.seisview.segy.geometry;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeSet;

import org.seisview.segy.EmptyVolumeException;
import org.seisview.segy.format.TraceHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps (inline, crossline) survey positions to trace indices.
 * <p>
 * Built once from the trace headers in file order and read-only afterwards. The distinct inline
 * and crossline numbers are kept sorted ascending; they need not be contiguous or evenly spaced,
 * and not every (inline, crossline) combination has to be populated.
 * <p>
 * <strong>Duplicate positions:</strong> when two traces share a position, the later trace in file
 * order wins. The number of overwritten entries is available via {@link #getDuplicateCount()}.
 * <p>
 * <strong>Thread Safety:</strong> Instances are immutable after {@link #build(List)} and safe to
 * share between threads.
 */
public final class GeometryIndex {

    private static final Logger log = LoggerFactory.getLogger(GeometryIndex.class);

    private final Map<Long, Integer> traceByPosition;
    private final int[] inlines;
    private final int[] crosslines;
    private final int traceCount;
    private final int duplicateCount;

    private GeometryIndex(Map<Long, Integer> traceByPosition, int[] inlines, int[] crosslines,
                          int traceCount, int duplicateCount) {
        this.traceByPosition = traceByPosition;
        this.inlines = inlines;
        this.crosslines = crosslines;
        this.traceCount = traceCount;
        this.duplicateCount = duplicateCount;
    }

    /**
     * Builds the index from trace headers in file order.
     *
     * @param traceHeaders trace headers; list position is the trace index
     * @return the index
     * @throws EmptyVolumeException if no trace headers are given
     */
    public static GeometryIndex build(List<TraceHeader> traceHeaders) throws EmptyVolumeException {
        if (traceHeaders.isEmpty()) {
            throw new EmptyVolumeException("Volume contains no traces");
        }

        final Map<Long, Integer> traceByPosition = new HashMap<>(traceHeaders.size() * 2);
        final TreeSet<Integer> inlineSet = new TreeSet<>();
        final TreeSet<Integer> crosslineSet = new TreeSet<>();
        int duplicates = 0;

        for (int traceIndex = 0; traceIndex < traceHeaders.size(); traceIndex++) {
            final TraceHeader header = traceHeaders.get(traceIndex);
            final Integer previous = traceByPosition.put(key(header.inline(), header.crossline()), traceIndex);
            if (previous != null) {
                duplicates++;
                log.debug("Trace {} replaces trace {} at inline={}, crossline={}",
                    traceIndex, previous, header.inline(), header.crossline());
            }
            inlineSet.add(header.inline());
            crosslineSet.add(header.crossline());
        }

        if (duplicates > 0) {
            log.warn("Geometry contains {} duplicate (inline, crossline) positions; later traces win", duplicates);
        }

        return new GeometryIndex(
            traceByPosition,
            inlineSet.stream().mapToInt(Integer::intValue).toArray(),
            crosslineSet.stream().mapToInt(Integer::intValue).toArray(),
            traceHeaders.size(),
            duplicates);
    }

    /**
     * Looks up the trace at a survey position.
     *
     * @param inline    inline number
     * @param crossline crossline number
     * @return the trace index, or empty if the position holds no trace
     */
    public OptionalInt findTrace(int inline, int crossline) {
        final Integer traceIndex = traceByPosition.get(key(inline, crossline));
        return traceIndex == null ? OptionalInt.empty() : OptionalInt.of(traceIndex);
    }

    public boolean containsInline(int inline) {
        return Arrays.binarySearch(inlines, inline) >= 0;
    }

    public boolean containsCrossline(int crossline) {
        return Arrays.binarySearch(crosslines, crossline) >= 0;
    }

    /**
     * @return a copy of the distinct inline numbers, ascending
     */
    public int[] getInlines() {
        return inlines.clone();
    }

    /**
     * @return a copy of the distinct crossline numbers, ascending
     */
    public int[] getCrosslines() {
        return crosslines.clone();
    }

    public int getInlineCount() {
        return inlines.length;
    }

    public int getCrosslineCount() {
        return crosslines.length;
    }

    public int getTraceCount() {
        return traceCount;
    }

    /**
     * @return number of populated (inline, crossline) positions
     */
    public int getPositionCount() {
        return traceByPosition.size();
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }

    private static long key(int inline, int crossline) {
        return ((long) inline << 32) | (crossline & 0xFFFFFFFFL);
    }
}
