package org.seisview.segy.slice;

import java.io.IOException;
import java.util.OptionalInt;

import org.seisview.segy.AxisValueNotFoundException;
import org.seisview.segy.TruncatedTraceException;
import org.seisview.segy.geometry.GeometryIndex;
import org.seisview.segy.io.TraceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles inline and crossline slices from a geometry index and a trace reader.
 * <p>
 * An inline slice has one column per distinct crossline number, in ascending order; a crossline
 * slice has one column per distinct inline number. Positions without a trace (gaps in sparse or
 * irregular surveys) produce an all-zero column instead of an error. Traces shorter than the
 * slice height are zero-padded at the bottom.
 * <p>
 * Cost is one trace read per column.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe as long as the geometry index and trace reader are,
 * which holds for the engine's own implementations.
 */
public class SliceExtractor {

    private static final Logger log = LoggerFactory.getLogger(SliceExtractor.class);

    private final GeometryIndex geometry;
    private final TraceReader traceReader;
    private final int samplesPerTrace;

    /**
     * @param geometry        geometry index of the volume
     * @param traceReader     reader for the volume's traces
     * @param samplesPerTrace slice height, the length of the volume's longest trace
     */
    public SliceExtractor(GeometryIndex geometry, TraceReader traceReader, int samplesPerTrace) {
        this.geometry = geometry;
        this.traceReader = traceReader;
        this.samplesPerTrace = samplesPerTrace;
    }

    public Slice extractInline(int inline)
            throws AxisValueNotFoundException, TruncatedTraceException, IOException {
        return extract(SliceAxis.INLINE, inline);
    }

    public Slice extractCrossline(int crossline)
            throws AxisValueNotFoundException, TruncatedTraceException, IOException {
        return extract(SliceAxis.CROSSLINE, crossline);
    }

    /**
     * Extracts the raw (un-normalized) slice at a fixed axis value.
     *
     * @param axis  axis to cut along
     * @param value inline or crossline number; must be one of the volume's distinct values
     * @return the slice, {@code samplesPerTrace} rows by perpendicular-axis size columns
     * @throws AxisValueNotFoundException if {@code value} is not a distinct value of {@code axis}
     * @throws TruncatedTraceException    if a trace in the slice is cut short
     * @throws IOException                if reading the file fails
     */
    public Slice extract(SliceAxis axis, int value)
            throws AxisValueNotFoundException, TruncatedTraceException, IOException {
        final boolean inlineAxis = axis == SliceAxis.INLINE;
        final boolean known = inlineAxis ? geometry.containsInline(value) : geometry.containsCrossline(value);
        if (!known) {
            throw new AxisValueNotFoundException(axis, value);
        }

        final int[] positions = inlineAxis ? geometry.getCrosslines() : geometry.getInlines();
        final float[][] rows = new float[samplesPerTrace][positions.length];
        int gaps = 0;

        for (int column = 0; column < positions.length; column++) {
            final OptionalInt traceIndex = inlineAxis
                ? geometry.findTrace(value, positions[column])
                : geometry.findTrace(positions[column], value);
            if (traceIndex.isEmpty()) {
                // Missing position: the column stays zero-filled.
                gaps++;
                continue;
            }
            final float[] trace = traceReader.readTrace(traceIndex.getAsInt());
            final int depth = Math.min(trace.length, samplesPerTrace);
            for (int sample = 0; sample < depth; sample++) {
                rows[sample][column] = trace[sample];
            }
        }

        log.debug("Extracted {} {}: {} columns, {} gaps, {} samples",
            axis.label(), value, positions.length, gaps, samplesPerTrace);
        return new Slice(axis, value, positions, rows);
    }
}
