package org.seisview.segy.format;

/**
 * Per-trace header fields the engine needs.
 *
 * @param inline               inline number of the trace position
 * @param crossline            crossline number of the trace position
 * @param sampleCount          samples in this trace as declared by its own header (0 when unset)
 * @param sampleIntervalMicros sample interval declared by this trace (0 when unset)
 */
public record TraceHeader(int inline, int crossline, int sampleCount, int sampleIntervalMicros) {

    public static final int SIZE = 240;
}
