package org.seisview.segy.volume;

import java.util.OptionalInt;

import org.seisview.segy.format.SampleFormat;

/**
 * Fixed-field summary of an open volume.
 *
 * @param generation           sequence number of the open that produced the volume, increasing per accessor
 * @param traceCount           number of traces in the file
 * @param inlines              distinct inline numbers, ascending
 * @param crosslines           distinct crossline numbers, ascending
 * @param samplesPerTrace      samples per trace
 * @param sampleIntervalMicros sample interval, absent when undefined
 * @param sampleFormat         sample encoding
 * @param revision             SEG-Y major revision
 * @param duplicatePositions   traces that overwrote an earlier trace at the same position
 * @param textualHeader        decoded textual header
 */
public record VolumeMetadata(
    long generation,
    int traceCount,
    int[] inlines,
    int[] crosslines,
    int samplesPerTrace,
    OptionalInt sampleIntervalMicros,
    SampleFormat sampleFormat,
    int revision,
    int duplicatePositions,
    String textualHeader
) {

    public int inlineCount() {
        return inlines.length;
    }

    public int crosslineCount() {
        return crosslines.length;
    }
}
