package org.seisview.segy.format;

import java.util.OptionalInt;

/**
 * Decoded textual and binary file header of a SEG-Y volume.
 * <p>
 * The textual header is informational only. As decoded, {@code samplesPerTrace} is the binary
 * header's default trace length. Trace headers may override it per trace; once a volume is open
 * its header carries the length of the longest trace instead (see {@link #withSamplesPerTrace(int)}).
 *
 * @param textualHeader          the 3200-byte textual header decoded to text
 * @param sampleIntervalMicros   sample interval in microseconds (0 when unset)
 * @param samplesPerTrace        default number of samples per trace
 * @param sampleFormat           sample encoding
 * @param tracesPerEnsemble      data traces per ensemble, a hint only
 * @param revision               SEG-Y major revision (0 for pre-1.0 files)
 * @param fixedLengthTraces      whether the fixed-length trace flag is set
 * @param extendedTextualHeaders number of 3200-byte extended textual header records
 */
public record FileHeader(
    String textualHeader,
    int sampleIntervalMicros,
    int samplesPerTrace,
    SampleFormat sampleFormat,
    int tracesPerEnsemble,
    int revision,
    boolean fixedLengthTraces,
    int extendedTextualHeaders
) {

    public static final int TEXTUAL_HEADER_SIZE = 3200;
    public static final int BINARY_HEADER_SIZE = 400;
    public static final int SIZE = TEXTUAL_HEADER_SIZE + BINARY_HEADER_SIZE;

    /**
     * Returns the byte offset of the first trace header.
     *
     * @return 3600 plus 3200 bytes per extended textual header record
     */
    public long headerRegionSize() {
        return SIZE + (long) TEXTUAL_HEADER_SIZE * extendedTextualHeaders;
    }

    /**
     * Returns the size of one trace on disk, header included.
     *
     * @return trace header size plus the sample bytes
     */
    public long traceSize() {
        return TraceHeader.SIZE + (long) samplesPerTrace * sampleFormat.bytesPerSample();
    }

    /**
     * Returns the sample interval, absent when the header leaves it unset or a trace holds a
     * single sample and no interval exists.
     *
     * @return the interval in microseconds, if defined
     */
    public OptionalInt sampleInterval() {
        if (samplesPerTrace < 2 || sampleIntervalMicros <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(sampleIntervalMicros);
    }

    public FileHeader withSamplesPerTrace(int samples) {
        return new FileHeader(textualHeader, sampleIntervalMicros, samples, sampleFormat,
            tracesPerEnsemble, revision, fixedLengthTraces, extendedTextualHeaders);
    }

    public FileHeader withSampleIntervalMicros(int interval) {
        return new FileHeader(textualHeader, interval, samplesPerTrace, sampleFormat,
            tracesPerEnsemble, revision, fixedLengthTraces, extendedTextualHeaders);
    }
}
