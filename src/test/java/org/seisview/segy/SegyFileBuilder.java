package org.seisview.segy;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.seisview.segy.format.FileHeader;
import org.seisview.segy.format.SampleFormat;
import org.seisview.segy.format.TraceHeader;
import org.seisview.segy.format.TraceHeaderLayout;

/**
 * Writes small synthetic SEG-Y files for tests.
 * <p>
 * Defaults: revision 1, IEEE samples, 4 samples per trace at 2000 us, ASCII textual header,
 * inline/crossline at the revision 1 byte positions. Each trace header declares the length of
 * its own trace unless {@link #traceHeaderSampling} says otherwise.
 */
public final class SegyFileBuilder {

    private record TraceSpec(int inline, int crossline, float[] samples) {}

    private final List<TraceSpec> traces = new ArrayList<>();
    private int formatCode = SampleFormat.IEEE_FLOAT.code();
    private int samplesPerTrace = 4;
    private Integer binarySamplesOverride;
    private int sampleIntervalMicros = 2000;
    private int rawRevision = 0x0100;
    private int extendedHeaders;
    private int traceSampleCount = -1;
    private int traceSampleInterval = -1;
    private String textualHeader = "C 1 SYNTHETIC SURVEY";
    private boolean ebcdic;
    private TraceHeaderLayout layout = TraceHeaderLayout.REV1;
    private int truncateBytes;

    private SegyFileBuilder() {
    }

    public static SegyFileBuilder create() {
        return new SegyFileBuilder();
    }

    /**
     * Creates a full inline x crossline grid whose sample {@code s} at (il, xl) equals
     * {@code il * 100 + xl + s / 10}.
     */
    public static SegyFileBuilder grid(int[] inlines, int[] crosslines) {
        SegyFileBuilder builder = create();
        for (int il : inlines) {
            for (int xl : crosslines) {
                builder.trace(il, xl, ramp(il, xl, builder.samplesPerTrace));
            }
        }
        return builder;
    }

    public static float[] ramp(int inline, int crossline, int samples) {
        float[] values = new float[samples];
        for (int s = 0; s < samples; s++) {
            values[s] = inline * 100f + crossline + s / 10f;
        }
        return values;
    }

    public SegyFileBuilder format(SampleFormat format) {
        this.formatCode = format.code();
        return this;
    }

    /** Writes an arbitrary format code, including ones the reader rejects. */
    public SegyFileBuilder formatCode(int code) {
        this.formatCode = code;
        return this;
    }

    public SegyFileBuilder samplesPerTrace(int samples) {
        this.samplesPerTrace = samples;
        return this;
    }

    /** Writes a different sample count into the binary header than the traces carry. */
    public SegyFileBuilder binaryHeaderSamples(int samples) {
        this.binarySamplesOverride = samples;
        return this;
    }

    public SegyFileBuilder sampleInterval(int micros) {
        this.sampleIntervalMicros = micros;
        return this;
    }

    /** Overrides the sample count and interval written into every trace header. */
    public SegyFileBuilder traceHeaderSampling(int sampleCount, int intervalMicros) {
        this.traceSampleCount = sampleCount;
        this.traceSampleInterval = intervalMicros;
        return this;
    }

    /** Raw value of bytes 3501-3502, e.g. {@code 0x0100} for revision 1 or {@code 0} for revision 0. */
    public SegyFileBuilder rawRevision(int raw) {
        this.rawRevision = raw;
        return this;
    }

    /** Declares and appends {@code count} extended textual headers of 3200 bytes each. */
    public SegyFileBuilder extendedTextualHeaders(int count) {
        this.extendedHeaders = count;
        return this;
    }

    public SegyFileBuilder textualHeader(String text, boolean asEbcdic) {
        this.textualHeader = text;
        this.ebcdic = asEbcdic;
        return this;
    }

    public SegyFileBuilder layout(TraceHeaderLayout traceHeaderLayout) {
        this.layout = traceHeaderLayout;
        return this;
    }

    /** Cuts the given number of bytes off the end of the file. */
    public SegyFileBuilder truncateBy(int bytes) {
        this.truncateBytes = bytes;
        return this;
    }

    /** Adds a trace; its length may differ from the binary header's sample count. */
    public SegyFileBuilder trace(int inline, int crossline, float... samples) {
        traces.add(new TraceSpec(inline, crossline, samples.clone()));
        return this;
    }

    public SegyFileBuilder constantTrace(int inline, int crossline, float value) {
        float[] samples = new float[samplesPerTrace];
        Arrays.fill(samples, value);
        return trace(inline, crossline, samples);
    }

    public Path write(Path file) throws IOException {
        Files.write(file, toBytes());
        return file;
    }

    public byte[] toBytes() {
        int bytesPerSample = bytesPerSample(formatCode);
        int size = FileHeader.SIZE + extendedHeaders * FileHeader.TEXTUAL_HEADER_SIZE;
        for (TraceSpec trace : traces) {
            size += TraceHeader.SIZE + trace.samples().length * bytesPerSample;
        }
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);

        buffer.put(encodeText(textualHeader));
        buffer.putShort(3212, (short) 1);
        buffer.putShort(3216, (short) sampleIntervalMicros);
        buffer.putShort(3220, (short) (binarySamplesOverride != null ? binarySamplesOverride : samplesPerTrace));
        buffer.putShort(3224, (short) formatCode);
        buffer.putShort(3500, (short) rawRevision);
        buffer.putShort(3502, (short) 1);
        buffer.putShort(3504, (short) extendedHeaders);

        buffer.position(FileHeader.SIZE);
        for (int i = 0; i < extendedHeaders; i++) {
            buffer.put(encodeText("C 1 EXTENDED HEADER " + (i + 1)));
        }

        for (TraceSpec trace : traces) {
            int start = buffer.position();
            buffer.putInt(start + layout.inlineByte() - 1, trace.inline());
            buffer.putInt(start + layout.crosslineByte() - 1, trace.crossline());
            buffer.putShort(start + 114, (short) (traceSampleCount >= 0 ? traceSampleCount : trace.samples().length));
            buffer.putShort(start + 116, (short) (traceSampleInterval >= 0 ? traceSampleInterval : sampleIntervalMicros));
            buffer.position(start + TraceHeader.SIZE);
            for (float value : trace.samples()) {
                putSample(buffer, value);
            }
        }

        byte[] bytes = buffer.array();
        return truncateBytes > 0 ? Arrays.copyOf(bytes, bytes.length - truncateBytes) : bytes;
    }

    private void putSample(ByteBuffer buffer, float value) {
        switch (formatCode) {
            case 1 -> buffer.putInt(floatToIbm(value));
            case 2 -> buffer.putInt((int) value);
            case 3 -> buffer.putShort((short) value);
            case 8 -> buffer.put((byte) value);
            default -> buffer.putFloat(value);
        }
    }

    private static int bytesPerSample(int code) {
        return switch (code) {
            case 3 -> 2;
            case 8 -> 1;
            default -> 4;
        };
    }

    private byte[] encodeText(String text) {
        StringBuilder card = new StringBuilder(FileHeader.TEXTUAL_HEADER_SIZE);
        for (String line : text.split("\n", -1)) {
            StringBuilder padded = new StringBuilder(line.length() > 80 ? line.substring(0, 80) : line);
            while (padded.length() < 80) {
                padded.append(' ');
            }
            card.append(padded);
        }
        while (card.length() < FileHeader.TEXTUAL_HEADER_SIZE) {
            card.append(' ');
        }
        Charset charset = ebcdic ? Charset.forName("IBM037") : StandardCharsets.US_ASCII;
        return card.substring(0, FileHeader.TEXTUAL_HEADER_SIZE).getBytes(charset);
    }

    /**
     * Encodes a float as IBM hexadecimal float, truncating the fraction.
     */
    public static int floatToIbm(float value) {
        if (value == 0f) {
            return 0;
        }
        int sign = value < 0 ? 0x80000000 : 0;
        double magnitude = Math.abs((double) value);
        int exponent = 64;
        while (magnitude >= 1.0) {
            magnitude /= 16.0;
            exponent++;
        }
        while (magnitude < 1.0 / 16.0) {
            magnitude *= 16.0;
            exponent--;
        }
        int fraction = (int) (magnitude * 0x1000000);
        return sign | (exponent << 24) | fraction;
    }
}
