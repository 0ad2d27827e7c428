package org.seisview.segy.format;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import org.seisview.segy.MalformedHeaderException;
import org.seisview.segy.UnsupportedFormatException;

/**
 * Decodes SEG-Y file and trace headers into typed records.
 * <p>
 * All integers are big-endian. Binary header offsets below are 0-based positions inside the
 * 3600-byte file header buffer (SEG-Y byte number minus one):
 * <ul>
 *   <li>3212 - data traces per ensemble (int16)</li>
 *   <li>3216 - sample interval in microseconds (uint16)</li>
 *   <li>3220 - samples per trace (uint16)</li>
 *   <li>3224 - sample format code (int16)</li>
 *   <li>3500 - revision number (uint16, major revision in the high byte)</li>
 *   <li>3502 - fixed length trace flag (int16)</li>
 *   <li>3504 - number of extended textual headers (int16)</li>
 * </ul>
 * <p>
 * Format codes that SEG-Y defines but this reader cannot decode raise
 * {@link UnsupportedFormatException}; codes SEG-Y never defined (including an unset zero)
 * mean the header itself is garbage and raise {@link MalformedHeaderException}.
 * <p>
 * Instances are immutable and thread-safe.
 */
public class HeaderDecoder {

    private static final int TRACES_PER_ENSEMBLE = 3212;
    private static final int SAMPLE_INTERVAL = 3216;
    private static final int SAMPLES_PER_TRACE = 3220;
    private static final int FORMAT_CODE = 3224;
    private static final int REVISION = 3500;
    private static final int FIXED_LENGTH_FLAG = 3502;
    private static final int EXTENDED_TEXTUAL_HEADERS = 3504;

    private static final int TRACE_SAMPLE_COUNT = 114;
    private static final int TRACE_SAMPLE_INTERVAL = 116;

    private static final int TEXT_LINE_LENGTH = 80;

    /** Every format code assigned by SEG-Y revisions 0 through 2. */
    private static final Set<Integer> DEFINED_FORMAT_CODES = Set.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 15, 16);

    private static final Charset EBCDIC = resolveEbcdic();

    private final TraceHeaderLayout layout;

    public HeaderDecoder() {
        this(TraceHeaderLayout.REV1);
    }

    public HeaderDecoder(TraceHeaderLayout layout) {
        this.layout = layout;
    }

    public TraceHeaderLayout getLayout() {
        return layout;
    }

    /**
     * Decodes the textual and binary file header.
     *
     * @param bytes exactly {@link FileHeader#SIZE} bytes from the start of the file
     * @return the decoded header
     * @throws MalformedHeaderException   if the buffer size is wrong or a field is out of range
     * @throws UnsupportedFormatException if the sample format is a SEG-Y code this reader does not decode
     */
    public FileHeader decode(byte[] bytes) throws MalformedHeaderException, UnsupportedFormatException {
        if (bytes == null || bytes.length != FileHeader.SIZE) {
            throw new MalformedHeaderException("File header must be exactly " + FileHeader.SIZE
                + " bytes, got " + (bytes == null ? 0 : bytes.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);

        int formatCode = buffer.getShort(FORMAT_CODE);
        if (!DEFINED_FORMAT_CODES.contains(formatCode)) {
            throw new MalformedHeaderException("Binary header carries an undefined sample format code: " + formatCode);
        }
        SampleFormat format = SampleFormat.fromCode(formatCode);

        int revision = decodeRevision(Short.toUnsignedInt(buffer.getShort(REVISION)));
        int extended = 0;
        // Bytes 3505-3506 were unassigned before revision 1 and often hold junk in older files.
        if (revision >= 1) {
            extended = buffer.getShort(EXTENDED_TEXTUAL_HEADERS);
            if (extended < 0) {
                throw new MalformedHeaderException(
                    "Variable number of extended textual headers is not supported: " + extended);
            }
        }

        return new FileHeader(
            decodeText(bytes),
            Short.toUnsignedInt(buffer.getShort(SAMPLE_INTERVAL)),
            Short.toUnsignedInt(buffer.getShort(SAMPLES_PER_TRACE)),
            format,
            buffer.getShort(TRACES_PER_ENSEMBLE),
            revision,
            revision >= 1 && buffer.getShort(FIXED_LENGTH_FLAG) == 1,
            extended);
    }

    /**
     * Decodes one trace header.
     *
     * @param bytes exactly {@link TraceHeader#SIZE} bytes
     * @return the decoded trace header
     * @throws MalformedHeaderException if the buffer size is wrong
     */
    public TraceHeader decodeTraceHeader(byte[] bytes) throws MalformedHeaderException {
        if (bytes == null || bytes.length != TraceHeader.SIZE) {
            throw new MalformedHeaderException("Trace header must be exactly " + TraceHeader.SIZE
                + " bytes, got " + (bytes == null ? 0 : bytes.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        return new TraceHeader(
            buffer.getInt(layout.inlineByte() - 1),
            buffer.getInt(layout.crosslineByte() - 1),
            Short.toUnsignedInt(buffer.getShort(TRACE_SAMPLE_COUNT)),
            Short.toUnsignedInt(buffer.getShort(TRACE_SAMPLE_INTERVAL)));
    }

    /**
     * Revision 1 and later store the major revision in the high byte (0x0100 = 1.0). Some writers
     * store the plain number instead, which is accepted as well.
     */
    static int decodeRevision(int raw) {
        return raw >= 0x100 ? raw >> 8 : raw;
    }

    /**
     * Decodes the textual header as 40 lines of 80 characters.
     * <p>
     * Headers whose first card starts with an EBCDIC 'C' (0xC3), or that are dominated by bytes
     * above 0x7F, are read as EBCDIC; everything else as ASCII.
     */
    static String decodeText(byte[] bytes) {
        Charset charset = looksLikeEbcdic(bytes) ? EBCDIC : StandardCharsets.US_ASCII;
        String text = new String(bytes, 0, FileHeader.TEXTUAL_HEADER_SIZE, charset);
        StringBuilder lines = new StringBuilder(FileHeader.TEXTUAL_HEADER_SIZE + 40);
        for (int start = 0; start < text.length(); start += TEXT_LINE_LENGTH) {
            String line = text.substring(start, Math.min(text.length(), start + TEXT_LINE_LENGTH));
            if (lines.length() > 0) {
                lines.append('\n');
            }
            lines.append(stripTrailing(line));
        }
        return lines.toString().stripTrailing();
    }

    private static boolean looksLikeEbcdic(byte[] bytes) {
        if ((bytes[0] & 0xFF) == 0xC3) {
            return true;
        }
        int high = 0;
        for (int i = 0; i < FileHeader.TEXTUAL_HEADER_SIZE; i++) {
            if ((bytes[i] & 0x80) != 0) {
                high++;
            }
        }
        return high > FileHeader.TEXTUAL_HEADER_SIZE / 2;
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) <= ' ')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static Charset resolveEbcdic() {
        // IBM037 lives in the jdk.charsets module, which trimmed runtimes may omit.
        return Charset.isSupported("IBM037") ? Charset.forName("IBM037") : StandardCharsets.ISO_8859_1;
    }
}
