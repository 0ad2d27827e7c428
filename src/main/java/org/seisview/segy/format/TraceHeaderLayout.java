package org.seisview.segy.format;

import java.util.Locale;

import com.typesafe.config.Config;

/**
 * Byte positions of the inline and crossline numbers inside a 240-byte trace header.
 * <p>
 * Positions are 1-based SEG-Y byte numbers and address 4-byte big-endian integers.
 * Surveys written before SEG-Y revision 1 often carry the survey grid in the field record
 * number and CDP fields instead of the dedicated 3D fields, hence the {@link #LEGACY} preset.
 *
 * @param inlineByte    1-based byte position of the inline number
 * @param crosslineByte 1-based byte position of the crossline number
 */
public record TraceHeaderLayout(int inlineByte, int crosslineByte) {

    /** SEG-Y revision 1 3D fields (bytes 189 and 193). */
    public static final TraceHeaderLayout REV1 = new TraceHeaderLayout(189, 193);

    /** Field record number (byte 9) as inline, CDP ensemble number (byte 21) as crossline. */
    public static final TraceHeaderLayout LEGACY = new TraceHeaderLayout(9, 21);

    public TraceHeaderLayout {
        requireIntField("inlineByte", inlineByte);
        requireIntField("crosslineByte", crosslineByte);
        if (inlineByte == crosslineByte) {
            throw new IllegalArgumentException("inline and crossline byte positions must differ: " + inlineByte);
        }
    }

    /**
     * Builds a layout from configuration.
     * <p>
     * Recognized keys (all optional):
     * <ul>
     *   <li>{@code header-convention} - {@code rev1} (default) or {@code legacy}</li>
     *   <li>{@code inline-byte} - overrides the preset's inline position</li>
     *   <li>{@code crossline-byte} - overrides the preset's crossline position</li>
     * </ul>
     *
     * @param options the {@code segy} configuration block
     * @return the resolved layout
     * @throws IllegalArgumentException if the convention name is unknown or a position is invalid
     */
    public static TraceHeaderLayout fromConfig(Config options) {
        TraceHeaderLayout preset = REV1;
        if (options.hasPath("header-convention")) {
            preset = forConvention(options.getString("header-convention"));
        }
        int inline = options.hasPath("inline-byte") ? options.getInt("inline-byte") : preset.inlineByte();
        int crossline = options.hasPath("crossline-byte") ? options.getInt("crossline-byte") : preset.crosslineByte();
        return new TraceHeaderLayout(inline, crossline);
    }

    static TraceHeaderLayout forConvention(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "rev1" -> REV1;
            case "legacy" -> LEGACY;
            default -> throw new IllegalArgumentException("Unknown trace header convention: " + name);
        };
    }

    private static void requireIntField(String name, int bytePosition) {
        if (bytePosition < 1 || bytePosition > TraceHeader.SIZE - 3) {
            throw new IllegalArgumentException(
                name + " must address a 4-byte field inside the trace header (1.." + (TraceHeader.SIZE - 3)
                    + "), got " + bytePosition);
        }
    }
}
