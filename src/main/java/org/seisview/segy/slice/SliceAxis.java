package org.seisview.segy.slice;

import java.util.Locale;

/**
 * Horizontal survey axis along which a slice is cut.
 */
public enum SliceAxis {

    INLINE("inline"),
    CROSSLINE("crossline");

    private final String label;

    SliceAxis(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the axis whose positions form the columns of a slice along this axis
     */
    public SliceAxis perpendicular() {
        return this == INLINE ? CROSSLINE : INLINE;
    }

    /**
     * Parses an axis name, accepting {@code inline}/{@code iline} and {@code crossline}/{@code xline}.
     *
     * @param name axis name, case-insensitive
     * @return the axis
     * @throws IllegalArgumentException for any other name
     */
    public static SliceAxis parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Axis name is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "inline", "iline" -> INLINE;
            case "crossline", "xline" -> CROSSLINE;
            default -> throw new IllegalArgumentException("Unknown slice axis: " + name);
        };
    }
}
