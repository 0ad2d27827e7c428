package org.seisview.segy.format;

import org.seisview.segy.UnsupportedFormatException;

/**
 * Closed set of trace sample encodings understood by the reader.
 * <p>
 * Codes follow the SEG-Y binary header (bytes 3225-3226). Codes outside this set, including
 * the fixed-point-with-gain format 4 and the 64-bit and unsigned formats introduced by
 * revision 2, are rejected rather than guessed.
 */
public enum SampleFormat {

    /** 4-byte IBM hexadecimal floating point. */
    IBM_FLOAT(1, 4),

    /** 4-byte two's complement integer. */
    INT32(2, 4),

    /** 2-byte two's complement integer. */
    INT16(3, 2),

    /** 4-byte IEEE 754 floating point. */
    IEEE_FLOAT(5, 4),

    /** 1-byte two's complement integer. */
    INT8(8, 1);

    private final int code;
    private final int bytesPerSample;

    SampleFormat(int code, int bytesPerSample) {
        this.code = code;
        this.bytesPerSample = bytesPerSample;
    }

    public int code() {
        return code;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    /**
     * Resolves a binary header format code.
     *
     * @param code the raw format code
     * @return the matching format
     * @throws UnsupportedFormatException if the code is not in the supported set
     */
    public static SampleFormat fromCode(int code) throws UnsupportedFormatException {
        for (SampleFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw new UnsupportedFormatException("Unsupported sample format code: " + code);
    }
}
