package org.seisview.segy;

/**
 * Thrown when the binary header names a sample format code outside the supported set.
 */
public class UnsupportedFormatException extends SegyException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "UnsupportedFormat";
    }
}
