package org.seisview.segy;

/**
 * Thrown when a textual, binary or trace header has the wrong size or carries values that cannot
 * describe a readable volume.
 */
public class MalformedHeaderException extends SegyException {

    public MalformedHeaderException(String message) {
        super(message);
    }

    public MalformedHeaderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "MalformedHeader";
    }
}
