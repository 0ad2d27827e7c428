package org.seisview.segy;

/**
 * Thrown when the file holds fewer trace bytes than its headers declare.
 */
public class TruncatedTraceException extends SegyException {

    public TruncatedTraceException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "TruncatedTrace";
    }
}
