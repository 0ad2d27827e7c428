package org.seisview.segy;

/**
 * Thrown when a volume query arrives before any volume was opened successfully.
 */
public class VolumeNotOpenException extends SegyException {

    public VolumeNotOpenException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "VolumeNotOpen";
    }
}
