package org.seisview.segy;

/**
 * Thrown when a volume contains no traces.
 */
public class EmptyVolumeException extends SegyException {

    public EmptyVolumeException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "EmptyVolume";
    }
}
