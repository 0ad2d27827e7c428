package org.seisview.segy;

import org.seisview.segy.slice.SliceAxis;

/**
 * Thrown when a requested inline or crossline number is not part of the volume geometry.
 * <p>
 * Only exact members of the distinct-value set are valid; a number lying between two real
 * inlines is rejected like any other unknown value.
 */
public class AxisValueNotFoundException extends SegyException {

    private final SliceAxis axis;
    private final int value;

    public AxisValueNotFoundException(SliceAxis axis, int value) {
        super(axis.label() + " " + value + " is not present in the volume geometry");
        this.axis = axis;
        this.value = value;
    }

    public SliceAxis getAxis() {
        return axis;
    }

    public int getValue() {
        return value;
    }

    @Override
    public String getErrorCode() {
        return "AxisValueNotFound";
    }
}
