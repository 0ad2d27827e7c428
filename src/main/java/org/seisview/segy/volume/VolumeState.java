package org.seisview.segy.volume;

/**
 * Lifecycle state of a {@link VolumeAccessor}.
 */
public enum VolumeState {
    /** No volume is being served. */
    CLOSED,
    /** A fully decoded and indexed volume is being served. */
    OPEN
}
