package org.seisview.telemetry;

import java.util.List;

/**
 * Snapshot of the live drilling state shown as an overlay.
 * <p>
 * Positions are {@code [longitude, latitude, height]} triples; height may be omitted.
 *
 * @param path trajectory points in drilling order
 * @param bit  current bit position, or null before the first report
 * @param md   measured depth along the well path
 */
public record DrillState(List<List<Double>> path, List<Double> bit, double md) {

    public DrillState {
        path = List.copyOf(path);
        bit = bit == null ? null : List.copyOf(bit);
    }

    public static DrillState initial() {
        return new DrillState(List.of(), null, 0.0);
    }

    /**
     * Applies a partial update. Absent fields keep their current value; an empty path does not
     * clear the trajectory.
     *
     * @param update the update
     * @return the merged state
     */
    public DrillState merge(DrillStateUpdate update) {
        return new DrillState(
            update.path() != null && !update.path().isEmpty() ? update.path() : path,
            update.bit() != null ? update.bit() : bit,
            update.md() != null ? update.md() : md);
    }
}
