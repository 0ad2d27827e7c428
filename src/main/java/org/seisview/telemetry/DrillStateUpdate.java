package org.seisview.telemetry;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound drilling report. Every field is optional.
 *
 * @param bit  new bit position {@code [lon, lat, height]}
 * @param md   new measured depth
 * @param path full or partial trajectory replacing the current one when non-empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DrillStateUpdate(List<Double> bit, Double md, List<List<Double>> path) {

    /**
     * Checks that every position has two or three finite coordinates and the depth is finite.
     *
     * @throws IllegalArgumentException if a value is malformed
     */
    public void validate() {
        if (bit != null) {
            requirePosition("bit", bit);
        }
        if (md != null && !Double.isFinite(md)) {
            throw new IllegalArgumentException("md must be a finite number");
        }
        if (path != null) {
            for (int i = 0; i < path.size(); i++) {
                requirePosition("path[" + i + "]", path.get(i));
            }
        }
    }

    private static void requirePosition(String name, List<Double> position) {
        if (position == null || position.size() < 2 || position.size() > 3) {
            throw new IllegalArgumentException(name + " must be [lon, lat] or [lon, lat, height]");
        }
        for (Double coordinate : position) {
            if (coordinate == null || !Double.isFinite(coordinate)) {
                throw new IllegalArgumentException(name + " contains a non-finite coordinate");
            }
        }
    }
}
