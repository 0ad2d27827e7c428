package org.seisview.segy.slice;

import java.util.Arrays;

/**
 * Rescales slice amplitudes into [0, 1] with 1st/99th percentile clipping.
 * <p>
 * The output contract is exact and reproducible:
 * <ol>
 *   <li>Collect all finite values of the slice.</li>
 *   <li>Compute p1 and p99 by rank selection over the sorted values with linear interpolation
 *       between neighbouring order statistics: rank {@code r = p / 100 * (n - 1)},
 *       value {@code v[floor(r)] + (v[ceil(r)] - v[floor(r)]) * (r - floor(r))}.</li>
 *   <li>{@code span = p99 - p1}, or {@code 1.0} when the two coincide.</li>
 *   <li>Each value becomes {@code (clip(v, p1, p99) - p1) / span}.</li>
 * </ol>
 * Infinite values clip to the bounds; NaN maps to 0. A slice without any finite value maps to
 * all zeros, and an empty slice is returned as is.
 * <p>
 * This class is stateless and thread-safe.
 */
public class AmplitudeNormalizer {

    static final double LOWER_PERCENTILE = 1.0;
    static final double UPPER_PERCENTILE = 99.0;

    /**
     * Normalizes a slice.
     *
     * @param slice the raw slice
     * @return a slice of the same shape with values in [0, 1]
     */
    public Slice normalize(Slice slice) {
        if (slice.isEmpty()) {
            return slice;
        }

        final float[][] source = slice.getRows();
        final double[] finite = collectFinite(source);
        final float[][] normalized = new float[source.length][];

        if (finite.length == 0) {
            for (int r = 0; r < source.length; r++) {
                normalized[r] = new float[source[r].length];
            }
            return slice.withRows(normalized);
        }

        Arrays.sort(finite);
        final double low = percentile(finite, LOWER_PERCENTILE);
        final double high = percentile(finite, UPPER_PERCENTILE);
        final double span = (high - low) != 0.0 ? (high - low) : 1.0;

        for (int r = 0; r < source.length; r++) {
            final float[] in = source[r];
            final float[] out = new float[in.length];
            for (int c = 0; c < in.length; c++) {
                final double v = in[c];
                if (Double.isNaN(v)) {
                    continue;
                }
                final double clipped = Math.min(Math.max(v, low), high);
                out[c] = (float) ((clipped - low) / span);
            }
            normalized[r] = out;
        }
        return slice.withRows(normalized);
    }

    /**
     * Percentile of ascending-sorted values using linear interpolation between order statistics.
     *
     * @param sorted     non-empty values in ascending order
     * @param percentile percentile in [0, 100]
     * @return the interpolated value
     */
    static double percentile(double[] sorted, double percentile) {
        final double rank = percentile / 100.0 * (sorted.length - 1);
        final int lower = (int) Math.floor(rank);
        final int upper = (int) Math.ceil(rank);
        final double fraction = rank - lower;
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static double[] collectFinite(float[][] rows) {
        int count = 0;
        for (float[] row : rows) {
            for (float v : row) {
                if (Float.isFinite(v)) {
                    count++;
                }
            }
        }
        final double[] values = new double[count];
        int i = 0;
        for (float[] row : rows) {
            for (float v : row) {
                if (Float.isFinite(v)) {
                    values[i++] = v;
                }
            }
        }
        return values;
    }
}
