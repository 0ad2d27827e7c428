package org.seisview.segy.slice;

/**
 * A 2D cross-section of a volume at a fixed inline or crossline number.
 * <p>
 * Row {@code r} holds sample {@code r} of every trace along the slice; column {@code c} belongs
 * to perpendicular-axis position {@code positions[c]}, in ascending order.
 * <p>
 * Slices are immutable once built: the constructor takes ownership of the arrays it is given and
 * the accessors hand out copies, so a slice can be cached and shared between requests.
 */
public final class Slice {

    private final SliceAxis axis;
    private final int axisValue;
    private final int[] positions;
    private final float[][] rows;

    /**
     * @param axis      axis the slice was cut along
     * @param axisValue inline or crossline number of the slice
     * @param positions perpendicular-axis numbers of the columns, ascending
     * @param rows      samples, {@code rows[sample][column]}
     */
    public Slice(SliceAxis axis, int axisValue, int[] positions, float[][] rows) {
        for (float[] row : rows) {
            if (row.length != positions.length) {
                throw new IllegalArgumentException("Row width " + row.length
                    + " does not match position count " + positions.length);
            }
        }
        this.axis = axis;
        this.axisValue = axisValue;
        this.positions = positions;
        this.rows = rows;
    }

    /**
     * Creates a slice with the same axis and positions but different sample values.
     *
     * @param newRows values with the same shape as this slice
     * @return the new slice
     */
    public Slice withRows(float[][] newRows) {
        if (newRows.length != rows.length) {
            throw new IllegalArgumentException("Row count " + newRows.length + " does not match " + rows.length);
        }
        return new Slice(axis, axisValue, positions, newRows);
    }

    public SliceAxis getAxis() {
        return axis;
    }

    public int getAxisValue() {
        return axisValue;
    }

    /**
     * @return a copy of the column positions
     */
    public int[] getPositions() {
        return positions.clone();
    }

    /**
     * @return a copy of the samples, {@code [sample][column]}
     */
    public float[][] getRows() {
        final float[][] copy = new float[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            copy[r] = rows[r].clone();
        }
        return copy;
    }

    public int getSampleCount() {
        return rows.length;
    }

    public int getWidth() {
        return positions.length;
    }

    public float get(int sample, int column) {
        return rows[sample][column];
    }

    public boolean isEmpty() {
        return rows.length == 0 || positions.length == 0;
    }

    @Override
    public String toString() {
        return "Slice{" + axis.label() + "=" + axisValue + ", samples=" + rows.length
            + ", width=" + positions.length + "}";
    }
}
