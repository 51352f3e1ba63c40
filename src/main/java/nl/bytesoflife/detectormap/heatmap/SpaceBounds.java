package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.ConfigurationException;

/**
 * Coordinate range shared by both axes of the binning space.
 * <p>
 * Columns run from {@code min} to {@code max} left to right. Rows are inverted: row 0 holds the
 * {@code max} edge, matching image rows that grow downward.
 */
public record SpaceBounds(double min, double max) {

    /** Pixel extent of an ATLAS detector chip. */
    public static final SpaceBounds ATLAS_CHIP = new SpaceBounds(0, 10559);

    public SpaceBounds {
        if (!Double.isFinite(min) || !Double.isFinite(max) || max <= min) {
            throw new ConfigurationException("Invalid space bounds: [" + min + ", " + max + "]");
        }
    }

    public double extent() {
        return max - min;
    }

    /**
     * Column index for x, or -1 when x falls outside the grid.
     */
    public int columnOf(double x, int resolution) {
        return toIndex((x - min) / extent() * resolution, resolution);
    }

    /**
     * Row index for y, or -1 when y falls outside the grid. y == min belongs to the last row.
     */
    public int rowOf(double y, int resolution) {
        double scaled = (max - y) / extent() * resolution;
        if (scaled == resolution) {
            return resolution - 1;
        }
        return toIndex(scaled, resolution);
    }

    private static int toIndex(double scaled, int resolution) {
        double cell = Math.floor(scaled);
        if (Double.isNaN(cell) || cell < 0 || cell >= resolution) {
            return -1;
        }
        return (int) cell;
    }
}
