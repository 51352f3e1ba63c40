package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.ConfigurationException;

import java.util.Arrays;
import java.util.List;

/**
 * Square matrix of accumulated sample weights, indexed {@code [row][col]} with row 0 at the
 * maximum-y edge of the binning space.
 * <p>
 * Cells only ever grow. Once a binning pass has finished the grid is treated as read-only;
 * {@link #merge} and {@link #masked} return new grids.
 */
public class HeatMapGrid {

    private final int resolution;
    private final double[][] cells;

    public HeatMapGrid(int resolution) {
        this.resolution = Resolution.requireSupported(resolution);
        this.cells = new double[resolution][resolution];
    }

    /**
     * Wraps a pre-built square matrix. The row count must be a supported resolution.
     */
    public static HeatMapGrid fromMatrix(double[][] matrix) {
        if (matrix == null || matrix.length == 0) {
            throw new ConfigurationException("Matrix must have at least one row");
        }
        HeatMapGrid grid = new HeatMapGrid(matrix.length);
        for (int row = 0; row < matrix.length; row++) {
            if (matrix[row] == null || matrix[row].length != matrix.length) {
                throw new ConfigurationException("Matrix is not square: row " + row + " has "
                        + (matrix[row] == null ? 0 : matrix[row].length) + " columns, expected " + matrix.length);
            }
            for (int col = 0; col < matrix.length; col++) {
                grid.add(row, col, matrix[row][col]);
            }
        }
        return grid;
    }

    /**
     * Builds a grid from one value per cell in row-major order. The resolution is the square
     * root of the number of values.
     */
    public static HeatMapGrid fromCells(List<? extends Number> cellValues) {
        int count = cellValues.size();
        int side = (int) Math.round(Math.sqrt(count));
        if (side * side != count) {
            throw new ConfigurationException(count + " cell values do not form a square grid");
        }
        if (!Resolution.isSupported(side)) {
            throw new ConfigurationException("Cell count " + count + " implies resolution " + side
                    + ", which is not supported");
        }
        HeatMapGrid grid = new HeatMapGrid(side);
        for (int i = 0; i < count; i++) {
            grid.add(i / side, i % side, cellValues.get(i).doubleValue());
        }
        return grid;
    }

    void add(int row, int col, double weight) {
        if (!(weight >= 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Cell weight must be finite and non-negative: " + weight);
        }
        cells[row][col] += weight;
    }

    public int getResolution() {
        return resolution;
    }

    public int getCellCount() {
        return resolution * resolution;
    }

    public double get(int row, int col) {
        return cells[row][col];
    }

    public double total() {
        double sum = 0;
        for (double[] row : cells) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum;
    }

    /**
     * All cell values in row-major order.
     */
    public double[] flatten() {
        double[] flat = new double[getCellCount()];
        for (int row = 0; row < resolution; row++) {
            System.arraycopy(cells[row], 0, flat, row * resolution, resolution);
        }
        return flat;
    }

    public double[][] toArray() {
        double[][] copy = new double[resolution][];
        for (int row = 0; row < resolution; row++) {
            copy[row] = cells[row].clone();
        }
        return copy;
    }

    /**
     * Elementwise sum of two grids of the same resolution.
     */
    public HeatMapGrid merge(HeatMapGrid other) {
        if (other.resolution != resolution) {
            throw new ConfigurationException("Cannot merge a " + other.resolution + " grid into a "
                    + resolution + " grid");
        }
        HeatMapGrid merged = new HeatMapGrid(resolution);
        for (int row = 0; row < resolution; row++) {
            for (int col = 0; col < resolution; col++) {
                merged.cells[row][col] = cells[row][col] + other.cells[row][col];
            }
        }
        return merged;
    }

    /**
     * Copy with every cell above {@code bound} set to zero.
     */
    public HeatMapGrid masked(double bound) {
        HeatMapGrid copy = new HeatMapGrid(resolution);
        for (int row = 0; row < resolution; row++) {
            for (int col = 0; col < resolution; col++) {
                double v = cells[row][col];
                copy.cells[row][col] = v > bound ? 0 : v;
            }
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeatMapGrid other)) return false;
        return resolution == other.resolution && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * resolution + Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return "HeatMapGrid[" + resolution + "x" + resolution + ", total=" + total() + "]";
    }
}
