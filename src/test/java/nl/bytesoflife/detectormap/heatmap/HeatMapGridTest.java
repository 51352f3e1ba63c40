package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeatMapGridTest {

    @Test
    void newGridIsZeroFilled() {
        HeatMapGrid grid = new HeatMapGrid(16);
        assertEquals(256, grid.getCellCount());
        assertEquals(0.0, grid.total(), 0.0);
    }

    @Test
    void fromCellsDerivesResolutionFromCount() {
        List<Integer> cells = new ArrayList<>(Collections.nCopies(64, 0));
        cells.set(9, 5);

        HeatMapGrid grid = HeatMapGrid.fromCells(cells);

        assertEquals(8, grid.getResolution());
        assertEquals(5.0, grid.get(1, 1), 0.0);
    }

    @Test
    void fromCellsRejectsNonSquareCount() {
        assertThrows(ConfigurationException.class,
                () -> HeatMapGrid.fromCells(Collections.nCopies(65, 1)));
    }

    @Test
    void fromCellsRejectsSquareOfUnsupportedResolution() {
        // 10 x 10 is square but 10 is not an allowed resolution
        assertThrows(ConfigurationException.class,
                () -> HeatMapGrid.fromCells(Collections.nCopies(100, 1)));
    }

    @Test
    void fromMatrixRequiresSquareRows() {
        double[][] ragged = new double[8][8];
        ragged[3] = new double[7];
        assertThrows(ConfigurationException.class, () -> HeatMapGrid.fromMatrix(ragged));
    }

    @Test
    void fromMatrixCopiesValues() {
        double[][] matrix = new double[8][8];
        matrix[2][5] = 4;
        HeatMapGrid grid = HeatMapGrid.fromMatrix(matrix);

        matrix[2][5] = 100;
        assertEquals(4.0, grid.get(2, 5), 0.0);
    }

    @Test
    void mergeAddsCellwise() {
        double[][] a = new double[8][8];
        double[][] b = new double[8][8];
        a[0][0] = 1;
        b[0][0] = 2;
        b[7][7] = 3;

        HeatMapGrid merged = HeatMapGrid.fromMatrix(a).merge(HeatMapGrid.fromMatrix(b));

        assertEquals(3.0, merged.get(0, 0), 0.0);
        assertEquals(3.0, merged.get(7, 7), 0.0);
        assertEquals(merged, HeatMapGrid.fromMatrix(b).merge(HeatMapGrid.fromMatrix(a)));
    }

    @Test
    void mergeRejectsDifferentResolutions() {
        assertThrows(ConfigurationException.class, () -> new HeatMapGrid(8).merge(new HeatMapGrid(16)));
    }

    @Test
    void maskedZeroesCellsAboveBound() {
        double[][] matrix = new double[8][8];
        matrix[0][0] = 10;
        matrix[0][1] = 2;
        HeatMapGrid masked = HeatMapGrid.fromMatrix(matrix).masked(5);

        assertEquals(0.0, masked.get(0, 0), 0.0);
        assertEquals(2.0, masked.get(0, 1), 0.0);
    }

    @Test
    void flattenIsRowMajor() {
        double[][] matrix = new double[8][8];
        matrix[1][2] = 7;
        double[] flat = HeatMapGrid.fromMatrix(matrix).flatten();
        assertEquals(7.0, flat[8 + 2], 0.0);
    }
}
