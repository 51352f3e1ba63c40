package nl.bytesoflife.detectormap.layout;

import nl.bytesoflife.detectormap.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DetectorLayoutTest {

    private static final double EPS = 1e-9;

    private final DetectorLayout layout = DetectorLayout.compute(LayoutGeometry.defaults());

    @Test
    void producesOneDistinctCenterPerDetector() {
        assertEquals(189, layout.size());
        Set<Coordinate> centers = new HashSet<>(layout.centers().values());
        assertEquals(189, centers.size());
    }

    @Test
    void cellsAreInIdentifierOrder() {
        List<DetectorCell> cells = layout.getCells();
        for (int i = 0; i < cells.size(); i++) {
            assertEquals(i, cells.get(i).id());
            assertEquals(i / 9, cells.get(i).group());
        }
    }

    @Test
    void computingTwiceGivesIdenticalCoordinates() {
        DetectorLayout again = DetectorLayout.compute(LayoutGeometry.defaults());
        for (int id = 0; id < 189; id++) {
            DetectorCell a = layout.getCell(id);
            DetectorCell b = again.getCell(id);
            assertEquals(Double.doubleToLongBits(a.x()), Double.doubleToLongBits(b.x()));
            assertEquals(Double.doubleToLongBits(a.y()), Double.doubleToLongBits(b.y()));
        }
    }

    @Test
    void firstGroupCorners() {
        Coordinate first = layout.center(0);
        Coordinate last = layout.center(8);

        assertTrue(last.x > first.x);
        assertTrue(last.y > first.y);

        // group 0 is centered at (-3.84, 0); squares of 1.0 with 0.12 gaps
        assertEquals(-4.96, first.x, EPS);
        assertEquals(-1.12, first.y, EPS);
        assertEquals(-2.72, last.x, EPS);
        assertEquals(1.12, last.y, EPS);
    }

    @Test
    void middleSquareSitsOnGroupCenter() {
        Coordinate center = layout.center(4);
        assertEquals(-3.84, center.x, EPS);
        assertEquals(0.0, center.y, EPS);
    }

    @Test
    void subPositionsRunBottomToTopLeftToRight() {
        DetectorCell cell = layout.getCell(9 + 5);
        assertEquals(1, cell.group());
        assertEquals(2, cell.ix());
        assertEquals(1, cell.iy());

        assertEquals(layout.center(9).y, layout.center(11).y, EPS);
        assertEquals(layout.center(9).x, layout.center(15).x, EPS);
        assertTrue(layout.center(15).y > layout.center(9).y);
    }

    @Test
    void rowsStackUpward() {
        assertEquals(0.0, layout.rowCenterY(0), EPS);
        assertEquals(3.84, layout.rowCenterY(1), EPS);
        assertEquals(15.36, layout.rowCenterY(4), EPS);

        // first detector of row 1 belongs to group 3
        assertEquals(1, layout.getCell(27).row());
        assertEquals(0, layout.getCell(26).row());
        assertEquals(4, layout.getCell(188).row());
    }

    @Test
    void groupCentersPerRow() {
        assertArrayEquals(new double[]{-3.84, 0, 3.84}, layout.groupCentersX(0), EPS);
        assertArrayEquals(new double[]{-7.68, -3.84, 0, 3.84, 7.68}, layout.groupCentersX(1), EPS);
        assertArrayEquals(new double[]{-7.68, -3.84, 0, 3.84, 7.68}, layout.groupCentersX(3), EPS);
    }

    @Test
    void topRowReusesMiddleGroupsOfRowBelow() {
        double[] below = layout.groupCentersX(3);
        double[] top = layout.groupCentersX(4);

        assertEquals(3, top.length);
        assertEquals(below[1], top[0], 0.0);
        assertEquals(below[2], top[1], 0.0);
        assertEquals(below[3], top[2], 0.0);
    }

    @Test
    void lastDetectorIsTopRightOfLastGroup() {
        Coordinate last = layout.center(188);
        // group 20 centered at (3.84, 15.36)
        assertEquals(3.84 + 1.12, last.x, EPS);
        assertEquals(15.36 + 1.12, last.y, EPS);
    }

    @Test
    void extentAddsOneSquareOfPadding() {
        Envelope extent = layout.extent();

        assertEquals(-7.68 - 1.62 - 1.0, extent.getMinX(), EPS);
        assertEquals(7.68 + 1.62 + 1.0, extent.getMaxX(), EPS);
        assertEquals(-1.62 - 1.0, extent.getMinY(), EPS);
        assertEquals(15.36 + 1.62 + 1.0, extent.getMaxY(), EPS);
        for (DetectorCell cell : layout.getCells()) {
            assertTrue(extent.contains(cell.bounds()));
        }
    }

    @Test
    void polygonsMatchSquareSize() {
        List<Polygon> polygons = layout.toPolygons(new GeometryFactory());
        assertEquals(189, polygons.size());
        assertEquals(1.0, polygons.get(0).getArea(), EPS);
        assertEquals(-4.96, polygons.get(0).getCentroid().getX(), EPS);
    }

    @Test
    void unknownDetectorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> layout.getCell(189));
        assertThrows(IllegalArgumentException.class, () -> layout.getCell(-1));
    }

    @Test
    void customRowsFollowSameRules() {
        LayoutGeometry geometry = LayoutGeometry.defaults().withRows(List.of(3, 5, 2), 90);
        DetectorLayout custom = DetectorLayout.compute(geometry);

        assertEquals(90, custom.size());
        // (5 - 2) / 2 = 1: the top row starts at the second group of the row below
        assertArrayEquals(new double[]{-3.84, 0}, custom.groupCentersX(2), EPS);
    }

    @Test
    void singleRowIsCenteredOnOrigin() {
        DetectorLayout single = DetectorLayout.compute(LayoutGeometry.defaults().withRows(List.of(2), 18));
        assertArrayEquals(new double[]{-1.92, 1.92}, single.groupCentersX(0), EPS);
    }

    @Test
    void spacingScalesPositions() {
        LayoutGeometry doubled = LayoutGeometry.defaults().withSpacing(2.0, 0.24, 1.2, 1.2);
        DetectorLayout scaled = DetectorLayout.compute(doubled);
        for (int id : new int[]{0, 8, 94, 188}) {
            assertEquals(2 * layout.center(id).x, scaled.center(id).x, EPS);
            assertEquals(2 * layout.center(id).y, scaled.center(id).y, EPS);
        }
    }

    @Test
    void mismatchedGroupTotalIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> LayoutGeometry.defaults().withRows(List.of(3, 5, 5, 5, 2), 189));
    }
}
