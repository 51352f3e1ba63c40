package nl.bytesoflife.detectormap.layout;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drawing positions of every detector in a {@link LayoutGeometry}.
 * <p>
 * Detectors come in blocks of nine per group, groups fill rows bottom to top and left to right,
 * and inside a group the nine squares are numbered
 * <pre>
 * 6 7 8
 * 3 4 5
 * 0 1 2
 * </pre>
 * The layout is a pure function of the geometry; computing it twice gives identical
 * coordinates.
 */
public class DetectorLayout {

    private final LayoutGeometry geometry;
    private final List<double[]> groupCentersX;
    private final List<DetectorCell> cells;

    private DetectorLayout(LayoutGeometry geometry, List<double[]> groupCentersX, List<DetectorCell> cells) {
        this.geometry = geometry;
        this.groupCentersX = groupCentersX;
        this.cells = cells;
    }

    public static DetectorLayout compute(LayoutGeometry geometry) {
        List<double[]> rowsX = RowPlacement.groupCenters(geometry.getRowGroupCounts(), geometry.getStrideX());
        List<DetectorCell> cells = new ArrayList<>(geometry.getDetectorCount());

        double size = geometry.getSquareSize();
        double pitch = geometry.getPitch();
        double halfWidth = geometry.getGroupWidth() / 2;
        double halfHeight = geometry.getGroupHeight() / 2;

        int group = 0;
        for (int row = 0; row < rowsX.size(); row++) {
            double yCenter = rowCenterY(geometry, row);
            for (double xCenter : rowsX.get(row)) {
                int base = LayoutGeometry.DETECTORS_PER_GROUP * group;
                double x0 = xCenter - halfWidth;
                double y0 = yCenter - halfHeight;

                for (int iy = 0; iy < LayoutGeometry.GROUP_SIDE; iy++) {
                    for (int ix = 0; ix < LayoutGeometry.GROUP_SIDE; ix++) {
                        int id = base + iy * LayoutGeometry.GROUP_SIDE + ix;
                        double x = x0 + ix * pitch + size / 2;
                        double y = y0 + iy * pitch + size / 2;
                        cells.add(new DetectorCell(id, group, row, ix, iy, x, y, size));
                    }
                }
                group++;
            }
        }

        List<double[]> frozenRows = new ArrayList<>(rowsX.size());
        for (double[] xs : rowsX) {
            frozenRows.add(xs.clone());
        }
        return new DetectorLayout(geometry, frozenRows, Collections.unmodifiableList(cells));
    }

    static double rowCenterY(LayoutGeometry geometry, int row) {
        return row * geometry.getStrideY();
    }

    public LayoutGeometry getGeometry() {
        return geometry;
    }

    public List<DetectorCell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public DetectorCell getCell(int id) {
        if (id < 0 || id >= cells.size()) {
            throw new IllegalArgumentException("Detector " + id + " outside [0, " + cells.size() + ")");
        }
        return cells.get(id);
    }

    public Coordinate center(int id) {
        return getCell(id).center();
    }

    public Map<Integer, Coordinate> centers() {
        Map<Integer, Coordinate> centers = new LinkedHashMap<>();
        for (DetectorCell cell : cells) {
            centers.put(cell.id(), cell.center());
        }
        return centers;
    }

    public double[] groupCentersX(int row) {
        return groupCentersX.get(row).clone();
    }

    public double rowCenterY(int row) {
        if (row < 0 || row >= geometry.getRowCount()) {
            throw new IllegalArgumentException("Row " + row + " outside [0, " + geometry.getRowCount() + ")");
        }
        return rowCenterY(geometry, row);
    }

    /**
     * Drawing extent: the outermost groups plus one square of padding on every side.
     */
    public Envelope extent() {
        double pad = geometry.getSquareSize();
        double halfWidth = geometry.getGroupWidth() / 2;
        double halfHeight = geometry.getGroupHeight() / 2;

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        for (double[] xs : groupCentersX) {
            for (double x : xs) {
                minX = Math.min(minX, x);
                maxX = Math.max(maxX, x);
            }
        }
        double topY = rowCenterY(geometry, geometry.getRowCount() - 1);
        return new Envelope(minX - (halfWidth + pad), maxX + (halfWidth + pad),
                -(halfHeight + pad), topY + halfHeight + pad);
    }

    /**
     * Detector squares as polygons, in identifier order.
     */
    public List<Polygon> toPolygons(GeometryFactory factory) {
        List<Polygon> polygons = new ArrayList<>(cells.size());
        for (DetectorCell cell : cells) {
            polygons.add((Polygon) factory.toGeometry(cell.bounds()));
        }
        return polygons;
    }
}
