package nl.bytesoflife.detectormap.layout;

import nl.bytesoflife.detectormap.ConfigurationException;

import java.util.List;

/**
 * Dimensions of a focal plane built from 3x3 groups of square detectors.
 * <p>
 * Rows are listed bottom to top. Each row holds {@code rowGroupCounts.get(row)} groups and every
 * group holds {@value #DETECTORS_PER_GROUP} detectors, so the counts must add up to
 * {@code detectorCount / 9}.
 */
public final class LayoutGeometry {

    public static final int GROUP_SIDE = 3;
    public static final int DETECTORS_PER_GROUP = GROUP_SIDE * GROUP_SIDE;

    public static final List<Integer> DEFAULT_ROW_GROUP_COUNTS = List.of(3, 5, 5, 5, 3);
    public static final int DEFAULT_DETECTOR_COUNT = 189;

    private final double squareSize;
    private final double intraGap;
    private final double interGapX;
    private final double interGapY;
    private final List<Integer> rowGroupCounts;
    private final int detectorCount;

    public LayoutGeometry(double squareSize, double intraGap, double interGapX, double interGapY,
                          List<Integer> rowGroupCounts, int detectorCount) {
        requirePositive("squareSize", squareSize);
        requireNonNegative("intraGap", intraGap);
        requireNonNegative("interGapX", interGapX);
        requireNonNegative("interGapY", interGapY);
        if (rowGroupCounts == null || rowGroupCounts.isEmpty()) {
            throw new ConfigurationException("At least one row of groups is required");
        }

        int groups = 0;
        for (int row = 0; row < rowGroupCounts.size(); row++) {
            Integer count = rowGroupCounts.get(row);
            if (count == null || count < 1) {
                throw new ConfigurationException("Row " + row + " must hold at least one group, got " + count);
            }
            groups += count;
        }
        if (groups * DETECTORS_PER_GROUP != detectorCount) {
            throw new ConfigurationException("Row group counts " + rowGroupCounts + " give "
                    + groups * DETECTORS_PER_GROUP + " detectors, expected " + detectorCount);
        }

        int rows = rowGroupCounts.size();
        if (rows > 1 && rowGroupCounts.get(rows - 1) > rowGroupCounts.get(rows - 2)) {
            throw new ConfigurationException("Top row has " + rowGroupCounts.get(rows - 1)
                    + " groups but the row beneath it only " + rowGroupCounts.get(rows - 2));
        }

        this.squareSize = squareSize;
        this.intraGap = intraGap;
        this.interGapX = interGapX;
        this.interGapY = interGapY;
        this.rowGroupCounts = List.copyOf(rowGroupCounts);
        this.detectorCount = detectorCount;
    }

    public static LayoutGeometry defaults() {
        return new LayoutGeometry(1.0, 0.12, 0.6, 0.6, DEFAULT_ROW_GROUP_COUNTS, DEFAULT_DETECTOR_COUNT);
    }

    public LayoutGeometry withSpacing(double squareSize, double intraGap, double interGapX, double interGapY) {
        return new LayoutGeometry(squareSize, intraGap, interGapX, interGapY, rowGroupCounts, detectorCount);
    }

    public LayoutGeometry withRows(List<Integer> rowGroupCounts, int detectorCount) {
        return new LayoutGeometry(squareSize, intraGap, interGapX, interGapY, rowGroupCounts, detectorCount);
    }

    public double getSquareSize() {
        return squareSize;
    }

    public double getIntraGap() {
        return intraGap;
    }

    public double getInterGapX() {
        return interGapX;
    }

    public double getInterGapY() {
        return interGapY;
    }

    public List<Integer> getRowGroupCounts() {
        return rowGroupCounts;
    }

    public int getDetectorCount() {
        return detectorCount;
    }

    public int getGroupCount() {
        return detectorCount / DETECTORS_PER_GROUP;
    }

    public int getRowCount() {
        return rowGroupCounts.size();
    }

    public double getPitch() {
        return squareSize + intraGap;
    }

    public double getGroupWidth() {
        return GROUP_SIDE * squareSize + (GROUP_SIDE - 1) * intraGap;
    }

    public double getGroupHeight() {
        return GROUP_SIDE * squareSize + (GROUP_SIDE - 1) * intraGap;
    }

    public double getStrideX() {
        return getGroupWidth() + interGapX;
    }

    public double getStrideY() {
        return getGroupHeight() + interGapY;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must not be negative, got " + value);
        }
    }

    @Override
    public String toString() {
        return "LayoutGeometry[square=" + squareSize + ", intraGap=" + intraGap
                + ", interGap=(" + interGapX + ", " + interGapY + "), rows=" + rowGroupCounts
                + ", detectors=" + detectorCount + "]";
    }
}
