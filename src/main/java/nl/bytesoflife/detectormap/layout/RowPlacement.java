package nl.bytesoflife.detectormap.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Horizontal group centers for each row of the focal plane.
 * <p>
 * Row 0 is centered on x = 0. Every following row is centered on the mean of the row below
 * it, except the top row, which reuses the middle run of the row below so that its groups sit
 * exactly above those groups.
 */
public final class RowPlacement {

    private RowPlacement() {
    }

    /**
     * @return one array of group center x coordinates per row, bottom row first
     */
    public static List<double[]> groupCenters(List<Integer> rowGroupCounts, double strideX) {
        List<double[]> rows = new ArrayList<>();
        int rowCount = rowGroupCounts.size();

        rows.add(centeredRow(rowGroupCounts.get(0), 0.0, strideX));
        for (int row = 1; row < rowCount; row++) {
            double[] below = rows.get(row - 1);
            int groups = rowGroupCounts.get(row);
            if (row == rowCount - 1) {
                rows.add(alignedWithMiddle(below, groups));
            } else {
                rows.add(centeredRow(groups, mean(below), strideX));
            }
        }
        return rows;
    }

    static double[] centeredRow(int groups, double center, double strideX) {
        double[] xs = new double[groups];
        for (int i = 0; i < groups; i++) {
            xs[i] = center + (i - (groups - 1) / 2.0) * strideX;
        }
        return xs;
    }

    /**
     * The contiguous middle run of {@code below} holding {@code groups} entries. When the run
     * cannot be centred exactly it starts one position further left.
     */
    static double[] alignedWithMiddle(double[] below, int groups) {
        int start = (below.length - groups) / 2;
        return Arrays.copyOfRange(below, start, start + groups);
    }

    static double mean(double[] xs) {
        double sum = 0;
        for (double x : xs) {
            sum += x;
        }
        return sum / xs.length;
    }
}
