package nl.bytesoflife.detectormap.heatmap.stats;

import nl.bytesoflife.detectormap.ConfigurationException;
import nl.bytesoflife.detectormap.heatmap.HeatMapGrid;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

public class GridStatisticsCalculator {

    public static final double DEFAULT_MULTIPLIER = 1.5;

    public GridStatistics compute(HeatMapGrid grid) {
        return compute(grid, DEFAULT_MULTIPLIER);
    }

    public GridStatistics compute(HeatMapGrid grid, double multiplier) {
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new ConfigurationException("Median multiplier must be positive and finite: " + multiplier);
        }

        double[] values = grid.flatten();
        double median = median(values);
        double mad = medianAbsoluteDeviation(values, median);
        double stddev = new StandardDeviation(false).evaluate(values);

        // median == 0 leaves the bound at 0: no signal, callers must not scale by it
        double displayBound = median == 0 ? 0 : multiplier * median;

        int above = 0;
        for (double v : values) {
            if (v > displayBound) {
                above++;
            }
        }
        double maskedFraction = above * 100.0 / values.length;

        return new GridStatistics(median, mad, stddev, multiplier, displayBound, maskedFraction);
    }

    static double median(double[] values) {
        return new Median().evaluate(values);
    }

    static double medianAbsoluteDeviation(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }
}
