package nl.bytesoflife.detectormap.heatmap.stats;

/**
 * Robust summary of a heat map grid used to choose a display range.
 *
 * @param median         median cell value
 * @param mad            median absolute deviation from the median
 * @param stddev         population standard deviation of the cell values
 * @param multiplier     factor applied to the median
 * @param displayBound   {@code multiplier * median}; 0 when the grid carries no signal
 * @param maskedFraction percentage of cells above {@code displayBound}
 */
public record GridStatistics(
        double median,
        double mad,
        double stddev,
        double multiplier,
        double displayBound,
        double maskedFraction
) {

    /**
     * False for empty or degenerate grids whose median is zero. The display range is undefined
     * in that case and must not be used as a divisor.
     */
    public boolean hasSignal() {
        return displayBound > 0;
    }
}
