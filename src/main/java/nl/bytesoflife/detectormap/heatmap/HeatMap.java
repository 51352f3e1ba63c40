package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.heatmap.stats.GridStatistics;

public record HeatMap(BinningResult binning, GridStatistics statistics) {

    public HeatMapGrid grid() {
        return binning.grid();
    }

    /**
     * Grid with cells above the display bound zeroed. Returns the grid unchanged when there is
     * no signal to bound by.
     */
    public HeatMapGrid maskedGrid() {
        if (!statistics.hasSignal()) {
            return binning.grid();
        }
        return binning.grid().masked(statistics.displayBound());
    }
}
