package nl.bytesoflife.detectormap.heatmap;

import java.util.HashSet;
import java.util.Set;

/**
 * Outcome of a binning pass. {@code outOfFrame} counts samples that fell outside the grid,
 * {@code skipped} records whose fields did not parse.
 */
public record BinningResult(
        HeatMapGrid grid,
        int accepted,
        int outOfFrame,
        int skipped,
        int outOfWindow,
        Set<String> exposures
) {

    public BinningResult {
        exposures = Set.copyOf(exposures);
    }

    /**
     * Number of distinct exposures, used as "nobs" in heat map titles.
     */
    public int exposureCount() {
        return exposures.size();
    }

    public BinningResult merge(BinningResult other) {
        Set<String> allExposures = new HashSet<>(exposures);
        allExposures.addAll(other.exposures);
        return new BinningResult(grid.merge(other.grid),
                accepted + other.accepted,
                outOfFrame + other.outOfFrame,
                skipped + other.skipped,
                outOfWindow + other.outOfWindow,
                allExposures);
    }
}
