package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.coords.CoordinateNormalizer;
import nl.bytesoflife.detectormap.coords.FilterBand;
import nl.bytesoflife.detectormap.heatmap.stats.GridStatistics;
import nl.bytesoflife.detectormap.heatmap.stats.GridStatisticsCalculator;
import nl.bytesoflife.detectormap.profile.HeatMapProfile;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records in, grid and statistics out, configured by a {@link HeatMapProfile}.
 */
public class HeatMapPipeline {

    private final HeatMapProfile profile;
    private final CoordinateNormalizer normalizer;
    private final HeatMapBinner binner;
    private final GridStatisticsCalculator statisticsCalculator = new GridStatisticsCalculator();

    public HeatMapPipeline(HeatMapProfile profile) {
        this(profile, new HeatMapBinner());
    }

    public HeatMapPipeline(HeatMapProfile profile, HeatMapBinner binner) {
        this.profile = profile;
        this.normalizer = new CoordinateNormalizer(profile.fields(), profile.space());
        this.binner = binner;
    }

    public HeatMapProfile getProfile() {
        return profile;
    }

    public HeatMap run(Iterable<Map<String, String>> records) {
        BinningResult result = binner.binRecords(records, normalizer, profile.resolution(), profile.bounds());
        return withStatistics(result);
    }

    /**
     * One heat map per filter band. The profile must name a filter column.
     */
    public Map<FilterBand, HeatMap> runByFilter(Iterable<Map<String, String>> records) {
        Map<FilterBand, HeatMap> heatMaps = new EnumMap<>(FilterBand.class);
        binner.binRecordsByFilter(records, normalizer, profile.resolution(), profile.bounds())
                .forEach((band, result) -> heatMaps.put(band, withStatistics(result)));
        return heatMaps;
    }

    public HeatMap runSamples(Iterable<Sample> samples) {
        return withStatistics(binner.bin(samples, profile.resolution(), profile.bounds()));
    }

    /**
     * Uses a pre-built grid given as one value per cell. The resolution follows from the
     * number of values, not from the profile.
     */
    public HeatMap runCells(List<? extends Number> cellValues) {
        HeatMapGrid grid = HeatMapGrid.fromCells(cellValues);
        int cells = grid.getCellCount();
        return withStatistics(new BinningResult(grid, cells, 0, 0, 0, Set.of()));
    }

    private HeatMap withStatistics(BinningResult result) {
        GridStatistics statistics = statisticsCalculator.compute(result.grid(), profile.multiplier());
        return new HeatMap(result, statistics);
    }
}
