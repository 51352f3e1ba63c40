package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.ConfigurationException;
import nl.bytesoflife.detectormap.coords.CoordinateNormalizer;
import nl.bytesoflife.detectormap.coords.FilterBand;
import nl.bytesoflife.detectormap.coords.MjdWindow;
import nl.bytesoflife.detectormap.coords.NormalizedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates samples into a fixed-resolution {@link HeatMapGrid}.
 * <p>
 * Accumulation is a plain sum per cell, so the result does not depend on sample order and
 * grids built from separate inputs can be merged afterwards.
 */
public class HeatMapBinner {

    private static final Logger log = LoggerFactory.getLogger(HeatMapBinner.class);

    private RecordErrorPolicy errorPolicy = RecordErrorPolicy.SKIP;
    private MjdWindow timeWindow = MjdWindow.UNBOUNDED;

    public HeatMapBinner withErrorPolicy(RecordErrorPolicy policy) {
        this.errorPolicy = policy;
        return this;
    }

    /**
     * Only records whose time falls inside the window are binned. Records without a time field
     * are never filtered.
     */
    public HeatMapBinner withTimeWindow(MjdWindow window) {
        this.timeWindow = window;
        return this;
    }

    public BinningResult bin(Iterable<Sample> samples, int resolution, SpaceBounds bounds) {
        HeatMapGrid grid = new HeatMapGrid(resolution);
        int accepted = 0;
        int outOfFrame = 0;

        for (Sample sample : samples) {
            if (accumulate(grid, bounds, sample.x(), sample.y(), sample.weight())) {
                accepted++;
            } else {
                outOfFrame++;
            }
        }

        log.debug("Binned {} samples into {}x{} grid, {} out of frame", accepted, resolution, resolution, outOfFrame);
        return new BinningResult(grid, accepted, outOfFrame, 0, 0, Set.of());
    }

    /**
     * Normalizes and bins field-keyed records. Unparseable records are skipped or abort the
     * batch depending on the configured {@link RecordErrorPolicy}.
     *
     * @throws CoordinateNormalizer.ParseException under {@link RecordErrorPolicy#FAIL}
     */
    public BinningResult binRecords(Iterable<Map<String, String>> records, CoordinateNormalizer normalizer,
                                    int resolution, SpaceBounds bounds) {
        Accumulator accumulator = new Accumulator(resolution, bounds);
        int skipped = 0;
        int index = 0;

        for (Map<String, String> record : records) {
            index++;
            NormalizedRecord normalized = normalize(normalizer, record, index);
            if (normalized == null) {
                skipped++;
                continue;
            }
            accumulator.offer(normalized, timeWindow);
        }

        if (skipped > 0) {
            log.warn("Skipped {} of {} records with unparseable fields", skipped, index);
        }
        log.info("Binned {} records into {}x{} grid: {} accepted, {} out of frame, {} outside time window",
                index, resolution, resolution, accumulator.accepted, accumulator.outOfFrame,
                accumulator.outOfWindow);
        return accumulator.toResult(skipped);
    }

    /**
     * Like {@link #binRecords} but with one grid per {@link FilterBand}, chosen by the first
     * letter of the filter column. Records whose filter matches no band are dropped. Bands
     * that no record names are absent from the result.
     *
     * @throws ConfigurationException if the normalizer has no filter column configured
     */
    public Map<FilterBand, BinningResult> binRecordsByFilter(Iterable<Map<String, String>> records,
                                                             CoordinateNormalizer normalizer,
                                                             int resolution, SpaceBounds bounds) {
        if (normalizer.getFields().filterKey() == null) {
            throw new ConfigurationException("Splitting by filter needs a filter column");
        }
        Resolution.requireSupported(resolution);

        Map<FilterBand, Accumulator> byBand = new EnumMap<>(FilterBand.class);
        int skipped = 0;
        int unknownBand = 0;
        int index = 0;

        for (Map<String, String> record : records) {
            index++;
            NormalizedRecord normalized = normalize(normalizer, record, index);
            if (normalized == null) {
                skipped++;
                continue;
            }
            Optional<FilterBand> band = FilterBand.fromFilterName(normalized.filter());
            if (band.isEmpty()) {
                log.debug("Record {} has filter '{}' outside the known bands", index, normalized.filter());
                unknownBand++;
                continue;
            }
            byBand.computeIfAbsent(band.get(), b -> new Accumulator(resolution, bounds))
                    .offer(normalized, timeWindow);
        }

        if (skipped > 0) {
            log.warn("Skipped {} of {} records with unparseable fields", skipped, index);
        }
        log.info("Binned {} records into {} filter bands, {} with an unknown filter", index, byBand.size(), unknownBand);

        Map<FilterBand, BinningResult> results = new EnumMap<>(FilterBand.class);
        byBand.forEach((band, accumulator) -> results.put(band, accumulator.toResult(0)));
        return results;
    }

    private NormalizedRecord normalize(CoordinateNormalizer normalizer, Map<String, String> record, int index) {
        try {
            return normalizer.normalize(record);
        } catch (CoordinateNormalizer.ParseException e) {
            if (errorPolicy == RecordErrorPolicy.FAIL) {
                throw e;
            }
            log.debug("Skipping record {}: {}", index, e.getMessage());
            return null;
        }
    }

    /**
     * Bins independent batches (for example one per input file) in parallel and sums the
     * resulting grids.
     */
    public BinningResult binAll(List<? extends Collection<Sample>> batches, int resolution, SpaceBounds bounds) {
        Resolution.requireSupported(resolution);
        BinningResult empty = new BinningResult(new HeatMapGrid(resolution), 0, 0, 0, 0, Set.of());
        return batches.parallelStream()
                .map(batch -> bin(batch, resolution, bounds))
                .reduce(empty, BinningResult::merge);
    }

    private static final class Accumulator {
        private final HeatMapGrid grid;
        private final SpaceBounds bounds;
        private final Set<String> exposures = new HashSet<>();
        private int accepted;
        private int outOfFrame;
        private int outOfWindow;

        Accumulator(int resolution, SpaceBounds bounds) {
            this.grid = new HeatMapGrid(resolution);
            this.bounds = bounds;
        }

        void offer(NormalizedRecord record, MjdWindow window) {
            if (record.mjd() != null && !window.contains(record.mjd())) {
                outOfWindow++;
                return;
            }
            if (accumulate(grid, bounds, record.x(), record.y(), record.weight())) {
                accepted++;
                if (record.exposure() != null) {
                    exposures.add(record.exposure());
                }
            } else {
                outOfFrame++;
            }
        }

        BinningResult toResult(int skipped) {
            return new BinningResult(grid, accepted, outOfFrame, skipped, outOfWindow, exposures);
        }
    }

    private static boolean accumulate(HeatMapGrid grid, SpaceBounds bounds, double x, double y, double weight) {
        int resolution = grid.getResolution();
        int col = bounds.columnOf(x, resolution);
        int row = bounds.rowOf(y, resolution);
        if (col < 0 || row < 0) {
            return false;
        }
        grid.add(row, col, weight);
        return true;
    }
}
