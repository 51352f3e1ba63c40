package nl.bytesoflife.detectormap.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Detector identifier to value mapping, ordered by identifier.
 */
public class DetectorValues {

    private static final Logger log = LoggerFactory.getLogger(DetectorValues.class);

    public static final String DEFAULT_ID_KEY = "detector";
    public static final String DEFAULT_VALUE_KEY = "ndet";

    /** Longest series {@link #denseSeries(int)} will allocate. */
    public static final int MAX_SERIES_LENGTH = 1 << 16;

    private final TreeMap<Integer, Double> sorted;
    private final Map<Integer, Double> values;
    private final int skipped;

    DetectorValues(Map<Integer, Double> values, int skipped) {
        this.sorted = new TreeMap<>(values);
        this.values = Collections.unmodifiableMap(sorted);
        this.skipped = skipped;
    }

    public static DetectorValues fromRecords(Iterable<Map<String, String>> records) {
        return fromRecords(records, DEFAULT_ID_KEY, DEFAULT_VALUE_KEY);
    }

    /**
     * Reads one value per record. Records whose identifier is not an integer or whose value is
     * not a number are skipped and counted.
     */
    public static DetectorValues fromRecords(Iterable<Map<String, String>> records, String idKey, String valueKey) {
        Map<Integer, Double> values = new TreeMap<>();
        int skipped = 0;
        for (Map<String, String> record : records) {
            String id = record.get(idKey);
            String value = record.get(valueKey);
            if (id == null || value == null) {
                log.debug("Skipping record without {}/{}: {}", idKey, valueKey, record);
                skipped++;
                continue;
            }
            try {
                values.put(Integer.parseInt(id.trim()), Double.parseDouble(value.trim()));
            } catch (NumberFormatException e) {
                log.debug("Skipping record with unparseable {}/{}: {}", idKey, valueKey, record);
                skipped++;
            }
        }
        return new DetectorValues(values, skipped);
    }

    public Map<Integer, Double> asMap() {
        return values;
    }

    public Double get(int id) {
        return values.get(id);
    }

    public boolean contains(int id) {
        return values.containsKey(id);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int getSkippedCount() {
        return skipped;
    }

    /**
     * Values for identifiers {@code 0 .. maxId + padding}, zero where no value was given.
     *
     * @throws IllegalArgumentException if padding is negative or the series would be longer
     *                                  than {@link #MAX_SERIES_LENGTH}
     */
    public double[] denseSeries(int padding) {
        if (padding < 0) {
            throw new IllegalArgumentException("Padding must not be negative: " + padding);
        }
        if (values.isEmpty()) {
            return new double[0];
        }
        int maxId = sorted.lastKey();
        long length = Math.max(0L, (long) maxId + 1 + padding);
        if (length > MAX_SERIES_LENGTH) {
            throw new IllegalArgumentException("Detector " + maxId + " is too large for a dense series of at most "
                    + MAX_SERIES_LENGTH + " entries");
        }
        double[] series = new double[(int) length];
        for (Map.Entry<Integer, Double> e : values.entrySet()) {
            if (e.getKey() >= 0 && e.getKey() < series.length) {
                series[e.getKey()] = e.getValue();
            }
        }
        return series;
    }

    /**
     * Dense series with two trailing empty slots, the shape used for per-detector bar charts.
     */
    public double[] denseSeries() {
        return denseSeries(2);
    }

    @Override
    public String toString() {
        return "DetectorValues[" + values.size() + " detectors, " + skipped + " skipped]";
    }
}
