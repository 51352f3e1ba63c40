package nl.bytesoflife.detectormap.coords;

/**
 * Column names used to pull coordinates out of a field-keyed record.
 *
 * @param xKey        column holding x (or right ascension)
 * @param yKey        column holding y (or declination)
 * @param timeKey     column holding an MJD, JD or calendar date; null when records are untimed
 * @param weightKey   column holding a per-sample weight; null for unit weights
 * @param exposureKey column naming the exposure a record came from; null when not tracked
 * @param filterKey   column naming the photometric filter; null when not tracked
 */
public record RecordFields(
        String xKey,
        String yKey,
        String timeKey,
        String weightKey,
        String exposureKey,
        String filterKey
) {

    public RecordFields {
        if (xKey == null || xKey.isBlank() || yKey == null || yKey.isBlank()) {
            throw new IllegalArgumentException("x and y keys must not be blank");
        }
    }

    public static RecordFields of(String xKey, String yKey) {
        return new RecordFields(xKey, yKey, null, null, null, null);
    }

    public static RecordFields pixels() {
        return of("x", "y");
    }

    public static RecordFields sky() {
        return new RecordFields("ra", "dec", "mjd", null, null, null);
    }

    public RecordFields withTime(String key) {
        return new RecordFields(xKey, yKey, key, weightKey, exposureKey, filterKey);
    }

    public RecordFields withWeight(String key) {
        return new RecordFields(xKey, yKey, timeKey, key, exposureKey, filterKey);
    }

    public RecordFields withExposure(String key) {
        return new RecordFields(xKey, yKey, timeKey, weightKey, key, filterKey);
    }

    public RecordFields withFilter(String key) {
        return new RecordFields(xKey, yKey, timeKey, weightKey, exposureKey, key);
    }
}
