package nl.bytesoflife.detectormap.coords;

/**
 * Open time interval in Modified Julian Days. Both bounds are exclusive.
 */
public record MjdWindow(double min, double max) {

    public static final MjdWindow UNBOUNDED =
            new MjdWindow(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    public MjdWindow {
        if (Double.isNaN(min) || Double.isNaN(max) || min >= max) {
            throw new IllegalArgumentException("Invalid MJD window: " + min + " .. " + max);
        }
    }

    public boolean contains(double mjd) {
        return mjd > min && mjd < max;
    }
}
