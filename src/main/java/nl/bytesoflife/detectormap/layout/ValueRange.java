package nl.bytesoflife.detectormap.layout;

import java.util.Collection;

/**
 * Colour normalisation range for detector values.
 */
public record ValueRange(double min, double max) {

    public static final ValueRange UNIT = new ValueRange(0.0, 1.0);

    public ValueRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Invalid value range: " + min + " .. " + max);
        }
    }

    /**
     * Smallest and largest of the values, or {@link #UNIT} when there are none.
     */
    public static ValueRange of(Collection<Double> values) {
        if (values.isEmpty()) {
            return UNIT;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new ValueRange(min, max);
    }

    /**
     * Position of {@code value} in the range, clipped to [0, 1]. A zero-width range maps
     * everything to 0.
     */
    public double normalize(double value) {
        if (max == min) {
            return 0.0;
        }
        double t = (value - min) / (max - min);
        return Math.max(0.0, Math.min(1.0, t));
    }
}
