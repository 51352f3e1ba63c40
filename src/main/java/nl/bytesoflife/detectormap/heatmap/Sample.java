package nl.bytesoflife.detectormap.heatmap;

/**
 * One observation to be binned. Coordinates outside the binning space are allowed and dropped
 * later; the weight must be finite and non-negative.
 */
public record Sample(double x, double y, double weight) {

    public Sample {
        if (!(weight >= 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Sample weight must be finite and non-negative: " + weight);
        }
    }

    public Sample(double x, double y) {
        this(x, y, 1.0);
    }
}
