package nl.bytesoflife.detectormap.coords;

import java.util.Locale;

public enum CoordinateSpace {
    /** Detector pixel coordinates, y increasing downward in the rendered image. */
    PIXEL,
    /** Right ascension and declination in degrees, projected to plotting radians. */
    SKY,
    NORMALIZED;

    public static CoordinateSpace fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "pixel" -> PIXEL;
            case "sky" -> SKY;
            case "normalized", "normalised" -> NORMALIZED;
            default -> throw new IllegalArgumentException("Unknown coordinate space: " + name);
        };
    }
}
