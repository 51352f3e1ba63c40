package nl.bytesoflife.detectormap.coords;

import java.util.regex.Pattern;

/**
 * Conversion of sexagesimal angles ({@code 12:34:56.7}, {@code -05 30 00}) to decimal degrees.
 */
public final class Sexagesimal {

    private static final Pattern SEPARATOR = Pattern.compile("[:\\s]+");

    private Sexagesimal() {
    }

    /**
     * Right ascension given in hours, minutes and seconds.
     */
    public static double rightAscensionToDegrees(String text) {
        return toDecimal(text) * 15.0;
    }

    /**
     * Declination (or any angle) given in degrees, arcminutes and arcseconds.
     */
    public static double declinationToDegrees(String text) {
        return toDecimal(text);
    }

    static double toDecimal(String text) {
        if (text == null) {
            throw new NumberFormatException("null sexagesimal value");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new NumberFormatException("empty sexagesimal value");
        }

        boolean negative = trimmed.startsWith("-");
        if (negative || trimmed.startsWith("+")) {
            trimmed = trimmed.substring(1).trim();
        }

        String[] parts = SEPARATOR.split(trimmed);
        if (parts.length < 2 || parts.length > 3) {
            throw new NumberFormatException("Not a sexagesimal value: " + text);
        }

        double whole = parseComponent(parts[0], text);
        double minutes = parseComponent(parts[1], text);
        double seconds = parts.length == 3 ? parseComponent(parts[2], text) : 0.0;
        if (minutes >= 60.0 || seconds >= 60.0) {
            throw new NumberFormatException("Minutes and seconds must be below 60: " + text);
        }

        double value = whole + minutes / 60.0 + seconds / 3600.0;
        return negative ? -value : value;
    }

    private static double parseComponent(String part, String original) {
        if (part.startsWith("-") || part.startsWith("+")) {
            throw new NumberFormatException("Sign only allowed on the leading component: " + original);
        }
        return Double.parseDouble(part);
    }
}
