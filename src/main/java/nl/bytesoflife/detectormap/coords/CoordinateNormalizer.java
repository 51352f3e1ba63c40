package nl.bytesoflife.detectormap.coords;

import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Turns a field-keyed record into numeric coordinates.
 * <p>
 * Angles are parsed as plain numbers first and only fall back to sexagesimal notation when that
 * fails. Time fields likewise fall back from a number to a calendar date. Nothing is detected up
 * front.
 */
public class CoordinateNormalizer {

    private static final double DEG_TO_RAD = Math.PI / 180.0;

    private final RecordFields fields;
    private final CoordinateSpace space;

    public CoordinateNormalizer(RecordFields fields, CoordinateSpace space) {
        if (fields == null || space == null) {
            throw new IllegalArgumentException("fields and space are required");
        }
        this.fields = fields;
        this.space = space;
    }

    public RecordFields getFields() {
        return fields;
    }

    public CoordinateSpace getSpace() {
        return space;
    }

    /**
     * @throws ParseException if any configured field is missing or cannot be parsed
     */
    public NormalizedRecord normalize(Map<String, String> record) {
        double x;
        double y;
        if (space == CoordinateSpace.SKY) {
            double ra = parseAngle(fields.xKey(), require(record, fields.xKey()), true);
            double dec = parseAngle(fields.yKey(), require(record, fields.yKey()), false);
            x = toPlotLongitude(ra) * DEG_TO_RAD;
            y = dec * DEG_TO_RAD;
        } else {
            x = parseNumber(fields.xKey(), require(record, fields.xKey()));
            y = parseNumber(fields.yKey(), require(record, fields.yKey()));
        }

        Double mjd = null;
        if (fields.timeKey() != null) {
            mjd = parseTime(fields.timeKey(), require(record, fields.timeKey()));
        }

        double weight = 1.0;
        if (fields.weightKey() != null) {
            weight = parseNumber(fields.weightKey(), require(record, fields.weightKey()));
            if (weight < 0) {
                throw new ParseException(fields.weightKey(), String.valueOf(weight), "weight must not be negative");
            }
        }

        String exposure = fields.exposureKey() != null ? record.get(fields.exposureKey()) : null;
        String filter = fields.filterKey() != null ? require(record, fields.filterKey()) : null;
        return new NormalizedRecord(x, y, weight, mjd, exposure, filter);
    }

    /**
     * Decimal degrees, or sexagesimal when the text is not a plain number. Right ascension in
     * sexagesimal form is read as hours.
     */
    public static double parseAngle(String field, String text, boolean rightAscension) {
        try {
            return finite(field, text, Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            try {
                return rightAscension
                        ? Sexagesimal.rightAscensionToDegrees(text)
                        : Sexagesimal.declinationToDegrees(text);
            } catch (NumberFormatException sexagesimalFailure) {
                throw new ParseException(field, text, "not a decimal or sexagesimal angle", sexagesimalFailure);
            }
        }
    }

    /**
     * MJD from a number (Julian Dates are shifted down) or from a calendar date.
     */
    public static double parseTime(String field, String text) {
        try {
            return JulianDates.toMjd(finite(field, text, Double.parseDouble(text.trim())));
        } catch (NumberFormatException e) {
            try {
                return JulianDates.mjdFromCalendarDate(text);
            } catch (DateTimeParseException dateFailure) {
                throw new ParseException(field, text, "not an MJD, JD or calendar date", dateFailure);
            }
        }
    }

    /**
     * Longitude used by the all-sky plots: RA above 180 degrees maps to {@code 360 - ra},
     * everything else to {@code -ra}.
     */
    public static double toPlotLongitude(double raDegrees) {
        if (raDegrees > 180.0) {
            return 360.0 - raDegrees;
        }
        return -raDegrees;
    }

    private static double parseNumber(String field, String text) {
        try {
            return finite(field, text, Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            throw new ParseException(field, text, "not a number", e);
        }
    }

    private static double finite(String field, String text, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ParseException(field, text, "value is not finite");
        }
        return value;
    }

    private static String require(Map<String, String> record, String key) {
        String value = record.get(key);
        if (value == null) {
            throw new ParseException(key, null, "field is missing");
        }
        return value;
    }

    public static class ParseException extends RuntimeException {
        private final String field;
        private final String value;

        public ParseException(String field, String value, String message) {
            this(field, value, message, null);
        }

        public ParseException(String field, String value, String message, Throwable cause) {
            super(field + "='" + value + "': " + message, cause);
            this.field = field;
            this.value = value;
        }

        public String getField() {
            return field;
        }

        public String getValue() {
            return value;
        }
    }
}
