package nl.bytesoflife.detectormap.coords;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Julian Date helpers. MJD is used as the time axis throughout.
 */
public final class JulianDates {

    /** Offset between a Julian Date and a Modified Julian Date. */
    public static final double MJD_OFFSET = 2400000.5;

    /** MJD of the Unix epoch, 1970-01-01T00:00Z. */
    static final double UNIX_EPOCH_MJD = 40587.0;

    private static final double SECONDS_PER_DAY = 86400.0;

    // 2015-06-01, 2015-06-01 12:30:00, 2015-06-01T12:30:00.250
    private static final DateTimeFormatter CALENDAR_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .toFormatter();

    private JulianDates() {
    }

    /**
     * Values above {@link #MJD_OFFSET} are taken to be full Julian Dates and shifted to MJD.
     * This is a magnitude heuristic; no format flag is consulted.
     */
    public static double toMjd(double value) {
        if (value > MJD_OFFSET) {
            return value - MJD_OFFSET;
        }
        return value;
    }

    /**
     * Converts a calendar date or SQL-style timestamp, taken as UTC, to MJD.
     *
     * @throws DateTimeParseException if the text is not a calendar date
     */
    public static double mjdFromCalendarDate(String text) {
        TemporalAccessor parsed = CALENDAR_FORMAT.parseBest(text.trim(), LocalDateTime::from, LocalDate::from);
        if (parsed instanceof LocalDateTime dateTime) {
            return mjdFromDateTime(dateTime);
        }
        return mjdFromDateTime(((LocalDate) parsed).atStartOfDay());
    }

    public static double mjdFromDateTime(LocalDateTime dateTime) {
        double epochSeconds = dateTime.toEpochSecond(ZoneOffset.UTC) + dateTime.getNano() / 1e9;
        return UNIX_EPOCH_MJD + epochSeconds / SECONDS_PER_DAY;
    }
}
