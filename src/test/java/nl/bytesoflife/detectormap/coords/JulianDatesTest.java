package nl.bytesoflife.detectormap.coords;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class JulianDatesTest {

    @Test
    void unixEpochIsMjd40587() {
        assertEquals(40587.0, JulianDates.mjdFromDateTime(LocalDateTime.of(1970, 1, 1, 0, 0)), 1e-12);
    }

    @Test
    void j2000Epoch() {
        // 2000-01-01T12:00 is JD 2451545.0
        double mjd = JulianDates.mjdFromCalendarDate("2000-01-01 12:00:00");
        assertEquals(2451545.0 - JulianDates.MJD_OFFSET, mjd, 1e-9);
    }

    @Test
    void fractionalSeconds() {
        double mjd = JulianDates.mjdFromCalendarDate("1970-01-02 00:00:00.500");
        assertEquals(40588.0 + 0.5 / 86400.0, mjd, 1e-9);
    }

    @Test
    void toMjdOnlyShiftsLargeValues() {
        assertEquals(59000.0, JulianDates.toMjd(59000.0), 1e-12);
        assertEquals(59000.0, JulianDates.toMjd(2459000.5), 1e-12);
    }
}
