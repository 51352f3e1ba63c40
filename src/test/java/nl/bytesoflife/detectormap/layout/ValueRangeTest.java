package nl.bytesoflife.detectormap.layout;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueRangeTest {

    @Test
    void normalizeClipsToUnitInterval() {
        ValueRange range = new ValueRange(10, 20);
        assertEquals(0.0, range.normalize(5), 0.0);
        assertEquals(0.5, range.normalize(15), 1e-12);
        assertEquals(1.0, range.normalize(25), 0.0);
    }

    @Test
    void zeroWidthRangeMapsToZero() {
        assertEquals(0.0, ValueRange.of(List.of(7.0, 7.0)).normalize(7), 0.0);
    }

    @Test
    void invertedRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ValueRange(2, 1));
    }
}
