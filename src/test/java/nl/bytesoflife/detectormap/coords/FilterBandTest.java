package nl.bytesoflife.detectormap.coords;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FilterBandTest {

    @Test
    void bandFollowsFirstLetter() {
        assertEquals(Optional.of(FilterBand.R), FilterBand.fromFilterName("r"));
        assertEquals(Optional.of(FilterBand.R), FilterBand.fromFilterName("rp1"));
        assertEquals(Optional.of(FilterBand.W), FilterBand.fromFilterName("w.00000"));
        assertEquals(Optional.of(FilterBand.O), FilterBand.fromFilterName("o"));
    }

    @Test
    void unknownOrEmptyFiltersHaveNoBand() {
        assertTrue(FilterBand.fromFilterName("Halpha").isEmpty());
        assertTrue(FilterBand.fromFilterName("G").isEmpty());
        assertTrue(FilterBand.fromFilterName("").isEmpty());
        assertTrue(FilterBand.fromFilterName(null).isEmpty());
    }
}
