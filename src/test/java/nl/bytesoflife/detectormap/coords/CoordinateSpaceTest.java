package nl.bytesoflife.detectormap.coords;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateSpaceTest {

    @Test
    void namesAreCaseInsensitive() {
        assertEquals(CoordinateSpace.SKY, CoordinateSpace.fromName(" Sky "));
        assertEquals(CoordinateSpace.NORMALIZED, CoordinateSpace.fromName("normalised"));
    }

    @Test
    void upperCaseNamesResolveUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(CoordinateSpace.PIXEL, CoordinateSpace.fromName("PIXEL"));
            assertEquals(CoordinateSpace.NORMALIZED, CoordinateSpace.fromName("NORMALIZED"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void unknownNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CoordinateSpace.fromName("galactic"));
    }
}
