package nl.bytesoflife.detectormap.coords;

import java.util.Optional;

/**
 * Photometric bands that sky plots split observations by. A filter name belongs to the band
 * named by its first letter, so {@code "r"}, {@code "r.00000"} and {@code "rp"} are all
 * {@link #R}.
 */
public enum FilterBand {
    G('g'),
    R('r'),
    I('i'),
    Z('z'),
    Y('y'),
    W('w'),
    /** ATLAS cyan. */
    C('c'),
    /** ATLAS orange. */
    O('o');

    private final char letter;

    FilterBand(char letter) {
        this.letter = letter;
    }

    public char getLetter() {
        return letter;
    }

    /**
     * Band for a filter name, or empty when the name is blank or its first letter is not a
     * known band. Matching is case sensitive.
     */
    public static Optional<FilterBand> fromFilterName(String filter) {
        if (filter == null || filter.isEmpty()) {
            return Optional.empty();
        }
        char first = filter.charAt(0);
        for (FilterBand band : values()) {
            if (band.letter == first) {
                return Optional.of(band);
            }
        }
        return Optional.empty();
    }
}
