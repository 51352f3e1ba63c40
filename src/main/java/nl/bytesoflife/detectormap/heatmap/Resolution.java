package nl.bytesoflife.detectormap.heatmap;

import nl.bytesoflife.detectormap.ConfigurationException;

import java.util.Set;
import java.util.TreeSet;

/**
 * Grid side lengths a heat map may be built with.
 */
public final class Resolution {

    public static final Set<Integer> SUPPORTED = Set.of(8, 16, 32, 64, 128, 256, 512);

    public static final int DEFAULT = 128;

    private Resolution() {
    }

    public static boolean isSupported(int resolution) {
        return SUPPORTED.contains(resolution);
    }

    public static int requireSupported(int resolution) {
        if (!isSupported(resolution)) {
            throw new ConfigurationException("Unsupported heat map resolution " + resolution
                    + ", expected one of " + new TreeSet<>(SUPPORTED));
        }
        return resolution;
    }
}
