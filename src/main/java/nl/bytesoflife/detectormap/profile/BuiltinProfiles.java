package nl.bytesoflife.detectormap.profile;

import nl.bytesoflife.detectormap.layout.LayoutGeometry;

import java.io.IOException;
import java.io.InputStream;

/**
 * Heat map profiles and layouts bundled as classpath resources.
 */
public class BuiltinProfiles {

    private static volatile HeatMapProfile cachedAtlasChip;
    private static volatile LayoutGeometry cachedLsstFocalPlane;

    /**
     * ATLAS detector chip: pixel coordinates over 10559 pixels, 128x128 grid, 1.5x median.
     */
    public static HeatMapProfile atlasChip() {
        if (cachedAtlasChip == null) {
            synchronized (BuiltinProfiles.class) {
                if (cachedAtlasChip == null) {
                    cachedAtlasChip = loadAtlasChip();
                }
            }
        }
        return cachedAtlasChip;
    }

    /**
     * LSST camera focal plane: 189 detectors in 21 groups over rows of 3, 5, 5, 5 and 3.
     */
    public static LayoutGeometry lsstFocalPlane() {
        if (cachedLsstFocalPlane == null) {
            synchronized (BuiltinProfiles.class) {
                if (cachedLsstFocalPlane == null) {
                    cachedLsstFocalPlane = loadLsstFocalPlane();
                }
            }
        }
        return cachedLsstFocalPlane;
    }

    private static HeatMapProfile loadAtlasChip() {
        try (InputStream is = open("/profiles/atlas-chip.properties")) {
            return new ProfileParser().parseHeatMapProfile(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load ATLAS chip profile", e);
        }
    }

    private static LayoutGeometry loadLsstFocalPlane() {
        try (InputStream is = open("/profiles/lsst-focal-plane.properties")) {
            return new ProfileParser().parseLayoutGeometry(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load LSST focal plane layout", e);
        }
    }

    private static InputStream open(String resource) {
        InputStream is = BuiltinProfiles.class.getResourceAsStream(resource);
        if (is == null) throw new IllegalStateException("Resource not found: " + resource);
        return is;
    }
}
