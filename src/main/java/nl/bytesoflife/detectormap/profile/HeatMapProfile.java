package nl.bytesoflife.detectormap.profile;

import nl.bytesoflife.detectormap.ConfigurationException;
import nl.bytesoflife.detectormap.coords.CoordinateSpace;
import nl.bytesoflife.detectormap.coords.RecordFields;
import nl.bytesoflife.detectormap.heatmap.Resolution;
import nl.bytesoflife.detectormap.heatmap.SpaceBounds;

/**
 * Everything needed to turn a stream of records into a heat map.
 *
 * @param name       display name
 * @param fields     record columns to read
 * @param space      how the coordinate columns are interpreted
 * @param bounds     extent of the binning space
 * @param resolution grid side length
 * @param multiplier factor applied to the grid median for the display bound
 */
public record HeatMapProfile(
        String name,
        RecordFields fields,
        CoordinateSpace space,
        SpaceBounds bounds,
        int resolution,
        double multiplier
) {

    public HeatMapProfile {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Profile name must not be blank");
        }
        if (fields == null || space == null || bounds == null) {
            throw new ConfigurationException("Profile " + name + " is missing fields, space or bounds");
        }
        Resolution.requireSupported(resolution);
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new ConfigurationException("Median multiplier must be positive and finite: " + multiplier);
        }
    }

    public HeatMapProfile withResolution(int resolution) {
        return new HeatMapProfile(name, fields, space, bounds, resolution, multiplier);
    }

    public HeatMapProfile withMultiplier(double multiplier) {
        return new HeatMapProfile(name, fields, space, bounds, resolution, multiplier);
    }

    public HeatMapProfile withFields(RecordFields fields) {
        return new HeatMapProfile(name, fields, space, bounds, resolution, multiplier);
    }
}
