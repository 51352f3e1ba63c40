package nl.bytesoflife.detectormap.profile;

import nl.bytesoflife.detectormap.ConfigurationException;
import nl.bytesoflife.detectormap.coords.CoordinateSpace;
import nl.bytesoflife.detectormap.coords.RecordFields;
import nl.bytesoflife.detectormap.heatmap.SpaceBounds;
import nl.bytesoflife.detectormap.layout.LayoutGeometry;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Reads heat map profiles and layout geometries from {@code .properties} files.
 */
public class ProfileParser {

    public HeatMapProfile parseHeatMapProfile(InputStream in) throws IOException {
        return parseHeatMapProfile(load(in));
    }

    public LayoutGeometry parseLayoutGeometry(InputStream in) throws IOException {
        return parseLayoutGeometry(load(in));
    }

    public HeatMapProfile parseHeatMapProfile(Properties props) {
        RecordFields fields = new RecordFields(
                require(props, "fields.x"),
                require(props, "fields.y"),
                props.getProperty("fields.time"),
                props.getProperty("fields.weight"),
                props.getProperty("fields.exposure"),
                props.getProperty("fields.filter"));

        CoordinateSpace space;
        try {
            space = CoordinateSpace.fromName(props.getProperty("space", "pixel"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        return new HeatMapProfile(
                require(props, "name"),
                fields,
                space,
                new SpaceBounds(parseDouble(props, "bounds.min"), parseDouble(props, "bounds.max")),
                parseInt(props, "resolution"),
                parseDouble(props, "multiplier"));
    }

    public LayoutGeometry parseLayoutGeometry(Properties props) {
        return new LayoutGeometry(
                parseDouble(props, "square.size"),
                parseDouble(props, "gap.intra"),
                parseDouble(props, "gap.inter.x"),
                parseDouble(props, "gap.inter.y"),
                parseIntList(props, "rows"),
                parseInt(props, "detectors"));
    }

    private static Properties load(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        return props;
    }

    private static String require(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing property '" + key + "'");
        }
        return value.trim();
    }

    private static double parseDouble(Properties props, String key) {
        String value = require(props, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property '" + key + "' is not a number: " + value, e);
        }
    }

    private static int parseInt(Properties props, String key) {
        String value = require(props, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property '" + key + "' is not an integer: " + value, e);
        }
    }

    private static List<Integer> parseIntList(Properties props, String key) {
        String value = require(props, key);
        List<Integer> list = new ArrayList<>();
        for (String part : value.split(",")) {
            try {
                list.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Property '" + key + "' is not a list of integers: " + value, e);
            }
        }
        return list;
    }
}
