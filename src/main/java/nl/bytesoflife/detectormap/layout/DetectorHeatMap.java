package nl.bytesoflife.detectormap.layout;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-detector values placed on a {@link DetectorLayout}: one entry for every detector, with
 * the value left empty where none was supplied.
 */
public class DetectorHeatMap {

    private static final Logger log = LoggerFactory.getLogger(DetectorHeatMap.class);

    private final DetectorLayout layout;
    private final Map<Integer, Double> values;
    private final List<Entry> entries;
    private final ValueRange range;

    private DetectorHeatMap(DetectorLayout layout, Map<Integer, Double> values, ValueRange range) {
        this.layout = layout;
        this.values = values;
        this.range = range;

        List<Entry> list = new ArrayList<>(layout.size());
        for (DetectorCell cell : layout.getCells()) {
            list.add(new Entry(cell.id(), cell.center(), values.get(cell.id())));
        }
        this.entries = Collections.unmodifiableList(list);
    }

    /**
     * Values for identifiers outside the layout are dropped with a warning. The colour range
     * spans the supplied values.
     */
    public static DetectorHeatMap of(DetectorLayout layout, Map<Integer, Double> values) {
        Map<Integer, Double> known = new TreeMap<>();
        int ignored = 0;
        for (Map.Entry<Integer, Double> e : values.entrySet()) {
            int id = e.getKey();
            if (id < 0 || id >= layout.size() || e.getValue() == null) {
                ignored++;
                continue;
            }
            known.put(id, e.getValue());
        }
        if (ignored > 0) {
            log.warn("Ignored {} entries without a value or outside [0, {})", ignored, layout.size());
        }
        return new DetectorHeatMap(layout, Collections.unmodifiableMap(known), ValueRange.of(known.values()));
    }

    /**
     * Same values with a caller-chosen colour range.
     */
    public DetectorHeatMap withRange(ValueRange range) {
        return new DetectorHeatMap(layout, values, range);
    }

    public DetectorLayout getLayout() {
        return layout;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public ValueRange getRange() {
        return range;
    }

    public int getPresentCount() {
        return values.size();
    }

    public int getMissingCount() {
        return layout.size() - values.size();
    }

    /**
     * @param value detector value, or null when the detector reported nothing
     */
    public record Entry(int id, Coordinate center, Double value) {

        public boolean hasValue() {
            return value != null;
        }
    }
}
