package nl.bytesoflife.detectormap.layout;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds detectors by drawing position, for hit testing in viewers.
 */
public class DetectorLocator {

    private final STRtree tree = new STRtree();

    public DetectorLocator(DetectorLayout layout) {
        for (DetectorCell cell : layout.getCells()) {
            tree.insert(cell.bounds(), cell);
        }
        tree.build();
    }

    /**
     * The detector whose square contains the point. Points on a shared edge resolve to the
     * lower identifier.
     */
    public Optional<DetectorCell> locate(double x, double y) {
        return query(new Envelope(x, x, y, y)).stream()
                .filter(cell -> cell.bounds().contains(x, y))
                .min(Comparator.comparingInt(DetectorCell::id));
    }

    /**
     * Detectors whose squares intersect the given area, in identifier order.
     */
    public List<DetectorCell> within(Envelope area) {
        List<DetectorCell> hits = new ArrayList<>();
        for (DetectorCell cell : query(area)) {
            if (cell.bounds().intersects(area)) {
                hits.add(cell);
            }
        }
        hits.sort(Comparator.comparingInt(DetectorCell::id));
        return hits;
    }

    @SuppressWarnings("unchecked")
    private List<DetectorCell> query(Envelope area) {
        return (List<DetectorCell>) tree.query(area);
    }
}
