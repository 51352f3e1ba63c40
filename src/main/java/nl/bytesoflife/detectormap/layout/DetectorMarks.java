package nl.bytesoflife.detectormap.layout;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named sets of detectors to highlight on a focal plane map, for example
 * {@code problem} and {@code missing}. A detector carries at most one mark; when it appears in
 * several sets the set marked last wins.
 */
public class DetectorMarks {

    private static final Logger log = LoggerFactory.getLogger(DetectorMarks.class);

    private final Map<String, List<Integer>> sets = new LinkedHashMap<>();
    private final Map<Integer, String> markByDetector = new TreeMap<>();

    public DetectorMarks mark(String category, Collection<Integer> detectorIds) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Mark category must not be blank");
        }
        List<Integer> ids = sets.computeIfAbsent(category, c -> new ArrayList<>());
        for (Integer id : detectorIds) {
            if (id == null) {
                throw new IllegalArgumentException("Null detector in mark set " + category);
            }
            ids.add(id);
            markByDetector.put(id, category);
        }
        return this;
    }

    public Optional<String> markOf(int detectorId) {
        return Optional.ofNullable(markByDetector.get(detectorId));
    }

    public List<String> getCategories() {
        return List.copyOf(sets.keySet());
    }

    public Map<Integer, String> asMap() {
        return Collections.unmodifiableMap(markByDetector);
    }

    public boolean isEmpty() {
        return markByDetector.isEmpty();
    }

    /**
     * Marked detectors of {@code layout} with their centers, in identifier order. Identifiers
     * the layout does not have are dropped with a warning.
     */
    public List<Placement> place(DetectorLayout layout) {
        List<Placement> placements = new ArrayList<>();
        int ignored = 0;
        for (Map.Entry<Integer, String> e : markByDetector.entrySet()) {
            int id = e.getKey();
            if (id < 0 || id >= layout.size()) {
                ignored++;
                continue;
            }
            placements.add(new Placement(id, layout.center(id), e.getValue()));
        }
        if (ignored > 0) {
            log.warn("Ignored {} marked detectors outside [0, {})", ignored, layout.size());
        }
        return placements;
    }

    public record Placement(int id, Coordinate center, String category) {
    }
}
