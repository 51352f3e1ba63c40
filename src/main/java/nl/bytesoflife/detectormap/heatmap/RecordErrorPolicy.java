package nl.bytesoflife.detectormap.heatmap;

/**
 * What to do with a record whose fields cannot be parsed.
 */
public enum RecordErrorPolicy {
    SKIP,
    FAIL
}
