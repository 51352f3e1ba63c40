package nl.bytesoflife.detectormap.coords;

public record NormalizedRecord(double x, double y, double weight, Double mjd, String exposure, String filter) {
}
