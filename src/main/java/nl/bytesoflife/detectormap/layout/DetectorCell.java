package nl.bytesoflife.detectormap.layout;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * One detector square in the drawing plane. Rows count groups from the bottom; {@code ix} and
 * {@code iy} place the square inside its group.
 */
public record DetectorCell(int id, int group, int row, int ix, int iy, double x, double y, double size) {

    public Coordinate center() {
        return new Coordinate(x, y);
    }

    public Envelope bounds() {
        double half = size / 2;
        return new Envelope(x - half, x + half, y - half, y + half);
    }
}
