package nl.bytesoflife.detectormap.table;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectorValuesTest {

    @Test
    void fromRecordsReadsDetectorAndCount() {
        List<Map<String, String>> rows = List.of(
                Map.of("detector", "10", "ndet", "1978"),
                Map.of("detector", " 11 ", "ndet", "1831.0"),
                Map.of("detector", "x", "ndet", "1"),
                Map.of("ndet", "5"));

        DetectorValues values = DetectorValues.fromRecords(rows);

        assertEquals(2, values.size());
        assertEquals(1831.0, values.get(11), 0.0);
        assertEquals(2, values.getSkippedCount());
    }

    @Test
    void fromRecordsWithCustomColumns() {
        DetectorValues values = DetectorValues.fromRecords(
                List.of(Map.of("ccd", "3", "hits", "12")), "ccd", "hits");
        assertEquals(12.0, values.get(3), 0.0);
    }

    @Test
    void denseSeriesPadsAndFillsGaps() {
        DetectorValues values = new DetectorTableParser().parse("| 1 | 5 |\n| 3 | 7 |");

        double[] series = values.denseSeries();

        assertArrayEquals(new double[]{0, 5, 0, 7, 0, 0}, series, 0.0);
    }

    @Test
    void denseSeriesOfNothingIsEmpty() {
        assertEquals(0, new DetectorTableParser().parse("").denseSeries().length);
    }

    @Test
    void denseSeriesRejectsHugeIdentifiers() {
        DetectorValues values = new DetectorTableParser().parse("| 2147483647 | 5 |");
        assertThrows(IllegalArgumentException.class, () -> values.denseSeries());

        DetectorValues beyondLimit = new DetectorTableParser().parse("| 65534 | 5 |");
        assertThrows(IllegalArgumentException.class, () -> beyondLimit.denseSeries());
    }

    @Test
    void denseSeriesAtLimitIsAllocated() {
        DetectorValues values = new DetectorTableParser().parse("| 65533 | 5 |");
        double[] series = values.denseSeries();
        assertEquals(DetectorValues.MAX_SERIES_LENGTH, series.length);
        assertEquals(5.0, series[65533], 0.0);
    }

    @Test
    void negativePaddingIsRejected() {
        DetectorValues values = new DetectorTableParser().parse("| 1 | 5 |");
        assertThrows(IllegalArgumentException.class, () -> values.denseSeries(-1));
    }

    @Test
    void mapIsOrderedByIdentifier() {
        DetectorValues values = new DetectorTableParser().parse("| 9 | 1 |\n| 2 | 1 |\n| 5 | 1 |");
        assertEquals(List.of(2, 5, 9), List.copyOf(values.asMap().keySet()));
    }
}
