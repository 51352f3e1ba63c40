package nl.bytesoflife.detectormap.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Best-effort parser for hand-edited two-column tables such as
 * <pre>
 * | detector | number |
 * |        2 |   2014 |
 * |        3 |   2114 |
 * </pre>
 * Only lines that start with the delimiter are looked at, and of those only lines whose first
 * two cells are unsigned integers produce an entry. Everything else, header rows included, is
 * skipped without an error. Skipped candidate lines are counted on the result so callers can
 * report them.
 */
public class DetectorTableParser {

    private static final Logger log = LoggerFactory.getLogger(DetectorTableParser.class);

    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("\\d+");

    private final char delimiter;
    private final Pattern splitter;

    public DetectorTableParser() {
        this('|');
    }

    public DetectorTableParser(char delimiter) {
        this.delimiter = delimiter;
        this.splitter = Pattern.compile(Pattern.quote(String.valueOf(delimiter)));
    }

    public DetectorValues parse(String text) {
        Map<Integer, Double> values = new LinkedHashMap<>();
        int skipped = 0;
        int lineNumber = 0;

        for (String raw : text.split("\\R")) {
            lineNumber++;
            String line = raw.trim();
            if (line.isEmpty() || line.charAt(0) != delimiter) {
                continue;
            }

            String[] tokens = splitter.split(stripDelimiters(line), -1);
            if (tokens.length < 2) {
                skipped++;
                continue;
            }
            String id = tokens[0].trim();
            String value = tokens[1].trim();
            if (!UNSIGNED_INTEGER.matcher(id).matches() || !UNSIGNED_INTEGER.matcher(value).matches()) {
                log.debug("Skipping table line {}: {}", lineNumber, line);
                skipped++;
                continue;
            }

            try {
                values.put(Integer.parseInt(id), Double.parseDouble(value));
            } catch (NumberFormatException e) {
                // identifier too large for an int
                log.debug("Skipping table line {}: {}", lineNumber, e.getMessage());
                skipped++;
            }
        }

        log.debug("Parsed {} detector values, skipped {} table lines", values.size(), skipped);
        return new DetectorValues(values, skipped);
    }

    private String stripDelimiters(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && line.charAt(start) == delimiter) {
            start++;
        }
        while (end > start && line.charAt(end - 1) == delimiter) {
            end--;
        }
        return line.substring(start, end);
    }
}
