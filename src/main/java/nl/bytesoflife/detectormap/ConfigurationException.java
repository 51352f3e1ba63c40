package nl.bytesoflife.detectormap;

/**
 * Raised when a heat map or layout is configured with values that cannot produce a result,
 * such as an unsupported grid resolution or row group counts that do not add up to the
 * detector count. Always thrown before any computation starts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
