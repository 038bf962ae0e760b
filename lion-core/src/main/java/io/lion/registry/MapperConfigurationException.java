package io.lion.registry;

/**
 * Thrown when mapper registration or resolution is misconfigured.
 *
 * <p>Raised at startup when no types or packages are supplied to scan, and at resolution
 * time when a registered implementation cannot be instantiated.
 */
public class MapperConfigurationException extends RuntimeException {

    public MapperConfigurationException(String message) {
        super(message);
    }

    public MapperConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
