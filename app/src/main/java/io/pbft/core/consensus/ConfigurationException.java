package io.pbft.core.consensus;

/** Invalid cluster shape, e.g. too few nodes for the requested fault tolerance. */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
