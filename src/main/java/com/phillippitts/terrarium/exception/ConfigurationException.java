package com.phillippitts.terrarium.exception;

/**
 * Thrown when a configuration document exists but cannot be read or parsed.
 *
 * <p>A missing document is not an error: loaders report absence as an empty result and
 * callers fall back to defaults.
 */
public class ConfigurationException extends TerrariumException {

    private final String path;

    public ConfigurationException(String path, String message) {
        super(message + " (path: " + path + ")");
        this.path = path;
    }

    public ConfigurationException(String path, String message, Throwable cause) {
        super(message + " (path: " + path + ")", cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
