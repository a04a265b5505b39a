package io.gridmesh.config;

public final class ConfigurationException extends RuntimeException {
    private final String path;

    public ConfigurationException(String path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ConfigurationException(String path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
