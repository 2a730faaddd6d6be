package com.shepherd.error;

/** Invalid or missing configuration. Fatal for the project it belongs to. */
public class ConfigException extends ShepherdException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
