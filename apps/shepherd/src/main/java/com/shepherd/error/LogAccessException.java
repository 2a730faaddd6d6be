package com.shepherd.error;

/** The conversation log (or its directory) cannot be located or read. */
public class LogAccessException extends ShepherdException {

    public LogAccessException(String message) {
        super(message);
    }

    public LogAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
