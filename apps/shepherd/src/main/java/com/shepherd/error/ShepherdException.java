package com.shepherd.error;

/** Base of every failure the engine reports per project. */
public abstract class ShepherdException extends RuntimeException {

    protected ShepherdException(String message) {
        super(message);
    }

    protected ShepherdException(String message, Throwable cause) {
        super(message, cause);
    }
}
