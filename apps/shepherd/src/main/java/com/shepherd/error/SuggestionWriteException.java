package com.shepherd.error;

public class SuggestionWriteException extends ShepherdException {

    public SuggestionWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
