package com.shepherd.error;

/** A reasoning-service round failed: timeout, malformed answer, auth/quota or process failure. */
public class AnalysisServiceException extends ShepherdException {

    public AnalysisServiceException(String message) {
        super(message);
    }

    public AnalysisServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
