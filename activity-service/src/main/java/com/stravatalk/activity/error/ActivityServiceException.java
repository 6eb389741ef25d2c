package com.stravatalk.activity.error;

/**
 * Root of the failures the service reports to its callers.
 * Subclasses map one-to-one onto the response a boundary gives back.
 */
public abstract class ActivityServiceException extends RuntimeException {

    protected ActivityServiceException(String message) {
        super(message);
    }

    protected ActivityServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
