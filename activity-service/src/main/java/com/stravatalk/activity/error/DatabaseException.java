package com.stravatalk.activity.error;

/** Storage failure: constraint violation, connection loss, bad column reference. */
public class DatabaseException extends ActivityServiceException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
