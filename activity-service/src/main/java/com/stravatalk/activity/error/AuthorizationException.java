package com.stravatalk.activity.error;

/**
 * Bad webhook verify token, foreign subscription, or a tenant credential that is
 * missing or can no longer be refreshed. The tenant has to re-authorize.
 */
public class AuthorizationException extends ActivityServiceException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
