package com.stravatalk.activity.error;

/**
 * A query or an outbound call ran past its deadline.
 * Kept apart from {@link DatabaseException} so callers can retry with a narrower question.
 */
public class OperationTimeoutException extends ActivityServiceException {

    public OperationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
