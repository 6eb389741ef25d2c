package com.stravatalk.activity.error;

import lombok.Getter;

/** Non-2xx answer from the Strava API. */
@Getter
public class UpstreamException extends ActivityServiceException {

    private final int status;

    public UpstreamException(int status, String message) {
        super(message);
        this.status = status;
    }

    public UpstreamException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
