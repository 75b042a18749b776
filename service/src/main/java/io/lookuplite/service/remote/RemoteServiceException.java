package io.lookuplite.service.remote;

import io.lookuplite.core.LookupException;

/**
 * The remote REST service answered with an unexpected status, sent a body
 * that could not be parsed, or could not be reached at all.
 */
public class RemoteServiceException extends LookupException {
    private final int statusCode;
    private final String body;

    public RemoteServiceException(String message, int statusCode, String body) {
        super(message + " (HTTP " + statusCode + ")");
        this.statusCode = statusCode;
        this.body = body;
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.body = null;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
