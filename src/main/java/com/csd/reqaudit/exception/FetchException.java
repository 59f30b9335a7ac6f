package com.csd.reqaudit.exception;

import java.io.IOException;

/**
 * Failure while retrieving manifests or the catalogue from a remote or local source.
 */
public class FetchException extends IOException {

    private final int statusCode;

    public FetchException(String message) {
        this(message, -1);
    }

    public FetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when the failure was not an HTTP response. */
    public int getStatusCode() {
        return statusCode;
    }
}
