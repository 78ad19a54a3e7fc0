package com.chimera.dispatch.cli;

/**
 * A failed call to the Chimera REST API.
 *
 * @see ApiClient
 */
public class ApiException extends RuntimeException {

    private final int statusCode;

    public ApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the server could not be reached. */
    public int getStatusCode() {
        return statusCode;
    }
}
