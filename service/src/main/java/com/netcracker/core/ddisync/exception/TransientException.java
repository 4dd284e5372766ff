package com.netcracker.core.ddisync.exception;

/**
 * Raised once every attempt of a remote call has failed with a non-2xx/non-401 status
 * or a transport error. {@link #NO_STATUS} marks a call that never got a response.
 */
public class TransientException extends DdiSyncException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public TransientException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
