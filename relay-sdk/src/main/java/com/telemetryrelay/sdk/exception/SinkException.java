package com.telemetryrelay.sdk.exception;

/**
 * A sink rejected or failed to accept a record.
 *
 * <p>Carries the HTTP status (0 for network-level failures) and an optional
 * error code parsed from the response body.</p>
 */
public class SinkException extends RelayException {

    private final int statusCode;
    private final String errorCode;

    public SinkException(String message) {
        super(message);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public SinkException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
