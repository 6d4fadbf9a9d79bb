package com.pulsewire.core.collector;

/**
 * A failure talking to an external source. Collectors turn it into a result error.
 */
public class SourceException extends Exception {

    private final int statusCode;

    public SourceException(String message) {
        this(message, 0);
    }

    public SourceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /** HTTP status, or 0 when the failure happened before a response. */
    public int getStatusCode() {
        return statusCode;
    }

    /** Server errors, rate limits and transport failures are worth another attempt. */
    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
