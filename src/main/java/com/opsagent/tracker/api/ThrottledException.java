package com.opsagent.tracker.api;

/**
 * The remote API refused a call for rate-limiting reasons. Writes retry on this; reads surface it.
 */
public class ThrottledException extends RuntimeException {

    private final int httpStatus;

    public ThrottledException(String message) {
        this(message, 429);
    }

    public ThrottledException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    /**
     * 200 when the throttling was only reported through the embedded error code.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
