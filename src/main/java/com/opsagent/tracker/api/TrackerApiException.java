package com.opsagent.tracker.api;

/**
 * Remote application error: the call completed but the payload carried a non-zero error code
 * or the server rejected it with a 4xx status.
 */
public class TrackerApiException extends RuntimeException {

    private final String operation;
    private final int httpStatus;
    private final int errorCode;

    public TrackerApiException(String operation, int httpStatus, int errorCode, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
    }

    public String getOperation() {
        return operation;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public int getErrorCode() {
        return errorCode;
    }

    /**
     * Remote error text without the operation prefix.
     */
    public String getRemoteMessage() {
        String prefix = operation + " failed: ";
        String message = getMessage();
        return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }
}
