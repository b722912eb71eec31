package com.opsagent.tracker.client;

/**
 * Transport failure (timeout, connection error, 5xx) that survived the client's own retries.
 */
public class TransientRemoteException extends RuntimeException {

    public TransientRemoteException(String message) {
        super(message);
    }

    public TransientRemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
