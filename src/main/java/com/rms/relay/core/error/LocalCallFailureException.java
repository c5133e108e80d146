package com.rms.relay.core.error;

/**
 * A local service call failed, raised, or did not complete in time.
 */
public class LocalCallFailureException extends RelayException {

    public LocalCallFailureException(String message) {
        super(message);
    }

    public LocalCallFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
