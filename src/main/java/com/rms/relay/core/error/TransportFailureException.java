package com.rms.relay.core.error;

/**
 * The cloud transport could not send or receive.
 */
public class TransportFailureException extends RelayException {

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
