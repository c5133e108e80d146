package com.rms.relay.core.error;

/**
 * =====================================================================
 * RelayException
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Root of the relay error taxonomy. Every subtype describes a failure
 * that is scoped to ONE channel, ONE desired-state entry, or ONE command
 * invocation.
 *
 * POLICY
 * ------
 * Callers isolate and log these errors. None of them may abort a
 * reconciliation pass, the startup restore, or another channel's relay.
 *
 *   InvalidSchemaException          → descriptor rejected
 *   ChannelMismatchException        → inbound message dropped, rejected upstream
 *   MalformedDesiredStateException  → desired-state entry skipped
 *   LocalCallFailureException       → reported to the cloud as a failure response
 *   TransportFailureException       → logged; registry state untouched
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
