package com.rms.relay.core.model;

/**
 * Acknowledgment returned to the cloud transport for an inbound message.
 */
public enum InboundOutcome {

    /** Published on the local bus. */
    ACCEPTED,

    /** Malformed or mismatched; dropped and must not be redelivered. */
    REJECTED,

    /** Routed but the local publish failed or the relay does not publish locally. */
    ABANDONED
}
