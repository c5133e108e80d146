package com.rms.relay.core.error;

/**
 * The payload type reference does not resolve to a registered message type.
 */
public class InvalidSchemaException extends RelayException {

    private final String payloadType;

    public InvalidSchemaException(String payloadType) {
        super("Unknown message type: " + payloadType);
        this.payloadType = payloadType;
    }

    public InvalidSchemaException(String payloadType, String detail) {
        super("Invalid payload for " + payloadType + ": " + detail);
        this.payloadType = payloadType;
    }

    public String payloadType() {
        return payloadType;
    }
}
