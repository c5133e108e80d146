package com.rms.relay.core.error;

/**
 * An inbound cloud message was routed to an entity whose channel or payload
 * type does not match the message.
 */
public class ChannelMismatchException extends RelayException {

    public ChannelMismatchException(String expectedChannel, String expectedType,
                                    String actualChannel, String actualType) {
        super("Message " + actualChannel + "[" + actualType + "] does not match relay "
                + expectedChannel + "[" + expectedType + "]");
    }
}
