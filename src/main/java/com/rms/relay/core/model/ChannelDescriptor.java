package com.rms.relay.core.model;

import java.util.Objects;

/**
 * =====================================================================
 * ChannelDescriptor
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Identifies one relayed channel: the local channel name, the type
 * reference of its payload, and the relay direction.
 *
 * KEY
 * ---
 * {@link #channel()} is the unique key across the registry.
 *
 * TYPE REFERENCE
 * --------------
 * {@link #payloadType()} is only a name here. It is resolved against the
 * local bus's type registry at bind time; an unresolvable name rejects the
 * descriptor before any binding is attempted.
 *
 * IMMUTABILITY
 * ------------
 * Mode changes produce a new descriptor ({@link #withMode(RelayMode)}).
 */
public record ChannelDescriptor(String channel, String payloadType, RelayMode mode) {

    public ChannelDescriptor {
        Objects.requireNonNull(mode, "mode");
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        if (payloadType == null || payloadType.isBlank()) {
            throw new IllegalArgumentException("payloadType is required");
        }
    }

    /** Same channel/type, different mode. */
    public ChannelDescriptor withMode(RelayMode newMode) {
        return new ChannelDescriptor(channel, payloadType, newMode);
    }

    @Override
    public String toString() {
        return channel + "[" + payloadType + ", " + mode + "]";
    }
}
