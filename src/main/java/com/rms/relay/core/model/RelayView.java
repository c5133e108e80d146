package com.rms.relay.core.model;

import java.time.Instant;

/**
 * Read-only snapshot of one relay, for diagnostics.
 *
 * @param topic       local channel
 * @param msgType     payload type reference
 * @param mode        current relay mode
 * @param subscribed  whether a local subscription is held
 * @param advertised  whether a local publish handle is held
 * @param boundAt     time of the last (re)bind
 * @param toCloud     messages forwarded towards the cloud since start
 * @param toLocal     cloud messages published locally since start
 */
public record RelayView(
        String topic,
        String msgType,
        RelayMode mode,
        boolean subscribed,
        boolean advertised,
        Instant boundAt,
        long toCloud,
        long toLocal) {
}
