package com.rms.relay.core.port;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.relay.core.error.InvalidSchemaException;
import com.rms.relay.core.model.LocalMessage;

import java.util.function.Consumer;

/**
 * =====================================================================
 * LocalBus
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Narrow contract the relay core needs from the local publish/subscribe
 * bus. The core never sees transport classes; the production
 * implementation sits on a local NATS server.
 *
 *   [ RelayEntity ]  ──subscribe/advertise/publish──▶  [ LocalBus ]
 *   [ CommandBridge ] ──callService──────────────────▶  [ LocalBus ]
 *
 * HANDLES
 * -------
 * {@link #subscribe} and {@link #advertise} return a {@link Handle} that
 * MUST be released with {@link #unregister(Handle)}. Unregistering twice is
 * a no-op.
 *
 * THREADING
 * ---------
 * Subscription callbacks run on the bus's delivery thread for that
 * subscription. Implementations MUST be thread-safe.
 */
public interface LocalBus {

    /**
     * A live binding on the bus.
     */
    interface Handle {

        String channel();

        String payloadType();

        boolean isActive();
    }

    /**
     * Checks that the type reference names a known message schema.
     *
     * @throws InvalidSchemaException if it does not
     */
    void resolve(String payloadType);

    /**
     * Subscribes to a channel; every decoded message is handed to {@code onMessage}.
     */
    Handle subscribe(String channel, String payloadType, Consumer<LocalMessage> onMessage);

    /**
     * Acquires a publish handle for a channel.
     */
    Handle advertise(String channel, String payloadType);

    /**
     * Publishes a message through an advertised handle.
     *
     * @throws IllegalStateException if the handle was unregistered
     */
    void publish(Handle publisher, LocalMessage message);

    /**
     * Releases a subscription or publish handle. Idempotent.
     */
    void unregister(Handle handle);

    /**
     * Turns a local message into its JSON payload for the cloud.
     */
    JsonNode encode(LocalMessage message);

    /**
     * Validates a cloud JSON payload against the type's schema.
     *
     * @throws InvalidSchemaException if the type is unknown or the payload does not fit it
     */
    LocalMessage decode(String payloadType, JsonNode payload);

    /**
     * Calls a local service asynchronously. Exactly one of the callbacks is
     * expected to fire; implementations that raise instead are treated as a
     * failure by the caller.
     */
    void callService(String name, JsonNode args, Consumer<JsonNode> onSuccess, Consumer<String> onFailure);
}
