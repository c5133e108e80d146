package com.rms.relay.core.port;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.relay.core.model.CloudEnvelope;
import com.rms.relay.core.model.CommandResponse;
import com.rms.relay.core.model.InboundOutcome;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * =====================================================================
 * CloudChannel
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The single bidirectional cloud channel, consumed as an opaque transport
 * with callback registration. Connection management, retries,
 * authentication and wire encoding belong to the implementation.
 *
 * CALLBACKS
 * ---------
 * Each callback may be invoked on its own transport thread. Handlers must
 * be registered before {@link #start()}.
 *
 * FAILURE SEMANTICS
 * -----------------
 * {@link #send} and {@link #reportState} throw
 * {@link com.rms.relay.core.error.TransportFailureException}; callers log
 * and move on.
 */
public interface CloudChannel {

    /**
     * Invoked by the cloud for a named command; must return synchronously.
     */
    @FunctionalInterface
    interface CommandHandler {
        CommandResponse handle(String methodName, String argsJson);
    }

    void onDesiredState(Consumer<JsonNode> handler);

    void onInboundMessage(Function<JsonNode, InboundOutcome> handler);

    void onCommand(CommandHandler handler);

    /**
     * Starts delivering callbacks. Idempotent.
     */
    void start();

    void send(CloudEnvelope envelope);

    void reportState(JsonNode reported);
}
