package com.rms.relay.core.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.error.LocalCallFailureException;
import com.rms.relay.core.model.CommandResponse;
import com.rms.relay.core.port.LocalBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * =====================================================================
 * CommandBridge
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Turns an asynchronous cloud command into a synchronous local service
 * call and hands the result back as a {@link CommandResponse}.
 *
 *   cloud callback thread ──▶ invoke() ──▶ LocalBus.callService(...)
 *            │                                   │ (completes on a bus thread)
 *            └──── blocks on PendingCommand ◀────┘
 *
 * BLOCKING CONTRACT
 * -----------------
 * The cloud callback must return a value before the transport proceeds,
 * so {@link #invoke} blocks the calling thread until the local call
 * reports success or failure. Each invocation has its own
 * {@link PendingCommand}; concurrent commands block independently.
 *
 * TIMEOUT
 * -------
 * {@code timeout} of zero waits without bound. A positive timeout turns a
 * hung local call into a failure response. The local call itself is never
 * cancelled.
 *
 * RESPONSES
 * ---------
 *   success → { successStatus, JSON of the result }
 *   failure → { failureStatus, JSON string of the description }
 */
public class CommandBridge {

    private static final Logger log = LoggerFactory.getLogger(CommandBridge.class);

    private final LocalBus bus;
    private final ObjectMapper mapper;
    private final int successStatus;
    private final int failureStatus;
    private final Duration timeout;

    public CommandBridge(LocalBus bus, ObjectMapper mapper, int successStatus, int failureStatus, Duration timeout) {
        this.bus = bus;
        this.mapper = mapper;
        this.successStatus = successStatus;
        this.failureStatus = failureStatus;
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    public CommandResponse invoke(String methodName, String argsJson) {
        PendingCommand cmd = new PendingCommand(methodName, argsJson);
        log.info("Command received: method={}", methodName);

        JsonNode args;
        try {
            args = decodeArgs(argsJson);
        } catch (JsonProcessingException e) {
            cmd.fail("Invalid command arguments: " + e.getOriginalMessage());
            return respond(cmd);
        }

        cmd.dispatched();
        try {
            bus.callService(methodName, args, cmd::succeed, cmd::fail);
        } catch (RuntimeException e) {
            cmd.fail(describe(e));
        }

        try {
            if (!cmd.await(timeout)) {
                cmd.fail("Local service " + methodName + " timed out after " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cmd.fail("Interrupted while waiting for local service " + methodName);
        }
        return respond(cmd);
    }

    private JsonNode decodeArgs(String argsJson) throws JsonProcessingException {
        if (argsJson == null || argsJson.isBlank()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(argsJson);
    }

    private CommandResponse respond(PendingCommand cmd) {
        PendingCommand.Outcome outcome = cmd.outcome();
        CommandResponse response;
        if (outcome.success()) {
            response = new CommandResponse(successStatus, writeJson(outcome.result()));
            log.info("Command succeeded: method={} status={}", cmd.methodName(), successStatus);
        } else {
            response = new CommandResponse(failureStatus, writeJson(mapper.getNodeFactory().textNode(outcome.error())));
            log.warn("Command failed: method={} status={} error={}", cmd.methodName(), failureStatus, outcome.error());
        }
        cmd.completed();
        return response;
    }

    private String writeJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node == null ? mapper.nullNode() : node);
        } catch (JsonProcessingException e) {
            throw new LocalCallFailureException("Cannot encode command response", e);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
