package com.rms.relay.nats.cloud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.relay.core.error.TransportFailureException;
import com.rms.relay.core.model.CloudEnvelope;
import com.rms.relay.core.model.CommandResponse;
import com.rms.relay.core.model.InboundOutcome;
import com.rms.relay.core.port.CloudChannel;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link CloudChannel} over a NATS connection to the cloud endpoint.
 *
 * <h2>Subjects</h2>
 * See {@link CloudSubjects}. Outbound envelopes carry a {@value #HDR_TOPIC}
 * header with the relayed topic.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>Desired-state and inbound messages share one dispatcher, so they are
 *       applied in arrival order.</li>
 *   <li>Commands arrive on a second dispatcher and each one is handed to the
 *       command scheduler, where it may block until its local call completes.
 *       Concurrent commands therefore block independently.</li>
 * </ul>
 *
 * <h2>Startup</h2>
 * {@link #start()} subscribes and then asks the cloud for the full desired
 * state once ({@code twin.get}); a missing responder is not an error.
 */
public class NatsCloudChannel implements CloudChannel, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NatsCloudChannel.class);

    public static final String HDR_TOPIC = "topic";

    /** Status used when the command handler itself blows up. */
    static final int INTERNAL_ERROR_STATUS = 500;

    private final Connection connection;
    private final CloudSubjects subjects;
    private final ObjectMapper mapper;
    private final Duration twinFetchTimeout;
    private final Scheduler commandScheduler;

    private volatile Consumer<JsonNode> desiredHandler;
    private volatile Function<JsonNode, InboundOutcome> inboundHandler;
    private volatile CommandHandler commandHandler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Dispatcher events;
    private Dispatcher commands;

    public NatsCloudChannel(Connection connection,
                            CloudSubjects subjects,
                            ObjectMapper mapper,
                            Duration twinFetchTimeout,
                            Scheduler commandScheduler) {
        this.connection = connection;
        this.subjects = subjects;
        this.mapper = mapper;
        this.twinFetchTimeout = twinFetchTimeout;
        this.commandScheduler = commandScheduler;
    }

    @Override
    public void onDesiredState(Consumer<JsonNode> handler) {
        this.desiredHandler = handler;
    }

    @Override
    public void onInboundMessage(Function<JsonNode, InboundOutcome> handler) {
        this.inboundHandler = handler;
    }

    @Override
    public void onCommand(CommandHandler handler) {
        this.commandHandler = handler;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (desiredHandler == null || inboundHandler == null || commandHandler == null) {
            started.set(false);
            throw new IllegalStateException("All cloud handlers must be registered before start()");
        }

        events = connection.createDispatcher();
        events.subscribe(subjects.desired(), this::onDesiredMessage);
        events.subscribe(subjects.deviceBound(), this::onInboundMessage);

        commands = connection.createDispatcher();
        commands.subscribe(subjects.methods(), this::onCommandMessage);

        log.info("Cloud channel started: device={} desired={} inbound={} methods={}",
                subjects.deviceId(), subjects.desired(), subjects.deviceBound(), subjects.methods());

        fetchDesiredState();
    }

    /**
     * Requests the full desired state once and applies it.
     */
    void fetchDesiredState() {
        if (twinFetchTimeout == null || twinFetchTimeout.isZero() || twinFetchTimeout.isNegative()) {
            return;
        }
        try {
            Message reply = connection.requestWithTimeout(subjects.twinGet(), new byte[0], twinFetchTimeout)
                    .get(twinFetchTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            if (reply.isStatusMessage()) {
                log.info("No desired-state responder on {} ({}); waiting for pushes",
                        subjects.twinGet(), reply.getStatus().getMessage());
                return;
            }
            onDesiredMessage(reply);
        } catch (ExecutionException | CancellationException | TimeoutException e) {
            log.info("Initial desired-state fetch on {} did not complete: {}", subjects.twinGet(), e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onDesiredMessage(Message msg) {
        JsonNode doc = readJson(msg);
        if (doc == null) {
            return;
        }
        try {
            desiredHandler.accept(doc);
        } catch (RuntimeException e) {
            log.error("Desired-state handler failed: {}", e.toString(), e);
        }
    }

    private void onInboundMessage(Message msg) {
        JsonNode doc = readJson(msg);
        InboundOutcome outcome;
        if (doc == null) {
            outcome = InboundOutcome.REJECTED;
        } else {
            try {
                outcome = inboundHandler.apply(doc);
            } catch (RuntimeException e) {
                log.error("Inbound handler failed: {}", e.toString(), e);
                outcome = InboundOutcome.ABANDONED;
            }
        }
        if (msg.getReplyTo() != null) {
            ObjectNode ack = mapper.createObjectNode().put("outcome", outcome.name());
            publishQuietly(msg.getReplyTo(), ack);
        }
    }

    private void onCommandMessage(Message msg) {
        String method = subjects.methodName(msg.getSubject());
        String args = msg.getData() == null ? "" : new String(msg.getData(), StandardCharsets.UTF_8);
        if (msg.getReplyTo() == null) {
            log.warn("Command {} has no reply subject; its result will be discarded", method);
        }

        Mono.fromCallable(() -> commandHandler.handle(method, args))
                .subscribeOn(commandScheduler)
                .onErrorResume(err -> {
                    log.error("Command handler failed for {}: {}", method, err.toString(), err);
                    return Mono.just(new CommandResponse(INTERNAL_ERROR_STATUS,
                            mapper.getNodeFactory().textNode(err.toString()).toString()));
                })
                .subscribe(response -> replyToCommand(msg, method, response));
    }

    private void replyToCommand(Message msg, String method, CommandResponse response) {
        if (msg.getReplyTo() == null) {
            return;
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("status", response.status());
        try {
            body.set("response", mapper.readTree(response.response()));
        } catch (JsonProcessingException e) {
            body.put("response", response.response());
        }
        publishQuietly(msg.getReplyTo(), body);
        log.debug("Replied to command {} status={}", method, response.status());
    }

    @Override
    public void send(CloudEnvelope envelope) {
        ObjectNode body = mapper.createObjectNode();
        body.put(CloudEnvelope.FIELD_TOPIC, envelope.topic());
        body.put(CloudEnvelope.FIELD_MSG_TYPE, envelope.msgType());
        body.set(CloudEnvelope.FIELD_PAYLOAD, envelope.payload());

        Headers headers = new Headers();
        headers.add(HDR_TOPIC, envelope.topic());
        try {
            connection.publish(subjects.events(), headers, mapper.writeValueAsBytes(body));
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new TransportFailureException("Cannot send " + envelope.topic() + " to cloud", e);
        }
    }

    @Override
    public void reportState(JsonNode reported) {
        try {
            connection.publish(subjects.reported(), mapper.writeValueAsBytes(reported));
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new TransportFailureException("Cannot report state to cloud", e);
        }
    }

    private JsonNode readJson(Message msg) {
        byte[] data = msg.getData();
        if (data == null || data.length == 0) {
            log.warn("Ignored empty cloud message on {}", msg.getSubject());
            return null;
        }
        try {
            return mapper.readTree(data);
        } catch (IOException e) {
            log.warn("Ignored unreadable cloud message on {}: {}", msg.getSubject(), e.getMessage());
            return null;
        }
    }

    private void publishQuietly(String subject, JsonNode body) {
        try {
            connection.publish(subject, mapper.writeValueAsBytes(body));
        } catch (JsonProcessingException | IllegalStateException e) {
            log.warn("Cloud reply on {} failed: {}", subject, e.toString());
        }
    }

    @Override
    public void close() {
        if (events != null) {
            connection.closeDispatcher(events);
        }
        if (commands != null) {
            connection.closeDispatcher(commands);
        }
    }
}
