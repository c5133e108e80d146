package com.rms.relay.nats.local;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.error.InvalidSchemaException;
import com.rms.relay.core.error.LocalCallFailureException;
import com.rms.relay.core.error.RelayException;
import com.rms.relay.core.model.LocalMessage;
import com.rms.relay.core.port.LocalBus;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharacterCodingException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link LocalBus} on a local NATS server.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li>Channel → subject via {@link Subjects#fromChannel(String)}.</li>
 *   <li>Message → JSON body, text encoded per {@link TextEncodingPolicy}.</li>
 *   <li>Service call → request/reply on {@code <servicePrefix>.<name>}. A reply
 *       carrying the {@value #HDR_SERVICE_ERROR} header is a failure whose
 *       description is the header value.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Every subscription gets its own {@link Dispatcher}, so each channel is
 * delivered on its own thread. Unregistering a subscription closes its
 * dispatcher.
 *
 * <h2>Validation</h2>
 * Inbound bus messages that do not fit their registered {@link MessageType}
 * are logged and dropped.
 */
public class NatsLocalBus implements LocalBus {

    private static final Logger log = LoggerFactory.getLogger(NatsLocalBus.class);

    public static final String HDR_SERVICE_ERROR = "Service-Error";

    private final Connection connection;
    private final MessageTypeRegistry types;
    private final ObjectMapper mapper;
    private final TextEncodingPolicy encoding;
    private final String servicePrefix;
    private final Duration serviceTimeout;

    public NatsLocalBus(Connection connection,
                        MessageTypeRegistry types,
                        ObjectMapper mapper,
                        TextEncodingPolicy encoding,
                        String servicePrefix,
                        Duration serviceTimeout) {
        this.connection = connection;
        this.types = types;
        this.mapper = mapper;
        this.encoding = encoding;
        this.servicePrefix = servicePrefix;
        this.serviceTimeout = serviceTimeout;
    }

    @Override
    public void resolve(String payloadType) {
        types.resolve(payloadType);
    }

    @Override
    public Handle subscribe(String channel, String payloadType, Consumer<LocalMessage> onMessage) {
        MessageType type = types.resolve(payloadType);
        String subject = subjectOf(channel);

        Dispatcher dispatcher = connection.createDispatcher(msg -> onBusMessage(channel, type, onMessage, msg));
        dispatcher.subscribe(subject);
        log.debug("Subscribed local subject={} type={}", subject, payloadType);
        return new NatsHandle(channel, payloadType, subject, dispatcher);
    }

    @Override
    public Handle advertise(String channel, String payloadType) {
        types.resolve(payloadType);
        String subject = subjectOf(channel);
        log.debug("Advertised local subject={} type={}", subject, payloadType);
        return new NatsHandle(channel, payloadType, subject, null);
    }

    @Override
    public void publish(Handle publisher, LocalMessage message) {
        NatsHandle h = natsHandle(publisher);
        if (!h.isActive()) {
            throw new IllegalStateException("Publish handle for " + h.channel() + " was released");
        }
        try {
            connection.publish(h.subject, encoding.encode(mapper.writeValueAsString(message.body())));
        } catch (JsonProcessingException e) {
            throw new RelayException("Cannot encode message for " + h.channel(), e);
        }
    }

    @Override
    public void unregister(Handle handle) {
        NatsHandle h = natsHandle(handle);
        if (!h.active.compareAndSet(true, false)) {
            return;
        }
        if (h.dispatcher != null) {
            connection.closeDispatcher(h.dispatcher);
            log.debug("Unsubscribed local subject={}", h.subject);
        }
    }

    @Override
    public JsonNode encode(LocalMessage message) {
        return message.body();
    }

    @Override
    public LocalMessage decode(String payloadType, JsonNode payload) {
        MessageType type = types.resolve(payloadType);
        List<String> problems = type.validate(payload);
        if (!problems.isEmpty()) {
            throw new InvalidSchemaException(payloadType, String.join("; ", problems));
        }
        return new LocalMessage(type.name(), payload.deepCopy());
    }

    @Override
    public void callService(String name, JsonNode args, Consumer<JsonNode> onSuccess, Consumer<String> onFailure) {
        String subject;
        byte[] body;
        try {
            subject = Subjects.service(servicePrefix, name);
            body = encoding.encode(mapper.writeValueAsString(args));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new LocalCallFailureException("Cannot call service " + name + ": " + e.getMessage(), e);
        }

        CompletableFuture<Message> reply = connection.requestWithTimeout(subject, body, serviceTimeout);
        reply.whenComplete((msg, err) -> {
            if (err != null) {
                onFailure.accept("Service " + name + " failed: " + describe(err));
                return;
            }
            if (msg.isStatusMessage()) {
                onFailure.accept("Service " + name + " unavailable: " + msg.getStatus().getMessage());
                return;
            }
            Headers headers = msg.getHeaders();
            String error = headers == null ? null : headers.getFirst(HDR_SERVICE_ERROR);
            if (error != null) {
                onFailure.accept(error);
                return;
            }
            try {
                byte[] data = msg.getData();
                onSuccess.accept(data == null || data.length == 0
                        ? mapper.nullNode()
                        : mapper.readTree(encoding.decode(data)));
            } catch (CharacterCodingException | JsonProcessingException e) {
                onFailure.accept("Service " + name + " returned an unreadable reply: " + e.getMessage());
            }
        });
    }

    private void onBusMessage(String channel, MessageType type, Consumer<LocalMessage> sink, Message msg) {
        JsonNode body;
        try {
            body = mapper.readTree(encoding.decode(msg.getData()));
        } catch (CharacterCodingException | JsonProcessingException e) {
            log.warn("Dropped unreadable message on {}: {}", channel, e.getMessage());
            return;
        }
        List<String> problems = type.validate(body);
        if (!problems.isEmpty()) {
            log.warn("Dropped message on {} not matching {}: {}", channel, type.name(), problems);
            return;
        }
        try {
            sink.accept(new LocalMessage(type.name(), body));
        } catch (RuntimeException e) {
            log.warn("Relay handler failed on {}: {}", channel, e.toString(), e);
        }
    }

    private static String subjectOf(String channel) {
        try {
            return Subjects.fromChannel(channel);
        } catch (IllegalArgumentException e) {
            throw new RelayException(e.getMessage(), e);
        }
    }

    private static NatsHandle natsHandle(Handle handle) {
        if (handle instanceof NatsHandle h) {
            return h;
        }
        throw new IllegalArgumentException("Not a NATS handle: " + handle);
    }

    private static String describe(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getMessage();
        return (msg == null || msg.isBlank()) ? root.getClass().getSimpleName() : msg;
    }

    static final class NatsHandle implements Handle {

        private final String channel;
        private final String payloadType;
        private final String subject;
        private final Dispatcher dispatcher;
        private final AtomicBoolean active = new AtomicBoolean(true);

        NatsHandle(String channel, String payloadType, String subject, Dispatcher dispatcher) {
            this.channel = channel;
            this.payloadType = payloadType;
            this.subject = subject;
            this.dispatcher = dispatcher;
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public String payloadType() {
            return payloadType;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        String subject() {
            return subject;
        }

        boolean isSubscription() {
            return dispatcher != null;
        }

        @Override
        public String toString() {
            return (dispatcher != null ? "sub:" : "pub:") + subject;
        }
    }
}
