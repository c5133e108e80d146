package com.rms.relay.nats.cloud;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.error.TransportFailureException;
import com.rms.relay.core.model.CloudEnvelope;
import com.rms.relay.core.model.CommandResponse;
import com.rms.relay.core.model.InboundOutcome;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.impl.Headers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

final class NatsCloudChannelTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CloudSubjects subjects = new CloudSubjects("robot-01");

    private Connection connection;
    private Dispatcher events;
    private Dispatcher commands;

    private final List<JsonNode> desired = new CopyOnWriteArrayList<>();
    private final List<JsonNode> inbound = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        connection = Mockito.mock(Connection.class);
        events = Mockito.mock(Dispatcher.class);
        commands = Mockito.mock(Dispatcher.class);
        Mockito.when(connection.createDispatcher()).thenReturn(events, commands);
    }

    private NatsCloudChannel channel(Duration twinFetchTimeout, CommandHandlerStub handler) {
        NatsCloudChannel ch = new NatsCloudChannel(connection, subjects, mapper, twinFetchTimeout, Schedulers.immediate());
        ch.onDesiredState(desired::add);
        ch.onInboundMessage(doc -> {
            inbound.add(doc);
            return InboundOutcome.ACCEPTED;
        });
        ch.onCommand(handler::handle);
        return ch;
    }

    private interface CommandHandlerStub {
        CommandResponse handle(String method, String args);
    }

    private static Message message(String subject, String body, String replyTo) {
        Message msg = Mockito.mock(Message.class);
        Mockito.when(msg.getSubject()).thenReturn(subject);
        Mockito.when(msg.getData()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        Mockito.when(msg.getReplyTo()).thenReturn(replyTo);
        return msg;
    }

    private MessageHandler handlerFor(Dispatcher dispatcher, String subject) {
        ArgumentCaptor<MessageHandler> captor = ArgumentCaptor.forClass(MessageHandler.class);
        Mockito.verify(dispatcher).subscribe(Mockito.eq(subject), captor.capture());
        return captor.getValue();
    }

    @Test
    void startRequiresEveryHandler() {
        NatsCloudChannel ch = new NatsCloudChannel(connection, subjects, mapper, Duration.ZERO, Schedulers.immediate());
        ch.onDesiredState(desired::add);

        Assertions.assertThrows(IllegalStateException.class, ch::start);
        Mockito.verify(connection, Mockito.never()).createDispatcher();
    }

    @Test
    void desiredStatePushesReachTheHandler() throws Exception {
        NatsCloudChannel ch = channel(Duration.ZERO, (m, a) -> null);
        ch.start();

        handlerFor(events, subjects.desired())
                .onMessage(message(subjects.desired(), "{\"relays\":{}}", null));
        handlerFor(events, subjects.desired())
                .onMessage(message(subjects.desired(), "garbage", null));

        Assertions.assertEquals(1, desired.size());
        Assertions.assertTrue(desired.get(0).has("relays"));
        Mockito.verify(connection, Mockito.never())
                .requestWithTimeout(Mockito.anyString(), Mockito.any(byte[].class), Mockito.any(Duration.class));
    }

    @Test
    void startFetchesTheFullDesiredStateOnce() {
        Message twin = message(subjects.twinGet(), "{\"desired\":{\"relays\":{}}}", null);
        Mockito.when(connection.requestWithTimeout(Mockito.eq(subjects.twinGet()), Mockito.any(byte[].class),
                Mockito.any(Duration.class))).thenReturn(CompletableFuture.completedFuture(twin));
        NatsCloudChannel ch = channel(Duration.ofMillis(200), (m, a) -> null);

        ch.start();
        ch.start();

        Assertions.assertEquals(1, desired.size());
        Assertions.assertTrue(desired.get(0).has("desired"));
        Mockito.verify(connection, Mockito.times(2)).createDispatcher();
    }

    @Test
    void inboundMessagesAreAcknowledgedWithTheOutcome() throws Exception {
        NatsCloudChannel ch = channel(Duration.ZERO, (m, a) -> null);
        ch.start();

        handlerFor(events, subjects.deviceBound()).onMessage(message(subjects.deviceBound(),
                "{\"topic\":\"/cmd\",\"msg_type\":\"std_msgs/String\",\"payload\":{\"data\":\"x\"}}", "_INBOX.1"));

        Assertions.assertEquals(1, inbound.size());
        ArgumentCaptor<byte[]> ack = ArgumentCaptor.forClass(byte[].class);
        Mockito.verify(connection).publish(Mockito.eq("_INBOX.1"), ack.capture());
        Assertions.assertEquals("ACCEPTED", mapper.readTree(ack.getValue()).get("outcome").asText());
    }

    @Test
    void commandsAreRepliedWithStatusAndResponse() throws Exception {
        NatsCloudChannel ch = channel(Duration.ZERO, (method, args) ->
                new CommandResponse(200, "{\"method\":\"" + method + "\",\"args\":" + args + "}"));
        ch.start();

        handlerFor(commands, subjects.methods()).onMessage(message(
                "devices.robot-01.methods.reboot", "{\"delay\":5}", "_INBOX.2"));

        ArgumentCaptor<byte[]> reply = ArgumentCaptor.forClass(byte[].class);
        Mockito.verify(connection).publish(Mockito.eq("_INBOX.2"), reply.capture());
        JsonNode body = mapper.readTree(reply.getValue());
        Assertions.assertEquals(200, body.get("status").asInt());
        Assertions.assertEquals("reboot", body.get("response").get("method").asText());
        Assertions.assertEquals(5, body.get("response").get("args").get("delay").asInt());
    }

    @Test
    void failingCommandHandlerStillGetsAReply() throws Exception {
        NatsCloudChannel ch = channel(Duration.ZERO, (method, args) -> {
            throw new IllegalStateException("kaput");
        });
        ch.start();

        handlerFor(commands, subjects.methods()).onMessage(message(
                "devices.robot-01.methods.reboot", "", "_INBOX.3"));

        ArgumentCaptor<byte[]> reply = ArgumentCaptor.forClass(byte[].class);
        Mockito.verify(connection).publish(Mockito.eq("_INBOX.3"), reply.capture());
        JsonNode body = mapper.readTree(reply.getValue());
        Assertions.assertEquals(NatsCloudChannel.INTERNAL_ERROR_STATUS, body.get("status").asInt());
        Assertions.assertTrue(body.get("response").asText().contains("kaput"));
    }

    @Test
    void sendPublishesTheEnvelopeWithATopicHeader() throws Exception {
        NatsCloudChannel ch = channel(Duration.ZERO, (m, a) -> null);

        ch.send(new CloudEnvelope("/odom", "geometry_msgs/Twist", mapper.readTree("{\"linear\":{}}")));

        ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        Mockito.verify(connection).publish(Mockito.eq(subjects.events()), headers.capture(), body.capture());
        Assertions.assertEquals("/odom", headers.getValue().getFirst(NatsCloudChannel.HDR_TOPIC));
        JsonNode sent = mapper.readTree(body.getValue());
        Assertions.assertEquals("/odom", sent.get("topic").asText());
        Assertions.assertEquals("geometry_msgs/Twist", sent.get("msg_type").asText());
        Assertions.assertTrue(sent.get("payload").has("linear"));
    }

    @Test
    void sendOnAClosedConnectionIsATransportFailure() {
        Mockito.doThrow(new IllegalStateException("Connection is Closed"))
                .when(connection).publish(Mockito.anyString(), Mockito.any(Headers.class), Mockito.any(byte[].class));
        NatsCloudChannel ch = channel(Duration.ZERO, (m, a) -> null);

        Assertions.assertThrows(TransportFailureException.class,
                () -> ch.send(new CloudEnvelope("/odom", "geometry_msgs/Twist", mapper.createObjectNode())));
    }

    @Test
    void reportedStateGoesToTheReportedSubject() throws Exception {
        NatsCloudChannel ch = channel(Duration.ZERO, (m, a) -> null);

        ch.reportState(mapper.readTree("{\"relays\":{}}"));

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        Mockito.verify(connection).publish(Mockito.eq(subjects.reported()), body.capture());
        Assertions.assertTrue(mapper.readTree(body.getValue()).has("relays"));
    }

    @Test
    void closeReleasesBothDispatchers() {
        NatsCloudChannel ch = channel(Duration.ZERO, (m, a) -> null);
        ch.start();

        ch.close();

        Mockito.verify(connection).closeDispatcher(events);
        Mockito.verify(connection).closeDispatcher(commands);
    }
}
