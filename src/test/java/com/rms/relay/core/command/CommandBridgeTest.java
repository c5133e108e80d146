package com.rms.relay.core.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.model.CommandResponse;
import com.rms.relay.support.FakeLocalBus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class CommandBridgeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private CommandBridge bridge(FakeLocalBus bus, Duration timeout) {
        return new CommandBridge(bus, mapper, 200, 500, timeout);
    }

    @Test
    void successReturnsTheServiceResultAsJson() throws Exception {
        FakeLocalBus bus = new FakeLocalBus()
                .service("echo", (args, ok, fail) -> ok.accept(args));

        CommandResponse response = bridge(bus, Duration.ZERO).invoke("echo", "{\"x\":1}");

        Assertions.assertEquals(200, response.status());
        Assertions.assertEquals(mapper.readTree("{\"x\":1}"), mapper.readTree(response.response()));
    }

    @Test
    void failureReturnsTheDescriptionAsAJsonString() throws Exception {
        FakeLocalBus bus = new FakeLocalBus()
                .service("arm", (args, ok, fail) -> fail.accept("boom"));

        CommandResponse response = bridge(bus, Duration.ZERO).invoke("arm", "{}");

        Assertions.assertEquals(500, response.status());
        Assertions.assertEquals("\"boom\"", response.response());
    }

    @Test
    void configuredStatusCodesAreUsed() {
        FakeLocalBus bus = new FakeLocalBus()
                .service("ok", (args, ok, fail) -> ok.accept(mapper.createObjectNode()))
                .service("ko", (args, ok, fail) -> fail.accept("no"));
        CommandBridge bridge = new CommandBridge(bus, mapper, 201, 418, Duration.ZERO);

        Assertions.assertEquals(201, bridge.invoke("ok", "{}").status());
        Assertions.assertEquals(418, bridge.invoke("ko", "{}").status());
    }

    @Test
    void throwingDispatchIsAFailureResponse() throws Exception {
        FakeLocalBus bus = new FakeLocalBus()
                .service("bad", (args, ok, fail) -> {
                    throw new IllegalStateException("service not advertised");
                });

        CommandResponse response = bridge(bus, Duration.ZERO).invoke("bad", "{}");

        Assertions.assertEquals(500, response.status());
        Assertions.assertEquals("service not advertised", mapper.readTree(response.response()).asText());
    }

    @Test
    void resultDeliveredOnAnotherThreadReleasesTheCaller() {
        FakeLocalBus bus = new FakeLocalBus()
                .service("slow", (args, ok, fail) -> CompletableFuture.runAsync(() -> {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    ok.accept(mapper.getNodeFactory().textNode("done"));
                }));

        CommandResponse response = bridge(bus, Duration.ZERO).invoke("slow", "{}");

        Assertions.assertEquals(200, response.status());
        Assertions.assertEquals("\"done\"", response.response());
    }

    @Test
    void hungServiceTimesOutWhenATimeoutIsSet() {
        FakeLocalBus bus = new FakeLocalBus()
                .service("hang", (args, ok, fail) -> { });

        CommandResponse response = bridge(bus, Duration.ofMillis(50)).invoke("hang", "{}");

        Assertions.assertEquals(500, response.status());
        Assertions.assertTrue(response.response().contains("timed out"), response.response());
    }

    @Test
    void firstOutcomeWins() {
        FakeLocalBus bus = new FakeLocalBus()
                .service("twice", (args, ok, fail) -> {
                    ok.accept(mapper.getNodeFactory().numberNode(1));
                    fail.accept("late");
                });

        CommandResponse response = bridge(bus, Duration.ZERO).invoke("twice", "{}");

        Assertions.assertEquals(200, response.status());
        Assertions.assertEquals("1", response.response());
    }

    @Test
    void blankArgumentsBecomeAnEmptyObject() {
        FakeLocalBus bus = new FakeLocalBus()
                .service("echo", (args, ok, fail) -> ok.accept(args));

        Assertions.assertEquals("{}", bridge(bus, Duration.ZERO).invoke("echo", "").response());
        Assertions.assertEquals("{}", bridge(bus, Duration.ZERO).invoke("echo", null).response());
    }

    @Test
    void unparseableArgumentsFailWithoutCallingTheService() {
        AtomicInteger calls = new AtomicInteger();
        FakeLocalBus bus = new FakeLocalBus()
                .service("echo", (args, ok, fail) -> {
                    calls.incrementAndGet();
                    ok.accept(args);
                });

        CommandResponse response = bridge(bus, Duration.ZERO).invoke("echo", "{not json");

        Assertions.assertEquals(500, response.status());
        Assertions.assertEquals(0, calls.get());
    }

    @Test
    void concurrentCommandsBlockIndependently() throws Exception {
        FakeLocalBus bus = new FakeLocalBus()
                .service("hang", (args, ok, fail) -> { })
                .service("echo", (args, ok, fail) -> ok.accept(args));
        CommandBridge bridge = bridge(bus, Duration.ofSeconds(2));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<CommandResponse> hung = pool.submit(() -> bridge.invoke("hang", "{}"));
            Future<CommandResponse> quick = pool.submit(() -> bridge.invoke("echo", "{\"n\":2}"));

            CommandResponse q = quick.get(1, TimeUnit.SECONDS);
            Assertions.assertEquals(200, q.status());
            Assertions.assertFalse(hung.isDone());
            Assertions.assertEquals(500, hung.get(5, TimeUnit.SECONDS).status());
        } finally {
            pool.shutdownNow();
        }
    }
}
