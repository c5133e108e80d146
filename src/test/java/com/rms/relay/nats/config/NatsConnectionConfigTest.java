package com.rms.relay.nats.config;

import io.nats.client.Options;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class NatsConnectionConfigTest {

    @Test
    void localOptionsCarryQueueSizeAndNoEcho() {
        CloudRelayProperties props = new CloudRelayProperties();
        props.getLocal().setNatsUrl("nats://localhost:4333");
        props.getLocal().setQueueSize(250);

        Options options = NatsConnectionConfig.localOptions(props);

        Assertions.assertEquals(250, options.getMaxMessagesInOutgoingQueue());
        Assertions.assertTrue(options.isNoEcho());
        Assertions.assertEquals("cloud-relay-local", options.getConnectionName());
        Assertions.assertEquals(-1, options.getMaxReconnect());
    }

    @Test
    void echoCanBeTurnedBackOn() {
        CloudRelayProperties props = new CloudRelayProperties();
        props.getLocal().setNoEcho(false);

        Assertions.assertFalse(NatsConnectionConfig.localOptions(props).isNoEcho());
    }

    @Test
    void cloudOptionsFollowTheConnectionString() throws Exception {
        CloudRelayProperties props = new CloudRelayProperties();
        props.getCloud().setConnectTimeout(Duration.ofSeconds(3));
        props.getCloud().setPingInterval(Duration.ofSeconds(30));
        props.getCloud().setReconnectWait(Duration.ofMillis(500));
        ConnectionString cs = ConnectionString.parse("Server=nats://cloud:4222;DeviceId=robot-01;Token=abc");

        Options options = NatsConnectionConfig.cloudOptions(props, cs);

        Assertions.assertEquals("cloud-relay-robot-01", options.getConnectionName());
        Assertions.assertEquals(Duration.ofSeconds(3), options.getConnectionTimeout());
        Assertions.assertEquals(Duration.ofSeconds(30), options.getPingInterval());
        Assertions.assertEquals(Duration.ofMillis(500), options.getReconnectWait());
        Assertions.assertFalse(options.isTLSRequired());
    }

    @Test
    void tlsFlagSecuresThePlainServerUrl() throws Exception {
        ConnectionString cs = ConnectionString.parse("Server=nats://cloud:4222;DeviceId=robot-01;Tls=true");

        Options options = NatsConnectionConfig.cloudOptions(new CloudRelayProperties(), cs);

        Assertions.assertTrue(options.isTLSRequired());
    }

    @Test
    void missingConnectionStringFailsBeforeConnecting() {
        CloudRelayProperties props = new CloudRelayProperties();

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new NatsConnectionConfig().cloudConnectionString(props));
    }
}
