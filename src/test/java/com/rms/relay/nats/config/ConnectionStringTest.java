package com.rms.relay.nats.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ConnectionStringTest {

    @Test
    void parsesTokenConnectionString() {
        ConnectionString cs = ConnectionString.parse(
                "Server=tls://cloud.example.com:4222;DeviceId=robot-01;Token=abc==");

        Assertions.assertEquals("tls://cloud.example.com:4222", cs.server());
        Assertions.assertEquals("robot-01", cs.deviceId());
        Assertions.assertEquals("abc==", cs.token());
        Assertions.assertTrue(cs.tls());
        Assertions.assertNull(cs.user());
    }

    @Test
    void keysAreCaseInsensitiveAndBlankSegmentsIgnored() {
        ConnectionString cs = ConnectionString.parse(
                " server = nats://localhost:4222 ;; deviceid=robot-02;USER=robot;Password=s3cret;Tls=true;");

        Assertions.assertEquals("nats://localhost:4222", cs.server());
        Assertions.assertEquals("robot-02", cs.deviceId());
        Assertions.assertEquals("robot", cs.user());
        Assertions.assertEquals("s3cret", cs.password());
        Assertions.assertTrue(cs.tls());
    }

    @Test
    void missingOrMalformedValuesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionString.parse(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionString.parse("  "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionString.parse("DeviceId=x"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionString.parse("Server=nats://h:4222"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionString.parse("Server=nats://h:4222;garbage"));
    }

    @Test
    void toStringHidesSecrets() {
        ConnectionString cs = ConnectionString.parse(
                "Server=nats://h:4222;DeviceId=d;Token=topsecret;User=admin;Password=hunter2");

        String text = cs.toString();

        Assertions.assertFalse(text.contains("topsecret"));
        Assertions.assertFalse(text.contains("hunter2"));
        Assertions.assertFalse(text.contains("admin"));
        Assertions.assertTrue(text.contains("a***n"));
    }
}
