package com.rms.relay.nats.local;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SubjectsTest {

    @Test
    void pathStyleChannelsBecomeDottedSubjects() {
        Assertions.assertEquals("robot.odom", Subjects.fromChannel("/robot/odom"));
        Assertions.assertEquals("chatter", Subjects.fromChannel("chatter"));
        Assertions.assertEquals("a.b", Subjects.fromChannel("//a/b/"));
    }

    @Test
    void invalidChannelsAreRefused() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Subjects.fromChannel("/"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Subjects.fromChannel("/a//b"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Subjects.fromChannel("/a/*"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Subjects.fromChannel("/a b"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Subjects.fromChannel(null));
    }

    @Test
    void servicesLiveUnderThePrefix() {
        Assertions.assertEquals("svc.arm.home", Subjects.service("svc", "/arm/home"));
        Assertions.assertEquals("reboot", Subjects.service("", "reboot"));
        Assertions.assertEquals("reboot", Subjects.service(null, "reboot"));
    }
}
