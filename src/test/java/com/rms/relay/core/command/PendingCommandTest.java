package com.rms.relay.core.command;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class PendingCommandTest {

    @Test
    void walksThroughItsStates() throws Exception {
        PendingCommand cmd = new PendingCommand("reboot", "{}");
        Assertions.assertEquals(CommandState.RECEIVED, cmd.state());

        cmd.dispatched();
        Assertions.assertEquals(CommandState.DISPATCHED, cmd.state());
        Assertions.assertFalse(cmd.await(Duration.ofMillis(10)));

        Assertions.assertTrue(cmd.fail("nope"));
        Assertions.assertEquals(CommandState.FAILED, cmd.state());
        Assertions.assertTrue(cmd.await(Duration.ofMillis(10)));

        cmd.completed();
        Assertions.assertEquals(CommandState.COMPLETED, cmd.state());
    }

    @Test
    void onlyTheFirstSettlementCounts() {
        PendingCommand cmd = new PendingCommand("reboot", "{}");

        Assertions.assertTrue(cmd.fail("first"));
        Assertions.assertFalse(cmd.succeed(JsonNodeFactory.instance.textNode("second")));

        Assertions.assertFalse(cmd.outcome().success());
        Assertions.assertEquals("first", cmd.outcome().error());
        Assertions.assertEquals(CommandState.FAILED, cmd.state());
    }
}
