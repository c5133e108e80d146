package com.rms.relay.core.command;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One in-flight command: method name, raw arguments and a one-shot result
 * slot.
 *
 * <p>{@link #succeed(JsonNode)} and {@link #fail(String)} may race from
 * different threads; only the first call fills the slot and releases
 * {@link #await(Duration)}.</p>
 */
final class PendingCommand {

    record Outcome(boolean success, JsonNode result, String error) {
    }

    private final String methodName;
    private final String args;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicReference<Outcome> slot = new AtomicReference<>();
    private volatile CommandState state = CommandState.RECEIVED;

    PendingCommand(String methodName, String args) {
        this.methodName = methodName;
        this.args = args;
    }

    String methodName() {
        return methodName;
    }

    String args() {
        return args;
    }

    CommandState state() {
        return state;
    }

    void dispatched() {
        state = CommandState.DISPATCHED;
    }

    boolean succeed(JsonNode result) {
        return settle(new Outcome(true, result, null), CommandState.SUCCEEDED);
    }

    boolean fail(String error) {
        return settle(new Outcome(false, null, error), CommandState.FAILED);
    }

    private boolean settle(Outcome outcome, CommandState terminal) {
        if (!slot.compareAndSet(null, outcome)) {
            return false;
        }
        state = terminal;
        done.countDown();
        return true;
    }

    /**
     * Waits for an outcome. A zero or negative timeout waits without bound.
     *
     * @return false if the timeout elapsed first
     */
    boolean await(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            done.await();
            return true;
        }
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    Outcome outcome() {
        return slot.get();
    }

    void completed() {
        state = CommandState.COMPLETED;
    }
}
