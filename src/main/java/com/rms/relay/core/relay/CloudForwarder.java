package com.rms.relay.core.relay;

import com.rms.relay.core.model.CloudEnvelope;
import com.rms.relay.core.port.CloudChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget path from local-bus callbacks to the cloud channel.
 *
 * <h2>Purpose</h2>
 * Local deliveries arrive on the bus's callback threads and must never wait
 * on cloud I/O. {@link #forward(CloudEnvelope)} only enqueues; a single
 * drain loop on the supplied {@link Scheduler} performs the (blocking)
 * {@link CloudChannel#send(CloudEnvelope)}.
 *
 * <h2>Backpressure</h2>
 * The queue is bounded. When it is full the envelope is dropped and counted;
 * there is no delivery confirmation towards the publishing side.
 *
 * <h2>Failure handling</h2>
 * A send failure is logged and the loop continues with the next envelope.
 */
public class CloudForwarder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CloudForwarder.class);

    private final CloudChannel cloud;
    private final Sinks.Many<CloudEnvelope> queue;
    private final Disposable drain;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public CloudForwarder(CloudChannel cloud, int bufferSize, Scheduler scheduler) {
        this.cloud = cloud;
        this.queue = Sinks.many().unicast()
                .onBackpressureBuffer(new ArrayBlockingQueue<CloudEnvelope>(Math.max(1, bufferSize)));

        // publishOn fuses with the sink queue, so bufferSize is the whole buffer
        this.drain = queue.asFlux()
                .publishOn(scheduler, 1)
                .subscribe(this::sendOne,
                        err -> log.error("Cloud forwarder terminated: {}", err.toString(), err));
    }

    /**
     * Enqueues an envelope for the cloud. Never blocks.
     *
     * @return false if the envelope was dropped
     */
    public boolean forward(CloudEnvelope envelope) {
        Sinks.EmitResult result;
        // unicast sinks reject concurrent emitters; callers come from several dispatcher threads
        synchronized (queue) {
            result = queue.tryEmitNext(envelope);
        }
        if (result.isFailure()) {
            long n = dropped.incrementAndGet();
            log.warn("Dropped message for cloud topic={} result={} droppedTotal={}", envelope.topic(), result, n);
            return false;
        }
        return true;
    }

    private void sendOne(CloudEnvelope envelope) {
        try {
            cloud.send(envelope);
            sent.incrementAndGet();
            log.debug("Forwarded topic={} type={} to cloud", envelope.topic(), envelope.msgType());
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("Cloud send failed topic={} err={}", envelope.topic(), e.toString());
        }
    }

    public long sentCount() {
        return sent.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        synchronized (queue) {
            queue.tryEmitComplete();
        }
        if (!drain.isDisposed()) {
            drain.dispose();
        }
    }
}
