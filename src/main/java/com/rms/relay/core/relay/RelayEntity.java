package com.rms.relay.core.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.relay.core.error.ChannelMismatchException;
import com.rms.relay.core.model.ChannelDescriptor;
import com.rms.relay.core.model.CloudEnvelope;
import com.rms.relay.core.model.LocalMessage;
import com.rms.relay.core.model.RelayMode;
import com.rms.relay.core.model.RelayView;
import com.rms.relay.core.port.LocalBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * =====================================================================
 * RelayEntity
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the live local-bus bindings for ONE channel descriptor:
 *
 *   subscription   held while mode ∈ { TO_CLOUD, BIDIRECTIONAL }
 *   publish handle held while mode ∈ { TO_LOCAL, BIDIRECTIONAL }
 *
 * LIFECYCLE
 * ---------
 *   create  → resolve type → initial bind
 *   mode change → release all handles → acquire required handles
 *   close   → release all handles (process teardown only)
 *
 * Binding changes are all-or-nothing: if acquiring a handle fails, every
 * handle acquired in that attempt is released again before the error
 * propagates.
 *
 * THREAD SAFETY
 * -------------
 * Binding state is guarded by the entity monitor. Local deliveries arrive
 * on bus threads and only read the (volatile) descriptor.
 */
public final class RelayEntity {

    private static final Logger log = LoggerFactory.getLogger(RelayEntity.class);

    private final LocalBus bus;
    private final CloudForwarder forwarder;

    private volatile ChannelDescriptor descriptor;

    private LocalBus.Handle subscription;
    private LocalBus.Handle publisher;
    private volatile Instant boundAt;

    private final AtomicLong toCloud = new AtomicLong();
    private final AtomicLong toLocal = new AtomicLong();
    private final AtomicLong bindCount = new AtomicLong();

    private RelayEntity(ChannelDescriptor descriptor, LocalBus bus, CloudForwarder forwarder) {
        this.descriptor = descriptor;
        this.bus = bus;
        this.forwarder = forwarder;
    }

    /**
     * Creates and binds an entity.
     *
     * @throws com.rms.relay.core.error.InvalidSchemaException if the payload type does not resolve
     */
    public static RelayEntity create(ChannelDescriptor descriptor, LocalBus bus, CloudForwarder forwarder) {
        bus.resolve(descriptor.payloadType());
        RelayEntity entity = new RelayEntity(descriptor, bus, forwarder);
        entity.rebind();
        return entity;
    }

    public ChannelDescriptor descriptor() {
        return descriptor;
    }

    public String channel() {
        return descriptor.channel();
    }

    public RelayMode mode() {
        return descriptor.mode();
    }

    /**
     * Releases any existing handles, then acquires exactly the handles the
     * current mode requires. Safe to call repeatedly.
     */
    public synchronized void rebind() {
        release();
        ChannelDescriptor d = descriptor;
        try {
            if (d.mode().subscribesLocally()) {
                subscription = bus.subscribe(d.channel(), d.payloadType(), this::onLocalMessage);
            }
            if (d.mode().publishesLocally()) {
                publisher = bus.advertise(d.channel(), d.payloadType());
            }
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        boundAt = Instant.now();
        bindCount.incrementAndGet();
        log.info("Relay bound: {} subscribed={} advertised={}", d, subscription != null, publisher != null);
    }

    /**
     * Sets the mode and rebinds under the entity monitor. A no-op when the
     * mode is unchanged. If the new bindings cannot be acquired, the previous
     * mode and its bindings are restored and the error is rethrown.
     */
    public synchronized void changeMode(RelayMode mode) {
        ChannelDescriptor previous = descriptor;
        if (previous.mode() == mode) {
            return;
        }
        descriptor = previous.withMode(mode);
        try {
            rebind();
        } catch (RuntimeException e) {
            descriptor = previous;
            try {
                rebind();
            } catch (RuntimeException restoreErr) {
                log.error("Relay {} left unbound after failed change: {}", previous, restoreErr.toString());
            }
            throw e;
        }
    }

    /**
     * Publishes a cloud-originated message on the local bus.
     *
     * @return true if the message was published, false if this relay does not
     *         publish locally or the publish failed
     * @throws ChannelMismatchException if channel or type do not match this relay
     * @throws com.rms.relay.core.error.InvalidSchemaException if the payload does not fit the type
     */
    public boolean deliverFromCloud(String channel, String payloadType, JsonNode payload) {
        ChannelDescriptor d = descriptor;
        if (!d.channel().equals(channel) || !d.payloadType().equals(payloadType)) {
            throw new ChannelMismatchException(d.channel(), d.payloadType(), channel, payloadType);
        }

        LocalMessage message = bus.decode(payloadType, payload);

        synchronized (this) {
            if (publisher == null || !publisher.isActive()) {
                log.warn("Relay {} does not publish locally; cloud message dropped", d);
                return false;
            }
            try {
                bus.publish(publisher, message);
            } catch (RuntimeException e) {
                log.warn("Local publish failed on {}: {}", d.channel(), e.toString());
                return false;
            }
        }
        toLocal.incrementAndGet();
        return true;
    }

    private void onLocalMessage(LocalMessage message) {
        ChannelDescriptor d = descriptor;
        if (!d.mode().subscribesLocally()) {
            // late delivery racing an unsubscribe
            return;
        }
        JsonNode payload = bus.encode(message);
        if (forwarder.forward(new CloudEnvelope(d.channel(), d.payloadType(), payload))) {
            toCloud.incrementAndGet();
        }
    }

    /** Number of successful (re)binds, for diagnostics. */
    public long bindCount() {
        return bindCount.get();
    }

    public synchronized boolean isSubscribed() {
        return subscription != null;
    }

    public synchronized boolean isAdvertised() {
        return publisher != null;
    }

    public synchronized RelayView view() {
        ChannelDescriptor d = descriptor;
        return new RelayView(d.channel(), d.payloadType(), d.mode(),
                subscription != null, publisher != null, boundAt, toCloud.get(), toLocal.get());
    }

    /** Releases all handles. */
    public synchronized void close() {
        release();
    }

    private void release() {
        if (subscription != null) {
            unregisterQuietly(subscription);
            subscription = null;
        }
        if (publisher != null) {
            unregisterQuietly(publisher);
            publisher = null;
        }
    }

    private void unregisterQuietly(LocalBus.Handle handle) {
        try {
            bus.unregister(handle);
        } catch (RuntimeException e) {
            log.warn("Failed to release handle on {}: {}", handle.channel(), e.toString());
        }
    }
}
