package com.rms.relay.core.relay;

import com.rms.relay.core.model.ChannelDescriptor;
import com.rms.relay.core.model.RelayMode;
import com.rms.relay.core.model.RelayView;
import com.rms.relay.core.port.LocalBus;
import com.rms.relay.core.port.RelayStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * =====================================================================
 * RelayRegistry
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The authoritative set of relays, keyed by channel name, and the sole
 * owner of every {@link RelayEntity}.
 *
 * INVARIANTS
 * ----------
 *  - At most one entity per channel name.
 *  - Registry mutation, mode change and rebind form one critical section;
 *    a changed mode without matching handles is never observable.
 *  - A BIDIRECTIONAL relay is never downgraded by {@link #register}.
 *
 * MERGE RULE (register)
 * ---------------------
 *
 *   absent                                    → create + bind
 *   present, same mode                        → no-op
 *   present, current mode BIDIRECTIONAL       → no-op
 *   present, different mode                   → change mode + rebind
 *
 * The payload type of an existing relay is never changed by a request;
 * a conflicting type surfaces as a channel mismatch on delivery.
 *
 * PERSISTENCE
 * -----------
 * Every successful mutation writes a full snapshot through the
 * {@link RelayStateStore}, synchronously, on the mutating thread.
 * A failed write is logged; the in-memory state stays authoritative.
 */
public class RelayRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayRegistry.class);

    private final LocalBus bus;
    private final CloudForwarder forwarder;
    private final RelayStateStore store;

    private final Object lock = new Object();

    /** Guarded by {@link #lock}. Insertion order gives a stable snapshot order. */
    private final Map<String, RelayEntity> relays = new LinkedHashMap<>();

    public RelayRegistry(LocalBus bus, CloudForwarder forwarder, RelayStateStore store) {
        this.bus = bus;
        this.forwarder = forwarder;
        this.store = store;
    }

    public Optional<RelayEntity> find(String channel) {
        synchronized (lock) {
            return Optional.ofNullable(relays.get(channel));
        }
    }

    /**
     * Creates, updates or keeps the relay for {@code channel}.
     *
     * @throws com.rms.relay.core.error.InvalidSchemaException if a new relay's type does not resolve
     */
    public RelayEntity register(String channel, String payloadType, RelayMode mode) {
        synchronized (lock) {
            Applied applied = apply(new ChannelDescriptor(channel, payloadType, mode));
            if (applied.mutated()) {
                persist();
            }
            return applied.entity();
        }
    }

    private Applied apply(ChannelDescriptor requested) {
        RelayEntity existing = relays.get(requested.channel());
        if (existing == null) {
            RelayEntity created = RelayEntity.create(requested, bus, forwarder);
            relays.put(requested.channel(), created);
            log.info("Relay created: {}", requested);
            return new Applied(created, true);
        }

        ChannelDescriptor current = existing.descriptor();
        if (current.mode() == RelayMode.BIDIRECTIONAL || current.mode() == requested.mode()) {
            if (!current.payloadType().equals(requested.payloadType())) {
                log.warn("Relay {} keeps its type; requested {}", current, requested.payloadType());
            } else {
                log.debug("Relay unchanged: {} (requested {})", current, requested.mode());
            }
            return new Applied(existing, false);
        }

        existing.changeMode(requested.mode());
        log.info("Relay updated: {} -> {}", current, existing.descriptor());
        return new Applied(existing, true);
    }

    private record Applied(RelayEntity entity, boolean mutated) {
    }

    /**
     * Returns the relay for an inbound cloud message, creating a
     * {@link RelayMode#TO_LOCAL} relay when the channel has never been seen.
     */
    public RelayEntity routeInbound(String channel, String payloadType) {
        synchronized (lock) {
            RelayEntity existing = relays.get(channel);
            if (existing != null) {
                return existing;
            }
            log.info("No relay for inbound topic {}; creating {} relay", channel, RelayMode.TO_LOCAL);
            return register(channel, payloadType, RelayMode.TO_LOCAL);
        }
    }

    /**
     * Replays persisted descriptors in order. Runs once at startup, before
     * any bus or cloud callback is live. A failing descriptor is logged and
     * skipped. The snapshot is written once, after the replay.
     *
     * @return number of descriptors restored
     */
    public int restore(List<ChannelDescriptor> persisted) {
        int restored = 0;
        synchronized (lock) {
            for (ChannelDescriptor d : persisted) {
                try {
                    apply(d);
                    restored++;
                } catch (RuntimeException e) {
                    log.error("Skipping persisted relay {}: {}", d, e.getMessage());
                }
            }
            if (!persisted.isEmpty()) {
                persist();
            }
        }
        log.info("Restored {}/{} persisted relays", restored, persisted.size());
        return restored;
    }

    /** Current descriptors in creation order. */
    public List<ChannelDescriptor> snapshot() {
        synchronized (lock) {
            List<ChannelDescriptor> out = new ArrayList<>(relays.size());
            for (RelayEntity e : relays.values()) {
                out.add(e.descriptor());
            }
            return out;
        }
    }

    public List<RelayView> views() {
        synchronized (lock) {
            List<RelayView> out = new ArrayList<>(relays.size());
            for (RelayEntity e : relays.values()) {
                out.add(e.view());
            }
            return out;
        }
    }

    public int size() {
        synchronized (lock) {
            return relays.size();
        }
    }

    /**
     * Writes the current snapshot to the store.
     */
    public void persist() {
        List<ChannelDescriptor> snapshot = snapshot();
        try {
            store.write(snapshot);
            log.debug("Persisted {} relays", snapshot.size());
        } catch (RuntimeException e) {
            log.error("Failed to persist relay state ({} relays): {}", snapshot.size(), e.toString(), e);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            for (RelayEntity e : relays.values()) {
                e.close();
            }
            log.info("Released {} relays", relays.size());
        }
    }
}
