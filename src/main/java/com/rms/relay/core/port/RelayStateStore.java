package com.rms.relay.core.port;

import com.rms.relay.core.model.ChannelDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for the registry's descriptor list.
 *
 * <p>{@link #read()} is called once at startup and returns empty on a first
 * run. {@link #write(List)} replaces the previous snapshot as a whole.</p>
 */
public interface RelayStateStore {

    void write(List<ChannelDescriptor> descriptors);

    Optional<List<ChannelDescriptor>> read();
}
