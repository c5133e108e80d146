package com.rms.relay.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.model.ChannelDescriptor;
import com.rms.relay.core.model.RelayMode;
import com.rms.relay.core.port.RelayStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link RelayStateStore} backed by a JSON file.
 *
 * <h2>Format</h2>
 * <pre>
 * [ { "topic": "/odom", "msg_type": "geometry_msgs/Twist", "relay_mode": 2 }, ... ]
 * </pre>
 *
 * <h2>Write behavior</h2>
 * The snapshot is written to a sibling temp file and moved over the target,
 * atomically where the file system supports it, so a crash never leaves a
 * half-written file behind.
 *
 * <h2>Read behavior</h2>
 * <ul>
 *   <li>No file: empty (first run).</li>
 *   <li>Unreadable file: logged, empty; the relay starts without restored state.</li>
 *   <li>Entries with an unknown relay mode or missing fields are skipped.</li>
 * </ul>
 */
public class FileRelayStateStore implements RelayStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileRelayStateStore.class);

    private static final TypeReference<List<PersistedRelay>> LIST_TYPE = new TypeReference<>() { };

    private final Path file;
    private final ObjectMapper mapper;

    public FileRelayStateStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    /** Persisted triple; field names are the on-disk contract. */
    record PersistedRelay(
            @JsonProperty("topic") String topic,
            @JsonProperty("msg_type") String msgType,
            @JsonProperty("relay_mode") int relayMode) {
    }

    @Override
    public synchronized void write(List<ChannelDescriptor> descriptors) {
        List<PersistedRelay> rows = new ArrayList<>(descriptors.size());
        for (ChannelDescriptor d : descriptors) {
            rows.add(new PersistedRelay(d.channel(), d.payloadType(), d.mode().code()));
        }
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), rows);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write relay state to " + file, e);
        }
    }

    @Override
    public synchronized Optional<List<ChannelDescriptor>> read() {
        if (!Files.exists(file)) {
            log.info("No relay state at {} (first run)", file);
            return Optional.empty();
        }
        List<PersistedRelay> rows;
        try {
            rows = mapper.readValue(file.toFile(), LIST_TYPE);
        } catch (IOException e) {
            log.error("Unreadable relay state at {}; starting without restored relays: {}", file, e.getMessage());
            return Optional.empty();
        }

        List<ChannelDescriptor> out = new ArrayList<>();
        for (PersistedRelay row : rows == null ? List.<PersistedRelay>of() : rows) {
            if (row == null) {
                log.warn("Skipping empty persisted relay entry in {}", file);
                continue;
            }
            Optional<RelayMode> mode = RelayMode.fromCode(row.relayMode());
            if (isBlank(row.topic()) || isBlank(row.msgType()) || mode.isEmpty()) {
                log.warn("Skipping invalid persisted relay {}", row);
                continue;
            }
            out.add(new ChannelDescriptor(row.topic(), row.msgType(), mode.get()));
        }
        log.info("Read {} relays from {}", out.size(), file);
        return Optional.of(out);
    }

    public Path file() {
        return file;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
