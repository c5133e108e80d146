package com.rms.relay.core.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.relay.core.error.MalformedDesiredStateException;
import com.rms.relay.core.model.ChannelDescriptor;
import com.rms.relay.core.model.RelayMode;
import com.rms.relay.core.relay.RelayRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * DesiredStateReconciler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Applies a cloud-pushed desired-state document to the
 * {@link RelayRegistry}.
 *
 * DOCUMENT
 * --------
 *
 *   { "relays": { "<any key>": { "topic": "...", "msg_type": "...", "relay_mode": 1|"2"|"RELAY_MODE_*" } } }
 *
 *  - {@code ros_relays} is accepted in place of {@code relays}.
 *  - A full twin ({@code { "desired": { ... } }}) is unwrapped first.
 *  - Keys starting with {@code $} (twin metadata) are ignored.
 *
 * FAILURE MODEL
 * -------------
 * Partial-failure tolerant. A malformed entry or a rejected registration
 * is logged and skipped; the remaining entries are still applied.
 *
 * PERSISTENCE
 * -----------
 * A snapshot is written after every pass, whatever the outcome.
 */
public class DesiredStateReconciler {

    private static final Logger log = LoggerFactory.getLogger(DesiredStateReconciler.class);

    public static final String FIELD_RELAYS = "relays";
    public static final String FIELD_LEGACY_RELAYS = "ros_relays";
    public static final String FIELD_DESIRED = "desired";

    private final RelayRegistry registry;
    private final ObjectMapper mapper;

    public DesiredStateReconciler(RelayRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    public ReconcileReport reconcile(JsonNode document) {
        List<String> applied = new ArrayList<>();
        List<ReconcileReport.Skipped> skipped = new ArrayList<>();
        try {
            JsonNode relays = relaysOf(document);
            if (relays == null) {
                log.debug("Desired-state update without a relays section; nothing to reconcile");
            } else if (!relays.isObject()) {
                log.error("Desired-state '{}' must be an object, got {}", FIELD_RELAYS, relays.getNodeType());
            } else {
                Iterator<Map.Entry<String, JsonNode>> it = relays.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    if (entry.getKey().startsWith("$")) {
                        continue;
                    }
                    applyEntry(entry.getKey(), entry.getValue(), applied, skipped);
                }
            }
        } finally {
            registry.persist();
        }

        ReconcileReport report = new ReconcileReport(applied, skipped);
        log.info("Desired state reconciled: applied={} skipped={} relays={}",
                report.applied().size(), report.skipped().size(), registry.size());
        return report;
    }

    private void applyEntry(String key, JsonNode value,
                            List<String> applied, List<ReconcileReport.Skipped> skipped) {
        try {
            ChannelDescriptor d = toDescriptor(key, value);
            registry.register(d.channel(), d.payloadType(), d.mode());
            applied.add(key);
        } catch (RuntimeException e) {
            // one bad entry must not stop the others
            log.error("Skipping desired-state entry '{}': {}", key, e.getMessage());
            skipped.add(new ReconcileReport.Skipped(key, e.getMessage()));
        }
    }

    static ChannelDescriptor toDescriptor(String key, JsonNode value) {
        if (value == null || !value.isObject()) {
            throw new MalformedDesiredStateException(key, "entry is not an object");
        }
        String topic = requiredText(key, value, "topic");
        String msgType = requiredText(key, value, "msg_type");
        JsonNode rawMode = value.get("relay_mode");
        RelayMode mode = RelayModeParser.parse(rawMode)
                .orElseThrow(() -> new MalformedDesiredStateException(key, "unsupported relay_mode " + rawMode));
        return new ChannelDescriptor(topic, msgType, mode);
    }

    private static String requiredText(String key, JsonNode value, String field) {
        JsonNode v = value.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            throw new MalformedDesiredStateException(key, "missing " + field);
        }
        return v.asText();
    }

    private static JsonNode relaysOf(JsonNode document) {
        if (document == null || !document.isObject()) {
            return null;
        }
        JsonNode root = document;
        JsonNode desired = document.get(FIELD_DESIRED);
        if (desired != null && desired.isObject()) {
            root = desired;
        }
        JsonNode relays = root.get(FIELD_RELAYS);
        return relays != null ? relays : root.get(FIELD_LEGACY_RELAYS);
    }

    /**
     * Builds the reported-state document for the current registry:
     * {@code { "relays": { "<topic>": { topic, msg_type, relay_mode } } }}.
     */
    public JsonNode reportedState() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode relays = root.putObject(FIELD_RELAYS);
        for (ChannelDescriptor d : registry.snapshot()) {
            ObjectNode entry = relays.putObject(d.channel());
            entry.put("topic", d.channel());
            entry.put("msg_type", d.payloadType());
            entry.put("relay_mode", d.mode().code());
        }
        return root;
    }
}
