package com.rms.relay.app.admin;

import com.rms.relay.app.RelayBootstrapCompleteEvent;
import com.rms.relay.core.model.ChannelDescriptor;
import com.rms.relay.core.model.RelayView;
import com.rms.relay.core.relay.CloudForwarder;
import com.rms.relay.core.relay.RelayRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Read-only diagnostics for the running relay.
 *
 * Enabled by default; disable via:
 *   cloudrelay.admin.enabled=false
 *
 * Topics are path-style ({@code /robot/odom}), so single-relay lookup takes
 * the topic as a query parameter.
 */
@RestController
@RequestMapping(path = "/relays", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "cloudrelay.admin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RelayAdminController {

    private final RelayRegistry registry;
    private final CloudForwarder forwarder;

    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final AtomicInteger restored = new AtomicInteger();

    public RelayAdminController(RelayRegistry registry, CloudForwarder forwarder) {
        this.registry = registry;
        this.forwarder = forwarder;
    }

    @EventListener
    public void onBootstrapComplete(RelayBootstrapCompleteEvent event) {
        restored.set(event.restoredRelays());
        ready.set(true);
    }

    @GetMapping
    public List<RelayView> relays() {
        return registry.views();
    }

    @GetMapping("/lookup")
    public ResponseEntity<RelayView> lookup(@RequestParam("topic") String topic) {
        return registry.find(topic)
                .map(relay -> ResponseEntity.ok(relay.view()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Descriptor triples exactly as they are persisted.
     */
    @GetMapping("/snapshot")
    public List<Map<String, Object>> snapshot() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ChannelDescriptor d : registry.snapshot()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("topic", d.channel());
            row.put("msg_type", d.payloadType());
            row.put("relay_mode", d.mode().code());
            out.add(row);
        }
        return out;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ready", ready.get());
        out.put("restored", restored.get());
        out.put("relays", registry.size());
        out.put("sent", forwarder.sentCount());
        out.put("dropped", forwarder.droppedCount());
        out.put("failed", forwarder.failedCount());
        return out;
    }
}
