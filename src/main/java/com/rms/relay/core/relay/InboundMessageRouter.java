package com.rms.relay.core.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.relay.core.error.RelayException;
import com.rms.relay.core.model.CloudEnvelope;
import com.rms.relay.core.model.InboundOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes cloud-inbound envelopes to their relay by topic.
 *
 * <p>An unknown topic gets a {@code TO_LOCAL} relay (see
 * {@link RelayRegistry#routeInbound}). Envelopes without {@code topic},
 * {@code msg_type} or {@code payload}, type mismatches and payloads that do
 * not fit their schema are rejected without any publish.</p>
 */
public class InboundMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageRouter.class);

    private final RelayRegistry registry;

    public InboundMessageRouter(RelayRegistry registry) {
        this.registry = registry;
    }

    public InboundOutcome route(JsonNode body) {
        if (body == null || !body.isObject()) {
            log.warn("Rejected inbound cloud message: body is not a JSON object");
            return InboundOutcome.REJECTED;
        }
        String topic = text(body, CloudEnvelope.FIELD_TOPIC);
        String msgType = text(body, CloudEnvelope.FIELD_MSG_TYPE);
        JsonNode payload = body.get(CloudEnvelope.FIELD_PAYLOAD);
        if (topic == null || msgType == null || payload == null || payload.isNull()) {
            log.warn("Rejected inbound cloud message: topic, msg_type and payload are required (topic={}, msg_type={})",
                    topic, msgType);
            return InboundOutcome.REJECTED;
        }

        try {
            RelayEntity relay = registry.routeInbound(topic, msgType);
            return relay.deliverFromCloud(topic, msgType, payload)
                    ? InboundOutcome.ACCEPTED
                    : InboundOutcome.ABANDONED;
        } catch (RelayException e) {
            log.warn("Rejected inbound cloud message for {}: {}", topic, e.getMessage());
            return InboundOutcome.REJECTED;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            return null;
        }
        return v.asText();
    }
}
