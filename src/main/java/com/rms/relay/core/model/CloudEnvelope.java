package com.rms.relay.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Message body exchanged with the cloud channel in both directions:
 *
 * <pre>
 * { "topic": "&lt;channel&gt;", "msg_type": "&lt;type-ref&gt;", "payload": &lt;schema-specific JSON&gt; }
 * </pre>
 *
 * Outbound envelopes are additionally tagged with a {@code topic} header on the
 * transport message so the cloud side can route without parsing the body.
 */
public record CloudEnvelope(String topic, String msgType, JsonNode payload) {

    public static final String FIELD_TOPIC = "topic";
    public static final String FIELD_MSG_TYPE = "msg_type";
    public static final String FIELD_PAYLOAD = "payload";
}
