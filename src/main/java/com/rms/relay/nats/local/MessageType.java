package com.rms.relay.nats.local;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A registered message schema: a type name and the fields every payload of
 * that type must carry. Extra fields are allowed.
 */
public record MessageType(String name, Map<String, FieldKind> fields) {

    public MessageType {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("type name is required");
        }
        fields = fields == null ? Map.of() : new LinkedHashMap<>(fields);
    }

    /**
     * Checks a payload against this type.
     *
     * @return violations, empty when the payload fits
     */
    public List<String> validate(JsonNode payload) {
        List<String> problems = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            problems.add("payload must be a JSON object");
            return problems;
        }
        for (Map.Entry<String, FieldKind> f : fields.entrySet()) {
            JsonNode v = payload.get(f.getKey());
            if (v == null) {
                problems.add("missing field '" + f.getKey() + "'");
            } else if (!f.getValue().accepts(v)) {
                problems.add("field '" + f.getKey() + "' is not " + f.getValue().name().toLowerCase());
            }
        }
        return problems;
    }
}
