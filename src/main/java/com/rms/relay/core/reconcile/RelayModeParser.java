package com.rms.relay.core.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.relay.core.model.RelayMode;

import java.util.Optional;

/**
 * Decodes the {@code relay_mode} field of a desired-state entry.
 *
 * <p>Encodings are tried in order:</p>
 * <ol>
 *   <li>an integer in {@code [1,3]};</li>
 *   <li>a numeric string in {@code [1,3]};</li>
 *   <li>a symbolic name ({@code RELAY_MODE_TO_ROS}, {@code RELAY_MODE_TO_IOT_HUB},
 *       {@code RELAY_MODE_BIDIRECTIONAL}) or an enum constant name.</li>
 * </ol>
 */
public final class RelayModeParser {

    private RelayModeParser() {
    }

    public static Optional<RelayMode> parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? RelayMode.fromCode(node.asLong()) : Optional.empty();
        }
        if (!node.isTextual()) {
            return Optional.empty();
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return RelayMode.fromCode(Long.parseLong(raw));
        } catch (NumberFormatException notNumeric) {
            return RelayMode.fromSymbol(raw);
        }
    }
}
