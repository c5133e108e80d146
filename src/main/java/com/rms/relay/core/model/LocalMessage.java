package com.rms.relay.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A message as seen on the local bus: its resolved type name and its decoded
 * body.
 */
public record LocalMessage(String type, JsonNode body) {
}
