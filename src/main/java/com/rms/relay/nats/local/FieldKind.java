package com.rms.relay.nats.local;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * JSON shape expected for one field of a message type.
 */
public enum FieldKind {
    STRING,
    INT,
    FLOAT,
    BOOL,
    OBJECT,
    ARRAY,
    ANY;

    public boolean accepts(JsonNode value) {
        return switch (this) {
            case STRING -> value.isTextual();
            case INT -> value.isIntegralNumber();
            case FLOAT -> value.isNumber();
            case BOOL -> value.isBoolean();
            case OBJECT -> value.isObject();
            case ARRAY -> value.isArray();
            case ANY -> !value.isMissingNode();
        };
    }

    /** Parses config values such as {@code string}, {@code float64} or {@code int32}. */
    public static FieldKind parse(String raw) {
        String s = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("int") || s.startsWith("uint")) return INT;
        if (s.startsWith("float") || s.equals("double")) return FLOAT;
        return switch (s) {
            case "string" -> STRING;
            case "bool", "boolean" -> BOOL;
            case "object", "time", "duration" -> OBJECT;
            case "array" -> ARRAY;
            case "any" -> ANY;
            default -> throw new IllegalArgumentException("Unknown field kind: " + raw);
        };
    }
}
