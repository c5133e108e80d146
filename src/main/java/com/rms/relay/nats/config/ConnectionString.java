package com.rms.relay.nats.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed cloud connection string.
 *
 * <p>Format: semicolon-separated {@code Key=Value} pairs, keys
 * case-insensitive:</p>
 * <pre>
 * Server=tls://cloud.example.com:4222;DeviceId=robot-01;Token=...
 * Server=nats://localhost:4222;DeviceId=robot-01;User=robot;Password=...
 * </pre>
 *
 * <ul>
 *   <li>{@code Server} and {@code DeviceId} are required.</li>
 *   <li>{@code Token}, {@code User}/{@code Password} and {@code Creds} are optional.</li>
 *   <li>A {@code tls://} server or {@code Tls=true} enables TLS.</li>
 * </ul>
 *
 * <p>Parsing failures throw {@link IllegalArgumentException}; at startup
 * this fails the application context before any relay is bound.</p>
 */
public record ConnectionString(
        String server,
        String deviceId,
        String token,
        String user,
        String password,
        String creds,
        boolean tls) {

    public static ConnectionString parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Cloud connection string is not set");
        }
        Map<String, String> parts = new LinkedHashMap<>();
        for (String segment : raw.split(";")) {
            if (segment.isBlank()) {
                continue;
            }
            int eq = segment.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed connection string segment (expected Key=Value)");
            }
            // values may contain '=' (base64 tokens), so split on the first one only
            String key = segment.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = segment.substring(eq + 1).trim();
            parts.put(key, value);
        }

        String server = parts.get("server");
        String deviceId = parts.get("deviceid");
        if (server == null || server.isBlank()) {
            throw new IllegalArgumentException("Connection string is missing Server");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Connection string is missing DeviceId");
        }
        boolean tls = server.toLowerCase(Locale.ROOT).startsWith("tls://")
                || Boolean.parseBoolean(parts.getOrDefault("tls", "false"));

        return new ConnectionString(server, deviceId,
                blankToNull(parts.get("token")),
                blankToNull(parts.get("user")),
                blankToNull(parts.get("password")),
                blankToNull(parts.get("creds")),
                tls);
    }

    /** Version safe for logs: secrets removed. */
    @Override
    public String toString() {
        return "ConnectionString[server=" + server
                + ", deviceId=" + deviceId
                + ", token=" + (token == null ? "none" : "***")
                + ", user=" + (user == null ? "none" : mask(user))
                + ", creds=" + (creds == null ? "none" : creds)
                + ", tls=" + tls + "]";
    }

    /**
     * Light obfuscation for identifiers in logs, e.g. "admin" -> "a***n".
     */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v;
    }
}
