package com.rms.relay.nats.local;

/**
 * Maps channel names to NATS subjects.
 *
 * <p>Path-style names are accepted: {@code /robot/odom} becomes
 * {@code robot.odom}. Subjects must not contain whitespace or wildcards.</p>
 */
public final class Subjects {

    private Subjects() {
    }

    public static String fromChannel(String channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel is required");
        }
        String s = channel.trim();
        while (s.startsWith("/")) {
            s = s.substring(1);
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        s = s.replace('/', '.');
        if (s.isEmpty() || s.contains("..") || s.startsWith(".") || s.endsWith(".")) {
            throw new IllegalArgumentException("Invalid channel name: " + channel);
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '*' || c == '>') {
                throw new IllegalArgumentException("Invalid channel name: " + channel);
            }
        }
        return s;
    }

    public static String service(String prefix, String name) {
        String svc = fromChannel(name);
        return (prefix == null || prefix.isBlank()) ? svc : prefix + "." + svc;
    }
}
