package com.rms.relay.nats.cloud;

/**
 * Device-scoped subject namespace on the cloud endpoint.
 *
 * <pre>
 * devices.&lt;id&gt;.twin.desired            cloud → relay  desired-state pushes
 * devices.&lt;id&gt;.twin.get                relay → cloud  full desired-state request
 * devices.&lt;id&gt;.twin.reported           relay → cloud  reported state
 * devices.&lt;id&gt;.messages.devicebound    cloud → relay  inbound envelopes
 * devices.&lt;id&gt;.messages.events         relay → cloud  outbound envelopes
 * devices.&lt;id&gt;.methods.&lt;name&gt;         cloud → relay  command request/reply
 * </pre>
 */
public record CloudSubjects(String deviceId) {

    public CloudSubjects {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        for (int i = 0; i < deviceId.length(); i++) {
            char c = deviceId.charAt(i);
            if (c == '.' || c == '*' || c == '>' || Character.isWhitespace(c)) {
                throw new IllegalArgumentException("deviceId is not a valid subject token: " + deviceId);
            }
        }
    }

    private String base() {
        return "devices." + deviceId;
    }

    public String desired() {
        return base() + ".twin.desired";
    }

    public String twinGet() {
        return base() + ".twin.get";
    }

    public String reported() {
        return base() + ".twin.reported";
    }

    public String deviceBound() {
        return base() + ".messages.devicebound";
    }

    public String events() {
        return base() + ".messages.events";
    }

    public String methods() {
        return base() + ".methods.*";
    }

    /** Method name of a command subject, or null if the subject is not one. */
    public String methodName(String subject) {
        String prefix = base() + ".methods.";
        if (subject == null || !subject.startsWith(prefix) || subject.length() == prefix.length()) {
            return null;
        }
        return subject.substring(prefix.length());
    }
}
