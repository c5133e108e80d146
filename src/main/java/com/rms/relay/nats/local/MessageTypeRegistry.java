package com.rms.relay.nats.local;

import com.rms.relay.core.error.InvalidSchemaException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup from type reference to {@link MessageType}.
 *
 * <h2>Purpose</h2>
 * Type references arriving in desired state and inbound envelopes are plain
 * strings. They are resolved against this registry only; nothing is loaded
 * by name at runtime.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>A built-in set of common {@code std_msgs} / {@code geometry_msgs} types.</li>
 *   <li>Types declared in configuration ({@code cloudrelay.local.message-types}),
 *       which may override built-ins.</li>
 * </ul>
 */
public class MessageTypeRegistry {

    private final Map<String, MessageType> types = new ConcurrentHashMap<>();

    public static MessageTypeRegistry withBuiltins() {
        MessageTypeRegistry r = new MessageTypeRegistry();
        r.register(new MessageType("std_msgs/Empty", Map.of()));
        r.register(new MessageType("std_msgs/String", Map.of("data", FieldKind.STRING)));
        r.register(new MessageType("std_msgs/Bool", Map.of("data", FieldKind.BOOL)));
        for (String t : new String[] {"Int8", "Int16", "Int32", "Int64", "UInt8", "UInt16", "UInt32", "UInt64"}) {
            r.register(new MessageType("std_msgs/" + t, Map.of("data", FieldKind.INT)));
        }
        r.register(new MessageType("std_msgs/Float32", Map.of("data", FieldKind.FLOAT)));
        r.register(new MessageType("std_msgs/Float64", Map.of("data", FieldKind.FLOAT)));
        r.register(new MessageType("std_msgs/Header", ordered(
                "seq", FieldKind.INT, "stamp", FieldKind.OBJECT, "frame_id", FieldKind.STRING)));

        Map<String, FieldKind> xyz = ordered("x", FieldKind.FLOAT, "y", FieldKind.FLOAT, "z", FieldKind.FLOAT);
        r.register(new MessageType("geometry_msgs/Vector3", xyz));
        r.register(new MessageType("geometry_msgs/Point", xyz));
        Map<String, FieldKind> quaternion = new LinkedHashMap<>(xyz);
        quaternion.put("w", FieldKind.FLOAT);
        r.register(new MessageType("geometry_msgs/Quaternion", quaternion));
        r.register(new MessageType("geometry_msgs/Twist", ordered(
                "linear", FieldKind.OBJECT, "angular", FieldKind.OBJECT)));
        r.register(new MessageType("geometry_msgs/Pose", ordered(
                "position", FieldKind.OBJECT, "orientation", FieldKind.OBJECT)));
        return r;
    }

    public void register(MessageType type) {
        types.put(type.name(), type);
    }

    public Optional<MessageType> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(types.get(name));
    }

    public MessageType resolve(String name) {
        return find(name).orElseThrow(() -> new InvalidSchemaException(name));
    }

    public Set<String> names() {
        return Set.copyOf(types.keySet());
    }

    private static Map<String, FieldKind> ordered(String k1, FieldKind v1, String k2, FieldKind v2) {
        Map<String, FieldKind> m = new LinkedHashMap<>();
        m.put(k1, v1);
        m.put(k2, v2);
        return m;
    }

    private static Map<String, FieldKind> ordered(String k1, FieldKind v1, String k2, FieldKind v2,
                                                  String k3, FieldKind v3) {
        Map<String, FieldKind> m = ordered(k1, v1, k2, v2);
        m.put(k3, v3);
        return m;
    }
}
