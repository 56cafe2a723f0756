package io.meshgraph.model;

import java.util.Locale;

public enum NodeRole {
    CLIENT("client"),
    ROUTER("router"),
    ROUTER_CLIENT("router-client"),
    REPEATER("repeater"),
    UNKNOWN("unknown");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Maps the device-config role number carried in node-info packets. CLIENT_MUTE and
     * CLIENT_HIDDEN are plain clients for graph purposes.
     */
    public static NodeRole fromWire(int value) {
        return switch (value) {
            case 0, 1, 8 -> CLIENT;
            case 2 -> ROUTER;
            case 3 -> ROUTER_CLIENT;
            case 4 -> REPEATER;
            default -> UNKNOWN;
        };
    }

    public static NodeRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String value = raw.trim();
        for (NodeRole role : values()) {
            if (role.name().equalsIgnoreCase(value) || role.label.equalsIgnoreCase(value)) {
                return role;
            }
        }
        String upper = value.toUpperCase(Locale.ROOT);
        if ("CLIENT_MUTE".equals(upper) || "CLIENT_HIDDEN".equals(upper)) {
            return CLIENT;
        }
        try {
            return fromWire(Integer.parseInt(value));
        } catch (NumberFormatException ignored) {
            return UNKNOWN;
        }
    }
}
