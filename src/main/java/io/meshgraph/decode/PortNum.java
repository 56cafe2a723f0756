package io.meshgraph.decode;

import java.util.Locale;

/**
 * Application port numbers of the mesh firmware and the message-type tag stored for each.
 */
public enum PortNum {
    TEXT(1, "text"),
    POSITION(3, "position"),
    NODEINFO(4, "nodeinfo"),
    ROUTING(5, "routing"),
    ADMIN(6, "admin"),
    WAYPOINT(8, "waypoint"),
    DETECTION_SENSOR(10, "detection_sensor"),
    PAXCOUNTER(34, "paxcounter"),
    STORE_FORWARD(65, "store_forward"),
    RANGE_TEST(66, "range_test"),
    TELEMETRY(67, "telemetry"),
    TRACEROUTE(70, "traceroute"),
    NEIGHBORINFO(71, "neighborinfo"),
    MAP_REPORT(73, "map_report"),
    UNKNOWN(-1, "unknown");

    /** Tag of a packet whose payload could not be decrypted with any configured key. */
    public static final String ENCRYPTED_TAG = "encrypted";

    private final int number;
    private final String tag;

    PortNum(int number, String tag) {
        this.number = number;
        this.tag = tag;
    }

    public int number() {
        return number;
    }

    public String tag() {
        return tag;
    }

    public static PortNum fromNumber(int number) {
        for (PortNum port : values()) {
            if (port.number == number) {
                return port;
            }
        }
        return UNKNOWN;
    }

    /**
     * Resolves the {@code type} string of a JSON envelope. Accepts the short tag
     * ({@code neighborinfo}) as well as the firmware enum name ({@code NEIGHBORINFO_APP}).
     */
    public static PortNum fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.endsWith("_app")) {
            value = value.substring(0, value.length() - 4);
        }
        if ("text_message".equals(value)) {
            return TEXT;
        }
        for (PortNum port : values()) {
            if (port.tag.equals(value)) {
                return port;
            }
        }
        return UNKNOWN;
    }
}
