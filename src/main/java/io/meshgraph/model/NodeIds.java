package io.meshgraph.model;

public final class NodeIds {
    public static final long BROADCAST = 0xFFFFFFFFL;
    private static final long MIN_UNICAST = 2L;
    private static final long MAX_UNICAST = 0xFFFFFFFEL;

    private NodeIds() {
    }

    public static boolean isUnicast(long nodeId) {
        return nodeId >= MIN_UNICAST && nodeId <= MAX_UNICAST;
    }

    public static String format(long nodeId) {
        return "!" + Long.toHexString(nodeId);
    }

    /**
     * Accepts {@code !a1b2c3d4}, bare hex with letters, or a decimal number.
     */
    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
        String value = raw.trim();
        if (value.startsWith("!")) {
            return Long.parseLong(value.substring(1), 16);
        }
        if (value.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(value);
        }
        return Long.parseLong(value, 16);
    }
}
