package io.meshgraph.model;

/**
 * Partial node update. Null fields are "not carried by this packet" and leave the stored
 * value untouched.
 */
public record NodeInfoUpdate(
        long nodeId,
        String longName,
        String shortName,
        Integer hardware,
        NodeRole role,
        Double latitude,
        Double longitude,
        long timestampMs
) implements MeshEvent {

    public static NodeInfoUpdate identity(
            long nodeId,
            String longName,
            String shortName,
            Integer hardware,
            NodeRole role,
            long timestampMs
    ) {
        return new NodeInfoUpdate(nodeId, longName, shortName, hardware, role, null, null, timestampMs);
    }

    public static NodeInfoUpdate position(long nodeId, double latitude, double longitude, long timestampMs) {
        return new NodeInfoUpdate(nodeId, null, null, null, null, latitude, longitude, timestampMs);
    }

    @Override
    public Kind kind() {
        return Kind.NODE_INFO;
    }
}
