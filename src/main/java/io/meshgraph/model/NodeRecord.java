package io.meshgraph.model;

public record NodeRecord(
        long nodeId,
        String longName,
        String shortName,
        Integer hardware,
        NodeRole role,
        Long lastSeenMs,
        Double latitude,
        Double longitude
) {

    public String label() {
        if (shortName != null && !shortName.isBlank()) {
            return shortName;
        }
        if (longName != null && !longName.isBlank()) {
            return longName;
        }
        return NodeIds.format(nodeId);
    }
}
