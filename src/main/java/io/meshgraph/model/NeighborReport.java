package io.meshgraph.model;

public record NeighborReport(
        long reporterId,
        long neighborId,
        Double snr,
        long timestampMs
) implements MeshEvent {

    @Override
    public Kind kind() {
        return Kind.NEIGHBOR_REPORT;
    }
}
