package io.meshgraph.model;

import java.util.List;

/**
 * Ordered hop list of one traceroute probe. {@code hops.get(i) -> hops.get(i + 1)} is a
 * directed edge; the list is kept in traversal order.
 */
public record TracerouteRecord(
        long id,
        long originId,
        List<Long> hops,
        long timestampMs
) implements MeshEvent {

    public TracerouteRecord {
        hops = hops == null ? List.of() : List.copyOf(hops);
    }

    @Override
    public Kind kind() {
        return Kind.TRACEROUTE;
    }
}
