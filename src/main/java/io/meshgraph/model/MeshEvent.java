package io.meshgraph.model;

/**
 * A decoded broker event on its way to the store.
 *
 * <p>The set of variants is closed: {@link MeshMessage}, {@link NeighborReport},
 * {@link TracerouteRecord}, {@link NodeInfoUpdate} and {@link UnknownEvent}. Callers
 * dispatch on {@link #kind()} and must handle {@link Kind#UNKNOWN} explicitly.
 */
public interface MeshEvent {

    Kind kind();

    long timestampMs();

    enum Kind {
        MESSAGE,
        NEIGHBOR_REPORT,
        TRACEROUTE,
        NODE_INFO,
        UNKNOWN
    }
}
