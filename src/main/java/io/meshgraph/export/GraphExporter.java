package io.meshgraph.export;

import io.meshgraph.model.EntityKind;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.model.NeighborReport;
import io.meshgraph.model.NodeIds;
import io.meshgraph.model.NodeRecord;
import io.meshgraph.model.NodeRole;
import io.meshgraph.model.TracerouteRecord;
import io.meshgraph.storage.MeshStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the graph of one view over the window {@code [now - window, now]}.
 *
 * <p>Only pairs whose endpoints are both unicast node ids take part. Nodes and edges
 * come out sorted by id so that an unchanged window exports byte-identical JSON.
 */
public final class GraphExporter {
    private final MeshStore store;
    private final Clock clock;
    private final RssiPolicy rssiPolicy;

    public GraphExporter(MeshStore store, Clock clock, RssiPolicy rssiPolicy) {
        this.store = store;
        this.clock = clock;
        this.rssiPolicy = rssiPolicy == null ? RssiPolicy.LATEST : rssiPolicy;
    }

    public GraphSnapshot export(ViewKind view, Duration window) {
        long endMs = clock.millis();
        long startMs = endMs - window.toMillis();
        TreeSet<Long> participants = new TreeSet<>();
        TreeMap<EdgeKey, EdgeStats> edges = new TreeMap<>();

        switch (view) {
            case MESSAGES, PHYSICAL_SENDERS -> {
                for (MeshMessage m : store.queryRange(EntityKind.MESSAGES, startMs, endMs)) {
                    long source = view == ViewKind.MESSAGES ? m.fromId() : m.physicalSenderId();
                    EdgeStats stats = qualify(source, m.toId(), participants, edges);
                    if (stats != null) {
                        stats.addRssi(m.rssi(), m.timestampMs(), m.id());
                    }
                }
            }
            case NEIGHBORS -> {
                for (NeighborReport r : store.queryRange(EntityKind.NEIGHBORS, startMs, endMs)) {
                    EdgeStats stats = qualify(r.reporterId(), r.neighborId(), participants, edges);
                    if (stats != null) {
                        stats.addSnr(r.snr(), r.timestampMs());
                    }
                }
            }
            case TRACEROUTES -> {
                for (TracerouteRecord t : store.queryRange(EntityKind.TRACEROUTES, startMs, endMs)) {
                    List<Long> hops = t.hops();
                    for (int i = 0; i + 1 < hops.size(); i++) {
                        qualify(hops.get(i), hops.get(i + 1), participants, edges);
                    }
                }
            }
        }

        Map<Long, Integer> connections = new TreeMap<>();
        for (Long id : participants) {
            connections.put(id, 0);
        }
        List<GraphSnapshot.GraphEdge> edgeOut = new ArrayList<>(edges.size());
        for (Map.Entry<EdgeKey, EdgeStats> e : edges.entrySet()) {
            EdgeKey key = e.getKey();
            EdgeStats stats = e.getValue();
            connections.merge(key.source(), 1, Integer::sum);
            connections.merge(key.target(), 1, Integer::sum);
            boolean neighbors = view == ViewKind.NEIGHBORS;
            edgeOut.add(new GraphSnapshot.GraphEdge(
                    key.source(),
                    key.target(),
                    stats.rssi(rssiPolicy),
                    stats.count,
                    neighbors ? stats.latestSnr : null,
                    neighbors ? (stats.latestSnr != null && stats.latestSnr > 0 ? 2 : 1) : null
            ));
        }

        Map<Long, NodeRecord> known = store.findNodes(participants);
        List<GraphSnapshot.GraphNode> nodeOut = new ArrayList<>(participants.size());
        for (Map.Entry<Long, Integer> e : connections.entrySet()) {
            NodeRecord record = known.get(e.getKey());
            String label = record == null ? NodeIds.format(e.getKey()) : record.label();
            NodeRole role = record == null || record.role() == null ? NodeRole.UNKNOWN : record.role();
            nodeOut.add(new GraphSnapshot.GraphNode(e.getKey(), label, e.getValue(), role.label()));
        }
        return new GraphSnapshot(view, startMs, endMs, nodeOut, edgeOut);
    }

    /**
     * Registers the participants of a qualifying pair and returns its edge accumulator, or
     * {@code null} when the pair does not qualify or is a self-loop.
     */
    private static EdgeStats qualify(long source, long target, TreeSet<Long> participants, TreeMap<EdgeKey, EdgeStats> edges) {
        if (!NodeIds.isUnicast(source) || !NodeIds.isUnicast(target)) {
            return null;
        }
        participants.add(source);
        participants.add(target);
        if (source == target) {
            return null;
        }
        EdgeStats stats = edges.computeIfAbsent(new EdgeKey(source, target), k -> new EdgeStats());
        stats.count++;
        return stats;
    }

    private record EdgeKey(long source, long target) implements Comparable<EdgeKey> {
        @Override
        public int compareTo(EdgeKey o) {
            int c = Long.compare(source, o.source);
            return c != 0 ? c : Long.compare(target, o.target);
        }
    }

    private static final class EdgeStats {
        int count;
        Double latestRssi;
        long latestRssiTs = Long.MIN_VALUE;
        long latestRssiId;
        double rssiSum;
        int rssiSamples;
        Double latestSnr;
        long latestSnrTs = Long.MIN_VALUE;

        void addRssi(Double rssi, long timestampMs, long messageId) {
            if (rssi == null) {
                return;
            }
            rssiSum += rssi;
            rssiSamples++;
            if (timestampMs > latestRssiTs
                    || (timestampMs == latestRssiTs && Long.compareUnsigned(messageId, latestRssiId) > 0)) {
                latestRssi = rssi;
                latestRssiTs = timestampMs;
                latestRssiId = messageId;
            }
        }

        void addSnr(Double snr, long timestampMs) {
            if (snr != null && timestampMs >= latestSnrTs) {
                latestSnr = snr;
                latestSnrTs = timestampMs;
            }
        }

        Double rssi(RssiPolicy policy) {
            if (rssiSamples == 0) {
                return null;
            }
            return policy == RssiPolicy.MEAN ? rssiSum / rssiSamples : latestRssi;
        }
    }
}
