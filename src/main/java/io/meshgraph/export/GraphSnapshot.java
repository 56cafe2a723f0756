package io.meshgraph.export;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshgraph.model.NodeIds;
import io.meshgraph.util.Jsons;

import java.util.List;

/**
 * One exported graph: node records first, then edge records, each wrapped in
 * {@code {"data": {...}}} as the visualization expects.
 */
public record GraphSnapshot(
        ViewKind view,
        long startMs,
        long endMs,
        List<GraphNode> nodes,
        List<GraphEdge> edges
) {
    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public GraphNode node(long nodeId) {
        for (GraphNode node : nodes) {
            if (node.nodeId() == nodeId) {
                return node;
            }
        }
        return null;
    }

    public GraphEdge edge(long source, long target) {
        for (GraphEdge edge : edges) {
            if (edge.source() == source && edge.target() == target) {
                return edge;
            }
        }
        return null;
    }

    public ArrayNode toJson() {
        ArrayNode out = Jsons.mapper().createArrayNode();
        for (GraphNode node : nodes) {
            ObjectNode data = out.addObject().putObject("data");
            data.put("id", NodeIds.format(node.nodeId()));
            data.put("label", node.label());
            data.put("connections", node.connections());
            data.put("role", node.role());
        }
        for (GraphEdge edge : edges) {
            ObjectNode data = out.addObject().putObject("data");
            data.put("id", edge.id());
            data.put("source", NodeIds.format(edge.source()));
            data.put("target", NodeIds.format(edge.target()));
            data.put("rssi", edge.rssi());
            data.put("count", edge.count());
            if (edge.snr() != null) {
                data.put("snr", edge.snr());
            }
            if (edge.weight() != null) {
                data.put("weight", edge.weight());
            }
        }
        return out;
    }

    public record GraphNode(long nodeId, String label, int connections, String role) {
    }

    /**
     * @param snr    latest reported SNR, neighbor views only
     * @param weight 2 when the latest SNR is positive, else 1; neighbor views only
     */
    public record GraphEdge(long source, long target, Double rssi, int count, Double snr, Integer weight) {

        public String id() {
            return NodeIds.format(source) + "_" + NodeIds.format(target);
        }
    }
}
