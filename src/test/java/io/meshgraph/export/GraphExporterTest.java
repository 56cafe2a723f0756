package io.meshgraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshgraph.config.MeshGraphConfig;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.model.NeighborReport;
import io.meshgraph.model.NodeInfoUpdate;
import io.meshgraph.model.NodeRole;
import io.meshgraph.model.TracerouteRecord;
import io.meshgraph.storage.Database;
import io.meshgraph.storage.MeshStore;
import io.meshgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

final class GraphExporterTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final long T = NOW.toEpochMilli();
    private static final long MINUTE = 60_000L;
    private static final long A = 0x11111111L;
    private static final long B = 0x22222222L;
    private static final long C = 0x33333333L;
    private static final long BROADCAST = 0xFFFFFFFFL;

    @Test
    void repeatedMessagesCollapseIntoOneCountedEdge() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-messages-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(1L, T - 30 * MINUTE, A, B, A, -90.0));
            store.insertMessage(message(2L, T - 20 * MINUTE, A, B, A, -80.0));
            store.insertMessage(message(3L, T - 10 * MINUTE, A, B, A, -70.0));

            GraphSnapshot graph = exporter(store, RssiPolicy.LATEST).export(ViewKind.MESSAGES, Duration.ofHours(1));

            Assertions.assertEquals(List.of(A, B), graph.nodes().stream().map(GraphSnapshot.GraphNode::nodeId).toList());
            Assertions.assertEquals(1, graph.edges().size());
            GraphSnapshot.GraphEdge edge = graph.edge(A, B);
            Assertions.assertEquals(3, edge.count());
            Assertions.assertEquals(-70.0, edge.rssi());
            Assertions.assertEquals(1, graph.node(A).connections());
            Assertions.assertEquals(1, graph.node(B).connections());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tracerouteHopsBecomeConsecutiveEdges() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-traceroute-");
        try {
            MeshStore store = openStore(root);
            store.insertTraceroute(new TracerouteRecord(50L, A, List.of(A, B, C), T - 5 * MINUTE));

            GraphSnapshot graph = exporter(store, RssiPolicy.LATEST).export(ViewKind.TRACEROUTES, Duration.ofHours(1));

            Assertions.assertEquals(2, graph.edges().size());
            Assertions.assertEquals(1, graph.edge(A, B).count());
            Assertions.assertEquals(1, graph.edge(B, C).count());
            Assertions.assertNull(graph.edge(A, B).rssi());
            Assertions.assertEquals(2, graph.node(B).connections());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void broadcastAndOutOfWindowMessagesAreExcluded() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-filter-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(1L, T - 5 * MINUTE, A, BROADCAST, A, -60.0));
            store.insertMessage(message(2L, T - 2 * 60 * MINUTE, B, C, B, -60.0));
            store.insertMessage(message(3L, T - 5 * MINUTE, C, C, C, null));

            GraphSnapshot graph = exporter(store, RssiPolicy.LATEST).export(ViewKind.MESSAGES, Duration.ofHours(1));

            Assertions.assertTrue(graph.edges().isEmpty());
            Assertions.assertEquals(1, graph.nodes().size());
            Assertions.assertEquals(C, graph.nodes().get(0).nodeId());
            Assertions.assertEquals(0, graph.nodes().get(0).connections());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyWindowExportsEmptyArray() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-empty-");
        try {
            MeshStore store = openStore(root);

            GraphSnapshot graph = exporter(store, RssiPolicy.LATEST).export(ViewKind.NEIGHBORS, Duration.ofMinutes(15));

            Assertions.assertEquals(0, graph.toJson().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void physicalSenderViewUsesRadioTransmitter() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-physical-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(1L, T - MINUTE, A, C, B, -75.0));

            GraphExporter exporter = exporter(store, RssiPolicy.LATEST);
            GraphSnapshot logical = exporter.export(ViewKind.MESSAGES, Duration.ofHours(1));
            GraphSnapshot physical = exporter.export(ViewKind.PHYSICAL_SENDERS, Duration.ofHours(1));

            Assertions.assertNotNull(logical.edge(A, C));
            Assertions.assertNotNull(physical.edge(B, C));
            Assertions.assertNull(physical.edge(A, C));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rssiPolicyChoosesLatestOrMean() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-rssi-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(1L, T - 3 * MINUTE, A, B, A, -100.0));
            store.insertMessage(message(2L, T - 2 * MINUTE, A, B, A, -80.0));
            store.insertMessage(message(3L, T - 2 * MINUTE, A, B, A, -60.0));
            store.insertMessage(message(4L, T - MINUTE, A, B, A, null));

            GraphSnapshot latest = exporter(store, RssiPolicy.LATEST).export(ViewKind.MESSAGES, Duration.ofHours(1));
            GraphSnapshot mean = exporter(store, RssiPolicy.MEAN).export(ViewKind.MESSAGES, Duration.ofHours(1));

            // id 3 wins the tie on timestamp; the null sample does not count
            Assertions.assertEquals(-60.0, latest.edge(A, B).rssi());
            Assertions.assertEquals(-80.0, mean.edge(A, B).rssi(), 1e-9);
            Assertions.assertEquals(4, latest.edge(A, B).count());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void neighborEdgesCarrySnrAndWeight() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-neighbors-");
        try {
            MeshStore store = openStore(root);
            store.insertNeighborReport(new NeighborReport(A, B, -4.0, T - 10 * MINUTE));
            store.insertNeighborReport(new NeighborReport(A, B, 6.0, T - 5 * MINUTE));
            store.insertNeighborReport(new NeighborReport(B, C, -1.5, T - 5 * MINUTE));

            GraphSnapshot graph = exporter(store, RssiPolicy.LATEST).export(ViewKind.NEIGHBORS, Duration.ofHours(1));

            GraphSnapshot.GraphEdge ab = graph.edge(A, B);
            Assertions.assertEquals(2, ab.count());
            Assertions.assertEquals(6.0, ab.snr());
            Assertions.assertEquals(2, ab.weight());
            Assertions.assertNull(ab.rssi());
            Assertions.assertEquals(1, graph.edge(B, C).weight());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nodesCarryStoredLabelAndRole() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-labels-");
        try {
            MeshStore store = openStore(root);
            store.upsertNode(NodeInfoUpdate.identity(A, "Alpha Base", "ALPH", null, NodeRole.ROUTER, T - MINUTE));
            store.insertMessage(message(1L, T - MINUTE, A, B, A, -70.0));

            JsonNode json = exporter(store, RssiPolicy.LATEST).export(ViewKind.MESSAGES, Duration.ofHours(1)).toJson();

            Assertions.assertEquals(3, json.size());
            JsonNode alpha = json.get(0).get("data");
            Assertions.assertEquals("!11111111", alpha.get("id").asText());
            Assertions.assertEquals("ALPH", alpha.get("label").asText());
            Assertions.assertEquals("router", alpha.get("role").asText());
            JsonNode bravo = json.get(1).get("data");
            Assertions.assertEquals("!22222222", bravo.get("label").asText());
            Assertions.assertEquals("unknown", bravo.get("role").asText());
            JsonNode edge = json.get(2).get("data");
            Assertions.assertEquals("!11111111", edge.get("source").asText());
            Assertions.assertEquals("!22222222", edge.get("target").asText());
            Assertions.assertEquals(1, edge.get("count").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unchangedWindowExportsIdenticalJson() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-graph-determinism-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(5L, T - MINUTE, C, A, C, -50.0));
            store.insertMessage(message(6L, T - MINUTE, B, A, B, -55.0));
            store.insertMessage(message(7L, T - MINUTE, A, C, A, -65.0));
            GraphExporter exporter = exporter(store, RssiPolicy.LATEST);

            String first = Jsons.toJson(exporter.export(ViewKind.MESSAGES, Duration.ofHours(1)).toJson());
            String second = Jsons.toJson(exporter.export(ViewKind.MESSAGES, Duration.ofHours(1)).toJson());

            Assertions.assertEquals(first, second);
        } finally {
            deleteRecursively(root);
        }
    }

    private static GraphExporter exporter(MeshStore store, RssiPolicy policy) {
        return new GraphExporter(store, Clock.fixed(NOW, ZoneOffset.UTC), policy);
    }

    private static MeshStore openStore(Path root) {
        Database db = new Database(MeshGraphConfig.fromRoot(root.toString()));
        db.init();
        return new MeshStore(db);
    }

    private static MeshMessage message(long id, long ts, long from, long to, long physical, Double rssi) {
        return new MeshMessage(id, ts, from, to, physical, "text", "msh/test", rssi, null, 0);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
