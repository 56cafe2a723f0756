package io.meshgraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshgraph.config.MeshGraphConfig;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.storage.Database;
import io.meshgraph.storage.MeshStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

final class SeriesExporterTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:30:00Z");
    private static final long A = 0x11111111L;
    private static final long B = 0x22222222L;
    private static final long C = 0x33333333L;

    @Test
    void bucketsCoverWholeHorizonAndAreZeroFilled() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-series-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(1L, "2025-03-01T12:10:00Z", A, A, "text"));
            store.insertMessage(message(2L, "2025-03-01T12:20:00Z", B, C, "text"));
            store.insertMessage(message(3L, "2025-03-01T11:59:59Z", A, A, "position"));
            store.insertMessage(message(4L, "2025-02-28T12:59:59Z", C, C, "text"));

            SeriesExporter.HourlySeries series = exporter(store, ZoneOffset.UTC).hourly(1);

            Assertions.assertEquals(24, series.labels().size());
            Assertions.assertEquals("2025-02-28 13:00", series.labels().get(0));
            Assertions.assertEquals("2025-03-01 12:00", series.labels().get(23));
            Assertions.assertEquals(List.of("position", "text"), series.types());
            Assertions.assertEquals(2L, series.countsByType().get("text")[23]);
            Assertions.assertEquals(1L, series.countsByType().get("position")[22]);
            Assertions.assertEquals(0L, series.countsByType().get("text")[0]);
            Assertions.assertEquals(3L, series.totalMessages());
            Assertions.assertEquals(2L, series.uniqueSenders()[23]);
            Assertions.assertEquals(1L, series.uniqueSenders()[22]);
            Assertions.assertEquals(0L, series.uniqueSenders()[5]);
            Assertions.assertEquals(2L, series.totalUniqueSenders());
            Assertions.assertEquals(2L, series.totalUniquePhysicalSenders());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void physicalSendersAreCountedSeparatelyFromLogicalSenders() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-series-physical-");
        try {
            MeshStore store = openStore(root);
            long relay = 0x44444444L;
            store.insertMessage(relayed(1L, "2025-03-01T12:05:00Z", A, relay));
            store.insertMessage(relayed(2L, "2025-03-01T12:06:00Z", B, relay));
            store.insertMessage(relayed(3L, "2025-03-01T12:07:00Z", C, relay));
            store.insertMessage(relayed(4L, "2025-03-01T11:10:00Z", A, A));
            store.insertMessage(relayed(5L, "2025-03-01T11:20:00Z", A, relay));

            SeriesExporter.HourlySeries series = exporter(store, ZoneOffset.UTC).hourly(1);

            Assertions.assertEquals(3L, series.uniqueSenders()[23]);
            Assertions.assertEquals(1L, series.uniquePhysicalSenders()[23]);
            Assertions.assertEquals(1L, series.uniqueSenders()[22]);
            Assertions.assertEquals(2L, series.uniquePhysicalSenders()[22]);
            Assertions.assertEquals(3L, series.totalUniqueSenders());
            Assertions.assertEquals(2L, series.totalUniquePhysicalSenders());

            JsonNode json = series.uniqueSendersJson();
            Assertions.assertEquals(3L, json.get("unique_senders").get(23).asLong());
            Assertions.assertEquals(1L, json.get("unique_physical_senders").get(23).asLong());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void longerHorizonsHaveTwentyFourBucketsPerDay() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-series-days-");
        try {
            MeshStore store = openStore(root);

            SeriesExporter.HourlySeries series = exporter(store, ZoneOffset.UTC).hourly(7);

            Assertions.assertEquals(168, series.labels().size());
            Assertions.assertEquals(168, series.messagesJson().get("x").size());
            Assertions.assertEquals(0L, series.totalMessages());
            Assertions.assertEquals(0.0, series.uniqueSendersJson().get("metadata")
                    .get("average_unique_senders_per_hour").asDouble());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void labelsFollowConfiguredZone() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-series-zone-");
        try {
            MeshStore store = openStore(root);

            SeriesExporter.HourlySeries series = exporter(store, ZoneId.of("Europe/Berlin")).hourly(1);

            Assertions.assertEquals("2025-03-01 13:00", series.labels().get(23));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void messagesJsonReportsRoundedPercentages() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-series-json-");
        try {
            MeshStore store = openStore(root);
            store.insertMessage(message(1L, "2025-03-01T12:01:00Z", A, A, "text"));
            store.insertMessage(message(2L, "2025-03-01T12:02:00Z", A, A, "text"));
            store.insertMessage(message(3L, "2025-03-01T12:03:00Z", B, B, "telemetry"));

            JsonNode json = exporter(store, ZoneOffset.UTC).hourly(1).messagesJson();

            JsonNode byType = json.get("metadata").get("messages_by_type");
            Assertions.assertEquals(3, json.get("metadata").get("total_messages").asInt());
            Assertions.assertEquals(2, byType.get("text").asInt());
            Assertions.assertEquals(66.67, byType.get("text_percentage").asDouble());
            Assertions.assertEquals(33.33, byType.get("telemetry_percentage").asDouble());
            Assertions.assertEquals(2, json.get("data").get("text").get(23).asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roundingIsHalfUp() {
        Assertions.assertEquals(0.13, SeriesExporter.round2(0.125));
        Assertions.assertEquals(1.0, SeriesExporter.round2(0.999));
    }

    @Test
    void horizonMustBePositive() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-series-invalid-");
        try {
            MeshStore store = openStore(root);
            Assertions.assertThrows(IllegalArgumentException.class, () -> exporter(store, ZoneOffset.UTC).hourly(0));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SeriesExporter exporter(MeshStore store, ZoneId zone) {
        return new SeriesExporter(store, Clock.fixed(NOW, ZoneOffset.UTC), zone);
    }

    private static MeshStore openStore(Path root) {
        Database db = new Database(MeshGraphConfig.fromRoot(root.toString()));
        db.init();
        return new MeshStore(db);
    }

    private static MeshMessage message(long id, String at, long from, long to, String type) {
        return new MeshMessage(id, Instant.parse(at).toEpochMilli(), from, to, from, type, "msh/test", null, null, null);
    }

    private static MeshMessage relayed(long id, String at, long from, long physical) {
        return new MeshMessage(id, Instant.parse(at).toEpochMilli(), from, 0xFFFFFFFFL, physical, "text", "msh/test",
                null, null, 1);
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
