package io.meshgraph.cli;

import io.meshgraph.config.MeshGraphConfig;
import io.meshgraph.model.EntityKind;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.storage.Database;
import io.meshgraph.storage.MeshStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

final class MeshGraphCommandTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void collectWithMissingConfigExitsWithConfigurationCode() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-cli-collect-");
        try {
            StringWriter err = new StringWriter();
            int code = run(err, "--root", root.toString(), "collect", "--config", root.resolve("missing.json").toString());

            Assertions.assertEquals(MeshGraphCommand.EXIT_CONFIGURATION, code);
            Assertions.assertTrue(err.toString().contains("Configuration error"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void collectWithMissingTruststoreExitsBeforeConnecting() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-cli-tls-");
        try {
            Path config = root.resolve("config.json");
            Files.writeString(config, "{\"MQTT_BROKER\":\"mqtt.example.org\",\"USE_SSL\":true,"
                    + "\"TLS_TRUSTSTORE\":\"" + root.resolve("missing.p12").toString().replace("\\", "/") + "\"}");
            StringWriter err = new StringWriter();

            int code = run(err, "--root", root.toString(), "collect", "--config", config.toString());

            Assertions.assertEquals(MeshGraphCommand.EXIT_CONFIGURATION, code);
            Assertions.assertTrue(err.toString().contains("TLS_TRUSTSTORE"));
            Assertions.assertFalse(Files.exists(MeshGraphConfig.fromRoot(root.toString()).dbFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exportWithoutStoreExitsWithStorageCode() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-cli-nostore-");
        try {
            StringWriter err = new StringWriter();
            int code = run(err, "--root", root.toString(), "export");

            Assertions.assertEquals(MeshGraphCommand.EXIT_STORAGE_UNAVAILABLE, code);
            Assertions.assertFalse(Files.exists(root.resolve("artifacts")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void initThenExportSingleViewWritesArtifactAndMarker() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-cli-export-");
        try {
            Assertions.assertEquals(0, run(new StringWriter(), "--root", root.toString(), "init"));
            MeshStore store = new MeshStore(new Database(MeshGraphConfig.fromRoot(root.toString())));
            store.insertMessage(new MeshMessage(1L, NOW.toEpochMilli() - 60_000L, 0x11111111L, 0x22222222L,
                    0x11111111L, "text", "msh/test", -80.0, null, null));
            Path out = root.resolve("web");

            int code = run(new StringWriter(), "--root", root.toString(), "export",
                    "--view", "messages", "--window", "1h", "--zone", "UTC", "--out", out.toString());

            Assertions.assertEquals(0, code);
            Assertions.assertTrue(Files.isRegularFile(out.resolve("cytoscape_messages_1h.json")));
            Assertions.assertTrue(Files.isRegularFile(out.resolve("cytoscape_data.txt")));
            Assertions.assertFalse(Files.exists(out.resolve("cytoscape_neighbors_1h.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidExportOptionsAreConfigurationErrors() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-cli-options-");
        try {
            Assertions.assertEquals(0, run(new StringWriter(), "--root", root.toString(), "init"));

            Assertions.assertEquals(MeshGraphCommand.EXIT_CONFIGURATION,
                    run(new StringWriter(), "--root", root.toString(), "export", "--rssi-policy", "median"));
            Assertions.assertEquals(MeshGraphCommand.EXIT_CONFIGURATION,
                    run(new StringWriter(), "--root", root.toString(), "export", "--view", "routers"));
            Assertions.assertEquals(MeshGraphCommand.EXIT_CONFIGURATION,
                    run(new StringWriter(), "--root", root.toString(), "export", "--zone", "Mars/Olympus"));
            Assertions.assertEquals(MeshGraphCommand.EXIT_CONFIGURATION,
                    run(new StringWriter(), "--root", root.toString(), "cleanup", "--days", "0"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanupDryRunKeepsRowsAndRealRunDeletesThem() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-cli-cleanup-");
        try {
            Assertions.assertEquals(0, run(new StringWriter(), "--root", root.toString(), "init"));
            MeshStore store = new MeshStore(new Database(MeshGraphConfig.fromRoot(root.toString())));
            long old = NOW.minus(Duration.ofDays(10)).toEpochMilli();
            store.insertMessage(new MeshMessage(1L, old, 0x11111111L, 0x22222222L,
                    0x11111111L, "text", "msh/test", null, null, null));
            store.insertMessage(new MeshMessage(2L, NOW.toEpochMilli(), 0x11111111L, 0x22222222L,
                    0x11111111L, "text", "msh/test", null, null, null));

            Assertions.assertEquals(0, run(new StringWriter(), "--root", root.toString(), "cleanup", "--dry-run"));
            Assertions.assertEquals(2L, store.countRows(EntityKind.MESSAGES));

            Assertions.assertEquals(0, run(new StringWriter(), "--root", root.toString(), "cleanup", "--days", "7"));
            Assertions.assertEquals(1L, store.countRows(EntityKind.MESSAGES));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(StringWriter err, String... args) {
        MeshGraphCommand command = new MeshGraphCommand();
        command.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CommandLine cli = MeshGraphCommand.newCommandLine(command);
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
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
