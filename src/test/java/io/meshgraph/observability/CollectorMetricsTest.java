package io.meshgraph.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.meshgraph.config.BrokerSettings;
import io.meshgraph.decode.ChannelDecryptor;
import io.meshgraph.decode.EnvelopeDecoder;
import io.meshgraph.listener.BrokerTransport;
import io.meshgraph.listener.MeshListener;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

final class CollectorMetricsTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void writesPrometheusFile() throws Exception {
        Path root = Files.createTempDirectory("meshgraph-test-metrics-");
        try {
            Path target = root.resolve("metrics").resolve("meshgraph.prom");
            CollectorMetrics metrics = new CollectorMetrics(listener(), target, "tcp://broker.test:1883");

            metrics.write();

            String text = Files.readString(target);
            Assertions.assertTrue(text.contains("meshgraph_connection_state{state=\"disconnected\"} 1\n"));
            Assertions.assertTrue(text.contains("meshgraph_broker_info{broker=\"tcp://broker.test:1883\"} 1\n"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unexpectedWriteFailureIsLoggedNotThrown() {
        // a filesystem root has no parent directory or file name to write through
        Path target = Path.of("").toAbsolutePath().getRoot();
        CollectorMetrics metrics = new CollectorMetrics(listener(), target, null);

        Logger logger = (Logger) LoggerFactory.getLogger(CollectorMetrics.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Assertions.assertDoesNotThrow(metrics::writeSafely);
            Assertions.assertDoesNotThrow(metrics::close);

            Assertions.assertEquals(2L, appender.list.stream()
                    .filter(e -> e.getLevel() == Level.ERROR || e.getLevel() == Level.WARN)
                    .count());
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }
    }

    private static MeshListener listener() {
        BrokerSettings settings = new BrokerSettings("broker.test", null, null, "meshgraph-test",
                null, null, null, null, null, null, null, null, null, null, null, 1, 1).validated();
        return new MeshListener(settings, new IdleTransport(), new EnvelopeDecoder(CLOCK, ChannelDecryptor.defaults()),
                event -> true, CLOCK, millis -> { });
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

    private static final class IdleTransport implements BrokerTransport {
        @Override
        public void connect(Callback callback) {
        }

        @Override
        public void subscribe(String topicFilter) {
        }

        @Override
        public boolean isConnected() {
            return false;
        }

        @Override
        public void disconnect() {
        }

        @Override
        public void close() {
        }
    }
}
