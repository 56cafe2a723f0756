package io.meshgraph.observability;

import io.meshgraph.export.ArtifactWriter;
import io.meshgraph.listener.MeshListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically dumps the listener counters to a Prometheus text file for a node
 * exporter textfile collector to pick up.
 */
public final class CollectorMetrics implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CollectorMetrics.class);

    private final MeshListener listener;
    private final Path target;
    private final String broker;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "meshgraph-metrics");
        t.setDaemon(true);
        return t;
    });

    public CollectorMetrics(MeshListener listener, Path target, String broker) {
        this.listener = listener;
        this.target = target;
        this.broker = broker;
    }

    public void start(long intervalMs) {
        scheduler.scheduleAtFixedRate(this::writeSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public Path write() {
        String text = PrometheusFormatter.format(listener.stats().snapshot(), listener.connection().state(), broker);
        return ArtifactWriter.writeText(target, text);
    }

    void writeSafely() {
        try {
            write();
        } catch (UncheckedIOException e) {
            log.warn("Failed to write collector metrics to {}: {}", target, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure writing collector metrics to {}", target, e);
        }
    }

    /**
     * Stops the schedule and writes one final snapshot.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
        writeSafely();
    }
}
