package io.meshgraph.export;

import io.meshgraph.config.ExportSettings;
import io.meshgraph.storage.MeshStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One export invocation: every configured window for every view, the hourly series for
 * every horizon, then the timestamp marker.
 */
public final class ExportRunner {
    private static final Logger log = LoggerFactory.getLogger(ExportRunner.class);
    private static final DateTimeFormatter MARKER_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss zzz yyyy", Locale.US);

    private final Clock clock;
    private final ExportSettings settings;
    private final Path outDir;
    private final Path markerFile;
    private final GraphExporter graphs;
    private final SeriesExporter series;

    public ExportRunner(MeshStore store, Clock clock, ExportSettings settings, Path outDir) {
        this.clock = clock;
        this.settings = settings;
        this.outDir = outDir;
        this.markerFile = outDir.resolve("cytoscape_data.txt");
        this.graphs = new GraphExporter(store, clock, settings.rssiPolicy());
        this.series = new SeriesExporter(store, clock, settings.zone());
    }

    public Outcome runAll() {
        List<Path> written = new ArrayList<>();
        for (Duration window : settings.windows()) {
            for (ViewKind view : ViewKind.values()) {
                written.add(runView(view, window));
            }
        }
        for (int days : settings.seriesDays()) {
            written.addAll(runSeries(days));
        }
        written.add(writeMarker());
        log.info("Exported {} artifacts to {}", written.size(), outDir);
        return new Outcome(written);
    }

    public Path runView(ViewKind view, Duration window) {
        GraphSnapshot snapshot = graphs.export(view, window);
        Path target = outDir.resolve(view.fileName(ExportSettings.windowLabel(window)));
        ArtifactWriter.writeJson(target, snapshot.toJson());
        log.debug("{} {}: {} nodes, {} edges", view.cliName(), ExportSettings.windowLabel(window),
                snapshot.nodes().size(), snapshot.edges().size());
        return target;
    }

    public List<Path> runSeries(int days) {
        SeriesExporter.HourlySeries hourly = series.hourly(days);
        Path messages = ArtifactWriter.writeJson(
                outDir.resolve("stats_hourly_messages_" + days + "d.json"), hourly.messagesJson());
        Path senders = ArtifactWriter.writeJson(
                outDir.resolve("stats_unique_senders_" + days + "d.json"), hourly.uniqueSendersJson());
        return List.of(messages, senders);
    }

    public Path writeMarker() {
        String stamp = MARKER_FORMAT.format(clock.instant().atZone(settings.zone()));
        return ArtifactWriter.writeText(markerFile, stamp + "\n");
    }

    public record Outcome(List<Path> written) {
        public Outcome {
            written = List.copyOf(written);
        }
    }
}
