package io.meshgraph.cli;

import io.meshgraph.config.BrokerSettings;
import io.meshgraph.config.ConfigurationException;
import io.meshgraph.config.ExportSettings;
import io.meshgraph.config.MeshGraphConfig;
import io.meshgraph.decode.ChannelDecryptor;
import io.meshgraph.decode.EnvelopeDecoder;
import io.meshgraph.error.StorageUnavailableException;
import io.meshgraph.export.ExportRunner;
import io.meshgraph.export.RssiPolicy;
import io.meshgraph.export.ViewKind;
import io.meshgraph.listener.MeshListener;
import io.meshgraph.listener.PahoBrokerTransport;
import io.meshgraph.listener.Sleeper;
import io.meshgraph.observability.CollectorMetrics;
import io.meshgraph.security.SensitiveDataMasker;
import io.meshgraph.storage.Database;
import io.meshgraph.storage.MeshStore;
import io.meshgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "meshgraph",
        mixinStandardHelpOptions = true,
        description = "Mesh telemetry collector and graph exporter",
        subcommands = {
                MeshGraphCommand.InitCommand.class,
                MeshGraphCommand.CollectCommand.class,
                MeshGraphCommand.ExportCommand.class,
                MeshGraphCommand.CleanupCommand.class,
                MeshGraphCommand.SchemaMigrationsCommand.class
        }
)
public final class MeshGraphCommand implements Runnable {
    public static final int EXIT_UNEXPECTED = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_STORAGE_UNAVAILABLE = 3;

    private static final Logger log = LoggerFactory.getLogger(MeshGraphCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = MeshGraphConfig.DEFAULT_ROOT)
    String root;

    Clock clock = Clock.systemDefaultZone();

    @Override
    public void run() {
        System.out.println("Use subcommands: init | collect | export | cleanup | schema-migrations");
    }

    /**
     * Command line with the exit-code mapping for fatal startup failures.
     */
    public static CommandLine newCommandLine() {
        return newCommandLine(new MeshGraphCommand());
    }

    static CommandLine newCommandLine(MeshGraphCommand command) {
        CommandLine cli = new CommandLine(command);
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ConfigurationException) {
                log.error("Configuration error: {}", ex.getMessage());
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            }
            if (ex instanceof StorageUnavailableException) {
                log.error("Store unavailable: {}", ex.getMessage(), ex.getCause());
                commandLine.getErr().println("Store unavailable: " + ex.getMessage());
                return EXIT_STORAGE_UNAVAILABLE;
            }
            log.error("Command failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            return EXIT_UNEXPECTED;
        });
        return cli;
    }

    MeshGraphConfig config() {
        return MeshGraphConfig.fromRoot(root);
    }

    @Command(name = "init", description = "Create the data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        MeshGraphCommand parent;

        @Override
        public Integer call() {
            MeshGraphConfig config = parent.config();
            new Database(config).init();
            System.out.println("Initialized meshgraph store at: " + config.dbFile());
            return 0;
        }
    }

    @Command(name = "collect", description = "Run the broker collector until terminated")
    static final class CollectCommand implements Callable<Integer> {
        @ParentCommand
        MeshGraphCommand parent;

        @Option(names = {"--config"}, defaultValue = "config.json", description = "Collector JSON configuration")
        Path configFile;

        @Override
        public Integer call() throws InterruptedException {
            BrokerSettings settings = BrokerSettings.load(configFile);
            log.info("Collector settings: {}", SensitiveDataMasker.maskedJson(settings));
            PahoBrokerTransport transport = new PahoBrokerTransport(settings);
            MeshGraphConfig config = parent.config();
            Database database = new Database(config);
            database.init();
            MeshStore store = new MeshStore(database);

            EnvelopeDecoder decoder = new EnvelopeDecoder(parent.clock, new ChannelDecryptor(settings.channelKeys()));
            MeshListener listener = new MeshListener(
                    settings,
                    transport,
                    decoder,
                    store,
                    parent.clock,
                    Sleeper.SYSTEM
            );
            CollectorMetrics metrics = new CollectorMetrics(listener, config.metricsFile(), settings.serverUri());
            CountDownLatch done = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down collector");
                listener.stop();
                metrics.close();
                done.countDown();
            }, "meshgraph-shutdown"));

            listener.start();
            metrics.start(MeshGraphConfig.DEFAULT_METRICS_INTERVAL_MS);
            log.info("Collector started, store={}", config.dbFile());
            done.await();
            return 0;
        }
    }

    @Command(name = "export", description = "Write graph and hourly-series artifacts")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        MeshGraphCommand parent;

        @Option(names = {"--view"}, description = "messages | physicalSenders | neighbors | traceroutes")
        String view;

        @Option(names = {"--window"}, description = "Window such as 15m, 1h, 24h or PT3H")
        String window;

        @Option(names = {"--series-days"}, description = "Comma separated series horizons in days")
        String seriesDays;

        @Option(names = {"--rssi-policy"}, defaultValue = "latest", description = "latest | mean")
        String rssiPolicy;

        @Option(names = {"--zone"}, description = "Time zone for hourly buckets (default: system)")
        String zone;

        @Option(names = {"--out"}, description = "Artifact directory (default: <root>/artifacts)")
        Path out;

        @Override
        public Integer call() {
            ExportSettings defaults = ExportSettings.defaults();
            List<Duration> windows = window == null ? defaults.windows() : List.of(ExportSettings.parseWindow(window));
            List<Integer> days = seriesDays == null ? defaults.seriesDays() : ExportSettings.parseDays(seriesDays);
            ExportSettings settings = new ExportSettings(windows, days, parseZone(zone), RssiPolicy.parse(rssiPolicy));

            MeshGraphConfig config = parent.config();
            Database database = new Database(config);
            database.requireExisting();
            Path outDir = out == null ? config.artifactsDir() : out.toAbsolutePath().normalize();
            ExportRunner runner = new ExportRunner(new MeshStore(database), parent.clock, settings, outDir);

            List<Path> written = new ArrayList<>();
            if (view == null && window == null) {
                written.addAll(runner.runAll().written());
            } else {
                List<ViewKind> views = view == null ? List.of(ViewKind.values()) : List.of(ViewKind.parse(view));
                for (Duration w : settings.windows()) {
                    for (ViewKind v : views) {
                        written.add(runner.runView(v, w));
                    }
                }
                written.add(runner.writeMarker());
            }
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("outDir", outDir.toString());
            summary.put("written", written.stream().map(p -> p.getFileName().toString()).toList());
            System.out.println(Jsons.toJson(summary));
            return 0;
        }

        private static ZoneId parseZone(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return ZoneId.of(raw.trim());
            } catch (DateTimeException e) {
                throw new ConfigurationException("Invalid time zone: " + raw, e);
            }
        }
    }

    @Command(name = "cleanup", description = "Delete event rows older than the retention period")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        MeshGraphCommand parent;

        @Option(names = {"--days"}, defaultValue = "" + MeshGraphConfig.DEFAULT_RETENTION_DAYS, description = "Retention in days")
        int days;

        @Option(names = {"--batch"}, defaultValue = "" + MeshGraphConfig.DEFAULT_RETENTION_BATCH, description = "Rows per delete batch")
        int batch;

        @Option(names = {"--dry-run"}, description = "Only report what would be deleted")
        boolean dryRun;

        @Override
        public Integer call() {
            if (days < 1) {
                throw new ConfigurationException("--days must be at least 1");
            }
            Database database = new Database(parent.config());
            database.requireExisting();
            MeshStore store = new MeshStore(database);
            long cutoffMs = parent.clock.millis() - Duration.ofDays(days).toMillis();
            MeshStore.RetentionResult result = store.deleteOlderThan(cutoffMs, batch, dryRun);
            if (!dryRun) {
                store.vacuum();
            }
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        MeshGraphCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}
