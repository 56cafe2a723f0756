package io.meshgraph.listener;

import io.meshgraph.config.BrokerSettings;
import io.meshgraph.decode.EnvelopeDecoder;
import io.meshgraph.error.MalformedPayloadException;
import io.meshgraph.error.StorageWriteException;
import io.meshgraph.error.TransientNetworkException;
import io.meshgraph.model.MeshEvent;
import io.meshgraph.model.UnknownEvent;
import io.meshgraph.storage.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Long-running collector: keeps one broker connection alive, decodes every payload on a
 * small worker pool and hands the resulting events to the store.
 *
 * <p>The reconnect loop runs on its own daemon thread and never gives up. Per-event
 * failures are counted in {@link ListenerStats} and never reach the loop.
 */
public final class MeshListener {
    private static final Logger log = LoggerFactory.getLogger(MeshListener.class);
    private static final long SHUTDOWN_WAIT_MS = 5_000L;

    private final BrokerSettings settings;
    private final BrokerTransport transport;
    private final EnvelopeDecoder decoder;
    private final EventSink sink;
    private final Sleeper sleeper;
    private final ConnectionManager connection;
    private final ListenerStats stats = new ListenerStats();
    private final Semaphore lostSignal = new Semaphore(0);
    private final ExecutorService decodePool;

    private volatile boolean running;
    private volatile Thread loopThread;

    public MeshListener(
            BrokerSettings settings,
            BrokerTransport transport,
            EnvelopeDecoder decoder,
            EventSink sink,
            Clock clock,
            Sleeper sleeper
    ) {
        this.settings = settings;
        this.transport = transport;
        this.decoder = decoder;
        this.sink = sink;
        this.sleeper = sleeper;
        this.connection = new ConnectionManager(
                settings.reconnectMinMs(),
                settings.reconnectMaxMs(),
                settings.reconnectStableMs(),
                clock
        );
        this.decodePool = Executors.newFixedThreadPool(settings.decodeThreads(), namedDaemon("meshgraph-decode"));
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = namedDaemon("meshgraph-listener").newThread(this::runLoop);
        loopThread = t;
        t.start();
    }

    /**
     * Disconnects, lets in-flight decode work finish and returns the state machine to
     * {@link ConnectionState#DISCONNECTED}.
     */
    public void stop() {
        Thread t;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            t = loopThread;
        }
        lostSignal.release();
        if (t != null) {
            t.interrupt();
            try {
                t.join(SHUTDOWN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        transport.close();
        decodePool.shutdown();
        try {
            if (!decodePool.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Decode pool did not drain within {} ms", SHUTDOWN_WAIT_MS);
                decodePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            decodePool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        connection.stopped();
        log.info("Listener stopped: {}", stats.snapshot());
    }

    public ConnectionManager connection() {
        return connection;
    }

    public ListenerStats stats() {
        return stats;
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        BrokerTransport.Callback callback = new BrokerTransport.Callback() {
            @Override
            public void messageArrived(String topic, byte[] payload) {
                onMessage(topic, payload);
            }

            @Override
            public void connectionLost(Throwable cause) {
                log.warn("Connection to {} lost: {}", settings.serverUri(),
                        cause == null ? "unknown cause" : cause.getMessage());
                lostSignal.release();
            }
        };
        while (running) {
            lostSignal.drainPermits();
            connection.connecting();
            String reason;
            try {
                transport.connect(callback);
                transport.subscribe(settings.topic());
                connection.connected();
                lostSignal.acquire();
                reason = "connection lost";
            } catch (TransientNetworkException e) {
                reason = e.getMessage();
                log.warn("Broker unavailable: {}", reason);
                transport.disconnect();
            } catch (InterruptedException e) {
                if (running) {
                    Thread.currentThread().interrupt();
                    log.warn("Listener loop interrupted, stopping");
                }
                return;
            } catch (RuntimeException e) {
                reason = "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("Broker session failed unexpectedly, backing off", e);
                transport.disconnect();
            }
            if (!running) {
                return;
            }
            long delayMs = connection.failed(reason);
            stats.reconnects.incrementAndGet();
            log.info("Reconnecting in {} ms (attempt {})", delayMs, connection.consecutiveFailures());
            try {
                sleeper.sleep(delayMs);
            } catch (InterruptedException e) {
                if (running) {
                    Thread.currentThread().interrupt();
                    log.warn("Listener loop interrupted during backoff, stopping");
                }
                return;
            }
        }
    }

    void onMessage(String topic, byte[] payload) {
        stats.received.incrementAndGet();
        try {
            decodePool.execute(() -> handle(topic, payload));
        } catch (RejectedExecutionException e) {
            stats.lostEvents.incrementAndGet();
            log.debug("Dropped payload on {} during shutdown", topic);
        }
    }

    private void handle(String topic, byte[] payload) {
        List<MeshEvent> events;
        try {
            events = decoder.decode(topic, payload);
        } catch (MalformedPayloadException e) {
            stats.decodeErrors.incrementAndGet();
            log.warn("Skipping malformed payload: {}", e.getMessage());
            return;
        } catch (RuntimeException e) {
            stats.decodeErrors.incrementAndGet();
            log.error("Decoder failed on payload from {}", topic, e);
            return;
        }
        for (MeshEvent event : events) {
            if (event.kind() == MeshEvent.Kind.UNKNOWN) {
                stats.unknownEvents.incrementAndGet();
                log.debug("Skipping unknown event on {}: {}", topic, ((UnknownEvent) event).reason());
                continue;
            }
            dispatch(event);
        }
    }

    private void dispatch(MeshEvent event) {
        int attempts = settings.handoffAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (sink.accept(event)) {
                    stats.stored.incrementAndGet();
                } else {
                    stats.duplicates.incrementAndGet();
                }
                return;
            } catch (StorageWriteException e) {
                if (attempt == attempts) {
                    stats.lostEvents.incrementAndGet();
                    log.warn("Dropping {} event after {} handoff attempts: {}", event.kind(), attempts, e.getMessage());
                } else {
                    log.debug("Handoff attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                }
            } catch (RuntimeException e) {
                stats.lostEvents.incrementAndGet();
                log.error("Dropping {} event, store rejected it", event.kind(), e);
                return;
            }
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
