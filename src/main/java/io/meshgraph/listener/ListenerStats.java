package io.meshgraph.listener;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the collector. Updated from the MQTT callback thread and the decode pool.
 */
public final class ListenerStats {
    final AtomicLong received = new AtomicLong();
    final AtomicLong stored = new AtomicLong();
    final AtomicLong duplicates = new AtomicLong();
    final AtomicLong decodeErrors = new AtomicLong();
    final AtomicLong unknownEvents = new AtomicLong();
    final AtomicLong lostEvents = new AtomicLong();
    final AtomicLong reconnects = new AtomicLong();

    public Snapshot snapshot() {
        return new Snapshot(
                received.get(),
                stored.get(),
                duplicates.get(),
                decodeErrors.get(),
                unknownEvents.get(),
                lostEvents.get(),
                reconnects.get()
        );
    }

    public record Snapshot(
            long received,
            long stored,
            long duplicates,
            long decodeErrors,
            long unknownEvents,
            long lostEvents,
            long reconnects
    ) {
    }
}
