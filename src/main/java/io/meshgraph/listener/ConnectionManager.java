package io.meshgraph.listener;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reconnect state of one broker connection.
 *
 * <p>The delay after the n-th consecutive failure is {@code min * 2^(n-1)}, capped at
 * {@code max}. A connection that stayed up for at least the stable period clears the
 * failure streak, so the next loss waits only {@code min}.
 */
public final class ConnectionManager {
    private static final int HISTORY_LIMIT = 256;

    private final long minDelayMs;
    private final long maxDelayMs;
    private final long stableMs;
    private final Clock clock;
    private final Deque<Transition> history = new ArrayDeque<>();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int consecutiveFailures;
    private long connectedAtMs = -1L;
    private long currentDelayMs;

    public ConnectionManager(long minDelayMs, long maxDelayMs, long stableMs, Clock clock) {
        if (minDelayMs <= 0L || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("backoff requires 0 < min <= max, got " + minDelayMs + "/" + maxDelayMs);
        }
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.stableMs = Math.max(0L, stableMs);
        this.clock = clock;
    }

    public synchronized void connecting() {
        move(ConnectionState.CONNECTING, null);
    }

    public synchronized void connected() {
        connectedAtMs = clock.millis();
        move(ConnectionState.CONNECTED, null);
    }

    /**
     * Records a failed attempt or a lost connection and enters {@link ConnectionState#BACKOFF}.
     *
     * @return delay before the next attempt
     */
    public synchronized long failed(String reason) {
        if (state == ConnectionState.CONNECTED && connectedAtMs >= 0L
                && clock.millis() - connectedAtMs >= stableMs) {
            consecutiveFailures = 0;
        }
        connectedAtMs = -1L;
        if (consecutiveFailures < Integer.MAX_VALUE) {
            consecutiveFailures++;
        }
        currentDelayMs = delayFor(consecutiveFailures, minDelayMs, maxDelayMs);
        move(ConnectionState.BACKOFF, reason);
        return currentDelayMs;
    }

    public synchronized void stopped() {
        connectedAtMs = -1L;
        move(ConnectionState.DISCONNECTED, "stopped");
    }

    public synchronized ConnectionState state() {
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized long currentDelayMs() {
        return currentDelayMs;
    }

    public synchronized List<Transition> history() {
        return new ArrayList<>(history);
    }

    /**
     * Sequence of states visited, starting with the initial one.
     */
    public synchronized List<ConnectionState> states() {
        List<ConnectionState> out = new ArrayList<>(history.size() + 1);
        out.add(history.isEmpty() ? state : history.peekFirst().from());
        for (Transition t : history) {
            out.add(t.to());
        }
        return out;
    }

    static long delayFor(int failures, long min, long max) {
        if (failures <= 1) {
            return min;
        }
        int shift = failures - 1;
        if (shift >= Long.SIZE - 2 || min > (max >> shift)) {
            return max;
        }
        return Math.min(max, min << shift);
    }

    private void move(ConnectionState next, String reason) {
        if (history.size() == HISTORY_LIMIT) {
            history.removeFirst();
        }
        history.addLast(new Transition(state, next, clock.millis(), reason));
        state = next;
    }

    public record Transition(ConnectionState from, ConnectionState to, long atMs, String reason) {
    }
}
