package io.meshgraph.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.meshgraph.error.StorageUnavailableException;
import io.meshgraph.error.StorageWriteException;
import io.meshgraph.model.EntityKind;
import io.meshgraph.model.MeshEvent;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.model.NeighborReport;
import io.meshgraph.model.NodeIds;
import io.meshgraph.model.NodeInfoUpdate;
import io.meshgraph.model.NodeRecord;
import io.meshgraph.model.NodeRole;
import io.meshgraph.model.TracerouteRecord;
import io.meshgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer store over the SQLite database.
 *
 * <p>Every mutation goes through one {@link ReentrantLock} and runs in its own
 * transaction. Reads open their own connection and rely on WAL snapshots, so an export
 * never waits for the collector.
 */
public final class MeshStore implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(MeshStore.class);
    private static final TypeReference<List<Long>> HOP_LIST = new TypeReference<>() {
    };

    private final Database database;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final int writeAttempts;
    private final long writeBackoffMs;

    public MeshStore(Database database) {
        this.database = database;
        this.writeAttempts = database.config().writeAttempts();
        this.writeBackoffMs = database.config().writeBackoffMs();
    }

    @Override
    public boolean accept(MeshEvent event) {
        return switch (event.kind()) {
            case MESSAGE -> insertMessage((MeshMessage) event);
            case NEIGHBOR_REPORT -> insertNeighborReport((NeighborReport) event);
            case TRACEROUTE -> insertTraceroute((TracerouteRecord) event);
            case NODE_INFO -> upsertNode((NodeInfoUpdate) event);
            case UNKNOWN -> throw new IllegalArgumentException("Unknown events are not stored");
        };
    }

    public boolean insertMessage(MeshMessage m) {
        return write("insert message " + m.id(), c -> {
            int inserted;
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT OR IGNORE INTO messages(
                        msg_id,topic,sender_id,receiver_id,physical_sender_id,msg_type,rssi,snr,hop_count,timestamp_ms
                    ) VALUES(?,?,?,?,?,?,?,?,?,?)
                    """)) {
                ps.setLong(1, m.id());
                ps.setString(2, m.topic());
                ps.setLong(3, m.fromId());
                ps.setLong(4, m.toId());
                ps.setLong(5, m.physicalSenderId());
                ps.setString(6, m.type());
                setNullableDouble(ps, 7, m.rssi());
                setNullableDouble(ps, 8, m.snr());
                setNullableInt(ps, 9, m.hopCount());
                ps.setLong(10, m.timestampMs());
                inserted = ps.executeUpdate();
            }
            touchNodes(c, List.of(m.fromId(), m.physicalSenderId()), m.timestampMs());
            return inserted > 0;
        });
    }

    public boolean insertNeighborReport(NeighborReport r) {
        return write("insert neighbor report " + r.reporterId() + "->" + r.neighborId(), c -> {
            int inserted;
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO neighbors(reporter_id,neighbor_id,snr,timestamp_ms) VALUES(?,?,?,?)")) {
                ps.setLong(1, r.reporterId());
                ps.setLong(2, r.neighborId());
                setNullableDouble(ps, 3, r.snr());
                ps.setLong(4, r.timestampMs());
                inserted = ps.executeUpdate();
            }
            touchNodes(c, List.of(r.reporterId(), r.neighborId()), r.timestampMs());
            return inserted > 0;
        });
    }

    public boolean insertTraceroute(TracerouteRecord t) {
        String hops = Jsons.toCompactJson(t.hops());
        return write("insert traceroute " + t.id(), c -> {
            int inserted;
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO traceroutes(traceroute_id,origin_id,hops,timestamp_ms) VALUES(?,?,?,?)")) {
                ps.setLong(1, t.id());
                ps.setLong(2, t.originId());
                ps.setString(3, hops);
                ps.setLong(4, t.timestampMs());
                inserted = ps.executeUpdate();
            }
            touchNodes(c, t.hops(), t.timestampMs());
            return inserted > 0;
        });
    }

    /**
     * Merges the update into the node row. Fields the update leaves null keep their stored
     * value and {@code last_seen_ms} only moves forward.
     */
    public boolean upsertNode(NodeInfoUpdate u) {
        return write("upsert node " + NodeIds.format(u.nodeId()), c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO nodes(node_id,long_name,short_name,hardware,role,last_seen_ms,latitude,longitude)
                    VALUES(?,?,?,?,?,?,?,?)
                    ON CONFLICT(node_id) DO UPDATE SET
                        long_name=COALESCE(excluded.long_name, nodes.long_name),
                        short_name=COALESCE(excluded.short_name, nodes.short_name),
                        hardware=COALESCE(excluded.hardware, nodes.hardware),
                        role=COALESCE(excluded.role, nodes.role),
                        last_seen_ms=MAX(COALESCE(nodes.last_seen_ms, 0), excluded.last_seen_ms),
                        latitude=COALESCE(excluded.latitude, nodes.latitude),
                        longitude=COALESCE(excluded.longitude, nodes.longitude)
                    """)) {
                ps.setLong(1, u.nodeId());
                ps.setString(2, u.longName());
                ps.setString(3, u.shortName());
                setNullableInt(ps, 4, u.hardware());
                ps.setString(5, u.role() == null ? null : u.role().name());
                ps.setLong(6, u.timestampMs());
                setNullableDouble(ps, 7, u.latitude());
                setNullableDouble(ps, 8, u.longitude());
                return ps.executeUpdate() > 0;
            }
        });
    }

    private void touchNodes(Connection c, Collection<Long> nodeIds, long timestampMs) throws SQLException {
        Set<Long> unique = new LinkedHashSet<>(nodeIds);
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO nodes(node_id,last_seen_ms) VALUES(?,?)
                ON CONFLICT(node_id) DO UPDATE SET
                    last_seen_ms=MAX(COALESCE(nodes.last_seen_ms, 0), excluded.last_seen_ms)
                """)) {
            for (Long nodeId : unique) {
                if (nodeId == null || !NodeIds.isUnicast(nodeId)) {
                    continue;
                }
                ps.setLong(1, nodeId);
                ps.setLong(2, timestampMs);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /**
     * Rows of {@code kind} with a timestamp in {@code [startMs, endMs]}, ordered by
     * timestamp and then by the row's natural key. Nodes are selected by last-seen time.
     */
    public <T> List<T> queryRange(EntityKind<T> kind, long startMs, long endMs) {
        List<Object> rows = new ArrayList<>();
        String sql = rangeSql(kind);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, startMs);
            ps.setLong(2, endMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(kind, rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read " + kind + " range", e);
        }
        return kind.cast(rows);
    }

    private static String rangeSql(EntityKind<?> kind) {
        if (kind == EntityKind.MESSAGES) {
            return """
                    SELECT msg_id,topic,sender_id,receiver_id,physical_sender_id,msg_type,rssi,snr,hop_count,timestamp_ms
                    FROM messages WHERE timestamp_ms BETWEEN ? AND ?
                    ORDER BY timestamp_ms ASC, msg_id ASC
                    """;
        }
        if (kind == EntityKind.NEIGHBORS) {
            return """
                    SELECT reporter_id,neighbor_id,snr,timestamp_ms
                    FROM neighbors WHERE timestamp_ms BETWEEN ? AND ?
                    ORDER BY timestamp_ms ASC, reporter_id ASC, neighbor_id ASC
                    """;
        }
        if (kind == EntityKind.TRACEROUTES) {
            return """
                    SELECT traceroute_id,origin_id,hops,timestamp_ms
                    FROM traceroutes WHERE timestamp_ms BETWEEN ? AND ?
                    ORDER BY timestamp_ms ASC, traceroute_id ASC
                    """;
        }
        return """
                SELECT node_id,long_name,short_name,hardware,role,last_seen_ms,latitude,longitude
                FROM nodes WHERE last_seen_ms BETWEEN ? AND ?
                ORDER BY last_seen_ms ASC, node_id ASC
                """;
    }

    private static Object mapRow(EntityKind<?> kind, ResultSet rs) throws SQLException {
        if (kind == EntityKind.MESSAGES) {
            return new MeshMessage(
                    rs.getLong("msg_id"),
                    rs.getLong("timestamp_ms"),
                    rs.getLong("sender_id"),
                    rs.getLong("receiver_id"),
                    rs.getLong("physical_sender_id"),
                    rs.getString("msg_type"),
                    rs.getString("topic"),
                    nullableDouble(rs, "rssi"),
                    nullableDouble(rs, "snr"),
                    nullableInt(rs, "hop_count")
            );
        }
        if (kind == EntityKind.NEIGHBORS) {
            return new NeighborReport(
                    rs.getLong("reporter_id"),
                    rs.getLong("neighbor_id"),
                    nullableDouble(rs, "snr"),
                    rs.getLong("timestamp_ms")
            );
        }
        if (kind == EntityKind.TRACEROUTES) {
            return new TracerouteRecord(
                    rs.getLong("traceroute_id"),
                    rs.getLong("origin_id"),
                    parseHops(rs.getString("hops")),
                    rs.getLong("timestamp_ms")
            );
        }
        return mapNode(rs);
    }

    private static NodeRecord mapNode(ResultSet rs) throws SQLException {
        long lastSeen = rs.getLong("last_seen_ms");
        Long lastSeenMs = rs.wasNull() ? null : lastSeen;
        return new NodeRecord(
                rs.getLong("node_id"),
                rs.getString("long_name"),
                rs.getString("short_name"),
                nullableInt(rs, "hardware"),
                NodeRole.fromString(rs.getString("role")),
                lastSeenMs,
                nullableDouble(rs, "latitude"),
                nullableDouble(rs, "longitude")
        );
    }

    private static List<Long> parseHops(String raw) throws SQLException {
        try {
            return Jsons.mapper().readValue(raw, HOP_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt traceroute hop list: " + raw, e);
        }
    }

    /**
     * Node rows for the given ids, regardless of last-seen time. Ids without a row are
     * absent from the result.
     */
    public Map<Long, NodeRecord> findNodes(Collection<Long> nodeIds) {
        Map<Long, NodeRecord> out = new LinkedHashMap<>();
        if (nodeIds == null || nodeIds.isEmpty()) {
            return out;
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT node_id,long_name,short_name,hardware,role,last_seen_ms,latitude,longitude FROM nodes WHERE node_id=?")) {
            for (Long nodeId : new LinkedHashSet<>(nodeIds)) {
                ps.setLong(1, nodeId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        out.put(nodeId, mapNode(rs));
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read nodes", e);
        }
        return out;
    }

    public long countRows(EntityKind<?> kind) {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + kind.table())) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count " + kind, e);
        }
    }

    /**
     * Drops event rows older than {@code cutoffMs} in batches of {@code batchSize}. Nodes are
     * kept; their last-seen time is cleared when it falls before the cutoff.
     */
    public RetentionResult deleteOlderThan(long cutoffMs, int batchSize, boolean dryRun) {
        int batch = Math.max(1, batchSize);
        if (dryRun) {
            return new RetentionResult(
                    countOlder("messages", "timestamp_ms", cutoffMs),
                    countOlder("neighbors", "timestamp_ms", cutoffMs),
                    countOlder("traceroutes", "timestamp_ms", cutoffMs),
                    countOlder("nodes", "last_seen_ms", cutoffMs),
                    true
            );
        }
        long messages = deleteInBatches("messages", cutoffMs, batch);
        long neighbors = deleteInBatches("neighbors", cutoffMs, batch);
        long traceroutes = deleteInBatches("traceroutes", cutoffMs, batch);
        long nodes = write("clear stale node last-seen", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE nodes SET last_seen_ms=NULL WHERE last_seen_ms < ?")) {
                ps.setLong(1, cutoffMs);
                return (long) ps.executeUpdate();
            }
        });
        log.info("Retention removed messages={} neighbors={} traceroutes={} staleNodes={}",
                messages, neighbors, traceroutes, nodes);
        return new RetentionResult(messages, neighbors, traceroutes, nodes, false);
    }

    private long deleteInBatches(String table, long cutoffMs, int batch) {
        String sql = "DELETE FROM " + table + " WHERE rowid IN (SELECT rowid FROM " + table
                + " WHERE timestamp_ms < ? LIMIT ?)";
        long total = 0L;
        while (true) {
            int deleted = write("delete old " + table, c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setLong(1, cutoffMs);
                    ps.setInt(2, batch);
                    return ps.executeUpdate();
                }
            });
            total += deleted;
            if (deleted < batch) {
                return total;
            }
        }
    }

    private long countOlder(String table, String column, long cutoffMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM " + table + " WHERE " + column + " < ?")) {
            ps.setLong(1, cutoffMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count old rows in " + table, e);
        }
    }

    public void vacuum() {
        writeLock.lock();
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            st.execute("VACUUM");
        } catch (SQLException e) {
            throw new StorageWriteException("VACUUM failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    private <R> R write(String what, SqlWork<R> work) {
        SQLException last = null;
        for (int attempt = 1; attempt <= writeAttempts; attempt++) {
            writeLock.lock();
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    R result = work.run(c);
                    c.commit();
                    return result;
                } catch (SQLException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                last = e;
                log.debug("Write attempt {}/{} failed: {}: {}", attempt, writeAttempts, what, e.getMessage());
            } finally {
                writeLock.unlock();
            }
            if (attempt < writeAttempts && writeBackoffMs > 0L) {
                try {
                    Thread.sleep(writeBackoffMs * attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StorageWriteException("Interrupted while retrying: " + what, e);
                }
            }
        }
        throw new StorageWriteException("Failed to " + what + " after " + writeAttempts + " attempts", last);
    }

    private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null || value.isNaN()) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    @FunctionalInterface
    private interface SqlWork<R> {
        R run(Connection c) throws SQLException;
    }

    public record RetentionResult(
            long messages,
            long neighborReports,
            long traceroutes,
            long staleNodes,
            boolean dryRun
    ) {
    }
}
