package io.meshgraph.model;

import java.util.List;

/**
 * Typed selector for range queries against the store.
 */
public final class EntityKind<T> {
    public static final EntityKind<MeshMessage> MESSAGES = new EntityKind<>("messages", MeshMessage.class);
    public static final EntityKind<NodeRecord> NODES = new EntityKind<>("nodes", NodeRecord.class);
    public static final EntityKind<NeighborReport> NEIGHBORS = new EntityKind<>("neighbors", NeighborReport.class);
    public static final EntityKind<TracerouteRecord> TRACEROUTES = new EntityKind<>("traceroutes", TracerouteRecord.class);

    private final String table;
    private final Class<T> type;

    private EntityKind(String table, Class<T> type) {
        this.table = table;
        this.type = type;
    }

    public String table() {
        return table;
    }

    public Class<T> type() {
        return type;
    }

    public List<T> cast(List<?> rows) {
        return rows.stream().map(type::cast).toList();
    }

    public static List<EntityKind<?>> all() {
        return List.of(MESSAGES, NODES, NEIGHBORS, TRACEROUTES);
    }

    @Override
    public String toString() {
        return table;
    }
}
