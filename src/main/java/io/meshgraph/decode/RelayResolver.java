package io.meshgraph.decode;

import io.meshgraph.model.NodeIds;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the one-byte relay hint carried by relayed packets back to a full node id, using
 * every node id observed so far.
 */
public final class RelayResolver {
    private final Map<Integer, Set<Long>> seenByLowByte = new ConcurrentHashMap<>();

    public void observe(long nodeId) {
        if (!NodeIds.isUnicast(nodeId)) {
            return;
        }
        seenByLowByte.computeIfAbsent((int) (nodeId & 0xFF), k -> ConcurrentHashMap.newKeySet()).add(nodeId);
    }

    /**
     * @return the only node id seen whose low byte equals {@code relayByte}, or {@code null}
     * when there is none or more than one
     */
    public Long resolve(int relayByte) {
        Set<Long> candidates = seenByLowByte.get(relayByte & 0xFF);
        if (candidates == null || candidates.size() != 1) {
            return null;
        }
        return candidates.iterator().next();
    }
}
