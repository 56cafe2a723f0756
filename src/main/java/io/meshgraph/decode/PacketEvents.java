package io.meshgraph.decode;

import io.meshgraph.model.MeshMessage;
import io.meshgraph.util.Hashing;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the stored events from a decoded header. Shared by the JSON and protobuf
 * decoders so both encodings produce identical ids and physical senders.
 */
final class PacketEvents {
    private final RelayResolver relays;

    PacketEvents(RelayResolver relays) {
        this.relays = relays;
    }

    MeshMessage message(PacketHeader h, String topic, byte[] raw, long nowMs) {
        relays.observe(h.fromId());
        return new MeshMessage(
                messageId(h.fromId(), h.packetId(), raw),
                nowMs,
                h.fromId(),
                h.toId(),
                physicalSender(h),
                h.type(),
                topic,
                h.rssi(),
                h.snr(),
                h.hopCount()
        );
    }

    void observeGateway(long gatewayId) {
        relays.observe(gatewayId);
    }

    private long physicalSender(PacketHeader h) {
        Integer hops = h.hopCount();
        if (hops == null || hops <= 0 || h.relayNode() == null || h.relayNode() == 0) {
            return h.fromId();
        }
        Long resolved = relays.resolve(h.relayNode());
        return resolved == null ? h.fromId() : resolved;
    }

    /**
     * {@code (from << 32) | packetId}; packets without an id fall back to a digest of the
     * raw envelope so that re-delivery of the same bytes still collapses.
     */
    static long messageId(long fromId, long packetId, byte[] raw) {
        if (packetId == 0L) {
            return Hashing.sha256Long(raw);
        }
        return (fromId << 32) | (packetId & 0xFFFFFFFFL);
    }

    static Integer hopCount(Integer hopStart, Integer hopLimit, Integer hopsAway) {
        if (hopStart != null && hopStart > 0) {
            return Math.max(0, hopStart - (hopLimit == null ? 0 : hopLimit));
        }
        return hopsAway;
    }

    /**
     * Traversal order of a route-discovery payload. A reply lists the hops from the
     * requester outward, so the path runs from the reply's destination to its sender;
     * a request in flight only knows the hops taken so far.
     */
    static List<Long> tracerouteHops(long fromId, long toId, List<Long> route, boolean reply) {
        List<Long> hops = new ArrayList<>(route.size() + 2);
        if (reply) {
            hops.add(toId);
            hops.addAll(route);
            hops.add(fromId);
        } else {
            hops.add(fromId);
            hops.addAll(route);
        }
        return dedupeAdjacent(hops);
    }

    static List<Long> dedupeAdjacent(List<Long> hops) {
        List<Long> out = new ArrayList<>(hops.size());
        for (Long hop : hops) {
            if (out.isEmpty() || !out.get(out.size() - 1).equals(hop)) {
                out.add(hop);
            }
        }
        return out;
    }
}
