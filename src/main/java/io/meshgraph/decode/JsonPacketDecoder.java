package io.meshgraph.decode;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshgraph.error.MalformedPayloadException;
import io.meshgraph.model.MeshEvent;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.model.NeighborReport;
import io.meshgraph.model.NodeIds;
import io.meshgraph.model.NodeInfoUpdate;
import io.meshgraph.model.NodeRole;
import io.meshgraph.model.TracerouteRecord;
import io.meshgraph.model.UnknownEvent;
import io.meshgraph.util.Jsons;
import io.meshgraph.util.Strings;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes the JSON envelopes gateways publish under {@code .../json/...} topics.
 */
public final class JsonPacketDecoder {
    private static final double COORDINATE_SCALE = 1e-7;

    private final PacketEvents events;

    public JsonPacketDecoder(RelayResolver relays) {
        this.events = new PacketEvents(relays);
    }

    public List<MeshEvent> decode(String topic, byte[] payload, long nowMs) {
        JsonNode root;
        try {
            root = Jsons.readTree(new String(payload, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Invalid JSON envelope on " + topic, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("JSON envelope on " + topic + " is not an object");
        }
        String sender = root.path("sender").asText("");
        if (sender.startsWith("!")) {
            try {
                events.observeGateway(NodeIds.parse(sender));
            } catch (NumberFormatException e) {
                throw new MalformedPayloadException("Invalid sender id " + sender + " on " + topic, e);
            }
        }
        Long from = nodeId(root.get("from"), topic);
        if (from == null || from == 0L) {
            return List.of(new UnknownEvent(topic, "packet without sender", nowMs));
        }
        Long to = nodeId(root.get("to"), topic);
        long toId = to == null ? NodeIds.BROADCAST : to;

        String rawType = root.path("type").asText("");
        PortNum port = PortNum.fromTag(rawType);
        String type = port != PortNum.UNKNOWN || rawType.isBlank()
                ? port.tag()
                : rawType.trim().toLowerCase(Locale.ROOT);

        PacketHeader header = new PacketHeader(
                root.path("id").asLong(0L) & 0xFFFFFFFFL,
                from,
                toId,
                type,
                optionalDouble(root.get("rssi")),
                optionalDouble(root.get("snr")),
                PacketEvents.hopCount(
                        optionalInt(root.get("hop_start")),
                        optionalInt(root.get("hop_limit")),
                        optionalInt(root.get("hops_away"))
                ),
                optionalInt(root.get("relay_node"))
        );
        MeshMessage message = events.message(header, topic, payload, nowMs);
        List<MeshEvent> out = new ArrayList<>();
        out.add(message);

        JsonNode body = root.path("payload");
        if (!body.isObject()) {
            return out;
        }
        switch (port) {
            case NODEINFO -> out.add(NodeInfoUpdate.identity(
                    from,
                    Strings.sanitize(textOrNull(body.get("longname"))),
                    Strings.sanitize(textOrNull(body.get("shortname"))),
                    optionalInt(body.get("hardware")),
                    body.has("role") ? NodeRole.fromString(body.get("role").asText()) : NodeRole.CLIENT,
                    nowMs
            ));
            case POSITION -> {
                Integer lat = optionalInt(body.get("latitude_i"));
                Integer lon = optionalInt(body.get("longitude_i"));
                if (lat != null && lon != null && (lat != 0 || lon != 0)) {
                    out.add(NodeInfoUpdate.position(from, lat * COORDINATE_SCALE, lon * COORDINATE_SCALE, nowMs));
                }
            }
            case NEIGHBORINFO -> {
                Long reporter = nodeId(body.get("node_id"), topic);
                long reporterId = reporter == null || reporter == 0L ? from : reporter;
                for (JsonNode neighbor : body.path("neighbors")) {
                    Long neighborId = nodeId(neighbor.get("node_id"), topic);
                    if (neighborId != null && neighborId != 0L) {
                        out.add(new NeighborReport(reporterId, neighborId, optionalDouble(neighbor.get("snr")), nowMs));
                    }
                }
            }
            case TRACEROUTE -> {
                List<Long> hops = new ArrayList<>();
                hops.add(from);
                for (JsonNode hop : body.path("route")) {
                    Long hopId = nodeId(hop, topic);
                    if (hopId != null) {
                        hops.add(hopId);
                    }
                }
                if (NodeIds.isUnicast(toId)) {
                    hops.add(toId);
                }
                List<Long> ordered = PacketEvents.dedupeAdjacent(hops);
                out.add(new TracerouteRecord(message.id(), from, ordered, nowMs));
            }
            default -> {
            }
        }
        return out;
    }

    private static Long nodeId(JsonNode node, String topic) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong() & 0xFFFFFFFFL;
        }
        String text = node.asText("").trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return NodeIds.parse(text);
        } catch (NumberFormatException e) {
            throw new MalformedPayloadException("Invalid node id " + text + " on " + topic, e);
        }
    }

    private static Double optionalDouble(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return node.asDouble();
    }

    private static Integer optionalInt(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return node.asInt();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
