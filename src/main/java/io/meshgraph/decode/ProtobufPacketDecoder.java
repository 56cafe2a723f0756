package io.meshgraph.decode;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import io.meshgraph.error.MalformedPayloadException;
import io.meshgraph.model.MeshEvent;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.model.NeighborReport;
import io.meshgraph.model.NodeIds;
import io.meshgraph.model.NodeInfoUpdate;
import io.meshgraph.model.NodeRole;
import io.meshgraph.model.TracerouteRecord;
import io.meshgraph.model.UnknownEvent;
import io.meshgraph.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code ServiceEnvelope} payloads straight from the protobuf wire format. Only
 * the fields the graph needs are read; everything else is skipped.
 */
public final class ProtobufPacketDecoder {
    private static final Logger log = LoggerFactory.getLogger(ProtobufPacketDecoder.class);
    private static final double COORDINATE_SCALE = 1e-7;

    private final ChannelDecryptor decryptor;
    private final PacketEvents events;

    public ProtobufPacketDecoder(ChannelDecryptor decryptor, RelayResolver relays) {
        this.decryptor = decryptor;
        this.events = new PacketEvents(relays);
    }

    public List<MeshEvent> decode(String topic, byte[] payload, long nowMs) {
        Envelope envelope;
        try {
            envelope = readEnvelope(payload);
        } catch (IOException | RuntimeException e) {
            throw new MalformedPayloadException("Undecodable service envelope on " + topic, e);
        }
        if (envelope.gatewayId != null) {
            observeGateway(envelope.gatewayId);
        }
        RawPacket packet = envelope.packet;
        if (packet == null) {
            return List.of(new UnknownEvent(topic, "envelope without packet", nowMs));
        }
        if (packet.from == 0L) {
            return List.of(new UnknownEvent(topic, "packet without sender", nowMs));
        }

        DataPayload data = packet.decoded;
        if (data == null && packet.encrypted != null) {
            data = decrypt(envelope.channelId, packet);
        }
        String type = data == null
                ? (packet.encrypted != null ? PortNum.ENCRYPTED_TAG : PortNum.UNKNOWN.tag())
                : PortNum.fromNumber(data.portnum).tag();

        PacketHeader header = new PacketHeader(
                packet.id,
                packet.from,
                packet.to,
                type,
                packet.rssi == null || packet.rssi == 0 ? null : packet.rssi.doubleValue(),
                packet.snr == null ? null : packet.snr.doubleValue(),
                PacketEvents.hopCount(packet.hopStart, packet.hopLimit, null),
                packet.relayNode
        );
        MeshMessage message = events.message(header, topic, payload, nowMs);
        List<MeshEvent> out = new ArrayList<>();
        out.add(message);
        if (data != null) {
            try {
                appendPortEvents(out, message, packet, data, nowMs);
            } catch (IOException | RuntimeException e) {
                throw new MalformedPayloadException(
                        "Undecodable " + type + " payload from " + NodeIds.format(packet.from), e);
            }
        }
        return out;
    }

    private void observeGateway(String gatewayId) {
        try {
            events.observeGateway(NodeIds.parse(gatewayId));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-node gateway id {}", gatewayId);
        }
    }

    private DataPayload decrypt(String channelId, RawPacket packet) {
        for (SecretKeySpec key : decryptor.candidates(channelId)) {
            byte[] plain = decryptor.decrypt(key, packet.id, packet.from, packet.encrypted);
            try {
                DataPayload data = readData(plain);
                if (PortNum.fromNumber(data.portnum) != PortNum.UNKNOWN) {
                    return data;
                }
            } catch (IOException | RuntimeException e) {
                log.trace("Key for channel {} does not decrypt packet {}", channelId, packet.id);
            }
        }
        return null;
    }

    private void appendPortEvents(
            List<MeshEvent> out,
            MeshMessage message,
            RawPacket packet,
            DataPayload data,
            long nowMs
    ) throws IOException {
        switch (PortNum.fromNumber(data.portnum)) {
            case NODEINFO -> out.add(readUser(packet.from, data.payload, nowMs));
            case POSITION -> {
                NodeInfoUpdate position = readPosition(packet.from, data.payload, nowMs);
                if (position != null) {
                    out.add(position);
                }
            }
            case NEIGHBORINFO -> out.addAll(readNeighbors(packet.from, data.payload, nowMs));
            case TRACEROUTE -> {
                List<Long> route = readRoute(data.payload);
                List<Long> hops = PacketEvents.tracerouteHops(packet.from, packet.to, route, data.requestId != 0L);
                out.add(new TracerouteRecord(message.id(), hops.get(0), hops, nowMs));
            }
            default -> {
            }
        }
    }

    private static Envelope readEnvelope(byte[] bytes) throws IOException {
        Envelope envelope = new Envelope();
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            switch (field(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
                case 1 -> envelope.packet = readPacket(in.readByteArray());
                case 2 -> envelope.channelId = in.readStringRequireUtf8();
                case 3 -> envelope.gatewayId = in.readStringRequireUtf8();
                default -> in.skipField(tag);
            }
        }
        return envelope;
    }

    private static RawPacket readPacket(byte[] bytes) throws IOException {
        RawPacket packet = new RawPacket();
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int wireType = WireFormat.getTagWireType(tag);
            int number = WireFormat.getTagFieldNumber(tag);
            if (wireType == WireFormat.WIRETYPE_FIXED32) {
                switch (number) {
                    case 1 -> packet.from = in.readFixed32() & 0xFFFFFFFFL;
                    case 2 -> packet.to = in.readFixed32() & 0xFFFFFFFFL;
                    case 6 -> packet.id = in.readFixed32() & 0xFFFFFFFFL;
                    case 7 -> in.readFixed32();
                    case 8 -> packet.snr = in.readFloat();
                    default -> in.skipField(tag);
                }
            } else if (wireType == WireFormat.WIRETYPE_VARINT) {
                switch (number) {
                    case 9 -> packet.hopLimit = in.readUInt32();
                    case 12 -> packet.rssi = in.readInt32();
                    case 15 -> packet.hopStart = in.readUInt32();
                    case 19 -> packet.relayNode = in.readUInt32();
                    default -> in.skipField(tag);
                }
            } else if (wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                switch (number) {
                    case 4 -> packet.decoded = readData(in.readByteArray());
                    case 5 -> packet.encrypted = in.readByteArray();
                    default -> in.skipField(tag);
                }
            } else {
                in.skipField(tag);
            }
        }
        return packet;
    }

    static DataPayload readData(byte[] bytes) throws IOException {
        DataPayload data = new DataPayload();
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int wireType = WireFormat.getTagWireType(tag);
            int number = WireFormat.getTagFieldNumber(tag);
            if (number == 1 && wireType == WireFormat.WIRETYPE_VARINT) {
                data.portnum = in.readEnum();
            } else if (number == 2 && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                data.payload = in.readByteArray();
            } else if (number == 6 && wireType == WireFormat.WIRETYPE_FIXED32) {
                data.requestId = in.readFixed32() & 0xFFFFFFFFL;
            } else {
                in.skipField(tag);
            }
        }
        return data;
    }

    private static NodeInfoUpdate readUser(long nodeId, byte[] bytes, long nowMs) throws IOException {
        String longName = null;
        String shortName = null;
        Integer hardware = null;
        NodeRole role = NodeRole.CLIENT;
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int wireType = WireFormat.getTagWireType(tag);
            int number = WireFormat.getTagFieldNumber(tag);
            if (number == 2 && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                longName = Strings.sanitize(in.readString());
            } else if (number == 3 && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                shortName = Strings.sanitize(in.readString());
            } else if (number == 5 && wireType == WireFormat.WIRETYPE_VARINT) {
                hardware = in.readEnum();
            } else if (number == 7 && wireType == WireFormat.WIRETYPE_VARINT) {
                role = NodeRole.fromWire(in.readEnum());
            } else {
                in.skipField(tag);
            }
        }
        return NodeInfoUpdate.identity(nodeId, longName, shortName, hardware, role, nowMs);
    }

    private static NodeInfoUpdate readPosition(long nodeId, byte[] bytes, long nowMs) throws IOException {
        Integer latitude = null;
        Integer longitude = null;
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int wireType = WireFormat.getTagWireType(tag);
            int number = WireFormat.getTagFieldNumber(tag);
            if (number == 1 && wireType == WireFormat.WIRETYPE_FIXED32) {
                latitude = in.readSFixed32();
            } else if (number == 2 && wireType == WireFormat.WIRETYPE_FIXED32) {
                longitude = in.readSFixed32();
            } else {
                in.skipField(tag);
            }
        }
        if (latitude == null || longitude == null || (latitude == 0 && longitude == 0)) {
            return null;
        }
        return NodeInfoUpdate.position(nodeId, latitude * COORDINATE_SCALE, longitude * COORDINATE_SCALE, nowMs);
    }

    private static List<NeighborReport> readNeighbors(long fromId, byte[] bytes, long nowMs) throws IOException {
        long reporter = 0L;
        List<NeighborReport> out = new ArrayList<>();
        List<byte[]> entries = new ArrayList<>();
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int wireType = WireFormat.getTagWireType(tag);
            int number = WireFormat.getTagFieldNumber(tag);
            if (number == 1 && wireType == WireFormat.WIRETYPE_VARINT) {
                reporter = in.readUInt32() & 0xFFFFFFFFL;
            } else if (number == 4 && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                entries.add(in.readByteArray());
            } else {
                in.skipField(tag);
            }
        }
        long reporterId = reporter == 0L ? fromId : reporter;
        for (byte[] entry : entries) {
            long neighborId = 0L;
            Double snr = null;
            CodedInputStream n = CodedInputStream.newInstance(entry);
            while (true) {
                int tag = n.readTag();
                if (tag == 0) {
                    break;
                }
                int wireType = WireFormat.getTagWireType(tag);
                int number = WireFormat.getTagFieldNumber(tag);
                if (number == 1 && wireType == WireFormat.WIRETYPE_VARINT) {
                    neighborId = n.readUInt32() & 0xFFFFFFFFL;
                } else if (number == 2 && wireType == WireFormat.WIRETYPE_FIXED32) {
                    snr = (double) n.readFloat();
                } else {
                    n.skipField(tag);
                }
            }
            if (neighborId != 0L) {
                out.add(new NeighborReport(reporterId, neighborId, snr, nowMs));
            }
        }
        return out;
    }

    private static List<Long> readRoute(byte[] bytes) throws IOException {
        List<Long> route = new ArrayList<>();
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int wireType = WireFormat.getTagWireType(tag);
            int number = WireFormat.getTagFieldNumber(tag);
            if (number == 1 && wireType == WireFormat.WIRETYPE_FIXED32) {
                route.add(in.readFixed32() & 0xFFFFFFFFL);
            } else if (number == 1 && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                int limit = in.pushLimit(in.readRawVarint32());
                while (in.getBytesUntilLimit() > 0) {
                    route.add(in.readFixed32() & 0xFFFFFFFFL);
                }
                in.popLimit(limit);
            } else {
                in.skipField(tag);
            }
        }
        return route;
    }

    private static int field(int tag, int expectedWireType) {
        return WireFormat.getTagWireType(tag) == expectedWireType ? WireFormat.getTagFieldNumber(tag) : -1;
    }

    private static final class Envelope {
        RawPacket packet;
        String channelId;
        String gatewayId;
    }

    private static final class RawPacket {
        long from;
        long to;
        long id;
        Float snr;
        Integer hopLimit;
        Integer rssi;
        Integer hopStart;
        Integer relayNode;
        DataPayload decoded;
        byte[] encrypted;
    }

    static final class DataPayload {
        int portnum;
        byte[] payload = new byte[0];
        long requestId;
    }
}
