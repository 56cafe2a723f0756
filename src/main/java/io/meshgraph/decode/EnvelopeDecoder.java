package io.meshgraph.decode;

import io.meshgraph.model.MeshEvent;
import io.meshgraph.model.UnknownEvent;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for raw broker payloads. Chooses the JSON or protobuf decoder and stamps
 * every event with the collector's receive time.
 */
public final class EnvelopeDecoder {
    private final Clock clock;
    private final JsonPacketDecoder json;
    private final ProtobufPacketDecoder protobuf;

    public EnvelopeDecoder(Clock clock, ChannelDecryptor decryptor) {
        this(clock, decryptor, new RelayResolver());
    }

    public EnvelopeDecoder(Clock clock, ChannelDecryptor decryptor, RelayResolver relays) {
        this.clock = clock;
        this.json = new JsonPacketDecoder(relays);
        this.protobuf = new ProtobufPacketDecoder(decryptor, relays);
    }

    /**
     * @throws io.meshgraph.error.MalformedPayloadException when the payload cannot be parsed
     */
    public List<MeshEvent> decode(String topic, byte[] payload) {
        long nowMs = clock.millis();
        if (payload == null || payload.length == 0) {
            return List.of(new UnknownEvent(topic, "empty payload", nowMs));
        }
        if (topic != null && topic.contains("/stat/")) {
            return List.of(new UnknownEvent(topic, "gateway status", nowMs));
        }
        if (looksLikeJson(payload)) {
            return json.decode(topic, payload, nowMs);
        }
        return protobuf.decode(topic, payload, nowMs);
    }

    private static boolean looksLikeJson(byte[] payload) {
        for (byte b : payload) {
            if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
                continue;
            }
            return b == '{';
        }
        return false;
    }
}
