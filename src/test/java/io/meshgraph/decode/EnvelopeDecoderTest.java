package io.meshgraph.decode;

import io.meshgraph.model.MeshEvent;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.model.UnknownEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class EnvelopeDecoderTest {
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    private final EnvelopeDecoder decoder = new EnvelopeDecoder(
            Clock.fixed(NOW, ZoneOffset.UTC), ChannelDecryptor.defaults());

    @Test
    void emptyPayloadIsUnknown() {
        List<MeshEvent> events = decoder.decode("msh/EU/2/e/LongFast/!11111111", new byte[0]);

        Assertions.assertEquals("empty payload", ((UnknownEvent) events.get(0)).reason());
        Assertions.assertEquals(NOW.toEpochMilli(), events.get(0).timestampMs());
    }

    @Test
    void gatewayStatusTopicIsUnknown() {
        List<MeshEvent> events = decoder.decode("msh/EU/2/stat/!11111111", "online".getBytes(StandardCharsets.UTF_8));

        Assertions.assertEquals(MeshEvent.Kind.UNKNOWN, events.get(0).kind());
    }

    @Test
    void routesByPayloadShape() throws Exception {
        byte[] json = "  {\"id\": 1, \"from\": 286331153, \"type\": \"text\"}".getBytes(StandardCharsets.UTF_8);
        byte[] protobuf = ProtobufPacketDecoderTest.envelope(
                ProtobufPacketDecoderTest.packet(0x11111111L, 0x22222222L, 2L,
                        ProtobufPacketDecoderTest.data(PortNum.TEXT.number(), new byte[]{0x41}, 0L),
                        null, null, null, null, null, null),
                "LongFast", null);

        MeshMessage fromJson = (MeshMessage) decoder.decode("msh/EU/2/json/LongFast/!11111111", json).get(0);
        MeshMessage fromProto = (MeshMessage) decoder.decode("msh/EU/2/e/LongFast/!11111111", protobuf).get(0);

        Assertions.assertEquals(0x11111111L, fromJson.fromId());
        Assertions.assertEquals(0x22222222L, fromProto.toId());
        Assertions.assertEquals(NOW.toEpochMilli(), fromProto.timestampMs());
    }

    @Test
    void sameLogicalPacketGetsSameIdInBothEncodings() throws Exception {
        byte[] json = "{\"id\": 99, \"from\": 286331153, \"to\": 572662306, \"type\": \"text\"}"
                .getBytes(StandardCharsets.UTF_8);
        byte[] protobuf = ProtobufPacketDecoderTest.envelope(
                ProtobufPacketDecoderTest.packet(0x11111111L, 0x22222222L, 99L,
                        ProtobufPacketDecoderTest.data(PortNum.TEXT.number(), new byte[]{0x41}, 0L),
                        null, null, null, null, null, null),
                "LongFast", null);

        long jsonId = ((MeshMessage) decoder.decode("t/json", json).get(0)).id();
        long protoId = ((MeshMessage) decoder.decode("t/e", protobuf).get(0)).id();

        Assertions.assertEquals(jsonId, protoId);
    }
}
