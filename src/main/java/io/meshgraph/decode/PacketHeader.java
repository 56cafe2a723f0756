package io.meshgraph.decode;

/**
 * Link-layer fields shared by both envelope encodings.
 *
 * @param packetId  per-sender packet id, 0 when absent
 * @param relayNode low byte of the relaying node, {@code null} when not carried
 */
record PacketHeader(
        long packetId,
        long fromId,
        long toId,
        String type,
        Double rssi,
        Double snr,
        Integer hopCount,
        Integer relayNode
) {
}
