package io.meshgraph.model;

public record MeshMessage(
        long id,
        long timestampMs,
        long fromId,
        long toId,
        long physicalSenderId,
        String type,
        String topic,
        Double rssi,
        Double snr,
        Integer hopCount
) implements MeshEvent {

    @Override
    public Kind kind() {
        return Kind.MESSAGE;
    }
}
