package io.meshgraph.model;

public record UnknownEvent(String topic, String reason, long timestampMs) implements MeshEvent {

    @Override
    public Kind kind() {
        return Kind.UNKNOWN;
    }
}
