package io.meshgraph.storage;

import io.meshgraph.model.MeshEvent;

/**
 * Destination of decoded events. Implementations must be safe to call from several
 * decode threads at once.
 */
public interface EventSink {

    /**
     * @return {@code true} when a new row was written, {@code false} for a duplicate
     * @throws io.meshgraph.error.StorageWriteException when the write could not be completed
     */
    boolean accept(MeshEvent event);
}
