package io.meshgraph.listener;

/**
 * Minimal broker connection used by {@link MeshListener}. Implementations do not
 * reconnect on their own; the listener owns the reconnect policy.
 */
public interface BrokerTransport extends AutoCloseable {

    /**
     * @throws io.meshgraph.error.TransientNetworkException when the broker cannot be reached
     */
    void connect(Callback callback);

    /**
     * @throws io.meshgraph.error.TransientNetworkException when the subscription is refused
     */
    void subscribe(String topicFilter);

    boolean isConnected();

    void disconnect();

    @Override
    void close();

    interface Callback {
        void messageArrived(String topic, byte[] payload);

        void connectionLost(Throwable cause);
    }
}
