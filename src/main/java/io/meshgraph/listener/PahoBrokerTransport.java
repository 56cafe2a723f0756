package io.meshgraph.listener;

import io.meshgraph.config.BrokerSettings;
import io.meshgraph.config.ConfigurationException;
import io.meshgraph.error.TransientNetworkException;
import io.meshgraph.security.BrokerTls;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paho-backed transport. Connect options and the client are built in the constructor so
 * that a bad broker URI or TLS setup fails collector startup instead of the reconnect loop.
 */
public final class PahoBrokerTransport implements BrokerTransport {
    private static final Logger log = LoggerFactory.getLogger(PahoBrokerTransport.class);

    private final BrokerSettings settings;
    private final MqttConnectOptions options;
    private MqttClient client;

    /**
     * @throws ConfigurationException when the TLS context or the MQTT client cannot be created
     */
    public PahoBrokerTransport(BrokerSettings settings) {
        this.settings = settings;
        this.options = options();
        this.client = newClient();
    }

    private MqttClient newClient() {
        try {
            return new MqttClient(settings.serverUri(), settings.clientId(), new MemoryPersistence());
        } catch (MqttException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid broker address " + settings.serverUri() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void connect(Callback callback) {
        try {
            if (client == null) {
                client = newClient();
            }
            client.setCallback(new MqttCallback() {
                @Override
                public void connectionLost(Throwable cause) {
                    callback.connectionLost(cause);
                }

                @Override
                public void messageArrived(String topic, MqttMessage message) {
                    callback.messageArrived(topic, message.getPayload());
                }

                @Override
                public void deliveryComplete(IMqttDeliveryToken token) {
                    // subscribe-only client
                }
            });
            client.connect(options);
            log.info("Connected to {} as {}", settings.serverUri(), settings.clientId());
        } catch (MqttException e) {
            throw new TransientNetworkException("Failed to connect to " + settings.serverUri() + ": " + e.getMessage(), e);
        }
    }

    private MqttConnectOptions options() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(settings.keepAliveSeconds());
        options.setConnectionTimeout(30);
        if (settings.hasCredentials()) {
            options.setUserName(settings.username());
            options.setPassword(settings.password().toCharArray());
        }
        if (settings.useTls()) {
            options.setSocketFactory(BrokerTls.socketFactory(settings));
            if (settings.tlsInsecure()) {
                options.setHttpsHostnameVerificationEnabled(false);
            }
        }
        return options;
    }

    @Override
    public synchronized void subscribe(String topicFilter) {
        try {
            client.subscribe(topicFilter, 0);
            log.info("Subscribed to {}", topicFilter);
        } catch (MqttException e) {
            throw new TransientNetworkException("Failed to subscribe to " + topicFilter + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized boolean isConnected() {
        return client != null && client.isConnected();
    }

    @Override
    public synchronized void disconnect() {
        if (client == null || !client.isConnected()) {
            return;
        }
        try {
            client.disconnect();
        } catch (MqttException e) {
            log.warn("Disconnect from {} failed: {}", settings.serverUri(), e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        disconnect();
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (MqttException e) {
            log.warn("Closing MQTT client failed: {}", e.getMessage());
        } finally {
            client = null;
        }
    }
}
