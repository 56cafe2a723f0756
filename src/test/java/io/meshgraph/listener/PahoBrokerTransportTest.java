package io.meshgraph.listener;

import io.meshgraph.config.BrokerSettings;
import io.meshgraph.config.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PahoBrokerTransportTest {

    @Test
    void missingTruststoreFailsConstruction() {
        BrokerSettings settings = settings("mqtt.example.org", true, "/nonexistent/trust.p12");

        ConfigurationException ex = Assertions.assertThrows(ConfigurationException.class,
                () -> new PahoBrokerTransport(settings));
        Assertions.assertTrue(ex.getMessage().contains("TLS_TRUSTSTORE"));
    }

    @Test
    void unparseableBrokerAddressFailsConstruction() {
        BrokerSettings settings = settings("bad host", false, null);

        ConfigurationException ex = Assertions.assertThrows(ConfigurationException.class,
                () -> new PahoBrokerTransport(settings));
        Assertions.assertTrue(ex.getMessage().contains("tcp://bad host:1883"));
    }

    @Test
    void validSettingsBuildDisconnectedTransport() {
        PahoBrokerTransport transport = new PahoBrokerTransport(settings("mqtt.example.org", true, null));
        try {
            Assertions.assertFalse(transport.isConnected());
        } finally {
            transport.close();
        }
    }

    private static BrokerSettings settings(String host, boolean tls, String truststore) {
        return new BrokerSettings(host, null, null, "meshgraph-test", null, null, tls, true,
                truststore, null, null, null, null, null, null, null, null).validated();
    }
}
