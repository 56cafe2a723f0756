package io.meshgraph.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.meshgraph.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Collector settings read from the JSON configuration file. Key names follow the
 * upper-case convention of the deployed {@code config.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BrokerSettings(
        @JsonProperty("MQTT_BROKER") String host,
        @JsonProperty("MQTT_PORT") Integer port,
        @JsonProperty("MQTT_TOPIC") String topic,
        @JsonProperty("CLIENT_ID") String clientId,
        @JsonProperty("MQTT_USERNAME") String username,
        @JsonProperty("MQTT_PASSWORD") String password,
        @JsonProperty("USE_SSL") Boolean useTls,
        @JsonProperty("TLS_INSECURE") Boolean tlsInsecure,
        @JsonProperty("TLS_TRUSTSTORE") String truststorePath,
        @JsonProperty("TLS_TRUSTSTORE_PASSWORD") String truststorePassword,
        @JsonProperty("CHANNEL_KEYS") Map<String, String> channelKeys,
        @JsonProperty("KEEPALIVE_SECONDS") Integer keepAliveSeconds,
        @JsonProperty("RECONNECT_MIN_MS") Long reconnectMinMs,
        @JsonProperty("RECONNECT_MAX_MS") Long reconnectMaxMs,
        @JsonProperty("RECONNECT_STABLE_MS") Long reconnectStableMs,
        @JsonProperty("DECODE_THREADS") Integer decodeThreads,
        @JsonProperty("HANDOFF_ATTEMPTS") Integer handoffAttempts
) {
    public static final int DEFAULT_PORT = 1883;
    public static final String DEFAULT_TOPIC = "msh/#";
    public static final int DEFAULT_KEEPALIVE_SECONDS = 60;
    public static final long DEFAULT_RECONNECT_MIN_MS = 1_000L;
    public static final long DEFAULT_RECONNECT_MAX_MS = 60_000L;
    public static final long DEFAULT_RECONNECT_STABLE_MS = 60_000L;
    public static final int DEFAULT_DECODE_THREADS = 2;
    public static final int DEFAULT_HANDOFF_ATTEMPTS = 3;

    public BrokerSettings {
        port = port == null ? DEFAULT_PORT : port;
        topic = topic == null || topic.isBlank() ? DEFAULT_TOPIC : topic.trim();
        clientId = clientId == null || clientId.isBlank()
                ? "meshgraph-" + UUID.randomUUID().toString().substring(0, 8)
                : clientId.trim();
        useTls = useTls != null && useTls;
        tlsInsecure = tlsInsecure == null || tlsInsecure;
        channelKeys = channelKeys == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(channelKeys));
        keepAliveSeconds = keepAliveSeconds == null ? DEFAULT_KEEPALIVE_SECONDS : keepAliveSeconds;
        reconnectMinMs = reconnectMinMs == null ? DEFAULT_RECONNECT_MIN_MS : reconnectMinMs;
        reconnectMaxMs = reconnectMaxMs == null ? DEFAULT_RECONNECT_MAX_MS : reconnectMaxMs;
        reconnectStableMs = reconnectStableMs == null ? DEFAULT_RECONNECT_STABLE_MS : reconnectStableMs;
        decodeThreads = decodeThreads == null ? DEFAULT_DECODE_THREADS : decodeThreads;
        handoffAttempts = handoffAttempts == null ? DEFAULT_HANDOFF_ATTEMPTS : handoffAttempts;
    }

    public static BrokerSettings load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(Files.readString(file));
        } catch (IOException e) {
            throw new ConfigurationException("Configuration file is not valid JSON: " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration file must contain a JSON object: " + file);
        }
        BrokerSettings settings;
        try {
            settings = Jsons.mapper().treeToValue(root, BrokerSettings.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration value in " + file + ": " + e.getMessage(), e);
        }
        return settings.validated();
    }

    public BrokerSettings validated() {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("MQTT_BROKER is required");
        }
        if (port < 1 || port > 65_535) {
            throw new ConfigurationException("MQTT_PORT must be between 1 and 65535, got " + port);
        }
        if ((username == null || username.isBlank()) != (password == null || password.isBlank())) {
            throw new ConfigurationException("MQTT_USERNAME and MQTT_PASSWORD must be set together");
        }
        if (reconnectMinMs <= 0L || reconnectMaxMs < reconnectMinMs) {
            throw new ConfigurationException("RECONNECT_MIN_MS must be positive and not above RECONNECT_MAX_MS");
        }
        if (decodeThreads < 1) {
            throw new ConfigurationException("DECODE_THREADS must be at least 1");
        }
        if (handoffAttempts < 1) {
            throw new ConfigurationException("HANDOFF_ATTEMPTS must be at least 1");
        }
        return this;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public String serverUri() {
        return (useTls ? "ssl://" : "tcp://") + host.trim() + ":" + port;
    }
}
