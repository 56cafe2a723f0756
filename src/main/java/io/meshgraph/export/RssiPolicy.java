package io.meshgraph.export;

import io.meshgraph.config.ConfigurationException;

import java.util.Locale;

/**
 * How the RSSI of an edge observed several times in one window is reduced to one value.
 */
public enum RssiPolicy {
    /** Most recent sample; equal timestamps fall back to the larger message id. */
    LATEST,
    /** Arithmetic mean of all samples. */
    MEAN;

    public static RssiPolicy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LATEST;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown RSSI policy: " + raw + " (expected latest or mean)", e);
        }
    }
}
