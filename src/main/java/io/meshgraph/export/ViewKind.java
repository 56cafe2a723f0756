package io.meshgraph.export;

import io.meshgraph.config.ConfigurationException;

import java.util.Locale;

public enum ViewKind {
    MESSAGES("messages", "cytoscape_messages_"),
    PHYSICAL_SENDERS("physicalSenders", "cytoscape_messages_physical_"),
    NEIGHBORS("neighbors", "cytoscape_neighbors_"),
    TRACEROUTES("traceroutes", "cytoscape_traceroutes_");

    private final String cliName;
    private final String filePrefix;

    ViewKind(String cliName, String filePrefix) {
        this.cliName = cliName;
        this.filePrefix = filePrefix;
    }

    public String cliName() {
        return cliName;
    }

    public String fileName(String windowLabel) {
        return filePrefix + windowLabel + ".json";
    }

    public static ViewKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("View must not be blank");
        }
        String value = raw.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        for (ViewKind kind : values()) {
            if (kind.cliName.toLowerCase(Locale.ROOT).equals(value)
                    || kind.name().replace("_", "").toLowerCase(Locale.ROOT).equals(value)) {
                return kind;
            }
        }
        if ("physical".equals(value)) {
            return PHYSICAL_SENDERS;
        }
        throw new ConfigurationException("Unknown view: " + raw);
    }
}
