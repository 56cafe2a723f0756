package io.meshgraph.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshgraph.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials and channel keys before configuration is logged.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "key", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static String maskedJson(Object value) {
        return Jsons.toCompactJson(masked(Jsons.mapper().valueToTree(value)));
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(entry.getKey()) && !value.isNull()) {
                    out.set(entry.getKey(), maskAll(value));
                } else {
                    out.set(entry.getKey(), masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        return input;
    }

    // Maps keep their keys (channel names) so the log still shows which channels are configured.
    private static JsonNode maskAll(JsonNode value) {
        if (value.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<String> names = value.fieldNames();
            while (names.hasNext()) {
                out.put(names.next(), MASK);
            }
            return out;
        }
        return Jsons.mapper().getNodeFactory().textNode(MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
