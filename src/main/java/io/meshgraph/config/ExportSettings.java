package io.meshgraph.config;

import io.meshgraph.export.RssiPolicy;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record ExportSettings(
        List<Duration> windows,
        List<Integer> seriesDays,
        ZoneId zone,
        RssiPolicy rssiPolicy
) {
    public static final List<Duration> DEFAULT_WINDOWS = List.of(
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofHours(1),
            Duration.ofHours(3),
            Duration.ofHours(24)
    );
    public static final List<Integer> DEFAULT_SERIES_DAYS = List.of(1, 7, 14, 30);

    public ExportSettings {
        windows = windows == null || windows.isEmpty() ? DEFAULT_WINDOWS : List.copyOf(windows);
        seriesDays = seriesDays == null ? DEFAULT_SERIES_DAYS : List.copyOf(seriesDays);
        zone = zone == null ? ZoneId.systemDefault() : zone;
        rssiPolicy = rssiPolicy == null ? RssiPolicy.LATEST : rssiPolicy;
        for (Duration window : windows) {
            if (window.isZero() || window.isNegative()) {
                throw new ConfigurationException("Export window must be positive: " + window);
            }
        }
        for (Integer days : seriesDays) {
            if (days == null || days < 1) {
                throw new ConfigurationException("Series horizon must be at least one day: " + days);
            }
        }
    }

    public static ExportSettings defaults() {
        return new ExportSettings(null, null, null, null);
    }

    /**
     * Parses {@code 15m}, {@code 15min}, {@code 3h}, {@code 1d} or an ISO-8601 duration.
     */
    public static Duration parseWindow(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Window must not be blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        try {
            if (value.startsWith("p")) {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            }
            if (value.endsWith("min")) {
                return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 3)));
            }
            char unit = value.charAt(value.length() - 1);
            long amount = Long.parseLong(value.substring(0, value.length() - 1));
            return switch (unit) {
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new ConfigurationException("Unsupported window unit in: " + raw);
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ConfigurationException("Invalid window: " + raw, e);
        }
    }

    /**
     * File-name label of a window: {@code 15min}, {@code 1h}, {@code 24h}.
     */
    public static String windowLabel(Duration window) {
        long minutes = window.toMinutes();
        if (minutes < 60 || minutes % 60 != 0) {
            return minutes + "min";
        }
        return (minutes / 60) + "h";
    }

    public static List<Integer> parseDays(String raw) {
        List<Integer> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                out.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid series horizon: " + trimmed, e);
            }
        }
        return out;
    }
}
