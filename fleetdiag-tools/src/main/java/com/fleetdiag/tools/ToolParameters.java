package com.fleetdiag.tools;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Parsed form of a session's opaque tool parameter string.
 * Accepts {@code key=value} pairs separated by {@code ;} or {@code &}. Keys are
 * case-insensitive; pairs without {@code =} are ignored.
 */
public final class ToolParameters {

    private final Map<String, String> values;

    private ToolParameters(Map<String, String> values) {
        this.values = values;
    }

    public static ToolParameters parse(String raw) {
        Map<String, String> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (raw == null || raw.isBlank()) {
            return new ToolParameters(values);
        }
        for (String pair : raw.split("[;&]")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).trim();
            String value = pair.substring(eq + 1).trim();
            if (!key.isEmpty()) {
                values.put(key, value);
            }
        }
        return new ToolParameters(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Read a duration given as whole seconds ({@code 30}), with a unit suffix
     * ({@code 30s}, {@code 2m}) or in ISO-8601 ({@code PT30S}).
     *
     * @throws IllegalArgumentException if the value is present but malformed or negative
     */
    public Duration getDuration(String key, Duration defaultValue) {
        Optional<String> raw = get(key);
        if (raw.isEmpty() || raw.get().isEmpty()) {
            return defaultValue;
        }
        Duration parsed = parseDuration(raw.get());
        if (parsed.isNegative()) {
            throw new IllegalArgumentException("Negative duration for " + key + ": " + raw.get());
        }
        return parsed;
    }

    public int size() {
        return values.size();
    }

    private static Duration parseDuration(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (v.startsWith("pt")) {
                return Duration.parse(v.toUpperCase(Locale.ROOT));
            }
            if (v.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2)));
            }
            if (v.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(v.substring(0, v.length() - 1)));
            }
            if (v.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(v.substring(0, v.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(v));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid duration: " + value, e);
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
