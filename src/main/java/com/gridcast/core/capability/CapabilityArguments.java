package com.gridcast.core.capability;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Typed read access to arguments that already passed {@link ArgumentValidator}.
 */
public final class CapabilityArguments {

    private final Map<String, Object> values;

    public CapabilityArguments(Map<String, Object> values) {
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CapabilityArguments empty() {
        return new CapabilityArguments(Map.of());
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Optional<String> string(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public int integer(String name, int defaultValue) {
        Object value = values.get(name);
        return value instanceof Number number ? number.intValue() : defaultValue;
    }

    public double number(String name, double defaultValue) {
        Object value = values.get(name);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }

    public boolean bool(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value != null) {
            return Boolean.parseBoolean(value.toString().trim());
        }
        return defaultValue;
    }

    public Optional<LocalDate> date(String name) {
        Object value = values.get(name);
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        return string(name).map(LocalDate::parse);
    }

    public Optional<Instant> timestamp(String name) {
        Object value = values.get(name);
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        return string(name).map(CapabilityArguments::parseTimestamp);
    }

    public <E extends Enum<E>> E enumValue(String name, Class<E> type, E defaultValue) {
        return string(name)
                .map(s -> Enum.valueOf(type, s.toUpperCase(Locale.ROOT)))
                .orElse(defaultValue);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    static Instant parseTimestamp(String text) {
        try {
            return Instant.parse(text);
        } catch (RuntimeException e) {
            return OffsetDateTime.parse(text).toInstant();
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
