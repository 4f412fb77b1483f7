package com.mythos.core.objective;

import com.mythos.core.model.StateValues;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loosely-typed creation attributes for objective factories and templates.
 * Values may arrive as Java objects or as their JSON-ish representations.
 */
public final class ObjectiveParams {

    private final Map<String, Object> values;

    public ObjectiveParams(Map<String, ?> values) {
        this.values = values == null ? Map.of() : new LinkedHashMap<>(values);
    }

    public static ObjectiveParams empty() {
        return new ObjectiveParams(Map.of());
    }

    /** Returns a copy where entries of {@code overrides} replace existing ones. */
    public ObjectiveParams merge(Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new ObjectiveParams(merged);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return java.util.Collections.unmodifiableMap(values);
    }

    public String string(String key, String fallback) {
        Object value = values.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    public double doubleValue(String key, double fallback) {
        return StateValues.getDouble(values, key, fallback);
    }

    public int intValue(String key, int fallback) {
        return StateValues.getInt(values, key, fallback);
    }

    public boolean bool(String key, boolean fallback) {
        return has(key) ? StateValues.getBoolean(values, key) : fallback;
    }

    public List<String> stringList(String key) {
        return StateValues.getStringList(values, key);
    }

    public Set<String> stringSet(String key) {
        return new LinkedHashSet<>(stringList(key));
    }

    public Map<String, Object> map(String key) {
        return StateValues.getMap(values, key);
    }

    /**
     * Accepts a {@link Duration}, a number of seconds, or an ISO-8601 duration string.
     */
    public Duration duration(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        }
        String text = String.valueOf(value).trim();
        if (text.startsWith("P") || text.startsWith("p")) {
            return Duration.parse(text);
        }
        return Duration.ofMillis(Math.round(Double.parseDouble(text) * 1000));
    }

    public <E extends Enum<E>> E enumValue(String key, Class<E> type, E fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        String text = String.valueOf(value).trim();
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(text) || constant.toString().equalsIgnoreCase(text)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " for '" + key + "': " + value);
    }

    /** Elements of {@code key} that are instances of {@code type}; other elements are ignored. */
    public <T> List<T> listOf(String key, Class<T> type) {
        Object value = values.get(key);
        List<T> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (type.isInstance(item)) {
                    result.add(type.cast(item));
                }
            }
        } else if (type.isInstance(value)) {
            result.add(type.cast(value));
        }
        return result;
    }

    @Override
    public String toString() {
        return "ObjectiveParams" + values;
    }
}
