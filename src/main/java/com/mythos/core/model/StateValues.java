package com.mythos.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, lenient reads from the loosely-typed maps the game loop hands in
 * ({@code game_state}, {@code action_data}, player stats).
 */
public final class StateValues {

    private StateValues() {}

    public static double getDouble(Map<String, ?> map, String key, double fallback) {
        if (map == null) return fallback;
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static int getInt(Map<String, ?> map, String key, int fallback) {
        return (int) getDouble(map, key, fallback);
    }

    public static String getString(Map<String, ?> map, String key) {
        if (map == null) return null;
        Object value = map.get(key);
        return value == null ? null : String.valueOf(value);
    }

    public static boolean getBoolean(Map<String, ?> map, String key) {
        if (map == null) return false;
        Object value = map.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Returns the value as a list of strings; a single scalar becomes a one-element list.
     */
    public static List<String> getStringList(Map<String, ?> map, String key) {
        if (map == null) return List.of();
        Object value = map.get(key);
        if (value == null) return List.of();
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null) result.add(String.valueOf(item));
            }
        } else {
            result.add(String.valueOf(value));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, ?> map, String key) {
        if (map == null) return Map.of();
        Object value = map.get(key);
        return value instanceof Map<?, ?> nested ? (Map<String, Object>) nested : Map.of();
    }

    /**
     * Equality that treats numbers of different boxed types as equal when their values match.
     */
    public static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Reads SAN from {@code sanity}, falling back to {@code san}, then to 50.
     */
    public static int currentSanity(Map<String, ?> state) {
        if (state != null && state.get("sanity") instanceof Number) {
            return getInt(state, "sanity", 50);
        }
        return getInt(state, "san", 50);
    }
}
