package io.datastoreadmin.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Helpers for working with the nested {@code Map<String, Object>} structures used for
 * datastore mappings, settings and records.
 */
public final class HashUtil {

    private HashUtil() {
        // Utility class
    }

    /**
     * Fetches the value at a dotted path (e.g. {@code "nested_fields.created_at"}).
     *
     * @throws NoSuchElementException if any key along the path is missing
     * @throws IllegalArgumentException if an intermediate value is not a map
     */
    public static Object fetchValueAtPath(Map<String, ?> map, String keyPath) {
        String[] parts = keyPath.split("\\.");
        Object current = map;

        for (int i = 0; i < parts.length; i++) {
            if (!(current instanceof Map)) {
                throw new IllegalArgumentException("Value at key \"" + String.join(".", List.of(parts).subList(0, i))
                    + "\" is not a `Map` as expected; instead, was a `" + typeName(current) + "`");
            }

            Map<?, ?> currentMap = (Map<?, ?>) current;
            if (!currentMap.containsKey(parts[i])) {
                throw new NoSuchElementException("Key not found: \""
                    + String.join(".", List.of(parts).subList(0, i + 1)) + "\"");
            }
            current = currentMap.get(parts[i]);
        }

        return current;
    }

    /**
     * Digs into nested maps, returning {@code null} when any key is absent.
     */
    public static Object dig(Map<String, ?> map, String... keys) {
        Object current = map;
        for (String key : keys) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(key);
        }
        return current;
    }

    /**
     * Flattens nested maps into a single level map with dotted keys.
     *
     * @param prefix optional prefix for all keys (joined with a dot)
     */
    public static Map<String, Object> flattenAndStringifyKeys(Map<String, ?> source, String prefix) {
        Map<String, Object> flat = new LinkedHashMap<>();
        populateFlatMap(source, prefix == null ? "" : prefix + ".", flat);
        return flat;
    }

    public static Map<String, Object> flattenAndStringifyKeys(Map<String, ?> source) {
        return flattenAndStringifyKeys(source, null);
    }

    /**
     * Recursively merges two maps. Values from {@code second} win, except that nested maps
     * present on both sides are merged.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepMerge(Map<String, ?> first, Map<String, ?> second) {
        Map<String, Object> merged = new LinkedHashMap<>(first);
        second.forEach((key, secondValue) -> {
            Object firstValue = merged.get(key);
            if (firstValue instanceof Map && secondValue instanceof Map) {
                merged.put(key, deepMerge((Map<String, Object>) firstValue, (Map<String, Object>) secondValue));
            } else {
                merged.put(key, secondValue);
            }
        });
        return merged;
    }

    /**
     * Builds a nested map holding {@code value} at the given dotted path.
     */
    public static Map<String, Object> nestAtPath(String keyPath, Object value) {
        String[] parts = keyPath.split("\\.");
        Object current = value;
        for (int i = parts.length - 1; i >= 0; i--) {
            Map<String, Object> wrapper = new LinkedHashMap<>();
            wrapper.put(parts[i], current);
            current = wrapper;
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) current;
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void populateFlatMap(Map<String, ?> source, String prefix, Map<String, Object> flat) {
        source.forEach((key, value) -> {
            if (value instanceof Map) {
                populateFlatMap((Map<String, Object>) value, prefix + key + ".", flat);
            } else if (value instanceof List && ((List<?>) value).stream().anyMatch(v -> v instanceof Map)) {
                throw new IllegalArgumentException(
                    "`flattenAndStringifyKeys` cannot handle nested lists of maps, but got: " + value);
            } else {
                flat.put(prefix + key, value);
            }
        });
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
