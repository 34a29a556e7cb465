package io.datastoreadmin.indices;

import io.datastoreadmin.util.HashUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;
import static io.datastoreadmin.config.Constants.KEY_PROPERTIES;
import static io.datastoreadmin.config.Constants.KEY_SETTINGS;
import static io.datastoreadmin.config.Constants.SETTINGS_PREFIX;

/**
 * Normalizes index configuration into the stable form the datastore returns when an index is fetched,
 * so desired and actual configuration can be compared directly.
 *
 * <ul>
 *   <li>Read-only settings the datastore sets on its own are dropped.</li>
 *   <li>Settings are flattened to dotted {@code index.*} keys with string values (the datastore
 *       returns {@code "7"} rather than {@code 7}). Explicit nulls are kept.</li>
 *   <li>{@code type: object} is dropped next to {@code properties}, as the datastore omits it there.</li>
 * </ul>
 */
public final class IndexConfigNormalizer {

    // Exposed by the datastore on every index but never settable.
    // index.routing.allocation.include._tier_preference is settable, but we never want to write it.
    public static final Set<String> READ_ONLY_SETTINGS = Set.of(
        "index.creation_date",
        "index.history.uuid",
        "index.provided_name",
        "index.replication.type",
        "index.routing.allocation.include._tier_preference",
        "index.uuid",
        "index.version.created",
        "index.version.upgraded"
    );

    private IndexConfigNormalizer() {
        // Utility class
    }

    /**
     * Normalizes the {@code settings} and {@code mappings} of an index config, leaving other entries as they are.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalize(Map<String, Object> indexConfig) {
        Map<String, Object> normalized = new LinkedHashMap<>(indexConfig);

        Object settings = indexConfig.get(KEY_SETTINGS);
        if (settings instanceof Map) {
            normalized.put(KEY_SETTINGS, normalizeSettings((Map<String, Object>) settings));
        }

        Object mappings = indexConfig.get(KEY_MAPPINGS);
        if (mappings instanceof Map) {
            normalized.put(KEY_MAPPINGS, normalizeMappings((Map<String, Object>) mappings));
        }

        return normalized;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeMappings(Map<String, Object> mappings) {
        Object properties = mappings.get(KEY_PROPERTIES);
        if (!(properties instanceof Map)) {
            return mappings;
        }

        Map<String, Object> normalized = new LinkedHashMap<>(mappings);
        if ("object".equals(normalized.get("type"))) {
            normalized.remove("type");
        }

        Map<String, Object> normalizedProperties = new LinkedHashMap<>();
        ((Map<String, Object>) properties).forEach((field, mapping) -> normalizedProperties.put(field,
            mapping instanceof Map ? normalizeMappings((Map<String, Object>) mapping) : mapping));
        normalized.put(KEY_PROPERTIES, normalizedProperties);

        return normalized;
    }

    public static Map<String, Object> normalizeSettings(Map<String, Object> settings) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        HashUtil.flattenAndStringifyKeys(settings).forEach((name, value) -> {
            String fullName = withIndexPrefix(name);
            if (!READ_ONLY_SETTINGS.contains(fullName)) {
                normalized.put(fullName, normalizeSettingValue(value));
            }
        });
        return normalized;
    }

    private static String withIndexPrefix(String name) {
        return name.startsWith(SETTINGS_PREFIX + ".") ? name : SETTINGS_PREFIX + "." + name;
    }

    private static Object normalizeSettingValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                .map(IndexConfigNormalizer::normalizeSettingValue)
                .collect(Collectors.toList());
        }
        return value.toString();
    }
}
