package io.datastoreadmin.configurator;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.indices.IndexConfigNormalizer;
import io.datastoreadmin.indices.IndexDefinition;
import io.datastoreadmin.metrics.MetricsProvider;
import io.datastoreadmin.util.HashUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;
import static io.datastoreadmin.config.Constants.KEY_PROPERTIES;
import static io.datastoreadmin.config.Constants.KEY_SETTINGS;
import static io.datastoreadmin.config.Constants.MAPPING_META;
import static io.datastoreadmin.config.Constants.MAPPING_META_NAMESPACE;
import static io.datastoreadmin.config.Constants.MAPPING_META_SOURCES;
import static io.datastoreadmin.metrics.MetricsConstants.ACTION_TAG;
import static io.datastoreadmin.metrics.MetricsConstants.CLUSTER_TAG;
import static io.datastoreadmin.metrics.MetricsConstants.DRY_RUN_TAG;
import static io.datastoreadmin.metrics.MetricsConstants.WRITE_ACTIONS_METRIC_NAME;

/**
 * Diffing logic shared by the index and index template configurators.
 * Configs handled here are normalized {@code {mappings, settings}} maps.
 */
abstract class AbstractIndexDefinitionConfigurator implements IndexDefinitionConfigurator {

    static final String MAPPING_REMOVAL_NOTE = "Note: the extra fields listed here will not actually get removed. "
        + "Mapping removals are unsupported (but the fields will be left alone and cause no problems).";

    protected final DatastoreClient datastoreClient;
    protected final ActionReporter reporter;
    protected final MetricsProvider metricsProvider;

    protected AbstractIndexDefinitionConfigurator(DatastoreClient datastoreClient, ActionReporter reporter,
                                                  MetricsProvider metricsProvider) {
        this.datastoreClient = datastoreClient;
        this.reporter = reporter;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Builds the desired, normalized config: the environment-agnostic config with the index's
     * environment setting overrides and the sources recorded in the mapping metadata. Recorded
     * sources are only ever added to.
     */
    protected static Map<String, Object> desiredIndexConfig(IndexDefinition indexDefinition,
                                                           Map<String, Object> envAgnosticIndexConfig,
                                                           Map<String, Object> currentMapping) {
        TreeSet<String> sources = new TreeSet<>(indexDefinition.getCurrentSources());
        Object recordedSources = HashUtil.dig(currentMapping, MAPPING_META, MAPPING_META_NAMESPACE, MAPPING_META_SOURCES);
        if (recordedSources instanceof List) {
            ((List<?>) recordedSources).forEach(source -> sources.add(String.valueOf(source)));
        }

        Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put(KEY_MAPPINGS, HashUtil.nestAtPath(
            String.join(".", MAPPING_META, MAPPING_META_NAMESPACE, MAPPING_META_SOURCES), new ArrayList<>(sources)));
        overrides.put(KEY_SETTINGS, indexDefinition.flattenedEnvSettingOverrides());

        return IndexConfigNormalizer.normalize(HashUtil.deepMerge(envAgnosticIndexConfig, overrides));
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> section(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Map ? (Map<String, Object>) value : new LinkedHashMap<>();
    }

    /**
     * Flattened {@code *.type} keys whose value differs between the current and desired mappings.
     */
    protected static List<String> mappingTypeChanges(Map<String, Object> currentMapping, Map<String, Object> desiredMapping) {
        Map<String, Object> flatCurrent = HashUtil.flattenAndStringifyKeys(currentMapping);
        Map<String, Object> flatDesired = HashUtil.flattenAndStringifyKeys(desiredMapping);

        List<String> changes = new ArrayList<>();
        flatCurrent.forEach((key, value) -> {
            if (key.endsWith(".type") && flatDesired.containsKey(key) && !Objects.equals(flatDesired.get(key), value)) {
                changes.add(key);
            }
        });
        return changes;
    }

    /**
     * Field paths present in the current mapping but not in the desired one.
     */
    protected static List<String> mappingRemovals(Map<String, Object> currentMapping, Map<String, Object> desiredMapping) {
        List<String> removals = mappingFieldsFrom(currentMapping, "");
        removals.removeAll(mappingFieldsFrom(desiredMapping, ""));
        return removals;
    }

    /**
     * Settings to send to bring the current settings to the desired ones: changed values, plus
     * {@code null} for every current setting no longer desired so it is restored to its default.
     */
    protected static Map<String, Object> settingsUpdates(Map<String, Object> currentSettings, Map<String, Object> desiredSettings) {
        Map<String, Object> updates = new LinkedHashMap<>();
        desiredSettings.forEach((key, value) -> {
            if (!currentSettings.containsKey(key) || !Objects.equals(currentSettings.get(key), value)) {
                updates.put(key, value);
            }
        });
        currentSettings.keySet().forEach(key -> {
            if (!desiredSettings.containsKey(key)) {
                updates.put(key, null);
            }
        });
        return updates;
    }

    /**
     * Merges the current mapping properties into the desired ones, since the datastore cannot
     * drop fields from a mapping. Desired field definitions win.
     */
    @SuppressWarnings("unchecked")
    protected static Map<String, Object> mergeProperties(Map<String, Object> desiredObject, Map<String, Object> currentObject) {
        Map<String, Object> desiredProperties = section(desiredObject, KEY_PROPERTIES);
        Map<String, Object> currentProperties = section(currentObject, KEY_PROPERTIES);
        if (currentProperties.isEmpty()) {
            return desiredObject;
        }

        Map<String, Object> mergedProperties = new LinkedHashMap<>(desiredProperties);
        currentProperties.forEach((field, current) -> {
            Object desired = mergedProperties.get(field);
            if (desired == null) {
                mergedProperties.put(field, current);
            } else if (desired instanceof Map && current instanceof Map
                    && ((Map<String, Object>) desired).containsKey(KEY_PROPERTIES)
                    && ((Map<String, Object>) current).containsKey(KEY_PROPERTIES)) {
                mergedProperties.put(field, mergeProperties((Map<String, Object>) desired, (Map<String, Object>) current));
            }
        });

        Map<String, Object> merged = new LinkedHashMap<>(desiredObject);
        merged.put(KEY_PROPERTIES, mergedProperties);
        return merged;
    }

    protected static String cannotModifyMappingFieldTypeError(String name, List<String> typeChanges) {
        return "The datastore does not support modifying the type of a field from an existing index definition. "
            + "You are attempting to update type of fields (" + typeChanges + ") from the " + name + " index definition.";
    }

    protected static String withRemovalNote(String description, List<String> removals) {
        return removals.isEmpty() ? description : description + "\n\n" + MAPPING_REMOVAL_NOTE + " Fields: " + removals;
    }

    protected void countWriteAction(String action) {
        metricsProvider.counter(WRITE_ACTIONS_METRIC_NAME,
            Map.of(CLUSTER_TAG, datastoreClient.getClusterName(), ACTION_TAG, action,
                DRY_RUN_TAG, String.valueOf(datastoreClient.isDryRun()))).increment();
    }

    @SuppressWarnings("unchecked")
    private static List<String> mappingFieldsFrom(Map<String, Object> mapping, String prefix) {
        List<String> fields = new ArrayList<>();
        section(mapping, KEY_PROPERTIES).forEach((key, params) -> {
            String field = prefix + key;
            fields.add(field);
            if (params instanceof Map && ((Map<String, Object>) params).containsKey(KEY_PROPERTIES)) {
                fields.addAll(mappingFieldsFrom((Map<String, Object>) params, field + "."));
            }
        });
        return fields;
    }
}
