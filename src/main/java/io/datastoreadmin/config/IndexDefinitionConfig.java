package io.datastoreadmin.config;

import io.datastoreadmin.errors.ConfigException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Environment-specific configuration of a single index definition, from the
 * {@code datastore.index_definitions} section of the config file.
 */
@Getter
@ToString
@EqualsAndHashCode
public class IndexDefinitionConfig {

    private final Set<String> ignoreRoutingValues;
    private final String queryCluster;
    // null when not configured; accessing the clusters to index into then fails.
    private final List<String> indexIntoClusters;
    private final Map<String, Object> settingOverrides;
    private final Map<String, Map<String, Object>> settingOverridesByTimestamp;
    private final List<CustomTimestampRange> customTimestampRanges;
    private final boolean useUpdatesForIndexing;

    public IndexDefinitionConfig(
            Collection<String> ignoreRoutingValues,
            String queryCluster,
            List<String> indexIntoClusters,
            Map<String, Object> settingOverrides,
            Map<String, Map<String, Object>> settingOverridesByTimestamp,
            List<CustomTimestampRange> customTimestampRanges,
            boolean useUpdatesForIndexing) {
        this.ignoreRoutingValues = ignoreRoutingValues == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(ignoreRoutingValues));
        this.queryCluster = queryCluster;
        this.indexIntoClusters = indexIntoClusters == null ? null : List.copyOf(indexIntoClusters);
        this.settingOverrides = unmodifiableCopy(settingOverrides);
        this.settingOverridesByTimestamp = settingOverridesByTimestamp == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(settingOverridesByTimestamp));
        this.customTimestampRanges = customTimestampRanges == null ? List.of() : List.copyOf(customTimestampRanges);
        this.useUpdatesForIndexing = useUpdatesForIndexing;

        verifyCustomTimestampRangesAreDisjoint();
    }

    /**
     * Builds the config of every index definition from the parsed {@code index_definitions} YAML section.
     */
    public static Map<String, IndexDefinitionConfig> definitionsByNameFrom(Map<String, Map<String, Object>> indexDefMapsByName) {
        Map<String, IndexDefinitionConfig> result = new LinkedHashMap<>();
        if (indexDefMapsByName != null) {
            indexDefMapsByName.forEach((name, indexDefMap) -> result.put(name, from(name, indexDefMap)));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    static IndexDefinitionConfig from(String name, Map<String, Object> map) {
        Map<String, Object> source = map == null ? Map.of() : map;
        List<String> unknownKeys = new ArrayList<>(source.keySet());
        unknownKeys.removeAll(List.of("ignore_routing_values", "query_cluster", "index_into_clusters",
            "setting_overrides", "setting_overrides_by_timestamp", "custom_timestamp_ranges", "use_updates_for_indexing"));
        if (!unknownKeys.isEmpty()) {
            throw new ConfigException("Unknown settings for index definition `" + name + "`: " + String.join(", ", unknownKeys));
        }

        Object useUpdates = source.get("use_updates_for_indexing");

        return new IndexDefinitionConfig(
            (List<String>) source.get("ignore_routing_values"),
            (String) source.get("query_cluster"),
            (List<String>) source.get("index_into_clusters"),
            (Map<String, Object>) source.get("setting_overrides"),
            overridesByTimestampFrom((Map<Object, Map<String, Object>>) source.get("setting_overrides_by_timestamp")),
            CustomTimestampRange.rangesFrom((List<Map<String, Object>>) source.get("custom_timestamp_ranges")),
            useUpdates == null || Boolean.parseBoolean(useUpdates.toString())
        );
    }

    /**
     * Returns a copy without any of the per-environment index setting overrides.
     */
    public IndexDefinitionConfig withoutEnvOverrides() {
        return new IndexDefinitionConfig(ignoreRoutingValues, queryCluster, indexIntoClusters,
            Map.of(), Map.of(), List.of(), useUpdatesForIndexing);
    }

    public IndexDefinitionConfig withSettingOverrides(Map<String, Object> newSettingOverrides) {
        return new IndexDefinitionConfig(ignoreRoutingValues, queryCluster, indexIntoClusters,
            newSettingOverrides, settingOverridesByTimestamp, customTimestampRanges, useUpdatesForIndexing);
    }

    /**
     * Returns the first configured custom timestamp range (in declaration order) containing the
     * given timestamp, or null if none does.
     */
    public CustomTimestampRange customTimestampRangeFor(Instant timestamp) {
        for (CustomTimestampRange range : customTimestampRanges) {
            if (range.getTimeSet().contains(timestamp)) {
                return range;
            }
        }
        return null;
    }

    // SnakeYAML resolves unquoted timestamp keys to dates; keys are kept as ISO-8601 strings.
    private static Map<String, Map<String, Object>> overridesByTimestampFrom(Map<Object, Map<String, Object>> rawOverrides) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        if (rawOverrides != null) {
            rawOverrides.forEach((timestamp, overrides) -> result.put(
                timestamp instanceof Date ? ((Date) timestamp).toInstant().toString() : String.valueOf(timestamp),
                overrides == null ? Map.of() : overrides));
        }
        return result;
    }

    private void verifyCustomTimestampRangesAreDisjoint() {
        for (int i = 0; i < customTimestampRanges.size(); i++) {
            for (int j = i + 1; j < customTimestampRanges.size(); j++) {
                if (customTimestampRanges.get(i).getTimeSet().intersects(customTimestampRanges.get(j).getTimeSet())) {
                    throw new ConfigException("Your configured `custom_timestamp_ranges` are not disjoint, as required. "
                        + "Ranges `" + customTimestampRanges.get(i).getIndexNameSuffix() + "` and `"
                        + customTimestampRanges.get(j).getIndexNameSuffix() + "` overlap.");
                }
            }
        }
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
