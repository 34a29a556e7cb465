package io.datastoreadmin.client;

import io.datastoreadmin.errors.BadDatastoreRequestException;
import io.datastoreadmin.indices.IndexConfigNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Datastore client backed by maps, behaving like the datastore where configurators depend on it:
 * settings come back flat with string values plus read-only settings, mapping updates are merged
 * into the existing mapping, field type changes and static setting changes are rejected.
 *
 * Every write is recorded in {@link #getWrites()}.
 */
public class InMemoryDatastoreClient implements DatastoreClient {

    private static final List<String> STATIC_SETTINGS = List.of("index.number_of_shards", "index.codec");

    private final String clusterName;
    private final Map<String, Object> persistentClusterSettings = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> indexTemplates = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> indices = new LinkedHashMap<>();
    private final List<String> writes = new ArrayList<>();

    public InMemoryDatastoreClient(String clusterName) {
        this.clusterName = clusterName;
    }

    public List<String> getWrites() {
        return writes;
    }

    public void clearWrites() {
        writes.clear();
    }

    @Override
    public String getClusterName() {
        return clusterName;
    }

    @Override
    public Map<String, Object> getFlatClusterSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("persistent", deepCopy(persistentClusterSettings));
        settings.put("transient", new LinkedHashMap<>());
        return settings;
    }

    @Override
    public void putPersistentClusterSettings(Map<String, Object> settings) {
        writes.add("putPersistentClusterSettings");
        persistentClusterSettings.putAll(settings);
    }

    @Override
    public Map<String, Object> getIndexTemplate(String name) {
        Map<String, Object> template = indexTemplates.get(name);
        return template == null ? new LinkedHashMap<>() : deepCopy(template);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void putIndexTemplate(String name, Map<String, Object> body) {
        writes.add("putIndexTemplate " + name);
        Map<String, Object> stored = deepCopy(body);
        Map<String, Object> template = (Map<String, Object>) stored.getOrDefault("template", new LinkedHashMap<>());
        template.put("settings", IndexConfigNormalizer.normalizeSettings(
            (Map<String, Object>) template.getOrDefault("settings", new LinkedHashMap<>())));
        template.putIfAbsent("mappings", new LinkedHashMap<>());
        stored.put("template", template);
        indexTemplates.put(name, stored);
    }

    @Override
    public void deleteIndexTemplate(String name) {
        writes.add("deleteIndexTemplate " + name);
        indexTemplates.remove(name);
    }

    @Override
    public Map<String, Object> getIndex(String name) {
        Map<String, Object> index = indices.get(name);
        return index == null ? new LinkedHashMap<>() : deepCopy(index);
    }

    @Override
    public List<String> listIndicesMatching(String expression) {
        Pattern pattern = wildcardPattern(expression);
        return indices.keySet().stream().filter(name -> pattern.matcher(name).matches()).collect(Collectors.toList());
    }

    @Override
    @SuppressWarnings("unchecked")
    public void createIndex(String index, Map<String, Object> body) {
        writes.add("createIndex " + index);
        if (indices.containsKey(index)) {
            throw new BadDatastoreRequestException("[400] resource_already_exists_exception: index [" + index + "]");
        }

        Map<String, Object> settings = IndexConfigNormalizer.normalizeSettings(
            (Map<String, Object>) body.getOrDefault("settings", new LinkedHashMap<>()));
        settings.put("index.uuid", "uuid-" + index);
        settings.put("index.provided_name", index);
        settings.put("index.creation_date", "1587666343511");

        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("mappings", deepCopy((Map<String, Object>) body.getOrDefault("mappings", new LinkedHashMap<>())));
        stored.put("settings", settings);
        indices.put(index, stored);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void putIndexMapping(String index, Map<String, Object> body) {
        writes.add("putIndexMapping " + index);
        Map<String, Object> stored = existingIndex(index);
        Map<String, Object> currentMapping = (Map<String, Object>) stored.get("mappings");
        stored.put("mappings", mergeMapping(index, currentMapping, deepCopy(body)));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void putIndexSettings(String index, Map<String, Object> body) {
        writes.add("putIndexSettings " + index);
        Map<String, Object> settings = (Map<String, Object>) existingIndex(index).get("settings");

        body.forEach((name, value) -> {
            String fullName = name.startsWith("index.") ? name : "index." + name;
            if (STATIC_SETTINGS.contains(fullName) && !Objects.equals(settings.get(fullName), Objects.toString(value, null))) {
                throw new BadDatastoreRequestException("[400] illegal_argument_exception: Can't update non dynamic settings [["
                    + fullName + "]] for open indices [[" + index + "]]");
            }
        });

        body.forEach((name, value) -> {
            String fullName = name.startsWith("index.") ? name : "index." + name;
            if (value == null) {
                settings.remove(fullName);
            } else {
                settings.put(fullName, value.toString());
            }
        });
    }

    @Override
    public void deleteIndices(String... names) {
        writes.add("deleteIndices " + String.join(",", names));
        for (String name : names) {
            Pattern pattern = wildcardPattern(name);
            indices.keySet().removeIf(index -> pattern.matcher(index).matches());
        }
    }

    private Map<String, Object> existingIndex(String index) {
        Map<String, Object> stored = indices.get(index);
        if (stored == null) {
            throw new BadDatastoreRequestException("[404] index_not_found_exception: no such index [" + index + "]");
        }
        return stored;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mergeMapping(String index, Map<String, Object> current, Map<String, Object> update) {
        Map<String, Object> merged = new LinkedHashMap<>(current);
        update.forEach((key, value) -> {
            if ("properties".equals(key) && current.get(key) instanceof Map && value instanceof Map) {
                Map<String, Object> properties = new LinkedHashMap<>((Map<String, Object>) current.get(key));
                ((Map<String, Object>) value).forEach((field, fieldMapping) -> {
                    Object existing = properties.get(field);
                    if (existing instanceof Map && fieldMapping instanceof Map) {
                        Object existingType = ((Map<String, Object>) existing).get("type");
                        Object newType = ((Map<String, Object>) fieldMapping).get("type");
                        if (existingType != null && newType != null && !existingType.equals(newType)) {
                            throw new BadDatastoreRequestException("[400] illegal_argument_exception: mapper [" + field
                                + "] cannot be changed from type [" + existingType + "] to [" + newType + "] on " + index);
                        }
                        properties.put(field, mergeField(index, (Map<String, Object>) existing, (Map<String, Object>) fieldMapping));
                    } else {
                        properties.put(field, fieldMapping);
                    }
                });
                merged.put(key, properties);
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    // Field params omitted from an update (such as `meta`) are dropped; sub-fields are kept.
    private static Map<String, Object> mergeField(String index, Map<String, Object> current, Map<String, Object> update) {
        Map<String, Object> merged = new LinkedHashMap<>(update);
        if (!update.containsKey("type") && current.containsKey("type")) {
            merged.put("type", current.get("type"));
        }
        if (current.get("properties") instanceof Map) {
            Map<String, Object> existingProperties = Map.of("properties", current.get("properties"));
            Map<String, Object> updatedProperties = update.get("properties") instanceof Map
                ? mergeMapping(index, existingProperties, Map.of("properties", update.get("properties")))
                : existingProperties;
            merged.put("properties", updatedProperties.get("properties"));
        }
        return merged;
    }

    private static Pattern wildcardPattern(String expression) {
        return Pattern.compile(Pattern.quote(expression).replace("*", "\\E.*\\Q"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (value instanceof Map) {
                copy.put(key, deepCopy((Map<String, Object>) value));
            } else if (value instanceof List) {
                copy.put(key, new ArrayList<>((List<Object>) value));
            } else {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
