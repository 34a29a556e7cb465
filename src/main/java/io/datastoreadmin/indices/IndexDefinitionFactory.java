package io.datastoreadmin.indices;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.DatastoreConfig;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.models.IndexDefinitionMetadata;
import io.datastoreadmin.models.RolloverMetadata;
import io.datastoreadmin.models.RuntimeMetadata;
import io.datastoreadmin.models.SortField;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds {@link IndexDefinition}s from schema runtime metadata and the environment's datastore config.
 * Definitions with rollover metadata become {@link RolloverIndexTemplate}s, the rest {@link Index}es.
 */
@Slf4j
public class IndexDefinitionFactory {

    private final DatastoreConfig datastoreConfig;
    private final Map<String, DatastoreClient> datastoreClientsByName;

    public IndexDefinitionFactory(DatastoreConfig datastoreConfig, Map<String, DatastoreClient> datastoreClientsByName) {
        this.datastoreConfig = datastoreConfig;
        this.datastoreClientsByName = datastoreClientsByName;
    }

    public Map<String, IndexDefinition> createAll(RuntimeMetadata runtimeMetadata) {
        Map<String, IndexDefinition> result = new LinkedHashMap<>();
        runtimeMetadata.getIndexDefinitionsByName().forEach((name, metadata) -> result.put(name, create(name, metadata)));
        log.info("Built {} index definitions: {}", result.size(), result.keySet());
        return result;
    }

    public IndexDefinition create(String name, IndexDefinitionMetadata metadata) {
        IndexDefinitionConfig envIndexConfig = datastoreConfig.getIndexDefinitions().get(name);
        if (envIndexConfig == null) {
            throw new ConfigException("Configuration does not provide an index definition for `" + name
                + "`, but it is required so we can identify the datastore cluster(s) to query and index into.");
        }

        List<Map<String, Object>> defaultSortClauses = metadata.getDefaultSortFields().stream()
            .map(SortField::toSortClause)
            .collect(Collectors.toList());
        Set<String> definedClusters = datastoreConfig.getClusters().keySet();

        RolloverMetadata rollover = metadata.getRollover();
        if (rollover == null) {
            return new Index(name, metadata.getRouteWith(), defaultSortClauses, metadata.getCurrentSources(),
                metadata.getFieldsByPath(), envIndexConfig, definedClusters, datastoreClientsByName);
        }

        return new RolloverIndexTemplate(name, metadata.getRouteWith(), defaultSortClauses, metadata.getCurrentSources(),
            metadata.getFieldsByPath(), envIndexConfig, definedClusters, datastoreClientsByName,
            rollover.getTimestampFieldPath(), rollover.getFrequency());
    }
}
