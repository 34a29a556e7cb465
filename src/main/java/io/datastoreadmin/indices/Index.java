package io.datastoreadmin.indices;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.models.FieldMetadata;
import io.datastoreadmin.util.HashUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;

/**
 * A single concrete index (no rollover).
 */
public class Index extends AbstractIndexDefinition {

    public Index(
            String name,
            String routeWith,
            List<Map<String, Object>> defaultSortClauses,
            Set<String> currentSources,
            Map<String, FieldMetadata> fieldsByPath,
            IndexDefinitionConfig envIndexConfig,
            Set<String> definedClusters,
            Map<String, DatastoreClient> datastoreClientsByName) {
        super(name, routeWith, defaultSortClauses, currentSources, fieldsByPath,
            envIndexConfig, definedClusters, datastoreClientsByName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> mappingsInDatastore(DatastoreClient datastoreClient) {
        Object mappings = HashUtil.dig(datastoreClient.getIndex(getName()), KEY_MAPPINGS);
        return IndexConfigNormalizer.normalizeMappings(
            mappings instanceof Map ? (Map<String, Object>) mappings : new LinkedHashMap<>());
    }

    // Missing indices are ignored by the client.
    @Override
    public void deleteFromDatastore(DatastoreClient datastoreClient) {
        datastoreClient.deleteIndices(getName());
    }

    @Override
    public boolean isRolloverIndexTemplate() {
        return false;
    }

    @Override
    public String indexExpressionForSearch() {
        return getName();
    }

    @Override
    public String indexNameForWrites(Map<String, Object> record, String timestampFieldPath) {
        return getName();
    }

    // Only rollover templates have related indices.
    @Override
    public List<RolloverIndex> relatedRolloverIndices(DatastoreClient datastoreClient, boolean onlyIfExists) {
        return List.of();
    }
}
