package io.datastoreadmin.indices;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.models.FieldMetadata;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.datastoreadmin.config.Constants.DEFAULT_ID_PATH;

/**
 * A logical index defined by the schema: either a single concrete index ({@link Index}) or a
 * rollover index template ({@link RolloverIndexTemplate}) backing a series of time-partitioned indices.
 */
public interface IndexDefinition {

    String getName();

    /**
     * Field path used for routing; {@code "id"} means no custom routing.
     */
    String getRouteWith();

    List<Map<String, Object>> getDefaultSortClauses();

    Set<String> getCurrentSources();

    Map<String, FieldMetadata> getFieldsByPath();

    IndexDefinitionConfig getEnvIndexConfig();

    /**
     * Environment setting overrides, flattened under the {@code index.} prefix so they can be used
     * directly in a create index request.
     */
    Map<String, Object> flattenedEnvSettingOverrides();

    default String routingValueForPreparedRecord(Map<String, Object> preparedRecord) {
        return routingValueForPreparedRecord(preparedRecord, getRouteWith(), DEFAULT_ID_PATH);
    }

    /**
     * Routing value for a record already prepared for indexing, or null when the index does not use custom routing.
     * Records whose routing value is one of the ignored routing values are routed by their id.
     */
    String routingValueForPreparedRecord(Map<String, Object> preparedRecord, String routeWithPath, String idPath);

    boolean hasCustomRouting();

    String clusterToQuery();

    List<String> clustersToIndexInto();

    boolean useUpdatesForIndexing();

    Set<String> ignoredValuesForRouting();

    /**
     * Names of the defined clusters this index resides in (query cluster and clusters indexed into).
     */
    List<String> allAccessibleClusterNames();

    List<String> accessibleClusterNamesToIndexInto();

    boolean isAccessibleFromQueries();

    /**
     * Whether searches may hit documents populated by only some of their sources.
     * Computed at most once per instance.
     */
    boolean searchesCouldHitIncompleteDocs();

    /**
     * Related rollover indices that exist in the query cluster. Computed at most once per instance, so it
     * may be out of date; use {@link #relatedRolloverIndices} when an up-to-date list is required.
     */
    List<RolloverIndex> knownRelatedQueryRolloverIndices();

    Set<String> listCountsFieldPathsForSource(String source);

    /**
     * Normalized mappings of this index (or template) as currently stored in the datastore.
     */
    Map<String, Object> mappingsInDatastore(DatastoreClient datastoreClient);

    void deleteFromDatastore(DatastoreClient datastoreClient);

    boolean isRolloverIndexTemplate();

    String indexExpressionForSearch();

    default String indexNameForWrites(Map<String, Object> record) {
        return indexNameForWrites(record, null);
    }

    /**
     * Name of the index a record is written to.
     *
     * @param timestampFieldPath overrides the configured rollover timestamp field path when non-null
     */
    String indexNameForWrites(Map<String, Object> record, String timestampFieldPath);

    /**
     * Concrete rollover indices related to this definition, from the datastore and from configuration.
     *
     * @param onlyIfExists drop configured indices that do not exist in the datastore
     */
    List<RolloverIndex> relatedRolloverIndices(DatastoreClient datastoreClient, boolean onlyIfExists);
}
