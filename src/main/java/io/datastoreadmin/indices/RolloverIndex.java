package io.datastoreadmin.indices;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.models.FieldMetadata;
import io.datastoreadmin.util.TimeSet;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A concrete index belonging to a {@link RolloverIndexTemplate}, together with the time set of
 * records it holds. Behaves exactly like the wrapped {@link Index}.
 *
 * Two rollover indices are equal when their indices and time sets are equal.
 */
public final class RolloverIndex implements IndexDefinition {

    private final Index index;
    private final TimeSet timeSet;

    public RolloverIndex(Index index, TimeSet timeSet) {
        this.index = Objects.requireNonNull(index, "index");
        this.timeSet = Objects.requireNonNull(timeSet, "timeSet");
    }

    public Index getIndex() {
        return index;
    }

    public TimeSet getTimeSet() {
        return timeSet;
    }

    @Override
    public String getName() {
        return index.getName();
    }

    @Override
    public String getRouteWith() {
        return index.getRouteWith();
    }

    @Override
    public List<Map<String, Object>> getDefaultSortClauses() {
        return index.getDefaultSortClauses();
    }

    @Override
    public Set<String> getCurrentSources() {
        return index.getCurrentSources();
    }

    @Override
    public Map<String, FieldMetadata> getFieldsByPath() {
        return index.getFieldsByPath();
    }

    @Override
    public IndexDefinitionConfig getEnvIndexConfig() {
        return index.getEnvIndexConfig();
    }

    @Override
    public Map<String, Object> flattenedEnvSettingOverrides() {
        return index.flattenedEnvSettingOverrides();
    }

    @Override
    public String routingValueForPreparedRecord(Map<String, Object> preparedRecord, String routeWithPath, String idPath) {
        return index.routingValueForPreparedRecord(preparedRecord, routeWithPath, idPath);
    }

    @Override
    public boolean hasCustomRouting() {
        return index.hasCustomRouting();
    }

    @Override
    public String clusterToQuery() {
        return index.clusterToQuery();
    }

    @Override
    public List<String> clustersToIndexInto() {
        return index.clustersToIndexInto();
    }

    @Override
    public boolean useUpdatesForIndexing() {
        return index.useUpdatesForIndexing();
    }

    @Override
    public Set<String> ignoredValuesForRouting() {
        return index.ignoredValuesForRouting();
    }

    @Override
    public List<String> allAccessibleClusterNames() {
        return index.allAccessibleClusterNames();
    }

    @Override
    public List<String> accessibleClusterNamesToIndexInto() {
        return index.accessibleClusterNamesToIndexInto();
    }

    @Override
    public boolean isAccessibleFromQueries() {
        return index.isAccessibleFromQueries();
    }

    @Override
    public boolean searchesCouldHitIncompleteDocs() {
        return index.searchesCouldHitIncompleteDocs();
    }

    @Override
    public List<RolloverIndex> knownRelatedQueryRolloverIndices() {
        return index.knownRelatedQueryRolloverIndices();
    }

    @Override
    public Set<String> listCountsFieldPathsForSource(String source) {
        return index.listCountsFieldPathsForSource(source);
    }

    @Override
    public Map<String, Object> mappingsInDatastore(DatastoreClient datastoreClient) {
        return index.mappingsInDatastore(datastoreClient);
    }

    @Override
    public void deleteFromDatastore(DatastoreClient datastoreClient) {
        index.deleteFromDatastore(datastoreClient);
    }

    @Override
    public boolean isRolloverIndexTemplate() {
        return false;
    }

    @Override
    public String indexExpressionForSearch() {
        return index.indexExpressionForSearch();
    }

    @Override
    public String indexNameForWrites(Map<String, Object> record, String timestampFieldPath) {
        return index.indexNameForWrites(record, timestampFieldPath);
    }

    @Override
    public List<RolloverIndex> relatedRolloverIndices(DatastoreClient datastoreClient, boolean onlyIfExists) {
        return index.relatedRolloverIndices(datastoreClient, onlyIfExists);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RolloverIndex)) return false;
        RolloverIndex that = (RolloverIndex) o;
        return index.equals(that.index) && timeSet.equals(that.timeSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, timeSet);
    }

    @Override
    public String toString() {
        return "RolloverIndex(" + index.getName() + ", " + timeSet + ")";
    }
}
