package io.datastoreadmin.indices;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.client.InMemoryDatastoreClient;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.models.FieldMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexTest {

    @Mock
    private DatastoreClient mockClient;

    @Test
    void testRoutingValueForPreparedRecord_DefaultRouting() {
        Index index = index("id", config("main", List.of("main")), Map.of());

        assertThat(index.hasCustomRouting()).isFalse();
        assertThat(index.routingValueForPreparedRecord(Map.of("id", "abc"))).isNull();
    }

    @Test
    void testRoutingValueForPreparedRecord_CustomRouting() {
        Index index = index("workspace_id", config("main", List.of("main")), Map.of());

        assertThat(index.hasCustomRouting()).isTrue();
        assertThat(index.routingValueForPreparedRecord(Map.of("id", "abc", "workspace_id", "ws1"))).isEqualTo("ws1");
    }

    @Test
    void testRoutingValueForPreparedRecord_IgnoredRoutingValueFallsBackToId() {
        IndexDefinitionConfig config = new IndexDefinitionConfig(
            List.of("ignored_ws"), "main", List.of("main"), Map.of(), Map.of(), List.of(), true);
        Index index = index("workspace_id", config, Map.of());

        assertThat(index.routingValueForPreparedRecord(Map.of("id", "abc", "workspace_id", "ignored_ws"))).isEqualTo("abc");
    }

    @Test
    void testRoutingValueForPreparedRecord_NullValueRoutesAsEmptyString() {
        // Given
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", "abc");
        record.put("workspace_id", null);
        Index index = index("workspace_id", config("main", List.of("main")), Map.of());

        // When
        String routingValue = index.routingValueForPreparedRecord(record);

        // Then
        assertThat(routingValue).isEmpty();
    }

    @Test
    void testRoutingValueForPreparedRecord_NestedPaths() {
        Index index = index("nested.workspace_id", config("main", List.of("main")), Map.of());

        assertThat(index.routingValueForPreparedRecord(
            Map.of("key", "abc", "nested", Map.of("workspace_id", "ws1")), "nested.workspace_id", "key"))
            .isEqualTo("ws1");
    }

    @Test
    void testRoutingValueForPreparedRecord_MisconfiguredRoutePath() {
        Index index = index("workspace_id", config("main", List.of("main")), Map.of());

        assertThatThrownBy(() -> index.routingValueForPreparedRecord(Map.of("id", "abc"), null, "id"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Index(components)")
            .hasMessageContaining("route_with_path");
    }

    @Test
    void testClustersToIndexInto_Missing() {
        Index index = index("id", config("main", null), Map.of());

        assertThatThrownBy(index::clustersToIndexInto)
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("index_into_clusters");
    }

    @Test
    void testAccessibleClusterNames_OnlyDefinedClusters() {
        Index index = index("id", config("other", List.of("main", "undefined")), Map.of());

        assertThat(index.allAccessibleClusterNames()).containsExactly("main", "other");
        assertThat(index.accessibleClusterNamesToIndexInto()).containsExactly("main");
        assertThat(index.isAccessibleFromQueries()).isTrue();
        assertThat(index("id", config("undefined", List.of("main")), Map.of()).isAccessibleFromQueries()).isFalse();
        assertThat(index("id", config(null, List.of("main")), Map.of()).isAccessibleFromQueries()).isFalse();
    }

    @Test
    void testSearchesCouldHitIncompleteDocs_MultipleCurrentSources() {
        Index index = new Index("components", "id", List.of(), Set.of("__self", "other"), Map.of(),
            config("main", List.of("main")), Set.of("main"), Map.of("main", mockClient));

        assertThat(index.searchesCouldHitIncompleteDocs()).isTrue();
    }

    @Test
    void testSearchesCouldHitIncompleteDocs_RecordedSources() {
        // Given
        InMemoryDatastoreClient client = new InMemoryDatastoreClient("main");
        Map<String, Object> mappings = new LinkedHashMap<>();
        mappings.put("_meta", Map.of("ElasticGraph", Map.of("sources", List.of("__self", "retired_source"))));
        client.createIndex("components", Map.of("mappings", mappings));

        Index index = index("id", config("main", List.of("main")), Map.of("main", client));

        // Then
        assertThat(index.searchesCouldHitIncompleteDocs()).isTrue();
    }

    @Test
    void testSearchesCouldHitIncompleteDocs_SingleSourceIsMemoized() {
        // Given
        when(mockClient.getIndex("components")).thenReturn(Map.of());
        Index index = index("id", config("main", List.of("main")), Map.of("main", mockClient));

        // When
        boolean first = index.searchesCouldHitIncompleteDocs();
        boolean second = index.searchesCouldHitIncompleteDocs();

        // Then
        assertThat(first).isFalse();
        assertThat(second).isFalse();
        verify(mockClient, times(1)).getIndex("components");
    }

    @Test
    void testListCountsFieldPathsForSource() {
        Map<String, FieldMetadata> fields = Map.of(
            "name", new FieldMetadata("__self"),
            "__counts.tags", new FieldMetadata("__self"),
            "parts.__counts.tags", new FieldMetadata("other"));
        Index index = index("id", config("main", List.of("main")), Map.of(), fields);

        assertThat(index.listCountsFieldPathsForSource("__self")).containsExactly("__counts.tags");
        assertThat(index.listCountsFieldPathsForSource("other")).containsExactly("parts.__counts.tags");
        assertThat(index.listCountsFieldPathsForSource("missing")).isEmpty();
    }

    @Test
    void testFlattenedEnvSettingOverrides() {
        IndexDefinitionConfig config = new IndexDefinitionConfig(List.of(), "main", List.of("main"),
            Map.of("number_of_shards", 3, "mapping", Map.of("total_fields", Map.of("limit", 2000))), Map.of(), List.of(), true);

        assertThat(index("id", config, Map.of()).flattenedEnvSettingOverrides()).containsOnly(
            Map.entry("index.number_of_shards", 3),
            Map.entry("index.mapping.total_fields.limit", 2000));
    }

    @Test
    void testNamesAndRelatedIndices() {
        Index index = index("id", config("main", List.of("main")), Map.of("main", mockClient));

        assertThat(index.indexExpressionForSearch()).isEqualTo("components");
        assertThat(index.indexNameForWrites(Map.of("id", "1"))).isEqualTo("components");
        assertThat(index.isRolloverIndexTemplate()).isFalse();
        assertThat(index.relatedRolloverIndices(mockClient, false)).isEmpty();
        assertThat(index.knownRelatedQueryRolloverIndices()).isEmpty();
        assertThat(index).hasToString("Index(components)");
    }

    @Test
    void testMappingsInDatastore_Normalized() {
        when(mockClient.getIndex("components")).thenReturn(Map.of("mappings",
            Map.of("properties", Map.of("nested", Map.of("type", "object", "properties", Map.of())))));

        Index index = index("id", config("main", List.of("main")), Map.of());

        assertThat(index.mappingsInDatastore(mockClient))
            .isEqualTo(Map.of("properties", Map.of("nested", Map.of("properties", Map.of()))));
    }

    @Test
    void testDeleteFromDatastore() {
        index("id", config("main", List.of("main")), Map.of()).deleteFromDatastore(mockClient);

        verify(mockClient).deleteIndices("components");
    }

    @Test
    void testDatastoreClientFor_UnknownCluster() {
        Index index = index("id", config("missing", List.of("main")), Map.of());

        assertThatThrownBy(index::searchesCouldHitIncompleteDocs)
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void testEquality() {
        assertThat(index("id", config("main", List.of("main")), Map.of()))
            .isEqualTo(index("id", config("main", List.of("main")), Map.of()))
            .isNotEqualTo(index("workspace_id", config("main", List.of("main")), Map.of()));
    }

    static Index index(String routeWith, IndexDefinitionConfig config, Map<String, DatastoreClient> clients) {
        return index(routeWith, config, clients, Map.of());
    }

    static Index index(String routeWith, IndexDefinitionConfig config, Map<String, DatastoreClient> clients,
                       Map<String, FieldMetadata> fieldsByPath) {
        return new Index("components", routeWith, List.of(), Set.of("__self"), fieldsByPath, config,
            Set.of("main", "other"), clients);
    }

    static IndexDefinitionConfig config(String queryCluster, List<String> indexIntoClusters) {
        return new IndexDefinitionConfig(List.of(), queryCluster, indexIntoClusters, Map.of(), Map.of(), List.of(), true);
    }
}
