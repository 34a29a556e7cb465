package io.datastoreadmin.indices;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.client.InMemoryDatastoreClient;
import io.datastoreadmin.config.ClusterDefinition;
import io.datastoreadmin.config.DatastoreConfig;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.enums.RolloverFrequency;
import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.errors.SchemaException;
import io.datastoreadmin.models.FieldMetadata;
import io.datastoreadmin.models.IndexDefinitionMetadata;
import io.datastoreadmin.models.RolloverMetadata;
import io.datastoreadmin.models.RuntimeMetadata;
import io.datastoreadmin.models.SortField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexDefinitionFactoryTest {

    private Map<String, DatastoreClient> clients;
    private IndexDefinitionFactory factory;

    @BeforeEach
    void setUp() {
        clients = Map.of("main", new InMemoryDatastoreClient("main"));

        Map<String, IndexDefinitionConfig> indexDefinitions = new LinkedHashMap<>();
        indexDefinitions.put("components", config());
        indexDefinitions.put("widgets", config());

        DatastoreConfig datastoreConfig = new DatastoreConfig(
            Map.of("main", new ClusterDefinition("http://localhost:9200", "opensearch", Map.of())),
            indexDefinitions, false, 3, 30_000L);
        factory = new IndexDefinitionFactory(datastoreConfig, clients);
    }

    @Test
    void testCreate_IndexWithoutRollover() {
        // Given
        IndexDefinitionMetadata metadata = IndexDefinitionMetadata.builder()
            .routeWith("workspace_id")
            .defaultSortFields(List.of(new SortField("created_at", "desc")))
            .currentSources(Set.of("__self"))
            .fieldsByPath(Map.of("name", new FieldMetadata("__self")))
            .build();

        // When
        IndexDefinition definition = factory.create("components", metadata);

        // Then
        assertThat(definition).isInstanceOf(Index.class);
        assertThat(definition.getName()).isEqualTo("components");
        assertThat(definition.getRouteWith()).isEqualTo("workspace_id");
        assertThat(definition.getDefaultSortClauses()).containsExactly(Map.of("created_at", Map.of("order", "desc")));
        assertThat(definition.getCurrentSources()).containsExactly("__self");
        assertThat(definition.getFieldsByPath()).containsOnlyKeys("name");
        assertThat(definition.getEnvIndexConfig()).isEqualTo(config());
        assertThat(definition.allAccessibleClusterNames()).containsExactly("main");
    }

    @Test
    void testCreate_RolloverIndexTemplate() {
        IndexDefinitionMetadata metadata = IndexDefinitionMetadata.builder()
            .rollover(new RolloverMetadata("daily", "created_at"))
            .build();

        IndexDefinition definition = factory.create("widgets", metadata);

        assertThat(definition).isInstanceOf(RolloverIndexTemplate.class);
        RolloverIndexTemplate template = (RolloverIndexTemplate) definition;
        assertThat(template.getFrequency()).isEqualTo(RolloverFrequency.DAILY);
        assertThat(template.getTimestampFieldPath()).isEqualTo("created_at");
        assertThat(template.getRouteWith()).isEqualTo("id");
        assertThat(template.getDatastoreClientsByName()).isEqualTo(clients);
    }

    @Test
    void testCreate_InvalidRolloverFrequency() {
        IndexDefinitionMetadata metadata = IndexDefinitionMetadata.builder()
            .rollover(new RolloverMetadata("fortnightly", "created_at"))
            .build();

        assertThatThrownBy(() -> factory.create("widgets", metadata))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("fortnightly");
    }

    @Test
    void testCreate_MissingEnvConfig() {
        assertThatThrownBy(() -> factory.create("gadgets", IndexDefinitionMetadata.builder().build()))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("`gadgets`");
    }

    @Test
    void testCreateAll_PreservesOrder() {
        Map<String, IndexDefinitionMetadata> metadataByName = new LinkedHashMap<>();
        metadataByName.put("widgets", IndexDefinitionMetadata.builder()
            .rollover(new RolloverMetadata("monthly", "created_at")).build());
        metadataByName.put("components", IndexDefinitionMetadata.builder().build());

        Map<String, IndexDefinition> definitions = factory.createAll(new RuntimeMetadata(metadataByName));

        assertThat(definitions).containsOnlyKeys("widgets", "components");
        assertThat(definitions.keySet()).containsExactly("widgets", "components");
        assertThat(definitions.get("widgets").isRolloverIndexTemplate()).isTrue();
        assertThat(definitions.get("components").isRolloverIndexTemplate()).isFalse();
    }

    private static IndexDefinitionConfig config() {
        return new IndexDefinitionConfig(List.of(), "main", List.of("main"), Map.of(), Map.of(), List.of(), true);
    }
}
