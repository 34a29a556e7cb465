package io.datastoreadmin.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DryRunDatastoreClientTest {

    @Mock
    private DatastoreClient wrappedClient;

    private DryRunDatastoreClient dryRunClient;

    @BeforeEach
    void setUp() {
        dryRunClient = new DryRunDatastoreClient(wrappedClient);
    }

    @Test
    void testReadsAreDelegated() {
        // Given
        when(wrappedClient.getIndex("components")).thenReturn(Map.of("mappings", Map.of()));
        when(wrappedClient.getIndexTemplate("widgets")).thenReturn(Map.of("index_patterns", List.of("widgets_rollover__*")));
        when(wrappedClient.listIndicesMatching("widgets_rollover__*")).thenReturn(List.of("widgets_rollover__2020-04"));
        when(wrappedClient.getFlatClusterSettings()).thenReturn(Map.of("persistent", Map.of()));

        // Then
        assertThat(dryRunClient.getIndex("components")).containsOnlyKeys("mappings");
        assertThat(dryRunClient.getIndexTemplate("widgets")).containsKey("index_patterns");
        assertThat(dryRunClient.listIndicesMatching("widgets_rollover__*")).containsExactly("widgets_rollover__2020-04");
        assertThat(dryRunClient.getFlatClusterSettings()).containsKey("persistent");
    }

    @Test
    void testIsDryRun() {
        assertThat(dryRunClient.isDryRun()).isTrue();
        assertThat(new InMemoryDatastoreClient("main").isDryRun()).isFalse();
    }

    @Test
    void testWritesAreSkipped() {
        // Given
        when(wrappedClient.getClusterName()).thenReturn("main");

        // When
        dryRunClient.putPersistentClusterSettings(Map.of("action.auto_create_index", "+.kibana*"));
        dryRunClient.putIndexTemplate("widgets", Map.of());
        dryRunClient.deleteIndexTemplate("widgets");
        dryRunClient.createIndex("components", Map.of());
        dryRunClient.putIndexMapping("components", Map.of());
        dryRunClient.putIndexSettings("components", Map.of());
        dryRunClient.deleteIndices("components");

        // Then
        assertThat(dryRunClient.getClusterName()).isEqualTo("main");
        verify(wrappedClient, atLeastOnce()).getClusterName();
        verifyNoMoreInteractions(wrappedClient);
    }
}
