package io.datastoreadmin.client;

import io.datastoreadmin.errors.BadDatastoreRequestException;
import io.datastoreadmin.errors.DatastoreAdminException;
import io.datastoreadmin.errors.RequestExceededDeadlineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpDatastoreClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private HttpDatastoreClient client;

    @BeforeEach
    void setUp() {
        client = new HttpDatastoreClient("main", "http://localhost:9200/", httpClient, false, 2, 5_000L);
    }

    @Test
    void testGetIndex_ParsesMappingsAndSettings() throws Exception {
        // Given
        respondWith(200, "{\"components\":{\"aliases\":{},"
            + "\"mappings\":{\"properties\":{\"id\":{\"type\":\"keyword\"}}},"
            + "\"settings\":{\"index.number_of_shards\":\"1\"}}}");

        // When
        Map<String, Object> index = client.getIndex("components");

        // Then
        assertThat(index).containsOnlyKeys("mappings", "settings");
        assertThat(index.get("mappings")).isEqualTo(Map.of("properties", Map.of("id", Map.of("type", "keyword"))));
        assertThat(index.get("settings")).isEqualTo(Map.of("index.number_of_shards", "1"));

        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.uri()).isEqualTo(URI.create("http://localhost:9200/components?flat_settings=true&ignore_unavailable=true"));
        assertThat(request.timeout()).hasValueSatisfying(timeout -> assertThat(timeout.toMillis()).isEqualTo(5_000L));
    }

    @Test
    void testGetIndex_NotFoundIsEmpty() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(404);

        assertThat(client.getIndex("missing")).isEmpty();
    }

    @Test
    void testGetIndexTemplate_PicksNamedTemplate() throws Exception {
        respondWith(200, "{\"index_templates\":[{\"name\":\"widgets\",\"index_template\":{"
            + "\"index_patterns\":[\"widgets_rollover__*\"],"
            + "\"template\":{\"settings\":{\"index.number_of_shards\":\"1\"}},"
            + "\"composed_of\":[]}}]}");

        Map<String, Object> template = client.getIndexTemplate("widgets");

        assertThat(template).containsOnlyKeys("index_patterns", "template");
        assertThat(template.get("index_patterns")).isEqualTo(List.of("widgets_rollover__*"));
        assertThat(sentRequest().uri().getPath()).isEqualTo("/_index_template/widgets");
    }

    @Test
    void testListIndicesMatching() throws Exception {
        respondWith(200, "[{\"index\":\"widgets_rollover__2020-03\"},{\"index\":\"widgets_rollover__2020-04\"}]");

        assertThat(client.listIndicesMatching("widgets_rollover__*"))
            .containsExactly("widgets_rollover__2020-03", "widgets_rollover__2020-04");
        assertThat(sentRequest().uri().toString())
            .isEqualTo("http://localhost:9200/_cat/indices/widgets_rollover__*?format=json&h=index");
    }

    @Test
    void testPutPersistentClusterSettings_SendsJsonBody() throws Exception {
        respondWith(200, "{\"acknowledged\":true}");

        client.putPersistentClusterSettings(Map.of("action.auto_create_index", "+.kibana*"));

        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("PUT");
        assertThat(request.uri().getPath()).isEqualTo("/_cluster/settings");
        assertThat(request.headers().firstValue("Content-Type")).hasValue("application/json");
        assertThat(request.bodyPublisher()).hasValueSatisfying(publisher ->
            assertThat(publisher.contentLength())
                .isEqualTo("{\"persistent\":{\"action.auto_create_index\":\"+.kibana*\"}}".length()));
    }

    @Test
    void testRejectedRequest() throws Exception {
        respondWith(400, "{\"error\":\"illegal_argument_exception\"}");

        assertThatThrownBy(() -> client.putIndexSettings("components", Map.of("index.number_of_shards", 2)))
            .isInstanceOf(BadDatastoreRequestException.class)
            .hasMessageContaining("[400] PUT /components/_settings")
            .hasMessageContaining("illegal_argument_exception");
    }

    @Test
    void testServerError() throws Exception {
        respondWith(503, "unavailable");

        assertThatThrownBy(() -> client.createIndex("components", Map.of()))
            .isInstanceOf(DatastoreAdminException.class)
            .isNotInstanceOf(BadDatastoreRequestException.class)
            .hasMessageContaining("[503]");
    }

    @Test
    void testConnectionFailuresAreRetried() throws Exception {
        // Given
        doThrow(new IOException("Connection refused"))
            .doReturn(response)
            .when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{}");

        // When
        client.deleteIndexTemplate("widgets");

        // Then
        verify(httpClient, times(2)).send(any(), any());
    }

    @Test
    void testGivesUpAfterMaxRetries() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.getFlatClusterSettings())
            .isInstanceOf(DatastoreAdminException.class)
            .hasMessageContaining("Failed to reach cluster 'main'")
            .hasMessageContaining("Connection refused");
        verify(httpClient, times(3)).send(any(), any());
    }

    @Test
    void testTimeoutIsNotRetried() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.getIndex("components"))
            .isInstanceOf(RequestExceededDeadlineException.class)
            .hasMessageContaining("5000ms");
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void testDeleteIndices() throws Exception {
        client.deleteIndices();
        verifyNoInteractions(httpClient);

        respondWith(200, "{\"acknowledged\":true}");
        client.deleteIndices("a", "b");

        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("DELETE");
        assertThat(request.uri().toString())
            .isEqualTo("http://localhost:9200/a,b?ignore_unavailable=true&allow_no_indices=true");
    }

    @Test
    void testBlankUrlIsRejected() {
        assertThatThrownBy(() -> new HttpDatastoreClient("main", " ", false, 0, 1_000L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private void respondWith(int status, String body) throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }
}
