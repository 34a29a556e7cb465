package io.datastoreadmin.client;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Decorator implementing dry-run behavior: read operations go to the wrapped client
 * while write operations are logged and skipped.
 */
@Slf4j
public class DryRunDatastoreClient implements DatastoreClient {

    private final DatastoreClient wrappedClient;

    public DryRunDatastoreClient(DatastoreClient wrappedClient) {
        this.wrappedClient = wrappedClient;
    }

    @Override
    public String getClusterName() {
        return wrappedClient.getClusterName();
    }

    @Override
    public boolean isDryRun() {
        return true;
    }

    @Override
    public Map<String, Object> getFlatClusterSettings() {
        return wrappedClient.getFlatClusterSettings();
    }

    @Override
    public void putPersistentClusterSettings(Map<String, Object> settings) {
        skip("put persistent cluster settings", settings.keySet());
    }

    @Override
    public Map<String, Object> getIndexTemplate(String name) {
        return wrappedClient.getIndexTemplate(name);
    }

    @Override
    public void putIndexTemplate(String name, Map<String, Object> body) {
        skip("put index template", name);
    }

    @Override
    public void deleteIndexTemplate(String name) {
        skip("delete index template", name);
    }

    @Override
    public Map<String, Object> getIndex(String name) {
        return wrappedClient.getIndex(name);
    }

    @Override
    public List<String> listIndicesMatching(String expression) {
        return wrappedClient.listIndicesMatching(expression);
    }

    @Override
    public void createIndex(String index, Map<String, Object> body) {
        skip("create index", index);
    }

    @Override
    public void putIndexMapping(String index, Map<String, Object> body) {
        skip("put index mapping", index);
    }

    @Override
    public void putIndexSettings(String index, Map<String, Object> body) {
        skip("put index settings", index);
    }

    @Override
    public void deleteIndices(String... names) {
        skip("delete indices", Arrays.toString(names));
    }

    private void skip(String operation, Object target) {
        log.info("Dry run: skipping {} on cluster '{}': {}", operation, getClusterName(), target);
    }
}
