package io.datastoreadmin.client;

import java.util.List;
import java.util.Map;

/**
 * Abstraction over the search datastore (Elasticsearch or OpenSearch) HTTP API.
 * Covers the index, index template and cluster settings operations needed to administer indices.
 *
 * Any call may throw {@link io.datastoreadmin.errors.BadDatastoreRequestException} when the
 * datastore rejects the request.
 */
public interface DatastoreClient {

    /**
     * Name of the cluster this client talks to.
     */
    String getClusterName();

    /**
     * Whether write operations are skipped rather than sent to the datastore.
     */
    default boolean isDryRun() {
        return false;
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    /**
     * Get cluster settings with flattened keys (persistent, transient and defaults sections)
     */
    Map<String, Object> getFlatClusterSettings();

    /**
     * Set persistent cluster settings
     */
    void putPersistentClusterSettings(Map<String, Object> settings);

    // =================================================================
    // INDEX TEMPLATE OPERATIONS
    // =================================================================

    /**
     * Get index template ({@code index_patterns} and {@code template}), or an empty map if absent
     */
    Map<String, Object> getIndexTemplate(String name);

    /**
     * Create or replace index template
     */
    void putIndexTemplate(String name, Map<String, Object> body);

    /**
     * Delete index template (no-op if absent)
     */
    void deleteIndexTemplate(String name);

    // =================================================================
    // INDEX OPERATIONS
    // =================================================================

    /**
     * Get index ({@code mappings} and flat {@code settings}), or an empty map if absent
     */
    Map<String, Object> getIndex(String name);

    /**
     * List the names of concrete indices matching a wildcard expression
     */
    List<String> listIndicesMatching(String expression);

    /**
     * Create index with mappings and settings
     */
    void createIndex(String index, Map<String, Object> body);

    /**
     * Update index mappings
     */
    void putIndexMapping(String index, Map<String, Object> body);

    /**
     * Update index settings. A null value restores the setting to its default.
     */
    void putIndexSettings(String index, Map<String, Object> body);

    /**
     * Delete indices (missing ones are ignored)
     */
    void deleteIndices(String... names);
}
