package io.datastoreadmin;

import com.google.common.base.Suppliers;
import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.client.DryRunDatastoreClient;
import io.datastoreadmin.client.HttpDatastoreClient;
import io.datastoreadmin.config.DatastoreAdminConfig;
import io.datastoreadmin.config.DatastoreConfig;
import io.datastoreadmin.config.SchemaArtifacts;
import io.datastoreadmin.configurator.ClusterConfigurator;
import io.datastoreadmin.configurator.ClusterSettingsManager;
import io.datastoreadmin.indices.IndexDefinition;
import io.datastoreadmin.indices.IndexDefinitionFactory;
import io.datastoreadmin.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point to datastore administration: wires the datastore clients, index definitions and
 * configurators from the admin config and the schema artifacts.
 *
 * Schema artifacts are loaded on first use, so cluster-level commands work without them.
 */
@Slf4j
public class DatastoreAdmin {

    private final DatastoreAdminConfig config;
    private final Map<String, DatastoreClient> datastoreClientsByName;
    private final Supplier<SchemaArtifacts> schemaArtifacts;
    private final Clock clock;
    private final MetricsProvider metricsProvider;
    private final Supplier<Map<String, IndexDefinition>> indexDefinitionsByName;

    public DatastoreAdmin(DatastoreAdminConfig config, Clock clock, MetricsProvider metricsProvider) {
        this(config, buildDatastoreClients(config.getDatastore()),
            () -> SchemaArtifacts.fromDirectory(config.getSchemaArtifactsDirectory()), clock, metricsProvider);
    }

    public DatastoreAdmin(DatastoreAdminConfig config, Map<String, DatastoreClient> datastoreClientsByName,
                          Supplier<SchemaArtifacts> schemaArtifacts, Clock clock, MetricsProvider metricsProvider) {
        this.config = config;
        this.datastoreClientsByName = Collections.unmodifiableMap(new LinkedHashMap<>(datastoreClientsByName));
        this.schemaArtifacts = Suppliers.memoize(schemaArtifacts::get);
        this.clock = clock;
        this.metricsProvider = metricsProvider;
        this.indexDefinitionsByName = Suppliers.memoize(() ->
            new IndexDefinitionFactory(config.getDatastore(), this.datastoreClientsByName)
                .createAll(this.schemaArtifacts.get().getRuntimeMetadata()));
    }

    public DatastoreAdminConfig getConfig() {
        return config;
    }

    public Map<String, DatastoreClient> getDatastoreClientsByName() {
        return datastoreClientsByName;
    }

    public Map<String, IndexDefinition> getIndexDefinitionsByName() {
        return indexDefinitionsByName.get();
    }

    public ClusterSettingsManager clusterSettingsManager() {
        return new ClusterSettingsManager(datastoreClientsByName, config.getDatastore().getClusters(), metricsProvider);
    }

    public ClusterConfigurator clusterConfigurator() {
        return new ClusterConfigurator(
            datastoreClientsByName,
            new ArrayList<>(getIndexDefinitionsByName().values()),
            schemaArtifacts.get().getDatastoreConfig().configurationsByName(),
            clusterSettingsManager(),
            clock,
            metricsProvider);
    }

    /**
     * A copy of this admin whose datastore clients skip every write.
     */
    public DatastoreAdmin withDryRunDatastoreClients() {
        Map<String, DatastoreClient> dryRunClients = new LinkedHashMap<>();
        datastoreClientsByName.forEach((name, client) -> dryRunClients.put(name, new DryRunDatastoreClient(client)));
        return new DatastoreAdmin(config, dryRunClients, schemaArtifacts, clock, metricsProvider);
    }

    private static Map<String, DatastoreClient> buildDatastoreClients(DatastoreConfig datastoreConfig) {
        Map<String, DatastoreClient> clients = new LinkedHashMap<>();
        datastoreConfig.getClusters().forEach((name, cluster) -> {
            log.info("Creating {} datastore client for cluster {} at {}", cluster.getBackend(), name, cluster.getUrl());
            clients.put(name, new HttpDatastoreClient(name, cluster.getUrl(), datastoreConfig.isLogTraffic(),
                datastoreConfig.getMaxClientRetries(), datastoreConfig.getRequestTimeoutMs()));
        });
        return clients;
    }
}
