package io.datastoreadmin.configurator;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.errors.IndexOperationException;
import io.datastoreadmin.indices.IndexDefinition;
import io.datastoreadmin.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.datastoreadmin.config.Constants.ALL_CLUSTERS;
import static io.datastoreadmin.metrics.MetricsConstants.CONFIGURE_CLUSTER_DURATION_METRIC_NAME;

/**
 * Configures every accessible index definition on every cluster it resides in.
 *
 * All configurators are validated before anything is written; writes then happen with index
 * maintenance mode on for all clusters.
 */
@Slf4j
public class ClusterConfigurator {

    private final Map<String, DatastoreClient> datastoreClientsByName;
    private final List<IndexDefinition> indexDefinitions;
    private final Map<String, Map<String, Object>> indexConfigurationsByName;
    private final ClusterSettingsManager clusterSettingsManager;
    private final Clock clock;
    private final MetricsProvider metricsProvider;

    public ClusterConfigurator(
            Map<String, DatastoreClient> datastoreClientsByName,
            List<IndexDefinition> indexDefinitions,
            Map<String, Map<String, Object>> indexConfigurationsByName,
            ClusterSettingsManager clusterSettingsManager,
            Clock clock,
            MetricsProvider metricsProvider) {
        this.datastoreClientsByName = datastoreClientsByName;
        this.indexDefinitions = indexDefinitions;
        this.indexConfigurationsByName = indexConfigurationsByName;
        this.clusterSettingsManager = clusterSettingsManager;
        this.clock = clock;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Validates and then configures all accessible index definitions, reporting every write to {@code output}.
     *
     * @throws IndexOperationException listing every validation error, before any write happens
     */
    public void configureCluster(PrintStream output) {
        ActionReporter reporter = new ActionReporter(output);

        List<String> errors = indexDefinitionConfiguratorsFor(reporter).stream()
            .flatMap(configurator -> configurator.validate().stream())
            .collect(Collectors.toList());

        if (!errors.isEmpty()) {
            StringBuilder descriptions = new StringBuilder();
            for (int i = 0; i < errors.size(); i++) {
                if (i > 0) {
                    descriptions.append("\n").append("=".repeat(80)).append("\n\n");
                }
                descriptions.append(i + 1).append("): ").append(errors.get(i));
            }
            log.error("Validation of {} index definitions failed with {} error(s)", indexDefinitions.size(), errors.size());
            throw new IndexOperationException("Got " + errors.size() + " validation error(s):\n\n" + descriptions);
        }

        // Validation fetched the current state, so configure with fresh configurators.
        metricsProvider.timer(CONFIGURE_CLUSTER_DURATION_METRIC_NAME, Map.of()).record(() ->
            clusterSettingsManager.inIndexMaintenanceMode(ALL_CLUSTERS, () ->
                indexDefinitionConfiguratorsFor(reporter).forEach(IndexDefinitionConfigurator::configure)));

        log.info("Finished configuring {} index definitions", accessibleIndexDefinitions().size());
    }

    /**
     * Index definitions residing in at least one defined cluster.
     */
    public List<IndexDefinition> accessibleIndexDefinitions() {
        return indexDefinitions.stream()
            .filter(indexDefinition -> !indexDefinition.allAccessibleClusterNames().isEmpty())
            .collect(Collectors.toList());
    }

    private List<IndexDefinitionConfigurator> indexDefinitionConfiguratorsFor(ActionReporter reporter) {
        List<IndexDefinitionConfigurator> configurators = new ArrayList<>();
        for (IndexDefinition indexDefinition : accessibleIndexDefinitions()) {
            Map<String, Object> envAgnosticConfig = indexConfigurationsByName.get(indexDefinition.getName());
            if (envAgnosticConfig == null) {
                throw new ConfigException("Schema artifacts have no datastore configuration for index definition `"
                    + indexDefinition.getName() + "`");
            }

            for (String clusterName : indexDefinition.allAccessibleClusterNames()) {
                DatastoreClient client = datastoreClientsByName.get(clusterName);
                if (client == null) {
                    throw new ConfigException("No datastore client available for cluster `" + clusterName + "`");
                }
                configurators.add(IndexDefinitionConfigurator.forDefinition(
                    client, indexDefinition, envAgnosticConfig, reporter, clock, metricsProvider));
            }
        }
        return configurators;
    }
}
