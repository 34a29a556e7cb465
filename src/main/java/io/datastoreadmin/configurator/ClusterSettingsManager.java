package io.datastoreadmin.configurator;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.ClusterDefinition;
import io.datastoreadmin.errors.ClusterOperationException;
import io.datastoreadmin.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.datastoreadmin.config.Constants.ALL_CLUSTERS;
import static io.datastoreadmin.config.Constants.ALWAYS_AUTO_CREATABLE_INDEX_PATTERN;
import static io.datastoreadmin.config.Constants.AUTO_CREATE_INDEX_SETTING;
import static io.datastoreadmin.config.Constants.ROLLOVER_INDEX_INFIX_MARKER;
import static io.datastoreadmin.metrics.MetricsConstants.CLUSTER_TAG;
import static io.datastoreadmin.metrics.MetricsConstants.INDEX_MAINTENANCE_MODE_METRIC_NAME;

/**
 * Toggles index maintenance mode on datastore clusters. In maintenance mode the datastore may not
 * auto-create rollover indices from their templates, so none gets created with stale settings while
 * indices are being reconfigured.
 *
 * Maintenance mode is stored as a persistent cluster setting, so it holds across admin processes.
 * Two processes toggling it at the same time are not guarded against.
 */
@Slf4j
public class ClusterSettingsManager {

    private final Map<String, DatastoreClient> datastoreClientsByName;
    private final Map<String, ClusterDefinition> clusterDefinitionsByName;
    private final MetricsProvider metricsProvider;

    public ClusterSettingsManager(Map<String, DatastoreClient> datastoreClientsByName,
                                  Map<String, ClusterDefinition> clusterDefinitionsByName,
                                  MetricsProvider metricsProvider) {
        this.datastoreClientsByName = datastoreClientsByName;
        this.clusterDefinitionsByName = clusterDefinitionsByName;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Disables auto-creation of rollover indices on the named cluster, or on every cluster for {@code all_clusters}.
     */
    public void startIndexMaintenanceMode(String clusterSpec) {
        for (String clusterName : clusterNamesFor(clusterSpec)) {
            log.info("Starting index maintenance mode on cluster {}", clusterName);
            datastoreClientNamed(clusterName).putPersistentClusterSettings(desiredClusterSettings(clusterName, List.of()));
            metricsProvider.gauge(INDEX_MAINTENANCE_MODE_METRIC_NAME, Map.of(CLUSTER_TAG, clusterName)).set(1);
        }
    }

    /**
     * Re-enables auto-creation of rollover indices on the named cluster, or on every cluster for {@code all_clusters}.
     */
    public void endIndexMaintenanceMode(String clusterSpec) {
        for (String clusterName : clusterNamesFor(clusterSpec)) {
            log.info("Ending index maintenance mode on cluster {}", clusterName);
            datastoreClientNamed(clusterName).putPersistentClusterSettings(
                desiredClusterSettings(clusterName, List.of("*" + ROLLOVER_INDEX_INFIX_MARKER + "*")));
            metricsProvider.gauge(INDEX_MAINTENANCE_MODE_METRIC_NAME, Map.of(CLUSTER_TAG, clusterName)).set(0);
        }
    }

    /**
     * Runs the action in index maintenance mode. If the action fails, maintenance mode is left on:
     * resuming auto-creation after a failed reconfiguration could create indices with the wrong settings.
     * A retry is idempotent.
     */
    public void inIndexMaintenanceMode(String clusterSpec, Runnable action) {
        startIndexMaintenanceMode(clusterSpec);

        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Not able to exit index maintenance mode on {} due to exception: {}. "
                + "A bit of manual cleanup may be required (although a re-try should be idempotent).", clusterSpec, e.toString());
            throw e;
        }

        endIndexMaintenanceMode(clusterSpec);
    }

    private Map<String, Object> desiredClusterSettings(String clusterName, List<String> autoCreateIndexPatterns) {
        List<String> patterns = new ArrayList<>();
        patterns.add("+" + ALWAYS_AUTO_CREATABLE_INDEX_PATTERN);
        autoCreateIndexPatterns.forEach(pattern -> patterns.add("+" + pattern));

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(AUTO_CREATE_INDEX_SETTING, String.join(",", patterns));

        ClusterDefinition clusterDefinition = clusterDefinitionsByName.get(clusterName);
        if (clusterDefinition != null && clusterDefinition.getSettings() != null) {
            settings.putAll(clusterDefinition.getSettings());
        }
        return settings;
    }

    private DatastoreClient datastoreClientNamed(String clusterName) {
        DatastoreClient client = datastoreClientsByName.get(clusterName);
        if (client == null) {
            throw new ClusterOperationException("Unknown datastore cluster name: `" + clusterName
                + "`. Valid cluster names: " + datastoreClientsByName.keySet());
        }
        return client;
    }

    private List<String> clusterNamesFor(String clusterSpec) {
        if (ALL_CLUSTERS.equals(clusterSpec)) {
            return new ArrayList<>(datastoreClientsByName.keySet());
        }
        datastoreClientNamed(clusterSpec);
        return List.of(clusterSpec);
    }
}
