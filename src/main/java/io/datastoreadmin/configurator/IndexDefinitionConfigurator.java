package io.datastoreadmin.configurator;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.indices.IndexDefinition;
import io.datastoreadmin.indices.RolloverIndexTemplate;
import io.datastoreadmin.metrics.MetricsProvider;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Reconciles the datastore configuration of one index definition with the desired configuration,
 * issuing only the writes needed to align them.
 *
 * Call {@link #validate()} first: {@link #configure()} assumes validation passed.
 */
public interface IndexDefinitionConfigurator {

    /**
     * Returns human-readable descriptions of changes that cannot be performed. Never writes.
     */
    List<String> validate();

    /**
     * Performs the writes. Fails on the first error.
     */
    void configure();

    /**
     * Creates the configurator suited to the given index definition.
     *
     * @param envAgnosticConfig the index config from the schema artifacts: {@code {mappings, settings}} for an
     *                          index, {@code {index_patterns, template: {mappings, settings}}} for a template
     */
    static IndexDefinitionConfigurator forDefinition(
            DatastoreClient datastoreClient,
            IndexDefinition indexDefinition,
            Map<String, Object> envAgnosticConfig,
            ActionReporter reporter,
            Clock clock,
            MetricsProvider metricsProvider) {
        if (indexDefinition.isRolloverIndexTemplate()) {
            return new ForIndexTemplate(datastoreClient, (RolloverIndexTemplate) indexDefinition,
                envAgnosticConfig, reporter, clock, metricsProvider);
        }
        return new ForIndex(datastoreClient, indexDefinition, envAgnosticConfig, reporter, metricsProvider);
    }
}
