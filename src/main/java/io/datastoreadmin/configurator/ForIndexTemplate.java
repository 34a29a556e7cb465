package io.datastoreadmin.configurator;

import com.google.common.base.Suppliers;
import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.indices.IndexConfigNormalizer;
import io.datastoreadmin.indices.RolloverIndex;
import io.datastoreadmin.indices.RolloverIndexTemplate;
import io.datastoreadmin.metrics.MetricsProvider;
import io.datastoreadmin.util.HashDiffer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.datastoreadmin.config.Constants.KEY_INDEX_PATTERNS;
import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;
import static io.datastoreadmin.config.Constants.KEY_SETTINGS;
import static io.datastoreadmin.config.Constants.KEY_TEMPLATE;
import static io.datastoreadmin.metrics.MetricsConstants.ACTION_PUT_INDEX_TEMPLATE;

/**
 * Configures a rollover index template and its concrete rollover indices.
 *
 * The related indices (those in the datastore plus those that must be pre-created with their own
 * settings) are validated along with the template and configured before the template is written, so
 * the datastore never auto-creates one of them from the template with default settings. When there
 * are no related indices, the index for the current time is created.
 *
 * Unlike concrete indices, a template may change static settings; only indices created afterwards
 * are affected.
 */
@Slf4j
public class ForIndexTemplate extends AbstractIndexDefinitionConfigurator {

    private final RolloverIndexTemplate indexTemplate;
    private final Map<String, Object> envAgnosticConfigParent;
    private final Map<String, Object> envAgnosticIndexConfig;
    private final Clock clock;

    private final Supplier<Map<String, Object>> currentConfigParent;
    private final Supplier<Map<String, Object>> desiredConfigParent;
    private final Supplier<List<ForIndex>> relatedIndexConfigurators;

    public ForIndexTemplate(DatastoreClient datastoreClient, RolloverIndexTemplate indexTemplate,
                            Map<String, Object> envAgnosticConfigParent, ActionReporter reporter, Clock clock,
                            MetricsProvider metricsProvider) {
        super(datastoreClient, reporter, metricsProvider);
        this.indexTemplate = indexTemplate;
        this.envAgnosticConfigParent = envAgnosticConfigParent;
        this.envAgnosticIndexConfig = section(envAgnosticConfigParent, KEY_TEMPLATE);
        this.clock = clock;

        this.currentConfigParent = Suppliers.memoize(this::fetchCurrentConfigParent);
        this.desiredConfigParent = Suppliers.memoize(this::buildDesiredConfigParent);
        this.relatedIndexConfigurators = Suppliers.memoize(this::buildRelatedIndexConfigurators);
    }

    public RolloverIndexTemplate getIndexTemplate() {
        return indexTemplate;
    }

    @Override
    public void configure() {
        relatedIndexConfigurators.get().forEach(ForIndex::configure);

        if (hasMappingUpdates() || !settingsUpdates(currentSettings(), desiredSettings()).isEmpty()) {
            putIndexTemplate();
        } else if (!mappingRemovals(currentMapping(), desiredMapping()).isEmpty()) {
            reporter.reportAction(withRemovalNote("Index template `" + indexTemplate.getName()
                + "` is up to date, but omits existing fields.", mappingRemovals(currentMapping(), desiredMapping())));
        }
    }

    /**
     * Validates the template and every related index, so nothing is written when any of them cannot be updated.
     */
    @Override
    public List<String> validate() {
        List<String> errors = relatedIndexConfigurators.get().stream()
            .flatMap(configurator -> configurator.validate().stream())
            .collect(Collectors.toCollection(ArrayList::new));

        if (!indexTemplateExists()) {
            return errors;
        }

        List<String> typeChanges = mappingTypeChanges(currentMapping(), desiredMapping());
        if (!typeChanges.isEmpty()) {
            errors.add(cannotModifyMappingFieldTypeError(indexTemplate.getName(), typeChanges));
        }

        return errors;
    }

    private void putIndexTemplate() {
        Map<String, Object> payload = new LinkedHashMap<>(desiredConfigParent.get());
        Map<String, Object> template = new LinkedHashMap<>(section(payload, KEY_TEMPLATE));
        template.put(KEY_MAPPINGS, mergeProperties(desiredMapping(), currentMapping()));
        payload.put(KEY_TEMPLATE, template);

        String description = withRemovalNote("Updated index template: `" + indexTemplate.getName() + "`:\n"
                + Objects.requireNonNullElse(HashDiffer.diff(currentConfigParent.get(), desiredConfigParent.get()), "(no diff)"),
            mappingRemovals(currentMapping(), desiredMapping()));

        log.info("Putting index template {} on cluster {}", indexTemplate.getName(), datastoreClient.getClusterName());
        datastoreClient.putIndexTemplate(indexTemplate.getName(), payload);
        countWriteAction(ACTION_PUT_INDEX_TEMPLATE);
        reporter.reportAction(description);
    }

    private List<ForIndex> buildRelatedIndexConfigurators() {
        List<RolloverIndex> rolloverIndices = indexTemplate.relatedRolloverIndices(datastoreClient, false);

        if (rolloverIndices.isEmpty()) {
            String now = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
            RolloverIndex currentIndex = indexTemplate.relatedRolloverIndexForTimestamp(now, Map.of());
            rolloverIndices = currentIndex == null ? List.of() : List.of(currentIndex);
        }

        log.debug("Related indices of template {}: {}", indexTemplate.getName(), rolloverIndices);
        return rolloverIndices.stream()
            .map(index -> new ForIndex(datastoreClient, index, envAgnosticIndexConfig, reporter, metricsProvider))
            .collect(Collectors.toList());
    }

    private Map<String, Object> fetchCurrentConfigParent() {
        Map<String, Object> config = new LinkedHashMap<>(datastoreClient.getIndexTemplate(indexTemplate.getName()));
        Object template = config.get(KEY_TEMPLATE);
        if (template instanceof Map) {
            config.put(KEY_TEMPLATE, IndexConfigNormalizer.normalize(section(config, KEY_TEMPLATE)));
        }
        return config;
    }

    private Map<String, Object> buildDesiredConfigParent() {
        Map<String, Object> parent = new LinkedHashMap<>(envAgnosticConfigParent);
        parent.putIfAbsent(KEY_INDEX_PATTERNS, List.of(indexTemplate.indexExpressionForSearch()));
        parent.put(KEY_TEMPLATE, desiredIndexConfig(indexTemplate, envAgnosticIndexConfig, currentMapping()));
        return parent;
    }

    private boolean indexTemplateExists() {
        return !currentConfigParent.get().isEmpty();
    }

    private boolean hasMappingUpdates() {
        return !currentMapping().equals(mergeProperties(desiredMapping(), currentMapping()));
    }

    private Map<String, Object> currentMapping() {
        return section(section(currentConfigParent.get(), KEY_TEMPLATE), KEY_MAPPINGS);
    }

    private Map<String, Object> currentSettings() {
        return section(section(currentConfigParent.get(), KEY_TEMPLATE), KEY_SETTINGS);
    }

    private Map<String, Object> desiredMapping() {
        return section(section(desiredConfigParent.get(), KEY_TEMPLATE), KEY_MAPPINGS);
    }

    private Map<String, Object> desiredSettings() {
        return section(section(desiredConfigParent.get(), KEY_TEMPLATE), KEY_SETTINGS);
    }
}
