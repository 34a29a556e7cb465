package io.datastoreadmin.configurator;

import com.google.common.base.Suppliers;
import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.errors.BadDatastoreRequestException;
import io.datastoreadmin.errors.IndexOperationException;
import io.datastoreadmin.indices.IndexConfigNormalizer;
import io.datastoreadmin.indices.IndexDefinition;
import io.datastoreadmin.metrics.MetricsProvider;
import io.datastoreadmin.util.HashDiffer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;
import static io.datastoreadmin.config.Constants.KEY_SETTINGS;
import static io.datastoreadmin.metrics.MetricsConstants.ACTION_CREATE_INDEX;
import static io.datastoreadmin.metrics.MetricsConstants.ACTION_UPDATE_INDEX_MAPPING;
import static io.datastoreadmin.metrics.MetricsConstants.ACTION_UPDATE_INDEX_SETTINGS;

/**
 * Configures a single concrete index: creates it when missing, otherwise updates its settings and
 * then its mappings.
 *
 * Static settings cannot change once an index exists, so such changes fail validation.
 */
@Slf4j
public class ForIndex extends AbstractIndexDefinitionConfigurator {

    static final Set<String> STATIC_SETTINGS = Set.of(
        "index.number_of_shards",
        "index.number_of_routing_shards",
        "index.codec",
        "index.routing_partition_size",
        "index.soft_deletes.enabled",
        "index.shard.check_on_startup",
        "index.load_fixed_bitset_filters_eagerly"
    );

    static final List<String> STATIC_SETTING_PREFIXES = List.of("index.sort.", "index.analysis.");

    private final IndexDefinition index;
    private final Map<String, Object> envAgnosticIndexConfig;

    // Fetched once per configurator, so a fresh configurator is needed after configure()
    private final Supplier<Map<String, Object>> currentConfig;
    private final Supplier<Map<String, Object>> desiredConfig;

    public ForIndex(DatastoreClient datastoreClient, IndexDefinition index, Map<String, Object> envAgnosticIndexConfig,
                    ActionReporter reporter, MetricsProvider metricsProvider) {
        super(datastoreClient, reporter, metricsProvider);
        this.index = index;
        this.envAgnosticIndexConfig = envAgnosticIndexConfig;
        this.currentConfig = Suppliers.memoize(() -> IndexConfigNormalizer.normalize(datastoreClient.getIndex(index.getName())));
        this.desiredConfig = Suppliers.memoize(() -> desiredIndexConfig(index, envAgnosticIndexConfig, currentMapping()));
    }

    public IndexDefinition getIndex() {
        return index;
    }

    @Override
    public void configure() {
        if (!indexExists()) {
            createNewIndex();
            return;
        }

        Map<String, Object> settingsUpdates = settingsUpdates();
        if (!settingsUpdates.isEmpty()) {
            updateSettings(settingsUpdates);
        }

        if (hasMappingUpdates()) {
            updateMapping();
        } else if (!mappingRemovals().isEmpty()) {
            reporter.reportAction(withRemovalNote(
                "Mappings for index `" + index.getName() + "` are up to date, but omit existing fields.", mappingRemovals()));
        }
    }

    @Override
    public List<String> validate() {
        if (!indexExists()) {
            return List.of();
        }

        List<String> errors = new ArrayList<>();

        List<String> typeChanges = mappingTypeChanges(currentMapping(), desiredMapping());
        if (!typeChanges.isEmpty()) {
            errors.add(cannotModifyMappingFieldTypeError(index.getName(), typeChanges));
        }

        List<String> staticSettingChanges = settingsUpdates().keySet().stream()
            .filter(ForIndex::isStaticSetting)
            .collect(Collectors.toList());
        if (!staticSettingChanges.isEmpty()) {
            errors.add("The datastore does not support modifying static settings of an existing index. "
                + "You are attempting to update static settings (" + describeChanges(staticSettingChanges)
                + ") of the " + index.getName() + " index.");
        }

        return errors;
    }

    static boolean isStaticSetting(String name) {
        return STATIC_SETTINGS.contains(name) || STATIC_SETTING_PREFIXES.stream().anyMatch(name::startsWith);
    }

    private void createNewIndex() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(KEY_MAPPINGS, desiredMapping());
        body.put(KEY_SETTINGS, desiredSettings());

        log.info("Creating index {} on cluster {}", index.getName(), datastoreClient.getClusterName());
        datastoreClient.createIndex(index.getName(), body);
        countWriteAction(ACTION_CREATE_INDEX);
        reporter.reportAction("Created index: `" + index.getName() + "`");
    }

    private void updateSettings(Map<String, Object> settingsUpdates) {
        log.info("Updating settings {} of index {} on cluster {}",
            settingsUpdates.keySet(), index.getName(), datastoreClient.getClusterName());
        try {
            datastoreClient.putIndexSettings(index.getName(), settingsUpdates);
        } catch (BadDatastoreRequestException e) {
            log.error("Datastore rejected settings update of index {}: {}", index.getName(), e.getMessage());
            throw new IndexOperationException("Failed to update settings of index `" + index.getName() + "`: "
                + e.getMessage(), e);
        }
        countWriteAction(ACTION_UPDATE_INDEX_SETTINGS);
        reporter.reportAction("Updated settings for index `" + index.getName() + "`:\n"
            + Objects.requireNonNullElse(HashDiffer.diff(currentSettings(), desiredSettings()), "(no diff)"));
    }

    private void updateMapping() {
        Map<String, Object> mapping = mergedDesiredMapping();
        log.debug("Mapping diff for index {}: {}", index.getName(), HashDiffer.diff(currentMapping(), mapping));

        datastoreClient.putIndexMapping(index.getName(), mapping);
        countWriteAction(ACTION_UPDATE_INDEX_MAPPING);
        reporter.reportAction(withRemovalNote("Updated mappings for index `" + index.getName() + "`:\n"
            + Objects.requireNonNullElse(HashDiffer.diff(currentMapping(), desiredMapping()), "(no diff)"), mappingRemovals()));
    }

    private boolean indexExists() {
        return !currentConfig.get().isEmpty();
    }

    private boolean hasMappingUpdates() {
        return !currentMapping().equals(mergedDesiredMapping());
    }

    private Map<String, Object> mergedDesiredMapping() {
        return mergeProperties(desiredMapping(), currentMapping());
    }

    private List<String> mappingRemovals() {
        return mappingRemovals(currentMapping(), desiredMapping());
    }

    private Map<String, Object> settingsUpdates() {
        return settingsUpdates(currentSettings(), desiredSettings());
    }

    private Map<String, Object> currentMapping() {
        return section(currentConfig.get(), KEY_MAPPINGS);
    }

    private Map<String, Object> currentSettings() {
        return section(currentConfig.get(), KEY_SETTINGS);
    }

    private Map<String, Object> desiredMapping() {
        return section(desiredConfig.get(), KEY_MAPPINGS);
    }

    private Map<String, Object> desiredSettings() {
        return section(desiredConfig.get(), KEY_SETTINGS);
    }

    private String describeChanges(List<String> settingNames) {
        Map<String, Object> current = currentSettings();
        Map<String, Object> desired = desiredSettings();
        return settingNames.stream()
            .map(name -> name + ": " + current.get(name) + " => " + desired.get(name))
            .collect(Collectors.joining(", "));
    }
}
