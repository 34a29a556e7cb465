package io.datastoreadmin.indices;

import com.google.common.base.Suppliers;
import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.CustomTimestampRange;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.enums.RolloverFrequency;
import io.datastoreadmin.errors.SchemaException;
import io.datastoreadmin.models.FieldMetadata;
import io.datastoreadmin.util.HashUtil;
import io.datastoreadmin.util.TimeSet;
import io.datastoreadmin.util.TimeUtil;
import lombok.Getter;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static io.datastoreadmin.config.Constants.KEY_MAPPINGS;
import static io.datastoreadmin.config.Constants.KEY_TEMPLATE;
import static io.datastoreadmin.config.Constants.ROLLOVER_INDEX_INFIX_MARKER;

/**
 * An index template from which time-partitioned rollover indices are created. Records are written
 * to the concrete index covering their timestamp, named {@code {name}_rollover__{suffix}}.
 */
@Getter
public class RolloverIndexTemplate extends AbstractIndexDefinition {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final String timestampFieldPath;
    private final RolloverFrequency frequency;

    @Getter(lombok.AccessLevel.NONE)
    private final Supplier<List<RolloverIndex>> rolloverIndicesToPreCreate;

    public RolloverIndexTemplate(
            String name,
            String routeWith,
            List<Map<String, Object>> defaultSortClauses,
            Set<String> currentSources,
            Map<String, FieldMetadata> fieldsByPath,
            IndexDefinitionConfig envIndexConfig,
            Set<String> definedClusters,
            Map<String, DatastoreClient> datastoreClientsByName,
            String timestampFieldPath,
            String frequency) {
        super(name, routeWith, defaultSortClauses, currentSources, fieldsByPath,
            envIndexConfig, definedClusters, datastoreClientsByName);

        this.frequency = RolloverFrequency.fromString(frequency);
        if (timestampFieldPath == null || this.frequency == null) {
            throw new SchemaException("Rollover index config 'timestamp_field' or 'frequency' is invalid "
                + "(timestamp_field: " + timestampFieldPath + ", frequency: " + frequency + ").");
        }
        this.timestampFieldPath = timestampFieldPath;
        this.rolloverIndicesToPreCreate = Suppliers.memoize(this::identifyRolloverIndicesToPreCreate);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> mappingsInDatastore(DatastoreClient datastoreClient) {
        Object mappings = HashUtil.dig(datastoreClient.getIndexTemplate(getName()), KEY_TEMPLATE, KEY_MAPPINGS);
        return IndexConfigNormalizer.normalizeMappings(
            mappings instanceof Map ? (Map<String, Object>) mappings : new LinkedHashMap<>());
    }

    /**
     * Deletes the template and then every index created from it.
     */
    @Override
    public void deleteFromDatastore(DatastoreClient datastoreClient) {
        datastoreClient.deleteIndexTemplate(getName());
        datastoreClient.deleteIndices(indexExpressionForSearch());
    }

    @Override
    public boolean isRolloverIndexTemplate() {
        return true;
    }

    @Override
    public String indexExpressionForSearch() {
        return indexNameWithSuffix("*");
    }

    /**
     * Name of the concrete index covering the timestamp of the given record.
     *
     * @throws java.util.NoSuchElementException if the record lacks the timestamp field
     */
    @Override
    public String indexNameForWrites(Map<String, Object> record, String timestampFieldPath) {
        return indexNameWithSuffix(rolloverIndexSuffixForRecord(
            record, timestampFieldPath != null ? timestampFieldPath : this.timestampFieldPath));
    }

    /**
     * Returns the indices related to this template: the ones that exist in the datastore and the ones
     * implied by configuration ({@code setting_overrides_by_timestamp} and {@code custom_timestamp_ranges}).
     *
     * Existing indices whose time set cannot be determined (a different rollover frequency, or a custom
     * suffix no longer configured) are ignored. When an existing index is also configured, the configured
     * time set and setting overrides are used for it.
     *
     * @param onlyIfExists drop configured indices missing from the datastore. Needed for searches, which
     *                     fail when they reference a missing index even to exclude it.
     */
    @Override
    public List<RolloverIndex> relatedRolloverIndices(DatastoreClient datastoreClient, boolean onlyIfExists) {
        Map<String, RolloverIndex> configIndicesByName = new LinkedHashMap<>();
        for (RolloverIndex index : rolloverIndicesToPreCreate()) {
            configIndicesByName.put(index.getName(), index);
        }

        Map<String, RolloverIndex> relatedIndicesByName = new LinkedHashMap<>();
        for (String indexName : datastoreClient.listIndicesMatching(indexExpressionForSearch())) {
            RolloverIndex index = configIndicesByName.containsKey(indexName)
                ? configIndicesByName.get(indexName)
                : concreteRolloverIndexFor(indexName, Map.of(), null);
            if (index != null) {
                relatedIndicesByName.put(indexName, index);
            }
        }

        if (!onlyIfExists) {
            configIndicesByName.forEach(relatedIndicesByName::putIfAbsent);
        }

        return new ArrayList<>(relatedIndicesByName.values());
    }

    /**
     * The concrete index that a record with the given timestamp is written to, with the given
     * setting overrides layered over the environment ones. Returns null when the index's time set cannot
     * be determined.
     */
    public RolloverIndex relatedRolloverIndexForTimestamp(String timestamp, Map<String, Object> settingOverrides) {
        Map<String, Object> record = HashUtil.nestAtPath(timestampFieldPath, timestamp);
        return concreteRolloverIndexFor(indexNameForWrites(record), settingOverrides, null);
    }

    /**
     * Indices that must be created before the template, so they get their own settings rather than the
     * template's (e.g. fewer shards for small historical months). Entries for
     * {@code setting_overrides_by_timestamp} come first, then those for {@code custom_timestamp_ranges}.
     */
    public List<RolloverIndex> rolloverIndicesToPreCreate() {
        return rolloverIndicesToPreCreate.get();
    }

    /**
     * Infers the time set of a rollover index from its name suffix, or returns null when the suffix does not
     * match the current frequency (e.g. after a frequency change) or is not numeric (a custom range suffix).
     */
    public TimeSet inferTimeSetFromIndexName(String indexName) {
        int markerIndex = indexName.lastIndexOf(ROLLOVER_INDEX_INFIX_MARKER);
        String suffix = markerIndex < 0 ? indexName : indexName.substring(markerIndex + ROLLOVER_INDEX_INFIX_MARKER.length());
        String[] timeArgs = suffix.split("-");

        if (timeArgs.length != frequency.getTimeElementCount()) {
            return null;
        }
        for (String arg : timeArgs) {
            if (!DIGITS.matcher(arg).matches()) {
                return null;
            }
        }

        ZonedDateTime lowerBound;
        try {
            lowerBound = ZonedDateTime.of(
                Integer.parseInt(timeArgs[0]),
                timeArgs.length > 1 ? Integer.parseInt(timeArgs[1]) : 1,
                timeArgs.length > 2 ? Integer.parseInt(timeArgs[2]) : 1,
                timeArgs.length > 3 ? Integer.parseInt(timeArgs[3]) : 0,
                0, 0, 0, ZoneOffset.UTC);
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }

        ZonedDateTime upperBound = TimeUtil.advanceOneUnit(lowerBound, frequency.getTimeUnit());
        return TimeSet.ofRange(lowerBound.toInstant(), upperBound.toInstant());
    }

    private List<RolloverIndex> identifyRolloverIndicesToPreCreate() {
        IndexDefinitionConfig config = getEnvIndexConfig();
        List<RolloverIndex> indices = new ArrayList<>();

        config.getSettingOverridesByTimestamp().forEach((timestamp, settingOverrides) -> {
            RolloverIndex index = relatedRolloverIndexForTimestamp(timestamp, settingOverrides);
            if (index != null) {
                indices.add(index);
            }
        });

        for (CustomTimestampRange range : config.getCustomTimestampRanges()) {
            RolloverIndex index = concreteRolloverIndexFor(
                indexNameWithSuffix(range.getIndexNameSuffix()), range.getSettingOverrides(), range.getTimeSet());
            if (index != null) {
                indices.add(index);
            }
        }

        return List.copyOf(indices);
    }

    private String rolloverIndexSuffixForRecord(Map<String, Object> record, String timestampFieldPath) {
        Object value = HashUtil.fetchValueAtPath(record, timestampFieldPath);
        Instant timestamp = TimeUtil.parseIso8601(Objects.toString(value, null));

        CustomTimestampRange matchingCustomRange = getEnvIndexConfig().customTimestampRangeFor(timestamp);
        if (matchingCustomRange != null) {
            return matchingCustomRange.getIndexNameSuffix();
        }

        return frequency.getSuffixFormatter().format(timestamp.atZone(ZoneOffset.UTC));
    }

    private RolloverIndex concreteRolloverIndexFor(String indexName, Map<String, Object> settingOverrides, TimeSet timeSet) {
        TimeSet indexTimeSet = timeSet != null ? timeSet : inferTimeSetFromIndexName(indexName);
        if (indexTimeSet == null) {
            return null;
        }

        IndexDefinitionConfig envConfig = getEnvIndexConfig();
        Map<String, Object> mergedOverrides = new LinkedHashMap<>(envConfig.getSettingOverrides());
        if (settingOverrides != null) {
            mergedOverrides.putAll(settingOverrides);
        }

        Index index = new Index(
            indexName,
            getRouteWith(),
            getDefaultSortClauses(),
            getCurrentSources(),
            getFieldsByPath(),
            envConfig.withoutEnvOverrides().withSettingOverrides(mergedOverrides),
            getDefinedClusters(),
            getDatastoreClientsByName());

        return new RolloverIndex(index, indexTimeSet);
    }

    private String indexNameWithSuffix(String suffix) {
        return getName() + ROLLOVER_INDEX_INFIX_MARKER + suffix;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        RolloverIndexTemplate that = (RolloverIndexTemplate) o;
        return timestampFieldPath.equals(that.timestampFieldPath) && frequency == that.frequency;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), timestampFieldPath, frequency);
    }
}
