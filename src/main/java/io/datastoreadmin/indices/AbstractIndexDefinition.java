package io.datastoreadmin.indices;

import com.google.common.base.Suppliers;
import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.config.IndexDefinitionConfig;
import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.models.FieldMetadata;
import io.datastoreadmin.util.HashUtil;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.datastoreadmin.config.Constants.DEFAULT_ROUTE_WITH;
import static io.datastoreadmin.config.Constants.LIST_COUNTS_FIELD;
import static io.datastoreadmin.config.Constants.MAPPING_META;
import static io.datastoreadmin.config.Constants.MAPPING_META_NAMESPACE;
import static io.datastoreadmin.config.Constants.MAPPING_META_SOURCES;
import static io.datastoreadmin.config.Constants.SETTINGS_PREFIX;

/**
 * Behavior shared by {@link Index} and {@link RolloverIndexTemplate}: cluster resolution, routing
 * and the memoized lookups used at query time.
 *
 * Memoized values are computed at most once per instance; index definitions are rebuilt whenever
 * the schema changes, so they are never invalidated.
 */
@Getter
public abstract class AbstractIndexDefinition implements IndexDefinition {

    private final String name;
    private final String routeWith;
    private final List<Map<String, Object>> defaultSortClauses;
    private final Set<String> currentSources;
    private final Map<String, FieldMetadata> fieldsByPath;
    private final IndexDefinitionConfig envIndexConfig;
    private final Set<String> definedClusters;
    private final Map<String, DatastoreClient> datastoreClientsByName;

    @Getter(AccessLevel.NONE)
    private final Supplier<Map<String, Object>> flattenedEnvSettingOverrides;
    @Getter(AccessLevel.NONE)
    private final Supplier<List<String>> allAccessibleClusterNames;
    @Getter(AccessLevel.NONE)
    private final Supplier<List<String>> accessibleClusterNamesToIndexInto;
    @Getter(AccessLevel.NONE)
    private final Supplier<Boolean> searchesCouldHitIncompleteDocs;
    @Getter(AccessLevel.NONE)
    private final Supplier<List<RolloverIndex>> knownRelatedQueryRolloverIndices;
    @Getter(AccessLevel.NONE)
    private final Map<String, Set<String>> listCountsFieldPathsBySource = new ConcurrentHashMap<>();

    protected AbstractIndexDefinition(
            String name,
            String routeWith,
            List<Map<String, Object>> defaultSortClauses,
            Set<String> currentSources,
            Map<String, FieldMetadata> fieldsByPath,
            IndexDefinitionConfig envIndexConfig,
            Set<String> definedClusters,
            Map<String, DatastoreClient> datastoreClientsByName) {
        this.name = Objects.requireNonNull(name, "name");
        this.routeWith = routeWith;
        this.defaultSortClauses = defaultSortClauses == null ? List.of() : List.copyOf(defaultSortClauses);
        this.currentSources = currentSources == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(currentSources));
        this.fieldsByPath = fieldsByPath == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fieldsByPath));
        this.envIndexConfig = Objects.requireNonNull(envIndexConfig, "envIndexConfig");
        this.definedClusters = definedClusters == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(definedClusters));
        this.datastoreClientsByName = datastoreClientsByName == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(datastoreClientsByName));

        this.flattenedEnvSettingOverrides = Suppliers.memoize(() -> Collections.unmodifiableMap(
            HashUtil.flattenAndStringifyKeys(this.envIndexConfig.getSettingOverrides(), SETTINGS_PREFIX)));
        this.allAccessibleClusterNames = Suppliers.memoize(this::identifyAllAccessibleClusterNames);
        this.accessibleClusterNamesToIndexInto = Suppliers.memoize(() -> clustersToIndexInto().stream()
            .filter(this.definedClusters::contains)
            .collect(Collectors.toUnmodifiableList()));
        this.searchesCouldHitIncompleteDocs = Suppliers.memoize(this::identifyWhetherSearchesCouldHitIncompleteDocs);
        this.knownRelatedQueryRolloverIndices = Suppliers.memoize(this::identifyKnownRelatedQueryRolloverIndices);
    }

    @Override
    public Map<String, Object> flattenedEnvSettingOverrides() {
        return flattenedEnvSettingOverrides.get();
    }

    @Override
    public String routingValueForPreparedRecord(Map<String, Object> preparedRecord, String routeWithPath, String idPath) {
        if (!hasCustomRouting()) {
            return null;
        }

        if (routeWithPath == null) {
            throw new ConfigException("`" + this + "` uses custom routing, but `route_with_path` is misconfigured (was `null`)");
        }

        String configRoutingValue = routingString(HashUtil.fetchValueAtPath(preparedRecord, routeWithPath));
        if (!ignoredValuesForRouting().contains(configRoutingValue)) {
            return configRoutingValue;
        }

        return routingString(HashUtil.fetchValueAtPath(preparedRecord, idPath));
    }

    // A null value routes as the empty string.
    private static String routingString(Object value) {
        return value == null ? "" : value.toString();
    }

    @Override
    public boolean hasCustomRouting() {
        return !DEFAULT_ROUTE_WITH.equals(routeWith);
    }

    @Override
    public String clusterToQuery() {
        return envIndexConfig.getQueryCluster();
    }

    @Override
    public List<String> clustersToIndexInto() {
        List<String> clusters = envIndexConfig.getIndexIntoClusters();
        if (clusters == null) {
            throw new ConfigException("No `index_into_clusters` defined for " + this + " in env index config");
        }
        return clusters;
    }

    @Override
    public boolean useUpdatesForIndexing() {
        return envIndexConfig.isUseUpdatesForIndexing();
    }

    @Override
    public Set<String> ignoredValuesForRouting() {
        return envIndexConfig.getIgnoreRoutingValues();
    }

    @Override
    public List<String> allAccessibleClusterNames() {
        return allAccessibleClusterNames.get();
    }

    @Override
    public List<String> accessibleClusterNamesToIndexInto() {
        return accessibleClusterNamesToIndexInto.get();
    }

    @Override
    public boolean isAccessibleFromQueries() {
        String cluster = clusterToQuery();
        return cluster != null && definedClusters.contains(cluster);
    }

    @Override
    public boolean searchesCouldHitIncompleteDocs() {
        return searchesCouldHitIncompleteDocs.get();
    }

    @Override
    public List<RolloverIndex> knownRelatedQueryRolloverIndices() {
        return knownRelatedQueryRolloverIndices.get();
    }

    @Override
    public Set<String> listCountsFieldPathsForSource(String source) {
        return listCountsFieldPathsBySource.computeIfAbsent(source, this::identifyListCountsFieldPathsForSource);
    }

    protected DatastoreClient datastoreClientFor(String clusterName) {
        DatastoreClient client = datastoreClientsByName.get(clusterName);
        if (client == null) {
            throw new ConfigException("No datastore client available for cluster `" + clusterName + "` (needed by "
                + this + "). Available: " + datastoreClientsByName.keySet());
        }
        return client;
    }

    private List<String> identifyAllAccessibleClusterNames() {
        Set<String> names = new LinkedHashSet<>(clustersToIndexInto());
        if (clusterToQuery() != null) {
            names.add(clusterToQuery());
        }
        return names.stream().filter(definedClusters::contains).collect(Collectors.toUnmodifiableList());
    }

    // An index with a single current source may still hold incomplete documents written while it had more
    // sources, so the sources recorded in the mapping metadata are taken into account too.
    private boolean identifyWhetherSearchesCouldHitIncompleteDocs() {
        if (currentSources.size() > 1) {
            return true;
        }

        Map<String, Object> mappings = mappingsInDatastore(datastoreClientFor(clusterToQuery()));
        Object recordedSources = HashUtil.dig(mappings, MAPPING_META, MAPPING_META_NAMESPACE, MAPPING_META_SOURCES);

        Set<String> sources = new LinkedHashSet<>(currentSources);
        if (recordedSources instanceof List) {
            ((List<?>) recordedSources).forEach(source -> sources.add(String.valueOf(source)));
        }
        return sources.size() > 1;
    }

    // Only indices that exist are wanted here: referencing a missing index in a search expression, even
    // to exclude it, makes the datastore fail the search.
    private List<RolloverIndex> identifyKnownRelatedQueryRolloverIndices() {
        String cluster = clusterToQuery();
        if (cluster == null) {
            return List.of();
        }
        return List.copyOf(relatedRolloverIndices(datastoreClientFor(cluster), true));
    }

    private Set<String> identifyListCountsFieldPathsForSource(String source) {
        Set<String> paths = new LinkedHashSet<>();
        fieldsByPath.forEach((path, field) -> {
            if (Objects.equals(field.getSource(), source) && List.of(path.split("\\.")).contains(LIST_COUNTS_FIELD)) {
                paths.add(path);
            }
        });
        return Collections.unmodifiableSet(paths);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbstractIndexDefinition that = (AbstractIndexDefinition) o;
        return name.equals(that.name)
            && Objects.equals(routeWith, that.routeWith)
            && defaultSortClauses.equals(that.defaultSortClauses)
            && currentSources.equals(that.currentSources)
            && fieldsByPath.equals(that.fieldsByPath)
            && envIndexConfig.equals(that.envIndexConfig)
            && definedClusters.equals(that.definedClusters)
            && datastoreClientsByName.equals(that.datastoreClientsByName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), name, routeWith, envIndexConfig);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
