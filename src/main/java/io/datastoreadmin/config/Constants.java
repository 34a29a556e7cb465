package io.datastoreadmin.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Rollover index naming. Two underscores avoid collisions with other index names
    // (e.g. payments_2020 and payments_xyz_2020).
    public static final String ROLLOVER_INDEX_INFIX_MARKER = "_rollover__";

    // Default field used for routing when an index does not use custom routing
    public static final String DEFAULT_ROUTE_WITH = "id";
    public static final String DEFAULT_ID_PATH = "id";

    // Hidden field holding the element counts of list fields
    public static final String LIST_COUNTS_FIELD = "__counts";

    // Mapping metadata used to record every source that has ever flowed into an index
    public static final String MAPPING_META = "_meta";
    public static final String MAPPING_META_NAMESPACE = "ElasticGraph";
    public static final String MAPPING_META_SOURCES = "sources";

    // Index config payload keys
    public static final String KEY_MAPPINGS = "mappings";
    public static final String KEY_SETTINGS = "settings";
    public static final String KEY_PROPERTIES = "properties";
    public static final String KEY_TEMPLATE = "template";
    public static final String KEY_INDEX_PATTERNS = "index_patterns";
    public static final String SETTINGS_PREFIX = "index";

    // Cluster settings
    public static final String AUTO_CREATE_INDEX_SETTING = "action.auto_create_index";
    public static final String ALWAYS_AUTO_CREATABLE_INDEX_PATTERN = ".kibana*";
    public static final String ALL_CLUSTERS = "all_clusters";

    // Config file locations
    public static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    public static final String EXTERNAL_CONFIG_ENV_VAR = "DATASTORE_ADMIN_CONFIG_FILE";
    public static final String DATASTORE_CONFIG_ARTIFACT = "datastore_config.yaml";
    public static final String RUNTIME_METADATA_ARTIFACT = "runtime_metadata.yaml";
    public static final String DEFAULT_SCHEMA_ARTIFACTS_DIRECTORY = "config/schema/artifacts";

    // Datastore client defaults
    public static final int DEFAULT_MAX_CLIENT_RETRIES = 3;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;

    // Admin commands
    public static final String COMMAND_CONFIGURE_CLUSTER = "configure_cluster";
    public static final String COMMAND_DRY_RUN_CONFIGURE_CLUSTER = "dry_run_configure_cluster";
    public static final String COMMAND_START_INDEX_MAINTENANCE_MODE = "start_index_maintenance_mode";
    public static final String COMMAND_END_INDEX_MAINTENANCE_MODE = "end_index_maintenance_mode";
    public static final String COMMAND_DROP_PROTOTYPE_INDICES = "drop_prototype_indices";
    public static final String COMMAND_DROP_INDEX = "drop_index";
    // Command line argument standing for every cluster
    public static final String ALL_CLUSTERS_ARGUMENT = "all";
}
