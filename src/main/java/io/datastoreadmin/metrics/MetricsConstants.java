package io.datastoreadmin.metrics;

/**
 * Constants for metrics names and tags used by datastore administration.
 */
public class MetricsConstants {
    public final static String WRITE_ACTIONS_METRIC_NAME = "datastore_admin_write_actions";
    public final static String INDEX_MAINTENANCE_MODE_METRIC_NAME = "datastore_admin_index_maintenance_mode";
    public final static String CONFIGURE_CLUSTER_DURATION_METRIC_NAME = "datastore_admin_configure_cluster_duration";
    public final static String CLUSTER_TAG = "cluster";
    public final static String ACTION_TAG = "action";
    public final static String DRY_RUN_TAG = "dry_run";

    public final static String ACTION_CREATE_INDEX = "create_index";
    public final static String ACTION_UPDATE_INDEX_SETTINGS = "update_index_settings";
    public final static String ACTION_UPDATE_INDEX_MAPPING = "update_index_mapping";
    public final static String ACTION_PUT_INDEX_TEMPLATE = "put_index_template";

    private MetricsConstants() {}
}
