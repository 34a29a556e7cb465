package io.datastoreadmin;

import io.datastoreadmin.client.DatastoreClient;
import io.datastoreadmin.configurator.ClusterConfigurator;
import io.datastoreadmin.errors.IndexOperationException;
import io.datastoreadmin.indices.IndexDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static io.datastoreadmin.config.Constants.ALL_CLUSTERS;
import static io.datastoreadmin.config.Constants.ALL_CLUSTERS_ARGUMENT;
import static io.datastoreadmin.config.Constants.COMMAND_CONFIGURE_CLUSTER;
import static io.datastoreadmin.config.Constants.COMMAND_DROP_INDEX;
import static io.datastoreadmin.config.Constants.COMMAND_DROP_PROTOTYPE_INDICES;
import static io.datastoreadmin.config.Constants.COMMAND_DRY_RUN_CONFIGURE_CLUSTER;
import static io.datastoreadmin.config.Constants.COMMAND_END_INDEX_MAINTENANCE_MODE;
import static io.datastoreadmin.config.Constants.COMMAND_START_INDEX_MAINTENANCE_MODE;

/**
 * Runs the admin command named by the first command line argument.
 *
 * Failures propagate, so the application exits non-zero.
 */
@Slf4j
public class AdminCommandRunner implements CommandLineRunner {

    private static final String RED_COLOR_CODE = "31";
    private static final String GREEN_COLOR_CODE = "32";
    private static final String BANNER = "=".repeat(80);

    private final DatastoreAdmin admin;
    private final PrintStream output;

    public AdminCommandRunner(DatastoreAdmin admin, PrintStream output) {
        this.admin = admin;
        this.output = output;
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            output.println(usage());
            return;
        }

        String command = args[0];
        List<String> commandArgs = Arrays.asList(args).subList(1, args.length);
        log.info("Running admin command {} with arguments {}", command, commandArgs);

        switch (command) {
            case COMMAND_CONFIGURE_CLUSTER:
                configureCluster();
                break;
            case COMMAND_DRY_RUN_CONFIGURE_CLUSTER:
                dryRunConfigureCluster();
                break;
            case COMMAND_START_INDEX_MAINTENANCE_MODE:
                admin.clusterSettingsManager().startIndexMaintenanceMode(clusterSpecFrom(command, commandArgs));
                output.println("Disabled rollover index auto creation for " + describe(clusterSpecFrom(command, commandArgs)));
                break;
            case COMMAND_END_INDEX_MAINTENANCE_MODE:
                admin.clusterSettingsManager().endIndexMaintenanceMode(clusterSpecFrom(command, commandArgs));
                output.println("Re-enabled rollover index auto creation for " + describe(clusterSpecFrom(command, commandArgs)));
                break;
            case COMMAND_DROP_PROTOTYPE_INDICES:
                dropPrototypeIndices();
                break;
            case COMMAND_DROP_INDEX:
                if (commandArgs.size() != 2) {
                    throw new IllegalArgumentException("Usage: " + COMMAND_DROP_INDEX + " <index_def_name> <cluster_name>");
                }
                dropIndex(commandArgs.get(0), commandArgs.get(1));
                break;
            default:
                throw new IllegalArgumentException("Unknown admin command: `" + command + "`.\n" + usage());
        }
    }

    private void configureCluster() {
        printInColor(BANNER + "\nNOTE: Performing datastore cluster updates for real!\n" + BANNER, RED_COLOR_CODE);
        updateClustersFor(admin);
        output.println("Done.");
    }

    private void dryRunConfigureCluster() {
        printInColor(BANNER + "\nNOTE: In dry-run mode. The updates reported below will actually be no-ops.\n" + BANNER,
            GREEN_COLOR_CODE);
        updateClustersFor(admin.withDryRunDatastoreClients());
        printInColor(BANNER + "\nNOTE: This was dry-run mode. The updates reported above were actually no-ops.\n" + BANNER,
            GREEN_COLOR_CODE);
    }

    private void updateClustersFor(DatastoreAdmin datastoreAdmin) {
        ClusterConfigurator configurator = datastoreAdmin.clusterConfigurator();
        output.println("The following index definitions will be configured:\n" + configurator.accessibleIndexDefinitions()
            .stream().map(IndexDefinition::getName).collect(Collectors.joining("\n")));
        configurator.configureCluster(output);
    }

    /**
     * Drops every prototype index definition on each cluster it resides in. Rollover index auto
     * creation stays disabled afterwards, so dropped rollover indices do not get re-created.
     */
    private void dropPrototypeIndices() {
        Set<String> prototypeIndexNames = admin.getConfig().getPrototypeIndexNames();
        List<IndexDefinition> prototypeIndices = admin.getIndexDefinitionsByName().values().stream()
            .filter(index -> prototypeIndexNames.contains(index.getName()))
            .filter(index -> !index.allAccessibleClusterNames().isEmpty())
            .collect(Collectors.toList());

        output.println("Disabling rollover index auto creation for all clusters");
        admin.clusterSettingsManager().startIndexMaintenanceMode(ALL_CLUSTERS);
        output.println("Disabled rollover index auto creation for all clusters");

        output.println("Dropping the following prototype index definitions: "
            + prototypeIndices.stream().map(IndexDefinition::getName).collect(Collectors.joining(",")));
        for (IndexDefinition index : prototypeIndices) {
            for (String clusterName : index.allAccessibleClusterNames()) {
                log.info("Dropping prototype index definition {} on cluster {}", index.getName(), clusterName);
                index.deleteFromDatastore(admin.getDatastoreClientsByName().get(clusterName));
            }
        }

        output.println("Finished dropping all prototype index definitions");
    }

    private void dropIndex(String indexDefinitionName, String clusterName) {
        DatastoreClient datastoreClient = admin.getDatastoreClientsByName().get(clusterName);
        if (datastoreClient == null) {
            throw new IndexOperationException("Cluster named `" + clusterName + "` does not exist. Valid clusters: "
                + admin.getDatastoreClientsByName().keySet() + ".");
        }

        IndexDefinition index = admin.getIndexDefinitionsByName().get(indexDefinitionName);
        if (index == null) {
            throw new IndexOperationException("Index definition named `" + indexDefinitionName + "` does not exist. "
                + "Valid index definitions: " + admin.getIndexDefinitionsByName().keySet() + ".");
        }

        if (!admin.getConfig().getPrototypeIndexNames().contains(index.getName())) {
            throw new IndexOperationException("Unable to drop live index " + indexDefinitionName + ". Deleting a live "
                + "index is extremely dangerous. Please ensure this is indeed intended, add the index name to the "
                + "`prototype_index_names` list and retry.");
        }

        output.println("Disabling rollover index auto creation for this cluster");
        admin.clusterSettingsManager().inIndexMaintenanceMode(clusterName, () -> {
            output.println("Disabled rollover index auto creation for this cluster");
            output.println("Dropping index " + index);
            index.deleteFromDatastore(datastoreClient);
            output.println("Dropped index " + index);
        });
        output.println("Re-enabled rollover index auto creation for this cluster");
    }

    private static String clusterSpecFrom(String command, List<String> commandArgs) {
        if (commandArgs.size() != 1) {
            throw new IllegalArgumentException("Usage: " + command + " <cluster_name|" + ALL_CLUSTERS_ARGUMENT + ">");
        }
        String clusterName = commandArgs.get(0);
        return ALL_CLUSTERS_ARGUMENT.equals(clusterName) ? ALL_CLUSTERS : clusterName;
    }

    private static String describe(String clusterSpec) {
        return ALL_CLUSTERS.equals(clusterSpec) ? "all clusters" : "cluster " + clusterSpec;
    }

    private void printInColor(String message, String colorCode) {
        output.println("\033[" + colorCode + "m" + message + "\033[0m");
    }

    static String usage() {
        return String.join("\n",
            "Usage: datastore-admin <command> [args]",
            "  " + COMMAND_CONFIGURE_CLUSTER + "                                 Configures the datastore clusters",
            "  " + COMMAND_DRY_RUN_CONFIGURE_CLUSTER + "                         Dry-runs the configuration of the datastore clusters",
            "  " + COMMAND_START_INDEX_MAINTENANCE_MODE + " <cluster|all>        Disables rollover index auto creation",
            "  " + COMMAND_END_INDEX_MAINTENANCE_MODE + " <cluster|all>          Re-enables rollover index auto creation",
            "  " + COMMAND_DROP_PROTOTYPE_INDICES + "                            Drops all prototype index definitions on all clusters",
            "  " + COMMAND_DROP_INDEX + " <index_def_name> <cluster>             Drops a prototype index definition on a cluster");
    }
}
