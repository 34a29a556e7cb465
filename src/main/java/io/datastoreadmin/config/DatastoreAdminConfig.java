package io.datastoreadmin.config;

import io.datastoreadmin.errors.ConfigException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.datastoreadmin.config.Constants.DEFAULT_CONFIG_FILE_CLASSPATH;
import static io.datastoreadmin.config.Constants.DEFAULT_SCHEMA_ARTIFACTS_DIRECTORY;
import static io.datastoreadmin.config.Constants.EXTERNAL_CONFIG_ENV_VAR;

/**
 * Configuration for datastore administration.
 * Loads configuration from application.yml (or the file named by the
 * {@code DATASTORE_ADMIN_CONFIG_FILE} environment variable).
 */
@Slf4j
@Getter
public class DatastoreAdminConfig {

    private final String adminId;
    private final DatastoreConfig datastore;
    private final String schemaArtifactsDirectory;
    // Index definitions that may be dropped; dropping any other index is refused
    private final Set<String> prototypeIndexNames;

    public DatastoreAdminConfig() {
        this(loadYamlConfig());
    }

    public DatastoreAdminConfig(Map<String, Object> parsedYaml) {
        this.adminId = parseAdminId(parsedYaml);
        this.datastore = DatastoreConfig.fromParsedYaml(parsedYaml);
        this.schemaArtifactsDirectory = parseSchemaArtifactsDirectory(parsedYaml);
        this.prototypeIndexNames = parsePrototypeIndexNames(parsedYaml);

        log.info("Loaded datastore admin config - clusters: {}, index definitions: {}, schema artifacts: {}",
            datastore.getClusters().keySet(), datastore.getIndexDefinitions().keySet(), schemaArtifactsDirectory);
    }

    private static Map<String, Object> loadYamlConfig() {
        Yaml yaml = new Yaml();
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = DatastoreAdminConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
                return Map.of();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream is = inputStream) {
            Map<String, Object> config = yaml.load(is);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : Map.of();
        } catch (IOException e) {
            log.error("Error closing config file input stream: {}", e.getMessage());
            throw new ConfigException("Failed to read configuration from " + loadedFrom, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static String parseAdminId(Map<String, Object> config) {
        Object admin = config == null ? null : config.get("admin");
        if (admin instanceof Map && ((Map<String, Object>) admin).get("id") != null) {
            return ((Map<String, Object>) admin).get("id").toString();
        }
        return "datastore-admin";
    }

    @SuppressWarnings("unchecked")
    private static Set<String> parsePrototypeIndexNames(Map<String, Object> config) {
        Object admin = config == null ? null : config.get("admin");
        if (admin instanceof Map && ((Map<String, Object>) admin).get("prototype_index_names") instanceof List) {
            return Collections.unmodifiableSet(
                new LinkedHashSet<>((List<String>) ((Map<String, Object>) admin).get("prototype_index_names")));
        }
        return Set.of();
    }

    @SuppressWarnings("unchecked")
    private static String parseSchemaArtifactsDirectory(Map<String, Object> config) {
        Object artifacts = config == null ? null : config.get("schema_artifacts");
        if (artifacts instanceof Map && ((Map<String, Object>) artifacts).get("directory") != null) {
            return ((Map<String, Object>) artifacts).get("directory").toString();
        }
        return DEFAULT_SCHEMA_ARTIFACTS_DIRECTORY;
    }
}
