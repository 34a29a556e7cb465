package io.datastoreadmin.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.models.DatastoreConfigArtifact;
import io.datastoreadmin.models.RuntimeMetadata;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static io.datastoreadmin.config.Constants.DATASTORE_CONFIG_ARTIFACT;
import static io.datastoreadmin.config.Constants.RUNTIME_METADATA_ARTIFACT;

/**
 * Schema artifacts produced by the schema compiler: the environment-agnostic datastore
 * configuration and the runtime metadata of each index definition.
 */
@Slf4j
@Getter
@AllArgsConstructor
public class SchemaArtifacts {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final DatastoreConfigArtifact datastoreConfig;
    private final RuntimeMetadata runtimeMetadata;

    public static SchemaArtifacts fromDirectory(String directory) {
        Path dir = Path.of(directory);
        log.info("Loading schema artifacts from {}", dir.toAbsolutePath());

        DatastoreConfigArtifact datastoreConfig =
            OBJECT_MAPPER.convertValue(loadYaml(dir.resolve(DATASTORE_CONFIG_ARTIFACT)), DatastoreConfigArtifact.class);
        RuntimeMetadata runtimeMetadata =
            OBJECT_MAPPER.convertValue(loadYaml(dir.resolve(RUNTIME_METADATA_ARTIFACT)), RuntimeMetadata.class);

        log.info("Loaded schema artifacts - indices: {}, index templates: {}",
            datastoreConfig.getIndices().keySet(), datastoreConfig.getIndexTemplates().keySet());
        return new SchemaArtifacts(datastoreConfig, runtimeMetadata);
    }

    private static Map<String, Object> loadYaml(Path file) {
        if (!Files.exists(file)) {
            throw new ConfigException("Schema artifact not found: " + file.toAbsolutePath());
        }

        try (InputStream is = Files.newInputStream(file)) {
            Map<String, Object> parsed = new Yaml().load(is);
            return parsed != null ? parsed : Map.of();
        } catch (IOException e) {
            throw new ConfigException("Failed to read schema artifact " + file + ": " + e.getMessage(), e);
        }
    }
}
