package io.datastoreadmin;

import io.datastoreadmin.config.DatastoreAdminConfig;
import io.datastoreadmin.metrics.MetricsProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Main Spring Boot application class for datastore administration.
 *
 * Runs a single admin command (see {@link AdminCommandRunner}) against the configured datastore
 * clusters and exits.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.datastoreadmin")
public class DatastoreAdminApplication {

    public static void main(String[] args) {
        log.info("Starting Datastore Admin Application");

        try {
            SpringApplication.run(DatastoreAdminApplication.class, args);
            log.info("Datastore Admin finished successfully");
        } catch (Exception e) {
            log.error("Datastore Admin failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public DatastoreAdminConfig config() {
        DatastoreAdminConfig config = new DatastoreAdminConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DatastoreAdmin datastoreAdmin(DatastoreAdminConfig config, Clock clock, MetricsProvider metricsProvider) {
        log.info("Initializing DatastoreAdmin for clusters {}", config.getDatastore().getClusters().keySet());
        return new DatastoreAdmin(config, clock, metricsProvider);
    }

    @Bean
    public AdminCommandRunner adminCommandRunner(DatastoreAdmin datastoreAdmin) {
        return new AdminCommandRunner(datastoreAdmin, System.out);
    }
}
