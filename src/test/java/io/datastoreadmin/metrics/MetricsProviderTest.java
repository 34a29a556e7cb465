package io.datastoreadmin.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.datastoreadmin.metrics.MetricsConstants.ACTION_CREATE_INDEX;
import static io.datastoreadmin.metrics.MetricsConstants.ACTION_TAG;
import static io.datastoreadmin.metrics.MetricsConstants.CLUSTER_TAG;
import static io.datastoreadmin.metrics.MetricsConstants.INDEX_MAINTENANCE_MODE_METRIC_NAME;
import static io.datastoreadmin.metrics.MetricsConstants.WRITE_ACTIONS_METRIC_NAME;
import static org.assertj.core.api.Assertions.assertThat;

class MetricsProviderTest {

    private static final String TEST_ADMIN_ID = "test-admin-01";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_ADMIN_ID);
    }

    @Test
    void testCounter_TaggedWithAdminId() {
        Counter counter = provider.counter(WRITE_ACTIONS_METRIC_NAME, Map.of(CLUSTER_TAG, "main", ACTION_TAG, ACTION_CREATE_INDEX));

        assertThat(counter.getId().getName()).isEqualTo(WRITE_ACTIONS_METRIC_NAME);
        assertThat(counter.getId().getTag("hostname")).isEqualTo(TEST_ADMIN_ID);
        assertThat(counter.getId().getTag(CLUSTER_TAG)).isEqualTo("main");

        counter.increment();
        provider.counter(WRITE_ACTIONS_METRIC_NAME, Map.of(CLUSTER_TAG, "main", ACTION_TAG, ACTION_CREATE_INDEX)).increment(2.0);
        assertThat(counter.count()).isEqualTo(3.0);
    }

    @Test
    void testGauge_SameValueForRepeatedCalls() {
        // Given
        AtomicDouble gaugeValue = provider.gauge(INDEX_MAINTENANCE_MODE_METRIC_NAME, Map.of(CLUSTER_TAG, "main"));

        // When
        provider.gauge(INDEX_MAINTENANCE_MODE_METRIC_NAME, Map.of(CLUSTER_TAG, "main")).set(1);

        // Then
        assertThat(gaugeValue.get()).isEqualTo(1.0);
        Gauge gauge = registry.find(INDEX_MAINTENANCE_MODE_METRIC_NAME).tag(CLUSTER_TAG, "main").gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(1.0);
        assertThat(gauge.getId().getTag("hostname")).isEqualTo(TEST_ADMIN_ID);

        assertThat(provider.gauge(INDEX_MAINTENANCE_MODE_METRIC_NAME, Map.of(CLUSTER_TAG, "other")).get()).isEqualTo(0.0);
    }

    @Test
    void testTimer_RecordsDurations() {
        Timer timer = provider.timer("test.timer", Map.of("operation", "configure"));

        timer.record(100, TimeUnit.MILLISECONDS);

        assertThat(timer.getId().getTag("hostname")).isEqualTo(TEST_ADMIN_ID);
        assertThat(timer.getId().getTag("operation")).isEqualTo("configure");
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100);
    }
}
