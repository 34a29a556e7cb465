package io.datastoreadmin.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider creates and caches the counters, gauges and timers reported by datastore administration.
 * Every meter is tagged with the id of the admin process.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String hostname;
    private final Map<String, AtomicDouble> gaugesByKey = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${admin.id:datastore-admin}") String adminId) {
        this.registry = registry;
        this.hostname = adminId;
        log.info("MetricsProvider initialized for the datastore admin: {}", hostname);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     * Micrometer keeps the first registered value object for a given name and tags,
     * so the same AtomicDouble is returned for repeated calls.
     *
     * @param name the name of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        return gaugesByKey.computeIfAbsent(name + new TreeMap<>(tags), key -> {
            AtomicDouble gaugeValue = new AtomicDouble(0);
            Gauge.builder(name, gaugeValue::get).tags(mapToTagArray(tags)).register(registry);
            return gaugeValue;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = HOST_NAME_TAG;
        tagArray[index] = hostname;
        return tagArray;
    }
}
