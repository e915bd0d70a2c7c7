package io.controlplane.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider creates the counters, gauges and timers of the supervisor,
 * every meter tagged with the node identity.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String NODE_TAG = "node";

    @Getter
    private final MeterRegistry registry;
    private final String nodeId;
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;
        log.info("MetricsProvider initialized for node: {}", nodeId);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric. The returned holder is the gauge value;
     * repeated calls with the same name and tags return the same holder.
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String key = name + tags;
        return gauges.computeIfAbsent(key, k -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
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
        tagArray[index++] = NODE_TAG;
        tagArray[index] = nodeId;
        return tagArray;
    }
}
