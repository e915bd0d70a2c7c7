package io.controlplane.metrics;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.controlplane.metrics.MetricsConstants.PHASE_TAG;
import static io.controlplane.metrics.MetricsConstants.STARTUP_PHASE_TIMER;

/**
 * Records named checkpoints of the server start sequence. The time between two
 * consecutive checkpoints is recorded as the phase ending at the later one.
 */
@Slf4j
public class StartupTimer {

    private final MetricsProvider metrics;
    private final Clock clock;
    private final List<String> names = new ArrayList<>();
    private final List<Long> timestamps = new ArrayList<>();

    public StartupTimer(MetricsProvider metrics) {
        this(metrics, Clock.systemUTC());
    }

    StartupTimer(MetricsProvider metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
        checkpoint("start");
    }

    public synchronized void checkpoint(String name) {
        long now = clock.millis();
        if (!timestamps.isEmpty()) {
            long elapsed = now - timestamps.get(timestamps.size() - 1);
            metrics.timer(STARTUP_PHASE_TIMER, Map.of(PHASE_TAG, name)).record(Duration.ofMillis(elapsed));
        }
        names.add(name);
        timestamps.add(now);
    }

    /**
     * Phase durations keyed by the checkpoint that ended them.
     */
    public synchronized Map<String, Duration> phases() {
        Map<String, Duration> phases = new LinkedHashMap<>();
        for (int i = 1; i < names.size(); i++) {
            phases.put(names.get(i), Duration.ofMillis(timestamps.get(i) - timestamps.get(i - 1)));
        }
        return phases;
    }

    public synchronized void logSummary() {
        long total = timestamps.get(timestamps.size() - 1) - timestamps.get(0);
        log.info("Startup took {}ms", total);
        phases().forEach((phase, duration) -> log.info("  {}: {}ms", phase, duration.toMillis()));
    }
}
