package io.controlplane.telemetry;

import com.google.common.util.concurrent.AtomicDouble;
import io.controlplane.component.Component;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.metrics.MetricsProvider;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.controlplane.config.Constants.TELEMETRY_INTERVAL_SECONDS;
import static io.controlplane.config.Constants.VERSION;
import static io.controlplane.metrics.MetricsConstants.TELEMETRY_NODE_COUNT;
import static io.controlplane.metrics.MetricsConstants.TELEMETRY_UPTIME_SECONDS;

/**
 * Periodic anonymous usage report: machine id, version, storage type and node count.
 */
@Slf4j
public class TelemetryReporter implements Component {

    private final ClusterConfig config;
    private final NodeDirectories dirs;
    private final KubeClientFactory clientFactory;
    private final MetricsProvider metrics;
    private final String machineId;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private Instant startedAt;
    private AtomicDouble nodeCount;
    private AtomicDouble uptime;

    public TelemetryReporter(ClusterConfig config, NodeDirectories dirs, KubeClientFactory clientFactory,
                             MetricsProvider metrics, String machineId) {
        this(config, dirs, clientFactory, metrics, machineId, Clock.systemUTC());
    }

    TelemetryReporter(ClusterConfig config, NodeDirectories dirs, KubeClientFactory clientFactory,
                      MetricsProvider metrics, String machineId, Clock clock) {
        this.config = config;
        this.dirs = dirs;
        this.clientFactory = clientFactory;
        this.metrics = metrics;
        this.machineId = machineId;
        this.clock = clock;
    }

    @Override
    public void init() {
        nodeCount = metrics.gauge(TELEMETRY_NODE_COUNT, Map.of());
        uptime = metrics.gauge(TELEMETRY_UPTIME_SECONDS, Map.of());
    }

    @Override
    public void run() {
        startedAt = clock.instant();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleWithFixedDelay(this::report, TELEMETRY_INTERVAL_SECONDS, TELEMETRY_INTERVAL_SECONDS,
            TimeUnit.SECONDS);
    }

    @Override
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    void report() {
        try {
            int nodes = countNodes();
            nodeCount.set(nodes);
            uptime.set(Duration.between(startedAt, clock.instant()).toSeconds());
            log.info("Telemetry: machineId={} version={} storage={} nodes={}",
                machineId, VERSION, config.getSpec().getStorage().getType(), nodes);
        } catch (Exception e) {
            log.error("Error collecting telemetry: {}", e.getMessage(), e);
        }
    }

    private int countNodes() throws IOException {
        if (!Files.exists(dirs.getAdminKubeconfig())) {
            return 0;
        }
        try (KubernetesClient client = clientFactory.create(dirs.getAdminKubeconfig())) {
            return client.nodes().list().getItems().size();
        }
    }
}
