package io.controlplane.applier;

import io.controlplane.component.Component;
import io.controlplane.component.ComponentException;
import io.controlplane.config.NodeDirectories;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.util.DirectoryUtils;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.controlplane.config.Constants.DATA_DIR_MODE;
import static io.controlplane.config.Constants.MANIFEST_APPLY_INTERVAL_SECONDS;
import static io.controlplane.metrics.MetricsConstants.MANIFESTS_APPLIED_COUNTER;
import static io.controlplane.metrics.MetricsConstants.MANIFEST_APPLY_FAILURES;
import static io.controlplane.metrics.MetricsConstants.STACK_TAG;

/**
 * Applies every manifest stack under the manifests directory to the cluster.
 * Each sub-directory is a stack; its *.yaml files are applied on every pass.
 */
@Slf4j
public class ManifestApplier implements Component {

    private final NodeDirectories dirs;
    private final KubeClientFactory clientFactory;
    private final MetricsProvider metrics;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private KubernetesClient client;

    public ManifestApplier(NodeDirectories dirs, KubeClientFactory clientFactory, MetricsProvider metrics) {
        this(dirs, clientFactory, metrics, MANIFEST_APPLY_INTERVAL_SECONDS);
    }

    ManifestApplier(NodeDirectories dirs, KubeClientFactory clientFactory, MetricsProvider metrics,
                    long intervalSeconds) {
        this.dirs = dirs;
        this.clientFactory = clientFactory;
        this.metrics = metrics;
        this.intervalSeconds = intervalSeconds;
    }

    @Override
    public void init() throws ComponentException {
        try {
            DirectoryUtils.initDirectory(dirs.getManifestsDir(), DATA_DIR_MODE);
        } catch (IOException e) {
            throw new ComponentException("failed to create manifests directory", e);
        }
    }

    @Override
    public void run() {
        log.info("Starting manifest applier on {}", dirs.getManifestsDir());
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleWithFixedDelay(this::applyLoop, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void stop() {
        log.info("Stopping manifest applier");
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (client != null) {
            client.close();
            client = null;
        }
    }

    private void applyLoop() {
        try {
            if (!Files.exists(dirs.getAdminKubeconfig())) {
                log.debug("Admin kubeconfig not present yet, skipping manifest apply");
                return;
            }
            if (client == null) {
                client = clientFactory.create(dirs.getAdminKubeconfig());
            }
            applyAll();
        } catch (Exception e) {
            log.error("Error in manifest apply loop: {}", e.getMessage(), e);
        }
    }

    /**
     * Apply every stack once.
     *
     * @return number of manifest files applied successfully
     */
    int applyAll() throws IOException {
        int applied = 0;
        for (Path stack : listDirectories(dirs.getManifestsDir())) {
            applied += applyStack(stack);
        }
        return applied;
    }

    int applyStack(Path stack) throws IOException {
        String stackName = stack.getFileName().toString();
        int applied = 0;
        for (Path manifest : listManifests(stack)) {
            try (InputStream in = Files.newInputStream(manifest)) {
                client.load(in).createOrReplace();
                applied++;
                metrics.counter(MANIFESTS_APPLIED_COUNTER, Map.of(STACK_TAG, stackName)).increment();
            } catch (KubernetesClientException e) {
                metrics.counter(MANIFEST_APPLY_FAILURES, Map.of(STACK_TAG, stackName)).increment();
                log.warn("Failed to apply {} in stack {}: {}", manifest.getFileName(), stackName, e.getMessage());
            }
        }
        log.debug("Applied {} manifest(s) of stack {}", applied, stackName);
        return applied;
    }

    void setClient(KubernetesClient client) {
        this.client = client;
    }

    private static List<Path> listDirectories(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        }
    }

    private static List<Path> listManifests(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(p -> p.getFileName().toString().endsWith(".yaml"))
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
