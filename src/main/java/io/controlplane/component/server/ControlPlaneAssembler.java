package io.controlplane.component.server;

import io.controlplane.applier.ManifestApplier;
import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.ComponentManager;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.ConfigurationException;
import io.controlplane.config.NodeDirectories;
import io.controlplane.controlapi.ControlApi;
import io.controlplane.join.JoinClient;
import io.controlplane.join.JoinException;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.telemetry.TelemetryReporter;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides between founding and joining a cluster and registers the control-plane
 * components in their start order.
 */
@Slf4j
public class ControlPlaneAssembler {

    /**
     * Builds a join client from a token. Replaced in tests.
     */
    @FunctionalInterface
    public interface JoinClientFactory {
        JoinClient fromToken(String token) throws JoinException;
    }

    private final NodeDirectories dirs;
    private final CertificateManager certManager;
    private final KubeClientFactory kubeClientFactory;
    private final MetricsProvider metrics;
    private final String machineId;
    private final JoinClientFactory joinClientFactory;

    public ControlPlaneAssembler(NodeDirectories dirs, CertificateManager certManager,
                                 KubeClientFactory kubeClientFactory, MetricsProvider metrics, String machineId) {
        this(dirs, certManager, kubeClientFactory, metrics, machineId, JoinClient::fromToken);
    }

    public ControlPlaneAssembler(NodeDirectories dirs, CertificateManager certManager,
                                 KubeClientFactory kubeClientFactory, MetricsProvider metrics, String machineId,
                                 JoinClientFactory joinClientFactory) {
        this.dirs = dirs;
        this.certManager = certManager;
        this.kubeClientFactory = kubeClientFactory;
        this.metrics = metrics;
        this.machineId = machineId;
        this.joinClientFactory = joinClientFactory;
    }

    /**
     * Register every control-plane component.
     *
     * @param token join token, null or empty for a founding controller
     * @throws ConfigurationException if the storage type is not recognized; nothing is registered
     * @throws JoinException          if the join token cannot be parsed; nothing is registered
     */
    public ControlPlane assemble(ClusterConfig config, String token) throws ConfigurationException, JoinException {
        // Step 1: Resolve the storage type before anything is registered
        StorageBackendSelector.resolveType(config.getSpec().getStorage().getType());

        // Step 2: Join or found
        boolean join = token != null && !token.isEmpty();
        JoinClient joinClient = null;
        ComponentManager manager = new ComponentManager();

        if (join) {
            joinClient = joinClientFactory.fromToken(token);
            manager.addSync(new CertificateAuthoritySyncer(joinClient, certManager));
        }
        manager.addSync(new Certificates(config, dirs, certManager));

        log.info("Public address: {}", config.getSpec().getApi().getAddress());
        log.info("SANs: {}", config.getSpec().getApi().getSans());
        log.info("DNS address: {}", config.getSpec().getNetwork().dnsAddress());

        // Step 3: Storage backend
        StorageBackend storage = new StorageBackendSelector(dirs).select(config, join, certManager, joinClient);
        manager.add(storage);

        // Step 4: The rest of the control plane
        manager.add(new ApiServer(config, dirs, certManager, storage));
        manager.add(new Konnectivity(dirs, certManager));
        manager.add(new Scheduler(dirs, certManager));
        manager.add(new ControllerManager(config, dirs, certManager));
        manager.add(new ManifestApplier(dirs, kubeClientFactory, metrics));
        manager.add(new ControlApi(dirs, certManager, storage, kubeClientFactory));

        if (config.getTelemetry().isEnabled()) {
            manager.add(new TelemetryReporter(config, dirs, kubeClientFactory, metrics, machineId));
        } else {
            log.info("Telemetry disabled");
        }

        log.info("Registered {} component(s), join={}", manager.getComponents().size(), join);
        return new ControlPlane(join, joinClient, manager, storage);
    }
}
