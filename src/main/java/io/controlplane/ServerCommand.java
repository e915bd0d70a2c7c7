package io.controlplane;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.ComponentException;
import io.controlplane.component.ComponentManager;
import io.controlplane.component.server.ControlPlane;
import io.controlplane.component.server.ControlPlaneAssembler;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.ClusterConfigLoader;
import io.controlplane.config.ConfigurationException;
import io.controlplane.config.NodeDirectories;
import io.controlplane.join.JoinException;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.metrics.StartupTimer;
import io.controlplane.reconciler.ClusterReconcilers;
import io.controlplane.reconciler.ReconcilerConstructor;
import io.controlplane.reconciler.ReconcilerSet;
import io.controlplane.util.DirectoryUtils;
import io.controlplane.util.MachineId;
import io.controlplane.util.RetryException;
import io.controlplane.util.RetryPolicy;
import io.controlplane.worker.KernelSetup;
import io.controlplane.worker.KubeletBootstrapper;
import io.controlplane.worker.WorkerComponentFactory;
import io.controlplane.worker.WorkerEnabler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;

import static io.controlplane.config.Constants.APPLICATION_ID;
import static io.controlplane.config.Constants.CERT_ROOT_DIR_MODE;
import static io.controlplane.config.Constants.DATA_DIR_MODE;
import static io.controlplane.config.Constants.DEFAULT_CONFIG_FILE;
import static io.controlplane.config.Constants.DEFAULT_DATA_DIR;
import static io.controlplane.config.Constants.DEFAULT_WORKER_PROFILE;

/**
 * Runs a controller node until it receives a termination signal.
 * Exits 0 after a signal-driven shutdown and 1 on any startup failure.
 */
@Slf4j
@Command(name = "server", mixinStandardHelpOptions = true, description = "Run server")
public class ServerCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Option(names = {"-c", "--config"}, description = "config file", defaultValue = DEFAULT_CONFIG_FILE)
    String configFile;

    @Option(names = {"--enable-worker"}, description = "enable worker", defaultValue = "false")
    boolean enableWorker;

    @Option(names = {"--profile"}, description = "worker profile to use on the node",
            defaultValue = DEFAULT_WORKER_PROFILE)
    String profile;

    @Option(names = {"--data-dir"}, description = "data directory", defaultValue = DEFAULT_DATA_DIR)
    String dataDir;

    @Parameters(index = "0", arity = "0..1", description = "join token")
    String token;

    @Override
    public Integer call() {
        // Step 1: Configuration
        ClusterConfig config;
        try {
            config = new ClusterConfigLoader().load(Path.of(configFile));
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        NodeDirectories dirs = new NodeDirectories(Path.of(dataDir));
        try {
            DirectoryUtils.initDirectory(dirs.getDataDir(), DATA_DIR_MODE);
            DirectoryUtils.initDirectory(dirs.getCertRootDir(), CERT_ROOT_DIR_MODE);
        } catch (IOException e) {
            log.error("Failed to create data directories under {}: {}", dataDir, e.getMessage());
            return EXIT_FAILURE;
        }

        String machineId = machineId();
        MetricsProvider metrics = new MetricsProvider(new SimpleMeterRegistry(), machineId);
        StartupTimer timer = new StartupTimer(metrics);
        CertificateManager certManager = new CertificateManager(dirs.getCertRootDir());
        KubeClientFactory kubeClientFactory = new KubeClientFactory();

        // Step 2: Join or found, and register the control plane
        ControlPlane controlPlane;
        try {
            controlPlane = new ControlPlaneAssembler(dirs, certManager, kubeClientFactory, metrics, machineId)
                .assemble(config, token);
        } catch (ConfigurationException | JoinException e) {
            log.error("Failed to set up control plane: {}", e.getMessage());
            return EXIT_FAILURE;
        }
        ComponentManager manager = controlPlane.manager();

        ShutdownSequencer sequencer = new ShutdownSequencer();
        sequencer.installSignalHandler();

        return runUntilSignal(manager,
            ClusterReconcilers.constructors(config, dirs.getManifestsDir()),
            enableWorker ? workerEnabler(dirs, manager, certManager, kubeClientFactory) : null,
            sequencer,
            timer);
    }

    /**
     * Init and start the registered components, then run the reconcilers and the optional
     * worker until a shutdown is requested. Every path out of here tears the node down.
     *
     * @param workerEnabler null when the node runs as a controller only
     * @return {@link #EXIT_OK} after a signal, {@link #EXIT_FAILURE} if any step failed
     */
    int runUntilSignal(ComponentManager manager, LinkedHashMap<String, ReconcilerConstructor> reconcilerConstructors,
                       WorkerEnabler workerEnabler, ShutdownSequencer sequencer, StartupTimer timer) {
        ReconcilerSet reconcilers = null;
        try {
            // Step 3: Init
            timer.checkpoint("starting-component-init");
            try {
                manager.init();
            } catch (ComponentException e) {
                log.error("Failed to initialize components: {}", e.getMessage());
                return EXIT_FAILURE;
            }
            timer.checkpoint("finished-component-init");

            // Step 4: Start
            timer.checkpoint("starting-components");
            int exitCode = EXIT_OK;
            ComponentException startError = null;
            try {
                manager.start();
            } catch (ComponentException e) {
                startError = e;
            }
            timer.checkpoint("finished-starting-components");

            if (startError == null) {
                // Step 5: Reconcilers and optional worker
                timer.checkpoint("starting-reconcilers");
                reconcilers = ReconcilerSet.create(reconcilerConstructors);
                reconcilers.runAll();
                timer.checkpoint("started-reconcilers");

                if (workerEnabler != null) {
                    timer.checkpoint("starting-worker");
                    try {
                        workerEnabler.enable(profile);
                        timer.checkpoint("started-worker");
                    } catch (ComponentException | RetryException e) {
                        log.error("Failed to enable worker: {}", e.getMessage());
                        exitCode = EXIT_FAILURE;
                        sequencer.signal("worker failure");
                    }
                }
            } else {
                log.error("Failed to start components: {}", startError.getMessage());
                exitCode = EXIT_FAILURE;
                sequencer.signal("start failure");
            }
            timer.logSummary();

            // Step 6: Run until told to stop
            String reason;
            try {
                reason = sequencer.awaitSignal();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reason = "interrupted";
            }
            log.info("Shutting down: {}", reason);
            return exitCode;
        } finally {
            sequencer.shutdown(reconcilers, manager);
        }
    }

    private WorkerEnabler workerEnabler(NodeDirectories dirs, ComponentManager manager,
                                        CertificateManager certManager, KubeClientFactory kubeClientFactory) {
        return new WorkerEnabler(
            dirs,
            manager,
            new KubeletBootstrapper(dirs, kubeClientFactory, certManager),
            new KernelSetup(),
            new WorkerComponentFactory(dirs, kubeClientFactory),
            RetryPolicy.defaults());
    }

    private static String machineId() {
        try {
            return MachineId.protectedId(APPLICATION_ID);
        } catch (IOException e) {
            log.warn("Could not determine machine id: {}", e.getMessage());
            return "unknown";
        }
    }
}
