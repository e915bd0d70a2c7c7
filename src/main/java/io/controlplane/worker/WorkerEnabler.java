package io.controlplane.worker;

import io.controlplane.component.Component;
import io.controlplane.component.ComponentException;
import io.controlplane.component.ComponentManager;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.RetryException;
import io.controlplane.util.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;

/**
 * Turns a controller into a worker as well: bootstraps kubelet credentials against the
 * local API server, then brings up the container runtime and the kubelet.
 * <p>
 * The worker components are added to the manager for teardown only; their init and
 * run are driven here because the manager has already started.
 */
@Slf4j
public class WorkerEnabler {

    static final Duration BOOTSTRAP_TOKEN_TTL = Duration.ofMinutes(1);

    private final NodeDirectories dirs;
    private final ComponentManager manager;
    private final KubeletBootstrapper bootstrapper;
    private final KernelSetup kernelSetup;
    private final WorkerComponentFactory componentFactory;
    private final RetryPolicy retryPolicy;

    public WorkerEnabler(NodeDirectories dirs, ComponentManager manager, KubeletBootstrapper bootstrapper,
                         KernelSetup kernelSetup, WorkerComponentFactory componentFactory, RetryPolicy retryPolicy) {
        this.dirs = dirs;
        this.manager = manager;
        this.bootstrapper = bootstrapper;
        this.kernelSetup = kernelSetup;
        this.componentFactory = componentFactory;
        this.retryPolicy = retryPolicy;
    }

    public void enable(String profile) throws ComponentException, RetryException {
        log.info("Enabling worker with profile {}", profile);

        // Step 1: Bootstrap credentials unless the kubelet already registered
        if (!Files.exists(dirs.getKubeletAuthConfig())) {
            retryPolicy.run("wait for admin kubeconfig", () -> {
                if (!Files.exists(dirs.getAdminKubeconfig())) {
                    throw new IOException("admin kubeconfig " + dirs.getAdminKubeconfig() + " not present yet");
                }
            });
            String bootstrapConfig = retryPolicy.call("create kubelet bootstrap config",
                () -> bootstrapper.createBootstrapConfig("worker", BOOTSTRAP_TOKEN_TTL));
            try {
                bootstrapper.handleBootstrapConfig(bootstrapConfig);
            } catch (IOException e) {
                throw new ComponentException("failed to write kubelet bootstrap config: " + e.getMessage(), e);
            }
        } else {
            log.info("Kubelet already registered, skipping bootstrap");
        }

        // Step 2: Host setup
        kernelSetup.run();

        // Step 3: Worker components
        KubeletConfigClient configClient = componentFactory.kubeletConfigClient();
        Component runtime = componentFactory.containerRuntime();
        Component kubelet = componentFactory.kubelet(configClient, profile);

        manager.add(runtime);
        manager.add(kubelet);

        runtime.init();
        kubelet.init();
        runtime.run();
        kubelet.run();
        log.info("Worker enabled");
    }
}
