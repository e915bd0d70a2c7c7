package io.controlplane.worker;

import io.controlplane.component.Component;
import io.controlplane.component.worker.ContainerRuntime;
import io.controlplane.component.worker.Kubelet;
import io.controlplane.config.NodeDirectories;
import io.controlplane.kube.KubeClientFactory;

import java.nio.file.Files;

/**
 * Creates the worker's components.
 */
public class WorkerComponentFactory {

    private final NodeDirectories dirs;
    private final KubeClientFactory clientFactory;
    private ContainerRuntime runtime;

    public WorkerComponentFactory(NodeDirectories dirs, KubeClientFactory clientFactory) {
        this.dirs = dirs;
        this.clientFactory = clientFactory;
    }

    /**
     * Config client authenticated as the node if it already registered, otherwise with the bootstrap token.
     */
    public KubeletConfigClient kubeletConfigClient() {
        if (Files.exists(dirs.getKubeletAuthConfig())) {
            return new KubeletConfigClient(clientFactory, dirs.getKubeletAuthConfig());
        }
        return new KubeletConfigClient(clientFactory, dirs.getKubeletBootstrapConfig());
    }

    public Component containerRuntime() {
        runtime = new ContainerRuntime(dirs);
        return runtime;
    }

    public Component kubelet(KubeletConfigClient configClient, String profile) {
        ContainerRuntime target = runtime != null ? runtime : new ContainerRuntime(dirs);
        return new Kubelet(dirs, configClient, profile, target.socketPath());
    }
}
