package io.controlplane.kube;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds Kubernetes API clients from a kubeconfig file.
 */
public class KubeClientFactory {

    public KubernetesClient create(Path kubeconfig) throws IOException {
        if (!Files.exists(kubeconfig)) {
            throw new IOException("kubeconfig " + kubeconfig + " does not exist");
        }
        Config config = Config.fromKubeconfig(Files.readString(kubeconfig));
        return new KubernetesClientBuilder().withConfig(config).build();
    }
}
