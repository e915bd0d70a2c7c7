package io.controlplane.worker;

import io.controlplane.kube.KubeClientFactory;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.io.IOException;
import java.nio.file.Path;

import static io.controlplane.config.Constants.KUBELET_CONFIG_MAP_PREFIX;
import static io.controlplane.config.Constants.KUBE_SYSTEM_NAMESPACE;

/**
 * Reads the published kubelet configuration of a worker profile.
 */
public class KubeletConfigClient {

    static final String KUBELET_CONFIG_KEY = "kubelet";

    private final KubeClientFactory clientFactory;
    private final Path kubeconfig;

    public KubeletConfigClient(KubeClientFactory clientFactory, Path kubeconfig) {
        this.clientFactory = clientFactory;
        this.kubeconfig = kubeconfig;
    }

    public String get(String profile) throws IOException {
        String name = KUBELET_CONFIG_MAP_PREFIX + profile;
        try (KubernetesClient client = clientFactory.create(kubeconfig)) {
            ConfigMap configMap = client.configMaps().inNamespace(KUBE_SYSTEM_NAMESPACE).withName(name).get();
            if (configMap == null || configMap.getData() == null
                    || !configMap.getData().containsKey(KUBELET_CONFIG_KEY)) {
                throw new IOException("kubelet config " + name + " not found");
            }
            return configMap.getData().get(KUBELET_CONFIG_KEY);
        } catch (KubernetesClientException e) {
            throw new IOException("failed to read kubelet config " + name + ": " + e.getMessage(), e);
        }
    }
}
