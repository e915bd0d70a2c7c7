package io.controlplane.reconciler;

import io.controlplane.config.ClusterConfig;

import java.util.Map;

import static io.controlplane.config.Constants.DEFAULT_CLUSTER_DOMAIN;
import static io.controlplane.config.Constants.DEFAULT_WORKER_PROFILE;
import static io.controlplane.config.Constants.KUBELET_CONFIG_MAP_PREFIX;

/**
 * Per-profile kubelet configuration published as ConfigMaps, read back by workers at join time.
 */
public class KubeletConfig extends AbstractManifestReconciler {

    public static final String NAME = "kubelet-config";

    private final ClusterConfig config;

    public KubeletConfig(ClusterConfig config, ManifestsSaver saver) {
        super(NAME, saver);
        this.config = config;
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of(
            "configMapName", KUBELET_CONFIG_MAP_PREFIX + DEFAULT_WORKER_PROFILE,
            "clusterDNS", config.getSpec().getNetwork().dnsAddress(),
            "clusterDomain", DEFAULT_CLUSTER_DOMAIN);
    }
}
