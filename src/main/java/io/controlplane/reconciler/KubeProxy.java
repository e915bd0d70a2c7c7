package io.controlplane.reconciler;

import io.controlplane.config.ClusterConfig;

import java.util.Map;

import static io.controlplane.config.Constants.API_SERVER_PORT;

/**
 * kube-proxy DaemonSet and its configuration.
 */
public class KubeProxy extends AbstractManifestReconciler {

    public static final String NAME = "kube-proxy";
    static final String IMAGE = "k8s.gcr.io/kube-proxy:v1.20.1";

    private final ClusterConfig config;

    public KubeProxy(ClusterConfig config, ManifestsSaver saver) {
        super(NAME, saver);
        this.config = config;
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of(
            "clusterCIDR", config.getSpec().getNetwork().getPodCIDR(),
            "controlPlaneEndpoint", "https://" + config.getSpec().getApi().getAddress() + ":" + API_SERVER_PORT,
            "image", IMAGE);
    }
}
