package io.controlplane.reconciler;

import io.controlplane.config.ClusterConfig;

import java.util.Map;

import static io.controlplane.config.Constants.DEFAULT_CLUSTER_DOMAIN;

/**
 * CoreDNS deployment serving the cluster DNS address.
 */
public class CoreDns extends AbstractManifestReconciler {

    public static final String NAME = "coredns";
    static final String IMAGE = "docker.io/coredns/coredns:1.7.0";

    private final ClusterConfig config;

    public CoreDns(ClusterConfig config, ManifestsSaver saver) {
        super(NAME, saver);
        this.config = config;
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of(
            "clusterDNS", config.getSpec().getNetwork().dnsAddress(),
            "clusterDomain", DEFAULT_CLUSTER_DOMAIN,
            "image", IMAGE);
    }
}
