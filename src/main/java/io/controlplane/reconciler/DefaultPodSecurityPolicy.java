package io.controlplane.reconciler;

import io.controlplane.config.ClusterConfig;

import java.util.Map;

/**
 * The privileged and restricted pod security policies, and the cluster-wide binding to the configured default.
 */
public class DefaultPodSecurityPolicy extends AbstractManifestReconciler {

    public static final String NAME = "default-psp";

    private final ClusterConfig config;

    public DefaultPodSecurityPolicy(ClusterConfig config, ManifestsSaver saver) {
        super(NAME, saver);
        this.config = config;
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of("defaultPolicy", config.getSpec().getPodSecurityPolicy().getDefaultPolicy());
    }
}
