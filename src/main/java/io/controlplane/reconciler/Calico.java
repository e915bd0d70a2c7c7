package io.controlplane.reconciler;

import io.controlplane.config.ClusterConfig;

import java.util.Map;

/**
 * Calico CNI, managed only when calico is the configured network provider.
 */
public class Calico extends AbstractManifestReconciler {

    public static final String NAME = "calico";
    static final String VERSION = "v3.16.2";

    private final ClusterConfig config;

    public Calico(ClusterConfig config, ManifestsSaver saver) {
        super(NAME, saver);
        this.config = config;
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of(
            "podCIDR", config.getSpec().getNetwork().getPodCIDR(),
            "version", VERSION);
    }
}
