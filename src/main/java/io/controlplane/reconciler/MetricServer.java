package io.controlplane.reconciler;

import java.util.Map;

/**
 * metrics-server for the resource metrics API.
 */
public class MetricServer extends AbstractManifestReconciler {

    public static final String NAME = "metric-server";
    static final String IMAGE = "gcr.io/k8s-staging-metrics-server/metrics-server:v0.3.7";

    public MetricServer(ManifestsSaver saver) {
        super(NAME, saver);
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of("image", IMAGE);
    }
}
