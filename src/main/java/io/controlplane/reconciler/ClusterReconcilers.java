package io.controlplane.reconciler;

import io.controlplane.config.ClusterConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;

import static io.controlplane.config.Constants.DEFAULT_NETWORK_PROVIDER;

/**
 * The cluster add-ons a controller manages, in start order.
 */
@Slf4j
public final class ClusterReconcilers {

    private ClusterReconcilers() {
        // Utility class
    }

    public static LinkedHashMap<String, ReconcilerConstructor> constructors(ClusterConfig config, Path manifestsDir) {
        LinkedHashMap<String, ReconcilerConstructor> constructors = new LinkedHashMap<>();
        constructors.put("default-psp",
            () -> new DefaultPodSecurityPolicy(config, new ManifestsSaver(manifestsDir, DefaultPodSecurityPolicy.NAME)));
        constructors.put("kube-proxy",
            () -> new KubeProxy(config, new ManifestsSaver(manifestsDir, KubeProxy.NAME)));
        constructors.put("coredns",
            () -> new CoreDns(config, new ManifestsSaver(manifestsDir, CoreDns.NAME)));

        if (DEFAULT_NETWORK_PROVIDER.equals(config.getSpec().getNetwork().getProvider())) {
            constructors.put("calico",
                () -> new Calico(config, new ManifestsSaver(manifestsDir, Calico.NAME)));
        } else {
            log.warn("network provider set to custom, k0s will not manage it");
        }

        constructors.put("metricServer",
            () -> new MetricServer(new ManifestsSaver(manifestsDir, MetricServer.NAME)));
        constructors.put("kubeletConfig",
            () -> new KubeletConfig(config, new ManifestsSaver(manifestsDir, KubeletConfig.NAME)));
        constructors.put("systemRBAC",
            () -> new SystemRbac(new ManifestsSaver(manifestsDir, SystemRbac.NAME)));
        return constructors;
    }
}
