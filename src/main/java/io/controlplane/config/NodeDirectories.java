package io.controlplane.config;

import lombok.Getter;

import java.nio.file.Path;

import static io.controlplane.config.Constants.*;

/**
 * On-disk layout of a node, resolved against the data directory.
 */
@Getter
public class NodeDirectories {

    private final Path dataDir;
    private final Path certRootDir;
    private final Path binDir;
    private final Path runDir;
    private final Path manifestsDir;
    private final Path etcdDataDir;
    private final Path kineDataDir;
    private final Path kubeletRootDir;
    private final Path adminKubeconfig;
    private final Path kubeletAuthConfig;
    private final Path kubeletBootstrapConfig;

    public NodeDirectories(Path dataDir) {
        this.dataDir = dataDir;
        this.certRootDir = dataDir.resolve(DIR_PKI);
        this.binDir = dataDir.resolve(DIR_BIN);
        this.runDir = dataDir.resolve(DIR_RUN);
        this.manifestsDir = dataDir.resolve(DIR_MANIFESTS);
        this.etcdDataDir = dataDir.resolve(DIR_ETCD);
        this.kineDataDir = dataDir.resolve(DIR_KINE);
        this.kubeletRootDir = dataDir.resolve(DIR_KUBELET);
        this.adminKubeconfig = certRootDir.resolve(FILE_ADMIN_KUBECONFIG);
        this.kubeletAuthConfig = dataDir.resolve(FILE_KUBELET_AUTH_CONFIG);
        this.kubeletBootstrapConfig = dataDir.resolve(FILE_KUBELET_BOOTSTRAP_CONFIG);
    }

    public Path binary(String name) {
        return binDir.resolve(name);
    }

    public Path cert(String name) {
        return certRootDir.resolve(name);
    }
}
