package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.ConfigurationException;
import io.controlplane.config.NodeDirectories;
import io.controlplane.join.JoinClient;
import lombok.extern.slf4j.Slf4j;

import static io.controlplane.config.Constants.STORAGE_TYPE_ETCD;
import static io.controlplane.config.Constants.STORAGE_TYPE_KINE;

/**
 * Maps the configured storage type to a backend component.
 * An empty type means kine.
 */
@Slf4j
public class StorageBackendSelector {

    private final NodeDirectories dirs;

    public StorageBackendSelector(NodeDirectories dirs) {
        this.dirs = dirs;
    }

    public static StorageType resolveType(String type) throws ConfigurationException {
        if (type == null || type.isEmpty() || STORAGE_TYPE_KINE.equals(type)) {
            return StorageType.KINE;
        }
        if (STORAGE_TYPE_ETCD.equals(type)) {
            return StorageType.ETCD;
        }
        throw new ConfigurationException("Invalid storage type: " + type);
    }

    public StorageBackend select(ClusterConfig config, boolean join, CertificateManager certManager,
                                 JoinClient joinClient) throws ConfigurationException {
        ClusterConfig.StorageSpec storage = config.getSpec().getStorage();
        StorageType type = resolveType(storage.getType());
        log.info("Using storage backend {}", type.name().toLowerCase());
        return switch (type) {
            case KINE -> new KineStorage(storage.getKine(), dirs);
            case ETCD -> new EtcdStorage(storage.getEtcd(), join, certManager, joinClient, dirs);
        };
    }
}
